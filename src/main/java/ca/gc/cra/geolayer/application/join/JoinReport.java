package ca.gc.cra.geolayer.application.join;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Match statistics for one join run.
 *
 * @param total records received
 * @param matched records paired with a boundary
 * @param unmatched records emitted with {@code null} geometry
 * @param matchesByStrategy match counts keyed by the strategy that produced the winning key
 * @param unmatchedSamples first few unmatched identifiers, for diagnostics
 * @since 0.1.0
 */
public record JoinReport(
    int total,
    int matched,
    int unmatched,
    Map<String, Integer> matchesByStrategy,
    List<String> unmatchedSamples) {

  /**
   * Validates counts and copies collections.
   */
  public JoinReport {
    if (matched + unmatched != total) {
      throw new IllegalArgumentException("matched + unmatched must equal total");
    }
    matchesByStrategy = Map.copyOf(Objects.requireNonNull(matchesByStrategy, "matchesByStrategy"));
    unmatchedSamples = List.copyOf(Objects.requireNonNull(unmatchedSamples, "unmatchedSamples"));
  }
}
