package ca.gc.cra.geolayer.application.join;

import ca.gc.cra.geolayer.domain.geo.JoinedRecord;
import java.util.List;
import java.util.Objects;

/**
 * Joined records of one run plus their match statistics.
 *
 * @param records joined records in input order; same size as the input
 * @param report match statistics
 * @since 0.1.0
 */
public record JoinResult(List<JoinedRecord> records, JoinReport report) {

  /**
   * Copies the record list.
   */
  public JoinResult {
    records = List.copyOf(Objects.requireNonNull(records, "records"));
    report = Objects.requireNonNull(report, "report");
  }
}
