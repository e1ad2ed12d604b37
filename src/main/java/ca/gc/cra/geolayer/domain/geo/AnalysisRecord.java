package ca.gc.cra.geolayer.domain.geo;

import ca.gc.cra.geolayer.domain.util.Attributes;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable scored row produced by the analysis engine for one area.
 *
 * <p><strong>Why:</strong> Rows identify their area loosely (area_id, ID, ZIP fields, labels) and the join
 * engine must see every field the producer supplied.</p>
 * <p><strong>Thread-safety:</strong> Immutable and safe to share.</p>
 *
 * @param rawAreaId area identifier as supplied by the producer; may be {@code null}
 * @param score thematic score under {@code targetVariable}; {@code null} when the producer omitted it
 * @param targetVariable name of the scored variable; never blank
 * @param attributes every other producer field, including nested {@code properties}; never {@code null}
 * @since 0.1.0
 */
public record AnalysisRecord(
    String rawAreaId,
    Double score,
    String targetVariable,
    Map<String, Object> attributes) {

  /**
   * Normalizes identifiers and copies the attribute map.
   */
  public AnalysisRecord {
    Objects.requireNonNull(targetVariable, "targetVariable");
    if (targetVariable.isBlank()) {
      throw new IllegalArgumentException("targetVariable must not be blank");
    }
    rawAreaId = rawAreaId == null || rawAreaId.isBlank() ? null : rawAreaId.trim();
    if (score != null && !Double.isFinite(score)) {
      score = null;
    }
    attributes = Attributes.copyOf(attributes);
  }

  /**
   * Builds a record from a producer row, resolving the area id and score from the conventional keys.
   *
   * <p>The score is read from {@code targetVariable}, then {@code value}, then
   * {@code properties.<targetVariable>}.</p>
   *
   * @param row producer row; never {@code null}
   * @param targetVariable scored variable name
   * @return immutable record
   */
  public static AnalysisRecord fromRow(Map<String, ?> row, String targetVariable) {
    Objects.requireNonNull(row, "row");
    String areaId = Attributes.text(row.get("area_id")).orElse(null);
    OptionalDouble score = Attributes.number(row.get(targetVariable));
    if (score.isEmpty()) {
      score = Attributes.number(row.get("value"));
    }
    if (score.isEmpty()) {
      score = Attributes.number(Attributes.nested(row, targetVariable).orElse(null));
    }
    Double boxed = score.isPresent() ? score.getAsDouble() : null;
    return new AnalysisRecord(areaId, boxed, targetVariable, Attributes.copyOf(row));
  }

  /**
   * Returns the score as an optional value.
   *
   * @return score when present
   */
  public OptionalDouble scoreValue() {
    return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
  }

  /**
   * Reads a producer field at the top level or under {@code properties}.
   *
   * @param key field name
   * @return value when present
   */
  public Optional<Object> field(String key) {
    return Attributes.lookup(attributes, key);
  }
}
