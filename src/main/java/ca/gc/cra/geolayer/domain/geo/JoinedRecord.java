package ca.gc.cra.geolayer.domain.geo;

import ca.gc.cra.geolayer.domain.util.Attributes;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Analysis record paired with its matched boundary, or explicitly unmatched.
 *
 * <p>{@code geometry} is a borrowed reference into the session's boundary collection and is never
 * mutated; {@code null} marks a record whose identifier matched no boundary.</p>
 *
 * @param areaId resolved area identifier (boundary code when matched, raw id otherwise); never blank
 * @param displayName human-readable label; never blank
 * @param geometry matched boundary or {@code null}
 * @param score thematic score or {@code null} when the producer omitted it
 * @param attributes merged record and boundary attributes; never {@code null}
 * @since 0.1.0
 */
public record JoinedRecord(
    String areaId,
    String displayName,
    BoundaryGeometry geometry,
    Double score,
    Map<String, Object> attributes) {

  /**
   * Validates identifiers and copies attributes.
   */
  public JoinedRecord {
    Objects.requireNonNull(areaId, "areaId");
    Objects.requireNonNull(displayName, "displayName");
    attributes = Attributes.copyOf(attributes);
  }

  /**
   * Indicates whether the record matched a boundary.
   *
   * @return {@code true} when geometry is present
   */
  public boolean hasGeometry() {
    return geometry != null;
  }

  /**
   * Returns the matched boundary.
   *
   * @return boundary when the record matched
   */
  public Optional<BoundaryGeometry> geometryRef() {
    return Optional.ofNullable(geometry);
  }
}
