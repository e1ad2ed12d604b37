package ca.gc.cra.geolayer.domain.geo;

import ca.gc.cra.geolayer.domain.util.Attributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable boundary feature keyed by its canonical area identifier.
 * <p><strong>Why:</strong> Boundary geometry is sourced independently of analysis output and must be
 * shared read-only by every join run within a session.</p>
 * <p><strong>Thread-safety:</strong> Deeply immutable; safe to share across threads.</p>
 *
 * @param areaId canonical area identifier; never blank
 * @param kind geometry shape; never {@code null}
 * @param coordinates polygon rings (first ring outer), or a single ring holding one position for points
 * @param attributes descriptive feature properties (for example {@code DESCRIPTION}); never {@code null}
 * @since 0.1.0
 */
public record BoundaryGeometry(
    String areaId,
    GeometryKind kind,
    List<List<Position>> coordinates,
    Map<String, Object> attributes) {

  /**
   * Validates invariants and copies coordinates and attributes.
   *
   * @throws IllegalArgumentException when the identifier is blank or the coordinates do not fit {@code kind}
   */
  public BoundaryGeometry {
    Objects.requireNonNull(areaId, "areaId");
    if (areaId.isBlank()) {
      throw new IllegalArgumentException("areaId must not be blank");
    }
    kind = Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(coordinates, "coordinates");
    List<List<Position>> rings = new ArrayList<>(coordinates.size());
    for (List<Position> ring : coordinates) {
      rings.add(List.copyOf(ring));
    }
    coordinates = List.copyOf(rings);
    if (coordinates.isEmpty() || coordinates.get(0).isEmpty()) {
      throw new IllegalArgumentException("geometry for " + areaId + " has no coordinates");
    }
    if (kind == GeometryKind.POINT
        && (coordinates.size() != 1 || coordinates.get(0).size() != 1)) {
      throw new IllegalArgumentException("point geometry for " + areaId + " must hold one position");
    }
    attributes = Attributes.copyOf(attributes);
  }

  /**
   * Builds a point boundary.
   *
   * @param areaId canonical identifier
   * @param position point location
   * @param attributes descriptive properties
   * @return point boundary
   */
  public static BoundaryGeometry point(String areaId, Position position, Map<String, ?> attributes) {
    return new BoundaryGeometry(
        areaId,
        GeometryKind.POINT,
        List.of(List.of(Objects.requireNonNull(position, "position"))),
        Attributes.copyOf(attributes));
  }

  /**
   * Builds a polygon boundary.
   *
   * @param areaId canonical identifier
   * @param rings polygon rings, outer ring first
   * @param attributes descriptive properties
   * @return polygon boundary
   */
  public static BoundaryGeometry polygon(
      String areaId, List<List<Position>> rings, Map<String, ?> attributes) {
    return new BoundaryGeometry(areaId, GeometryKind.POLYGON, rings, Attributes.copyOf(attributes));
  }

  /**
   * Returns the outer ring (polygons) or the single position list (points).
   *
   * @return first coordinate ring
   */
  public List<Position> outerRing() {
    return coordinates.get(0);
  }

  /**
   * Returns the descriptive label, typically formatted {@code "08837 (Edison)"}.
   *
   * @return label when the boundary carries one
   */
  public Optional<String> description() {
    return Attributes.lookup(attributes, "DESCRIPTION").flatMap(Attributes::text);
  }
}
