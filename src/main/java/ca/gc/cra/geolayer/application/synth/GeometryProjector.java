package ca.gc.cra.geolayer.application.synth;

import ca.gc.cra.geolayer.domain.geo.BoundaryGeometry;
import ca.gc.cra.geolayer.domain.geo.GeometryKind;
import ca.gc.cra.geolayer.domain.geo.Position;
import ca.gc.cra.geolayer.domain.layer.RenderMode;
import ca.gc.cra.geolayer.domain.util.Attributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Projects boundary geometry into the shape a layer renders.
 *
 * <p>Polygon mode keeps rings with their invalid vertices removed. Centroid mode turns polygons into points,
 * preferring a {@code centroid} attribute on the boundary and otherwise averaging the outer ring's valid
 * vertices. Points always stay points.</p>
 *
 * @since 0.1.0
 */
public final class GeometryProjector {
  private static final String CENTROID = "centroid";

  /**
   * Projects one boundary.
   *
   * @param boundary source geometry; never {@code null}
   * @param mode render mode
   * @return projected geometry, or empty when no valid vertex exists
   */
  public Optional<Projection> project(BoundaryGeometry boundary, RenderMode mode) {
    if (boundary.kind() == GeometryKind.POINT) {
      Position point = boundary.outerRing().get(0);
      return point.isValid() ? Optional.of(Projection.point(point)) : Optional.empty();
    }
    if (mode == RenderMode.CENTROID) {
      return centroidAttribute(boundary.attributes())
          .or(() -> ringMean(boundary.outerRing()))
          .map(Projection::point);
    }
    List<List<Position>> rings = new ArrayList<>(boundary.coordinates().size());
    for (List<Position> ring : boundary.coordinates()) {
      List<Position> valid = ring.stream().filter(Position::isValid).toList();
      if (!valid.isEmpty()) {
        rings.add(valid);
      } else if (rings.isEmpty()) {
        return Optional.empty();
      }
    }
    return Optional.of(new Projection(GeometryKind.POLYGON, rings));
  }

  static Optional<Position> ringMean(List<Position> ring) {
    double sumX = 0d;
    double sumY = 0d;
    int count = 0;
    for (Position position : ring) {
      if (position.isValid()) {
        sumX += position.x();
        sumY += position.y();
        count++;
      }
    }
    if (count == 0) {
      return Optional.empty();
    }
    return Optional.of(new Position(sumX / count, sumY / count));
  }

  static Optional<Position> centroidAttribute(Map<String, Object> attributes) {
    Optional<Object> raw = Attributes.lookup(attributes, CENTROID);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    Object value = raw.get();
    OptionalDouble x = OptionalDouble.empty();
    OptionalDouble y = OptionalDouble.empty();
    if (value instanceof List<?> list && list.size() >= 2) {
      x = Attributes.number(list.get(0));
      y = Attributes.number(list.get(1));
    } else if (value instanceof Map<?, ?> map) {
      x = Attributes.number(map.get("x"));
      y = Attributes.number(map.get("y"));
    }
    if (x.isEmpty() || y.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new Position(x.getAsDouble(), y.getAsDouble())).filter(Position::isValid);
  }

  /**
   * Projected shape of one feature.
   *
   * @param kind rendered geometry kind
   * @param coordinates rings, or a single one-position ring for points
   */
  public record Projection(GeometryKind kind, List<List<Position>> coordinates) {
    /**
     * Copies coordinates.
     */
    public Projection {
      coordinates = coordinates.stream().map(List::copyOf).toList();
    }

    static Projection point(Position position) {
      return new Projection(GeometryKind.POINT, List.of(List.of(position)));
    }
  }
}
