package ca.gc.cra.geolayer.domain.layer;

import ca.gc.cra.geolayer.domain.geo.GeometryKind;
import ca.gc.cra.geolayer.domain.geo.Position;
import ca.gc.cra.geolayer.domain.util.Attributes;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renderable feature: projected geometry plus display attributes.
 *
 * <p>Polygon features reference the boundary's ring lists directly; point features hold a single
 * position in a single ring.</p>
 *
 * @param objectId 1-based object identifier unique within the layer
 * @param kind projected geometry kind; never {@code null}
 * @param coordinates projected coordinates; never {@code null}
 * @param attributes display attributes; never {@code null}
 * @since 0.1.0
 */
public record LayerFeature(
    int objectId,
    GeometryKind kind,
    List<List<Position>> coordinates,
    Map<String, Object> attributes) {

  /**
   * Validates the object id and copies attributes.
   */
  public LayerFeature {
    if (objectId <= 0) {
      throw new IllegalArgumentException("objectId must be positive");
    }
    kind = Objects.requireNonNull(kind, "kind");
    coordinates = List.copyOf(Objects.requireNonNull(coordinates, "coordinates"));
    attributes = Attributes.copyOf(attributes);
  }
}
