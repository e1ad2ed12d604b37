package ca.gc.cra.geolayer.domain.layer;

import java.util.Objects;

/**
 * Ownership token for the single layer a layer cache has attached to its host.
 *
 * <p><strong>Thread-safety:</strong> Immutable; safe to hand to any number of waiters.</p>
 *
 * @param layer attached layer; never {@code null}
 * @param signature signature the layer was built for; never {@code null}
 * @param attachedAtMillis epoch milliseconds when the layer was attached
 * @since 0.1.0
 */
public record LayerHandle(MapLayer layer, VisualizationSignature signature, long attachedAtMillis) {

  /**
   * Validates references.
   */
  public LayerHandle {
    layer = Objects.requireNonNull(layer, "layer");
    signature = Objects.requireNonNull(signature, "signature");
  }

  /**
   * Returns the attached layer's identifier.
   *
   * @return layer id
   */
  public String layerId() {
    return layer.layerId();
  }
}
