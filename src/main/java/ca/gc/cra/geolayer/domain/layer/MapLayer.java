package ca.gc.cra.geolayer.domain.layer;

import java.util.Objects;

/**
 * Materialized layer ready to be added to a map host's layer collection.
 *
 * <p>Identity matters: hosts track layers by {@code layerId} and the cache compares instances when
 * detaching.</p>
 *
 * @param layerId unique layer identifier; never blank
 * @param descriptor layer blueprint; never {@code null}
 * @param createdAtMillis epoch milliseconds when the layer was materialized
 * @since 0.1.0
 */
public record MapLayer(String layerId, LayerDescriptor descriptor, long createdAtMillis) {

  /** Identifier prefix shared by every layer this subsystem creates. */
  public static final String ID_PREFIX = "analysis-layer-";

  /**
   * Validates identifiers.
   */
  public MapLayer {
    Objects.requireNonNull(layerId, "layerId");
    if (layerId.isBlank()) {
      throw new IllegalArgumentException("layerId must not be blank");
    }
    descriptor = Objects.requireNonNull(descriptor, "descriptor");
  }

  /**
   * Returns the layer title.
   *
   * @return descriptor title
   */
  public String title() {
    return descriptor.title();
  }
}
