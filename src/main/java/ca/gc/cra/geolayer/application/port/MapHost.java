package ca.gc.cra.geolayer.application.port;

import ca.gc.cra.geolayer.domain.layer.MapLayer;
import java.util.List;

/**
 * <strong>What:</strong> Domain port over the map runtime's layer collection.
 * <p><strong>Why:</strong> The layer cache is the only component allowed to mutate the host's collection; the
 * port keeps that mutation surface to add/remove.</p>
 * <p><strong>Role:</strong> Leaf port implemented by adapters such as {@code InMemoryMapHost}.</p>
 * <p><strong>Thread-safety:</strong> The layer cache serializes every call it makes; implementations need only
 * tolerate concurrent {@link #layers()} reads.</p>
 *
 * @since 0.1.0
 */
public interface MapHost {
  /**
   * Returns a stable identifier for this host instance.
   *
   * @return host id used in logs
   */
  String hostId();

  /**
   * Adds a layer to the host's collection.
   *
   * @param layer layer to attach; never {@code null}
   * @throws RuntimeException when the host rejects the layer
   */
  void addLayer(MapLayer layer);

  /**
   * Removes a layer from the host's collection; removing an absent layer is a no-op.
   *
   * @param layer layer to detach; never {@code null}
   * @return {@code true} when the layer was present
   */
  boolean removeLayer(MapLayer layer);

  /**
   * Returns a snapshot of the host's current layers.
   *
   * @return layers in attach order
   */
  List<MapLayer> layers();
}
