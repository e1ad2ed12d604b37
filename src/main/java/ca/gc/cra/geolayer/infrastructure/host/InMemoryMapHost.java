package ca.gc.cra.geolayer.infrastructure.host;

import ca.gc.cra.geolayer.application.port.MapHost;
import ca.gc.cra.geolayer.domain.layer.MapLayer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Headless {@link MapHost} keeping layers in insertion order.
 *
 * <p>Used by the CLI and tests in place of an interactive map runtime. Adding a layer whose id is already
 * present is rejected.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryMapHost implements MapHost {
  private final String hostId;
  private final List<MapLayer> layers = new ArrayList<>(); // guarded by this

  /**
   * Creates a host.
   *
   * @param hostId host identifier used in logs
   */
  public InMemoryMapHost(String hostId) {
    this.hostId = Objects.requireNonNull(hostId, "hostId");
  }

  @Override
  public String hostId() {
    return hostId;
  }

  @Override
  public synchronized void addLayer(MapLayer layer) {
    Objects.requireNonNull(layer, "layer");
    for (MapLayer existing : layers) {
      if (existing.layerId().equals(layer.layerId())) {
        throw new IllegalStateException("layer " + layer.layerId() + " is already attached to " + hostId);
      }
    }
    layers.add(layer);
  }

  @Override
  public synchronized boolean removeLayer(MapLayer layer) {
    Objects.requireNonNull(layer, "layer");
    return layers.removeIf(existing -> existing.layerId().equals(layer.layerId()));
  }

  @Override
  public synchronized List<MapLayer> layers() {
    return List.copyOf(layers);
  }
}
