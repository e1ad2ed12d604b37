package ca.gc.cra.geolayer.application.pipeline;

import ca.gc.cra.geolayer.application.port.ClockPort;
import ca.gc.cra.geolayer.domain.layer.LayerDescriptor;
import ca.gc.cra.geolayer.domain.layer.MapLayer;
import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Materializes layer descriptors into host-ready layers with unique ids.
 *
 * @since 0.1.0
 */
public final class MapLayerFactory {
  private final ClockPort clock;
  private final AtomicLong sequence = new AtomicLong();

  /**
   * Creates a factory.
   *
   * @param clock clock used for ids and creation timestamps
   */
  public MapLayerFactory(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Materializes a layer.
   *
   * @param descriptor layer blueprint
   * @param signature signature the layer answers
   * @return new layer with id {@code analysis-layer-<millis>-<seq>-<sig>}
   */
  public MapLayer materialize(LayerDescriptor descriptor, VisualizationSignature signature) {
    long now = clock.nowMillis();
    String id = MapLayer.ID_PREFIX + now + '-' + sequence.incrementAndGet() + '-' + signature.shortForm();
    return new MapLayer(id, descriptor, now);
  }
}
