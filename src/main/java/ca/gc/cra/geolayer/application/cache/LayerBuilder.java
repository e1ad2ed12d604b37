package ca.gc.cra.geolayer.application.cache;

import ca.gc.cra.geolayer.domain.layer.MapLayer;
import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;
import java.util.concurrent.CompletableFuture;

/**
 * Build routine handed to {@link VisualizationLayerCache#acquire}.
 *
 * <p>Implementations should return promptly and complete the future on their own executor. The cache never
 * interrupts a running build; it only stops waiting for it.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LayerBuilder {
  /**
   * Starts building the layer for a signature.
   *
   * @param signature requested signature
   * @return future completed with the materialized layer, or exceptionally on failure
   */
  CompletableFuture<MapLayer> build(VisualizationSignature signature);
}
