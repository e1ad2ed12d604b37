/**
 * <strong>Purpose:</strong> Visualization pipeline bridging the join engine, layer synthesizer and per-host layer
 * cache.
 * <p><strong>Concurrency:</strong> Use cases are thread-safe; synthesis runs on a caller-supplied executor.
 * <p><strong>Observability:</strong> MDC {@code pipeline} during preparation, {@code signature} during builds.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.application.pipeline;
