/**
 * <strong>Purpose:</strong> Ports defining the boundary store -> join -> synthesize -> map host contracts.
 * <p><strong>Pipeline role:</strong> Application layer; adapters implement these interfaces to integrate files,
 * telemetry backends and map hosts.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.application.port;
