/**
 * <strong>Purpose:</strong> Adapters implementing the application ports: files, telemetry, executors, clocks and
 * map hosts.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.infrastructure;
