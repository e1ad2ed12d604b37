/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link ca.gc.cra.geolayer.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe.
 * <p><strong>Observability:</strong> OpenTelemetry OTLP export, or noop when {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.geolayer.infrastructure.metrics;
