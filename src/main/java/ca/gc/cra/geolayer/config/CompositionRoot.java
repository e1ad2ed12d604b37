package ca.gc.cra.geolayer.config;

import ca.gc.cra.geolayer.application.cache.HostSession;
import ca.gc.cra.geolayer.application.join.GeographicJoinEngine;
import ca.gc.cra.geolayer.application.pipeline.MapLayerFactory;
import ca.gc.cra.geolayer.application.pipeline.SignatureFactory;
import ca.gc.cra.geolayer.application.pipeline.VisualizationUseCase;
import ca.gc.cra.geolayer.application.port.AnalysisSource;
import ca.gc.cra.geolayer.application.port.BoundaryStore;
import ca.gc.cra.geolayer.application.port.ClockPort;
import ca.gc.cra.geolayer.application.port.MapHost;
import ca.gc.cra.geolayer.application.port.MetricsPort;
import ca.gc.cra.geolayer.application.synth.LayerSynthesizer;
import ca.gc.cra.geolayer.domain.layer.RenderRules;
import ca.gc.cra.geolayer.infrastructure.analysis.JsonAnalysisSource;
import ca.gc.cra.geolayer.infrastructure.boundary.GeoJsonBoundaryStore;
import ca.gc.cra.geolayer.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.geolayer.infrastructure.host.InMemoryMapHost;
import ca.gc.cra.geolayer.infrastructure.json.JsonSupport;
import ca.gc.cra.geolayer.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.geolayer.infrastructure.render.RenderRulesReader;
import ca.gc.cra.geolayer.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires adapters and application services for the {@code render} command.
 *
 * <p>Owns the build pool, the deadline scheduler and the host session; {@link #close()} releases all three and
 * detaches the rendered layer.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final long SHUTDOWN_WAIT_MILLIS = 2_000L;

  private final VisualizationConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final JsonSupport json = new JsonSupport();
  private final ExecutorService buildPool;
  private final ScheduledExecutorService timeoutScheduler;
  private final MapHost host;
  private final HostSession session;
  private final VisualizationUseCase useCase;

  /**
   * Creates a root exporting metrics through OpenTelemetry.
   *
   * @param config validated settings
   */
  public CompositionRoot(VisualizationConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a root with an explicit metrics sink.
   *
   * @param config validated settings
   * @param metrics metrics sink
   */
  public CompositionRoot(VisualizationConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = new SystemClockAdapter();
    this.buildPool = ExecutorFactories.newBuildPool(config.buildWorkers(), "geolayer-build",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    this.timeoutScheduler = ExecutorFactories.newTimeoutScheduler("geolayer-ttl");
    this.host = new InMemoryMapHost(config.hostId());
    this.session = HostSession.open(host, config.cacheSettings(), timeoutScheduler, clock, metrics);
    BoundaryStore boundaries = new GeoJsonBoundaryStore(config.boundaries(), json, clock);
    this.useCase = new VisualizationUseCase(
        boundaries,
        new GeographicJoinEngine(metrics),
        new LayerSynthesizer(metrics),
        new SignatureFactory(),
        new MapLayerFactory(clock),
        session,
        buildPool);
  }

  /**
   * Returns the wired visualization use case.
   *
   * @return use case
   */
  public VisualizationUseCase visualizationUseCase() {
    return useCase;
  }

  /**
   * Returns the analysis source reading the configured records file.
   *
   * @return analysis source
   */
  public AnalysisSource analysisSource() {
    return new JsonAnalysisSource(config.records(), json);
  }

  /**
   * Reads the configured render rules, if a rules file was given.
   *
   * @return render rules, or empty to fall back to a simple renderer
   * @throws IOException when the rules file cannot be read
   */
  public Optional<RenderRules> renderRules() throws IOException {
    if (config.rules().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new RenderRulesReader(json).read(config.rules().get()));
  }

  /**
   * Returns the headless host layers are attached to.
   *
   * @return map host
   */
  public MapHost host() {
    return host;
  }

  /**
   * Returns the host session.
   *
   * @return host session
   */
  public HostSession session() {
    return session;
  }

  /**
   * Returns the metrics sink.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  @Override
  public void close() {
    session.close();
    buildPool.shutdown();
    timeoutScheduler.shutdownNow();
    try {
      if (!buildPool.awaitTermination(SHUTDOWN_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Build pool did not terminate within {} ms", SHUTDOWN_WAIT_MILLIS);
        buildPool.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      buildPool.shutdownNow();
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
