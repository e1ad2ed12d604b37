package ca.gc.cra.geolayer.application.pipeline;

import static ca.gc.cra.geolayer.testutil.Fixtures.TARGET;
import static ca.gc.cra.geolayer.testutil.Fixtures.boundaries;
import static ca.gc.cra.geolayer.testutil.Fixtures.record;
import static ca.gc.cra.geolayer.testutil.Fixtures.square;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geolayer.application.cache.CacheSettings;
import ca.gc.cra.geolayer.application.cache.HostSession;
import ca.gc.cra.geolayer.application.cache.LayerOutcome;
import ca.gc.cra.geolayer.application.join.BoundaryUnavailableException;
import ca.gc.cra.geolayer.application.join.GeographicJoinEngine;
import ca.gc.cra.geolayer.application.port.BoundaryStore;
import ca.gc.cra.geolayer.application.synth.LayerSynthesizer;
import ca.gc.cra.geolayer.application.synth.SynthesisEmptyException;
import ca.gc.cra.geolayer.domain.geo.AnalysisBatch;
import ca.gc.cra.geolayer.domain.geo.BoundarySet;
import ca.gc.cra.geolayer.domain.layer.LayerDescriptor;
import ca.gc.cra.geolayer.domain.layer.LayerHandle;
import ca.gc.cra.geolayer.domain.layer.MapLayer;
import ca.gc.cra.geolayer.domain.layer.RenderRules;
import ca.gc.cra.geolayer.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.geolayer.testutil.ManualClock;
import ca.gc.cra.geolayer.testutil.RecordingMapHost;
import ca.gc.cra.geolayer.testutil.RecordingMetricsPort;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class VisualizationUseCaseTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final RecordingMapHost host = new RecordingMapHost("pipeline-host");
  private ExecutorService buildPool;
  private ScheduledExecutorService scheduler;
  private HostSession session;

  @BeforeEach
  void setUp() {
    buildPool = ExecutorFactories.newBuildPool(2, "test-build", null);
    scheduler = ExecutorFactories.newTimeoutScheduler("test-ttl");
    session = HostSession.open(host, CacheSettings.defaults(), scheduler, new ManualClock(5_000L), metrics);
  }

  @AfterEach
  void tearDown() {
    session.close();
    buildPool.shutdownNow();
    scheduler.shutdownNow();
  }

  private VisualizationUseCase useCase(BoundarySet boundaries) {
    BoundaryStore store = new BoundaryStore() {
      @Override
      public BoundarySet boundaries() {
        if (boundaries == null) {
          throw new BoundaryUnavailableException("boundary file missing");
        }
        return boundaries;
      }

      @Override
      public BoundarySet reload() {
        return boundaries();
      }
    };
    return new VisualizationUseCase(
        store,
        new GeographicJoinEngine(metrics),
        new LayerSynthesizer(metrics),
        new SignatureFactory(),
        new MapLayerFactory(new ManualClock(5_000L)),
        session,
        buildPool);
  }

  @Test
  void visualizeJoinsSynthesizesAndAttaches() throws Exception {
    VisualizationUseCase useCase = useCase(boundaries(square("00001"), square("00002")));
    AnalysisBatch batch = new AnalysisBatch(TARGET, List.of(record("1", 3.0), record("2", 4.0), record("7", 1.0)));

    LayerOutcome outcome = useCase.visualize(batch, RenderRules.simple(TARGET)).get(5, TimeUnit.SECONDS);

    LayerHandle handle = outcome.handleOrThrow();
    assertTrue(handle.layerId().startsWith(MapLayer.ID_PREFIX));
    LayerDescriptor descriptor = handle.layer().descriptor();
    assertEquals(2, descriptor.featureCount());
    assertEquals(1, descriptor.missingGeometryCount());
    assertEquals(List.of(handle.layer()), host.layers());
    assertNull(MDC.get("pipeline"));
  }

  @Test
  void repeatedRequestIsServedFromCache() throws Exception {
    VisualizationUseCase useCase = useCase(boundaries(square("00001")));
    AnalysisBatch batch = new AnalysisBatch(TARGET, List.of(record("1", 3.0)));

    LayerHandle first = useCase.visualize(batch, RenderRules.simple(TARGET)).get(5, TimeUnit.SECONDS)
        .handleOrThrow();
    LayerHandle second = useCase.visualize(batch, RenderRules.simple(TARGET)).get(5, TimeUnit.SECONDS)
        .handleOrThrow();

    assertSame(first, second);
    assertEquals(1, metrics.count("cache.build.started"));
    assertEquals(1, metrics.count("cache.hit"));
  }

  @Test
  void prepareExposesEveryJoinedRecord() {
    VisualizationUseCase useCase = useCase(boundaries(square("00001")));
    AnalysisBatch batch = new AnalysisBatch(TARGET, List.of(record("1", 3.0), record("99999", 2.0)));

    JoinRun run = useCase.prepare(batch, RenderRules.simple(TARGET));

    assertEquals(2, run.records().size());
    assertEquals(1, run.report().unmatched());
    assertEquals(TARGET, run.targetVariable());
    assertTrue(host.layers().isEmpty());
  }

  @Test
  void unavailableBoundariesFailBeforeTheCache() {
    VisualizationUseCase useCase = useCase(null);
    AnalysisBatch batch = new AnalysisBatch(TARGET, List.of(record("1", 3.0)));

    assertThrows(BoundaryUnavailableException.class, () -> useCase.visualize(batch, RenderRules.simple(TARGET)));
    assertEquals(0, metrics.count("cache.build.started"));
  }

  @Test
  void emptySynthesisFailsOutcomeAndKeepsHostEmpty() throws Exception {
    VisualizationUseCase useCase = useCase(boundaries(square("00001")));
    AnalysisBatch batch = new AnalysisBatch(TARGET, List.of(record("42424", 3.0)));

    LayerOutcome outcome = useCase.visualize(batch, RenderRules.simple(TARGET)).get(5, TimeUnit.SECONDS);

    LayerOutcome.Failed failed = assertInstanceOf(LayerOutcome.Failed.class, outcome);
    assertInstanceOf(SynthesisEmptyException.class, failed.cause());
    assertThrows(SynthesisEmptyException.class, outcome::handleOrThrow);
    assertTrue(host.layers().isEmpty());
  }
}
