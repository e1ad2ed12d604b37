package ca.gc.cra.geolayer.application.cache;

import static ca.gc.cra.geolayer.testutil.Fixtures.layer;
import static ca.gc.cra.geolayer.testutil.Fixtures.signature;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geolayer.domain.layer.LayerBuildException;
import ca.gc.cra.geolayer.domain.layer.LayerHandle;
import ca.gc.cra.geolayer.domain.layer.MapLayer;
import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;
import ca.gc.cra.geolayer.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.geolayer.testutil.ManualClock;
import ca.gc.cra.geolayer.testutil.RecordingMapHost;
import ca.gc.cra.geolayer.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VisualizationLayerCacheTest {
  private static final VisualizationSignature S1 = signature("aaaaaaaaaaaaaaaa1");
  private static final VisualizationSignature S2 = signature("bbbbbbbbbbbbbbbb2");
  private static final VisualizationSignature S3 = signature("cccccccccccccccc3");

  private ScheduledExecutorService scheduler;
  private RecordingMapHost host;
  private RecordingMetricsPort metrics;
  private ManualClock clock;

  @BeforeEach
  void setUp() {
    scheduler = ExecutorFactories.newTimeoutScheduler("test-ttl");
    host = new RecordingMapHost("host-1");
    metrics = new RecordingMetricsPort();
    clock = new ManualClock(1_000L);
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  private VisualizationLayerCache cache(Duration ttl) {
    return new VisualizationLayerCache(host, new CacheSettings(ttl), scheduler, clock, metrics);
  }

  private VisualizationLayerCache cache() {
    return cache(Duration.ofSeconds(30));
  }

  private static LayerHandle attached(CompletableFuture<LayerOutcome> future) throws Exception {
    LayerOutcome outcome = future.get(5, TimeUnit.SECONDS);
    assertInstanceOf(LayerOutcome.Attached.class, outcome, () -> "unexpected outcome " + outcome);
    return outcome.handleOrThrow();
  }

  @Test
  void concurrentAcquiresForOneSignatureShareASingleBuild() throws Exception {
    VisualizationLayerCache cache = cache();
    AtomicInteger builds = new AtomicInteger();
    CompletableFuture<MapLayer> pending = new CompletableFuture<>();
    int callers = 16;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<CompletableFuture<LayerOutcome>>> submitted = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        submitted.add(pool.submit(() -> {
          start.await();
          return cache.acquire(S1, signature -> {
            builds.incrementAndGet();
            return pending;
          });
        }));
      }
      start.countDown();
      List<CompletableFuture<LayerOutcome>> outcomes = new ArrayList<>();
      for (Future<CompletableFuture<LayerOutcome>> future : submitted) {
        outcomes.add(future.get(5, TimeUnit.SECONDS));
      }

      pending.complete(layer("layer-s1"));

      LayerHandle first = attached(outcomes.get(0));
      for (CompletableFuture<LayerOutcome> outcome : outcomes) {
        assertSame(first, attached(outcome));
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, builds.get());
    assertEquals(1, host.layers().size());
    assertEquals("layer-s1", host.layers().get(0).layerId());
    assertEquals(callers - 1, metrics.count("cache.coalesced"));
    assertEquals(1, metrics.count("cache.build.started"));
  }

  @Test
  void attachedSignatureIsServedWithoutRebuilding() throws Exception {
    VisualizationLayerCache cache = cache();
    LayerHandle handle = attached(cache.acquire(S1, signature -> CompletableFuture.completedFuture(layer("l1"))));

    LayerHandle again = attached(cache.acquire(S1, signature -> {
      throw new AssertionError("build must not run for an attached signature");
    }));

    assertSame(handle, again);
    assertEquals(1, metrics.count("cache.hit"));
  }

  @Test
  void sequentialBuildsLeaveOnlyTheNewestLayerAttached() throws Exception {
    VisualizationLayerCache cache = cache();
    attached(cache.acquire(S1, signature -> CompletableFuture.completedFuture(layer("layer-s1"))));
    LayerHandle second =
        attached(cache.acquire(S2, signature -> CompletableFuture.completedFuture(layer("layer-s2"))));

    assertEquals(List.of("layer-s2"), host.layers().stream().map(MapLayer::layerId).toList());
    assertTrue(host.operations().contains("remove:layer-s1"));
    assertEquals(S2, second.signature());
    assertEquals(S2, cache.current().orElseThrow().signature());
    assertEquals(SlotState.ATTACHED, cache.snapshot().state());
  }

  @Test
  void newerSignatureSupersedesInFlightBuildAndDiscardsItsResult() throws Exception {
    VisualizationLayerCache cache = cache();
    CompletableFuture<MapLayer> first = new CompletableFuture<>();
    CompletableFuture<MapLayer> second = new CompletableFuture<>();

    CompletableFuture<LayerOutcome> older = cache.acquire(S1, signature -> first);
    CompletableFuture<LayerOutcome> newer = cache.acquire(S2, signature -> second);

    LayerOutcome superseded = older.get(5, TimeUnit.SECONDS);
    LayerOutcome.Superseded tagged = assertInstanceOf(LayerOutcome.Superseded.class, superseded);
    assertEquals(S1, tagged.signature());
    assertEquals(S2, tagged.winner());
    LayerSupersededException thrown = assertThrows(LayerSupersededException.class, superseded::handleOrThrow);
    assertEquals(S2, thrown.winner());

    first.complete(layer("layer-s1"));
    assertTrue(host.layers().isEmpty(), "superseded result must not be attached");
    assertEquals(1, metrics.count("cache.late.discarded"));

    second.complete(layer("layer-s2"));
    assertEquals("layer-s2", attached(newer).layerId());
    assertEquals(List.of("layer-s2"), host.layers().stream().map(MapLayer::layerId).toList());
  }

  @Test
  void buildOutlivingItsTtlReleasesWaitersAndAllowsAFreshBuild() throws Exception {
    VisualizationLayerCache cache = cache(Duration.ofMillis(50));
    AtomicInteger builds = new AtomicInteger();
    CompletableFuture<MapLayer> hung = new CompletableFuture<>();

    CompletableFuture<LayerOutcome> waiter = cache.acquire(S1, signature -> {
      builds.incrementAndGet();
      return hung;
    });
    CompletableFuture<LayerOutcome> coalesced = cache.acquire(S1, signature -> {
      throw new AssertionError("coalesced caller must not start a build");
    });

    LayerOutcome outcome = waiter.get(5, TimeUnit.SECONDS);
    assertInstanceOf(LayerOutcome.TimedOut.class, outcome);
    assertInstanceOf(LayerOutcome.TimedOut.class, coalesced.get(5, TimeUnit.SECONDS));
    assertThrows(BuildTimeoutException.class, outcome::handleOrThrow);
    SlotSnapshot afterTimeout = cache.snapshot();
    assertNull(afterTimeout.inFlightSignature());
    assertNull(afterTimeout.inFlightDeadlineMillis());
    assertEquals(1, metrics.count("cache.build.timeout"));

    hung.complete(layer("late"));
    assertTrue(host.layers().isEmpty(), "timed-out result must not be attached");

    CompletableFuture<LayerOutcome> retry = cache.acquire(S1, signature -> {
      builds.incrementAndGet();
      return CompletableFuture.completedFuture(layer("fresh"));
    });
    assertEquals("fresh", attached(retry).layerId());
    assertEquals(2, builds.get());
  }

  @Test
  void failedBuildLeavesCurrentLayerAndHostUntouched() throws Exception {
    VisualizationLayerCache cache = cache();
    LayerHandle current =
        attached(cache.acquire(S1, signature -> CompletableFuture.completedFuture(layer("layer-s1"))));
    List<String> opsBefore = host.operations();

    LayerOutcome failed = cache.acquire(S2,
        signature -> CompletableFuture.failedFuture(new IllegalStateException("synthesis exploded")))
        .get(5, TimeUnit.SECONDS);

    LayerOutcome.Failed tagged = assertInstanceOf(LayerOutcome.Failed.class, failed);
    assertEquals("synthesis exploded", tagged.cause().getMessage());
    LayerBuildException thrown = assertThrows(LayerBuildException.class, failed::handleOrThrow);
    assertInstanceOf(IllegalStateException.class, thrown.getCause());
    assertSame(current, cache.current().orElseThrow());
    assertEquals(opsBefore, host.operations());
    assertEquals(1, metrics.count("cache.build.failed"));
  }

  @Test
  void builderThrowingSynchronouslyIsReportedAsFailure() throws Exception {
    VisualizationLayerCache cache = cache();

    LayerOutcome outcome = cache.acquire(S1, signature -> {
      throw new IllegalArgumentException("bad input");
    }).get(5, TimeUnit.SECONDS);

    assertInstanceOf(LayerOutcome.Failed.class, outcome);
    assertEquals(SlotState.IDLE, cache.snapshot().state());
    assertTrue(host.layers().isEmpty());
  }

  @Test
  void hostRejectionRestoresPreviousLayer() throws Exception {
    VisualizationLayerCache cache = cache();
    LayerHandle current =
        attached(cache.acquire(S1, signature -> CompletableFuture.completedFuture(layer("layer-s1"))));
    host.rejectNextAdds(1);

    LayerOutcome outcome = cache.acquire(S2, signature -> CompletableFuture.completedFuture(layer("layer-s2")))
        .get(5, TimeUnit.SECONDS);

    LayerOutcome.Failed failed = assertInstanceOf(LayerOutcome.Failed.class, outcome);
    assertInstanceOf(HostAttachFailureException.class, failed.cause());
    assertEquals(List.of("layer-s1"), host.layers().stream().map(MapLayer::layerId).toList());
    assertSame(current, cache.current().orElseThrow());
  }

  @Test
  void forceReplaceSwapsLayerWithoutBuilding() throws Exception {
    VisualizationLayerCache cache = cache();
    attached(cache.acquire(S1, signature -> CompletableFuture.completedFuture(layer("layer-s1"))));

    LayerHandle handle = cache.forceReplace(layer("forced"), S2);

    assertEquals("forced", handle.layerId());
    assertEquals(S2, cache.current().orElseThrow().signature());
    assertEquals(List.of("forced"), host.layers().stream().map(MapLayer::layerId).toList());
    assertTrue(host.operations().contains("remove:layer-s1"));
    assertEquals(1, metrics.count("cache.build.started"));
    assertEquals(1, metrics.count("cache.forceReplace"));
  }

  @Test
  void forceReplaceSupersedesInFlightBuild() throws Exception {
    VisualizationLayerCache cache = cache();
    CompletableFuture<MapLayer> pending = new CompletableFuture<>();
    CompletableFuture<LayerOutcome> waiter = cache.acquire(S3, signature -> pending);

    cache.forceReplace(layer("forced"), S2);

    LayerOutcome.Superseded superseded =
        assertInstanceOf(LayerOutcome.Superseded.class, waiter.get(5, TimeUnit.SECONDS));
    assertEquals(S2, superseded.winner());
    pending.complete(layer("late"));
    assertEquals(List.of("forced"), host.layers().stream().map(MapLayer::layerId).toList());
  }

  @Test
  void waitForReturnsHandleOnceBuildAttaches() throws Exception {
    VisualizationLayerCache cache = cache();
    CompletableFuture<MapLayer> pending = new CompletableFuture<>();
    cache.acquire(S1, signature -> pending);
    assertEquals(SlotState.BUILDING, cache.snapshot().state());

    CompletableFuture<Optional<LayerHandle>> waited =
        CompletableFuture.supplyAsync(() -> cache.waitFor(S1, Duration.ofSeconds(5)));
    pending.complete(layer("layer-s1"));

    assertEquals("layer-s1", waited.get(5, TimeUnit.SECONDS).orElseThrow().layerId());
    assertEquals("layer-s1", cache.waitFor(S1, Duration.ofMillis(10)).orElseThrow().layerId());
  }

  @Test
  void waitForIsEmptyForUnknownSignatureOrExpiredWait() {
    VisualizationLayerCache cache = cache();
    assertTrue(cache.waitFor(S1, Duration.ofMillis(10)).isEmpty());

    cache.acquire(S1, signature -> new CompletableFuture<>());
    assertTrue(cache.waitFor(S2, Duration.ofMillis(10)).isEmpty());
    assertTrue(cache.waitFor(S1, Duration.ofMillis(20)).isEmpty());
  }

  @Test
  void cleanupDetachesLayerFailsWaitersAndKeepsCacheUsable() throws Exception {
    VisualizationLayerCache cache = cache();
    attached(cache.acquire(S1, signature -> CompletableFuture.completedFuture(layer("layer-s1"))));
    CompletableFuture<MapLayer> pending = new CompletableFuture<>();
    CompletableFuture<LayerOutcome> waiter = cache.acquire(S2, signature -> pending);
    assertEquals(SlotState.REPLACING, cache.snapshot().state());

    cache.cleanup();

    LayerOutcome.Failed failed = assertInstanceOf(LayerOutcome.Failed.class, waiter.get(5, TimeUnit.SECONDS));
    assertInstanceOf(CacheClosedException.class, failed.cause());
    assertTrue(host.layers().isEmpty());
    assertEquals(SlotSnapshot.IDLE, cache.snapshot());
    assertFalse(cache.current().isPresent());

    pending.complete(layer("late"));
    assertTrue(host.layers().isEmpty());

    LayerHandle reused =
        attached(cache.acquire(S3, signature -> CompletableFuture.completedFuture(layer("layer-s3"))));
    assertEquals("layer-s3", reused.layerId());
  }

  @Test
  void snapshotReportsDeadlineOfInFlightBuild() {
    VisualizationLayerCache cache = cache(Duration.ofSeconds(10));
    cache.acquire(S1, signature -> new CompletableFuture<>());

    SlotSnapshot snapshot = cache.snapshot();

    assertEquals(SlotState.BUILDING, snapshot.state());
    assertEquals(S1, snapshot.inFlightSignature());
    assertEquals(11_000L, snapshot.inFlightDeadlineMillis());
  }

  @Test
  void cacheHitForAttachedSignatureSupersedesPendingBuildOfAnother() throws Exception {
    VisualizationLayerCache cache = cache();
    attached(cache.acquire(S1, signature -> CompletableFuture.completedFuture(layer("layer-s1"))));
    CompletableFuture<MapLayer> pending = new CompletableFuture<>();
    CompletableFuture<LayerOutcome> older = cache.acquire(S2, signature -> pending);

    LayerHandle hit = attached(cache.acquire(S1, signature -> {
      throw new AssertionError("build must not run for an attached signature");
    }));

    LayerOutcome.Superseded superseded =
        assertInstanceOf(LayerOutcome.Superseded.class, older.get(5, TimeUnit.SECONDS));
    assertEquals(S1, superseded.winner());
    assertEquals(SlotState.ATTACHED, cache.snapshot().state());

    pending.complete(layer("layer-s2"));

    assertEquals(List.of("layer-s1"), host.layers().stream().map(MapLayer::layerId).toList());
    assertEquals(S1, cache.current().orElseThrow().signature());
    assertSame(hit, cache.current().orElseThrow());
    assertEquals(1, metrics.count("cache.late.discarded"));
  }

  @Test
  void hostFailingToRemovePreviousLayerFailsWaitersAndKeepsCurrent() throws Exception {
    VisualizationLayerCache cache = cache();
    LayerHandle current =
        attached(cache.acquire(S1, signature -> CompletableFuture.completedFuture(layer("layer-s1"))));
    CompletableFuture<MapLayer> pending = new CompletableFuture<>();
    CompletableFuture<LayerOutcome> waiter = cache.acquire(S2, signature -> pending);
    CompletableFuture<LayerOutcome> coalesced = cache.acquire(S2, signature -> pending);
    host.failNextRemoves(1);

    pending.complete(layer("layer-s2"));

    LayerOutcome.Failed failed = assertInstanceOf(LayerOutcome.Failed.class, waiter.get(5, TimeUnit.SECONDS));
    assertInstanceOf(HostAttachFailureException.class, failed.cause());
    assertInstanceOf(LayerOutcome.Failed.class, coalesced.get(5, TimeUnit.SECONDS));
    assertThrows(HostAttachFailureException.class, failed::handleOrThrow);
    assertSame(current, cache.current().orElseThrow());
    assertEquals(List.of("layer-s1"), host.layers().stream().map(MapLayer::layerId).toList());
    assertEquals(SlotState.ATTACHED, cache.snapshot().state());
  }

  @Test
  void forceReplaceReportsHostRemoveFailureAsAttachFailure() throws Exception {
    VisualizationLayerCache cache = cache();
    LayerHandle current =
        attached(cache.acquire(S1, signature -> CompletableFuture.completedFuture(layer("layer-s1"))));
    host.failNextRemoves(1);

    assertThrows(HostAttachFailureException.class, () -> cache.forceReplace(layer("forced"), S2));

    assertSame(current, cache.current().orElseThrow());
    assertEquals(List.of("layer-s1"), host.layers().stream().map(MapLayer::layerId).toList());
  }

  @Test
  void rejectedDeadlineFailsRequestWithoutLeavingABuildBehind() throws Exception {
    VisualizationLayerCache cache = cache();
    scheduler.shutdownNow();
    AtomicInteger builds = new AtomicInteger();

    LayerOutcome first = cache.acquire(S1, signature -> {
      builds.incrementAndGet();
      return new CompletableFuture<>();
    }).get(5, TimeUnit.SECONDS);
    LayerOutcome second = cache.acquire(S1, signature -> {
      builds.incrementAndGet();
      return new CompletableFuture<>();
    }).get(5, TimeUnit.SECONDS);

    assertInstanceOf(LayerOutcome.Failed.class, first);
    assertInstanceOf(LayerOutcome.Failed.class, second);
    assertThrows(LayerBuildException.class, first::handleOrThrow);
    assertEquals(0, builds.get());
    assertEquals(SlotState.IDLE, cache.snapshot().state());
    assertNull(cache.snapshot().inFlightSignature());
  }
}
