package ca.gc.cra.geolayer.application.cache;

import ca.gc.cra.geolayer.application.port.ClockPort;
import ca.gc.cra.geolayer.application.port.MapHost;
import ca.gc.cra.geolayer.application.port.MetricsPort;
import ca.gc.cra.geolayer.domain.layer.LayerBuildException;
import ca.gc.cra.geolayer.domain.layer.LayerHandle;
import ca.gc.cra.geolayer.domain.layer.MapLayer;
import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Owns the single analysis layer attached to one map host and coordinates the builds
 * that produce it.
 * <p><strong>Why:</strong> Layer construction is expensive and requests overlap; the host must never show a
 * stale or duplicate layer, and one caller's failure must not disturb another's.</p>
 * <p><strong>Role:</strong> Application service behind {@link HostSession}; one instance per host.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return the attached layer immediately when the signature matches.</li>
 *   <li>Coalesce concurrent requests for one signature onto a single build.</li>
 *   <li>Let the newest signature win: older waiters receive {@link LayerOutcome.Superseded} and the older
 *   result is discarded.</li>
 *   <li>Release waiters with {@link LayerOutcome.TimedOut} when a build outlives its TTL.</li>
 *   <li>Swap layers on the host so that at most one cache-owned layer is attached.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Slot state and host attach/detach run under one lock. Build routines run
 * outside it. Waiter futures are completed after the lock is released.</p>
 * <p><strong>Observability:</strong> Emits {@code cache.hit}, {@code cache.coalesced},
 * {@code cache.build.*}, {@code cache.late.discarded}, {@code cache.forceReplace} and
 * {@code cache.cleanup}; sets MDC {@code signature} while a build routine starts.</p>
 *
 * @since 0.1.0
 */
public final class VisualizationLayerCache {
  private static final Logger log = LoggerFactory.getLogger(VisualizationLayerCache.class);
  private static final String MDC_SIGNATURE = "signature";

  private final MapHost host;
  private final CacheSettings settings;
  private final ScheduledExecutorService timeoutScheduler;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicLong tickets = new AtomicLong();

  private ManagerSlot slot; // guarded by lock; null until first use and after cleanup

  /**
   * Creates a cache for one host.
   *
   * @param host map host whose layer collection this cache manages
   * @param settings cache tunables
   * @param timeoutScheduler scheduler used for build deadlines; owned by the caller
   * @param clock clock for deadlines and handle timestamps
   * @param metrics metrics sink
   */
  public VisualizationLayerCache(
      MapHost host,
      CacheSettings settings,
      ScheduledExecutorService timeoutScheduler,
      ClockPort clock,
      MetricsPort metrics) {
    this.host = Objects.requireNonNull(host, "host");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.timeoutScheduler = Objects.requireNonNull(timeoutScheduler, "timeoutScheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the attached layer for {@code signature}, building it if needed.
   *
   * @param signature requested signature
   * @param builder build routine, invoked at most once per started build
   * @return future completed with the outcome shared by every waiter of the same build
   */
  public CompletableFuture<LayerOutcome> acquire(VisualizationSignature signature, LayerBuilder builder) {
    Objects.requireNonNull(signature, "signature");
    Objects.requireNonNull(builder, "builder");
    List<Resolution> resolutions = new ArrayList<>(1);
    InFlight started;
    lock.lock();
    try {
      ManagerSlot s = slot();
      if (s.current != null && s.current.signature().equals(signature)) {
        if (s.inFlight != null) {
          // newest request; the pending build must not replace it
          supersede(s, signature, resolutions);
        }
        metrics.increment("cache.hit");
        return CompletableFuture.completedFuture(new LayerOutcome.Attached(s.current));
      }
      if (s.inFlight != null && s.inFlight.signature.equals(signature)) {
        metrics.increment("cache.coalesced");
        log.debug("Joining in-flight build {}", signature.shortForm());
        return s.inFlight.outcome.copy();
      }
      long deadline = clock.nowMillis() + settings.buildTtl().toMillis();
      InFlight candidate = new InFlight(tickets.incrementAndGet(), signature, deadline, System.nanoTime());
      try {
        candidate.timeout = timeoutScheduler.schedule(
            () -> expire(candidate), settings.buildTtl().toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException ex) {
        metrics.increment("cache.build.failed");
        log.warn("Could not schedule deadline for layer build {}; build not started", signature.shortForm(), ex);
        return CompletableFuture.completedFuture(new LayerOutcome.Failed(signature,
            new LayerBuildException("deadline for layer build " + signature.shortForm() + " was rejected", ex)));
      }
      if (s.inFlight != null) {
        supersede(s, signature, resolutions);
      }
      s.inFlight = candidate;
      started = candidate;
    } finally {
      lock.unlock();
      resolve(resolutions);
    }

    metrics.increment("cache.build.started");
    log.debug("Starting layer build {} (ticket {})", signature.shortForm(), started.ticket);
    CompletableFuture<LayerOutcome> view = started.outcome.copy();
    startBuild(started, builder);
    return view;
  }

  /**
   * Attaches a finished layer without running a build.
   *
   * <p>Waiters of any in-flight build receive {@link LayerOutcome.Superseded}.</p>
   *
   * @param layer finished layer
   * @param signature signature the layer answers
   * @return handle of the attached layer
   * @throws HostAttachFailureException when the host rejects the layer
   */
  public LayerHandle forceReplace(MapLayer layer, VisualizationSignature signature) {
    Objects.requireNonNull(layer, "layer");
    Objects.requireNonNull(signature, "signature");
    List<Resolution> resolutions = new ArrayList<>(1);
    lock.lock();
    try {
      ManagerSlot s = slot();
      if (s.inFlight != null) {
        supersede(s, signature, resolutions);
      }
      LayerHandle handle = attach(s, layer, signature);
      metrics.increment("cache.forceReplace");
      log.info("Force-replaced layer on host {} with {} ({})",
          host.hostId(), layer.layerId(), signature.shortForm());
      return handle;
    } finally {
      lock.unlock();
      resolve(resolutions);
    }
  }

  /**
   * Waits for the layer of {@code signature}.
   *
   * @param signature requested signature
   * @param timeout maximum time to block for an in-flight build
   * @return the attached handle; empty when nothing matching is attached or building, when the build does not
   *     attach, or when the timeout elapses
   */
  public Optional<LayerHandle> waitFor(VisualizationSignature signature, Duration timeout) {
    Objects.requireNonNull(signature, "signature");
    Objects.requireNonNull(timeout, "timeout");
    CompletableFuture<LayerOutcome> pending;
    lock.lock();
    try {
      if (slot == null) {
        return Optional.empty();
      }
      if (slot.current != null && slot.current.signature().equals(signature)) {
        return Optional.of(slot.current);
      }
      if (slot.inFlight == null || !slot.inFlight.signature.equals(signature)) {
        return Optional.empty();
      }
      pending = slot.inFlight.outcome;
    } finally {
      lock.unlock();
    }

    try {
      LayerOutcome outcome = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (outcome instanceof LayerOutcome.Attached attached) {
        return Optional.of(attached.handle());
      }
      return Optional.empty();
    } catch (TimeoutException ex) {
      log.debug("Gave up waiting for layer {} after {}", signature.shortForm(), timeout);
      return Optional.empty();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    } catch (ExecutionException ex) {
      throw new LayerBuildException("waiting for layer " + signature.shortForm() + " failed", ex.getCause());
    }
  }

  /**
   * Detaches the current layer and releases the slot.
   *
   * <p>Waiters of an outstanding build receive {@link LayerOutcome.Failed} with a
   * {@link CacheClosedException}; that build's result is discarded. The cache can be used again afterwards.</p>
   */
  public void cleanup() {
    List<Resolution> resolutions = new ArrayList<>(1);
    lock.lock();
    try {
      if (slot == null) {
        return;
      }
      InFlight flight = slot.inFlight;
      if (flight != null) {
        flight.cancelTimeout();
        resolutions.add(new Resolution(flight.outcome,
            new LayerOutcome.Failed(flight.signature, new CacheClosedException(host.hostId()))));
      }
      LayerHandle current = slot.current;
      if (current != null) {
        try {
          host.removeLayer(current.layer());
        } catch (RuntimeException ex) {
          log.warn("Host {} failed to remove layer {} during cleanup", host.hostId(), current.layerId(), ex);
        }
      }
      slot = null;
      metrics.increment("cache.cleanup");
      log.info("Cleaned up layer cache for host {}", host.hostId());
    } finally {
      lock.unlock();
      resolve(resolutions);
    }
  }

  /**
   * Returns the attached layer handle.
   *
   * @return current handle, if any
   */
  public Optional<LayerHandle> current() {
    lock.lock();
    try {
      return slot == null ? Optional.empty() : Optional.ofNullable(slot.current);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a point-in-time view of the slot.
   *
   * @return slot snapshot
   */
  public SlotSnapshot snapshot() {
    lock.lock();
    try {
      if (slot == null) {
        return SlotSnapshot.IDLE;
      }
      LayerHandle current = slot.current;
      InFlight flight = slot.inFlight;
      SlotState state;
      if (flight == null) {
        state = current == null ? SlotState.IDLE : SlotState.ATTACHED;
      } else {
        state = current == null ? SlotState.BUILDING : SlotState.REPLACING;
      }
      return new SlotSnapshot(
          state,
          current == null ? null : current.signature(),
          current == null ? null : current.layerId(),
          flight == null ? null : flight.signature,
          flight == null ? null : flight.deadlineMillis);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the host this cache manages.
   *
   * @return map host
   */
  public MapHost host() {
    return host;
  }

  private void startBuild(InFlight flight, LayerBuilder builder) {
    String previous = MDC.get(MDC_SIGNATURE);
    MDC.put(MDC_SIGNATURE, flight.signature.shortForm());
    CompletableFuture<MapLayer> build;
    try {
      build = builder.build(flight.signature);
      if (build == null) {
        build = CompletableFuture.failedFuture(
            new LayerBuildException("build routine returned no future for " + flight.signature.shortForm()));
      }
    } catch (RuntimeException ex) {
      build = CompletableFuture.failedFuture(ex);
    } finally {
      if (previous == null) {
        MDC.remove(MDC_SIGNATURE);
      } else {
        MDC.put(MDC_SIGNATURE, previous);
      }
    }
    build.whenComplete((layer, error) -> complete(flight, layer, error));
  }

  private void complete(InFlight flight, MapLayer layer, Throwable error) {
    List<Resolution> resolutions = new ArrayList<>(1);
    lock.lock();
    try {
      if (slot == null || slot.inFlight != flight) {
        metrics.increment("cache.late.discarded");
        log.warn("Discarding late result of layer build {} (ticket {})", flight.signature.shortForm(), flight.ticket);
        return;
      }
      slot.inFlight = null;
      flight.cancelTimeout();
      metrics.observe("cache.build.latencyNanos", System.nanoTime() - flight.startedNanos);

      Throwable failure = unwrap(error);
      if (failure == null && layer == null) {
        failure = new LayerBuildException("build routine produced no layer for " + flight.signature.shortForm());
      }
      if (failure != null) {
        metrics.increment("cache.build.failed");
        log.warn("Layer build {} failed: {}", flight.signature.shortForm(), failure.getMessage());
        resolutions.add(new Resolution(flight.outcome, new LayerOutcome.Failed(flight.signature, failure)));
        return;
      }
      try {
        LayerHandle handle = attach(slot, layer, flight.signature);
        metrics.increment("cache.build.succeeded");
        log.info("Attached layer {} to host {} ({})", layer.layerId(), host.hostId(), flight.signature.shortForm());
        resolutions.add(new Resolution(flight.outcome, new LayerOutcome.Attached(handle)));
      } catch (RuntimeException ex) {
        metrics.increment("cache.build.failed");
        log.warn("Could not attach layer {} to host {}", layer.layerId(), host.hostId(), ex);
        resolutions.add(new Resolution(flight.outcome, new LayerOutcome.Failed(flight.signature, ex)));
      }
    } finally {
      lock.unlock();
      resolve(resolutions);
    }
  }

  private void expire(InFlight flight) {
    List<Resolution> resolutions = new ArrayList<>(1);
    lock.lock();
    try {
      if (slot == null || slot.inFlight != flight) {
        return;
      }
      slot.inFlight = null;
      metrics.increment("cache.build.timeout");
      log.warn("Layer build {} exceeded {} ms; releasing waiters",
          flight.signature.shortForm(), settings.buildTtl().toMillis());
      resolutions.add(new Resolution(flight.outcome, new LayerOutcome.TimedOut(flight.signature)));
    } finally {
      lock.unlock();
      resolve(resolutions);
    }
  }

  /** Caller holds the lock. */
  private void supersede(ManagerSlot s, VisualizationSignature winner, List<Resolution> resolutions) {
    InFlight older = s.inFlight;
    s.inFlight = null;
    older.cancelTimeout();
    metrics.increment("cache.build.superseded");
    log.info("Layer build {} superseded by {}", older.signature.shortForm(), winner.shortForm());
    resolutions.add(new Resolution(older.outcome, new LayerOutcome.Superseded(older.signature, winner)));
  }

  /**
   * Caller holds the lock. Any host failure surfaces as {@link HostAttachFailureException}; the previous layer is
   * restored when it was already detached.
   */
  private LayerHandle attach(ManagerSlot s, MapLayer layer, VisualizationSignature signature) {
    LayerHandle previous = s.current;
    boolean detached = false;
    try {
      if (previous != null) {
        host.removeLayer(previous.layer());
        detached = true;
      }
      host.addLayer(layer);
    } catch (RuntimeException ex) {
      if (detached) {
        try {
          host.addLayer(previous.layer());
        } catch (RuntimeException restoreFailure) {
          ex.addSuppressed(restoreFailure);
          s.current = null;
        }
      }
      throw new HostAttachFailureException(host.hostId(), layer.layerId(), ex);
    }
    s.current = new LayerHandle(layer, signature, clock.nowMillis());
    return s.current;
  }

  private ManagerSlot slot() {
    if (slot == null) {
      slot = new ManagerSlot();
    }
    return slot;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static void resolve(List<Resolution> resolutions) {
    for (Resolution resolution : resolutions) {
      resolution.future().complete(resolution.outcome());
    }
  }

  private static final class ManagerSlot {
    private LayerHandle current;
    private InFlight inFlight;
  }

  private static final class InFlight {
    private final long ticket;
    private final VisualizationSignature signature;
    private final long deadlineMillis;
    private final long startedNanos;
    private final CompletableFuture<LayerOutcome> outcome = new CompletableFuture<>();
    private ScheduledFuture<?> timeout;

    private InFlight(long ticket, VisualizationSignature signature, long deadlineMillis, long startedNanos) {
      this.ticket = ticket;
      this.signature = signature;
      this.deadlineMillis = deadlineMillis;
      this.startedNanos = startedNanos;
    }

    private void cancelTimeout() {
      if (timeout != null) {
        timeout.cancel(false);
      }
    }
  }

  private record Resolution(CompletableFuture<LayerOutcome> future, LayerOutcome outcome) {}
}
