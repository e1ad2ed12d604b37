package ca.gc.cra.geolayer.application.cache;

import ca.gc.cra.geolayer.application.port.ClockPort;
import ca.gc.cra.geolayer.application.port.MapHost;
import ca.gc.cra.geolayer.application.port.MetricsPort;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Explicit per-host handle owning that host's {@link VisualizationLayerCache}.
 *
 * <p>Whoever manages the host's lifetime opens a session, passes it to the code that renders layers, and
 * closes it when the host is disposed. The cache is created on first use.</p>
 *
 * @since 0.1.0
 */
public final class HostSession implements AutoCloseable {
  private final MapHost host;
  private final CacheSettings settings;
  private final ScheduledExecutorService timeoutScheduler;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private VisualizationLayerCache cache; // guarded by this
  private boolean closed; // guarded by this

  private HostSession(
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
   * Opens a session for a host.
   *
   * @param host map host
   * @param settings cache tunables
   * @param timeoutScheduler scheduler for build deadlines; owned by the caller
   * @param clock clock
   * @param metrics metrics sink
   * @return open session
   */
  public static HostSession open(
      MapHost host,
      CacheSettings settings,
      ScheduledExecutorService timeoutScheduler,
      ClockPort clock,
      MetricsPort metrics) {
    return new HostSession(host, settings, timeoutScheduler, clock, metrics);
  }

  /**
   * Returns the host's cache, creating it on first use.
   *
   * @return layer cache
   * @throws IllegalStateException after {@link #close()}
   */
  public synchronized VisualizationLayerCache cache() {
    if (closed) {
      throw new IllegalStateException("host session for " + host.hostId() + " is closed");
    }
    if (cache == null) {
      cache = new VisualizationLayerCache(host, settings, timeoutScheduler, clock, metrics);
    }
    return cache;
  }

  /**
   * Returns the host.
   *
   * @return map host
   */
  public MapHost host() {
    return host;
  }

  /**
   * Indicates whether the session has been closed.
   *
   * @return {@code true} after {@link #close()}
   */
  public synchronized boolean isClosed() {
    return closed;
  }

  /**
   * Cleans up the cache, detaching its layer. Idempotent.
   */
  @Override
  public void close() {
    VisualizationLayerCache toClean;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      toClean = cache;
      cache = null;
    }
    if (toClean != null) {
      toClean.cleanup();
    }
  }
}
