package ca.gc.cra.geolayer.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors behind layer builds and build deadlines.
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool running layer synthesis.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each worker; {@code null} ignores failures
   * @return configured executor service
   */
  public static ExecutorService newBuildPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = threadFactory(orDefault(prefix, "geolayer-build"), false, handler);
    return new ThreadPoolExecutor(
        size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the single-thread scheduler that expires overdue builds.
   *
   * @param prefix thread-name prefix
   * @return daemon scheduler that drops cancelled deadlines immediately
   */
  public static ScheduledExecutorService newTimeoutScheduler(String prefix) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, threadFactory(orDefault(prefix, "geolayer-ttl"), true, null));
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  private static ThreadFactory threadFactory(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  private static String orDefault(String prefix, String fallback) {
    return prefix == null || prefix.isBlank() ? fallback : prefix;
  }
}
