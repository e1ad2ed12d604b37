package ca.gc.cra.geolayer.application.port;

/**
 * <strong>What:</strong> Domain port supplying wall-clock timestamps to layer construction and caching.
 * <p><strong>Why:</strong> Build deadlines, layer ids, and attach timestamps need a time source tests can pin.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads occur on caller, build, and
 * timeout threads.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.geolayer.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
