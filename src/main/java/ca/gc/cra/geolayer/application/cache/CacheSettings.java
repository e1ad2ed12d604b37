package ca.gc.cra.geolayer.application.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of a {@link VisualizationLayerCache}.
 *
 * @param buildTtl maximum time a build may stay in flight before its waiters are released
 * @since 0.1.0
 */
public record CacheSettings(Duration buildTtl) {

  /** Default build TTL. */
  public static final Duration DEFAULT_BUILD_TTL = Duration.ofSeconds(30);

  /**
   * Validates the TTL.
   */
  public CacheSettings {
    Objects.requireNonNull(buildTtl, "buildTtl");
    if (buildTtl.isNegative() || buildTtl.isZero()) {
      throw new IllegalArgumentException("buildTtl must be positive");
    }
  }

  /**
   * Returns the default settings.
   *
   * @return settings with a 30 second TTL
   */
  public static CacheSettings defaults() {
    return new CacheSettings(DEFAULT_BUILD_TTL);
  }
}
