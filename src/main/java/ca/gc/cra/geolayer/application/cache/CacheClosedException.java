package ca.gc.cra.geolayer.application.cache;

import ca.gc.cra.geolayer.domain.layer.LayerBuildException;

/**
 * Delivered to waiters of a build that was outstanding when the cache was cleaned up.
 *
 * @since 0.1.0
 */
public final class CacheClosedException extends LayerBuildException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param hostId host whose cache was cleaned up
   */
  public CacheClosedException(String hostId) {
    super("layer cache for host " + hostId + " was cleaned up");
  }
}
