package ca.gc.cra.geolayer.application.port;

import ca.gc.cra.geolayer.application.join.BoundaryUnavailableException;
import ca.gc.cra.geolayer.domain.geo.BoundarySet;

/**
 * <strong>What:</strong> Domain port supplying the session's boundary geometry collection.
 * <p><strong>Why:</strong> Boundary geometry is sourced independently of analysis output and is loaded once per
 * session; joins must not trigger repeated loads.</p>
 * <p><strong>Role:</strong> Leaf port implemented by adapters such as {@code GeoJsonBoundaryStore}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the boundary collection at most once until {@link #reload()} is requested.</li>
 *   <li>Remember a load failure and report it on every subsequent call until a reload succeeds.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent {@link #boundaries()} calls and
 * hand out the same immutable {@link BoundarySet} to every caller.</p>
 *
 * @since 0.1.0
 */
public interface BoundaryStore {
  /**
   * Returns the loaded boundary collection, loading it on first use.
   *
   * @return shared immutable boundary collection
   * @throws BoundaryUnavailableException when the collection failed to load
   */
  BoundarySet boundaries();

  /**
   * Discards the cached collection (or remembered failure) and loads again.
   *
   * @return freshly loaded boundary collection
   * @throws BoundaryUnavailableException when the reload fails
   */
  BoundarySet reload();
}
