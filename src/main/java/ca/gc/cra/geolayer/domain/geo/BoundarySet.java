package ca.gc.cra.geolayer.domain.geo;

import java.util.List;
import java.util.Objects;

/**
 * Immutable boundary collection loaded once per session.
 *
 * <p>Instances are matched by reference when the join engine caches its normalized index; a reload
 * always produces a new instance.</p>
 *
 * @param source human-readable origin (file path or store name); never {@code null}
 * @param boundaries boundary features in source order; never {@code null}
 * @param loadedAtMillis epoch milliseconds when the collection was loaded
 * @since 0.1.0
 */
public record BoundarySet(String source, List<BoundaryGeometry> boundaries, long loadedAtMillis) {

  /**
   * Copies the boundary list.
   */
  public BoundarySet {
    Objects.requireNonNull(source, "source");
    boundaries = List.copyOf(Objects.requireNonNull(boundaries, "boundaries"));
  }

  /**
   * Returns the number of boundaries.
   *
   * @return boundary count
   */
  public int size() {
    return boundaries.size();
  }

  /**
   * Indicates whether the collection holds no boundaries.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return boundaries.isEmpty();
  }
}
