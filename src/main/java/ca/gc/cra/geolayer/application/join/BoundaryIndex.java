package ca.gc.cra.geolayer.application.join;

import ca.gc.cra.geolayer.domain.geo.BoundaryGeometry;
import ca.gc.cra.geolayer.domain.geo.BoundarySet;
import ca.gc.cra.geolayer.domain.util.Attributes;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized-key lookup over a boundary collection.
 *
 * <p>Keys are inserted in three passes so that canonical identifiers win over alternate attribute keys,
 * which in turn win over codes parsed from labels. Within a pass the first boundary claims a key.</p>
 *
 * <p><strong>Thread-safety:</strong> Immutable after construction; shared read-only across join runs.</p>
 *
 * @since 0.1.0
 */
public final class BoundaryIndex {
  private static final List<String> ALTERNATE_KEYS = List.of("ID", "ZIP", "ZIPCODE", "OBJECTID");

  private final BoundarySet source;
  private final Map<String, BoundaryGeometry> byKey;

  private BoundaryIndex(BoundarySet source, Map<String, BoundaryGeometry> byKey) {
    this.source = source;
    this.byKey = Map.copyOf(byKey);
  }

  /**
   * Builds the index for a boundary collection.
   *
   * @param boundaries loaded boundary collection; never {@code null}
   * @return immutable index
   */
  public static BoundaryIndex build(BoundarySet boundaries) {
    Objects.requireNonNull(boundaries, "boundaries");
    Map<String, BoundaryGeometry> keys = new HashMap<>(boundaries.size() * 4);
    for (BoundaryGeometry boundary : boundaries.boundaries()) {
      register(keys, boundary.areaId(), boundary);
    }
    for (BoundaryGeometry boundary : boundaries.boundaries()) {
      for (String attribute : ALTERNATE_KEYS) {
        Attributes.lookup(boundary.attributes(), attribute)
            .flatMap(Attributes::text)
            .ifPresent(value -> register(keys, value, boundary));
      }
    }
    for (BoundaryGeometry boundary : boundaries.boundaries()) {
      boundary.description()
          .flatMap(AreaCodes::leadingCode)
          .ifPresent(code -> keys.putIfAbsent(code, boundary));
    }
    return new BoundaryIndex(boundaries, keys);
  }

  private static void register(Map<String, BoundaryGeometry> keys, String raw, BoundaryGeometry boundary) {
    String key = raw.trim();
    if (key.isEmpty()) {
      return;
    }
    keys.putIfAbsent(key, boundary);
    AreaCodes.zeroPad(key).ifPresent(padded -> keys.putIfAbsent(padded, boundary));
  }

  /**
   * Looks up a boundary by normalized key.
   *
   * @param key candidate key
   * @return matching boundary
   */
  public Optional<BoundaryGeometry> find(String key) {
    if (key == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byKey.get(key));
  }

  /**
   * Returns the collection this index was built from.
   *
   * @return indexed boundary collection
   */
  public BoundarySet source() {
    return source;
  }

  /**
   * Returns the number of distinct keys.
   *
   * @return key count
   */
  public int keyCount() {
    return byKey.size();
  }
}
