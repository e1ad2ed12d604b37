package ca.gc.cra.geolayer.application.join;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered identifier normalization policies for the join engine.
 *
 * <p>Order is priority: explicit id fields as supplied, then their zero-padded forms, then codes parsed
 * from descriptive labels, then the raw {@code area_id} placeholder. Support for a new identifier format
 * is added here without touching the join loop.</p>
 *
 * @since 0.1.0
 */
public final class IdentifierStrategies {

  private IdentifierStrategies() {}

  /**
   * Returns the default strategy list.
   *
   * @return immutable ordered strategies
   */
  public static List<IdentifierStrategy> defaults() {
    List<IdentifierStrategy> explicit = List.of(
        IdentifierStrategy.field("ZIP"),
        IdentifierStrategy.field("ZIPCODE"),
        IdentifierStrategy.field("zip_code"),
        IdentifierStrategy.nested("ID"),
        IdentifierStrategy.nested("id"),
        IdentifierStrategy.topLevel("ID"),
        IdentifierStrategy.topLevel("id"),
        IdentifierStrategy.areaId());

    List<IdentifierStrategy> ordered = new ArrayList<>(explicit);
    for (IdentifierStrategy strategy : explicit) {
      ordered.add(strategy.zeroPadded());
    }
    ordered.add(IdentifierStrategy.labelCode("DESCRIPTION"));
    ordered.add(IdentifierStrategy.labelCode("area_name"));
    ordered.add(IdentifierStrategy.rawAreaId());
    return List.copyOf(ordered);
  }
}
