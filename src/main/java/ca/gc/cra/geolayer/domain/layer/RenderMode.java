package ca.gc.cra.geolayer.domain.layer;

import java.util.Locale;

/**
 * Geometry presentation requested by a render descriptor.
 *
 * @since 0.1.0
 */
public enum RenderMode {
  /** Render polygon boundaries as filled polygons. */
  POLYGON,

  /** Render each area as a point at its centroid. */
  CENTROID;

  /**
   * Parses a mode name, accepting {@code point} as an alias for {@link #CENTROID}.
   *
   * @param raw mode text; {@code null} or blank yields {@link #POLYGON}
   * @return parsed mode
   * @throws IllegalArgumentException when the text names no known mode
   */
  public static RenderMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return POLYGON;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "polygon" -> POLYGON;
      case "centroid", "point" -> CENTROID;
      default -> throw new IllegalArgumentException("Unknown render mode: " + raw);
    };
  }
}
