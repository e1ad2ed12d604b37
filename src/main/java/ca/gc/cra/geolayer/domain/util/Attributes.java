package ca.gc.cra.geolayer.domain.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Helpers for the loosely typed attribute maps carried by analysis rows and boundary features.
 * <p><strong>Why:</strong> Producer rows and GeoJSON properties arrive as string-keyed maps of JSON scalars;
 * join and synthesis code needs consistent copy, lookup, and coercion rules.</p>
 * <p><strong>Role:</strong> Domain support functions reused by the join engine and layer synthesizer.</p>
 * <p><strong>Thread-safety:</strong> Stateless static helpers; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Lookups are O(1) map reads; copies are O(n) in the entry count.</p>
 * <p><strong>Observability:</strong> No direct instrumentation.</p>
 *
 * @since 0.1.0
 */
public final class Attributes {
  /** Key under which producers nest per-area properties. */
  public static final String PROPERTIES = "properties";

  private Attributes() {}

  /**
   * Returns an insertion-ordered, unmodifiable copy that omits {@code null} keys and values.
   *
   * @param source attribute map; {@code null} yields an empty map
   * @return unmodifiable copy; nested maps are copied recursively
   */
  public static Map<String, Object> copyOf(Map<String, ?> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        value = copyOf(asStringKeyed(nested));
      }
      copy.put(entry.getKey(), value);
    }
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Reads a top-level attribute, falling back to the nested {@code properties} map.
   *
   * @param attributes attribute map; may be {@code null}
   * @param key attribute name
   * @return value when present at either level
   */
  public static Optional<Object> lookup(Map<String, ?> attributes, String key) {
    if (attributes == null || key == null) {
      return Optional.empty();
    }
    Object direct = attributes.get(key);
    if (direct != null) {
      return Optional.of(direct);
    }
    return nested(attributes, key);
  }

  /**
   * Reads an attribute from the nested {@code properties} map only.
   *
   * @param attributes attribute map; may be {@code null}
   * @param key attribute name
   * @return value when present in {@code properties}
   */
  public static Optional<Object> nested(Map<String, ?> attributes, String key) {
    if (attributes == null || key == null) {
      return Optional.empty();
    }
    if (attributes.get(PROPERTIES) instanceof Map<?, ?> props) {
      return Optional.ofNullable(props.get(key));
    }
    return Optional.empty();
  }

  /**
   * Renders a scalar attribute as trimmed text.
   *
   * @param value attribute value; may be {@code null}
   * @return non-blank text, or empty for {@code null}, blank strings, and non-scalar values
   */
  public static Optional<String> text(Object value) {
    if (value == null || value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      return Optional.empty();
    }
    String text;
    if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
      text = Long.toString(d.longValue());
    } else {
      text = value.toString().trim();
    }
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  /**
   * Coerces a scalar attribute into a finite double.
   *
   * @param value attribute value; numbers and numeric strings are accepted
   * @return numeric value, or empty when absent, non-numeric, NaN, or infinite
   */
  public static OptionalDouble number(Object value) {
    double parsed;
    if (value instanceof Number n) {
      parsed = n.doubleValue();
    } else if (value instanceof String s && !s.isBlank()) {
      try {
        parsed = Double.parseDouble(s.trim());
      } catch (NumberFormatException ex) {
        return OptionalDouble.empty();
      }
    } else {
      return OptionalDouble.empty();
    }
    if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(parsed);
  }

  private static Map<String, Object> asStringKeyed(Map<?, ?> raw) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (entry.getKey() instanceof String key) {
        map.put(key, entry.getValue());
      }
    }
    return map;
  }
}
