package ca.gc.cra.geolayer.domain.layer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Externally supplied render descriptor (thematic breaks, color ramp, point-vs-polygon mode).
 * <p><strong>Why:</strong> The layer synthesizer needs the renderer's field names and geometry mode; everything
 * else travels through untouched and contributes to the visualization signature.</p>
 * <p><strong>Role:</strong> Domain value consumed by the synthesizer; opaque to the layer cache.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param rendererType renderer family (for example {@code class-breaks}); never {@code null}
 * @param field primary renderer field; may be {@code null}
 * @param visualVariableFields fields referenced by visual variables; never {@code null}
 * @param classBreaks thematic break values in ascending order; never {@code null}
 * @param colors color ramp entries; never {@code null}
 * @param mode geometry presentation; never {@code null}
 * @param descriptor complete parsed descriptor including keys the synthesizer does not read; never {@code null}
 * @since 0.1.0
 */
public record RenderRules(
    String rendererType,
    String field,
    List<String> visualVariableFields,
    List<Double> classBreaks,
    List<String> colors,
    RenderMode mode,
    Map<String, Object> descriptor) {

  /**
   * Copies collections and applies defaults.
   */
  public RenderRules {
    rendererType = rendererType == null || rendererType.isBlank() ? "simple" : rendererType.trim();
    field = field == null || field.isBlank() ? null : field.trim();
    visualVariableFields = List.copyOf(Objects.requireNonNullElse(visualVariableFields, List.of()));
    classBreaks = List.copyOf(Objects.requireNonNullElse(classBreaks, List.of()));
    colors = List.copyOf(Objects.requireNonNullElse(colors, List.of()));
    mode = Objects.requireNonNullElse(mode, RenderMode.POLYGON);
    descriptor = freezeMap(Objects.requireNonNullElse(descriptor, Map.of()));
  }

  /**
   * Creates rules without a raw descriptor.
   *
   * @param rendererType renderer family
   * @param field primary renderer field
   * @param visualVariableFields fields referenced by visual variables
   * @param classBreaks thematic break values
   * @param colors color ramp entries
   * @param mode geometry presentation
   */
  public RenderRules(
      String rendererType,
      String field,
      List<String> visualVariableFields,
      List<Double> classBreaks,
      List<String> colors,
      RenderMode mode) {
    this(rendererType, field, visualVariableFields, classBreaks, colors, mode, Map.of());
  }

  /**
   * Returns a simple polygon renderer keyed on {@code field}.
   *
   * @param field renderer field
   * @return default rules
   */
  public static RenderRules simple(String field) {
    return new RenderRules("simple", field, List.of(), List.of(), List.of(), RenderMode.POLYGON);
  }

  /**
   * Returns a copy using the supplied geometry mode.
   *
   * @param newMode geometry presentation
   * @return updated rules
   */
  public RenderRules withMode(RenderMode newMode) {
    return new RenderRules(rendererType, field, visualVariableFields, classBreaks, colors, newMode, descriptor);
  }

  /**
   * Returns every field the renderer reads, primary field first.
   *
   * @return ordered field names
   */
  public Set<String> rendererFields() {
    Set<String> fields = new LinkedHashSet<>();
    if (field != null) {
      fields.add(field);
    }
    fields.addAll(visualVariableFields);
    return fields;
  }

  /**
   * Renders a deterministic canonical form used when computing visualization signatures.
   *
   * <p>Every string is length-prefixed and descriptor keys are sorted, so distinct descriptors never share a
   * fingerprint.</p>
   *
   * @return canonical text; equal rules produce equal fingerprints
   */
  public String fingerprint() {
    StringBuilder sb = new StringBuilder(128);
    sb.append("type=");
    appendCanonical(sb, rendererType);
    sb.append(";field=");
    appendCanonical(sb, field);
    sb.append(";vv=");
    appendCanonical(sb, visualVariableFields);
    sb.append(";breaks=");
    appendCanonical(sb, classBreaks);
    sb.append(";colors=");
    appendCanonical(sb, colors);
    sb.append(";mode=").append(mode.name());
    sb.append(";descriptor=");
    appendCanonical(sb, descriptor);
    return sb.toString();
  }

  private static void appendCanonical(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append('~');
    } else if (value instanceof Map<?, ?> map) {
      Map<String, Object> sorted = new TreeMap<>();
      map.forEach((key, item) -> sorted.put(String.valueOf(key), item));
      sb.append('{').append(sorted.size()).append('|');
      sorted.forEach((key, item) -> {
        appendCanonical(sb, key);
        sb.append('=');
        appendCanonical(sb, item);
      });
      sb.append('}');
    } else if (value instanceof List<?> list) {
      sb.append('[').append(list.size()).append('|');
      for (Object item : list) {
        appendCanonical(sb, item);
      }
      sb.append(']');
    } else if (value instanceof Number number) {
      double d = number.doubleValue();
      boolean integral = d == Math.rint(d) && Math.abs(d) < 1e15;
      sb.append('#').append(integral ? Long.toString((long) d) : Double.toString(d)).append(';');
    } else if (value instanceof Boolean bool) {
      sb.append(bool ? "T" : "F");
    } else {
      String text = value.toString();
      sb.append('\'').append(text.length()).append(':').append(text);
    }
  }

  private static Map<String, Object> freezeMap(Map<?, ?> source) {
    if (source.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    source.forEach((key, value) -> {
      if (key != null) {
        copy.put(key.toString(), freeze(value));
      }
    });
    return Collections.unmodifiableMap(copy);
  }

  private static Object freeze(Object value) {
    if (value instanceof Map<?, ?> map) {
      return freezeMap(map);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(freeze(item));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
