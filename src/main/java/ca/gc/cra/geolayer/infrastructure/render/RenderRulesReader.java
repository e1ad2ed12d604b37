package ca.gc.cra.geolayer.infrastructure.render;

import ca.gc.cra.geolayer.domain.layer.RenderMode;
import ca.gc.cra.geolayer.domain.layer.RenderRules;
import ca.gc.cra.geolayer.domain.util.Attributes;
import ca.gc.cra.geolayer.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.StringJoiner;

/**
 * Reads render descriptors from JSON.
 *
 * <p>Recognized keys: {@code type} (or {@code rendererType}), {@code field}, {@code visualVariables} (objects
 * with a {@code field}) or {@code visualVariableFields} (strings), {@code classBreaks} (numbers),
 * {@code colors} (CSS strings or {@code [r, g, b(, a)]} arrays) and {@code mode} ({@code polygon}, {@code centroid}
 * or {@code point}). The whole descriptor, unknown keys included, is kept on the rules and takes part in their
 * fingerprint.</p>
 *
 * @since 0.1.0
 */
public final class RenderRulesReader {
  private final JsonSupport json;

  /**
   * Creates a reader.
   *
   * @param json JSON parser
   */
  public RenderRulesReader(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Reads a render descriptor file.
   *
   * @param file JSON path
   * @return render rules
   * @throws IOException when the file cannot be read or is not a JSON object
   * @throws IllegalArgumentException when a value is invalid, such as an unknown mode
   */
  public RenderRules read(Path file) throws IOException {
    return fromMap(JsonSupport.requireObject(json.parse(file), "render rules"));
  }

  /**
   * Builds render rules from a parsed descriptor.
   *
   * @param descriptor parsed JSON object
   * @return render rules
   * @throws IllegalArgumentException when a value is invalid
   */
  public static RenderRules fromMap(Map<String, ?> descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    String type = Attributes.text(descriptor.get("type"))
        .or(() -> Attributes.text(descriptor.get("rendererType")))
        .orElse(null);
    String field = Attributes.text(descriptor.get("field")).orElse(null);

    List<String> visualFields = new ArrayList<>();
    if (descriptor.get("visualVariables") instanceof List<?> variables) {
      for (Object variable : variables) {
        if (variable instanceof Map<?, ?> map) {
          Attributes.text(map.get("field")).ifPresent(visualFields::add);
        }
      }
    }
    if (descriptor.get("visualVariableFields") instanceof List<?> names) {
      for (Object name : names) {
        Attributes.text(name).ifPresent(visualFields::add);
      }
    }

    List<Double> breaks = new ArrayList<>();
    if (descriptor.get("classBreaks") instanceof List<?> values) {
      for (Object value : values) {
        OptionalDouble number = Attributes.number(value);
        if (number.isEmpty()) {
          throw new IllegalArgumentException("classBreaks must contain numbers (was " + value + ")");
        }
        breaks.add(number.getAsDouble());
      }
    }

    List<String> colors = new ArrayList<>();
    if (descriptor.get("colors") instanceof List<?> values) {
      for (Object value : values) {
        if (value instanceof List<?> components) {
          colors.add(colorArray(components));
        } else {
          Attributes.text(value).ifPresent(colors::add);
        }
      }
    }

    RenderMode mode = RenderMode.parse(Attributes.text(descriptor.get("mode")).orElse(null));
    return new RenderRules(type, field, visualFields, breaks, colors, mode, new LinkedHashMap<>(descriptor));
  }

  private static String colorArray(List<?> components) {
    if (components.size() < 3 || components.size() > 4) {
      throw new IllegalArgumentException("color arrays must hold 3 or 4 components (was " + components + ")");
    }
    StringJoiner joiner = new StringJoiner(",", "[", "]");
    for (Object component : components) {
      OptionalDouble number = Attributes.number(component);
      if (number.isEmpty()) {
        throw new IllegalArgumentException("color components must be numbers (was " + component + ")");
      }
      joiner.add(Attributes.text(number.getAsDouble()).orElseThrow());
    }
    return joiner.toString();
  }
}
