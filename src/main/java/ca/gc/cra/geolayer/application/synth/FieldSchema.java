package ca.gc.cra.geolayer.application.synth;

import ca.gc.cra.geolayer.domain.layer.FieldDefinition;
import ca.gc.cra.geolayer.domain.layer.FieldType;
import ca.gc.cra.geolayer.domain.layer.LayerFeature;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the field list of a synthesized layer.
 *
 * <p>Essential fields come first in a fixed order; the remaining fields are inferred from the first feature's
 * attribute values. Known field names override inference.</p>
 *
 * @since 0.1.0
 */
final class FieldSchema {
  static final String OBJECT_ID = "OBJECTID";

  private static final Map<String, FieldType> OVERRIDES = Map.of(
      "rank", FieldType.INTEGER,
      "ID", FieldType.STRING,
      "zip_code", FieldType.STRING);

  private FieldSchema() {}

  static List<FieldDefinition> infer(LayerFeature first, String targetVariable) {
    Map<String, FieldType> fields = new LinkedHashMap<>();
    fields.put(OBJECT_ID, FieldType.OID);
    fields.put("area_name", FieldType.STRING);
    fields.put("value", FieldType.DOUBLE);
    fields.put("ID", FieldType.STRING);
    fields.putIfAbsent(targetVariable, FieldType.DOUBLE);

    for (Map.Entry<String, Object> entry : first.attributes().entrySet()) {
      String name = entry.getKey();
      if (!fields.containsKey(name)) {
        fields.put(name, OVERRIDES.getOrDefault(name, typeOf(entry.getValue())));
      }
    }
    List<FieldDefinition> definitions = new ArrayList<>(fields.size());
    fields.forEach((name, type) -> definitions.add(new FieldDefinition(name, type)));
    return definitions;
  }

  static FieldType typeOf(Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte || value instanceof java.math.BigInteger) {
      return FieldType.INTEGER;
    }
    if (value instanceof Number) {
      return FieldType.DOUBLE;
    }
    return FieldType.STRING;
  }
}
