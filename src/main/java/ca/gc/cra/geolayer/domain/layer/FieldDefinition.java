package ca.gc.cra.geolayer.domain.layer;

import java.util.Objects;

/**
 * Named, typed attribute field of a rendered layer.
 *
 * @param name field name; never blank
 * @param type field type; never {@code null}
 * @since 0.1.0
 */
public record FieldDefinition(String name, FieldType type) {

  /**
   * Validates the field name and type.
   */
  public FieldDefinition {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("field name must not be blank");
    }
    type = Objects.requireNonNull(type, "type");
  }
}
