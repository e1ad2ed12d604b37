package ca.gc.cra.geolayer.domain.layer;

/**
 * Attribute field types declared in a layer schema.
 *
 * @since 0.1.0
 */
public enum FieldType {
  /** Object identifier field. */
  OID,
  /** Free text. */
  STRING,
  /** Whole number. */
  INTEGER,
  /** Floating point number. */
  DOUBLE;
}
