package ca.gc.cra.geolayer.domain.geo;

/**
 * Geometry shapes supported for boundary features and rendered layers.
 *
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and safe to share.
 *
 * @since 0.1.0
 */
public enum GeometryKind {
  /** Single coordinate position. */
  POINT,

  /** One or more coordinate rings; the first ring is the outer boundary. */
  POLYGON;
}
