package ca.gc.cra.geolayer.domain.layer;

import java.util.Objects;

/**
 * Deterministic fingerprint of a visualization request, used as the layer cache key.
 *
 * <p>Equal signatures denote an identical requested result. Values are opaque to the cache.</p>
 *
 * @param value canonical signature text; never blank
 * @since 0.1.0
 */
public record VisualizationSignature(String value) {

  /**
   * Validates the signature text.
   */
  public VisualizationSignature {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("signature must not be blank");
    }
  }

  /**
   * Wraps raw signature text.
   *
   * @param value signature text
   * @return signature
   */
  public static VisualizationSignature of(String value) {
    return new VisualizationSignature(value);
  }

  /**
   * Returns a shortened form suitable for log lines.
   *
   * @return first twelve characters of the signature
   */
  public String shortForm() {
    return value.length() <= 12 ? value : value.substring(0, 12);
  }

  @Override
  public String toString() {
    return value;
  }
}
