package ca.gc.cra.geolayer.validation;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through configuration and the CLI.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Restrict enumerated options such as the metrics exporter to their allowed values.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Normalizes an enumerated option to lower case and checks it against the allowed set.
   *
   * @param name logical parameter name
   * @param value candidate option
   * @param allowed lower-case allowed values
   * @return normalized option
   * @throws IllegalArgumentException if the option is blank or not allowed
   */
  public static String requireOneOf(String name, String value, Set<String> allowed) {
    String normalized = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    if (!allowed.contains(normalized)) {
      throw new IllegalArgumentException(message(name, "must be one of " + allowed + " (was " + value + ")"));
    }
    return normalized;
  }

  /**
   * Ensures a value is printable ASCII and within a length limit.
   *
   * @param name logical parameter name
   * @param value candidate text
   * @param maxLength maximum accepted length
   * @return trimmed input
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "must be at most " + maxLength + " characters"));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c < 0x20 || c > 0x7e) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII only"));
      }
    }
    return trimmed;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
