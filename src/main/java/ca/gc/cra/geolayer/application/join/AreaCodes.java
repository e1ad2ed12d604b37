package ca.gc.cra.geolayer.application.join;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing helpers for five-digit area codes and {@code "08837 (Edison)"} style labels.
 *
 * @since 0.1.0
 */
public final class AreaCodes {
  /** Width of canonical area codes. */
  public static final int CODE_WIDTH = 5;

  private static final Pattern LEADING_CODE = Pattern.compile("^(\\d{5})");
  private static final Pattern CODE_AND_CITY = Pattern.compile("^(\\d{5})\\s*\\(([^)]+)\\)");
  private static final Pattern DIGITS = Pattern.compile("^\\d+$");

  private AreaCodes() {}

  /**
   * Left-pads an all-digit identifier with zeros to {@link #CODE_WIDTH} characters.
   *
   * @param raw candidate identifier; may be {@code null}
   * @return padded code, or empty when the value is not a short run of digits
   */
  public static Optional<String> zeroPad(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty() || trimmed.length() >= CODE_WIDTH || !DIGITS.matcher(trimmed).matches()) {
      return Optional.empty();
    }
    return Optional.of("0".repeat(CODE_WIDTH - trimmed.length()) + trimmed);
  }

  /**
   * Extracts a leading five-digit code from a descriptive label.
   *
   * @param label label such as {@code "08837 (Edison)"}; may be {@code null}
   * @return leading code when present
   */
  public static Optional<String> leadingCode(String label) {
    if (label == null) {
      return Optional.empty();
    }
    Matcher matcher = LEADING_CODE.matcher(label.trim());
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }

  /**
   * Splits a {@code "CODE (City)"} label into its parts.
   *
   * @param label descriptive label; may be {@code null}
   * @return code and city when the label follows the convention
   */
  public static Optional<CodeAndCity> parseLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    Matcher matcher = CODE_AND_CITY.matcher(label.trim());
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(new CodeAndCity(matcher.group(1), matcher.group(2).trim()));
  }

  /**
   * Parsed {@code "CODE (City)"} label.
   *
   * @param code five-digit area code
   * @param city city name
   */
  public record CodeAndCity(String code, String city) {
    /**
     * Formats the pair back into its label form.
     *
     * @return {@code "CODE (City)"}
     */
    public String label() {
      return code + " (" + city + ")";
    }
  }
}
