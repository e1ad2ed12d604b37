package ca.gc.cra.geolayer.api;

import java.util.Map;

final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument so it is not treated as a setting.
   *
   * @param args mutable argument map
   * @return trimmed config path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }
}
