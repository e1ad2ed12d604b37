package ca.gc.cra.geolayer.config;

import ca.gc.cra.geolayer.application.cache.CacheSettings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each geolayer CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param command target CLI command ({@code render})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "render" -> buildRenderDefaults();
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRenderDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("boundaries", "");
    map.put("records", "");
    map.put("rules", "");
    map.put("hostId", VisualizationConfig.DEFAULT_HOST_ID);
    map.put("buildTtlMillis", Long.toString(CacheSettings.DEFAULT_BUILD_TTL.toMillis()));
    map.put("waitTimeoutMillis", Long.toString(VisualizationConfig.DEFAULT_WAIT_TIMEOUT.toMillis()));
    map.put("buildWorkers", Integer.toString(VisualizationConfig.DEFAULT_BUILD_WORKERS));
    map.put("dryRun", "false");
    return map;
  }
}
