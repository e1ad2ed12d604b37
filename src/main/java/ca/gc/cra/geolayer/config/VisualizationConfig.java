package ca.gc.cra.geolayer.config;

import ca.gc.cra.geolayer.application.cache.CacheSettings;
import ca.gc.cra.geolayer.validation.Numbers;
import ca.gc.cra.geolayer.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validated settings of the {@code render} command.
 *
 * @param boundaries boundary GeoJSON file
 * @param records analysis records JSON file
 * @param rules optional render-rules JSON file; a simple renderer on the target variable is used otherwise
 * @param hostId identifier of the headless map host
 * @param buildTtl deadline of one layer build
 * @param waitTimeout how long the CLI waits for the layer to attach
 * @param buildWorkers synthesis worker threads
 * @param metricsExporter {@code otlp} or {@code none}
 * @param dryRun join and synthesize without attaching
 * @since 0.1.0
 */
public record VisualizationConfig(
    Path boundaries,
    Path records,
    Optional<Path> rules,
    String hostId,
    Duration buildTtl,
    Duration waitTimeout,
    int buildWorkers,
    String metricsExporter,
    boolean dryRun) {

  static final String DEFAULT_HOST_ID = "headless-map";
  static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofSeconds(60);
  static final int DEFAULT_BUILD_WORKERS = 2;
  private static final long MAX_BUILD_TTL_MILLIS = 600_000L;
  private static final long MAX_WAIT_TIMEOUT_MILLIS = 3_600_000L;
  private static final Set<String> EXPORTERS = Set.of("otlp", "none");

  /**
   * Validates and normalizes settings.
   */
  public VisualizationConfig {
    boundaries = normalizePath("boundaries", boundaries);
    records = normalizePath("records", records);
    rules = Objects.requireNonNullElse(rules, Optional.<Path>empty()).map(path -> normalizePath("rules", path));
    hostId = Strings.requireNonBlank("hostId", hostId);
    Objects.requireNonNull(buildTtl, "buildTtl");
    Numbers.requireRange("buildTtlMillis", buildTtl.toMillis(), 1, MAX_BUILD_TTL_MILLIS);
    Objects.requireNonNull(waitTimeout, "waitTimeout");
    Numbers.requireRange("waitTimeoutMillis", waitTimeout.toMillis(), 1, MAX_WAIT_TIMEOUT_MILLIS);
    Numbers.requireRange("buildWorkers", buildWorkers, 1, 64);
    metricsExporter = Strings.requireOneOf("metricsExporter", metricsExporter, EXPORTERS);
  }

  /**
   * Builds a config from a merged key/value map.
   *
   * @param options effective configuration
   * @return validated config
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static VisualizationConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path boundaries = parsePath("boundaries", options.get("boundaries"));
    Path records = parsePath("records", options.get("records"));
    Optional<Path> rules = optionalString(options.get("rules")).map(value -> parsePath("rules", value));
    String hostId = optionalString(options.get("hostId")).orElse(DEFAULT_HOST_ID);
    Duration buildTtl = parseMillis("buildTtlMillis", options.get("buildTtlMillis"), CacheSettings.DEFAULT_BUILD_TTL);
    Duration waitTimeout = parseMillis("waitTimeoutMillis", options.get("waitTimeoutMillis"), DEFAULT_WAIT_TIMEOUT);
    int workers = optionalString(options.get("buildWorkers"))
        .map(value -> (int) Numbers.requireRange("buildWorkers", Numbers.parseLong("buildWorkers", value), 1, 64))
        .orElse(DEFAULT_BUILD_WORKERS);
    String exporter = optionalString(options.get("metricsExporter")).orElse("otlp");
    boolean dryRun = parseBoolean(options.get("dryRun"), false);
    return new VisualizationConfig(
        boundaries, records, rules, hostId, buildTtl, waitTimeout, workers, exporter, dryRun);
  }

  /**
   * Returns the cache settings derived from this config.
   *
   * @return cache settings
   */
  public CacheSettings cacheSettings() {
    return new CacheSettings(buildTtl);
  }

  private static Duration parseMillis(String name, String raw, Duration fallback) {
    return optionalString(raw)
        .map(value -> Duration.ofMillis(Numbers.parseLong(name, value)))
        .orElse(fallback);
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static Path parsePath(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
    try {
      return Path.of(Strings.requireNonBlank(name, value));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }
}
