package ca.gc.cra.geolayer.api;

import ca.gc.cra.geolayer.application.cache.LayerOutcome;
import ca.gc.cra.geolayer.application.join.BoundaryUnavailableException;
import ca.gc.cra.geolayer.application.join.JoinReport;
import ca.gc.cra.geolayer.application.pipeline.JoinRun;
import ca.gc.cra.geolayer.application.pipeline.VisualizationUseCase;
import ca.gc.cra.geolayer.config.CompositionRoot;
import ca.gc.cra.geolayer.config.ConfigMerger;
import ca.gc.cra.geolayer.config.DefaultsForMode;
import ca.gc.cra.geolayer.config.VisualizationConfig;
import ca.gc.cra.geolayer.config.YamlConfigLoader;
import ca.gc.cra.geolayer.domain.geo.AnalysisBatch;
import ca.gc.cra.geolayer.domain.layer.LayerBuildException;
import ca.gc.cra.geolayer.domain.layer.LayerDescriptor;
import ca.gc.cra.geolayer.domain.layer.LayerHandle;
import ca.gc.cra.geolayer.domain.layer.RenderRules;
import ca.gc.cra.geolayer.logging.LoggingConfigurator;
import ca.gc.cra.geolayer.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code render} command: joins analysis records with boundaries, builds the analysis layer through the host's
 * layer cache and prints a summary.
 */
public final class RenderCli {
  private static final Logger log = LoggerFactory.getLogger(RenderCli.class);
  private static final String COMMAND = "render";
  private static final String SUMMARY_USAGE =
      "usage: render boundaries=PATH records=PATH [rules=PATH] [config=PATH] [buildTtlMillis=MS] "
          + "[waitTimeoutMillis=MS] [buildWorkers=N] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      geolayer render pipeline

      Usage:
        render boundaries=./zip_boundaries.geojson records=./analysis.json [options]

      Required:
        boundaries=PATH            GeoJSON FeatureCollection of area boundaries
        records=PATH               Analysis output: {"targetVariable": ..., "records": [...]}

      Optional (validated):
        rules=PATH                 Render rules JSON (default: simple renderer on the target variable)
        config=PATH                YAML file with common/render sections
        hostId=NAME                Identifier of the headless map host
        buildTtlMillis=MS          Layer build deadline, 1..600000 (default 30000)
        waitTimeoutMillis=MS       How long to wait for the layer to attach (default 60000)
        buildWorkers=N             Synthesis worker threads, 1..64 (default 2)
        --dry-run                  Join and synthesize, print the plan, attach nothing
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private RenderCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for render CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, COMMAND);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    VisualizationConfig config;
    try {
      Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          COMMAND, yamlConfig, kv, DefaultsForMode.asFlatMap(COMMAND), log::warn));
      if (input.hasFlag("--dry-run")) {
        effective.put("dryRun", "true");
      }
      TelemetryConfigurator.configureMetrics(effective);
      config = VisualizationConfig.fromMap(effective);
      Paths.validateReadableFile("boundaries", config.boundaries());
      Paths.validateReadableFile("records", config.records());
      config.rules().ifPresent(rules -> Paths.validateReadableFile("rules", rules));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid render arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      return execute(root, config);
    } catch (BoundaryUnavailableException ex) {
      log.error("Boundary data unavailable: {}", ex.getMessage(), ex);
      return ex.getCause() instanceof IOException ? ExitCode.IO_ERROR : ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Render pipeline I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (LayerBuildException ex) {
      log.error("Analysis layer could not be rendered: {}", ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Render pipeline interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (ExecutionException | TimeoutException ex) {
      log.error("Render pipeline did not complete", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in render pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode execute(CompositionRoot root, VisualizationConfig config)
      throws IOException, InterruptedException, ExecutionException, TimeoutException {
    AnalysisBatch batch = root.analysisSource().read();
    RenderRules rules = root.renderRules().orElseGet(() -> RenderRules.simple(batch.targetVariable()));
    VisualizationUseCase useCase = root.visualizationUseCase();
    JoinRun run = useCase.prepare(batch, rules);

    if (config.dryRun()) {
      printDryRunPlan(config, run, useCase.preview(run));
      return ExitCode.SUCCESS;
    }

    log.info("Rendering {} records for {} (signature {})",
        batch.size(), batch.targetVariable(), run.signature().shortForm());
    LayerOutcome outcome = useCase.render(run).get(config.waitTimeout().toMillis(), TimeUnit.MILLISECONDS);
    LayerHandle handle = outcome.handleOrThrow();
    printSummary(root, run, handle);
    return ExitCode.SUCCESS;
  }

  private static void printDryRunPlan(VisualizationConfig config, JoinRun run, LayerDescriptor descriptor) {
    JoinReport report = run.report();
    CliPrinter.printLines(
        "Render dry-run: no layer will be attached.",
        " Boundaries        : " + config.boundaries(),
        " Records           : " + config.records(),
        " Target variable   : " + run.targetVariable(),
        " Signature         : " + run.signature().shortForm(),
        " Joined            : " + report.matched() + " of " + report.total() + " matched",
        " Unmatched samples : " + report.unmatchedSamples(),
        " Layer title       : " + descriptor.title(),
        " Geometry          : " + descriptor.geometryKind(),
        " Features          : " + descriptor.featureCount(),
        " Filtered          : " + descriptor.filteredCount(),
        " Re-run without --dry-run to attach the layer.");
  }

  private static void printSummary(CompositionRoot root, JoinRun run, LayerHandle handle) {
    LayerDescriptor descriptor = handle.layer().descriptor();
    JoinReport report = run.report();
    CliPrinter.printLines(
        "Rendered analysis layer " + handle.layerId(),
        " Host              : " + root.host().hostId() + " (" + root.host().layers().size() + " layer(s))",
        " Title             : " + descriptor.title(),
        " Signature         : " + handle.signature().shortForm(),
        " Joined            : " + report.matched() + " of " + report.total() + " matched",
        " Geometry          : " + descriptor.geometryKind(),
        " Features          : " + descriptor.featureCount(),
        " Missing geometry  : " + descriptor.missingGeometryCount(),
        " Missing score     : " + descriptor.missingScoreCount(),
        " Truncated         : " + descriptor.truncatedCount());
  }
}
