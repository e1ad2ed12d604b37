package ca.gc.cra.geolayer.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RenderCliTest {
  private static final String BOUNDARIES = """
      {"type": "FeatureCollection", "features": [
        {"type": "Feature", "properties": {"ID": "08837", "DESCRIPTION": "08837 (Edison)"},
         "geometry": {"type": "Polygon", "coordinates": [[[0, 0], [1, 0], [1, 1], [0, 0]]]}},
        {"type": "Feature", "properties": {"ID": "10001"},
         "geometry": {"type": "Polygon", "coordinates": [[[2, 2], [3, 2], [3, 3], [2, 2]]]}}
      ]}
      """;
  private static final String RECORDS = """
      {"targetVariable": "income", "records": [
        {"area_id": "8837", "income": 71000},
        {"area_id": "10001", "income": 52000},
        {"area_id": "99999", "income": 1}
      ]}
      """;

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private String originalExporter;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RenderCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    originalExporter = System.getProperty("otel.metrics.exporter");
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
    if (originalExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", originalExporter);
    }
  }

  private String[] args(Path boundaries, Path records, String... extra) {
    String[] base = {
        "boundaries=" + boundaries, "records=" + records, "metricsExporter=none"};
    String[] all = new String[base.length + extra.length];
    System.arraycopy(base, 0, all, 0, base.length);
    System.arraycopy(extra, 0, all, base.length, extra.length);
    return all;
  }

  @Test
  void missingRecordsReturnsUsageAndInvalidArgs() {
    ExitCode code = RenderCli.run(new String[] {"boundaries=" + tempDir.resolve("zips.geojson")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: render"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("records is required"));
    assertTrue(logged);
  }

  @Test
  void nonexistentInputFileReturnsInvalidArgs() throws IOException {
    Path boundaries = Files.writeString(tempDir.resolve("zips.geojson"), BOUNDARIES);

    ExitCode code = RenderCli.run(args(boundaries, tempDir.resolve("missing.json")));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: render"));
  }

  @Test
  void dryRunPrintsPlanWithoutAttaching() throws IOException {
    Path boundaries = Files.writeString(tempDir.resolve("zips.geojson"), BOUNDARIES);
    Path records = Files.writeString(tempDir.resolve("analysis.json"), RECORDS);

    ExitCode code = RenderCli.run(args(boundaries, records, "--dry-run"));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Render dry-run: no layer will be attached."));
    assertTrue(output.contains("Joined            : 2 of 3 matched"));
    assertTrue(output.contains("Features          : 2"));
    assertFalse(output.contains("Rendered analysis layer"));
  }

  @Test
  void renderAttachesLayerAndPrintsSummary() throws IOException {
    Path boundaries = Files.writeString(tempDir.resolve("zips.geojson"), BOUNDARIES);
    Path records = Files.writeString(tempDir.resolve("analysis.json"), RECORDS);
    Path rules = Files.writeString(tempDir.resolve("rules.json"), "{\"field\": \"income\", \"mode\": \"centroid\"}");

    ExitCode code = RenderCli.run(args(boundaries, records, "rules=" + rules, "hostId=test-map"));

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Rendered analysis layer analysis-layer-"));
    assertTrue(output.contains("Host              : test-map (1 layer(s))"));
    assertTrue(output.contains("Geometry          : POINT"));
    assertTrue(output.contains("Missing geometry  : 1"));
    assertEquals("none", System.getProperty("otel.metrics.exporter"));
  }

  @Test
  void yamlConfigSuppliesInputs() throws IOException {
    Path boundaries = Files.writeString(tempDir.resolve("zips.geojson"), BOUNDARIES);
    Path records = Files.writeString(tempDir.resolve("analysis.json"), RECORDS);
    Path yaml = Files.writeString(tempDir.resolve("geolayer.yaml"), """
        common:
          metricsExporter: none
        render:
          boundaries: %s
          records: %s
        """.formatted(boundaries, records));

    ExitCode code = RenderCli.run(new String[] {"config=" + yaml, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Render dry-run"));
  }

  @Test
  void emptyBoundaryFileReturnsConfigError() throws IOException {
    Path boundaries = Files.writeString(tempDir.resolve("zips.geojson"),
        "{\"type\": \"FeatureCollection\", \"features\": []}");
    Path records = Files.writeString(tempDir.resolve("analysis.json"), RECORDS);

    ExitCode code = RenderCli.run(args(boundaries, records));

    assertEquals(ExitCode.CONFIG_ERROR, code);
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Boundary data unavailable"));
    assertTrue(logged);
  }

  @Test
  void unrenderableBatchReturnsRuntimeFailure() throws IOException {
    Path boundaries = Files.writeString(tempDir.resolve("zips.geojson"), BOUNDARIES);
    Path records = Files.writeString(tempDir.resolve("analysis.json"), """
        {"targetVariable": "income", "records": [{"area_id": "55555", "income": 3}]}
        """);

    ExitCode code = RenderCli.run(args(boundaries, records));

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
  }

  @Test
  void malformedAnalysisDocumentReturnsIoError() throws IOException {
    Path boundaries = Files.writeString(tempDir.resolve("zips.geojson"), BOUNDARIES);
    Path records = Files.writeString(tempDir.resolve("analysis.json"), "{\"records\": []}");

    assertEquals(ExitCode.IO_ERROR, RenderCli.run(args(boundaries, records)));
  }
}
