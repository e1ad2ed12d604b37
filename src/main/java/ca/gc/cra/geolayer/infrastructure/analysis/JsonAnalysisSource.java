package ca.gc.cra.geolayer.infrastructure.analysis;

import ca.gc.cra.geolayer.application.port.AnalysisSource;
import ca.gc.cra.geolayer.domain.geo.AnalysisBatch;
import ca.gc.cra.geolayer.domain.geo.AnalysisRecord;
import ca.gc.cra.geolayer.domain.util.Attributes;
import ca.gc.cra.geolayer.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AnalysisSource} reading the analysis producer's JSON output.
 *
 * <p>Expected shape: {@code {"targetVariable": "...", "records": [{...}, ...]}}. Each record keeps every field
 * it carries; the score is read from the target variable, then {@code value}, then
 * {@code properties.<targetVariable>}.</p>
 *
 * @since 0.1.0
 */
public final class JsonAnalysisSource implements AnalysisSource {
  private static final Logger log = LoggerFactory.getLogger(JsonAnalysisSource.class);

  private final Path file;
  private final JsonSupport json;

  /**
   * Creates a source for a producer output file.
   *
   * @param file JSON path
   * @param json JSON parser
   */
  public JsonAnalysisSource(Path file, JsonSupport json) {
    this.file = Objects.requireNonNull(file, "file");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public AnalysisBatch read() throws IOException {
    Map<String, Object> root = JsonSupport.requireObject(json.parse(file), "analysis document");
    String targetVariable = Attributes.text(root.get("targetVariable"))
        .orElseThrow(() -> new IOException("analysis document " + file + " is missing targetVariable"));
    List<Object> rows = JsonSupport.requireArray(root.get("records"), "records");
    List<AnalysisRecord> records = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      Map<String, Object> row = JsonSupport.requireObject(rows.get(i), "records[" + i + "]");
      records.add(AnalysisRecord.fromRow(row, targetVariable));
    }
    log.info("Read {} analysis records for {} from {}", records.size(), targetVariable, file);
    return new AnalysisBatch(targetVariable, records);
  }
}
