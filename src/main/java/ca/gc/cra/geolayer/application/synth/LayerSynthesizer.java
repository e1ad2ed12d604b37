package ca.gc.cra.geolayer.application.synth;

import ca.gc.cra.geolayer.application.port.MetricsPort;
import ca.gc.cra.geolayer.domain.geo.GeometryKind;
import ca.gc.cra.geolayer.domain.geo.JoinedRecord;
import ca.gc.cra.geolayer.domain.layer.LayerDescriptor;
import ca.gc.cra.geolayer.domain.layer.LayerFeature;
import ca.gc.cra.geolayer.domain.layer.RenderMode;
import ca.gc.cra.geolayer.domain.layer.RenderRules;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts joined records and a render descriptor into a layer blueprint.
 * <p><strong>Role:</strong> Application service invoked inside a cache build routine; pure apart from
 * metrics and logging.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drop records without renderable geometry or without a score, counting each separately.</li>
 *   <li>Apply the {@link VolumeCap} to the survivors in producer order.</li>
 *   <li>Project geometry for the requested {@link RenderMode}.</li>
 *   <li>Assemble feature attributes and the field schema.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; safe for concurrent builds.</p>
 * <p><strong>Observability:</strong> Emits {@code synth.features}, {@code synth.truncated} and
 * {@code synth.missingGeometry}.</p>
 *
 * @since 0.1.0
 */
public final class LayerSynthesizer {
  private static final Logger log = LoggerFactory.getLogger(LayerSynthesizer.class);

  /** Title prefix of every synthesized layer. */
  public static final String TITLE_PREFIX = "AnalysisEngine - ";
  /** Layer opacity. */
  public static final double OPACITY = 0.8d;

  private static final List<String> COMMON_FIELDS = List.of(
      "zip_code", "city_name", "rank", "total_population", "median_income");

  private final VolumeCap volumeCap;
  private final GeometryProjector projector;
  private final MetricsPort metrics;

  /**
   * Creates a synthesizer with the default volume cap.
   *
   * @param metrics metrics sink
   */
  public LayerSynthesizer(MetricsPort metrics) {
    this(VolumeCap.DEFAULT, new GeometryProjector(), metrics);
  }

  /**
   * Creates a synthesizer.
   *
   * @param volumeCap feature-count tiers
   * @param projector geometry projector
   * @param metrics metrics sink
   */
  public LayerSynthesizer(VolumeCap volumeCap, GeometryProjector projector, MetricsPort metrics) {
    this.volumeCap = Objects.requireNonNull(volumeCap, "volumeCap");
    this.projector = Objects.requireNonNull(projector, "projector");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Synthesizes a layer descriptor.
   *
   * @param records joined records in producer order
   * @param rules render descriptor
   * @param targetVariable analysed variable
   * @return layer descriptor with at least one feature
   * @throws SynthesisEmptyException when no record survives filtering
   */
  public LayerDescriptor synthesize(List<JoinedRecord> records, RenderRules rules, String targetVariable) {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(rules, "rules");
    Objects.requireNonNull(targetVariable, "targetVariable");

    int missingGeometry = 0;
    int missingScore = 0;
    GeometryKind layerKind = rules.mode() == RenderMode.CENTROID ? GeometryKind.POINT : null;
    List<Survivor> survivors = new ArrayList<>(records.size());
    for (JoinedRecord record : records) {
      if (!record.hasGeometry()) {
        missingGeometry++;
        continue;
      }
      if (record.score() == null) {
        missingScore++;
        continue;
      }
      Optional<GeometryProjector.Projection> projection = projector.project(record.geometry(), rules.mode());
      if (projection.isEmpty()) {
        missingGeometry++;
        continue;
      }
      if (layerKind == null) {
        layerKind = projection.get().kind();
      } else if (projection.get().kind() != layerKind) {
        missingGeometry++;
        continue;
      }
      survivors.add(new Survivor(record, projection.get()));
    }

    if (survivors.isEmpty()) {
      metrics.observe("synth.missingGeometry", missingGeometry);
      throw new SynthesisEmptyException(targetVariable, records.size(), missingGeometry, missingScore);
    }

    int limit = volumeCap.limitFor(survivors.size());
    int truncated = survivors.size() - limit;
    List<LayerFeature> features = new ArrayList<>(limit);
    for (int i = 0; i < limit; i++) {
      Survivor survivor = survivors.get(i);
      features.add(new LayerFeature(
          i + 1,
          survivor.projection().kind(),
          survivor.projection().coordinates(),
          featureAttributes(i + 1, survivor.record(), rules, targetVariable)));
    }

    metrics.observe("synth.features", features.size());
    metrics.observe("synth.missingGeometry", missingGeometry);
    if (truncated > 0) {
      metrics.observe("synth.truncated", truncated);
      log.info("Rendering {} of {} records for {}; {} truncated by volume cap",
          limit, survivors.size(), targetVariable, truncated);
    }
    if (missingGeometry > 0 || missingScore > 0) {
      log.debug("Skipped {} records without geometry and {} without score", missingGeometry, missingScore);
    }

    return new LayerDescriptor(
        TITLE_PREFIX + targetVariable,
        layerKind,
        features,
        FieldSchema.infer(features.get(0), targetVariable),
        FieldSchema.OBJECT_ID,
        rules,
        targetVariable,
        missingGeometry,
        missingScore,
        truncated,
        OPACITY,
        LayerDescriptor.WGS84);
  }

  private static Map<String, Object> featureAttributes(
      int objectId, JoinedRecord record, RenderRules rules, String targetVariable) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put(FieldSchema.OBJECT_ID, objectId);
    attributes.put("area_name", record.displayName());
    attributes.put("value", record.score());
    attributes.put("ID", record.areaId());
    attributes.put("DESCRIPTION", record.geometry().description().orElse(record.displayName()));
    attributes.put(targetVariable, record.score());
    for (String field : rules.rendererFields()) {
      copyIfPresent(record, field, attributes);
    }
    for (String field : COMMON_FIELDS) {
      copyIfPresent(record, field, attributes);
    }
    return attributes;
  }

  private static void copyIfPresent(JoinedRecord record, String field, Map<String, Object> attributes) {
    if (attributes.containsKey(field)) {
      return;
    }
    Object value = record.attributes().get(field);
    if (value != null && !(value instanceof Map) && !(value instanceof List)) {
      attributes.put(field, value);
    }
  }

  private record Survivor(JoinedRecord record, GeometryProjector.Projection projection) {}
}
