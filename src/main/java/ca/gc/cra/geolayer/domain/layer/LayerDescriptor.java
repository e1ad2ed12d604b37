package ca.gc.cra.geolayer.domain.layer;

import ca.gc.cra.geolayer.domain.geo.GeometryKind;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Renderable layer blueprint produced by the layer synthesizer.
 * <p><strong>Why:</strong> Separates layer construction (pure, testable) from attaching to a map host.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; ownership transfers to the layer cache once attached.</p>
 *
 * @param title layer title; never blank
 * @param geometryKind geometry kind shared by every feature; never {@code null}
 * @param features rendered features in producer order; never empty
 * @param fields attribute schema, essential fields first; never {@code null}
 * @param objectIdField name of the object identifier field
 * @param renderRules render descriptor passed through to the host; never {@code null}
 * @param targetVariable scored variable rendered by the layer
 * @param missingGeometryCount records skipped because they had no usable geometry
 * @param missingScoreCount records skipped because they had no score
 * @param truncatedCount records dropped by the volume cap
 * @param opacity layer opacity in {@code [0,1]}
 * @param spatialReference WKID of the coordinates
 * @since 0.1.0
 */
public record LayerDescriptor(
    String title,
    GeometryKind geometryKind,
    List<LayerFeature> features,
    List<FieldDefinition> fields,
    String objectIdField,
    RenderRules renderRules,
    String targetVariable,
    int missingGeometryCount,
    int missingScoreCount,
    int truncatedCount,
    double opacity,
    int spatialReference) {

  /** WGS84 geographic coordinates. */
  public static final int WGS84 = 4326;

  /**
   * Validates invariants and copies collections.
   */
  public LayerDescriptor {
    Objects.requireNonNull(title, "title");
    geometryKind = Objects.requireNonNull(geometryKind, "geometryKind");
    features = List.copyOf(Objects.requireNonNull(features, "features"));
    fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    Objects.requireNonNull(objectIdField, "objectIdField");
    renderRules = Objects.requireNonNull(renderRules, "renderRules");
    Objects.requireNonNull(targetVariable, "targetVariable");
    if (features.isEmpty()) {
      throw new IllegalArgumentException("layer must contain at least one feature");
    }
    if (missingGeometryCount < 0 || missingScoreCount < 0 || truncatedCount < 0) {
      throw new IllegalArgumentException("skip counters must not be negative");
    }
    if (opacity < 0d || opacity > 1d) {
      throw new IllegalArgumentException("opacity must be within [0,1]");
    }
  }

  /**
   * Returns the number of rendered features.
   *
   * @return feature count
   */
  public int featureCount() {
    return features.size();
  }

  /**
   * Returns the number of records excluded from rendering for any reason.
   *
   * @return missing geometry + missing score + truncated
   */
  public int filteredCount() {
    return missingGeometryCount + missingScoreCount + truncatedCount;
  }
}
