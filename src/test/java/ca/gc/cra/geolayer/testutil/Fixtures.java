package ca.gc.cra.geolayer.testutil;

import ca.gc.cra.geolayer.domain.geo.AnalysisRecord;
import ca.gc.cra.geolayer.domain.geo.BoundaryGeometry;
import ca.gc.cra.geolayer.domain.geo.BoundarySet;
import ca.gc.cra.geolayer.domain.geo.GeometryKind;
import ca.gc.cra.geolayer.domain.geo.JoinedRecord;
import ca.gc.cra.geolayer.domain.geo.Position;
import ca.gc.cra.geolayer.domain.layer.FieldDefinition;
import ca.gc.cra.geolayer.domain.layer.FieldType;
import ca.gc.cra.geolayer.domain.layer.LayerDescriptor;
import ca.gc.cra.geolayer.domain.layer.LayerFeature;
import ca.gc.cra.geolayer.domain.layer.MapLayer;
import ca.gc.cra.geolayer.domain.layer.RenderRules;
import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builders for geometry, records and layers shared across tests. */
public final class Fixtures {
  public static final String TARGET = "score";

  private Fixtures() {}

  public static BoundaryGeometry square(String areaId, double x, double y, Map<String, ?> attributes) {
    List<Position> ring = List.of(
        new Position(x, y),
        new Position(x + 1, y),
        new Position(x + 1, y + 1),
        new Position(x, y + 1),
        new Position(x, y));
    return BoundaryGeometry.polygon(areaId, List.of(ring), attributes);
  }

  public static BoundaryGeometry square(String areaId) {
    return square(areaId, 0, 0, Map.of());
  }

  public static BoundarySet boundaries(BoundaryGeometry... geometries) {
    return new BoundarySet("test", List.of(geometries), 0L);
  }

  public static AnalysisRecord record(String areaId, Double score) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("area_id", areaId);
    if (score != null) {
      row.put(TARGET, score);
    }
    return AnalysisRecord.fromRow(row, TARGET);
  }

  public static JoinedRecord joined(String areaId, Double score, BoundaryGeometry geometry) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("area_id", areaId);
    if (score != null) {
      attributes.put(TARGET, score);
    }
    return new JoinedRecord(areaId, areaId, geometry, score, attributes);
  }

  public static List<JoinedRecord> joinedSquares(int count) {
    List<JoinedRecord> records = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      String id = String.format("%05d", i);
      records.add(joined(id, (double) i, square(id, i % 100, i / 100, Map.of())));
    }
    return records;
  }

  public static MapLayer layer(String layerId) {
    LayerFeature feature = new LayerFeature(
        1,
        GeometryKind.POINT,
        List.of(List.of(new Position(1, 2))),
        Map.of("OBJECTID", 1, "value", 1.0d));
    LayerDescriptor descriptor = new LayerDescriptor(
        "AnalysisEngine - " + TARGET,
        GeometryKind.POINT,
        List.of(feature),
        List.of(new FieldDefinition("OBJECTID", FieldType.OID), new FieldDefinition("value", FieldType.DOUBLE)),
        "OBJECTID",
        RenderRules.simple(TARGET),
        TARGET,
        0,
        0,
        0,
        0.8d,
        LayerDescriptor.WGS84);
    return new MapLayer(layerId, descriptor, 0L);
  }

  public static VisualizationSignature signature(String value) {
    return VisualizationSignature.of(value);
  }
}
