package ca.gc.cra.geolayer.infrastructure.boundary;

import ca.gc.cra.geolayer.application.join.BoundaryUnavailableException;
import ca.gc.cra.geolayer.application.port.BoundaryStore;
import ca.gc.cra.geolayer.application.port.ClockPort;
import ca.gc.cra.geolayer.domain.geo.BoundaryGeometry;
import ca.gc.cra.geolayer.domain.geo.BoundarySet;
import ca.gc.cra.geolayer.domain.geo.Position;
import ca.gc.cra.geolayer.domain.util.Attributes;
import ca.gc.cra.geolayer.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link BoundaryStore} reading a GeoJSON {@code FeatureCollection} from disk.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load once per session; hand every caller the same {@link BoundarySet}.</li>
 *   <li>Accept {@code Polygon}, {@code MultiPolygon} (flattened to its rings) and {@code Point} geometry.</li>
 *   <li>Key each feature by {@code properties.ID}, falling back to the feature {@code id}.</li>
 *   <li>Remember a failed load until {@link #reload()} succeeds.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Loads are serialized on the instance monitor.</p>
 *
 * @since 0.1.0
 */
public final class GeoJsonBoundaryStore implements BoundaryStore {
  private static final Logger log = LoggerFactory.getLogger(GeoJsonBoundaryStore.class);

  private final Path file;
  private final JsonSupport json;
  private final ClockPort clock;

  private BoundarySet loaded; // guarded by this
  private BoundaryUnavailableException failure; // guarded by this

  /**
   * Creates a store for a GeoJSON file.
   *
   * @param file GeoJSON path
   * @param json JSON parser
   * @param clock clock stamping the load time
   */
  public GeoJsonBoundaryStore(Path file, JsonSupport json, ClockPort clock) {
    this.file = Objects.requireNonNull(file, "file");
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized BoundarySet boundaries() {
    if (loaded != null) {
      return loaded;
    }
    if (failure != null) {
      throw failure;
    }
    return load();
  }

  @Override
  public synchronized BoundarySet reload() {
    loaded = null;
    failure = null;
    return load();
  }

  private BoundarySet load() {
    try {
      List<BoundaryGeometry> boundaries = readFeatures();
      if (boundaries.isEmpty()) {
        throw new BoundaryUnavailableException("boundary file " + file + " contains no usable features");
      }
      loaded = new BoundarySet(file.toString(), boundaries, clock.nowMillis());
      log.info("Loaded {} boundaries from {}", boundaries.size(), file);
      return loaded;
    } catch (IOException ex) {
      failure = new BoundaryUnavailableException("boundary unavailable: unable to read " + file, ex);
    } catch (BoundaryUnavailableException ex) {
      failure = ex;
    } catch (IllegalArgumentException ex) {
      failure = new BoundaryUnavailableException("boundary unavailable: invalid geometry in " + file, ex);
    }
    log.error("Boundary load failed: {}", failure.getMessage());
    throw failure;
  }

  private List<BoundaryGeometry> readFeatures() throws IOException {
    Map<String, Object> root = JsonSupport.requireObject(json.parse(file), "boundary document");
    if (!"FeatureCollection".equals(root.get("type"))) {
      throw new IOException("boundary document must be a FeatureCollection");
    }
    List<Object> features = JsonSupport.requireArray(root.get("features"), "features");
    List<BoundaryGeometry> boundaries = new ArrayList<>(features.size());
    int skipped = 0;
    for (Object raw : features) {
      Optional<BoundaryGeometry> boundary = toBoundary(JsonSupport.requireObject(raw, "feature"));
      if (boundary.isPresent()) {
        boundaries.add(boundary.get());
      } else {
        skipped++;
      }
    }
    if (skipped > 0) {
      log.warn("Skipped {} boundary features without an id or supported geometry", skipped);
    }
    return boundaries;
  }

  private static Optional<BoundaryGeometry> toBoundary(Map<String, Object> feature) throws IOException {
    Map<String, Object> properties = feature.get("properties") instanceof Map<?, ?>
        ? JsonSupport.requireObject(feature.get("properties"), "properties")
        : Map.of();
    Optional<String> id = Attributes.text(properties.get("ID")).or(() -> Attributes.text(feature.get("id")));
    if (id.isEmpty() || !(feature.get("geometry") instanceof Map<?, ?>)) {
      return Optional.empty();
    }
    Map<String, Object> geometry = JsonSupport.requireObject(feature.get("geometry"), "geometry");
    Object coordinates = geometry.get("coordinates");
    String type = String.valueOf(geometry.get("type"));
    switch (type) {
      case "Point": {
        return position(coordinates).map(p -> BoundaryGeometry.point(id.get(), p, properties));
      }
      case "Polygon": {
        List<List<Position>> rings = rings(coordinates);
        return rings.isEmpty()
            ? Optional.empty()
            : Optional.of(BoundaryGeometry.polygon(id.get(), rings, properties));
      }
      case "MultiPolygon": {
        List<List<Position>> rings = new ArrayList<>();
        if (coordinates instanceof List<?> polygons) {
          for (Object polygon : polygons) {
            rings.addAll(rings(polygon));
          }
        }
        return rings.isEmpty()
            ? Optional.empty()
            : Optional.of(BoundaryGeometry.polygon(id.get(), rings, properties));
      }
      default:
        return Optional.empty();
    }
  }

  private static List<List<Position>> rings(Object coordinates) {
    List<List<Position>> rings = new ArrayList<>();
    if (!(coordinates instanceof List<?> rawRings)) {
      return rings;
    }
    for (Object rawRing : rawRings) {
      if (!(rawRing instanceof List<?> points)) {
        continue;
      }
      List<Position> ring = new ArrayList<>(points.size());
      for (Object point : points) {
        position(point).ifPresent(ring::add);
      }
      if (!ring.isEmpty()) {
        rings.add(ring);
      }
    }
    return rings;
  }

  private static Optional<Position> position(Object raw) {
    if (!(raw instanceof List<?> pair) || pair.size() < 2) {
      return Optional.empty();
    }
    OptionalDouble x = Attributes.number(pair.get(0));
    OptionalDouble y = Attributes.number(pair.get(1));
    if (x.isEmpty() || y.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new Position(x.getAsDouble(), y.getAsDouble()));
  }
}
