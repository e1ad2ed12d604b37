package ca.gc.cra.geolayer.application.join;

import ca.gc.cra.geolayer.application.port.MetricsPort;
import ca.gc.cra.geolayer.domain.geo.AnalysisRecord;
import ca.gc.cra.geolayer.domain.geo.BoundaryGeometry;
import ca.gc.cra.geolayer.domain.geo.BoundarySet;
import ca.gc.cra.geolayer.domain.geo.JoinedRecord;
import ca.gc.cra.geolayer.logging.Logs;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Pairs analysis records with boundary geometry by normalized identifier.
 * <p><strong>Why:</strong> Analysis output names its areas loosely while boundaries are keyed canonically; the
 * engine owns the normalization and fallback policy so downstream stages see one consistent shape.</p>
 * <p><strong>Role:</strong> Application service between the analysis producer and the layer synthesizer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build (and reuse) a normalized-key index per boundary collection.</li>
 *   <li>Resolve each record through the ordered {@link IdentifierStrategy} list; first hit wins.</li>
 *   <li>Emit unmatched records with {@code null} geometry instead of dropping them.</li>
 *   <li>Fail fast with {@link BoundaryUnavailableException} when no boundaries are available.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent joins; the cached index is immutable and swapped
 * atomically.</p>
 * <p><strong>Performance:</strong> O(b) to index b boundaries once, then O(s) lookups per record for s
 * strategies.</p>
 * <p><strong>Observability:</strong> Emits {@code join.records}, {@code join.matched}, {@code join.unmatched},
 * and {@code join.latencyNanos}; logs a WARN summary with sample unmatched ids.</p>
 *
 * @since 0.1.0
 */
public final class GeographicJoinEngine {
  private static final Logger log = LoggerFactory.getLogger(GeographicJoinEngine.class);

  private static final int MAX_UNMATCHED_SAMPLES = 5;
  private static final int MAX_LOGGED_ID_BYTES = 64;
  private static final String UNKNOWN_CITY = "Unknown City";
  private static final String NO_BOUNDARY = "No boundary data";
  private static final Set<String> PROTECTED_SCORE_FIELDS =
      Set.of("value", "thematic_value", "competitive_advantage_score");

  private final List<IdentifierStrategy> strategies;
  private final MetricsPort metrics;
  private final AtomicReference<BoundaryIndex> cachedIndex = new AtomicReference<>();

  /**
   * Creates an engine using {@link IdentifierStrategies#defaults()}.
   *
   * @param metrics metrics sink
   */
  public GeographicJoinEngine(MetricsPort metrics) {
    this(IdentifierStrategies.defaults(), metrics);
  }

  /**
   * Creates an engine with an explicit strategy list.
   *
   * @param strategies ordered normalization strategies; must not be empty
   * @param metrics metrics sink
   */
  public GeographicJoinEngine(List<IdentifierStrategy> strategies, MetricsPort metrics) {
    this.strategies = List.copyOf(Objects.requireNonNull(strategies, "strategies"));
    if (this.strategies.isEmpty()) {
      throw new IllegalArgumentException("at least one identifier strategy is required");
    }
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Joins records with boundaries, returning one joined record per input record in input order.
   *
   * @param records analysis records; never {@code null}
   * @param boundaries loaded boundary collection
   * @return joined records
   * @throws BoundaryUnavailableException when {@code boundaries} is {@code null} or empty
   */
  public List<JoinedRecord> join(List<AnalysisRecord> records, BoundarySet boundaries) {
    return joinWithReport(records, boundaries).records();
  }

  /**
   * Joins records with boundaries and reports match statistics.
   *
   * @param records analysis records; never {@code null}
   * @param boundaries loaded boundary collection
   * @return joined records and statistics
   * @throws BoundaryUnavailableException when {@code boundaries} is {@code null} or empty
   */
  public JoinResult joinWithReport(List<AnalysisRecord> records, BoundarySet boundaries) {
    Objects.requireNonNull(records, "records");
    if (boundaries == null || boundaries.isEmpty()) {
      throw new BoundaryUnavailableException("boundary unavailable: no boundary geometry loaded");
    }
    long start = System.nanoTime();
    BoundaryIndex index = indexFor(boundaries);

    List<JoinedRecord> joined = new ArrayList<>(records.size());
    Map<String, Integer> byStrategy = new LinkedHashMap<>();
    List<String> unmatchedSamples = new ArrayList<>();
    int matched = 0;

    for (int i = 0; i < records.size(); i++) {
      AnalysisRecord record = Objects.requireNonNull(records.get(i), "record");
      Optional<Match> match = resolve(record, index);
      if (match.isPresent()) {
        matched++;
        byStrategy.merge(match.get().strategy(), 1, Integer::sum);
        joined.add(matchedRecord(record, match.get().boundary()));
      } else {
        JoinedRecord fallback = unmatchedRecord(record, i);
        if (unmatchedSamples.size() < MAX_UNMATCHED_SAMPLES) {
          unmatchedSamples.add(fallback.areaId());
        }
        log.debug("No boundary match for record {} (id {})", i, Logs.truncate(fallback.areaId(), MAX_LOGGED_ID_BYTES));
        joined.add(fallback);
      }
    }

    int unmatched = records.size() - matched;
    JoinReport report = new JoinReport(records.size(), matched, unmatched, byStrategy, unmatchedSamples);
    metrics.observe("join.latencyNanos", System.nanoTime() - start);
    metrics.observe("join.records", records.size());
    metrics.observe("join.matched", matched);
    if (unmatched > 0) {
      metrics.observe("join.unmatched", unmatched);
      log.warn("Join left {} of {} records without boundary geometry (samples: {})",
          unmatched, records.size(), unmatchedSamples);
    }
    log.info("Joined {} records against {} boundaries from {}: {} matched",
        records.size(), boundaries.size(), boundaries.source(), matched);
    return new JoinResult(joined, report);
  }

  private BoundaryIndex indexFor(BoundarySet boundaries) {
    BoundaryIndex current = cachedIndex.get();
    if (current != null && current.source() == boundaries) {
      return current;
    }
    BoundaryIndex built = BoundaryIndex.build(boundaries);
    cachedIndex.set(built);
    log.debug("Indexed {} boundaries under {} keys", boundaries.size(), built.keyCount());
    return built;
  }

  private Optional<Match> resolve(AnalysisRecord record, BoundaryIndex index) {
    for (IdentifierStrategy strategy : strategies) {
      Optional<String> candidate = strategy.candidate(record);
      if (candidate.isEmpty()) {
        continue;
      }
      Optional<BoundaryGeometry> boundary = index.find(candidate.get());
      if (boundary.isPresent()) {
        return Optional.of(new Match(strategy.name(), boundary.get()));
      }
    }
    return Optional.empty();
  }

  private JoinedRecord matchedRecord(AnalysisRecord record, BoundaryGeometry boundary) {
    Optional<String> description = boundary.description();
    Optional<AreaCodes.CodeAndCity> label = description.flatMap(AreaCodes::parseLabel);
    String code = label.map(AreaCodes.CodeAndCity::code).orElse(boundary.areaId());
    String city = label.map(AreaCodes.CodeAndCity::city).orElse(UNKNOWN_CITY);
    String displayName = label.map(AreaCodes.CodeAndCity::label)
        .or(() -> description)
        .orElse(boundary.areaId());

    Map<String, Object> attributes = new LinkedHashMap<>(record.attributes());
    for (Map.Entry<String, Object> entry : boundary.attributes().entrySet()) {
      String key = entry.getKey();
      boolean scoreField = PROTECTED_SCORE_FIELDS.contains(key) || key.equals(record.targetVariable());
      if (scoreField && attributes.containsKey(key)) {
        continue;
      }
      attributes.put(key, entry.getValue());
    }
    attributes.put("area_id", code);
    attributes.put("area_name", displayName);
    attributes.put("zip_code", code);
    attributes.put("city_name", city);
    putScore(attributes, record);
    return new JoinedRecord(code, displayName, boundary, record.score(), attributes);
  }

  private JoinedRecord unmatchedRecord(AnalysisRecord record, int index) {
    String rawId = strategies.stream()
        .map(strategy -> strategy.candidate(record))
        .flatMap(Optional::stream)
        .findFirst()
        .orElse("area_" + index);
    String displayName = IdentifierStrategy.isPlaceholder(rawId)
        ? rawId
        : rawId + " (" + NO_BOUNDARY + ")";

    Map<String, Object> attributes = new LinkedHashMap<>(record.attributes());
    attributes.put("area_id", rawId);
    attributes.put("area_name", displayName);
    attributes.put("zip_code", rawId);
    attributes.put("city_name", NO_BOUNDARY);
    putScore(attributes, record);
    return new JoinedRecord(rawId, displayName, null, record.score(), attributes);
  }

  private static void putScore(Map<String, Object> attributes, AnalysisRecord record) {
    if (record.score() != null) {
      attributes.put(record.targetVariable(), record.score());
      attributes.put("value", record.score());
    }
  }

  private record Match(String strategy, BoundaryGeometry boundary) {}
}
