package ca.gc.cra.geolayer.application.join;

import ca.gc.cra.geolayer.domain.geo.AnalysisRecord;
import ca.gc.cra.geolayer.domain.util.Attributes;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Named rule deriving one candidate boundary key from an analysis record.
 *
 * <p>Strategies are pure and composable: {@code IdentifierStrategy.field("ZIP").zeroPadded()} derives the
 * padded form of the {@code ZIP} field. The join engine evaluates an ordered list of strategies and stops at
 * the first candidate present in the boundary index.</p>
 *
 * @param name strategy name used in logs and match statistics; never blank
 * @param extractor candidate extractor; returns empty when the record has nothing to offer
 * @since 0.1.0
 */
public record IdentifierStrategy(String name, Function<AnalysisRecord, Optional<String>> extractor) {

  private static final String PLACEHOLDER_PREFIX = "area_";

  /**
   * Validates the name and extractor.
   */
  public IdentifierStrategy {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(extractor, "extractor");
  }

  /**
   * Reads a field at the top level or, failing that, under {@code properties}.
   *
   * @param field field name
   * @return strategy named after the field
   */
  public static IdentifierStrategy field(String field) {
    return new IdentifierStrategy(field, record -> record.field(field).flatMap(Attributes::text));
  }

  /**
   * Reads a field at the top level only.
   *
   * @param field field name
   * @return strategy named after the field
   */
  public static IdentifierStrategy topLevel(String field) {
    return new IdentifierStrategy(
        field, record -> Attributes.text(record.attributes().get(field)));
  }

  /**
   * Reads a field under {@code properties} only.
   *
   * @param field field name
   * @return strategy named {@code properties.<field>}
   */
  public static IdentifierStrategy nested(String field) {
    return new IdentifierStrategy(
        Attributes.PROPERTIES + "." + field,
        record -> Attributes.nested(record.attributes(), field).flatMap(Attributes::text));
  }

  /**
   * Reads the producer's {@code area_id}, skipping synthetic {@code area_N} placeholders.
   *
   * @return area id strategy
   */
  public static IdentifierStrategy areaId() {
    return new IdentifierStrategy(
        "area_id",
        record -> Optional.ofNullable(record.rawAreaId()).filter(id -> !isPlaceholder(id)));
  }

  /**
   * Reads the producer's {@code area_id} even when it is a synthetic placeholder.
   *
   * @return placeholder-tolerant area id strategy
   */
  public static IdentifierStrategy rawAreaId() {
    return new IdentifierStrategy("area_id.raw", record -> Optional.ofNullable(record.rawAreaId()));
  }

  /**
   * Extracts a leading five-digit code from a descriptive label field.
   *
   * @param field label field such as {@code DESCRIPTION}
   * @return strategy named {@code <field>.code}
   */
  public static IdentifierStrategy labelCode(String field) {
    IdentifierStrategy source = field(field);
    return new IdentifierStrategy(
        field + ".code", record -> source.candidate(record).flatMap(AreaCodes::leadingCode));
  }

  /**
   * Returns a strategy yielding the zero-padded form of this strategy's candidate.
   *
   * @return padded strategy named {@code <name>.padded}
   */
  public IdentifierStrategy zeroPadded() {
    return new IdentifierStrategy(
        name + ".padded", record -> candidate(record).flatMap(AreaCodes::zeroPad));
  }

  /**
   * Applies the strategy to a record.
   *
   * @param record analysis record
   * @return candidate key when the record offers one
   */
  public Optional<String> candidate(AnalysisRecord record) {
    Optional<String> value = extractor.apply(record);
    return value == null ? Optional.empty() : value.map(String::trim).filter(s -> !s.isEmpty());
  }

  /**
   * Indicates whether an identifier is a synthetic {@code area_N} placeholder.
   *
   * @param id identifier
   * @return {@code true} for placeholders
   */
  public static boolean isPlaceholder(String id) {
    return id != null && id.startsWith(PLACEHOLDER_PREFIX);
  }
}
