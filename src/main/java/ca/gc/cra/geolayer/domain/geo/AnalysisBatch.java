package ca.gc.cra.geolayer.domain.geo;

import java.util.List;
import java.util.Objects;

/**
 * Ordered output of one analysis run.
 *
 * @param targetVariable scored variable shared by every record; never blank
 * @param records records in producer (rank) order; never {@code null}
 * @since 0.1.0
 */
public record AnalysisBatch(String targetVariable, List<AnalysisRecord> records) {

  /**
   * Validates the target variable and copies the record list.
   */
  public AnalysisBatch {
    Objects.requireNonNull(targetVariable, "targetVariable");
    if (targetVariable.isBlank()) {
      throw new IllegalArgumentException("targetVariable must not be blank");
    }
    records = List.copyOf(Objects.requireNonNull(records, "records"));
  }

  /**
   * Returns the number of records in the batch.
   *
   * @return record count
   */
  public int size() {
    return records.size();
  }
}
