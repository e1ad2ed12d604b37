package ca.gc.cra.geolayer.application.port;

import ca.gc.cra.geolayer.domain.geo.AnalysisBatch;
import java.io.IOException;

/**
 * Domain port supplying scored analysis records from the analysis producer.
 *
 * <p><strong>Thread-safety:</strong> Implementations are called from a single pipeline thread.</p>
 *
 * @since 0.1.0
 */
public interface AnalysisSource {
  /**
   * Reads the next analysis batch.
   *
   * @return ordered analysis records with their target variable
   * @throws IOException when the producer output cannot be read
   */
  AnalysisBatch read() throws IOException;
}
