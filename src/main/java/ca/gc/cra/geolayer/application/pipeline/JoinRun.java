package ca.gc.cra.geolayer.application.pipeline;

import ca.gc.cra.geolayer.application.join.JoinReport;
import ca.gc.cra.geolayer.domain.geo.JoinedRecord;
import ca.gc.cra.geolayer.domain.layer.RenderRules;
import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;
import java.util.List;
import java.util.Objects;

/**
 * Joined records of one visualization request, available to consumers independently of the rendered subset.
 *
 * @param targetVariable analysed variable
 * @param rules render descriptor
 * @param records every joined record, matched or not, in producer order
 * @param report join statistics
 * @param signature signature of the request
 * @since 0.1.0
 */
public record JoinRun(
    String targetVariable,
    RenderRules rules,
    List<JoinedRecord> records,
    JoinReport report,
    VisualizationSignature signature) {

  /**
   * Validates fields and copies the record list.
   */
  public JoinRun {
    Objects.requireNonNull(targetVariable, "targetVariable");
    Objects.requireNonNull(rules, "rules");
    records = List.copyOf(Objects.requireNonNull(records, "records"));
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(signature, "signature");
  }
}
