package ca.gc.cra.geolayer.application.cache;

import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;

/**
 * Point-in-time view of the layer slot, for diagnostics and tests.
 *
 * @param state lifecycle state
 * @param currentSignature signature of the attached layer, or {@code null}
 * @param currentLayerId id of the attached layer, or {@code null}
 * @param inFlightSignature signature being built, or {@code null}
 * @param inFlightDeadlineMillis epoch millis at which the in-flight build expires, or {@code null}
 * @since 0.1.0
 */
public record SlotSnapshot(
    SlotState state,
    VisualizationSignature currentSignature,
    String currentLayerId,
    VisualizationSignature inFlightSignature,
    Long inFlightDeadlineMillis) {

  static final SlotSnapshot IDLE = new SlotSnapshot(SlotState.IDLE, null, null, null, null);
}
