package ca.gc.cra.geolayer.application.synth;

import ca.gc.cra.geolayer.domain.layer.LayerBuildException;

/**
 * Raised when no joined record survives filtering, so no layer can be produced.
 *
 * @since 0.1.0
 */
public final class SynthesisEmptyException extends LayerBuildException {
  private static final long serialVersionUID = 1L;

  private final int inputCount;

  /**
   * Creates the exception.
   *
   * @param targetVariable analysed variable
   * @param inputCount number of joined records received
   * @param missingGeometry records dropped for lack of renderable geometry
   * @param missingScore records dropped for lack of a score
   */
  public SynthesisEmptyException(
      String targetVariable, int inputCount, int missingGeometry, int missingScore) {
    super("no renderable records for " + targetVariable + ": " + inputCount + " received, "
        + missingGeometry + " without geometry, " + missingScore + " without score");
    this.inputCount = inputCount;
  }

  /**
   * Returns the number of joined records the synthesizer received.
   *
   * @return input count
   */
  public int inputCount() {
    return inputCount;
  }
}
