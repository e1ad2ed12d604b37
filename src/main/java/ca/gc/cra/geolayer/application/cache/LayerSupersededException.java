package ca.gc.cra.geolayer.application.cache;

import ca.gc.cra.geolayer.domain.layer.LayerBuildException;
import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;

/**
 * Raised when a newer request replaced the build a caller was waiting on.
 *
 * @since 0.1.0
 */
public final class LayerSupersededException extends LayerBuildException {
  private static final long serialVersionUID = 1L;

  private final transient VisualizationSignature winner;

  /**
   * Creates the exception.
   *
   * @param requested signature the caller asked for
   * @param winner signature of the request that won
   */
  public LayerSupersededException(VisualizationSignature requested, VisualizationSignature winner) {
    super("layer build " + requested.shortForm() + " superseded by " + winner.shortForm());
    this.winner = winner;
  }

  /**
   * Returns the signature of the winning request.
   *
   * @return winning signature
   */
  public VisualizationSignature winner() {
    return winner;
  }
}
