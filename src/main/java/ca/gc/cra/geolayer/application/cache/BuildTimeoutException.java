package ca.gc.cra.geolayer.application.cache;

import ca.gc.cra.geolayer.domain.layer.LayerBuildException;
import ca.gc.cra.geolayer.domain.layer.VisualizationSignature;

/**
 * Raised when a build did not resolve before its deadline.
 *
 * @since 0.1.0
 */
public final class BuildTimeoutException extends LayerBuildException {
  private static final long serialVersionUID = 1L;

  private final transient VisualizationSignature signature;

  /**
   * Creates the exception.
   *
   * @param signature signature whose build expired
   */
  public BuildTimeoutException(VisualizationSignature signature) {
    super("layer build " + signature.shortForm() + " timed out");
    this.signature = signature;
  }

  /**
   * Returns the expired signature.
   *
   * @return signature
   */
  public VisualizationSignature signature() {
    return signature;
  }
}
