package ca.gc.cra.geolayer.domain.layer;

/**
 * Base type for failures of a single layer build attempt.
 *
 * <p>A build failure is surfaced identically to every caller waiting on that build and never leaves a
 * partially attached layer behind.</p>
 *
 * @since 0.1.0
 */
public class LayerBuildException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message diagnostic message
   */
  public LayerBuildException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message diagnostic message
   * @param cause underlying failure
   */
  public LayerBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
