package ca.gc.cra.geolayer.application.join;

/**
 * Signals that the session's boundary collection is missing, empty, or failed to load.
 *
 * <p>Fatal to the join call; the join engine never synthesizes placeholder geometry.</p>
 *
 * @since 0.1.0
 */
public final class BoundaryUnavailableException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception with a message.
   *
   * @param message failure description
   */
  public BoundaryUnavailableException(String message) {
    super(message);
  }

  /**
   * Creates the exception with a message and cause.
   *
   * @param message failure description
   * @param cause underlying load failure
   */
  public BoundaryUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
