package ca.gc.cra.geolayer.application.cache;

import ca.gc.cra.geolayer.domain.layer.LayerBuildException;

/**
 * Raised when the map host rejects a layer; the previously attached layer is left in place.
 *
 * @since 0.1.0
 */
public final class HostAttachFailureException extends LayerBuildException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param hostId host that rejected the layer
   * @param layerId layer that could not be attached
   * @param cause host failure
   */
  public HostAttachFailureException(String hostId, String layerId, Throwable cause) {
    super("host " + hostId + " rejected layer " + layerId, cause);
  }
}
