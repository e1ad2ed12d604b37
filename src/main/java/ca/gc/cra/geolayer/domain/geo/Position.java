package ca.gc.cra.geolayer.domain.geo;

/**
 * Immutable longitude/latitude pair in WGS84 (WKID 4326).
 *
 * @param x longitude
 * @param y latitude
 * @since 0.1.0
 */
public record Position(double x, double y) {

  /**
   * Indicates whether both ordinates are finite numbers.
   *
   * @return {@code true} when the position can be rendered
   */
  public boolean isValid() {
    return Double.isFinite(x) && Double.isFinite(y);
  }
}
