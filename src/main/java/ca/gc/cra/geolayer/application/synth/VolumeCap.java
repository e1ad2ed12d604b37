package ca.gc.cra.geolayer.application.synth;

/**
 * Tiered bound on the number of features handed to the map host.
 *
 * <p>Sets at or below {@code fullThreshold} render in full; sets up to {@code midThreshold} are capped at
 * {@code midCap}; anything larger is capped at {@code largeCap}.</p>
 *
 * @param fullThreshold largest set rendered without truncation
 * @param midThreshold largest set that receives {@code midCap}
 * @param midCap cap applied to mid-sized sets
 * @param largeCap cap applied beyond {@code midThreshold}
 * @since 0.1.0
 */
public record VolumeCap(int fullThreshold, int midThreshold, int midCap, int largeCap) {

  /** Default tiers: 4,000 in full, up to 8,000 capped at 6,000, larger capped at 4,000. */
  public static final VolumeCap DEFAULT = new VolumeCap(4_000, 8_000, 6_000, 4_000);

  /**
   * Validates the tiers.
   */
  public VolumeCap {
    if (fullThreshold <= 0 || midCap <= 0 || largeCap <= 0) {
      throw new IllegalArgumentException("volume caps must be positive");
    }
    if (midThreshold < fullThreshold) {
      throw new IllegalArgumentException("midThreshold must be >= fullThreshold");
    }
  }

  /**
   * Returns how many of {@code size} records may be rendered.
   *
   * @param size surviving record count
   * @return rendered record count, never above {@code size}
   */
  public int limitFor(int size) {
    if (size <= fullThreshold) {
      return size;
    }
    if (size <= midThreshold) {
      return Math.min(size, midCap);
    }
    return Math.min(size, largeCap);
  }
}
