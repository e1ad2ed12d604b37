package ca.gc.cra.geolayer.application.cache;

/**
 * Lifecycle state of the per-host layer slot.
 *
 * @since 0.1.0
 */
public enum SlotState {
  /** Nothing attached and nothing building. */
  IDLE,
  /** First build in flight; nothing attached yet. */
  BUILDING,
  /** A layer is attached and no build is in flight. */
  ATTACHED,
  /** A layer is attached while a build for a different signature is in flight. */
  REPLACING
}
