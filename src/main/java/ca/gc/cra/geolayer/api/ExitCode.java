package ca.gc.cra.geolayer.api;

/**
 * Process exit codes returned by the geolayer CLI.
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments or configuration were rejected before running. */
  INVALID_ARGS(2),
  /** An input file could not be read. */
  IO_ERROR(3),
  /** Inputs were readable but unusable, such as boundaries with no usable features. */
  CONFIG_ERROR(4),
  /** The layer could not be built or attached. */
  RUNTIME_FAILURE(5),
  /** The command was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process exit code.
   *
   * @return exit code
   */
  public int code() {
    return code;
  }
}
