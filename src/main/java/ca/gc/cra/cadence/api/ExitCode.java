package ca.gc.cra.cadence.api;

/**
 * <strong>What:</strong> Process exit codes returned by CADENCE commands.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A file could not be read. */
  IO_ERROR(3),
  /** Configuration or catalog content was malformed. */
  CONFIG_ERROR(4),
  /** Resolving failed or did not finish in time. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
