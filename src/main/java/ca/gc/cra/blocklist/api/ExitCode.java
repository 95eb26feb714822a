package ca.gc.cra.blocklist.api;

/**
 * <strong>What:</strong> Process exit codes shared by the block list commands.
 * <p><strong>Why:</strong> Lets schedulers tell a bad invocation from an unwritable output directory or an
 * interrupted run.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** The run completed, even if every source failed. */
  SUCCESS(0),
  /** Command-line arguments or configuration were invalid. */
  INVALID_ARGS(2),
  /** An output file could not be written. */
  IO_ERROR(3),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
