package ca.gc.cra.portalwatch.api;

/**
 * <strong>What:</strong> Canonical exit codes of the portalwatch command-line tool.
 * <p><strong>Why:</strong> Lets scripts branch on the connectivity verdict without parsing output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution; for {@code check}, the network has internet connectivity. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** A captive portal was found; the sign-in URL is printed. */
  PORTAL_DETECTED(10),
  /** Validation finished without internet connectivity. */
  NO_CONNECTIVITY(11),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
