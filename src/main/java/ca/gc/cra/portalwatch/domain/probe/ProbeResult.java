package ca.gc.cra.portalwatch.domain.probe;

/**
 * <strong>What:</strong> Classification of a single HTTP or HTTPS probe.
 * <p><strong>Why:</strong> This fixed set is the only error vocabulary of the validation core; transport errors
 * are translated into it and never escape as exceptions.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ProbeResult {
  /** The probe has not completed yet (or was never issued). */
  NO_RESULT("No result"),
  DNS_FAILURE("DNS failure"),
  DNS_TIMEOUT("DNS timeout"),
  TLS_FAILURE("TLS failure"),
  CONNECTION_FAILURE("Connection failure"),
  HTTP_TIMEOUT("Request timeout"),
  SUCCESS("Success"),
  /** HTTP 200 with a body: likely silent interception. */
  PORTAL_SUSPECTED("Portal suspected"),
  /** HTTP redirect with a usable absolute Location. */
  PORTAL_REDIRECT("Portal redirect"),
  /** HTTP redirect status without a usable Location. */
  PORTAL_INVALID_REDIRECT("Portal invalid redirect"),
  FAILURE("Failure");

  private final String displayName;

  ProbeResult(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Maps a typed transport error onto the probe taxonomy.
   *
   * @param error transport error reported by the probe client; must not be {@code null}
   * @return matching failure classification
   */
  public static ProbeResult fromError(ProbeError error) {
    return switch (error) {
      case DNS_FAILURE -> DNS_FAILURE;
      case DNS_TIMEOUT -> DNS_TIMEOUT;
      case TLS_FAILURE -> TLS_FAILURE;
      case HTTP_TIMEOUT -> HTTP_TIMEOUT;
      case CONNECTION_FAILURE, IO_ERROR, INTERNAL_ERROR -> CONNECTION_FAILURE;
    };
  }

  @Override
  public String toString() {
    return displayName;
  }
}
