package ca.gc.cra.portalwatch.domain.probe;

/**
 * <strong>What:</strong> Triggers by which collaborators request network (re)validation.
 * <p><strong>Why:</strong> The connectivity monitor decides whether to reuse its prober, reset backoff, or respect
 * the pending retry delay based solely on this value.</p>
 * <p><strong>Role:</strong> Input vocabulary of {@code ConnectivityMonitor#start}; no other entry point exists.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ValidationReason {
  /** IP provisioning completed or the network connection changed. Always creates a fresh prober. */
  NETWORK_CONNECTION_UPDATE(true),
  /** The service moved in the manager's service ordering. */
  SERVICE_REORDER(true),
  /** A service property relevant to validation changed. */
  SERVICE_PROPERTY_UPDATE(false),
  /** A manager property relevant to validation (probe URLs, enabled technologies) changed. */
  MANAGER_PROPERTY_UPDATE(false),
  /** An explicit request arrived over the RPC surface. */
  DBUS_REQUEST(true),
  /** Link monitoring saw the ethernet gateway become reachable. */
  ETHERNET_GATEWAY_REACHABLE(true),
  /** Link monitoring saw the ethernet gateway become unreachable. */
  ETHERNET_GATEWAY_UNREACHABLE(false),
  /** Follow-up attempt after a verdict other than internet connectivity. */
  RETRY_VALIDATION(false);

  private final boolean resetsAttemptDelays;

  ValidationReason(boolean resetsAttemptDelays) {
    this.resetsAttemptDelays = resetsAttemptDelays;
  }

  /**
   * Indicates whether this trigger discards any pending retry backoff before starting.
   *
   * @return {@code true} for reasons that must not wait out a previous backoff
   */
  public boolean resetsAttemptDelays() {
    return resetsAttemptDelays;
  }
}
