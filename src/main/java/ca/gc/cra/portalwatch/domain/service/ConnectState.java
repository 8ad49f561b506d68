package ca.gc.cra.portalwatch.domain.service;

import java.util.Locale;

/**
 * <strong>What:</strong> Connection states of a network service.
 * <p><strong>Why:</strong> Validation only moves a service between {@link #CONNECTED}, {@link #NO_CONNECTIVITY},
 * {@link #REDIRECT_FOUND} and {@link #ONLINE}; the remaining states belong to technology-specific connection logic.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ConnectState {
  IDLE,
  ASSOCIATING,
  CONFIGURING,
  /** L3 connected, validation not yet concluded. */
  CONNECTED,
  NO_CONNECTIVITY,
  /** Portal redirect or suspected portal; the user must sign in. */
  REDIRECT_FOUND,
  ONLINE,
  DISCONNECTING,
  FAILURE;

  /**
   * Reports whether the service holds an IP connection, validated or not.
   *
   * @return {@code true} for connected, no-connectivity, redirect-found and online
   */
  public boolean isConnected() {
    return this == CONNECTED || this == NO_CONNECTIVITY || this == REDIRECT_FOUND || this == ONLINE;
  }

  /**
   * Reports whether validation concluded that the service is not on the open Internet.
   *
   * @return {@code true} for no-connectivity and redirect-found
   */
  public boolean isPortalled() {
    return this == NO_CONNECTIVITY || this == REDIRECT_FOUND;
  }

  /**
   * Returns the lower-case, hyphenated label exposed to users, e.g. {@code redirect-found}.
   *
   * @return display label
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
