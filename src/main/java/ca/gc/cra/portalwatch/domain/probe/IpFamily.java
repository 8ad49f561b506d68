package ca.gc.cra.portalwatch.domain.probe;

import java.util.Locale;

/**
 * IP family used for a validation attempt.
 *
 * @since 0.1.0
 */
public enum IpFamily {
  /** IPv4 transport. */
  IPV4,
  /** IPv6 transport. */
  IPV6;

  /**
   * Parses {@code ipv4}/{@code ipv6} (case-insensitive), defaulting to {@link #IPV4} when blank.
   *
   * @param value textual family
   * @return parsed family
   * @throws IllegalArgumentException if the value is not a known family
   */
  public static IpFamily fromString(String value) {
    if (value == null || value.isBlank()) {
      return IPV4;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "IPV4", "4", "V4" -> IPV4;
      case "IPV6", "6", "V6" -> IPV6;
      default -> throw new IllegalArgumentException("Unknown ipFamily: " + value);
    };
  }
}
