package ca.gc.cra.portalwatch.domain.probe;

import java.util.Locale;

/**
 * Network validation mode selected for a connection.
 *
 * @since 0.1.0
 */
public enum ValidationMode {
  /** No probing; the connection is reported online as soon as it is connected. */
  DISABLED,
  /** HTTP captive portal probe plus HTTPS internet probe. */
  FULL_VALIDATION,
  /** HTTP captive portal probe only; never reports no-connectivity. */
  HTTP_ONLY;

  /**
   * Parses {@code full}, {@code http-only} or {@code disabled}; blank defaults to {@link #FULL_VALIDATION}.
   *
   * @param value textual mode
   * @return parsed mode
   * @throws IllegalArgumentException for unknown values
   */
  public static ValidationMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return FULL_VALIDATION;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    return switch (normalized) {
      case "full", "full-validation", "true" -> FULL_VALIDATION;
      case "http-only", "httponly" -> HTTP_ONLY;
      case "disabled", "false", "none" -> DISABLED;
      default -> throw new IllegalArgumentException("Unknown validation mode: " + value);
    };
  }
}
