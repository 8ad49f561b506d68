package ca.gc.cra.portalwatch.domain.probe;

import java.util.Locale;

/**
 * Coarse attempt outcome reported to metrics, finer than {@link ValidationState}.
 *
 * @since 0.1.0
 */
public enum ResultMetric {
  UNKNOWN,
  DNS_FAILURE,
  DNS_TIMEOUT,
  CONNECTION_FAILURE,
  HTTP_TIMEOUT,
  ONLINE,
  HTTPS_FAILURE,
  REDIRECT_FOUND,
  REDIRECT_NO_URL,
  NO_CONNECTIVITY,
  HTTP_FAILURE;

  /**
   * Returns the metric name suffix, e.g. {@code redirect_found}.
   *
   * @return lower-case metric name
   */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
