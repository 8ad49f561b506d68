package ca.gc.cra.portalwatch.application.validation;

/**
 * Metric names emitted by the validation core through {@code MetricsPort}.
 *
 * @since 0.1.0
 */
public final class ValidationMetrics {
  public static final String HTTP_DURATION = "validation.http.duration.ms";
  public static final String HTTPS_DURATION = "validation.https.duration.ms";
  public static final String INTERNET_DURATION = "validation.internet.duration.ms";
  public static final String PORTAL_DURATION = "validation.portal.duration.ms";
  public static final String HTTP_RESPONSE_CODE_PREFIX = "validation.http.response_code.";
  public static final String HTTP_CONTENT_LENGTH = "validation.http.content_length";
  public static final String RESULT_PREFIX = "validation.result.";
  public static final String ATTEMPTS_TO_ONLINE = "validation.attempts_to_online";
  public static final String ATTEMPTS_TO_REDIRECT_FOUND = "validation.attempts_to_redirect_found";
  public static final String ATTEMPTS_TO_DISCONNECT = "validation.attempts_to_disconnect";
  public static final String TIME_TO_ONLINE = "validation.time_to_online.ms";

  private ValidationMetrics() {
    // Constants
  }
}
