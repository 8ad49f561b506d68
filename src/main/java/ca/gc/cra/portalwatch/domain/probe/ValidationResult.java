package ca.gc.cra.portalwatch.domain.probe;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Result of one validation attempt: the HTTP probe outcome, the HTTPS probe outcome, and the
 * attempt metadata.
 * <p><strong>Why:</strong> Produced once per attempt and handed by value to the result callback; the
 * {@link ValidationState} verdict is always derived, never stored.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param httpOnly whether the attempt ran without the HTTPS probe
 * @param numAttempts attempt counter of the prober when the attempt started
 * @param httpResult classification of the HTTP probe
 * @param httpStatusCode HTTP status of the HTTP probe, {@code 0} if no response
 * @param httpContentLength content length of the HTTP probe response when known
 * @param httpsResult classification of the HTTPS probe
 * @param redirectUrl sign-in location of a portal redirect
 * @param probeUrl HTTP probe URL that triggered a portal classification
 * @param httpDuration HTTP probe duration
 * @param httpsDuration HTTPS probe duration
 * @since 0.1.0
 */
public record ValidationResult(
    boolean httpOnly,
    int numAttempts,
    ProbeResult httpResult,
    int httpStatusCode,
    OptionalLong httpContentLength,
    ProbeResult httpsResult,
    Optional<URI> redirectUrl,
    Optional<URI> probeUrl,
    Duration httpDuration,
    Duration httpsDuration) {

  /** Response code metric for status codes outside 100..599. */
  public static final int RESPONSE_CODE_INVALID = 1;
  /** Response code metric for a redirect status without a usable Location. */
  public static final int RESPONSE_CODE_INCOMPLETE_REDIRECT = 2;
  /** Response code metric for a 200 response whose content length is unknown. */
  public static final int RESPONSE_CODE_NO_CONTENT_LENGTH_200 = 3;

  public ValidationResult {
    Objects.requireNonNull(httpResult, "httpResult");
    Objects.requireNonNull(httpsResult, "httpsResult");
    httpContentLength = httpContentLength == null ? OptionalLong.empty() : httpContentLength;
    redirectUrl = redirectUrl == null ? Optional.empty() : redirectUrl;
    probeUrl = probeUrl == null ? Optional.empty() : probeUrl;
    httpDuration = httpDuration == null ? Duration.ZERO : httpDuration;
    httpsDuration = httpsDuration == null ? Duration.ZERO : httpsDuration;
  }

  /**
   * Merges the per-probe outcomes of an attempt. A {@code null} outcome means the probe has not finished.
   *
   * @param httpOnly attempt mode
   * @param numAttempts attempt counter
   * @param http HTTP probe outcome or {@code null}
   * @param https HTTPS probe outcome or {@code null}
   * @return merged result
   */
  public static ValidationResult combine(
      boolean httpOnly, int numAttempts, ProbeOutcome http, ProbeOutcome https) {
    Builder builder = builder().httpOnly(httpOnly).numAttempts(numAttempts);
    if (http != null) {
      builder.httpResult(http.result())
          .httpStatusCode(http.statusCode())
          .httpContentLength(http.contentLength())
          .redirectUrl(http.redirectUrl().orElse(null))
          .probeUrl(http.probeUrl().orElse(null))
          .httpDuration(http.duration());
    }
    if (https != null) {
      builder.httpsResult(https.result()).httpsDuration(https.duration());
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isHttpProbeComplete() {
    return httpResult != ProbeResult.NO_RESULT;
  }

  public boolean isHttpsProbeComplete() {
    return httpsResult != ProbeResult.NO_RESULT;
  }

  public boolean isHttpProbeSuccessful() {
    return httpResult == ProbeResult.SUCCESS;
  }

  public boolean isHttpsProbeSuccessful() {
    return httpsResult == ProbeResult.SUCCESS;
  }

  /**
   * A redirect only counts when a usable sign-in location was captured.
   *
   * @return {@code true} for a clean portal redirect
   */
  public boolean isHttpProbeRedirected() {
    return httpResult == ProbeResult.PORTAL_REDIRECT && redirectUrl.isPresent();
  }

  public boolean isHttpProbeRedirectionSuspected() {
    return httpResult == ProbeResult.PORTAL_SUSPECTED;
  }

  /**
   * Determines whether the attempt can be reported.
   *
   * <p>A portal redirect or suspected portal completes the attempt immediately, without waiting for the HTTPS
   * probe. In HTTP-only mode the HTTP probe alone is enough. Otherwise both probes must have finished.</p>
   *
   * @return {@code true} once the attempt has a reportable verdict
   */
  public boolean isComplete() {
    if (isHttpProbeRedirected() || isHttpProbeRedirectionSuspected()) {
      return true;
    }
    if (isHttpProbeComplete() && httpOnly) {
      return true;
    }
    return isHttpProbeComplete() && isHttpsProbeComplete();
  }

  /**
   * Derives the connectivity verdict.
   *
   * @return verdict; HTTP-only attempts never yield {@link ValidationState#NO_CONNECTIVITY}
   */
  public ValidationState validationState() {
    if (isHttpsProbeSuccessful() && isHttpProbeSuccessful()) {
      return ValidationState.INTERNET_CONNECTIVITY;
    }
    if (isHttpProbeRedirected()) {
      return ValidationState.PORTAL_REDIRECT;
    }
    if (isHttpProbeRedirectionSuspected()) {
      return ValidationState.PORTAL_SUSPECTED;
    }
    if (httpOnly) {
      return ValidationState.INTERNET_CONNECTIVITY;
    }
    return ValidationState.NO_CONNECTIVITY;
  }

  /**
   * Returns the URL the user should open to sign in: the redirect location for a portal redirect, the probe URL
   * for a suspected portal.
   *
   * @return sign-in URL, empty when no portal was found
   */
  public Optional<URI> signInUrl() {
    return switch (validationState()) {
      case PORTAL_REDIRECT -> redirectUrl;
      case PORTAL_SUSPECTED -> probeUrl;
      default -> Optional.empty();
    };
  }

  /**
   * Maps the attempt onto the coarse result metric.
   *
   * @return result metric
   */
  public ResultMetric resultMetric() {
    return switch (httpResult) {
      case NO_RESULT -> ResultMetric.UNKNOWN;
      case DNS_FAILURE -> ResultMetric.DNS_FAILURE;
      case DNS_TIMEOUT -> ResultMetric.DNS_TIMEOUT;
      case TLS_FAILURE, CONNECTION_FAILURE -> ResultMetric.CONNECTION_FAILURE;
      case HTTP_TIMEOUT -> ResultMetric.HTTP_TIMEOUT;
      case SUCCESS -> (httpOnly || isHttpsProbeSuccessful())
          ? ResultMetric.ONLINE
          : ResultMetric.HTTPS_FAILURE;
      case PORTAL_SUSPECTED -> {
        if (httpOnly) {
          yield ResultMetric.REDIRECT_FOUND;
        }
        yield isHttpsProbeSuccessful() ? ResultMetric.NO_CONNECTIVITY : ResultMetric.HTTPS_FAILURE;
      }
      case PORTAL_REDIRECT -> ResultMetric.REDIRECT_FOUND;
      case PORTAL_INVALID_REDIRECT -> ResultMetric.REDIRECT_NO_URL;
      case FAILURE -> ResultMetric.HTTP_FAILURE;
    };
  }

  /**
   * Returns the HTTP status code to report, folding anomalous responses into sentinel values.
   *
   * @return status code or one of the {@code RESPONSE_CODE_*} sentinels; empty when the HTTP probe got no response
   */
  public OptionalInt httpResponseCodeMetric() {
    if (httpStatusCode == 0) {
      return OptionalInt.empty();
    }
    if (httpStatusCode < 100 || httpStatusCode > 599) {
      return OptionalInt.of(RESPONSE_CODE_INVALID);
    }
    if (HttpStatus.isRedirect(httpStatusCode) && !isHttpProbeRedirected()) {
      return OptionalInt.of(RESPONSE_CODE_INCOMPLETE_REDIRECT);
    }
    if (httpStatusCode == HttpStatus.OK && httpContentLength.isEmpty()) {
      return OptionalInt.of(RESPONSE_CODE_NO_CONTENT_LENGTH_200);
    }
    return OptionalInt.of(httpStatusCode);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(160);
    sb.append("{ num_attempts=").append(numAttempts).append(", HTTP probe");
    if (!isHttpProbeComplete()) {
      sb.append(" in-flight");
    } else {
      sb.append(" result=").append(httpResult).append(" code=").append(httpStatusCode);
      httpContentLength.ifPresent(length -> sb.append(" content-length=").append(length));
      sb.append(" duration=").append(httpDuration.toMillis()).append("ms");
    }
    sb.append(", HTTPS probe");
    if (httpOnly) {
      sb.append(" disabled");
    } else if (!isHttpsProbeComplete()) {
      sb.append(" in-flight");
    } else {
      sb.append(" result=").append(httpsResult)
          .append(" duration=").append(httpsDuration.toMillis()).append("ms");
    }
    redirectUrl.ifPresent(url -> sb.append(", redirect_url=").append(url));
    probeUrl.ifPresent(url -> sb.append(", probe_url=").append(url));
    sb.append(", is_complete=").append(isComplete()).append('}');
    return sb.toString();
  }

  /**
   * Mutable builder used by the prober when merging outcomes and by callers assembling fixtures.
   */
  public static final class Builder {
    private boolean httpOnly;
    private int numAttempts;
    private ProbeResult httpResult = ProbeResult.NO_RESULT;
    private int httpStatusCode;
    private OptionalLong httpContentLength = OptionalLong.empty();
    private ProbeResult httpsResult = ProbeResult.NO_RESULT;
    private URI redirectUrl;
    private URI probeUrl;
    private Duration httpDuration = Duration.ZERO;
    private Duration httpsDuration = Duration.ZERO;

    private Builder() {}

    public Builder httpOnly(boolean value) {
      this.httpOnly = value;
      return this;
    }

    public Builder numAttempts(int value) {
      this.numAttempts = value;
      return this;
    }

    public Builder httpResult(ProbeResult value) {
      this.httpResult = Objects.requireNonNull(value, "httpResult");
      return this;
    }

    public Builder httpStatusCode(int value) {
      this.httpStatusCode = value;
      return this;
    }

    public Builder httpContentLength(long value) {
      this.httpContentLength = OptionalLong.of(value);
      return this;
    }

    public Builder httpContentLength(OptionalLong value) {
      this.httpContentLength = value == null ? OptionalLong.empty() : value;
      return this;
    }

    public Builder httpsResult(ProbeResult value) {
      this.httpsResult = Objects.requireNonNull(value, "httpsResult");
      return this;
    }

    public Builder redirectUrl(URI value) {
      this.redirectUrl = value;
      return this;
    }

    public Builder probeUrl(URI value) {
      this.probeUrl = value;
      return this;
    }

    public Builder httpDuration(Duration value) {
      this.httpDuration = value;
      return this;
    }

    public Builder httpsDuration(Duration value) {
      this.httpsDuration = value;
      return this;
    }

    public ValidationResult build() {
      return new ValidationResult(
          httpOnly,
          numAttempts,
          httpResult,
          httpStatusCode,
          httpContentLength,
          httpsResult,
          Optional.ofNullable(redirectUrl),
          Optional.ofNullable(probeUrl),
          httpDuration,
          httpsDuration);
    }
  }
}
