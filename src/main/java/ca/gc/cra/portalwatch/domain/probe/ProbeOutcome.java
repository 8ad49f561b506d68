package ca.gc.cra.portalwatch.domain.probe;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Immutable outcome of one finished probe. The HTTP and HTTPS probes of an attempt each produce one of these;
 * they are only combined into a {@link ValidationResult} when the attempt completes.
 *
 * @param result classification of the probe
 * @param statusCode HTTP status code, or {@code 0} when no response was received
 * @param contentLength response content length when known
 * @param redirectUrl sign-in location captured from a redirect
 * @param probeUrl probe URL captured when the response looked like a portal
 * @param duration time from attempt start to probe completion
 * @since 0.1.0
 */
public record ProbeOutcome(
    ProbeResult result,
    int statusCode,
    OptionalLong contentLength,
    Optional<URI> redirectUrl,
    Optional<URI> probeUrl,
    Duration duration) {

  public ProbeOutcome {
    Objects.requireNonNull(result, "result");
    contentLength = contentLength == null ? OptionalLong.empty() : contentLength;
    redirectUrl = redirectUrl == null ? Optional.empty() : redirectUrl;
    probeUrl = probeUrl == null ? Optional.empty() : probeUrl;
    duration = duration == null ? Duration.ZERO : duration;
  }

  /**
   * Creates an outcome for a probe that ended without an HTTP response.
   *
   * @param result failure classification
   * @param duration elapsed time
   * @return outcome without status or content metadata
   */
  public static ProbeOutcome failed(ProbeResult result, Duration duration) {
    return new ProbeOutcome(result, 0, OptionalLong.empty(), Optional.empty(), Optional.empty(), duration);
  }

  /**
   * Creates a successful outcome with no HTTP metadata (HTTPS probes).
   *
   * @param duration elapsed time
   * @return success outcome
   */
  public static ProbeOutcome succeeded(Duration duration) {
    return failed(ProbeResult.SUCCESS, duration);
  }
}
