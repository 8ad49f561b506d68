package ca.gc.cra.portalwatch.application.validation;

import ca.gc.cra.portalwatch.application.port.Cancellable;
import ca.gc.cra.portalwatch.application.port.ClockPort;
import ca.gc.cra.portalwatch.application.port.ProbeClient;
import ca.gc.cra.portalwatch.domain.probe.HttpStatus;
import ca.gc.cra.portalwatch.domain.probe.IpFamily;
import ca.gc.cra.portalwatch.domain.probe.ProbeError;
import ca.gc.cra.portalwatch.domain.probe.ProbeOutcome;
import ca.gc.cra.portalwatch.domain.probe.ProbeRequest;
import ca.gc.cra.portalwatch.domain.probe.ProbeResponse;
import ca.gc.cra.portalwatch.domain.probe.ProbeResult;
import ca.gc.cra.portalwatch.domain.probe.ProbingConfiguration;
import ca.gc.cra.portalwatch.domain.probe.ValidationResult;
import ca.gc.cra.portalwatch.logging.Logs;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one validation attempt at a time: an HTTP probe and, unless HTTP-only, a concurrent
 * HTTPS probe.
 * <p><strong>Why:</strong> Classifies each probe, merges both outcomes and reports the attempt exactly once, as soon
 * as a verdict is available.</p>
 * <p><strong>Role:</strong> Owned by a {@link ConnectivityMonitor}, one per interface.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick probe URLs: primary first, then each fallback once, then at random.</li>
 *   <li>Reuse the HTTP URL that revealed a portal until {@link #reset()}.</li>
 *   <li>Drop probe callbacks that arrive after {@link #stop()} or {@link #reset()}.</li>
 *   <li>Track the retry backoff the monitor consults before starting.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; every method and every probe callback must run on the event
 * loop thread.</p>
 *
 * @since 0.1.0
 */
public final class PortalProber {
  private static final Logger log = LoggerFactory.getLogger(PortalProber.class);

  /** Default {@code User-Agent} sent with every probe. */
  public static final String DEFAULT_USER_AGENT =
      "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) "
          + "Chrome/126.0.0.0 Safari/537.36";

  private final ProbingConfiguration configuration;
  private final ProbeClient probeClient;
  private final ClockPort clock;
  private final Random random;
  private final AttemptBackoff backoff;
  private final String interfaceName;
  private final String userAgent;

  private int attemptCount;
  private long generation;
  private URI portalFoundHttpUrl;
  private IpFamily lastIpFamily;
  private Attempt current;

  /**
   * Creates a prober.
   *
   * @param configuration probe URLs
   * @param probeClient transport used to issue probes
   * @param clock time source for probe durations
   * @param random source of randomness for URL rotation
   * @param backoff retry spacing consulted by the monitor
   * @param interfaceName interface name used for binding hints and the logging tag
   * @param userAgent {@code User-Agent} header value
   */
  public PortalProber(
      ProbingConfiguration configuration,
      ProbeClient probeClient,
      ClockPort clock,
      Random random,
      AttemptBackoff backoff,
      String interfaceName,
      String userAgent) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.probeClient = Objects.requireNonNull(probeClient, "probeClient");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = Objects.requireNonNull(random, "random");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.interfaceName = Objects.requireNonNull(interfaceName, "interfaceName");
    this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
  }

  /**
   * Starts an attempt. Does nothing (apart from logging) when an attempt is already running.
   *
   * <p>The callback fires exactly once unless {@link #stop()} or {@link #reset()} is called first. It normally
   * fires later from a probe callback; it fires before this method returns only if the probe client completes
   * synchronously.</p>
   *
   * @param httpOnly skip the HTTPS probe
   * @param ipFamily address family to probe over
   * @param dnsServers resolvers handed to the probe client
   * @param onResult receiver of the attempt result
   */
  public void start(
      boolean httpOnly,
      IpFamily ipFamily,
      List<InetAddress> dnsServers,
      Consumer<ValidationResult> onResult) {
    Objects.requireNonNull(ipFamily, "ipFamily");
    Objects.requireNonNull(dnsServers, "dnsServers");
    Objects.requireNonNull(onResult, "onResult");
    if (isRunning()) {
      log.info("{}: Attempt is already running", loggingTag());
      return;
    }
    lastIpFamily = ipFamily;
    attemptCount++;
    backoff.recordAttemptStart();

    URI httpUrl = portalFoundHttpUrl != null
        ? portalFoundHttpUrl
        : pickProbeUrl(configuration.httpUrl(), configuration.fallbackHttpUrls());
    URI httpsUrl = pickProbeUrl(configuration.httpsUrl(), configuration.fallbackHttpsUrls());
    Attempt attempt = new Attempt(
        ++generation, attemptCount, httpOnly, ipFamily, List.copyOf(dnsServers), httpUrl, onResult,
        clock.nowMillis());
    current = attempt;

    log.info("{}: Starting HTTP probe: {}", loggingTag(), httpUrl.getHost());
    attempt.httpHandle = issue(attempt, httpUrl, true);
    if (!httpOnly && isCurrent(attempt)) {
      log.info("{}: Starting HTTPS probe: {}", loggingTag(), httpsUrl.getHost());
      attempt.httpsHandle = issue(attempt, httpsUrl, false);
    }
  }

  /**
   * Cancels the running attempt, if any, without invoking its callback. The attempt counter is kept so the next
   * attempt continues the URL rotation.
   */
  public void stop() {
    Attempt attempt = current;
    current = null;
    generation++;
    if (attempt != null) {
      log.debug("{}: Stopping attempt {}", loggingTag(), attempt.number);
      attempt.httpHandle.cancel();
      attempt.httpsHandle.cancel();
    }
  }

  /** Stops any running attempt, resets the attempt counter and forgets the portal URL. */
  public void reset() {
    stop();
    attemptCount = 0;
    portalFoundHttpUrl = null;
  }

  /** Clears the retry backoff so the next attempt may start immediately. */
  public void resetAttemptDelays() {
    backoff.reset();
  }

  /**
   * Returns how long the monitor must wait before the next attempt may start.
   *
   * @return remaining delay, zero when an attempt may start now
   */
  public Duration nextAttemptDelay() {
    return backoff.nextAttemptDelay();
  }

  public boolean isRunning() {
    return current != null;
  }

  /**
   * Returns the number of attempts started since construction or the last {@link #reset()}.
   *
   * @return attempt counter
   */
  public int attemptCount() {
    return attemptCount;
  }

  /**
   * Returns the HTTP probe URL that revealed a portal, reused by subsequent attempts.
   *
   * @return sticky URL, empty when no portal was found since the last reset
   */
  public Optional<URI> portalFoundHttpUrl() {
    return Optional.ofNullable(portalFoundHttpUrl);
  }

  /**
   * Returns the log prefix, e.g. {@code wlan0 IPFamily=IPV4 attempt=2}.
   *
   * @return logging tag
   */
  public String loggingTag() {
    StringBuilder tag = new StringBuilder(interfaceName);
    if (lastIpFamily != null) {
      tag.append(" IPFamily=").append(lastIpFamily);
    }
    tag.append(" attempt=").append(attemptCount);
    return tag.toString();
  }

  URI pickProbeUrl(URI defaultUrl, List<URI> fallbackUrls) {
    if (attemptCount <= 1 || fallbackUrls.isEmpty()) {
      return defaultUrl;
    }
    int fallbackIndex = attemptCount - 2;
    if (fallbackIndex < fallbackUrls.size()) {
      return fallbackUrls.get(fallbackIndex);
    }
    // Index == size selects the primary URL so every candidate has equal weight.
    int index = random.nextInt(fallbackUrls.size() + 1);
    return index < fallbackUrls.size() ? fallbackUrls.get(index) : defaultUrl;
  }

  private Cancellable issue(Attempt attempt, URI url, boolean http) {
    String probeTag = loggingTag() + (http ? " HTTP probe" : " HTTPS probe");
    ProbeRequest request = new ProbeRequest(
        url, Map.of("User-Agent", userAgent), attempt.dnsServers, attempt.ipFamily, interfaceName, probeTag);
    ProbeClient.Callback callback = new ProbeClient.Callback() {
      @Override
      public void onResponse(ProbeResponse response) {
        if (!accepts(attempt, http)) {
          return;
        }
        if (http) {
          attempt.http = classifyHttpResponse(url, response, elapsed(attempt));
        } else {
          attempt.https = ProbeOutcome.succeeded(elapsed(attempt));
        }
        completeIfDone(attempt);
      }

      @Override
      public void onError(ProbeError error) {
        if (!accepts(attempt, http)) {
          return;
        }
        log.info("{}: failed with {}", probeTag, error);
        ProbeOutcome outcome = ProbeOutcome.failed(ProbeResult.fromError(error), elapsed(attempt));
        if (http) {
          attempt.http = outcome;
        } else {
          attempt.https = outcome;
        }
        completeIfDone(attempt);
      }
    };
    try {
      Cancellable handle = probeClient.issue(request, callback);
      return handle == null ? Cancellable.NONE : handle;
    } catch (RuntimeException ex) {
      log.warn("{}: could not be started", probeTag, ex);
      callback.onError(ProbeError.INTERNAL_ERROR);
      return Cancellable.NONE;
    }
  }

  private boolean accepts(Attempt attempt, boolean http) {
    if (!isCurrent(attempt)) {
      log.debug("{}: dropping stale {} probe callback for attempt {}",
          loggingTag(), http ? "HTTP" : "HTTPS", attempt.number);
      return false;
    }
    if ((http ? attempt.http : attempt.https) != null) {
      log.warn("{}: duplicate {} probe callback ignored", loggingTag(), http ? "HTTP" : "HTTPS");
      return false;
    }
    return true;
  }

  private boolean isCurrent(Attempt attempt) {
    return current != null && current.generation == attempt.generation;
  }

  private Duration elapsed(Attempt attempt) {
    return Duration.ofMillis(Math.max(0L, clock.nowMillis() - attempt.startMillis));
  }

  private void completeIfDone(Attempt attempt) {
    ValidationResult result =
        ValidationResult.combine(attempt.httpOnly, attempt.number, attempt.http, attempt.https);
    log.info("{}: {}", loggingTag(), result);
    if (!result.isComplete()) {
      return;
    }
    if (result.isHttpProbeRedirected() || result.isHttpProbeRedirectionSuspected()) {
      portalFoundHttpUrl = result.probeUrl().orElse(attempt.httpUrl);
    }
    // The HTTPS transport of an early-completed attempt is left to finish; its callback is dropped as stale.
    current = null;
    attempt.onResult.accept(result);
  }

  private ProbeOutcome classifyHttpResponse(URI url, ProbeResponse response, Duration duration) {
    int status = response.statusCode();
    OptionalLong contentLength = contentLength(response);
    ProbeResult result;
    URI probeUrl = null;
    URI redirectUrl = null;
    if (status == HttpStatus.NO_CONTENT) {
      result = ProbeResult.SUCCESS;
    } else if (status == HttpStatus.OK) {
      // Proxies that rewrite 204 into 200 sometimes add a single byte of body.
      if (contentLength.isPresent() && contentLength.getAsLong() <= 1) {
        result = ProbeResult.SUCCESS;
      } else if (contentLength.isPresent()) {
        probeUrl = url;
        result = ProbeResult.PORTAL_SUSPECTED;
      } else {
        log.warn("{}: Missing Content-Length", loggingTag());
        result = ProbeResult.FAILURE;
      }
    } else if (HttpStatus.isRedirect(status)) {
      probeUrl = url;
      redirectUrl = parseLocation(response.header("Location").orElse(null));
      result = redirectUrl != null ? ProbeResult.PORTAL_REDIRECT : ProbeResult.PORTAL_INVALID_REDIRECT;
    } else {
      result = ProbeResult.FAILURE;
    }
    return new ProbeOutcome(
        result, status, contentLength, Optional.ofNullable(redirectUrl), Optional.ofNullable(probeUrl), duration);
  }

  private OptionalLong contentLength(ProbeResponse response) {
    Optional<String> header = response.header("Content-Length");
    if (header.isEmpty() || header.get().isBlank()) {
      return OptionalLong.of(Math.max(0L, response.bodyLength()));
    }
    String value = header.get().trim();
    try {
      long parsed = Long.parseLong(value);
      if (parsed < 0) {
        log.warn("{}: Invalid Content-Length {}", loggingTag(), value);
        return OptionalLong.empty();
      }
      return OptionalLong.of(parsed);
    } catch (NumberFormatException ex) {
      log.warn("{}: Invalid Content-Length {}", loggingTag(), Logs.truncate(value, 32));
      return OptionalLong.empty();
    }
  }

  private URI parseLocation(String location) {
    if (location == null || location.isBlank()) {
      log.warn("{}: redirect without Location header", loggingTag());
      return null;
    }
    try {
      URI uri = new URI(location.trim());
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if (uri.isAbsolute() && uri.getHost() != null && (scheme.equals("http") || scheme.equals("https"))) {
        return uri;
      }
    } catch (URISyntaxException ex) {
      log.debug("{}: unparseable Location: {}", loggingTag(), ex.getMessage());
    }
    log.warn("{}: invalid redirect Location {}", loggingTag(), Logs.truncate(location, Logs.MAX_URL_LENGTH));
    return null;
  }

  private static final class Attempt {
    final long generation;
    final int number;
    final boolean httpOnly;
    final IpFamily ipFamily;
    final List<InetAddress> dnsServers;
    final URI httpUrl;
    final Consumer<ValidationResult> onResult;
    final long startMillis;
    Cancellable httpHandle = Cancellable.NONE;
    Cancellable httpsHandle = Cancellable.NONE;
    ProbeOutcome http;
    ProbeOutcome https;

    Attempt(
        long generation,
        int number,
        boolean httpOnly,
        IpFamily ipFamily,
        List<InetAddress> dnsServers,
        URI httpUrl,
        Consumer<ValidationResult> onResult,
        long startMillis) {
      this.generation = generation;
      this.number = number;
      this.httpOnly = httpOnly;
      this.ipFamily = ipFamily;
      this.dnsServers = dnsServers;
      this.httpUrl = httpUrl;
      this.onResult = onResult;
      this.startMillis = startMillis;
    }
  }
}
