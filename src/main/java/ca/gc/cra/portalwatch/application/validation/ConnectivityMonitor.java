package ca.gc.cra.portalwatch.application.validation;

import ca.gc.cra.portalwatch.application.port.Cancellable;
import ca.gc.cra.portalwatch.application.port.EventLoopPort;
import ca.gc.cra.portalwatch.application.port.MetricsPort;
import ca.gc.cra.portalwatch.domain.probe.HttpStatus;
import ca.gc.cra.portalwatch.domain.probe.IpFamily;
import ca.gc.cra.portalwatch.domain.probe.ValidationMode;
import ca.gc.cra.portalwatch.domain.probe.ValidationReason;
import ca.gc.cra.portalwatch.domain.probe.ValidationResult;
import java.net.InetAddress;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides when validation attempts run on one network interface.
 * <p><strong>Why:</strong> Triggers arrive from many places (IP provisioning, user requests, link monitoring,
 * retries); the monitor coalesces them onto a single {@link PortalProber} and honours its backoff.</p>
 * <p><strong>Role:</strong> Owned by the {@code ConnectionStateAdapter}; forwards every attempt result to its
 * {@link ResultListener} unchanged.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Refuse to start without DNS servers.</li>
 *   <li>Replace the prober on {@link ValidationReason#NETWORK_CONNECTION_UPDATE}, reuse it otherwise.</li>
 *   <li>Clear the backoff for reasons that must not wait, schedule delayed starts for the others.</li>
 *   <li>Emit per-attempt duration, response code and result metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the event loop thread.</p>
 *
 * @since 0.1.0
 */
public final class ConnectivityMonitor {
  private static final Logger log = LoggerFactory.getLogger(ConnectivityMonitor.class);

  /**
   * Receiver of attempt results.
   */
  @FunctionalInterface
  public interface ResultListener {
    /**
     * Called once per completed attempt on the event loop thread.
     *
     * @param interfaceIndex index of the interface the monitor was created for
     * @param result attempt result
     */
    void onValidationResult(int interfaceIndex, ValidationResult result);
  }

  /**
   * Creates fresh probers; replaced in tests to observe prober lifecycles.
   */
  @FunctionalInterface
  public interface ProberFactory {
    PortalProber create();
  }

  private final int interfaceIndex;
  private final String interfaceName;
  private final ProberFactory proberFactory;
  private final EventLoopPort eventLoop;
  private final MetricsPort metrics;
  private final ResultListener listener;

  private ValidationMode validationMode = ValidationMode.FULL_VALIDATION;
  private PortalProber prober;
  private Cancellable pendingStart = Cancellable.NONE;
  private boolean startPending;

  /**
   * Creates a monitor for one interface.
   *
   * @param interfaceIndex interface index reported with each result
   * @param interfaceName interface name for log lines
   * @param proberFactory source of probers
   * @param eventLoop loop used to schedule delayed attempts
   * @param metrics metrics sink
   * @param listener receiver of attempt results
   */
  public ConnectivityMonitor(
      int interfaceIndex,
      String interfaceName,
      ProberFactory proberFactory,
      EventLoopPort eventLoop,
      MetricsPort metrics,
      ResultListener listener) {
    this.interfaceIndex = interfaceIndex;
    this.interfaceName = Objects.requireNonNull(interfaceName, "interfaceName");
    this.proberFactory = Objects.requireNonNull(proberFactory, "proberFactory");
    this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * Requests validation.
   *
   * @param reason trigger of the request
   * @param ipFamily address family to validate
   * @param dnsServers resolvers of the interface
   * @return {@code false} when validation cannot run because no DNS servers are configured; {@code true} when an
   *     attempt is running, scheduled or was already in flight
   */
  public boolean start(ValidationReason reason, IpFamily ipFamily, List<InetAddress> dnsServers) {
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(ipFamily, "ipFamily");
    if (dnsServers == null || dnsServers.isEmpty()) {
      log.warn("{}: Cannot start validation ({}): no DNS servers", interfaceName, reason);
      return false;
    }
    if (prober == null || reason == ValidationReason.NETWORK_CONNECTION_UPDATE) {
      if (prober != null) {
        prober.reset();
      }
      cancelPendingStart();
      prober = proberFactory.create();
    }
    if (reason.resetsAttemptDelays()) {
      prober.resetAttemptDelays();
    }
    if (prober.isRunning()) {
      log.debug("{}: Validation already running, coalescing {}", interfaceName, reason);
      return true;
    }

    cancelPendingStart();
    Duration delay = prober.nextAttemptDelay();
    List<InetAddress> dns = List.copyOf(dnsServers);
    if (delay.isZero()) {
      log.info("{}: Starting validation ({})", interfaceName, reason);
      startAttempt(prober, ipFamily, dns);
      return true;
    }
    log.info("{}: Validation ({}) scheduled in {} ms", interfaceName, reason, delay.toMillis());
    PortalProber scheduled = prober;
    startPending = true;
    pendingStart = eventLoop.schedule(delay, () -> {
      startPending = false;
      pendingStart = Cancellable.NONE;
      if (scheduled == prober && !scheduled.isRunning()) {
        startAttempt(scheduled, ipFamily, dns);
      }
    });
    return true;
  }

  /**
   * Cancels any running or scheduled attempt and resets the prober.
   *
   * @return {@code true} if an attempt was running or scheduled
   */
  public boolean stop() {
    boolean wasRunning = isRunning();
    cancelPendingStart();
    if (prober != null) {
      prober.reset();
    }
    return wasRunning;
  }

  /**
   * Reports whether an attempt is in flight or scheduled.
   *
   * @return {@code true} while validation is active
   */
  public boolean isRunning() {
    return startPending || (prober != null && prober.isRunning());
  }

  /**
   * Selects how attempts probe. Takes effect on the next attempt.
   *
   * @param mode {@link ValidationMode#FULL_VALIDATION} or {@link ValidationMode#HTTP_ONLY}
   * @throws IllegalArgumentException for {@link ValidationMode#DISABLED}, which never runs a monitor
   */
  public void setValidationMode(ValidationMode mode) {
    Objects.requireNonNull(mode, "mode");
    if (mode == ValidationMode.DISABLED) {
      throw new IllegalArgumentException("Validation mode DISABLED does not use a monitor");
    }
    this.validationMode = mode;
  }

  public ValidationMode validationMode() {
    return validationMode;
  }

  public int interfaceIndex() {
    return interfaceIndex;
  }

  private void startAttempt(PortalProber target, IpFamily ipFamily, List<InetAddress> dnsServers) {
    boolean httpOnly = validationMode == ValidationMode.HTTP_ONLY;
    target.start(httpOnly, ipFamily, dnsServers, result -> onAttemptResult(target, result));
  }

  private void onAttemptResult(PortalProber source, ValidationResult result) {
    if (source != prober) {
      log.debug("{}: Ignoring result of a replaced prober", interfaceName);
      return;
    }
    log.info("{}: Validation result {} ({})", interfaceName, result.validationState(), result.resultMetric());
    recordMetrics(result);
    listener.onValidationResult(interfaceIndex, result);
  }

  private void recordMetrics(ValidationResult result) {
    long httpMillis = result.httpDuration().toMillis();
    long httpsMillis = result.httpsDuration().toMillis();
    if (result.isHttpProbeComplete()) {
      metrics.observe(ValidationMetrics.HTTP_DURATION, httpMillis);
    }
    if (!result.httpOnly() && result.isHttpsProbeComplete()) {
      metrics.observe(ValidationMetrics.HTTPS_DURATION, httpsMillis);
    }
    switch (result.validationState()) {
      case INTERNET_CONNECTIVITY -> metrics.observe(
          ValidationMetrics.INTERNET_DURATION, Math.max(httpMillis, httpsMillis));
      case PORTAL_REDIRECT, PORTAL_SUSPECTED -> metrics.observe(
          ValidationMetrics.PORTAL_DURATION, Math.max(httpMillis, httpsMillis));
      default -> {
        // No duration for failed attempts.
      }
    }
    result.httpResponseCodeMetric().ifPresent(
        code -> metrics.increment(ValidationMetrics.HTTP_RESPONSE_CODE_PREFIX + code));
    if (result.httpStatusCode() == HttpStatus.OK && result.httpContentLength().isPresent()) {
      metrics.observe(ValidationMetrics.HTTP_CONTENT_LENGTH, result.httpContentLength().getAsLong());
    }
    metrics.increment(ValidationMetrics.RESULT_PREFIX + result.resultMetric().metricName());
  }

  private void cancelPendingStart() {
    pendingStart.cancel();
    pendingStart = Cancellable.NONE;
    startPending = false;
  }

  PortalProber currentProber() {
    return prober;
  }
}
