package ca.gc.cra.portalwatch.application.connection;

import ca.gc.cra.portalwatch.application.port.ConnectStateListener;
import ca.gc.cra.portalwatch.application.validation.ConnectivityMonitor;
import ca.gc.cra.portalwatch.application.validation.ValidationLog;
import ca.gc.cra.portalwatch.domain.probe.IpFamily;
import ca.gc.cra.portalwatch.domain.probe.ValidationMode;
import ca.gc.cra.portalwatch.domain.probe.ValidationReason;
import ca.gc.cra.portalwatch.domain.probe.ValidationResult;
import ca.gc.cra.portalwatch.domain.probe.ValidationState;
import ca.gc.cra.portalwatch.domain.service.ConnectState;
import ca.gc.cra.portalwatch.logging.Logs;
import java.net.InetAddress;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Drives the connection state of one service from the results of its connectivity monitor.
 * <p><strong>Why:</strong> Turns a {@link ValidationState} into {@code online}, {@code redirect-found} or
 * {@code no-connectivity} and keeps the sign-in URL the user needs to open.</p>
 * <p><strong>Role:</strong> One instance per service; owns the monitor and the validation log of the network the
 * service is attached to.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Ignore results for an interface the service is no longer attached to.</li>
 *   <li>Treat a validation that cannot start as no-connectivity.</li>
 *   <li>Skip probing entirely when validation is disabled.</li>
 *   <li>Request a retry after every verdict other than internet connectivity.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the event loop thread.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionStateAdapter {
  private static final Logger log = LoggerFactory.getLogger(ConnectionStateAdapter.class);

  /**
   * Creates the monitor for a newly attached network.
   */
  @FunctionalInterface
  public interface MonitorFactory {
    /**
     * Creates a monitor.
     *
     * @param interfaceIndex index of the attached interface
     * @param listener receiver the monitor must report results to
     * @return new monitor
     */
    ConnectivityMonitor create(int interfaceIndex, ConnectivityMonitor.ResultListener listener);
  }

  private final long serviceId;
  private final String serviceName;
  private final MonitorFactory monitorFactory;
  private final Supplier<ValidationLog> validationLogFactory;
  private final ConnectStateListener listener;
  private final boolean retryOnFailure;

  private ConnectState state = ConnectState.IDLE;
  private ValidationMode validationMode = ValidationMode.FULL_VALIDATION;
  private URI probeUrl;

  private int attachedInterfaceIndex = -1;
  private IpFamily ipFamily = IpFamily.IPV4;
  private List<InetAddress> dnsServers = List.of();
  private ConnectivityMonitor monitor;
  private ValidationLog validationLog;

  /**
   * Creates an adapter for one service.
   *
   * @param serviceId serial number identifying the service
   * @param serviceName name used in log lines
   * @param monitorFactory source of connectivity monitors
   * @param validationLogFactory source of per-session validation logs
   * @param listener observer of state changes
   * @param retryOnFailure request {@link ValidationReason#RETRY_VALIDATION} after non-online verdicts
   */
  public ConnectionStateAdapter(
      long serviceId,
      String serviceName,
      MonitorFactory monitorFactory,
      Supplier<ValidationLog> validationLogFactory,
      ConnectStateListener listener,
      boolean retryOnFailure) {
    this.serviceId = serviceId;
    this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
    this.monitorFactory = Objects.requireNonNull(monitorFactory, "monitorFactory");
    this.validationLogFactory = Objects.requireNonNull(validationLogFactory, "validationLogFactory");
    this.listener = listener == null ? ConnectStateListener.NO_OP : listener;
    this.retryOnFailure = retryOnFailure;
  }

  /**
   * Attaches the service to a network that finished IP provisioning and starts validating it. A previously
   * attached network is detached first.
   *
   * @param interfaceIndex index of the interface
   * @param family address family to validate
   * @param dns resolvers of the network; empty means validation cannot start
   */
  public void attachNetwork(int interfaceIndex, IpFamily family, List<InetAddress> dns) {
    Objects.requireNonNull(family, "family");
    Objects.requireNonNull(dns, "dns");
    if (attachedInterfaceIndex >= 0) {
      detachNetwork();
    }
    attachedInterfaceIndex = interfaceIndex;
    ipFamily = family;
    dnsServers = List.copyOf(dns);
    monitor = monitorFactory.create(interfaceIndex, this::onValidationResult);
    if (validationMode != ValidationMode.DISABLED) {
      monitor.setValidationMode(validationMode);
    }
    validationLog = validationLogFactory.get();
    log.info("{}: attached to interface {}", serviceName, interfaceIndex);
    setState(ConnectState.CONNECTED);
    requestValidation(ValidationReason.NETWORK_CONNECTION_UPDATE);
  }

  /**
   * Stops validation, flushes the session metrics and moves the service to idle.
   */
  public void detachNetwork() {
    if (attachedInterfaceIndex < 0) {
      return;
    }
    log.info("{}: detached from interface {}", serviceName, attachedInterfaceIndex);
    monitor.stop();
    validationLog.recordMetrics();
    monitor = null;
    validationLog = null;
    attachedInterfaceIndex = -1;
    probeUrl = null;
    setState(ConnectState.IDLE);
  }

  /**
   * Requests (re)validation of the attached network.
   *
   * @param reason trigger of the request
   * @return {@code false} when no network is attached or validation could not start
   */
  public boolean requestValidation(ValidationReason reason) {
    Objects.requireNonNull(reason, "reason");
    if (monitor == null) {
      log.debug("{}: validation ({}) requested without an attached network", serviceName, reason);
      return false;
    }
    if (validationMode == ValidationMode.DISABLED) {
      log.info("{}: validation disabled, assuming online", serviceName);
      probeUrl = null;
      setState(ConnectState.ONLINE);
      return true;
    }
    if (!monitor.start(reason, ipFamily, dnsServers)) {
      log.warn("{}: validation ({}) could not start", serviceName, reason);
      setState(ConnectState.NO_CONNECTIVITY);
      return false;
    }
    return true;
  }

  /**
   * Updates the validation mode. Disabling validation stops probing and moves a connected service online;
   * other changes revalidate.
   *
   * @param mode new mode
   */
  public void setValidationMode(ValidationMode mode) {
    Objects.requireNonNull(mode, "mode");
    if (mode == validationMode) {
      return;
    }
    log.info("{}: validation mode {} -> {}", serviceName, validationMode, mode);
    validationMode = mode;
    if (monitor == null) {
      return;
    }
    if (mode == ValidationMode.DISABLED) {
      monitor.stop();
    } else {
      monitor.setValidationMode(mode);
    }
    requestValidation(ValidationReason.SERVICE_PROPERTY_UPDATE);
  }

  /**
   * Applies a result delivered by the monitor.
   *
   * @param interfaceIndex interface the result was produced for
   * @param result attempt result
   */
  void onValidationResult(int interfaceIndex, ValidationResult result) {
    if (interfaceIndex != attachedInterfaceIndex) {
      log.debug("{}: ignoring result for interface {} (attached to {})",
          serviceName, interfaceIndex, attachedInterfaceIndex);
      return;
    }
    if (!state.isConnected()) {
      log.debug("{}: ignoring result in state {}", serviceName, state.label());
      return;
    }
    validationLog.append(result);
    listener.onValidationResult(serviceId, result);

    ValidationState verdict = result.validationState();
    switch (verdict) {
      case INTERNET_CONNECTIVITY -> {
        probeUrl = null;
        setState(ConnectState.ONLINE);
      }
      case PORTAL_REDIRECT, PORTAL_SUSPECTED -> {
        probeUrl = result.signInUrl().orElse(null);
        log.info("{}: portal detected, sign-in URL {}", serviceName, Logs.redactQuery(probeUrl));
        setState(ConnectState.REDIRECT_FOUND);
      }
      case NO_CONNECTIVITY -> {
        probeUrl = null;
        setState(ConnectState.NO_CONNECTIVITY);
      }
      default -> throw new IllegalStateException("Unhandled validation state " + verdict);
    }
    if (verdict != ValidationState.INTERNET_CONNECTIVITY && retryOnFailure && monitor != null) {
      requestValidation(ValidationReason.RETRY_VALIDATION);
    }
  }

  /**
   * Moves the service to a new state, notifying the listener on change.
   *
   * @param next new state
   */
  public void setState(ConnectState next) {
    Objects.requireNonNull(next, "next");
    if (next == state) {
      return;
    }
    ConnectState previous = state;
    state = next;
    log.info("{}: {} -> {}", serviceName, previous.label(), next.label());
    listener.onStateChanged(serviceId, previous, next, probeUrl());
  }

  public ConnectState state() {
    return state;
  }

  /**
   * Returns the sign-in URL discovered by the last portal verdict.
   *
   * @return probe URL, empty unless the service is redirect-found
   */
  public Optional<URI> probeUrl() {
    return Optional.ofNullable(probeUrl);
  }

  public boolean isPortalled() {
    return state.isPortalled();
  }

  public ValidationMode validationMode() {
    return validationMode;
  }

  public long serviceId() {
    return serviceId;
  }

  /**
   * Returns the validation log of the current session.
   *
   * @return log, empty when no network is attached
   */
  public Optional<ValidationLog> validationLog() {
    return Optional.ofNullable(validationLog);
  }

  public int attachedInterfaceIndex() {
    return attachedInterfaceIndex;
  }
}
