package ca.gc.cra.portalwatch.api;

import ca.gc.cra.portalwatch.application.connection.ConnectionStateAdapter;
import ca.gc.cra.portalwatch.application.port.ConnectStateListener;
import ca.gc.cra.portalwatch.config.CompositionRoot;
import ca.gc.cra.portalwatch.config.ValidationConfig;
import ca.gc.cra.portalwatch.domain.probe.ValidationResult;
import ca.gc.cra.portalwatch.domain.probe.ValidationState;
import ca.gc.cra.portalwatch.domain.service.ConnectState;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One CLI run: attaches a single service to the configured interface and turns its state changes into console
 * output and an exit code.
 *
 * <p>Listener callbacks arrive on the event loop thread; {@link #await()} and {@link #stop(Duration)} are called
 * from the CLI thread.</p>
 */
final class ValidationSession implements ConnectStateListener {
  private static final Logger log = LoggerFactory.getLogger(ValidationSession.class);

  /** Command flavour. */
  enum Kind {
    /** Stop at the first verdict that settles the run. */
    CHECK,
    /** Print every transition until stopped. */
    WATCH
  }

  private final CompositionRoot root;
  private final Kind kind;
  private final CompletableFuture<ExitCode> verdict = new CompletableFuture<>();

  // loop-confined
  private ConnectionStateAdapter adapter;
  private int attempts;

  ValidationSession(CompositionRoot root, Kind kind) {
    this.root = Objects.requireNonNull(root, "root");
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /** Creates the service and attaches it on the event loop. */
  void start() {
    root.eventLoop().post(() -> {
      ValidationConfig config = root.config();
      adapter = root.newService(this);
      adapter.attachNetwork(config.ifindex(), config.ipFamily(), config.dnsServers());
    });
  }

  ExitCode await() throws InterruptedException, ExecutionException {
    return verdict.get();
  }

  ExitCode await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
    return verdict.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Completes the session from outside the loop, e.g. from a shutdown hook.
   *
   * @param code exit code to report when no verdict was reached yet
   */
  void finish(ExitCode code) {
    verdict.complete(code);
  }

  /**
   * Detaches the service on the event loop so the validation log emits its session metrics.
   *
   * @param timeout how long to wait for the loop
   * @throws InterruptedException if interrupted while waiting
   */
  void stop(Duration timeout) throws InterruptedException {
    CompletableFuture<Void> detached = new CompletableFuture<>();
    root.eventLoop().post(() -> {
      try {
        if (adapter != null) {
          adapter.detachNetwork();
        }
      } finally {
        detached.complete(null);
      }
    });
    try {
      detached.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException ex) {
      log.warn("Detaching the service failed", ex.getCause());
    } catch (TimeoutException ex) {
      log.warn("Timed out after {} ms detaching the service", timeout.toMillis());
    }
  }

  int attempts() {
    return attempts;
  }

  @Override
  public void onValidationResult(long serviceId, ValidationResult result) {
    attempts++;
    log.debug("Attempt {} result {}", attempts, result);
    if (kind != Kind.CHECK) {
      return;
    }
    ValidationState state = result.validationState();
    if (state == ValidationState.INTERNET_CONNECTIVITY) {
      report(ExitCode.SUCCESS, "online", Optional.empty());
      return;
    }
    ValidationConfig config = root.config();
    boolean exhausted = config.maxAttempts() > 0 && attempts >= config.maxAttempts();
    if (!exhausted && config.retryOnFailure()) {
      return;
    }
    if (state == ValidationState.NO_CONNECTIVITY) {
      report(ExitCode.NO_CONNECTIVITY, ConnectState.NO_CONNECTIVITY.label(), Optional.empty());
    } else {
      report(ExitCode.PORTAL_DETECTED, ConnectState.REDIRECT_FOUND.label(), result.signInUrl());
    }
  }

  @Override
  public void onStateChanged(long serviceId, ConnectState previous, ConnectState current, Optional<URI> probeUrl) {
    if (kind == Kind.WATCH) {
      CliPrinter.transition(previous, current, probeUrl);
      return;
    }
    // Transitions that happen without a validation result: disabled mode and a start failure.
    if (current == ConnectState.ONLINE && attempts == 0) {
      report(ExitCode.SUCCESS, "online", Optional.empty());
    } else if (current == ConnectState.NO_CONNECTIVITY && attempts == 0) {
      report(ExitCode.NO_CONNECTIVITY, current.label(), Optional.empty());
    }
  }

  private void report(ExitCode code, String label, Optional<URI> signInUrl) {
    if (verdict.complete(code)) {
      CliPrinter.verdict(label, signInUrl);
    }
  }
}
