package ca.gc.cra.portalwatch.application.port;

import ca.gc.cra.portalwatch.domain.probe.ValidationResult;
import ca.gc.cra.portalwatch.domain.service.ConnectState;
import java.net.URI;
import java.util.Optional;

/**
 * <strong>What:</strong> Observer of service connection state changes.
 * <p><strong>Why:</strong> UI and policy layers consume the connection state literally; this is the only way they
 * learn about validation verdicts.</p>
 * <p><strong>Thread-safety:</strong> Invoked on the event loop thread; implementations must not block.</p>
 *
 * @since 0.1.0
 */
public interface ConnectStateListener {
  /**
   * Called when the state of a service changes.
   *
   * @param serviceId serial number of the service
   * @param previous state before the change
   * @param current state after the change
   * @param probeUrl sign-in URL when {@code current} is redirect-found
   */
  void onStateChanged(long serviceId, ConnectState previous, ConnectState current, Optional<URI> probeUrl);

  /**
   * Called for every validation result applied to the service, before any resulting state change.
   *
   * @param serviceId serial number of the service
   * @param result applied result
   */
  default void onValidationResult(long serviceId, ValidationResult result) {}

  /** Listener that ignores every notification. */
  ConnectStateListener NO_OP = (serviceId, previous, current, probeUrl) -> {};
}
