package ca.gc.cra.portalwatch.application.port;

import ca.gc.cra.portalwatch.domain.probe.ProbeError;
import ca.gc.cra.portalwatch.domain.probe.ProbeRequest;
import ca.gc.cra.portalwatch.domain.probe.ProbeResponse;

/**
 * <strong>What:</strong> Port issuing one HTTP(S) GET for a probe.
 * <p><strong>Why:</strong> Keeps the transport, DNS resolution and interface binding outside the validation core,
 * which only sees a response or a typed {@link ProbeError}.</p>
 * <p><strong>Role:</strong> Implemented by {@code JdkHttpProbeClient}; the prober receives it by constructor
 * injection.</p>
 * <p><strong>Thread-safety:</strong> {@link #issue(ProbeRequest, Callback)} is called from the event loop thread
 * and callbacks must be delivered on that same thread.</p>
 *
 * @since 0.1.0
 */
public interface ProbeClient {
  /**
   * Starts a single-shot probe. Exactly one callback method fires unless the returned handle is cancelled first.
   *
   * @param request probe parameters
   * @param callback receiver of the outcome
   * @return handle cancelling the probe
   * @throws RuntimeException if the probe cannot be started at all; callers treat this as a failed probe
   */
  Cancellable issue(ProbeRequest request, Callback callback);

  /**
   * Receiver of a probe outcome.
   */
  interface Callback {
    /**
     * Called when a response (headers and body) was received.
     *
     * @param response response metadata
     */
    void onResponse(ProbeResponse response);

    /**
     * Called when the probe failed before a response was received.
     *
     * @param error typed transport error
     */
    void onError(ProbeError error);
  }
}
