/**
 * <strong>Purpose:</strong> Ports separating the validation core from transport, scheduling, time and metrics.
 * <p><strong>Role:</strong> Infrastructure adapters implement these interfaces; tests substitute hand-written fakes.</p>
 * <p><strong>Concurrency:</strong> Unless documented otherwise, callbacks handed to a port are invoked on the event
 * loop thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.portalwatch.application.port;
