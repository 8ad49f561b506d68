/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep portal URLs readable in logs.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Security:</strong> Portal sign-in URLs often carry session tokens in their query string; use
 * {@link ca.gc.cra.portalwatch.logging.Logs#redactQuery(java.net.URI)} before logging them at INFO.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.portalwatch.logging;
