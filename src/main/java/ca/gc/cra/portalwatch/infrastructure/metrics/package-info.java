/**
 * Metrics adapters bridging {@link ca.gc.cra.portalwatch.application.port.MetricsPort} to OpenTelemetry or to a
 * no-op sink.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code validation.*} namespace, tagged with the interface name.</p>
 * <p><strong>Security:</strong> Only metric names and interface names are exported; never URLs.</p>
 */
package ca.gc.cra.portalwatch.infrastructure.metrics;
