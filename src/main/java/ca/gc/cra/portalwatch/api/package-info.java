/**
 * CLI entry points that run captive portal checks from the command line.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and drives a
 * {@link ca.gc.cra.portalwatch.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> The CLI thread only waits; all validation work runs on the event loop.</p>
 * <p><strong>Metrics:</strong> Resolves the OpenTelemetry exporter settings before wiring.</p>
 * <p><strong>Security:</strong> Validates user-supplied URLs and addresses before any probe is issued.</p>
 */
package ca.gc.cra.portalwatch.api;
