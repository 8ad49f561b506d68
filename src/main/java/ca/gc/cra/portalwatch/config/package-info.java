/**
 * Configuration loading and composition root wiring for the portalwatch CLI.
 * <p><strong>Role:</strong> Merges defaults, YAML and command-line values into an immutable
 * {@link ca.gc.cra.portalwatch.config.ValidationConfig} and builds the object graph from it.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Relies on {@code ca.gc.cra.portalwatch.validation} utilities to reject malformed
 * URLs and addresses before any probe is issued.</p>
 */
package ca.gc.cra.portalwatch.config;
