/**
 * Adapters implementing the application ports: HTTP probing over the JDK client, the single-threaded event loop,
 * OpenTelemetry metrics and the system clock.
 */
package ca.gc.cra.portalwatch.infrastructure;
