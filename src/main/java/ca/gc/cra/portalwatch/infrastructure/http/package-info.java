/**
 * {@link ca.gc.cra.portalwatch.application.port.ProbeClient} backed by {@link java.net.http.HttpClient}.
 */
package ca.gc.cra.portalwatch.infrastructure.http;
