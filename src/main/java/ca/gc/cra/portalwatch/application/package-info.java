/**
 * Application layer for connectivity validation.
 * <p><strong>Role:</strong> Hosts the portal prober, the per-interface connectivity monitor and the connection state
 * adapter, wired together through the ports in {@code application.port}.</p>
 * <p><strong>Concurrency:</strong> Every class in this layer is confined to the event loop thread; none of them
 * locks.</p>
 * <p><strong>Metrics:</strong> Emits the {@code validation.*} namespace.</p>
 */
package ca.gc.cra.portalwatch.application;
