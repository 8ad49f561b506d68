/**
 * Validation core: the single-attempt {@link ca.gc.cra.portalwatch.application.validation.PortalProber}, the
 * per-interface {@link ca.gc.cra.portalwatch.application.validation.ConnectivityMonitor} that decides when attempts
 * run, and the bounded {@link ca.gc.cra.portalwatch.application.validation.ValidationLog}.
 * <p><strong>Concurrency:</strong> Confined to the event loop thread.</p>
 */
package ca.gc.cra.portalwatch.application.validation;
