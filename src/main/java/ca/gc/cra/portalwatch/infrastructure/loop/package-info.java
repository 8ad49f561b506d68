/**
 * The process-wide event loop that owns all validation state.
 */
package ca.gc.cra.portalwatch.infrastructure.loop;
