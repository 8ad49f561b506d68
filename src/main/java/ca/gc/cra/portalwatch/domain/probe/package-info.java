/**
 * Probe-level value types: probing configuration, per-probe outcomes, attempt results, and the validation
 * vocabulary (reasons, modes, states).
 *
 * @since 0.1.0
 */
package ca.gc.cra.portalwatch.domain.probe;
