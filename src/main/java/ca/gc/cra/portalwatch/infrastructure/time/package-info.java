/**
 * Time adapters implementing {@link ca.gc.cra.portalwatch.application.port.ClockPort}.
 */
package ca.gc.cra.portalwatch.infrastructure.time;
