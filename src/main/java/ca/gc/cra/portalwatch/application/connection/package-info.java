/**
 * Glue between validation verdicts and the connection state of a service.
 */
package ca.gc.cra.portalwatch.application.connection;
