/**
 * Service-side vocabulary: connection states and identifier generation.
 */
package ca.gc.cra.portalwatch.domain.service;
