/**
 * Core domain model for portalwatch network validation.
 * <p><strong>Role:</strong> Domain layer value types describing probes, attempt results, and service connection
 * states without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to hand across the event loop boundary.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed the {@code validation.*} metric names.</p>
 */
package ca.gc.cra.portalwatch.domain;
