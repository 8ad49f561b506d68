/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.</p>
 * <p><strong>Observability:</strong> No logging; failures surface via {@link IllegalArgumentException} with the
 * offending key in the message.</p>
 * <p><strong>Security:</strong> DNS server entries must be IP literals; nothing here triggers a name lookup.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.portalwatch.validation;
