/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing, configuration bootstrap, and catalog
 * loading.
 * <p><strong>Pipeline role:</strong> Rejects invalid inputs before ports/adapters allocate network or file
 * resources.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.blocklist.validation;
