/**
 * Executor factories for pipeline worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the source, public-suffix, verification, and
 * aggregation threads.</p>
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return independently managed executors.</p>
 */
package ca.gc.cra.blocklist.infrastructure.exec;
