/**
 * Metrics adapters that bridge the block list {@code MetricsPort} to OpenTelemetry or a no-op implementation.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and cache instruments per metric name.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code fetch.*}, {@code source.*}, {@code verify.*}, and
 * {@code output.*} namespaces.</p>
 */
package ca.gc.cra.blocklist.infrastructure.metrics;
