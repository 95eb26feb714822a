/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound untrusted text before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for fetch, validation, and verification diagnostics.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.blocklist.logging;
