/**
 * Configuration loading and wiring: embedded defaults, YAML files, CLI overrides, the catalog, and the
 * composition root that turns them into use cases.
 * <p><strong>Precedence:</strong> CLI &gt; YAML &gt; defaults.</p>
 */
package ca.gc.cra.blocklist.config;
