/**
 * Adapters implementing the application ports: HTTP fetching and resolution, file output, metrics, and worker
 * pools.
 */
package ca.gc.cra.blocklist.infrastructure;
