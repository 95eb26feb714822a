/**
 * <strong>Purpose:</strong> Ports separating the block list pipeline from the network, the file system, and
 * metrics backends.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.blocklist.application.port;
