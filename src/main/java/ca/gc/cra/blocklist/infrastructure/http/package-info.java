/**
 * HTTP adapters built on the JDK {@code java.net.http} client: list downloads and DNS-over-HTTPS existence
 * queries.
 */
package ca.gc.cra.blocklist.infrastructure.http;
