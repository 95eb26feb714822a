package ca.gc.cra.blocklist.application.port;

import java.io.IOException;

/**
 * Port for the remote resolver that tells whether a domain exists.
 *
 * <p>An implementation performs exactly one query per call and reports the DNS response code it received. Every
 * failure to obtain a code (transport error, unexpected HTTP status, unreadable body) surfaces as an
 * {@link IOException}; retry policy belongs to the caller.</p>
 *
 * @since 0.1.0
 */
public interface ExistenceOracle {
  /** DNS response code for a name that does not exist. */
  int NXDOMAIN = 3;

  /**
   * Resolves {@code domain} once.
   *
   * @param domain lower-cased domain; must not be {@code null}
   * @return DNS response code from the resolver
   * @throws IOException if no response code could be obtained
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  int resolve(String domain) throws IOException, InterruptedException;
}
