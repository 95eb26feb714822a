package ca.gc.cra.blocklist.application.port;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

/**
 * <strong>What:</strong> Port that opens the raw content of one remote list.
 * <p><strong>Why:</strong> Keeps the transport (HTTP today) out of the validation pipeline and lets tests feed
 * canned content.</p>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent calls for different URIs.</p>
 *
 * @since 0.1.0
 */
public interface SourceFetcher {
  /**
   * Opens the content at {@code uri}. The caller owns and closes the returned stream.
   *
   * @param uri absolute http(s) location; must not be {@code null}
   * @return content stream
   * @throws IOException if the content cannot be obtained (transport failure or non-2xx status)
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  InputStream fetch(URI uri) throws IOException, InterruptedException;
}
