package ca.gc.cra.blocklist.application.pipeline;

import java.io.IOException;
import java.net.URI;

/**
 * Raised when every fetch attempt for a URI failed. The last attempt's failure is the cause.
 *
 * @since 0.1.0
 */
public final class FetchFailedException extends IOException {
  private static final long serialVersionUID = 1L;

  private final URI uri;
  private final int attempts;

  /**
   * Creates the exception.
   *
   * @param uri location that could not be fetched
   * @param attempts number of attempts made
   * @param cause failure of the final attempt
   */
  public FetchFailedException(URI uri, int attempts, Throwable cause) {
    super("fetch failed after " + attempts + " attempt(s): " + uri, cause);
    this.uri = uri;
    this.attempts = attempts;
  }

  /**
   * Returns the location that could not be fetched.
   *
   * @return URI
   */
  public URI uri() {
    return uri;
  }

  /**
   * Returns the number of attempts made.
   *
   * @return attempt count
   */
  public int attempts() {
    return attempts;
  }
}
