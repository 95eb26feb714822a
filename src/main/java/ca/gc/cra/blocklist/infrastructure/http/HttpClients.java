package ca.gc.cra.blocklist.infrastructure.http;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Builds the shared JDK {@link HttpClient} used for list downloads and resolver queries.
 */
public final class HttpClients {

  private HttpClients() {
    // Utility
  }

  /**
   * Creates a client that follows redirects (list hosts move between http and https) and bounds connection setup.
   *
   * @param connectTimeout connection timeout
   * @return new client
   */
  public static HttpClient create(Duration connectTimeout) {
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    return HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(connectTimeout)
        .build();
  }
}
