package ca.gc.cra.blocklist.infrastructure.http;

import ca.gc.cra.blocklist.application.port.SourceFetcher;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SourceFetcher} adapter performing one HTTP GET per call.
 * <p><strong>Why:</strong> Every upstream list and both public-suffix lists are plain HTTP resources.</p>
 * <p><strong>Thread-safety:</strong> Delegates to a thread-safe {@link HttpClient}.</p>
 * <p><strong>Performance:</strong> Streams the body; nothing is buffered beyond the client's own window.</p>
 *
 * @since 0.1.0
 */
public final class HttpSourceFetcher implements SourceFetcher {
  private static final Logger log = LoggerFactory.getLogger(HttpSourceFetcher.class);

  private final HttpClient client;
  private final Duration requestTimeout;

  /**
   * Creates the adapter.
   *
   * @param client shared HTTP client
   * @param requestTimeout timeout until response headers arrive
   */
  public HttpSourceFetcher(HttpClient client, Duration requestTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  /**
   * Issues a GET for {@code uri}.
   *
   * @throws IOException on transport failure or a non-2xx status
   */
  @Override
  public InputStream fetch(URI uri) throws IOException, InterruptedException {
    Objects.requireNonNull(uri, "uri");
    HttpRequest request = HttpRequest.newBuilder(uri).timeout(requestTimeout).GET().build();
    HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    int status = response.statusCode();
    if (status < 200 || status > 299) {
      response.body().close();
      throw new IOException("HTTP " + status + " from " + uri);
    }
    log.debug("Fetching {} (HTTP {})", uri, status);
    return response.body();
  }
}
