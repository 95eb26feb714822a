package ca.gc.cra.blocklist.infrastructure.http;

import ca.gc.cra.blocklist.application.port.ExistenceOracle;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link ExistenceOracle} backed by a DNS-over-HTTPS JSON resolver.
 * <p><strong>Why:</strong> A JSON resolver answers over plain HTTPS, so verification needs no DNS library and
 * reuses the download client.</p>
 * <p><strong>Contract:</strong> {@code GET <resolver>?name=<domain>}; the response must be HTTP 200 with a JSON
 * object whose top-level {@code Status} field holds the DNS response code. Anything else is an
 * {@link IOException}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; the Jackson factory and HTTP client are shared.</p>
 *
 * @since 0.1.0
 */
public final class DnsJsonExistenceOracle implements ExistenceOracle {
  private static final String STATUS_FIELD = "Status";

  private final HttpClient client;
  private final URI resolver;
  private final Duration requestTimeout;
  private final JsonFactory factory = new JsonFactory();

  /**
   * Creates the oracle.
   *
   * @param client shared HTTP client
   * @param resolver resolver endpoint without the {@code name} parameter
   * @param requestTimeout per-query timeout
   */
  public DnsJsonExistenceOracle(HttpClient client, URI resolver, Duration requestTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  @Override
  public int resolve(String domain) throws IOException, InterruptedException {
    Objects.requireNonNull(domain, "domain");
    HttpRequest request =
        HttpRequest.newBuilder(queryUri(domain))
            .timeout(requestTimeout)
            .header("Accept", "application/dns-json")
            .GET()
            .build();
    HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    if (response.statusCode() != 200) {
      throw new IOException("resolver returned HTTP " + response.statusCode() + " for " + domain);
    }
    return readStatus(response.body());
  }

  URI queryUri(String domain) {
    String base = resolver.toString();
    String separator = resolver.getRawQuery() == null ? "?" : "&";
    return URI.create(base + separator + "name=" + URLEncoder.encode(domain, StandardCharsets.UTF_8));
  }

  /**
   * Extracts the top-level {@code Status} code from a resolver response body.
   *
   * @param body raw JSON
   * @return DNS response code
   * @throws IOException if the body is not a JSON object or has no integer {@code Status}
   */
  int readStatus(byte[] body) throws IOException {
    try (JsonParser parser = factory.createParser(body)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IOException("resolver response is not a JSON object");
      }
      JsonToken token;
      while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        JsonToken value = parser.nextToken();
        if (STATUS_FIELD.equals(field)) {
          if (value != JsonToken.VALUE_NUMBER_INT) {
            throw new IOException("resolver Status is not an integer: " + value);
          }
          return parser.getIntValue();
        }
        parser.skipChildren();
      }
      throw new IOException("resolver response has no Status (stopped at " + token + ")");
    }
  }
}
