package ca.gc.cra.blocklist.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.blocklist.application.port.ExistenceOracle;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DnsJsonExistenceOracleTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  @Test
  void returnsResolverStatus() throws Exception {
    try (LocalHttpServer server = new LocalHttpServer()
        .respond(200, "{\"Status\":3,\"TC\":false,\"Question\":[{\"name\":\"gone.example.com.\",\"type\":1}]}")) {
      DnsJsonExistenceOracle oracle = oracle(server.uri("/resolve"));

      assertEquals(ExistenceOracle.NXDOMAIN, oracle.resolve("gone.example.com"));
      URI request = server.requests().get(0);
      assertEquals("/resolve", request.getPath());
      assertEquals("name=gone.example.com", request.getQuery());
    }
  }

  @Test
  void nonOkStatusIsAnIoError() throws Exception {
    try (LocalHttpServer server = new LocalHttpServer().respond(500, "")) {
      DnsJsonExistenceOracle oracle = oracle(server.uri("/resolve"));

      assertThrows(IOException.class, () -> oracle.resolve("ads.example.com"));
    }
  }

  @Test
  void queryUriAppendsToExistingQuery() {
    DnsJsonExistenceOracle oracle = oracle(URI.create("https://resolver.example.net/resolve?type=A"));

    assertEquals(
        URI.create("https://resolver.example.net/resolve?type=A&name=ads.example.com"),
        oracle.queryUri("ads.example.com"));
  }

  @Test
  void readStatusSkipsNestedStructuresBeforeStatus() throws Exception {
    DnsJsonExistenceOracle oracle = oracle(URI.create("https://resolver.example.net/resolve"));

    int status = oracle.readStatus(bytes("{\"Question\":[{\"name\":\"x.\"}],\"Meta\":{\"Status\":9},\"Status\":0}"));

    assertEquals(0, status);
  }

  @Test
  void readStatusRejectsMalformedBodies() {
    DnsJsonExistenceOracle oracle = oracle(URI.create("https://resolver.example.net/resolve"));

    assertThrows(IOException.class, () -> oracle.readStatus(bytes("[1,2,3]")));
    assertThrows(IOException.class, () -> oracle.readStatus(bytes("{\"Status\":\"NXDOMAIN\"}")));
    assertThrows(IOException.class, () -> oracle.readStatus(bytes("{\"Answer\":[]}")));
    assertThrows(IOException.class, () -> oracle.readStatus(bytes("{\"Status\":")));
  }

  private static DnsJsonExistenceOracle oracle(URI resolver) {
    return new DnsJsonExistenceOracle(HttpClients.create(TIMEOUT), resolver, TIMEOUT);
  }

  private static byte[] bytes(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }
}
