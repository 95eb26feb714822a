package ca.gc.cra.blocklist.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import org.junit.jupiter.api.Test;

class UrisTest {

  @Test
  void acceptsHttpAndHttps() {
    assertEquals(URI.create("https://dns.google.com/resolve"),
        Uris.requireHttpUri("resolverUri", " https://dns.google.com/resolve "));
    assertEquals(URI.create("http://data.iana.org/TLD/tlds-alpha-by-domain.txt"),
        Uris.requireHttpUri("tldListUri", "http://data.iana.org/TLD/tlds-alpha-by-domain.txt"));
  }

  @Test
  void rejectsOtherSchemesAndRelativeUris() {
    assertThrows(IllegalArgumentException.class, () -> Uris.requireHttpUri("u", "ftp://example.com/list"));
    assertThrows(IllegalArgumentException.class, () -> Uris.requireHttpUri("u", "/relative/list"));
    assertThrows(IllegalArgumentException.class, () -> Uris.requireHttpUri("u", "http:///nohost"));
    assertThrows(IllegalArgumentException.class, () -> Uris.requireHttpUri("u", "http://bad host/"));
  }
}
