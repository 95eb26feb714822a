package ca.gc.cra.blocklist.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Validation helpers for the HTTP endpoints named in configuration and the source catalog.
 *
 * @since 0.1.0
 */
public final class Uris {

  private Uris() {
    // Utility
  }

  /**
   * Parses an absolute {@code http} or {@code https} URI that names a host.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw candidate URI text
   * @return parsed URI
   * @throws IllegalArgumentException if the value is blank, malformed, relative, host-less, or uses another scheme
   */
  public static URI requireHttpUri(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI (was " + trimmed + ")", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null) {
      throw new IllegalArgumentException(name + " must be an absolute URI (was " + trimmed + ")");
    }
    String normalized = scheme.toLowerCase(Locale.ROOT);
    if (!normalized.equals("http") && !normalized.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https scheme (was " + scheme + ")");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(name + " must include a host (was " + trimmed + ")");
    }
    return uri;
  }
}
