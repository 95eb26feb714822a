package ca.gc.cra.blocklist.domain.catalog;

import ca.gc.cra.blocklist.domain.rules.LineRule;
import java.net.URI;
import java.util.Objects;

/**
 * One upstream list and the rule that understands its lines.
 *
 * @param uri absolute http(s) location
 * @param rule line format
 * @since 0.1.0
 */
public record SourceDescriptor(URI uri, LineRule rule) {
  public SourceDescriptor {
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(rule, "rule");
  }
}
