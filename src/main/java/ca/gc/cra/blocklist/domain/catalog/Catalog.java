package ca.gc.cra.blocklist.domain.catalog;

import ca.gc.cra.blocklist.domain.rules.Whitelist;
import java.util.List;
import java.util.Objects;

/**
 * Everything a run needs to know about its inputs besides the network endpoints: the upstream sources, the
 * whitelist, and the URL shortener domains.
 *
 * @param sources upstream lists in catalog order
 * @param whitelist exemption rules
 * @param shortlinks shortener domains, lower-case
 * @since 0.1.0
 */
public record Catalog(List<SourceDescriptor> sources, Whitelist whitelist, List<String> shortlinks) {
  public Catalog {
    sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    whitelist = Objects.requireNonNull(whitelist, "whitelist");
    shortlinks = List.copyOf(Objects.requireNonNull(shortlinks, "shortlinks"));
  }
}
