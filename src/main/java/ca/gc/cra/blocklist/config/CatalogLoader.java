package ca.gc.cra.blocklist.config;

import ca.gc.cra.blocklist.domain.catalog.Catalog;
import ca.gc.cra.blocklist.domain.catalog.SourceDescriptor;
import ca.gc.cra.blocklist.domain.name.DomainNames;
import ca.gc.cra.blocklist.domain.rules.LineRule;
import ca.gc.cra.blocklist.domain.rules.Whitelist;
import ca.gc.cra.blocklist.domain.rules.WhitelistRule;
import ca.gc.cra.blocklist.validation.Uris;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads the catalog (sources, whitelist, shortlinks) from YAML.
 * <p><strong>Why:</strong> Upstream lists and exemptions change far more often than the code; keeping them in
 * data lets operators edit them without a release.</p>
 * <p><strong>Format:</strong></p>
 * <pre>
 * sources:
 *   - uri: https://adaway.org/hosts.txt
 *     format: hosts        # hosts | domains
 *     address: 127.0.0.1   # required for hosts
 * whitelist:
 *   - suffix: .googlevideo.com   # contains | prefix | suffix | equal | regex
 * shortlinks:
 *   - bit.ly
 * </pre>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class CatalogLoader {
  private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);
  /** Classpath location of the bundled catalog. */
  public static final String DEFAULT_RESOURCE = "/default-catalog.yaml";

  private CatalogLoader() {}

  /**
   * Loads a catalog file.
   *
   * @param path YAML file
   * @return parsed catalog
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the document is malformed
   */
  public static Catalog load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Catalog catalog = parse(reader, path.toString());
      log.info("Loaded catalog {}: {} source(s), {} whitelist rule(s), {} shortlink(s)",
          path, catalog.sources().size(), catalog.whitelist().size(), catalog.shortlinks().size());
      return catalog;
    }
  }

  /**
   * Loads the catalog bundled with the application.
   *
   * @return parsed default catalog
   * @throws IOException if the resource is missing or unreadable
   */
  public static Catalog loadDefault() throws IOException {
    InputStream in = CatalogLoader.class.getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      throw new IOException("bundled catalog not found: " + DEFAULT_RESOURCE);
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return parse(reader, DEFAULT_RESOURCE);
    }
  }

  static Catalog parse(Reader reader, String origin) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse catalog " + origin, ex);
    }
    if (document == null) {
      throw new IllegalArgumentException("catalog " + origin + " is empty");
    }
    Map<String, Object> root = YamlNodes.asMap(document, "catalog");
    return new Catalog(
        parseSources(YamlNodes.asList(root.get("sources"), "sources")),
        parseWhitelist(YamlNodes.asList(root.get("whitelist"), "whitelist")),
        parseShortlinks(YamlNodes.asList(root.get("shortlinks"), "shortlinks")));
  }

  private static List<SourceDescriptor> parseSources(List<Object> nodes) {
    List<SourceDescriptor> sources = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      String context = "sources[" + i + "]";
      Map<String, Object> node = YamlNodes.asMap(nodes.get(i), context);
      String uri = YamlNodes.asScalar(node.get("uri"), context + ".uri");
      String format = YamlNodes.asScalar(node.get("format"), context + ".format").toLowerCase(Locale.ROOT);
      LineRule rule = switch (format) {
        case "hosts" -> LineRule.hostLine(YamlNodes.asScalar(node.get("address"), context + ".address"));
        case "domains" -> LineRule.domainList();
        default -> throw new IllegalArgumentException(context + ".format must be hosts or domains (was " + format + ")");
      };
      sources.add(new SourceDescriptor(Uris.requireHttpUri(context + ".uri", uri), rule));
    }
    return sources;
  }

  private static Whitelist parseWhitelist(List<Object> nodes) {
    List<WhitelistRule> rules = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      String context = "whitelist[" + i + "]";
      Map<String, Object> node = YamlNodes.asMap(nodes.get(i), context);
      if (node.size() != 1) {
        throw new IllegalArgumentException(context + " must have exactly one of contains|prefix|suffix|equal|regex");
      }
      Map.Entry<String, Object> entry = node.entrySet().iterator().next();
      rules.add(WhitelistRule.of(entry.getKey(), YamlNodes.asScalar(entry.getValue(), context + "." + entry.getKey())));
    }
    return new Whitelist(rules);
  }

  private static List<String> parseShortlinks(List<Object> nodes) {
    List<String> shortlinks = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      String domain = DomainNames.normalize(YamlNodes.asScalar(nodes.get(i), "shortlinks[" + i + "]"));
      if (!DomainNames.isValid(domain)) {
        throw new IllegalArgumentException("shortlinks[" + i + "] is not a valid domain: " + domain);
      }
      if (!shortlinks.contains(domain)) {
        shortlinks.add(domain);
      }
    }
    return shortlinks;
  }
}
