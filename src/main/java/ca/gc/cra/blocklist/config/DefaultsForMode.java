package ca.gc.cra.blocklist.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys; every key a mode understands appears
 * here.</p>
 */
public final class DefaultsForMode {
  /** Plain TLD list published by IANA. */
  public static final String DEFAULT_TLD_LIST_URI = "http://data.iana.org/TLD/tlds-alpha-by-domain.txt";
  /** Public suffix list. */
  public static final String DEFAULT_EFFECTIVE_TLD_URI = "https://publicsuffix.org/list/effective_tld_names.dat";
  /** DNS-over-HTTPS JSON resolver. */
  public static final String DEFAULT_RESOLVER_URI = "https://dns.google.com/resolve";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode CLI mode ({@code run} or {@code optimize})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "optimize" -> buildOptimizeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("outputDir", ".");
    map.put("catalog", "");
    map.put("tldListUri", DEFAULT_TLD_LIST_URI);
    map.put("effectiveTldUri", DEFAULT_EFFECTIVE_TLD_URI);
    map.put("resolverUri", DEFAULT_RESOLVER_URI);
    map.put("fetch.maxAttempts", "10");
    map.put("fetch.retryDelayMillis", "5000");
    map.put("verify.maxAttempts", "10");
    map.put("verify.retryDelayMillis", "3000");
    map.put("verify.concurrency", "50");
    map.put("verify.queueCapacity", "20");
    map.put("http.connectTimeoutMillis", "30000");
    map.put("http.requestTimeoutMillis", "60000");
    return map;
  }

  private static Map<String, String> buildOptimizeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("out", "");
    return map;
  }
}
