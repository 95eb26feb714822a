package ca.gc.cra.blocklist.config;

import ca.gc.cra.blocklist.application.pipeline.RetryPolicy;
import ca.gc.cra.blocklist.validation.Numbers;
import ca.gc.cra.blocklist.validation.Uris;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings of a {@code run} invocation.
 * <p><strong>Why:</strong> Turns the merged flat key/value map into typed values once, so adapters never parse
 * strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param outputDirectory directory receiving the four variants
 * @param catalog catalog file; empty selects the bundled default catalog
 * @param tldListUri plain TLD list location
 * @param effectiveTldUri effective TLD names location
 * @param resolverUri DNS-over-HTTPS JSON endpoint
 * @param fetchRetry retry budget for downloads
 * @param verifyRetry retry budget for existence lookups
 * @param verifyConcurrency maximum lookups in flight
 * @param queueCapacity capacity of the aggregation queue
 * @param connectTimeout HTTP connection timeout
 * @param requestTimeout HTTP request timeout
 * @since 0.1.0
 */
public record BlocklistConfig(
    Path outputDirectory,
    Optional<Path> catalog,
    URI tldListUri,
    URI effectiveTldUri,
    URI resolverUri,
    RetryPolicy fetchRetry,
    RetryPolicy verifyRetry,
    int verifyConcurrency,
    int queueCapacity,
    Duration connectTimeout,
    Duration requestTimeout) {

  private static final int MAX_ATTEMPTS = 100;
  private static final int MAX_DELAY_MILLIS = 600_000;
  private static final int MAX_CONCURRENCY = 1_000;
  private static final int MAX_QUEUE = 100_000;

  public BlocklistConfig {
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(tldListUri, "tldListUri");
    Objects.requireNonNull(effectiveTldUri, "effectiveTldUri");
    Objects.requireNonNull(resolverUri, "resolverUri");
    Objects.requireNonNull(fetchRetry, "fetchRetry");
    Objects.requireNonNull(verifyRetry, "verifyRetry");
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  /**
   * Returns the settings used when no overrides are supplied.
   *
   * @return default configuration
   */
  public static BlocklistConfig defaults() {
    return fromMap(DefaultsForMode.asFlatMap("run"));
  }

  /**
   * Parses a merged configuration map. Missing keys fall back to {@link DefaultsForMode}.
   *
   * @param args flat key/value map
   * @return validated configuration
   * @throws IllegalArgumentException naming the offending key when a value is invalid
   */
  public static BlocklistConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");
    SettingReader reader = key -> {
      String value = args.get(key);
      return value == null || value.isBlank() ? defaults.get(key) : value.trim();
    };

    String catalogValue = Optional.ofNullable(args.get("catalog")).map(String::trim).orElse("");
    return new BlocklistConfig(
        Path.of(reader.get("outputDir")),
        catalogValue.isEmpty() ? Optional.empty() : Optional.of(Path.of(catalogValue)),
        Uris.requireHttpUri("tldListUri", reader.get("tldListUri")),
        Uris.requireHttpUri("effectiveTldUri", reader.get("effectiveTldUri")),
        Uris.requireHttpUri("resolverUri", reader.get("resolverUri")),
        RetryPolicy.ofMillis(
            Numbers.parseIntInRange("fetch.maxAttempts", reader.get("fetch.maxAttempts"), 1, MAX_ATTEMPTS),
            Numbers.parseIntInRange(
                "fetch.retryDelayMillis", reader.get("fetch.retryDelayMillis"), 0, MAX_DELAY_MILLIS)),
        RetryPolicy.ofMillis(
            Numbers.parseIntInRange("verify.maxAttempts", reader.get("verify.maxAttempts"), 1, MAX_ATTEMPTS),
            Numbers.parseIntInRange(
                "verify.retryDelayMillis", reader.get("verify.retryDelayMillis"), 0, MAX_DELAY_MILLIS)),
        Numbers.parseIntInRange("verify.concurrency", reader.get("verify.concurrency"), 1, MAX_CONCURRENCY),
        Numbers.parseIntInRange("verify.queueCapacity", reader.get("verify.queueCapacity"), 1, MAX_QUEUE),
        Duration.ofMillis(Numbers.parseIntInRange(
            "http.connectTimeoutMillis", reader.get("http.connectTimeoutMillis"), 1, MAX_DELAY_MILLIS)),
        Duration.ofMillis(Numbers.parseIntInRange(
            "http.requestTimeoutMillis", reader.get("http.requestTimeoutMillis"), 1, MAX_DELAY_MILLIS)));
  }

  @FunctionalInterface
  private interface SettingReader {
    String get(String key);
  }
}
