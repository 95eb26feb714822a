package ca.gc.cra.blocklist.application.pipeline;

import ca.gc.cra.blocklist.application.port.MetricsPort;
import ca.gc.cra.blocklist.domain.name.DomainNames;
import ca.gc.cra.blocklist.domain.rules.LineRule;
import ca.gc.cra.blocklist.domain.rules.Whitelist;
import ca.gc.cra.blocklist.domain.rules.WhitelistRule;
import ca.gc.cra.blocklist.domain.tld.TldSnapshot;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns the raw content of one source into its candidate domains.
 * <p><strong>Why:</strong> Every line passes the same gauntlet regardless of where it came from: lower-casing, the
 * source's line rule, the public-suffix check, then the whitelist.</p>
 * <p><strong>Role:</strong> Stage A worker logic; one instance is shared by all source tasks of a run.</p>
 * <p><strong>Thread-safety:</strong> Immutable; each call builds its own result set.</p>
 * <p><strong>Observability:</strong> Emits {@code source.lines.rejected}, {@code source.domains.tldMismatch},
 * {@code source.domains.whitelisted}, {@code source.domains.accepted}.</p>
 *
 * @since 0.1.0
 */
public final class SourceProcessor {
  private static final Logger log = LoggerFactory.getLogger(SourceProcessor.class);

  private final TldSnapshot tlds;
  private final Whitelist whitelist;
  private final MetricsPort metrics;

  /**
   * Creates a processor bound to this run's reference data.
   *
   * @param tlds public-suffix snapshot
   * @param whitelist exemption rules
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public SourceProcessor(TldSnapshot tlds, Whitelist whitelist, MetricsPort metrics) {
    this.tlds = Objects.requireNonNull(tlds, "tlds");
    this.whitelist = Objects.requireNonNull(whitelist, "whitelist");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Reads {@code content} line by line and collects the accepted domains. The stream is always closed.
   *
   * <p>A read failure part-way through keeps what was accepted so far and is logged at WARN.</p>
   *
   * @param content source content; must not be {@code null}
   * @param rule line format of this source; must not be {@code null}
   * @return accepted, deduplicated domains
   */
  public Set<String> process(InputStream content, LineRule rule) {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(rule, "rule");
    Set<String> accepted = new HashSet<>();
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(content, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        accept(DomainNames.normalize(line), rule).ifPresent(accepted::add);
      }
    } catch (IOException ex) {
      log.warn("Read failed after {} accepted domain(s) for {}: {}", accepted.size(), rule.describe(), ex.getMessage());
    }
    return accepted;
  }

  /**
   * Applies the per-line checks to one already lower-cased line.
   *
   * @param line lower-cased line
   * @param rule line format
   * @return accepted domain, or empty when the line is rejected at any step
   */
  Optional<String> accept(String line, LineRule rule) {
    Optional<String> candidate = rule.validate(line);
    if (candidate.isEmpty()) {
      metrics.increment("source.lines.rejected");
      return Optional.empty();
    }
    String domain = candidate.get();
    if (!tlds.matches(domain)) {
      log.debug("no public suffix: {}", domain);
      metrics.increment("source.domains.tldMismatch");
      return Optional.empty();
    }
    Optional<WhitelistRule> exemption = whitelist.firstMatch(domain);
    if (exemption.isPresent()) {
      log.debug("whitelisted by {} {}: {}", exemption.get().kind(), exemption.get().pattern(), domain);
      metrics.increment("source.domains.whitelisted");
      return Optional.empty();
    }
    metrics.increment("source.domains.accepted");
    return candidate;
  }
}
