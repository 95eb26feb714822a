package ca.gc.cra.blocklist.application.pipeline;

import ca.gc.cra.blocklist.application.port.MetricsPort;
import ca.gc.cra.blocklist.domain.blocklist.HierarchicalOptimizer;
import ca.gc.cra.blocklist.domain.name.DomainNames;
import ca.gc.cra.blocklist.infrastructure.output.FileBlocklistWriter;
import ca.gc.cra.blocklist.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the hierarchical reduction to an existing list file without touching the network.
 *
 * <p>Blank lines and {@code #} comments are skipped, entries are lower-cased, and malformed entries are dropped.
 * Undecodable bytes are replaced rather than failing the read, so they only invalidate their own line.
 * The output is sorted and written the same way as the published variants.</p>
 *
 * @since 0.1.0
 */
public final class OptimizeUseCase {
  private static final Logger log = LoggerFactory.getLogger(OptimizeUseCase.class);

  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public OptimizeUseCase(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Reads {@code input}, reduces it, and writes the sorted result to {@code output}.
   *
   * @param input existing list
   * @param output destination, replaced if present
   * @return number of lines written
   * @throws IOException if reading or writing fails
   */
  public int run(Path input, Path output) throws IOException {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    Set<String> domains = new HashSet<>();
    int dropped = 0;
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(Files.newInputStream(input), StandardCharsets.UTF_8))) {
      String raw;
      while ((raw = reader.readLine()) != null) {
        String line = DomainNames.normalize(raw.trim());
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        if (DomainNames.isValid(line)) {
          domains.add(line);
        } else {
          dropped++;
          log.debug("invalid domain: {}", Logs.line(line));
        }
      }
    }

    List<String> lines = new ArrayList<>(HierarchicalOptimizer.optimize(domains));
    Collections.sort(lines);
    FileBlocklistWriter.writeLines(output, lines);
    metrics.observe("output.lines", lines.size());
    log.info("Optimized {} domain(s) to {} line(s) ({} invalid entr(ies) dropped): {}",
        domains.size(), lines.size(), dropped, output);
    return lines.size();
  }
}
