package ca.gc.cra.blocklist.application.pipeline;

import ca.gc.cra.blocklist.application.port.BlocklistWriter;
import ca.gc.cra.blocklist.application.port.MetricsPort;
import ca.gc.cra.blocklist.domain.blocklist.BlocklistVariant;
import ca.gc.cra.blocklist.domain.blocklist.BlocklistVariants;
import ca.gc.cra.blocklist.domain.catalog.Catalog;
import ca.gc.cra.blocklist.domain.tld.TldSnapshot;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the full aggregation: public-suffix bootstrap, source collection, existence
 * verification, and publication of the four variants.
 * <p><strong>Why:</strong> Each phase needs the previous one complete, so the use case sequences the stages and
 * owns the per-run data that flows between them.</p>
 * <p><strong>Role:</strong> Application-layer entry point invoked by {@code RunCli}.</p>
 * <p><strong>Thread-safety:</strong> Not intended for concurrent {@link #run} calls; stages manage their own
 * worker pools.</p>
 * <p><strong>Observability:</strong> Logs stage summaries at INFO and emits {@code output.lines} per variant.</p>
 *
 * @since 0.1.0
 */
public final class BlocklistUseCase {
  private static final Logger log = LoggerFactory.getLogger(BlocklistUseCase.class);

  private final TldBootstrap bootstrap;
  private final CandidateStage candidateStage;
  private final VerificationStage verificationStage;
  private final BlocklistWriter writer;
  private final MetricsPort metrics;

  /**
   * Creates the use case from its stages.
   *
   * @param bootstrap public-suffix loader
   * @param candidateStage Stage A
   * @param verificationStage Stage B
   * @param writer output port
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public BlocklistUseCase(
      TldBootstrap bootstrap,
      CandidateStage candidateStage,
      VerificationStage verificationStage,
      BlocklistWriter writer,
      MetricsPort metrics) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.candidateStage = Objects.requireNonNull(candidateStage, "candidateStage");
    this.verificationStage = Objects.requireNonNull(verificationStage, "verificationStage");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Executes one run.
   *
   * @param catalog sources, whitelist, and shortlinks
   * @param tldListUri plain TLD list location
   * @param effectiveTldUri effective TLD names location
   * @return tallies of the run; a failed variant write is reported rather than thrown
   * @throws InterruptedException if the run is interrupted
   */
  public RunReport run(Catalog catalog, URI tldListUri, URI effectiveTldUri) throws InterruptedException {
    Objects.requireNonNull(catalog, "catalog");
    TldSnapshot tlds = bootstrap.load(tldListUri, effectiveTldUri);
    if (tlds.isEmpty()) {
      log.warn("No public suffix data available; every source domain will be rejected");
    }

    SourceProcessor processor = new SourceProcessor(tlds, catalog.whitelist(), metrics);
    CandidateStage.Result collected = candidateStage.collect(catalog.sources(), processor);
    VerificationStage.Result verified = verificationStage.verify(collected.candidates());

    BlocklistVariants variants = BlocklistVariants.from(verified.domains(), catalog.shortlinks());
    Map<BlocklistVariant, Integer> written = new EnumMap<>(BlocklistVariant.class);
    List<BlocklistVariant> failed = new ArrayList<>();
    for (Map.Entry<BlocklistVariant, List<String>> entry : variants.asMap().entrySet()) {
      BlocklistVariant variant = entry.getKey();
      List<String> lines = entry.getValue();
      try {
        writer.write(variant, lines);
        written.put(variant, lines.size());
        metrics.observe("output.lines", lines.size());
        log.info("Wrote {} line(s) to {}", lines.size(), variant.fileName());
      } catch (IOException ex) {
        failed.add(variant);
        log.error("Failed to write {}", variant.fileName(), ex);
      }
    }

    RunReport report =
        new RunReport(
            catalog.sources().size(),
            collected.sourcesFailed(),
            collected.candidates().size(),
            verified.nxdomain(),
            verified.unverified(),
            verified.domains().size(),
            verified.peakInFlight(),
            written,
            failed);
    log.info("Run complete: {}", report);
    return report;
  }
}
