package ca.gc.cra.blocklist.config;

import ca.gc.cra.blocklist.application.pipeline.BlocklistUseCase;
import ca.gc.cra.blocklist.application.pipeline.CandidateStage;
import ca.gc.cra.blocklist.application.pipeline.ExistenceVerifier;
import ca.gc.cra.blocklist.application.pipeline.RetryingSourceFetcher;
import ca.gc.cra.blocklist.application.pipeline.TldBootstrap;
import ca.gc.cra.blocklist.application.pipeline.VerificationStage;
import ca.gc.cra.blocklist.application.port.MetricsPort;
import ca.gc.cra.blocklist.application.port.SourceFetcher;
import ca.gc.cra.blocklist.domain.catalog.Catalog;
import ca.gc.cra.blocklist.infrastructure.http.DnsJsonExistenceOracle;
import ca.gc.cra.blocklist.infrastructure.http.HttpClients;
import ca.gc.cra.blocklist.infrastructure.http.HttpSourceFetcher;
import ca.gc.cra.blocklist.infrastructure.output.FileBlocklistWriter;
import java.io.IOException;
import java.net.http.HttpClient;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the block list use cases to their concrete adapters.
 * <p><strong>Why:</strong> Keeps configuration-to-object translation in one place so the CLI only deals with
 * arguments and exit codes.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new object graphs.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final BlocklistConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a composition root.
   *
   * @param config run configuration
   * @param metrics metrics sink shared by every component
   */
  public CompositionRoot(BlocklistConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Loads the configured catalog, or the bundled one when none is configured.
   *
   * @return catalog
   * @throws IOException if the catalog cannot be read
   */
  public Catalog catalog() throws IOException {
    return config.catalog().isPresent()
        ? CatalogLoader.load(config.catalog().get())
        : CatalogLoader.loadDefault();
  }

  /**
   * Builds the full pipeline over HTTP and the file system.
   *
   * @return use case
   */
  public BlocklistUseCase blocklistUseCase() {
    HttpClient client = HttpClients.create(config.connectTimeout());
    SourceFetcher fetcher =
        new RetryingSourceFetcher(
            new HttpSourceFetcher(client, config.requestTimeout()), config.fetchRetry(), metrics);
    ExistenceVerifier verifier =
        new ExistenceVerifier(
            new DnsJsonExistenceOracle(client, config.resolverUri(), config.requestTimeout()),
            config.verifyRetry(),
            metrics);
    return new BlocklistUseCase(
        new TldBootstrap(fetcher),
        new CandidateStage(fetcher),
        new VerificationStage(verifier, config.verifyConcurrency(), config.queueCapacity(), metrics),
        new FileBlocklistWriter(config.outputDirectory()),
        metrics);
  }

  /**
   * Returns the metrics sink shared by the wired components.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }
}
