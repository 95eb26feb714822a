package ca.gc.cra.blocklist.application.pipeline;

import ca.gc.cra.blocklist.application.port.SourceFetcher;
import ca.gc.cra.blocklist.domain.tld.TldSnapshot;
import ca.gc.cra.blocklist.infrastructure.exec.ExecutorFactories;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads the public-suffix reference data before any source is filtered.
 * <p><strong>Why:</strong> Both reference lists are needed to classify a single domain, so they are fetched
 * concurrently and the snapshot is published only once both downloads have finished.</p>
 * <p><strong>Role:</strong> First phase of {@link BlocklistUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Each call uses its own builder and pool.</p>
 * <p><strong>Observability:</strong> Logs the snapshot size at INFO and a failed list at WARN.</p>
 *
 * @since 0.1.0
 */
public final class TldBootstrap {
  private static final Logger log = LoggerFactory.getLogger(TldBootstrap.class);

  private final SourceFetcher fetcher;

  /**
   * Creates a bootstrap over a (normally retrying) fetcher.
   *
   * @param fetcher content fetcher
   */
  public TldBootstrap(SourceFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  /**
   * Fetches both lists concurrently and builds the snapshot. A list that cannot be fetched contributes nothing.
   *
   * @param tldListUri plain TLD list location
   * @param effectiveTldUri effective TLD names location
   * @return immutable snapshot
   * @throws InterruptedException if interrupted while waiting for the downloads
   */
  public TldSnapshot load(URI tldListUri, URI effectiveTldUri) throws InterruptedException {
    Objects.requireNonNull(tldListUri, "tldListUri");
    Objects.requireNonNull(effectiveTldUri, "effectiveTldUri");
    TldSnapshot.Builder builder = TldSnapshot.builder();
    List<Callable<Integer>> tasks =
        List.of(
            () -> feed(tldListUri, builder::acceptTldListLine),
            () -> feed(effectiveTldUri, builder::acceptEffectiveTldLine));

    ExecutorService executor = ExecutorFactories.newWorkerPool(tasks.size(), "blocklist-tld", null);
    try {
      List<Future<Integer>> futures = executor.invokeAll(tasks);
      for (Future<Integer> future : futures) {
        awaitQuietly(future);
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      throw ex;
    } finally {
      executor.shutdown();
    }

    TldSnapshot snapshot = builder.build();
    log.info("Loaded public suffix data: {} exact label(s), {} suffix(es)",
        snapshot.exactLabels().size(), snapshot.suffixes().size());
    return snapshot;
  }

  private int feed(URI uri, Predicate<String> sink) throws InterruptedException {
    int accepted = 0;
    try (InputStream in = fetcher.fetch(uri);
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (sink.test(line)) {
          accepted++;
        }
      }
    } catch (IOException ex) {
      log.warn("Public suffix list {} unavailable after {} entr(ies): {}", uri, accepted, ex.getMessage());
    }
    return accepted;
  }

  private static void awaitQuietly(Future<Integer> future) throws InterruptedException {
    try {
      future.get();
    } catch (ExecutionException ex) {
      log.error("Public suffix task failed", ex.getCause());
    }
  }
}
