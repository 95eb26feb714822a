package ca.gc.cra.blocklist.application.pipeline;

import ca.gc.cra.blocklist.application.port.SourceFetcher;
import ca.gc.cra.blocklist.domain.catalog.SourceDescriptor;
import ca.gc.cra.blocklist.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Stage A of a run: downloads every source in parallel and merges the filtered domains into
 * one candidate set.
 * <p><strong>Why:</strong> Sources are independent and dominated by network latency, so one task per source keeps
 * the stage as slow as its slowest source rather than the sum of all of them.</p>
 * <p><strong>Thread-safety:</strong> The candidate set of a call is guarded by a single lock; {@code invokeAll}
 * is the completion barrier, so the returned set is never mutated again.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code source} inside each task; logs per-source counts at
 * INFO and failed sources at WARN.</p>
 *
 * @since 0.1.0
 */
public final class CandidateStage {
  private static final Logger log = LoggerFactory.getLogger(CandidateStage.class);

  private final SourceFetcher fetcher;

  /**
   * Creates the stage.
   *
   * @param fetcher content fetcher, normally a {@link RetryingSourceFetcher}
   */
  public CandidateStage(SourceFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  /**
   * Outcome of Stage A.
   *
   * @param candidates merged candidate domains
   * @param sourcesSucceeded sources that were fetched
   * @param sourcesFailed sources that contributed nothing because every fetch attempt failed
   */
  public record Result(Set<String> candidates, int sourcesSucceeded, int sourcesFailed) {
    public Result {
      candidates = Set.copyOf(candidates);
    }
  }

  /**
   * Processes all sources and returns once every task has finished.
   *
   * @param sources upstream lists
   * @param processor filtering logic bound to this run's reference data
   * @return merged candidates and per-source tallies
   * @throws InterruptedException if interrupted while waiting for the tasks
   */
  public Result collect(List<SourceDescriptor> sources, SourceProcessor processor) throws InterruptedException {
    Objects.requireNonNull(sources, "sources");
    Objects.requireNonNull(processor, "processor");
    if (sources.isEmpty()) {
      log.warn("Catalog has no sources");
      return new Result(Set.of(), 0, 0);
    }

    Set<String> candidates = new HashSet<>();
    ReentrantLock lock = new ReentrantLock();
    List<Callable<Boolean>> tasks = new ArrayList<>(sources.size());
    for (SourceDescriptor source : sources) {
      tasks.add(() -> runSource(source, processor, candidates, lock));
    }

    int succeeded = 0;
    ExecutorService executor =
        ExecutorFactories.newWorkerPool(
            sources.size(),
            "blocklist-source",
            (thread, ex) -> log.error("Uncaught exception in {}", thread.getName(), ex));
    try {
      for (Future<Boolean> future : executor.invokeAll(tasks)) {
        if (outcome(future)) {
          succeeded++;
        }
      }
    } catch (InterruptedException ex) {
      log.warn("Source stage interrupted; requesting shutdown");
      executor.shutdownNow();
      throw ex;
    } finally {
      executor.shutdown();
    }

    lock.lock();
    try {
      log.info("Collected {} candidate domain(s) from {}/{} source(s)", candidates.size(), succeeded, sources.size());
      return new Result(candidates, succeeded, sources.size() - succeeded);
    } finally {
      lock.unlock();
    }
  }

  private boolean runSource(
      SourceDescriptor source, SourceProcessor processor, Set<String> candidates, ReentrantLock lock)
      throws InterruptedException {
    MDC.put("source", source.uri().toString());
    try (InputStream content = fetcher.fetch(source.uri())) {
      Set<String> accepted = processor.process(content, source.rule());
      lock.lock();
      try {
        candidates.addAll(accepted);
      } finally {
        lock.unlock();
      }
      log.info("Source {} ({}) contributed {} domain(s)", source.uri(), source.rule().describe(), accepted.size());
      return true;
    } catch (IOException ex) {
      log.warn("Source {} skipped: {}", source.uri(), ex.getMessage());
      return false;
    } finally {
      MDC.remove("source");
    }
  }

  private static boolean outcome(Future<Boolean> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      log.error("Source task failed", ex.getCause());
      return false;
    }
  }
}
