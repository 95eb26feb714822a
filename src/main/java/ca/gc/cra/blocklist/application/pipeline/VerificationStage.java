package ca.gc.cra.blocklist.application.pipeline;

import ca.gc.cra.blocklist.application.port.MetricsPort;
import ca.gc.cra.blocklist.infrastructure.exec.ExecutorFactories;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stage B of a run: verifies every candidate against the resolver with a hard ceiling on
 * concurrent lookups, funnelling the survivors to a single aggregator.
 * <p><strong>Why:</strong> Tens of thousands of candidates would otherwise flood the public resolver; the
 * semaphore caps in-flight lookups while the queue keeps the final set single-writer.</p>
 * <p><strong>Role:</strong> Second phase of {@link BlocklistUseCase}, started only after Stage A completed.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Acquire a permit on the dispatching thread before submitting each lookup.</li>
 *   <li>Release the permit and count down the completion latch when the lookup ends, however it ends.</li>
 *   <li>Send the end marker only after the latch opened, then join the aggregator.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each call owns its pools, queue and set; concurrent calls do not interact.</p>
 * <p><strong>Observability:</strong> Records {@code verify.inflight} per dispatched lookup and reports the
 * high-water mark in {@link Result}.</p>
 *
 * @since 0.1.0
 */
public final class VerificationStage {
  private static final Logger log = LoggerFactory.getLogger(VerificationStage.class);
  private static final String END_OF_STREAM = "";

  private final ExistenceVerifier verifier;
  private final int concurrency;
  private final int queueCapacity;
  private final MetricsPort metrics;

  /**
   * Creates the stage.
   *
   * @param verifier per-domain verifier
   * @param concurrency maximum lookups in flight; at least 1
   * @param queueCapacity capacity of the aggregation queue; at least 1
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public VerificationStage(ExistenceVerifier verifier, int concurrency, int queueCapacity, MetricsPort metrics) {
    this.verifier = Objects.requireNonNull(verifier, "verifier");
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1");
    }
    if (queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be >= 1");
    }
    this.concurrency = concurrency;
    this.queueCapacity = queueCapacity;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Outcome of Stage B.
   *
   * @param domains final domain set
   * @param nxdomain candidates dropped as NXDOMAIN
   * @param unverified candidates kept after every lookup attempt failed
   * @param peakInFlight highest number of concurrent lookups observed
   */
  public record Result(Set<String> domains, int nxdomain, int unverified, int peakInFlight) {
    public Result {
      domains = Set.copyOf(domains);
    }
  }

  /**
   * Verifies all candidates and returns the surviving set.
   *
   * @param candidates deduplicated candidate domains
   * @return final domain set and tallies
   * @throws InterruptedException if interrupted while dispatching or waiting
   */
  public Result verify(Collection<String> candidates) throws InterruptedException {
    Objects.requireNonNull(candidates, "candidates");
    if (candidates.isEmpty()) {
      return new Result(Set.of(), 0, 0, 0);
    }

    Semaphore permits = new Semaphore(concurrency);
    CountDownLatch done = new CountDownLatch(candidates.size());
    BlockingQueue<String> kept = new ArrayBlockingQueue<>(queueCapacity);
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    AtomicInteger nxdomain = new AtomicInteger();
    AtomicInteger unverified = new AtomicInteger();

    ExecutorService aggregator = ExecutorFactories.newWorkerPool(1, "blocklist-aggregate", null);
    ExecutorService workers =
        ExecutorFactories.newWorkerPool(
            concurrency,
            "blocklist-verify",
            (thread, ex) -> log.error("Uncaught exception in {}", thread.getName(), ex));
    try {
      Future<Set<String>> finalSet = aggregator.submit(() -> aggregate(kept));

      for (String domain : candidates) {
        permits.acquire();
        int current = inFlight.incrementAndGet();
        peak.accumulateAndGet(current, Math::max);
        metrics.observe("verify.inflight", current);
        workers.execute(
            () -> {
              try {
                ExistenceVerifier.Verdict verdict = verifier.verify(domain);
                if (verdict == ExistenceVerifier.Verdict.NXDOMAIN) {
                  nxdomain.incrementAndGet();
                } else {
                  if (verdict == ExistenceVerifier.Verdict.UNVERIFIED) {
                    unverified.incrementAndGet();
                  }
                  kept.put(domain);
                }
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.debug("Verification of {} interrupted", domain);
              } finally {
                inFlight.decrementAndGet();
                permits.release();
                done.countDown();
              }
            });
      }

      done.await();
      kept.put(END_OF_STREAM);
      Set<String> domains = join(finalSet);
      log.info("Verified {} candidate(s): {} kept, {} nxdomain, {} unverified, peak {} in flight",
          candidates.size(), domains.size(), nxdomain.get(), unverified.get(), peak.get());
      return new Result(domains, nxdomain.get(), unverified.get(), peak.get());
    } catch (InterruptedException ex) {
      log.warn("Verification stage interrupted; requesting shutdown");
      workers.shutdownNow();
      aggregator.shutdownNow();
      throw ex;
    } finally {
      workers.shutdown();
      aggregator.shutdown();
    }
  }

  private static Set<String> aggregate(BlockingQueue<String> kept) throws InterruptedException {
    Set<String> domains = new HashSet<>();
    while (true) {
      String domain = kept.take();
      if (END_OF_STREAM.equals(domain)) {
        return domains;
      }
      domains.add(domain);
    }
  }

  private static Set<String> join(Future<Set<String>> finalSet) throws InterruptedException {
    try {
      return finalSet.get();
    } catch (ExecutionException ex) {
      throw new IllegalStateException("aggregator failed", ex.getCause());
    }
  }
}
