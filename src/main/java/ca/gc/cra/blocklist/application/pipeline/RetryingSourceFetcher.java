package ca.gc.cra.blocklist.application.pipeline;

import ca.gc.cra.blocklist.application.port.MetricsPort;
import ca.gc.cra.blocklist.application.port.SourceFetcher;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SourceFetcher} decorator that retries failed fetches with a fixed delay.
 * <p><strong>Why:</strong> Community list hosts are flaky; a run should survive short outages without operator
 * involvement.</p>
 * <p><strong>Role:</strong> Wraps the HTTP adapter for both the TLD bootstrap and source downloads.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Emits {@code fetch.attempt}, {@code fetch.retry}, {@code fetch.failed}; logs
 * every failed attempt at WARN.</p>
 *
 * @since 0.1.0
 */
public final class RetryingSourceFetcher implements SourceFetcher {
  private static final Logger log = LoggerFactory.getLogger(RetryingSourceFetcher.class);

  private final SourceFetcher delegate;
  private final RetryPolicy policy;
  private final MetricsPort metrics;

  /**
   * Creates a retrying fetcher.
   *
   * @param delegate single-attempt fetcher
   * @param policy retry budget
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public RetryingSourceFetcher(SourceFetcher delegate, RetryPolicy policy, MetricsPort metrics) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Fetches {@code uri}, returning on the first success.
   *
   * @throws FetchFailedException if every attempt failed
   * @throws InterruptedException if interrupted while fetching or between attempts
   */
  @Override
  public InputStream fetch(URI uri) throws IOException, InterruptedException {
    Objects.requireNonNull(uri, "uri");
    for (int attempt = 1; ; attempt++) {
      metrics.increment("fetch.attempt");
      try {
        return delegate.fetch(uri);
      } catch (IOException ex) {
        log.warn("Fetch attempt {}/{} failed for {}: {}", attempt, policy.maxAttempts(), uri, ex.getMessage());
        if (!policy.hasNext(attempt)) {
          metrics.increment("fetch.failed");
          throw new FetchFailedException(uri, attempt, ex);
        }
      }
      metrics.increment("fetch.retry");
      policy.pause();
    }
  }
}
