package ca.gc.cra.blocklist.application.pipeline;

import ca.gc.cra.blocklist.application.port.ExistenceOracle;
import ca.gc.cra.blocklist.application.port.MetricsPort;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides whether a candidate domain still exists, retrying inconclusive lookups. Any
 * failure of the oracle, checked or not, counts as inconclusive.
 * <p><strong>Why:</strong> Upstream lists accumulate dead names; dropping NXDOMAIN entries keeps the published
 * lists short. When the resolver cannot answer, the domain is kept so an outage never unblocks anything.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Emits {@code verify.attempt}, {@code verify.retry}, {@code verify.nxdomain},
 * {@code verify.failOpen}, {@code verify.kept}, and {@code verify.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class ExistenceVerifier {
  private static final Logger log = LoggerFactory.getLogger(ExistenceVerifier.class);

  /** Outcome of verifying one domain. */
  public enum Verdict {
    /** The resolver answered with a code other than NXDOMAIN. */
    EXISTS,
    /** The resolver reported NXDOMAIN. */
    NXDOMAIN,
    /** Every attempt failed; the domain is kept. */
    UNVERIFIED;

    /**
     * Returns whether the domain stays on the list.
     *
     * @return {@code false} only for {@link #NXDOMAIN}
     */
    public boolean keep() {
      return this != NXDOMAIN;
    }
  }

  private final ExistenceOracle oracle;
  private final RetryPolicy policy;
  private final MetricsPort metrics;

  /**
   * Creates a verifier.
   *
   * @param oracle single-query resolver
   * @param policy retry budget for inconclusive lookups
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public ExistenceVerifier(ExistenceOracle oracle, RetryPolicy policy, MetricsPort metrics) {
    this.oracle = Objects.requireNonNull(oracle, "oracle");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Returns whether {@code domain} should stay on the list.
   *
   * @param domain candidate domain
   * @return {@code false} only when the resolver reported NXDOMAIN
   * @throws InterruptedException if interrupted while querying or between attempts
   */
  public boolean exists(String domain) throws InterruptedException {
    return verify(domain).keep();
  }

  /**
   * Queries the resolver until it gives a definitive answer or the retry budget is spent.
   *
   * @param domain candidate domain
   * @return verdict
   * @throws InterruptedException if interrupted while querying or between attempts
   */
  public Verdict verify(String domain) throws InterruptedException {
    Objects.requireNonNull(domain, "domain");
    long start = System.nanoTime();
    try {
      for (int attempt = 1; ; attempt++) {
        metrics.increment("verify.attempt");
        try {
          int status = oracle.resolve(domain);
          if (status == ExistenceOracle.NXDOMAIN) {
            log.debug("nxdomain: {}", domain);
            metrics.increment("verify.nxdomain");
            return Verdict.NXDOMAIN;
          }
          metrics.increment("verify.kept");
          return Verdict.EXISTS;
        } catch (IOException | RuntimeException ex) {
          log.debug("Lookup attempt {}/{} failed for {}: {}", attempt, policy.maxAttempts(), domain, ex.getMessage());
          if (!policy.hasNext(attempt)) {
            log.warn("Keeping {} unverified after {} failed lookup(s): {}", domain, attempt, ex.getMessage());
            metrics.increment("verify.failOpen");
            return Verdict.UNVERIFIED;
          }
        }
        metrics.increment("verify.retry");
        policy.pause();
      }
    } finally {
      metrics.observe("verify.latencyNanos", System.nanoTime() - start);
    }
  }
}
