package ca.gc.cra.blocklist.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-delay retry budget shared by the fetch and verification loops.
 *
 * @param maxAttempts total attempts including the first; at least 1
 * @param delay pause between consecutive attempts; zero disables sleeping
 * @since 0.1.0
 */
public record RetryPolicy(int maxAttempts, Duration delay) {
  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
  }

  /**
   * Creates a policy from millisecond settings.
   *
   * @param maxAttempts total attempts
   * @param delayMillis pause between attempts in milliseconds
   * @return policy
   */
  public static RetryPolicy ofMillis(int maxAttempts, long delayMillis) {
    return new RetryPolicy(maxAttempts, Duration.ofMillis(delayMillis));
  }

  /**
   * Returns whether another attempt is allowed after {@code attempt} failed.
   *
   * @param attempt one-based number of the attempt that just failed
   * @return {@code true} when attempts remain
   */
  public boolean hasNext(int attempt) {
    return attempt < maxAttempts;
  }

  /**
   * Sleeps for {@link #delay()}.
   *
   * @throws InterruptedException if interrupted while sleeping
   */
  public void pause() throws InterruptedException {
    if (!delay.isZero()) {
      Thread.sleep(delay.toMillis());
    }
  }
}
