package ca.gc.cra.blocklist.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named worker pools used by the pipeline stages.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool whose threads are named {@code <prefix>-<n>}.
   *
   * <p>The work queue is unbounded; callers that need back-pressure bound submissions themselves (for example with
   * a semaphore).</p>
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix; blank falls back to {@code blocklist-worker}
   * @param handler uncaught exception handler; {@code null} installs one that logs at ERROR
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "blocklist-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler =
        handler != null ? handler : (t, ex) -> log.error("Uncaught exception in {}", t.getName(), ex);
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(size == 1 ? threadPrefix : threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
