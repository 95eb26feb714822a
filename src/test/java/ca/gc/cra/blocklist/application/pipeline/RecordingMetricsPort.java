package ca.gc.cra.blocklist.application.pipeline;

import ca.gc.cra.blocklist.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test double capturing metric usage for assertions. Synchronized because pipeline stages report from worker threads.
 */
final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Integer> counters = new HashMap<>();
  private final Map<String, List<Long>> observations = new HashMap<>();

  @Override
  public synchronized void increment(String key) {
    counters.merge(key, 1, Integer::sum);
  }

  @Override
  public synchronized void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
  }

  synchronized int count(String key) {
    return counters.getOrDefault(key, 0);
  }

  synchronized List<Long> observed(String key) {
    return List.copyOf(observations.getOrDefault(key, List.of()));
  }

  synchronized boolean hasObservation(String key) {
    return observations.containsKey(key);
  }

  synchronized boolean hasCounter(String key) {
    return counters.containsKey(key);
  }

  synchronized void clear() {
    counters.clear();
    observations.clear();
  }
}
