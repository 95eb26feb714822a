package ca.gc.cra.blocklist.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.blocklist.application.port.ExistenceOracle;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class VerificationStageTest {

  @Test
  void keepsExistingAndUnverifiedDomainsAndDropsNxdomain() throws Exception {
    ExistenceOracle oracle = domain -> {
      if (domain.startsWith("gone")) {
        return ExistenceOracle.NXDOMAIN;
      }
      if (domain.startsWith("flaky")) {
        throw new IOException("timeout");
      }
      return 0;
    };
    ExistenceVerifier verifier = new ExistenceVerifier(oracle, RetryPolicy.ofMillis(2, 0), null);
    VerificationStage stage = new VerificationStage(verifier, 4, 2, null);

    VerificationStage.Result result = stage.verify(
        List.of("ads.example.com", "gone.example.com", "flaky.example.com", "tracker.net", "gone.tracker.net"));

    assertEquals(Set.of("ads.example.com", "flaky.example.com", "tracker.net"), result.domains());
    assertEquals(2, result.nxdomain());
    assertEquals(1, result.unverified());
  }

  @Test
  void inFlightLookupsNeverExceedConcurrency() throws Exception {
    AtomicInteger active = new AtomicInteger();
    AtomicInteger maxActive = new AtomicInteger();
    ExistenceOracle slow = domain -> {
      int now = active.incrementAndGet();
      maxActive.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(2);
      } finally {
        active.decrementAndGet();
      }
      return 0;
    };
    Set<String> candidates = new HashSet<>();
    for (int i = 0; i < 200; i++) {
      candidates.add("host" + i + ".example.com");
    }
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    VerificationStage stage =
        new VerificationStage(new ExistenceVerifier(slow, RetryPolicy.ofMillis(1, 0), null), 5, 3, metrics);

    VerificationStage.Result result = stage.verify(candidates);

    assertEquals(candidates, result.domains());
    assertTrue(maxActive.get() <= 5, "max active lookups " + maxActive.get());
    assertTrue(result.peakInFlight() <= 5, "peak in flight " + result.peakInFlight());
    assertTrue(result.peakInFlight() >= 1);
    assertEquals(200, metrics.observed("verify.inflight").size());
  }

  @Test
  void emptyCandidatesYieldEmptyResult() throws Exception {
    VerificationStage stage =
        new VerificationStage(new ExistenceVerifier(domain -> 0, RetryPolicy.ofMillis(1, 0), null), 2, 2, null);

    VerificationStage.Result result = stage.verify(List.of());

    assertTrue(result.domains().isEmpty());
    assertEquals(0, result.peakInFlight());
  }

  @Test
  void oracleThrowingUncheckedExceptionKeepsDomain() throws Exception {
    ExistenceOracle broken = domain -> {
      if (domain.startsWith("gone")) {
        return ExistenceOracle.NXDOMAIN;
      }
      throw new IllegalStateException("resolver client fault");
    };
    VerificationStage stage =
        new VerificationStage(new ExistenceVerifier(broken, RetryPolicy.ofMillis(2, 0), null), 2, 2, null);

    VerificationStage.Result result = stage.verify(List.of("ads.example.com", "gone.example.com"));

    assertEquals(Set.of("ads.example.com"), result.domains());
    assertEquals(1, result.nxdomain());
    assertEquals(1, result.unverified());
  }

  @Test
  void rejectsInvalidSizing() {
    ExistenceVerifier verifier = new ExistenceVerifier(domain -> 0, RetryPolicy.ofMillis(1, 0), null);

    assertThrows(IllegalArgumentException.class, () -> new VerificationStage(verifier, 0, 1, null));
    assertThrows(IllegalArgumentException.class, () -> new VerificationStage(verifier, 1, 0, null));
  }
}
