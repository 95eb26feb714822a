package ca.gc.cra.blocklist.domain.tld;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class TldSnapshotTest {

  @Test
  void matchesOnExactLastLabel() {
    TldSnapshot snapshot = TldSnapshot.of(Set.of("com", "org"), List.of());

    assertTrue(snapshot.matches("ads.example.com"));
    assertFalse(snapshot.matches("ads.example.invalid"));
  }

  @Test
  void matchesOnEffectiveSuffixAtLabelBoundary() {
    TldSnapshot snapshot = TldSnapshot.of(Set.of(), List.of(".co.uk"));

    assertTrue(snapshot.matches("tracker.co.uk"));
    assertFalse(snapshot.matches("tracker.xco.uk"));
    assertFalse(snapshot.matches("co.uk"));
  }

  @Test
  void builderSkipsCommentsAndBlanksInTldList() {
    TldSnapshot.Builder builder = TldSnapshot.builder();

    assertFalse(builder.acceptTldListLine("# Version 2024010100"));
    assertFalse(builder.acceptTldListLine("   "));
    assertTrue(builder.acceptTldListLine("COM"));
    assertTrue(builder.acceptTldListLine("XN--P1AI"));

    TldSnapshot snapshot = builder.build();
    assertEquals(Set.of("com", "xn--p1ai"), snapshot.exactLabels());
  }

  @Test
  void builderSplitsEffectiveTldLinesByDots() {
    TldSnapshot.Builder builder = TldSnapshot.builder();

    assertFalse(builder.acceptEffectiveTldLine("// ===BEGIN ICANN DOMAINS==="));
    assertFalse(builder.acceptEffectiveTldLine("*.ck"));
    assertFalse(builder.acceptEffectiveTldLine("!www.ck"));
    assertFalse(builder.acceptEffectiveTldLine("公司.cn"));
    assertFalse(builder.acceptEffectiveTldLine(""));
    assertTrue(builder.acceptEffectiveTldLine("uk"));
    assertTrue(builder.acceptEffectiveTldLine("co.uk"));
    assertTrue(builder.acceptEffectiveTldLine("3utilities.com"));

    TldSnapshot snapshot = builder.build();
    assertEquals(Set.of("uk"), snapshot.exactLabels());
    assertEquals(List.of(".co.uk", ".3utilities.com"), snapshot.suffixes());
    assertTrue(snapshot.matches("ads.3utilities.com"));
  }

  @Test
  void builderToleratesConcurrentFeeds() throws InterruptedException {
    TldSnapshot.Builder builder = TldSnapshot.builder();
    ExecutorService pool = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    try {
      pool.submit(() -> {
        start.await();
        for (int i = 0; i < 1_000; i++) {
          builder.acceptTldListLine("tld" + i);
        }
        return null;
      });
      pool.submit(() -> {
        start.await();
        for (int i = 0; i < 1_000; i++) {
          builder.acceptEffectiveTldLine("sub" + i + ".example");
        }
        return null;
      });
      start.countDown();
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
    }

    TldSnapshot snapshot = builder.build();
    assertEquals(1_000, snapshot.exactLabels().size());
    assertEquals(1_000, snapshot.suffixes().size());
  }

  @Test
  void emptySnapshotMatchesNothing() {
    assertTrue(TldSnapshot.empty().isEmpty());
    assertFalse(TldSnapshot.empty().matches("example.com"));
  }

  @Test
  void ofRejectsSuffixWithoutLeadingDot() {
    assertThrows(IllegalArgumentException.class, () -> TldSnapshot.of(Set.of(), List.of("co.uk")));
  }
}
