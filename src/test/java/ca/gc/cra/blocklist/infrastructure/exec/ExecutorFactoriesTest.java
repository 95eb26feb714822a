package ca.gc.cra.blocklist.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void singleThreadPoolUsesBarePrefix() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, "blocklist-aggregate", null);
    try {
      assertEquals("blocklist-aggregate", pool.submit(() -> Thread.currentThread().getName()).get());
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void multiThreadPoolNumbersThreads() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(3, "blocklist-verify", null);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get();
      assertTrue(name.startsWith("blocklist-verify-"), name);
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }
}
