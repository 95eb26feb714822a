package ca.gc.cra.blocklist.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void runDefaultsCoverPipelineSettings() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");

    assertEquals(".", defaults.get("outputDir"));
    assertEquals("https://dns.google.com/resolve", defaults.get("resolverUri"));
    assertEquals("50", defaults.get("verify.concurrency"));
    assertEquals("20", defaults.get("verify.queueCapacity"));
    assertEquals("10", defaults.get("verify.maxAttempts"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertFalse(defaults.containsKey("in"));
  }

  @Test
  void optimizeDefaultsOnlyAddPaths() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" OPTIMIZE ");

    assertTrue(defaults.containsKey("in"));
    assertTrue(defaults.containsKey("out"));
    assertTrue(defaults.containsKey("verbose"));
    assertFalse(defaults.containsKey("resolverUri"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("serve"));
  }
}
