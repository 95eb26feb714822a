package ca.gc.cra.blocklist.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlOverridesDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");
    Map<String, String> yaml = Map.of("outputDir", "/srv/yaml", "verify.concurrency", "10");
    Map<String, String> cli = Map.of("outputDir", "/srv/cli");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig("run", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("/srv/cli", merged.get("outputDir"));
    assertEquals("10", merged.get("verify.concurrency"));
    assertEquals("20", merged.get("verify.queueCapacity"));
    assertEquals(List.of("CLI overrides YAML for key: outputDir"), warnings);
  }

  @Test
  void unknownKeysAreWarnedButKept() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run", Optional.empty(), Map.of("colour", "blue"), DefaultsForMode.asFlatMap("run"), warnings::add);

    assertEquals("blue", merged.get("colour"));
    assertTrue(warnings.contains("Ignoring unknown run key: colour"));
  }

  @Test
  void optimizeRequiresInputAndOutput() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("optimize");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "optimize", Optional.empty(), Map.of("out", "b.lst"), defaults, msg -> {}));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "optimize", Optional.empty(), Map.of("in", "a.lst", "out", " "), defaults, msg -> {}));

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "optimize", Optional.empty(), Map.of("in", "a.lst", "out", "b.lst"), defaults, null);
    assertEquals("a.lst", merged.get("in"));
  }
}
