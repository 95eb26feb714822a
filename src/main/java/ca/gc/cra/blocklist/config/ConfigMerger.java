package ca.gc.cra.blocklist.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and cross-key rules.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key or a key is unknown
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> warnSink = warn == null ? message -> {} : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        warnSink.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }
    for (String key : merged.keySet()) {
      if (!defaultsCopy.isEmpty() && !defaultsCopy.containsKey(key)) {
        warnSink.accept("Ignoring unknown " + mode + " key: " + key);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("optimize".equalsIgnoreCase(mode)) {
      if (trim(effective.get("in")).isEmpty()) {
        throw new IllegalArgumentException("optimize requires in=PATH");
      }
      if (trim(effective.get("out")).isEmpty()) {
        throw new IllegalArgumentException("optimize requires out=PATH");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
