package ca.gc.cra.blocklist.config;

import ca.gc.cra.blocklist.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of an {@code optimize} invocation.
 *
 * @param input existing list file
 * @param output destination file
 * @since 0.1.0
 */
public record OptimizeConfig(Path input, Path output) {
  public OptimizeConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
  }

  /**
   * Parses {@code in} and {@code out} from a merged configuration map.
   *
   * @param args flat key/value map
   * @return configuration
   * @throws IllegalArgumentException if either path is missing
   */
  public static OptimizeConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    return new OptimizeConfig(
        Path.of(Strings.requireNonBlank("in", args.getOrDefault("in", ""))),
        Path.of(Strings.requireNonBlank("out", args.getOrDefault("out", ""))));
  }
}
