package ca.gc.cra.blocklist.api;

import ca.gc.cra.blocklist.application.pipeline.OptimizeUseCase;
import ca.gc.cra.blocklist.application.port.MetricsPort;
import ca.gc.cra.blocklist.config.OptimizeConfig;
import ca.gc.cra.blocklist.logging.LoggingConfigurator;
import ca.gc.cra.blocklist.validation.Paths;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point for reducing an existing list file offline.
 *
 * @since 0.1.0
 */
public final class OptimizeCli {
  private static final Logger log = LoggerFactory.getLogger(OptimizeCli.class);
  private static final String MODE = "optimize";
  private static final String SUMMARY_USAGE = "usage: blocklist optimize in=PATH out=PATH [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      Offline hierarchical reduction

      Usage:
        blocklist optimize in=PATH out=PATH

      Options:
        in=PATH        Existing list, one domain per line (# comments and blank lines skipped)
        out=PATH       Destination file, replaced if present
        config=PATH    YAML file with common/optimize sections
        --verbose      Enable DEBUG logging
        --help         Show this message
      """;

  private OptimizeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for optimize CLI");
    }

    OptimizeConfig config;
    MetricsPort metrics;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, kv, log::warn);
      config = OptimizeConfig.fromMap(effective);
      Paths.validateReadableFile(config.input());
      metrics = TelemetryConfigurator.createMetrics(TelemetryConfigurator.configureMetrics(effective));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid optimize arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.INVALID_ARGS;
    }

    MDC.put("pipeline", MODE);
    try {
      int lines = new OptimizeUseCase(metrics).run(config.input(), config.output());
      CliPrinter.println("Wrote " + lines + " line(s) to " + config.output());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Optimize I/O failure for {} -> {}", config.input(), config.output(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in optimize", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      TelemetryConfigurator.close(metrics);
      MDC.remove("pipeline");
    }
  }
}
