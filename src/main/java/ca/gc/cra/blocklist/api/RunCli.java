package ca.gc.cra.blocklist.api;

import ca.gc.cra.blocklist.application.pipeline.BlocklistUseCase;
import ca.gc.cra.blocklist.application.pipeline.RunReport;
import ca.gc.cra.blocklist.application.port.MetricsPort;
import ca.gc.cra.blocklist.config.BlocklistConfig;
import ca.gc.cra.blocklist.config.CompositionRoot;
import ca.gc.cra.blocklist.domain.blocklist.BlocklistVariant;
import ca.gc.cra.blocklist.domain.catalog.Catalog;
import ca.gc.cra.blocklist.domain.catalog.SourceDescriptor;
import ca.gc.cra.blocklist.logging.LoggingConfigurator;
import ca.gc.cra.blocklist.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point for a full block list run: download, filter, verify, and publish.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String MODE = "run";
  private static final String SUMMARY_USAGE =
      "usage: blocklist run [outputDir=DIR] [catalog=PATH] [config=PATH] [verify.concurrency=N] "
          + "[metricsExporter=otlp|none] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      Block list aggregation run

      Usage:
        blocklist run [options]

      Inputs:
        catalog=PATH                  Sources, whitelist and shortlinks (default: bundled catalog)
        tldListUri=URL                Plain TLD list
        effectiveTldUri=URL           Public suffix list
        resolverUri=URL               DNS-over-HTTPS JSON resolver

      Output:
        outputDir=DIR                 Directory for the four .lst files (default .)

      Tuning:
        fetch.maxAttempts=N           Download attempts per list (default 10)
        fetch.retryDelayMillis=MS     Pause between download attempts (default 5000)
        verify.maxAttempts=N          Resolver attempts per domain (default 10)
        verify.retryDelayMillis=MS    Pause between resolver attempts (default 3000)
        verify.concurrency=N          Maximum resolver queries in flight (default 50)
        verify.queueCapacity=N        Aggregation queue capacity (default 20)
        http.connectTimeoutMillis=MS  HTTP connect timeout (default 30000)
        http.requestTimeoutMillis=MS  HTTP request timeout (default 60000)

      Global options:
        config=PATH                   YAML file with common/run sections
        metricsExporter=otlp|none     Metrics exporter (default none)
        otelEndpoint=URL              OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V,.. Extra OpenTelemetry resource attributes
        --dry-run                     Print the plan without network access
        --verbose                     Enable DEBUG logging
        --help                        Show this message
      """;

  private RunCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Executes a run and maps its outcome to an exit code.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig(MODE, kv, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose() || ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run CLI");
    }
    boolean dryRun = input.hasFlag("--dry-run");

    BlocklistConfig config;
    String exporter;
    Catalog catalog;
    try {
      exporter = TelemetryConfigurator.configureMetrics(effective);
      config = BlocklistConfig.fromMap(effective);
      Paths.validateWritableDir(config.outputDirectory(), !dryRun);
      catalog = new CompositionRoot(config, MetricsPort.NO_OP).catalog();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read catalog", ex);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, catalog, exporter);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = TelemetryConfigurator.createMetrics(exporter);
    MDC.put("pipeline", MODE);
    try {
      BlocklistUseCase useCase = new CompositionRoot(config, metrics).blocklistUseCase();
      log.info("Starting run with {} source(s), output {}", catalog.sources().size(), config.outputDirectory());
      RunReport report = useCase.run(catalog, config.tldListUri(), config.effectiveTldUri());
      if (report.hasWriteFailures()) {
        log.error("Run finished but {} variant(s) could not be written: {}",
            report.failedWrites().size(), report.failedWrites());
      }
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Run interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in run", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      TelemetryConfigurator.close(metrics);
      MDC.remove("pipeline");
    }
  }

  private static void printDryRunPlan(BlocklistConfig config, Catalog catalog, String exporter) {
    List<String> lines = new ArrayList<>();
    lines.add(" Catalog          : " + config.catalog().map(Path::toString).orElse("<bundled>"));
    lines.add(" Sources          : " + catalog.sources().size());
    for (SourceDescriptor source : catalog.sources()) {
      lines.add("   " + source.rule().describe() + " " + source.uri());
    }
    lines.add(" Whitelist rules  : " + catalog.whitelist().size());
    lines.add(" Shortlinks       : " + String.join(", ", catalog.shortlinks()));
    lines.add(" TLD list         : " + config.tldListUri());
    lines.add(" Effective TLDs   : " + config.effectiveTldUri());
    lines.add(" Resolver         : " + config.resolverUri());
    lines.add(" Fetch retry      : " + config.fetchRetry().maxAttempts() + " x " + config.fetchRetry().delay());
    lines.add(" Verify retry     : " + config.verifyRetry().maxAttempts() + " x " + config.verifyRetry().delay());
    lines.add(" Verify in flight : " + config.verifyConcurrency());
    lines.add(" Metrics exporter : " + exporter);
    for (BlocklistVariant variant : BlocklistVariant.values()) {
      lines.add(" Output           : " + config.outputDirectory().resolve(variant.fileName()));
    }
    lines.add(" Re-run without --dry-run to build the lists.");
    CliPrinter.printSection("Run dry-run: nothing will be downloaded or written.", lines);
  }
}
