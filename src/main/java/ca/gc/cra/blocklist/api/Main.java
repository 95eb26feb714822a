package ca.gc.cra.blocklist.api;

import ca.gc.cra.blocklist.logging.LoggingConfigurator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Block list CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: blocklist <run|optimize> [options]";
  private static final String HELP_TEXT = """
      Block list aggregator

      Usage:
        blocklist <command> [options]

      Commands:
        run        Download, filter, verify and publish the block lists (run --help for details)
        optimize   Reduce an existing list file without network access

      Global flags:
        --help     Show this message
        --verbose  Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first positional token is the command)
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] positional = input.keyValueArgs();
    if (positional.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = positional[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = input.subcommandArgs();
    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "optimize" -> OptimizeCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
