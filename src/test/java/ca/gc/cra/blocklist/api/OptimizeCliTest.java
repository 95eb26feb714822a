package ca.gc.cra.blocklist.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class OptimizeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(OptimizeCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void writesOptimizedList() throws Exception {
    Path in = tempDir.resolve("toblock.lst");
    Files.writeString(in, "ads.example.com\nexample.com\ntracker.net\n", StandardCharsets.UTF_8);
    Path out = tempDir.resolve("toblock-optimized.lst");

    ExitCode code = OptimizeCli.run(new String[] {"in=" + in, "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("example.com\ntracker.net", Files.readString(out, StandardCharsets.UTF_8));
    assertTrue(buffer.toString().contains("Wrote 2 line(s) to " + out));
  }

  @Test
  void missingOutputIsInvalid() {
    ExitCode code = OptimizeCli.run(new String[] {"in=" + tempDir.resolve("toblock.lst")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: blocklist optimize"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid optimize arguments")));
  }

  @Test
  void unreadableInputIsInvalid() {
    ExitCode code = OptimizeCli.run(
        new String[] {"in=" + tempDir.resolve("absent.lst"), "out=" + tempDir.resolve("out.lst")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, OptimizeCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Offline hierarchical reduction"));
  }
}
