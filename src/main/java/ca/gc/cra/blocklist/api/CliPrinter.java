package ca.gc.cra.blocklist.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Console output for usage text, dry-run plans and the optimize summary. Logs go to stderr through Logback; this
 * writes to stdout so the plan can be piped or diffed.
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  static void println(String message) {
    PrintWriter out = writer();
    out.println(message);
    out.flush();
  }

  /**
   * Prints a titled block: the title, then each line, then a blank separator.
   *
   * @param title heading line
   * @param lines body lines in order
   */
  static void printSection(String title, List<String> lines) {
    PrintWriter out = writer();
    out.println(title);
    for (String line : lines) {
      out.println(line);
    }
    out.println();
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
