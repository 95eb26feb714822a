package ca.gc.cra.blocklist.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("0.0.0.0 ads.example.com", Logs.line("0.0.0.0 ads.example.com"));
    assertEquals("<null>", Logs.line(null));
  }

  @Test
  void longLinesAreCutToBudget() {
    String longLine = "x".repeat(1_000);

    String logged = Logs.line(longLine);

    assertTrue(logged.startsWith("x".repeat(Logs.LINE_BUDGET_BYTES)));
    assertTrue(logged.endsWith("... (truncated, 256 of 1000)"), logged);
  }

  @Test
  void truncationDoesNotSplitMultiByteCharacters() {
    String value = "é".repeat(10);

    String logged = Logs.truncate(value, 5);

    assertTrue(logged.startsWith("éé..."), logged);
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }
}
