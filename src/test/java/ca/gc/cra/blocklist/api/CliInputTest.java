package ca.gc.cra.blocklist.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArgs() {
    CliInput input = CliInput.parse(new String[] {"run", "-v", "outputDir=/tmp/x", "--DRY-RUN", ""});

    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertArrayEquals(new String[] {"run", "outputDir=/tmp/x"}, input.keyValueArgs());
  }

  @Test
  void helpAliasesAreRecognized() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).help());
  }

  @Test
  void subcommandArgsDropTheCommandAndKeepFlags() {
    CliInput input = CliInput.parse(new String[] {"optimize", "in=a.lst", "--verbose", "out=b.lst"});

    assertArrayEquals(new String[] {"--verbose", "in=a.lst", "out=b.lst"}, input.subcommandArgs());
  }

  @Test
  void nullArgsParseToEmptyInput() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertArrayEquals(new String[0], input.subcommandArgs());
  }
}
