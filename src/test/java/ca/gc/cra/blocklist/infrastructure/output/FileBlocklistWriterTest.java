package ca.gc.cra.blocklist.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.blocklist.domain.blocklist.BlocklistVariant;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileBlocklistWriterTest {
  @TempDir Path tempDir;

  @Test
  void writesVariantFileWithoutTrailingNewline() throws Exception {
    FileBlocklistWriter writer = new FileBlocklistWriter(tempDir);

    writer.write(BlocklistVariant.OPTIMIZED, List.of("example.com", "tracker.net"));

    Path written = tempDir.resolve("toblock-optimized.lst");
    assertEquals(written, writer.pathOf(BlocklistVariant.OPTIMIZED));
    assertEquals("example.com\ntracker.net", Files.readString(written, StandardCharsets.UTF_8));
  }

  @Test
  void truncatesExistingFile() throws Exception {
    FileBlocklistWriter writer = new FileBlocklistWriter(tempDir);
    Files.writeString(tempDir.resolve("toblock.lst"), "stale.example.com\nolder.example.com\nmore.example.com");

    writer.write(BlocklistVariant.PLAIN, List.of("fresh.example.com"));

    assertEquals("fresh.example.com", Files.readString(tempDir.resolve("toblock.lst"), StandardCharsets.UTF_8));
  }

  @Test
  void emptyVariantProducesEmptyFile() throws Exception {
    FileBlocklistWriter writer = new FileBlocklistWriter(tempDir);

    writer.write(BlocklistVariant.PLAIN_WITHOUT_SHORTLINKS, List.of());

    assertEquals(0L, Files.size(tempDir.resolve("toblock-without-shorturl.lst")));
  }

  @Test
  void writeLinesCreatesMissingParents() throws Exception {
    Path target = tempDir.resolve("a").resolve("b").resolve("list.lst");

    FileBlocklistWriter.writeLines(target, List.of("ads.example.com"));

    assertEquals("ads.example.com", Files.readString(target, StandardCharsets.UTF_8));
  }
}
