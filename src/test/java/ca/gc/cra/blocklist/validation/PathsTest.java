package ca.gc.cra.blocklist.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateWritableDirReturnsCanonicalPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));

    assertEquals(dir.toRealPath(), Paths.validateWritableDir(dir, false));
  }

  @Test
  void validateWritableDirCreatesWhenRequested() {
    Path dir = tempDir.resolve("missing/child");

    Path validated = Paths.validateWritableDir(dir, true);

    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateWritableDirAllowsFutureCreationWithoutCreating() {
    Path dir = tempDir.resolve("future/child");

    Path validated = Paths.validateWritableDir(dir, false);

    assertTrue(validated.endsWith(Path.of("future", "child")));
    assertFalse(Files.exists(validated));
  }

  @Test
  void validateWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("toblock.lst"));

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, false));
  }

  @Test
  void validateReadableFileRequiresExistingRegularFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("in.lst"), "example.com");

    assertEquals(file.toAbsolutePath().normalize(), Paths.validateReadableFile(file));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(tempDir.resolve("absent.lst")));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(null));
  }
}
