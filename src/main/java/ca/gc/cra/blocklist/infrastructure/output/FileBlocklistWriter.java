package ca.gc.cra.blocklist.infrastructure.output;

import ca.gc.cra.blocklist.application.port.BlocklistWriter;
import ca.gc.cra.blocklist.domain.blocklist.BlocklistVariant;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * Writes block list variants into one output directory under their fixed file names.
 * <p>Content is UTF-8, lines joined by {@code \n} with no trailing newline; existing files are truncated.
 * Synchronized so concurrent writes never interleave.</p>
 *
 * @since 0.1.0
 */
public final class FileBlocklistWriter implements BlocklistWriter {
  private final Path outputDirectory;

  /**
   * Creates a writer rooted at {@code outputDirectory}; the directory is created on first write when missing.
   *
   * @param outputDirectory target directory
   */
  public FileBlocklistWriter(Path outputDirectory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
  }

  @Override
  public synchronized void write(BlocklistVariant variant, List<String> lines) throws IOException {
    Objects.requireNonNull(variant, "variant");
    writeLines(outputDirectory.resolve(variant.fileName()), lines);
  }

  /**
   * Returns the path a variant is written to.
   *
   * @param variant variant
   * @return target path
   */
  public Path pathOf(BlocklistVariant variant) {
    return outputDirectory.resolve(variant.fileName());
  }

  /**
   * Writes {@code lines} to {@code target} in the block list file format, creating parent directories.
   *
   * @param target destination file
   * @param lines ordered lines
   * @throws IOException if the file cannot be written
   */
  public static void writeLines(Path target, List<String> lines) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(lines, "lines");
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    Files.writeString(
        target,
        String.join("\n", lines),
        StandardCharsets.UTF_8,
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE);
  }
}
