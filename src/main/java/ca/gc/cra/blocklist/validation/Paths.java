package ca.gc.cra.blocklist.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for CLI and configuration flows.
 * <p><strong>Why:</strong> Ensures block lists are written only into writable directories and list files are
 * read only from readable regular files, failing before any network work starts.
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a dangling symlink is reported as such.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable output directory, optionally creating it (and its parents) when absent.
   *
   * <p>Existing directories are always reusable: block list files are truncated on every write.</p>
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory when absent
   * @return real path when the directory exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = requireSanePath(path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath();
        ensureWritableDirectory(real);
        return real;
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        Path real = normalized.toRealPath();
        ensureWritableDirectory(real);
        return real;
      }
      Path parent = nearestExistingAncestor(normalized);
      if (!Files.isWritable(parent)) {
        throw new IllegalArgumentException("parent directory is not writable: " + parent);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param path candidate file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, not a regular file, or unreadable
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = requireSanePath(path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("file does not exist or is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path requireSanePath(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }

  private static void ensureWritableDirectory(Path dir) {
    if (!Files.isDirectory(dir)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
  }

  private static Path nearestExistingAncestor(Path path) {
    Path current = path.getParent();
    while (current != null && !Files.exists(current)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + path);
    }
    return current;
  }
}
