package ca.gc.cra.blocklist.application.port;

import ca.gc.cra.blocklist.domain.blocklist.BlocklistVariant;
import java.io.IOException;
import java.util.List;

/**
 * Port that publishes one block list variant.
 *
 * <p>Implementations write the lines in the order given, joined by a single newline with no trailing newline, and
 * replace any previous content.</p>
 *
 * @since 0.1.0
 */
public interface BlocklistWriter {
  /**
   * Writes {@code lines} as the content of {@code variant}.
   *
   * @param variant target variant; must not be {@code null}
   * @param lines ordered lines; must not be {@code null}
   * @throws IOException if the content cannot be written
   */
  void write(BlocklistVariant variant, List<String> lines) throws IOException;
}
