package ca.gc.cra.blocklist.domain.blocklist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Sorted contents of every {@link BlocklistVariant} derived from one final domain set.
 * <p><strong>Why:</strong> Shortlink services are removed before anything else so that a blocked shortener never
 * hides its subdomains from the optimizer, then re-added only to the variants that ship them.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class BlocklistVariants {
  private final Map<BlocklistVariant, List<String>> lines;

  private BlocklistVariants(Map<BlocklistVariant, List<String>> lines) {
    this.lines = Collections.unmodifiableMap(lines);
  }

  /**
   * Computes all four variants.
   *
   * @param finalSet verified domains; must not be {@code null}
   * @param shortlinks shortlink domains; must not be {@code null}
   * @return variants keyed by type
   */
  public static BlocklistVariants from(Collection<String> finalSet, Collection<String> shortlinks) {
    Objects.requireNonNull(finalSet, "finalSet");
    Objects.requireNonNull(shortlinks, "shortlinks");
    Set<String> remainder = new HashSet<>(finalSet);
    remainder.removeAll(shortlinks);
    Set<String> optimized = HierarchicalOptimizer.optimize(remainder);

    Map<BlocklistVariant, List<String>> lines = new EnumMap<>(BlocklistVariant.class);
    for (BlocklistVariant variant : BlocklistVariant.values()) {
      List<String> entries = new ArrayList<>(variant.optimized() ? optimized : remainder);
      if (variant.withShortlinks()) {
        entries.addAll(shortlinks);
      }
      Collections.sort(entries);
      lines.put(variant, List.copyOf(entries));
    }
    return new BlocklistVariants(lines);
  }

  /**
   * Returns the sorted lines of one variant.
   *
   * @param variant variant to read
   * @return immutable sorted lines
   */
  public List<String> lines(BlocklistVariant variant) {
    return lines.get(Objects.requireNonNull(variant, "variant"));
  }

  /**
   * Returns every variant with its lines, in declaration order.
   *
   * @return unmodifiable map
   */
  public Map<BlocklistVariant, List<String>> asMap() {
    return lines;
  }
}
