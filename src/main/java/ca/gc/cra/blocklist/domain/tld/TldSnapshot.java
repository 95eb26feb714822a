package ca.gc.cra.blocklist.domain.tld;

import ca.gc.cra.blocklist.domain.name.DomainNames;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Immutable public-suffix reference data used to reject domains under unknown roots.
 * <p><strong>Why:</strong> Upstream lists carry typos, internal names, and reverse-DNS junk; a domain is only
 * blockable when its last label is a delegated TLD or it ends with a known effective TLD.
 * <p><strong>Role:</strong> Produced once by the bootstrap phase via {@link Builder}, then shared read-only with
 * every source task.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold the exact-match label set (IANA list plus dot-free public suffix entries).</li>
 *   <li>Hold the ordered effective-TLD suffix list, each entry prefixed with {@code .}.</li>
 *   <li>Classify domains in time proportional to their label count.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent reads.</p>
 * <p><strong>Performance:</strong> {@link #matches(String)} probes a hash set once per label boundary instead of
 * scanning the suffix list; both are equivalent because every suffix entry starts at a label boundary.</p>
 *
 * @since 0.1.0
 */
public final class TldSnapshot {
  private static final TldSnapshot EMPTY = new TldSnapshot(Set.of(), List.of());

  private final Set<String> exact;
  private final List<String> suffixes;
  private final Set<String> suffixLookup;

  private TldSnapshot(Set<String> exact, List<String> suffixes) {
    this.exact = Set.copyOf(exact);
    this.suffixes = List.copyOf(suffixes);
    this.suffixLookup = Set.copyOf(suffixes);
  }

  /**
   * Returns a snapshot that matches nothing; the result of a bootstrap where both fetches failed.
   *
   * @return empty snapshot
   */
  public static TldSnapshot empty() {
    return EMPTY;
  }

  /**
   * Creates a snapshot directly from reference data.
   *
   * @param exact exact-match labels, lower-case
   * @param suffixes effective TLD suffixes, each starting with {@code .}
   * @return immutable snapshot
   * @throws IllegalArgumentException if a suffix does not start with {@code .}
   */
  public static TldSnapshot of(Set<String> exact, List<String> suffixes) {
    Objects.requireNonNull(exact, "exact");
    Objects.requireNonNull(suffixes, "suffixes");
    for (String suffix : suffixes) {
      if (!suffix.startsWith(".")) {
        throw new IllegalArgumentException("effective TLD suffix must start with '.': " + suffix);
      }
    }
    return new TldSnapshot(exact, suffixes);
  }

  /**
   * Creates a builder for the bootstrap phase.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether {@code domain} sits under a recognized public suffix.
   *
   * @param domain lower-cased domain; must not be {@code null}
   * @return {@code true} when the last label is an exact TLD or the domain ends with an effective TLD suffix
   */
  public boolean matches(String domain) {
    Objects.requireNonNull(domain, "domain");
    if (exact.contains(DomainNames.lastLabel(domain))) {
      return true;
    }
    int idx = domain.indexOf('.');
    while (idx >= 0) {
      if (suffixLookup.contains(domain.substring(idx))) {
        return true;
      }
      idx = domain.indexOf('.', idx + 1);
    }
    return false;
  }

  /**
   * Returns the exact-match label set.
   *
   * @return immutable label set
   */
  public Set<String> exactLabels() {
    return exact;
  }

  /**
   * Returns the effective TLD suffixes in load order.
   *
   * @return immutable suffix list
   */
  public List<String> suffixes() {
    return suffixes;
  }

  /**
   * Returns whether the snapshot holds no reference data at all.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return exact.isEmpty() && suffixes.isEmpty();
  }

  @Override
  public String toString() {
    return "TldSnapshot[exact=" + exact.size() + ", suffixes=" + suffixes.size() + "]";
  }

  /**
   * Accumulates reference data from the two bootstrap downloads. Both feeds may run concurrently; writes are
   * serialized by the builder's own lock.
   */
  public static final class Builder {
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> exact = new HashSet<>();
    private final Set<String> suffixes = new LinkedHashSet<>();

    private Builder() {}

    /**
     * Consumes one line of the plain TLD list (one label per line). Blank lines and {@code #} comments are skipped.
     *
     * @param rawLine raw line
     * @return {@code true} when the line contributed a label
     */
    public boolean acceptTldListLine(String rawLine) {
      String line = rawLine == null ? "" : rawLine.trim().toLowerCase(Locale.ROOT);
      if (line.isEmpty() || line.startsWith("#")) {
        return false;
      }
      lock.lock();
      try {
        exact.add(line);
      } finally {
        lock.unlock();
      }
      return true;
    }

    /**
     * Consumes one line of the effective TLD names data. Only lines starting with an ASCII letter or digit count;
     * comments, wildcard and exception rules, and non-ASCII entries are ignored. Dot-free entries join the exact
     * set, the rest become {@code .}-prefixed suffixes.
     *
     * @param rawLine raw line
     * @return {@code true} when the line contributed reference data
     */
    public boolean acceptEffectiveTldLine(String rawLine) {
      String line = rawLine == null ? "" : rawLine.trim().toLowerCase(Locale.ROOT);
      if (line.isEmpty() || !isAsciiAlnum(line.charAt(0))) {
        return false;
      }
      lock.lock();
      try {
        if (line.indexOf('.') < 0) {
          exact.add(line);
        } else {
          suffixes.add("." + line);
        }
      } finally {
        lock.unlock();
      }
      return true;
    }

    /**
     * Publishes the accumulated data as an immutable snapshot.
     *
     * @return snapshot
     */
    public TldSnapshot build() {
      lock.lock();
      try {
        return new TldSnapshot(exact, new ArrayList<>(suffixes));
      } finally {
        lock.unlock();
      }
    }

    private static boolean isAsciiAlnum(char c) {
      return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }
  }
}
