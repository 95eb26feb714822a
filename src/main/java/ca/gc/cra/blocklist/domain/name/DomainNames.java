package ca.gc.cra.blocklist.domain.name;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Shape checks and label-boundary helpers for block list domain names.
 * <p><strong>Why:</strong> Every stage after line validation treats a domain as an opaque lower-case key; this
 * class is the single place that knows what a valid key looks like and how to walk its ancestors.
 * <p><strong>Thread-safety:</strong> Stateless; the compiled pattern is immutable and shared.</p>
 *
 * @since 0.1.0
 */
public final class DomainNames {
  /**
   * Accepted domain shape: one or more {@code label.} groups (optionally {@code xn--} prefixed) followed by a final
   * alphanumeric label of at least two characters. Applied to lower-cased input only.
   */
  public static final Pattern DOMAIN_PATTERN =
      Pattern.compile("^((xn--)?[a-z0-9][a-z0-9\\-_]*\\.)+[a-z0-9]{2,}$");

  private DomainNames() {
    // Utility
  }

  /**
   * Lower-cases a raw value using the root locale.
   *
   * @param raw raw text; must not be {@code null}
   * @return lower-cased text
   */
  public static String normalize(String raw) {
    return Objects.requireNonNull(raw, "raw").toLowerCase(Locale.ROOT);
  }

  /**
   * Checks a candidate against {@link #DOMAIN_PATTERN}.
   *
   * @param candidate value to test; {@code null} is never valid
   * @return {@code true} when the candidate is a well-formed lower-case domain
   */
  public static boolean isValid(String candidate) {
    return candidate != null && DOMAIN_PATTERN.matcher(candidate).matches();
  }

  /**
   * Returns the label after the final dot, or the whole value when it has no dot.
   *
   * @param domain domain name; must not be {@code null}
   * @return last label
   */
  public static String lastLabel(String domain) {
    int idx = domain.lastIndexOf('.');
    return idx < 0 ? domain : domain.substring(idx + 1);
  }

  /**
   * Lists every proper suffix of {@code domain} that starts at a label boundary, nearest ancestor first.
   *
   * <p>{@code a.b.example.com} yields {@code [b.example.com, example.com, com]}. The domain itself is never part of
   * the result.</p>
   *
   * @param domain domain name; must not be {@code null}
   * @return ancestors ordered from longest to shortest
   */
  public static List<String> ancestors(String domain) {
    Objects.requireNonNull(domain, "domain");
    List<String> result = new ArrayList<>();
    int idx = domain.indexOf('.');
    while (idx >= 0 && idx < domain.length() - 1) {
      result.add(domain.substring(idx + 1));
      idx = domain.indexOf('.', idx + 1);
    }
    return result;
  }
}
