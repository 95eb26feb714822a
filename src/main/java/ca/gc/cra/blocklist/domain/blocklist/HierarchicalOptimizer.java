package ca.gc.cra.blocklist.domain.blocklist;

import ca.gc.cra.blocklist.domain.name.DomainNames;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Removes every domain already covered by a blocked ancestor domain.
 * <p><strong>Why:</strong> DNS-level blockers match a listed domain and all of its subdomains, so
 * {@code ads.example.com} adds nothing once {@code example.com} is listed.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each call works on its own copy.</p>
 * <p><strong>Performance:</strong> One hash probe per label boundary of each domain.</p>
 *
 * @since 0.1.0
 */
public final class HierarchicalOptimizer {

  private HierarchicalOptimizer() {
    // Utility
  }

  /**
   * Returns the subset of {@code domains} whose proper ancestors are all absent from the input.
   *
   * <p>A domain never removes itself. The result is unordered; callers sort before writing. Applying the
   * operation twice yields the same set.</p>
   *
   * @param domains input domains; must not be {@code null}
   * @return reduced set
   */
  public static Set<String> optimize(Collection<String> domains) {
    Objects.requireNonNull(domains, "domains");
    Set<String> present = domains instanceof Set<String> set ? set : new HashSet<>(domains);
    Set<String> kept = new HashSet<>();
    for (String domain : present) {
      if (!coveredByAncestor(domain, present)) {
        kept.add(domain);
      }
    }
    return kept;
  }

  private static boolean coveredByAncestor(String domain, Set<String> present) {
    for (String ancestor : DomainNames.ancestors(domain)) {
      if (present.contains(ancestor)) {
        return true;
      }
    }
    return false;
  }
}
