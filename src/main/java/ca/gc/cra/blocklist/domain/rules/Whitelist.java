package ca.gc.cra.blocklist.domain.rules;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable set of {@link WhitelistRule}s. The first matching rule wins; rules are otherwise independent.
 *
 * @since 0.1.0
 */
public final class Whitelist {
  private static final Whitelist EMPTY = new Whitelist(List.of());

  private final List<WhitelistRule> rules;

  /**
   * Creates a whitelist from rules in evaluation order.
   *
   * @param rules rules; must not be {@code null} or contain {@code null}
   */
  public Whitelist(List<WhitelistRule> rules) {
    this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
  }

  /**
   * Returns a whitelist that exempts nothing.
   *
   * @return empty whitelist
   */
  public static Whitelist empty() {
    return EMPTY;
  }

  /**
   * Finds the first rule exempting {@code domain}.
   *
   * @param domain lower-cased domain
   * @return matching rule, or empty when the domain is blockable
   */
  public Optional<WhitelistRule> firstMatch(String domain) {
    Objects.requireNonNull(domain, "domain");
    for (WhitelistRule rule : rules) {
      if (rule.matches(domain)) {
        return Optional.of(rule);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns whether any rule exempts {@code domain}.
   *
   * @param domain lower-cased domain
   * @return {@code true} when whitelisted
   */
  public boolean isWhitelisted(String domain) {
    return firstMatch(domain).isPresent();
  }

  /**
   * Returns the configured rules in evaluation order.
   *
   * @return immutable rule list
   */
  public List<WhitelistRule> rules() {
    return rules;
  }

  /**
   * Returns the number of configured rules.
   *
   * @return rule count
   */
  public int size() {
    return rules.size();
  }
}
