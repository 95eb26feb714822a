package ca.gc.cra.blocklist.domain.rules;

import ca.gc.cra.blocklist.validation.Strings;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Predicate that exempts a domain from blocking.
 *
 * <p>Variants compare against the lower-cased domain: exact equality, prefix, suffix, substring, and regular
 * expression ({@link java.util.regex.Matcher#find()} semantics, so unanchored patterns match anywhere).</p>
 *
 * @since 0.1.0
 */
public sealed interface WhitelistRule
    permits WhitelistRule.EqualRule,
        WhitelistRule.PrefixRule,
        WhitelistRule.SuffixRule,
        WhitelistRule.ContainsRule,
        WhitelistRule.RegexRule {

  /**
   * Tests the rule against a domain.
   *
   * @param domain lower-cased domain; must not be {@code null}
   * @return {@code true} when the domain is exempt
   */
  boolean matches(String domain);

  /**
   * Catalog keyword for this rule kind ({@code equal}, {@code prefix}, {@code suffix}, {@code contains},
   * {@code regex}).
   *
   * @return rule kind
   */
  String kind();

  /**
   * Pattern text as configured.
   *
   * @return pattern
   */
  String pattern();

  /**
   * Builds a rule from its catalog keyword and pattern.
   *
   * @param kind rule keyword, case-insensitive
   * @param pattern rule pattern; must not be blank
   * @return rule instance
   * @throws IllegalArgumentException if the keyword is unknown or the pattern is blank or an invalid regex
   */
  static WhitelistRule of(String kind, String pattern) {
    String normalized = Strings.requireNonBlank("whitelist rule kind", kind).toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "equal" -> new EqualRule(pattern);
      case "prefix" -> new PrefixRule(pattern);
      case "suffix" -> new SuffixRule(pattern);
      case "contains" -> new ContainsRule(pattern);
      case "regex" -> new RegexRule(pattern);
      default -> throw new IllegalArgumentException("unknown whitelist rule kind: " + kind);
    };
  }

  /** Exact match. */
  record EqualRule(String pattern) implements WhitelistRule {
    public EqualRule {
      pattern = Strings.requireNonBlank("equal", pattern);
    }

    @Override
    public boolean matches(String domain) {
      return pattern.equals(domain);
    }

    @Override
    public String kind() {
      return "equal";
    }
  }

  /** Leading match. */
  record PrefixRule(String pattern) implements WhitelistRule {
    public PrefixRule {
      pattern = Strings.requireNonBlank("prefix", pattern);
    }

    @Override
    public boolean matches(String domain) {
      return domain.startsWith(pattern);
    }

    @Override
    public String kind() {
      return "prefix";
    }
  }

  /** Trailing match; no implicit label boundary, so {@code msedge.net} also matches {@code foomsedge.net}. */
  record SuffixRule(String pattern) implements WhitelistRule {
    public SuffixRule {
      pattern = Strings.requireNonBlank("suffix", pattern);
    }

    @Override
    public boolean matches(String domain) {
      return domain.endsWith(pattern);
    }

    @Override
    public String kind() {
      return "suffix";
    }
  }

  /** Substring match. */
  record ContainsRule(String pattern) implements WhitelistRule {
    public ContainsRule {
      pattern = Strings.requireNonBlank("contains", pattern);
    }

    @Override
    public boolean matches(String domain) {
      return domain.contains(pattern);
    }

    @Override
    public String kind() {
      return "contains";
    }
  }

  /** Regular expression match, compiled once. */
  final class RegexRule implements WhitelistRule {
    private final String pattern;
    private final Pattern compiled;

    /**
     * Compiles the expression.
     *
     * @param pattern Java regular expression
     * @throws IllegalArgumentException if the expression is blank or does not compile
     */
    public RegexRule(String pattern) {
      this.pattern = Strings.requireNonBlank("regex", pattern);
      try {
        this.compiled = Pattern.compile(this.pattern);
      } catch (PatternSyntaxException ex) {
        throw new IllegalArgumentException("invalid whitelist regex: " + pattern, ex);
      }
    }

    @Override
    public boolean matches(String domain) {
      return compiled.matcher(domain).find();
    }

    @Override
    public String kind() {
      return "regex";
    }

    @Override
    public String pattern() {
      return pattern;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof RegexRule rule && rule.pattern.equals(pattern);
    }

    @Override
    public int hashCode() {
      return Objects.hash("regex", pattern);
    }

    @Override
    public String toString() {
      return "RegexRule[pattern=" + pattern + "]";
    }
  }
}
