package ca.gc.cra.blocklist.domain.rules;

import ca.gc.cra.blocklist.domain.name.DomainNames;
import ca.gc.cra.blocklist.logging.Logs;
import ca.gc.cra.blocklist.validation.Strings;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-source line format that maps one raw, already lower-cased line to a domain.
 * <p><strong>Why:</strong> Upstream lists mix hosts-file syntax and bare domain lists; each source descriptor
 * carries the rule that understands its format.
 * <p><strong>Role:</strong> Closed set of variants evaluated through {@link #validate(String)}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable and shared across source tasks.</p>
 *
 * @since 0.1.0
 */
public sealed interface LineRule permits LineRule.HostLineRule, LineRule.DomainListRule {

  /**
   * Extracts the domain carried by {@code line}.
   *
   * @param line raw line, lower-cased by the caller; must not be {@code null}
   * @return the validated domain, or empty when the line is rejected
   */
  Optional<String> validate(String line);

  /**
   * Short human-readable description used in dry-run plans and logs.
   *
   * @return description such as {@code hosts(0.0.0.0)} or {@code domains}
   */
  String describe();

  /**
   * Creates a hosts-file rule bound to {@code address}.
   *
   * @param address literal address every accepted line must start with
   * @return hosts-file rule
   */
  static LineRule hostLine(String address) {
    return new HostLineRule(address);
  }

  /**
   * Returns the bare domain-list rule.
   *
   * @return domain-list rule
   */
  static LineRule domainList() {
    return DomainListRule.INSTANCE;
  }

  /**
   * Hosts-file line: {@code <address><whitespace><domain>[anything]}.
   */
  final class HostLineRule implements LineRule {
    private static final Logger log = LoggerFactory.getLogger(HostLineRule.class);

    private final String address;
    private final Pattern linePattern;

    HostLineRule(String address) {
      this.address = Strings.requireNonBlank("address", address);
      this.linePattern = Pattern.compile("^(" + Pattern.quote(this.address) + ")\\s+([a-z0-9\\-._]+)");
    }

    /**
     * Returns the address literal accepted lines must start with.
     *
     * @return address literal
     */
    public String address() {
      return address;
    }

    @Override
    public Optional<String> validate(String line) {
      Objects.requireNonNull(line, "line");
      Matcher matcher = linePattern.matcher(line);
      if (matcher.lookingAt()) {
        String candidate = matcher.group(2);
        if (DomainNames.isValid(candidate)) {
          return Optional.of(candidate);
        }
      }
      log.debug("invalid line: {}", Logs.line(line));
      return Optional.empty();
    }

    @Override
    public String describe() {
      return "hosts(" + address + ")";
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof HostLineRule rule && rule.address.equals(address);
    }

    @Override
    public int hashCode() {
      return address.hashCode();
    }

    @Override
    public String toString() {
      return "HostLineRule[address=" + address + "]";
    }
  }

  /**
   * Bare domain per line.
   */
  final class DomainListRule implements LineRule {
    private static final Logger log = LoggerFactory.getLogger(DomainListRule.class);
    static final DomainListRule INSTANCE = new DomainListRule();

    private DomainListRule() {}

    @Override
    public Optional<String> validate(String line) {
      Objects.requireNonNull(line, "line");
      if (DomainNames.isValid(line)) {
        return Optional.of(line);
      }
      log.debug("invalid domain: {}", Logs.line(line));
      return Optional.empty();
    }

    @Override
    public String describe() {
      return "domains";
    }

    @Override
    public String toString() {
      return "DomainListRule";
    }
  }
}
