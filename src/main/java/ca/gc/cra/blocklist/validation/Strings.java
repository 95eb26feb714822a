package ca.gc.cra.blocklist.validation;

import java.util.Objects;

/**
 * String checks for values that name something the pipeline acts on: catalog rule patterns and host addresses,
 * file paths for {@code optimize}, and the OpenTelemetry resource attributes.
 *
 * <p>Failures raise {@link IllegalArgumentException} with the offending key in the message, which the CLI reports
 * as an invalid-arguments exit.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Uris
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Rejects {@code null}, blank and control-character values.
   *
   * @param name key reported in the failure message; {@code null} reports {@code value}
   * @param value candidate text
   * @return {@code value} trimmed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains an ISO control character
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    if (containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Like {@link #requireNonBlank(String, String)}, but also limits the value to {@code maxLength} printable ASCII
   * characters ({@code 0x20-0x7E}). Used for OTLP resource attributes, which the exporter sends as headers.
   *
   * @param name key reported in the failure message
   * @param value candidate text
   * @param maxLength inclusive upper bound on the trimmed length
   * @return {@code value} trimmed
   * @throws IllegalArgumentException if the value is blank, too long, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    if (maxLength < 0) {
      throw new IllegalArgumentException("maxLength must not be negative");
    }
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    if (!trimmed.chars().allMatch(c -> c >= 0x20 && c <= 0x7E)) {
      throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
    }
    return trimmed;
  }

  /**
   * Returns whether {@code value} holds a tab, newline or other ISO control character.
   *
   * @param value sequence to scan
   * @return {@code true} when a control character is present
   */
  public static boolean containsControl(CharSequence value) {
    return value.chars().anyMatch(c -> Character.isISOControl((char) c));
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
