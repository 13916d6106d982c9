package ca.gc.cra.rill.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String validation for configuration values such as sink paths and worker names.
 * <p><strong>Why:</strong> Rejects values that would later produce unreadable thread names or broken files.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and free of control characters.
   *
   * @param name parameter name for diagnostics; {@code "value"} when {@code null}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII and fits within {@code maxLength}.
   *
   * @param name parameter name for diagnostics
   * @param value candidate string
   * @param maxLength maximum permitted length in characters
   * @return trimmed value containing only characters {@code 0x20-0x7E}
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank, too long, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
