package ca.gc.cra.rill.validation;

/**
 * Numeric bound checks for pipeline configuration such as async queue capacity.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in the message; {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return {@code value}, for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer configuration value and checks its bounds.
   *
   * @param name parameter name used in messages
   * @param raw text to parse; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside the range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    long parsed;
    try {
      parsed = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
