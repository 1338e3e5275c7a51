package ca.gc.cra.cadence.validation;

/**
 * Numeric range checks for pipeline and resolver settings.
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
   * @param name parameter name used in messages; blank becomes {@code "value"}
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer setting.
   *
   * @param name parameter name used in messages
   * @param raw text to parse; surrounding whitespace is ignored
   * @return parsed value
   * @throws IllegalArgumentException if the text is missing or not an integer
   */
  public static long parseLong(String name, String raw) {
    String label = name == null || name.isBlank() ? "value" : name;
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label + " must be an integer (was empty)");
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label + " must be an integer (was " + raw.trim() + ")", ex);
    }
  }
}
