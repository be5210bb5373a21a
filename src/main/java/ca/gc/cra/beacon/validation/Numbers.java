package ca.gc.cra.beacon.validation;

/**
 * Range checks for ports, counts and octets supplied on the command line.
 *
 * <p>Failures are reported as {@link IllegalArgumentException} naming the offending parameter.</p>
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {}

  /**
   * Checks that {@code value} lies in {@code [min, max]}.
   *
   * @param name parameter name used in the failure message
   * @param value candidate value
   * @param min lowest accepted value
   * @param max highest accepted value
   * @return {@code value}
   * @throws IllegalArgumentException when the value is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value >= min && value <= max) {
      return value;
    }
    throw new IllegalArgumentException(label(name) + " must be between " + min + " and " + max
        + " (was " + value + ")");
  }

  /**
   * Parses a decimal integer and checks it against {@code [min, max]}.
   *
   * @param name parameter name used in the failure message
   * @param raw text to parse; surrounding whitespace is ignored
   * @param min lowest accepted value
   * @param max highest accepted value
   * @return parsed value
   * @throws IllegalArgumentException when the text is not an integer or the value is out of range
   */
  public static int parseInt(String name, String raw, int min, int max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must be an integer");
    }
    int parsed;
    try {
      parsed = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw.trim() + "')", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
