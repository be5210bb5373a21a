package ca.gc.cra.beacon.validation;

import java.util.Objects;

/**
 * Text checks for names and values that end up in packet captions or connection descriptors.
 *
 * <p>Session and application names reach the console verbatim, so control characters are refused up front.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {}

  /**
   * Trims {@code value} and refuses blank text or text holding control characters.
   *
   * @param name parameter name used in failure messages
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException when {@code value} is {@code null}
   * @throws IllegalArgumentException when the value is blank or holds a control character
   */
  public static String requireNonBlank(String name, String value) {
    String label = label(name);
    String trimmed = Objects.requireNonNull(value, label).trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    if (trimmed.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(label + " must not contain control characters");
    }
    return trimmed;
  }

  /**
   * Like {@link #requireNonBlank} but also limits the value to {@code maxLength} printable ASCII characters,
   * as required for descriptor fragments and OTLP settings.
   *
   * @param name parameter name used in failure messages
   * @param value candidate text
   * @param maxLength longest accepted value after trimming
   * @return trimmed value
   * @throws IllegalArgumentException when the value is blank, too long or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    if (!trimmed.chars().allMatch(c -> c >= 0x20 && c <= 0x7E)) {
      throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
    }
    return trimmed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
