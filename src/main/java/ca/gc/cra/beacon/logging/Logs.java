package ca.gc.cra.beacon.logging;

import java.nio.charset.StandardCharsets;

/**
 * Helpers for quoting caller or server supplied text in BEACON's own diagnostics.
 *
 * <p>Banners, descriptor keys and packet titles are unbounded, so log messages only carry a prefix.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {}

  /**
   * Cuts {@code value} to at most {@code maxBytes} UTF-8 bytes without splitting a code point and notes the
   * original size.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes UTF-8 byte budget; must be positive
   * @return {@code value} unchanged when it fits, otherwise the prefix followed by a truncation marker
   * @throws IllegalArgumentException when {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int totalBytes = value.getBytes(StandardCharsets.UTF_8).length;
    if (totalBytes <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int codePoint = value.codePointAt(end);
      int width = utf8Width(codePoint);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(codePoint);
    }
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + totalBytes + ")";
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
