package ca.gc.cra.beacon.validation;

import java.util.regex.Pattern;

/**
 * Network address helpers for console endpoints and gateway discovery.
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  // dotted-quad shape; octets are range-checked separately
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a hostname or IPv4 literal.
   *
   * @param host candidate host
   * @return the host
   * @throws IllegalArgumentException when the host is malformed
   */
  public static String validateHost(String host) {
    String sanitized = Strings.requireNonBlank("host", host);
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      parseIpv4(sanitized);
      return sanitized;
    }
    validateHostname(sanitized);
    return sanitized;
  }

  /**
   * Tests whether {@code host} is an IPv4 literal in an RFC 1918 private range.
   *
   * @param host candidate address; may be {@code null}
   * @return {@code true} for 10/8, 172.16/12, or 192.168/16 addresses
   */
  public static boolean isPrivateIpv4(String host) {
    int[] octets = tryParseIpv4(host);
    if (octets == null) {
      return false;
    }
    return octets[0] == 10
        || (octets[0] == 172 && octets[1] >= 16 && octets[1] <= 31)
        || (octets[0] == 192 && octets[1] == 168);
  }

  /**
   * Tests whether {@code host} names the local machine.
   *
   * @param host candidate host; may be {@code null}
   * @return {@code true} for {@code localhost}, 127/8, or {@code ::1}
   */
  public static boolean isLoopback(String host) {
    if (host == null) {
      return false;
    }
    String trimmed = host.trim();
    if (trimmed.equalsIgnoreCase("localhost") || trimmed.equals("::1")) {
      return true;
    }
    int[] octets = tryParseIpv4(trimmed);
    return octets != null && octets[0] == 127;
  }

  private static int[] tryParseIpv4(String host) {
    if (host == null || !IPV4_PATTERN.matcher(host.trim()).matches()) {
      return null;
    }
    try {
      return parseIpv4(host.trim());
    } catch (IllegalArgumentException ex) {
      return null;
    }
  }

  private static int[] parseIpv4(String host) {
    String[] parts = host.split("\\.");
    int[] octets = new int[4];
    for (int i = 0; i < 4; i++) {
      octets[i] = (int) Numbers.requireRange("IPv4 octet", Integer.parseInt(parts[i]), 0, 255);
    }
    return octets;
  }

  private static void validateHostname(String host) {
    int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      int dot = host.indexOf('.', start);
      int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
