package ca.gc.cra.beacon.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI tokens into a lookup map.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern OPTION = Pattern.compile("([A-Za-z0-9._-]+)=(.*)", Pattern.DOTALL);

  private CliArgsParser() {}

  /**
   * Splits each token on its first {@code '='}, so a value such as {@code connection=tcp(host=a,port=4228)}
   * survives whole. Keys keep their case; a repeated key keeps the last value.
   *
   * @param args raw tokens; {@code null} or blank entries are skipped
   * @return mutable map in argument order
   * @throws IllegalArgumentException when a token has no key, an invalid key, or a control character in its value
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> options = new LinkedHashMap<>();
    if (args == null) {
      return options;
    }
    for (String raw : args) {
      String token = raw == null ? "" : raw.trim();
      if (token.isEmpty()) {
        continue;
      }
      Matcher m = OPTION.matcher(token);
      if (!m.matches()) {
        throw new IllegalArgumentException("argument must be key=value with a name of letters, digits, '.', '_'"
            + " or '-' (was '" + token + "')");
      }
      String value = m.group(2).trim();
      if (value.chars().anyMatch(Character::isISOControl)) {
        throw new IllegalArgumentException("argument " + m.group(1) + " must not contain control characters");
      }
      options.put(m.group(1), value);
    }
    return options;
  }
}
