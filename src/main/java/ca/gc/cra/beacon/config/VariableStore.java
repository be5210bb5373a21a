package ca.gc.cra.beacon.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Client-owned key/value store used to expand placeholders in connection descriptors.
 * <p><strong>Why:</strong> Deployments keep one descriptor template and inject hosts or rooms per environment.</p>
 * <p><strong>Thread-safety:</strong> Backed by a concurrent map; safe for concurrent access.</p>
 *
 * @since 0.1.0
 */
public final class VariableStore {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}|%([^%]+)%");

  private final Map<String, String> values = new ConcurrentHashMap<>();

  /**
   * Stores or replaces a variable.
   *
   * @param key variable name
   * @param value variable value
   */
  public void set(String key, String value) {
    values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  public Optional<String> get(String key) {
    if (key == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(values.get(key));
  }

  public void unset(String key) {
    if (key != null) {
      values.remove(key);
    }
  }

  public void clear() {
    values.clear();
  }

  /**
   * Replaces every {@code ${key}} and {@code %key%} placeholder with its stored value in a single pass, so
   * substituted values are never expanded again.
   *
   * <p>A {@code %...%} pair naming no stored variable is kept as literal text; an unknown {@code ${key}} is an
   * error.</p>
   *
   * @param text template text; {@code null} yields {@code null}
   * @return expanded text
   * @throws ConfigurationException when a {@code ${key}} placeholder names an unknown variable
   */
  public String expand(String text) throws ConfigurationException {
    if (text == null) {
      return null;
    }
    Matcher matcher = PLACEHOLDER.matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    int copied = 0;
    int from = 0;
    while (from < text.length() && matcher.find(from)) {
      String braced = matcher.group(1);
      String key = braced != null ? braced : matcher.group(2);
      String value = values.get(key);
      if (value == null && braced != null) {
        throw new ConfigurationException("Unresolved variable '" + key + "' in connection descriptor");
      }
      if (value == null) {
        // literal '%'; rescan from the next character
        from = matcher.start() + 1;
        continue;
      }
      out.append(text, copied, matcher.start()).append(value);
      copied = matcher.end();
      from = copied;
    }
    return out.append(text, copied, text.length()).toString();
  }
}
