package ca.gc.cra.beacon.application.session;

import ca.gc.cra.beacon.validation.Strings;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions by name, created on first reference. The {@value #MAIN} session always exists.
 *
 * <p>Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class SessionRegistry {
  /** Name of the session that is always present. */
  public static final String MAIN = "Main";

  private final SessionHost host;
  private final Map<String, Session> sessions = new ConcurrentHashMap<>();
  private final Session main;

  public SessionRegistry(SessionHost host) {
    this.host = Objects.requireNonNull(host, "host");
    this.main = new Session(host, MAIN);
    sessions.put(MAIN, main);
  }

  public Session main() {
    return main;
  }

  /**
   * Returns the named session, creating it when first referenced.
   *
   * @param name session name; must not be blank
   * @return session
   */
  public Session get(String name) {
    String key = Strings.requireNonBlank("name", name);
    return sessions.computeIfAbsent(key, n -> new Session(host, n));
  }

  public Optional<Session> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(sessions.get(name));
  }

  /**
   * Forgets a session. Callers still holding it can keep logging through it.
   *
   * @param name session name
   * @return {@code true} when removed; always {@code false} for {@value #MAIN}
   */
  public boolean delete(String name) {
    if (name == null || MAIN.equals(name)) {
      return false;
    }
    return sessions.remove(name) != null;
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(new TreeSet<>(sessions.keySet()));
  }
}
