package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.domain.packet.Level;
import java.util.Optional;

/**
 * Client-level settings read from a configuration file. Absent keys are empty and leave the client unchanged.
 *
 * @param appName application name announced to the console
 * @param level global minimum level
 * @param defaultLevel level used by level-less session calls
 * @param enabled whether the client should start sending after the connection is configured
 * @param connections connection descriptor, placeholders already expanded
 * @since 0.1.0
 */
public record ClientConfig(
    Optional<String> appName,
    Optional<Level> level,
    Optional<Level> defaultLevel,
    Optional<Boolean> enabled,
    Optional<String> connections) {

  public ClientConfig {
    appName = appName == null ? Optional.empty() : appName;
    level = level == null ? Optional.empty() : level;
    defaultLevel = defaultLevel == null ? Optional.empty() : defaultLevel;
    enabled = enabled == null ? Optional.empty() : enabled;
    connections = connections == null ? Optional.empty() : connections;
  }

  /**
   * Returns a configuration that changes nothing.
   *
   * @return empty configuration
   */
  public static ClientConfig empty() {
    return new ClientConfig(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
  }
}
