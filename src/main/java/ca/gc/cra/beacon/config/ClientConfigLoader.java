package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.domain.packet.Level;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link ClientConfig} from a YAML document ({@code .yaml}/{@code .yml}) or a properties file.
 *
 * <p>Recognized keys (case-insensitive): {@code appname}, {@code level}, {@code defaultlevel}, {@code enabled},
 * {@code connections}. Nested YAML sections are flattened, so a top-level section name is ignored.
 * Placeholders in {@code connections} are expanded from the supplied {@link VariableStore}.</p>
 *
 * @since 0.1.0
 */
public final class ClientConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ClientConfigLoader.class);

  private ClientConfigLoader() {}

  /**
   * Reads the file at {@code path}.
   *
   * @param path configuration file
   * @param variables variables used to expand the connection descriptor
   * @return parsed configuration; empty when the file does not exist
   * @throws ConfigurationException when the file cannot be read or contains invalid values
   */
  public static ClientConfig load(Path path, VariableStore variables) throws ConfigurationException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(variables, "variables");
    if (!Files.exists(path)) {
      log.warn("Configuration file {} does not exist; keeping current settings", path);
      return ClientConfig.empty();
    }
    Map<String, String> values;
    try {
      values = isYaml(path) ? readYaml(path) : readProperties(path);
    } catch (IOException ex) {
      throw new ConfigurationException("Unable to read configuration file " + path, ex);
    }
    return fromMap(values, variables);
  }

  /**
   * Interprets already flattened key/value pairs.
   *
   * @param values raw values keyed by lower-case name
   * @param variables variables used to expand the connection descriptor
   * @return parsed configuration
   * @throws ConfigurationException when a level name or placeholder is invalid
   */
  public static ClientConfig fromMap(Map<String, String> values, VariableStore variables)
      throws ConfigurationException {
    Optional<String> appName = Optional.ofNullable(values.get("appname")).filter(v -> !v.isBlank());
    Optional<Level> level = optionalLevel("level", values.get("level"));
    Optional<Level> defaultLevel = optionalLevel("defaultlevel", values.get("defaultlevel"));
    Optional<Boolean> enabled = Optional.ofNullable(values.get("enabled"))
        .map(ConnectionStringParser::parseBoolean);
    String rawConnections = values.get("connections");
    Optional<String> connections = rawConnections == null || rawConnections.isBlank()
        ? Optional.empty()
        : Optional.of(variables.expand(rawConnections.trim()));
    return new ClientConfig(appName, level, defaultLevel, enabled, connections);
  }

  private static Optional<Level> optionalLevel(String key, String raw) throws ConfigurationException {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(ConnectionStringParser.parseLevel(key, raw));
  }

  private static boolean isYaml(Path path) {
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    return name.endsWith(".yaml") || name.endsWith(".yml");
  }

  private static Map<String, String> readProperties(Path path) throws IOException {
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : props.stringPropertyNames()) {
      if (name.startsWith("[")) {
        continue;
      }
      values.put(name.trim().toLowerCase(Locale.ROOT), props.getProperty(name).trim());
    }
    return values;
  }

  private static Map<String, String> readYaml(Path path) throws IOException, ConfigurationException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      Map<String, String> values = new LinkedHashMap<>();
      if (document == null) {
        return values;
      }
      if (!(document instanceof Map<?, ?> root)) {
        throw new ConfigurationException("YAML configuration root must be a mapping: " + path);
      }
      flatten(root, values);
      return values;
    } catch (YAMLException ex) {
      throw new ConfigurationException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static void flatten(Map<?, ?> source, Map<String, String> target) {
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        continue;
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(nested, target);
      } else if (value != null) {
        target.put(key.trim().toLowerCase(Locale.ROOT), value.toString());
      }
    }
  }
}
