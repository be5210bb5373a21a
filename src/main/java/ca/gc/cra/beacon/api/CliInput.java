package ca.gc.cra.beacon.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Subcommand arguments split into dash flags and {@code key=value} options.
 *
 * @param keyValueArgs option tokens in the order given
 * @param flags lower-cased flags; {@code --help} and {@code --verbose} aliases are normalized
 * @param help whether a help alias was present
 * @param verbose whether a verbose alias was present
 */
public record CliInput(List<String> keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
  private static final Set<String> HELP_ALIASES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of("--verbose", "-v", "--debug");

  public CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Splits raw arguments. A token starting with {@code '-'} and holding no {@code '='} is a flag; blank and
   * {@code null} tokens are skipped.
   *
   * @param args raw arguments, may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> options = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String token = raw == null ? "" : raw.trim();
        if (token.isEmpty()) {
          continue;
        }
        String lower = token.toLowerCase(Locale.ROOT);
        if (HELP_ALIASES.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_ALIASES.contains(lower)) {
          flags.add("--verbose");
        } else if (lower.startsWith("-") && lower.indexOf('=') < 0) {
          flags.add(lower);
        } else {
          options.add(token);
        }
      }
    }
    return new CliInput(options, flags, flags.contains("--help"), flags.contains("--verbose"));
  }

  /**
   * Parses the option tokens into a mutable map the caller consumes with {@link Map#remove}.
   *
   * @return options keyed by name
   * @throws IllegalArgumentException when a token is not a valid {@code key=value} pair
   */
  public Map<String, String> options() {
    return CliArgsParser.toMap(keyValueArgs.toArray(new String[0]));
  }

  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
