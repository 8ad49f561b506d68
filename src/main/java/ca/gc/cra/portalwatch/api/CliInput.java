package ca.gc.cra.portalwatch.api;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Arguments of one portalwatch invocation, split into the known switches and {@code key=value} settings.
 *
 * <p>GNU-style {@code --key=value} is accepted as a setting. A switch outside {@link Flag} is rejected.</p>
 *
 * @since 0.1.0
 */
public final class CliInput {

  /** Switches understood by the dispatcher and by {@code check}/{@code watch}. */
  public enum Flag {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug"),
    DRY_RUN("--dry-run");

    private final Set<String> spellings;

    Flag(String... spellings) {
      this.spellings = Set.of(spellings);
    }

    static Flag lookup(String token) {
      String lower = token.toLowerCase(Locale.ROOT);
      for (Flag flag : values()) {
        if (flag.spellings.contains(lower)) {
          return flag;
        }
      }
      return null;
    }
  }

  private final List<String> settings;
  private final Set<Flag> flags;

  private CliInput(List<String> settings, Set<Flag> flags) {
    this.settings = List.copyOf(settings);
    this.flags = flags;
  }

  /**
   * Splits raw arguments. Bare words other than {@code help} stay with the settings so the settings parser can
   * report them.
   *
   * @param args raw arguments; {@code null} and blank entries are skipped
   * @return parsed input
   * @throws IllegalArgumentException when a switch is not a portalwatch flag
   */
  public static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    Set<Flag> flags = EnumSet.noneOf(Flag.class);
    if (args == null) {
      return new CliInput(settings, flags);
    }
    for (String raw : args) {
      String token = raw == null ? "" : raw.trim();
      if (token.isEmpty()) {
        continue;
      }
      Flag flag = Flag.lookup(token);
      if (flag != null) {
        flags.add(flag);
      } else if (token.startsWith("-")) {
        settings.add(asSetting(token));
      } else {
        settings.add(token);
      }
    }
    return new CliInput(settings, flags);
  }

  private static String asSetting(String token) {
    int eq = token.indexOf('=');
    if (eq < 0) {
      throw new IllegalArgumentException("unknown flag: " + token);
    }
    String stripped = token.replaceFirst("^-{1,2}", "");
    if (stripped.startsWith("-") || stripped.indexOf('=') == 0) {
      throw new IllegalArgumentException("malformed setting: " + token);
    }
    return stripped;
  }

  /**
   * Returns the {@code key=value} tokens in command-line order.
   *
   * @return immutable settings
   */
  public List<String> settings() {
    return settings;
  }

  public boolean has(Flag flag) {
    return flags.contains(flag);
  }

  public boolean help() {
    return has(Flag.HELP);
  }

  public boolean verbose() {
    return has(Flag.VERBOSE);
  }

  public boolean dryRun() {
    return has(Flag.DRY_RUN);
  }
}
