package ca.gc.cra.portalwatch.api;

import ca.gc.cra.portalwatch.validation.Strings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns the {@code key=value} settings of a {@code check} or {@code watch} run into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern SETTING_KEY = Pattern.compile("[A-Za-z][A-Za-z0-9._]*");

  private CliArgsParser() {}

  /**
   * Splits each setting on its first {@code '='}. An empty value ({@code dns=}) is kept so it can clear a YAML
   * setting.
   *
   * @param settings settings as returned by {@link CliInput#settings()}
   * @return mutable map in command-line order
   * @throws IllegalArgumentException for a bare word, a malformed key, a repeated key or a value with control
   *     characters
   */
  public static Map<String, String> toMap(List<String> settings) {
    Map<String, String> map = new LinkedHashMap<>();
    for (String setting : settings) {
      int eq = setting.indexOf('=');
      if (eq <= 0) {
        throw new IllegalArgumentException("expected key=value but got '" + setting + "'");
      }
      String key = setting.substring(0, eq).trim();
      if (!SETTING_KEY.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid setting name: " + key);
      }
      String value = setting.substring(eq + 1).trim();
      if (!value.isEmpty()) {
        // rejects control characters; an empty value stays allowed
        Strings.requireNonBlank(key, value);
      }
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("setting given more than once: " + key);
      }
    }
    return map;
  }
}
