package ca.gc.cra.portalwatch.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command; their keys are the recognised keys
   * @param warn consumer told about CLI keys overriding YAML keys and about unknown keys
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged values are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> sink = warn == null ? message -> {} : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!defaultsCopy.containsKey(entry.getKey())) {
        sink.accept("Ignoring unknown YAML key: " + entry.getKey());
        continue;
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (!defaultsCopy.containsKey(key)) {
        throw new IllegalArgumentException("Unknown configuration key: " + key);
      }
      if (yamlCopy.containsKey(key)) {
        sink.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    long initial = parseLong(effective.get("backoffInitialMs"));
    long max = parseLong(effective.get("backoffMaxMs"));
    if (initial >= 0 && max >= 0 && max < initial) {
      throw new IllegalArgumentException("backoffMaxMs must be >= backoffInitialMs");
    }
  }

  private static long parseLong(String value) {
    if (value == null || value.isBlank()) {
      return -1L;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      // Reported with the key name by ValidationConfig.fromMap.
      return -1L;
    }
  }
}
