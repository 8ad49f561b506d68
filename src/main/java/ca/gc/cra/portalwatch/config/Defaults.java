package ca.gc.cra.portalwatch.config;

import ca.gc.cra.portalwatch.application.validation.PortalProber;
import ca.gc.cra.portalwatch.domain.probe.ProbingConfiguration;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Supplies the flattened default configuration for each CLI command.
 *
 * <p>The defaults are the single source of truth for the set of recognised keys.</p>
 */
public final class Defaults {
  /** Commands that read configuration. */
  public static final Set<String> COMMANDS = Set.of("check", "watch");

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private Defaults() {}

  /**
   * Returns the defaults for a command.
   *
   * @param command {@code check} or {@code watch}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    if (!COMMANDS.contains(normalized)) {
      throw new IllegalArgumentException("Unsupported command: " + command);
    }
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    if (normalized.equals("watch")) {
      // watch keeps retrying until interrupted
      defaults.put("maxAttempts", "0");
    }
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    ProbingConfiguration probing = ProbingConfiguration.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("iface", "eth0");
    map.put("ifindex", "1");
    map.put("ipFamily", "IPV4");
    map.put("dns", "");
    map.put("mode", "full");
    map.put("httpUrl", probing.httpUrl().toString());
    map.put("httpsUrl", probing.httpsUrl().toString());
    map.put("fallbackHttpUrls", join(probing.fallbackHttpUrls()));
    map.put("fallbackHttpsUrls", join(probing.fallbackHttpsUrls()));
    map.put("probeTimeoutMs", "10000");
    map.put("backoffInitialMs", "3000");
    map.put("backoffMaxMs", "300000");
    map.put("maxAttempts", "3");
    map.put("retryOnFailure", "true");
    map.put("validationLogCapacity", "25");
    map.put("userAgent", PortalProber.DEFAULT_USER_AGENT);
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  private static String join(List<URI> urls) {
    return urls.stream().map(URI::toString).collect(Collectors.joining(","));
  }
}
