package ca.gc.cra.portalwatch.config;

import ca.gc.cra.portalwatch.domain.probe.IpFamily;
import ca.gc.cra.portalwatch.domain.probe.ProbingConfiguration;
import ca.gc.cra.portalwatch.domain.probe.ValidationMode;
import ca.gc.cra.portalwatch.validation.Net;
import ca.gc.cra.portalwatch.validation.Numbers;
import ca.gc.cra.portalwatch.validation.Strings;
import java.net.InetAddress;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Immutable settings of one portalwatch run: the interface to validate, probe URLs, timeouts
 * and retry bounds.
 * <p><strong>Why:</strong> Parses the merged key/value configuration once so the composition root only sees
 * validated, typed values.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot} and the CLI.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param iface interface name used in log tags and as a binding hint
 * @param ifindex interface index the service attaches to
 * @param ipFamily address family to probe over
 * @param dnsServers resolvers of the interface; empty means validation cannot start
 * @param mode validation mode
 * @param probing probe URLs
 * @param probeTimeout per-probe timeout enforced by the probe client
 * @param backoffInitial first retry interval after a reset
 * @param backoffMax upper bound of the retry interval
 * @param maxAttempts attempts {@code check} makes before giving up; {@code 0} means unbounded
 * @param retryOnFailure request another attempt after every verdict other than online
 * @param validationLogCapacity retained validation log entries
 * @param userAgent {@code User-Agent} sent with every probe
 * @since 0.1.0
 */
public record ValidationConfig(
    String iface,
    int ifindex,
    IpFamily ipFamily,
    List<InetAddress> dnsServers,
    ValidationMode mode,
    ProbingConfiguration probing,
    Duration probeTimeout,
    Duration backoffInitial,
    Duration backoffMax,
    int maxAttempts,
    boolean retryOnFailure,
    int validationLogCapacity,
    String userAgent) {

  private static final int MAX_IFACE_LENGTH = 64;
  private static final int MAX_USER_AGENT_LENGTH = 512;
  private static final long MAX_TIMEOUT_MS = 600_000L;
  private static final long MAX_BACKOFF_MS = 86_400_000L;

  /**
   * Validates the record invariants.
   *
   * @throws IllegalArgumentException if the backoff bounds are inverted or a count is out of range
   */
  public ValidationConfig {
    Objects.requireNonNull(iface, "iface");
    Objects.requireNonNull(ipFamily, "ipFamily");
    dnsServers = List.copyOf(Objects.requireNonNull(dnsServers, "dnsServers"));
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(probing, "probing");
    Objects.requireNonNull(probeTimeout, "probeTimeout");
    Objects.requireNonNull(backoffInitial, "backoffInitial");
    Objects.requireNonNull(backoffMax, "backoffMax");
    Objects.requireNonNull(userAgent, "userAgent");
    if (probeTimeout.isZero() || probeTimeout.isNegative()) {
      throw new IllegalArgumentException("probeTimeout must be positive");
    }
    if (backoffMax.compareTo(backoffInitial) < 0) {
      throw new IllegalArgumentException("backoffMaxMs must be >= backoffInitialMs");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0");
    }
    if (validationLogCapacity <= 0) {
      throw new IllegalArgumentException("validationLogCapacity must be positive");
    }
  }

  /**
   * Parses a merged configuration map. Missing keys fall back to the {@code check} defaults.
   *
   * @param options key/value pairs as produced by {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException naming the offending key when a value is invalid
   */
  public static ValidationConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Map<String, String> values = new LinkedHashMap<>(Defaults.asFlatMap("check"));
    options.forEach((key, value) -> {
      if (key != null && value != null) {
        values.put(key, value);
      }
    });

    String iface = Strings.requirePrintableAscii("iface", values.get("iface"), MAX_IFACE_LENGTH);
    int ifindex = (int) Numbers.parseInRange("ifindex", values.get("ifindex"), 0, Integer.MAX_VALUE);
    IpFamily ipFamily = IpFamily.fromString(values.get("ipFamily"));
    List<InetAddress> dns = Net.parseIpList("dns", values.get("dns"));
    ValidationMode mode = ValidationMode.fromString(values.get("mode"));

    URI httpUrl = Net.requireUrl("httpUrl", values.get("httpUrl"), "http");
    URI httpsUrl = Net.requireUrl("httpsUrl", values.get("httpsUrl"), "https");
    List<URI> fallbackHttp = Net.parseUrlList("fallbackHttpUrls", values.get("fallbackHttpUrls"), "http");
    List<URI> fallbackHttps = Net.parseUrlList("fallbackHttpsUrls", values.get("fallbackHttpsUrls"), "https");
    ProbingConfiguration probing = new ProbingConfiguration(httpUrl, httpsUrl, fallbackHttp, fallbackHttps);

    Duration probeTimeout = Duration.ofMillis(
        Numbers.parseInRange("probeTimeoutMs", values.get("probeTimeoutMs"), 1, MAX_TIMEOUT_MS));
    Duration backoffInitial = Duration.ofMillis(
        Numbers.parseInRange("backoffInitialMs", values.get("backoffInitialMs"), 1, MAX_BACKOFF_MS));
    Duration backoffMax = Duration.ofMillis(
        Numbers.parseInRange("backoffMaxMs", values.get("backoffMaxMs"), 1, MAX_BACKOFF_MS));
    int maxAttempts = (int) Numbers.parseInRange("maxAttempts", values.get("maxAttempts"), 0, 1_000_000);
    boolean retryOnFailure = parseBoolean("retryOnFailure", values.get("retryOnFailure"));
    int capacity = (int) Numbers.parseInRange(
        "validationLogCapacity", values.get("validationLogCapacity"), 1, 10_000);
    String userAgent = Strings.requirePrintableAscii("userAgent", values.get("userAgent"), MAX_USER_AGENT_LENGTH);

    return new ValidationConfig(
        iface,
        ifindex,
        ipFamily,
        dns,
        mode,
        probing,
        probeTimeout,
        backoffInitial,
        backoffMax,
        maxAttempts,
        retryOnFailure,
        capacity,
        userAgent);
  }

  /**
   * Renders the configuration as ordered key/value pairs for {@code --dry-run} output.
   *
   * @return keys in the same vocabulary accepted by {@link #fromMap(Map)}
   */
  public Map<String, String> describe() {
    Map<String, String> out = new LinkedHashMap<>();
    out.put("iface", iface);
    out.put("ifindex", Integer.toString(ifindex));
    out.put("ipFamily", ipFamily.name());
    out.put("dns", dnsServers.stream().map(InetAddress::getHostAddress).collect(Collectors.joining(",")));
    out.put("mode", mode.name().toLowerCase(Locale.ROOT).replace('_', '-'));
    out.put("httpUrl", probing.httpUrl().toString());
    out.put("httpsUrl", probing.httpsUrl().toString());
    out.put("fallbackHttpUrls", joinUrls(probing.fallbackHttpUrls()));
    out.put("fallbackHttpsUrls", joinUrls(probing.fallbackHttpsUrls()));
    out.put("probeTimeoutMs", Long.toString(probeTimeout.toMillis()));
    out.put("backoffInitialMs", Long.toString(backoffInitial.toMillis()));
    out.put("backoffMaxMs", Long.toString(backoffMax.toMillis()));
    out.put("maxAttempts", Integer.toString(maxAttempts));
    out.put("retryOnFailure", Boolean.toString(retryOnFailure));
    out.put("validationLogCapacity", Integer.toString(validationLogCapacity));
    out.put("userAgent", userAgent);
    return out;
  }

  private static String joinUrls(List<URI> urls) {
    return urls.stream().map(URI::toString).collect(Collectors.joining(","));
  }

  private static boolean parseBoolean(String name, String value) {
    String normalized = Strings.requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + value + ")");
    };
  }
}
