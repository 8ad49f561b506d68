package ca.gc.cra.portalwatch.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Network value validation: resolver addresses, probe URLs and OTLP endpoints.
 *
 * <p>Address parsing accepts literals only and never performs a DNS lookup.</p>
 */
public final class Net {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  // IPv4 dotted-quad shape (fast pre-check); octets are range-checked separately.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Parses an IPv4 or IPv6 literal.
   *
   * @param name logical parameter name for diagnostics
   * @param value address literal, IPv6 optionally wrapped in brackets
   * @return parsed address
   * @throws IllegalArgumentException if the value is not an IP literal
   */
  public static InetAddress parseIpLiteral(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      byte[] octets = ipv4Octets(sanitized);
      try {
        return InetAddress.getByAddress(octets);
      } catch (UnknownHostException ex) {
        throw new IllegalArgumentException(name + " is not a valid IPv4 address: " + sanitized, ex);
      }
    }
    String host = sanitized.startsWith("[") && sanitized.endsWith("]")
        ? sanitized.substring(1, sanitized.length() - 1)
        : sanitized;
    if (host.indexOf(':') < 0) {
      throw new IllegalArgumentException(name + " must be an IP address literal (was " + sanitized + ")");
    }
    return parseIpv6(name, host);
  }

  /**
   * Parses a comma-separated list of IP literals.
   *
   * @param name logical parameter name for diagnostics
   * @param value list text; blank yields an empty list
   * @return parsed addresses in order
   * @throws IllegalArgumentException if any entry is not an IP literal
   */
  public static List<InetAddress> parseIpList(String name, String value) {
    List<InetAddress> addresses = new ArrayList<>();
    for (String entry : Strings.splitList(name, value)) {
      addresses.add(parseIpLiteral(name, entry));
    }
    return List.copyOf(addresses);
  }

  /**
   * Validates an absolute URL with one of the permitted schemes and a well-formed host.
   *
   * @param name logical parameter name for diagnostics
   * @param value URL text
   * @param schemes permitted schemes, lower case
   * @return parsed URL
   * @throws IllegalArgumentException if the URL is malformed, relative, uses another scheme or lacks a host
   */
  public static URI requireUrl(String name, String value, String... schemes) {
    String sanitized = Strings.requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(sanitized);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URL", ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    boolean allowed = false;
    for (String candidate : schemes) {
      if (candidate.equals(scheme)) {
        allowed = true;
        break;
      }
    }
    if (!allowed) {
      throw new IllegalArgumentException(
          name + " must use " + String.join(" or ", schemes) + " scheme (was " + sanitized + ")");
    }
    String host = uri.getHost();
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException(name + " must include a host");
    }
    validateHost(host);
    return uri;
  }

  /**
   * Parses a comma-separated list of URLs with {@link #requireUrl(String, String, String...)}.
   *
   * @param name logical parameter name for diagnostics
   * @param value list text; blank yields an empty list
   * @param schemes permitted schemes
   * @return parsed URLs in order
   */
  public static List<URI> parseUrlList(String name, String value, String... schemes) {
    List<URI> urls = new ArrayList<>();
    for (String entry : Strings.splitList(name, value)) {
      urls.add(requireUrl(name, entry, schemes));
    }
    return List.copyOf(urls);
  }

  private static void validateHost(String host) {
    if (host.startsWith("[") && host.endsWith("]")) {
      parseIpv6("host", host.substring(1, host.length() - 1));
      return;
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      ipv4Octets(host);
      return;
    }
    validateHostname(host);
  }

  /** Deterministic hostname validator (ASCII/Punycode). */
  private static void validateHostname(String host) {
    final int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    final char first = s.charAt(start);
    final char last = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static byte[] ipv4Octets(String host) {
    String[] parts = host.split("\\.");
    byte[] octets = new byte[4];
    for (int i = 0; i < 4; i++) {
      int octet = Integer.parseInt(parts[i]);
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      octets[i] = (byte) octet;
    }
    return octets;
  }

  private static InetAddress parseIpv6(String name, String host) {
    try {
      InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException(name + " is not a valid IPv6 literal: " + host);
      }
      return address;
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException(name + " is not a valid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
