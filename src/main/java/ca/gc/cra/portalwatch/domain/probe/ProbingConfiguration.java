package ca.gc.cra.portalwatch.domain.probe;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Probe URL set for one interface: primary HTTP and HTTPS URLs plus ordered fallbacks.
 * <p><strong>Why:</strong> Rotation between primary and fallback URLs resists portals that allow-list a fixed probe
 * endpoint.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share between the monitor, the prober and the CLI.</p>
 *
 * @param httpUrl primary HTTP probe URL
 * @param httpsUrl primary HTTPS probe URL
 * @param fallbackHttpUrls ordered fallback HTTP URLs, possibly empty
 * @param fallbackHttpsUrls ordered fallback HTTPS URLs, possibly empty
 * @since 0.1.0
 */
public record ProbingConfiguration(
    URI httpUrl, URI httpsUrl, List<URI> fallbackHttpUrls, List<URI> fallbackHttpsUrls) {

  public static final URI DEFAULT_HTTP_URL =
      URI.create("http://connectivitycheck.gstatic.com/generate_204");
  public static final URI DEFAULT_HTTPS_URL = URI.create("https://www.google.com/generate_204");
  public static final List<URI> DEFAULT_FALLBACK_HTTP_URLS = List.of(
      URI.create("http://www.google.com/gen_204"),
      URI.create("http://play.googleapis.com/generate_204"));
  public static final List<URI> DEFAULT_FALLBACK_HTTPS_URLS = List.of(
      URI.create("https://www.gstatic.com/generate_204"),
      URI.create("https://accounts.google.com/generate_204"),
      URI.create("https://www.googleapis.com/generate_204"));

  public ProbingConfiguration {
    requireScheme(httpUrl, "httpUrl", "http");
    requireScheme(httpsUrl, "httpsUrl", "https");
    fallbackHttpUrls = List.copyOf(Objects.requireNonNull(fallbackHttpUrls, "fallbackHttpUrls"));
    fallbackHttpsUrls = List.copyOf(Objects.requireNonNull(fallbackHttpsUrls, "fallbackHttpsUrls"));
    for (URI url : fallbackHttpUrls) {
      requireScheme(url, "fallbackHttpUrls", "http");
    }
    for (URI url : fallbackHttpsUrls) {
      requireScheme(url, "fallbackHttpsUrls", "https");
    }
  }

  /**
   * Returns the stock probe endpoints.
   *
   * @return default configuration
   */
  public static ProbingConfiguration defaults() {
    return new ProbingConfiguration(
        DEFAULT_HTTP_URL, DEFAULT_HTTPS_URL, DEFAULT_FALLBACK_HTTP_URLS, DEFAULT_FALLBACK_HTTPS_URLS);
  }

  private static void requireScheme(URI url, String name, String scheme) {
    if (url == null) {
      throw new IllegalArgumentException(name + " is required");
    }
    if (!url.isAbsolute() || url.getHost() == null) {
      throw new IllegalArgumentException(name + " must be an absolute URL with a host: " + url);
    }
    if (!scheme.equals(url.getScheme().toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException(name + " must use " + scheme + ": " + url);
    }
  }
}
