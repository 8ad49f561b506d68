package ca.gc.cra.portalwatch.domain.probe;

import java.net.InetAddress;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters of a single probe handed to the probe client.
 *
 * @param url URL to GET
 * @param headers request headers
 * @param dnsServers resolvers to use, never empty when issued by the prober
 * @param ipFamily address family to probe over
 * @param interfaceName interface the probe should be bound to
 * @param loggingTag prefix for transport log lines
 * @since 0.1.0
 */
public record ProbeRequest(
    URI url,
    Map<String, String> headers,
    List<InetAddress> dnsServers,
    IpFamily ipFamily,
    String interfaceName,
    String loggingTag) {

  public ProbeRequest {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(ipFamily, "ipFamily");
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    dnsServers = dnsServers == null ? List.of() : List.copyOf(dnsServers);
    interfaceName = interfaceName == null ? "" : interfaceName;
    loggingTag = loggingTag == null ? "" : loggingTag;
  }

  /**
   * Reports whether the request targets an HTTPS endpoint.
   *
   * @return {@code true} when the URL scheme is https
   */
  public boolean isHttps() {
    return "https".equalsIgnoreCase(url.getScheme());
  }
}
