package ca.gc.cra.portalwatch.domain.probe;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Response metadata reported by the probe client. Header lookups are case-insensitive; only the first value of a
 * repeated header is kept.
 *
 * @param statusCode HTTP status code
 * @param headers response headers
 * @param bodyLength number of body bytes read
 * @since 0.1.0
 */
public record ProbeResponse(int statusCode, Map<String, String> headers, long bodyLength) {

  public ProbeResponse {
    TreeMap<String, String> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    if (headers != null) {
      headers.forEach((name, value) -> {
        if (name != null && value != null) {
          normalized.putIfAbsent(name, value);
        }
      });
    }
    headers = Collections.unmodifiableMap(normalized);
  }

  /**
   * Looks up a header value.
   *
   * @param name header name, any case
   * @return header value when present
   */
  public Optional<String> header(String name) {
    return Optional.ofNullable(headers.get(name));
  }
}
