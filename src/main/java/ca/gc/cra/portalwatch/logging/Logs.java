package ca.gc.cra.portalwatch.logging;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers for probe URLs and header values.
 * <p><strong>Why:</strong> Captive portals return arbitrarily long Location headers and embed session tokens in
 * sign-in URLs; neither should reach operator logs verbatim.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Byte budget applied to URLs and Location headers in log lines. */
  public static final int MAX_URL_LENGTH = 256;

  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Replaces the query and fragment of a URL with a redaction marker.
   *
   * @param url URL to sanitize; {@code null} results in {@code "<null>"}
   * @return scheme, authority and path of the URL, truncated to {@link #MAX_URL_LENGTH}
   */
  public static String redactQuery(URI url) {
    if (url == null) {
      return NULL_PLACEHOLDER;
    }
    if (url.getRawAuthority() == null) {
      return truncate(url.toString(), MAX_URL_LENGTH);
    }
    StringBuilder sb = new StringBuilder();
    sb.append(url.getScheme()).append("://").append(url.getRawAuthority());
    if (url.getRawPath() != null) {
      sb.append(url.getRawPath());
    }
    if (url.getRawQuery() != null || url.getRawFragment() != null) {
      sb.append('?').append(REDACTED_PLACEHOLDER);
    }
    return truncate(sb.toString(), MAX_URL_LENGTH);
  }
}
