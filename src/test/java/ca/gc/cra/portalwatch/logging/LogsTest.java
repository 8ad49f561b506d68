package ca.gc.cra.portalwatch.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("wlan0", Logs.truncate("wlan0", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void longValuesAreTruncatedWithLengthMetadata() {
    String truncated = Logs.truncate("abcdefghij", 4);
    assertEquals("abcd... (truncated, 4 of 10)", truncated);
  }

  @Test
  void truncationNeverSplitsCodepoints() {
    String truncated = Logs.truncate("\u00e9\u00e9\u00e9", 3);
    assertTrue(truncated.startsWith("\u00e9..."), truncated);
  }

  @Test
  void nonPositiveBudgetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void queryAndFragmentAreRedacted() {
    assertEquals("http://portal.example/login?[REDACTED]",
        Logs.redactQuery(URI.create("http://portal.example/login?session=secret#top")));
    assertEquals("https://portal.example:8443/", Logs.redactQuery(URI.create("https://portal.example:8443/")));
    assertEquals("<null>", Logs.redactQuery(null));
  }

  @Test
  void redactedUrlsAreBounded() {
    String longPath = "http://portal.example/" + "a".repeat(400);
    assertTrue(Logs.redactQuery(URI.create(longPath)).contains("(truncated, " + Logs.MAX_URL_LENGTH + " of"));
  }
}
