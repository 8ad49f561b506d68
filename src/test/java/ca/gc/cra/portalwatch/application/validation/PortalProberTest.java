package ca.gc.cra.portalwatch.application.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.portalwatch.domain.probe.IpFamily;
import ca.gc.cra.portalwatch.domain.probe.ProbeError;
import ca.gc.cra.portalwatch.domain.probe.ProbeRequest;
import ca.gc.cra.portalwatch.domain.probe.ProbeResult;
import ca.gc.cra.portalwatch.domain.probe.ProbingConfiguration;
import ca.gc.cra.portalwatch.domain.probe.ValidationResult;
import ca.gc.cra.portalwatch.domain.probe.ValidationState;
import ca.gc.cra.portalwatch.testutil.FakeProbeClient;
import ca.gc.cra.portalwatch.testutil.ManualEventLoop;
import java.net.InetAddress;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PortalProberTest {
  private static final URI HTTP = URI.create("http://primary.example/generate_204");
  private static final URI HTTPS = URI.create("https://primary.example/generate_204");
  private static final URI HTTP_FB1 = URI.create("http://fallback1.example/gen_204");
  private static final URI HTTP_FB2 = URI.create("http://fallback2.example/gen_204");
  private static final URI HTTPS_FB1 = URI.create("https://fallback1.example/gen_204");
  private static final URI HTTPS_FB2 = URI.create("https://fallback2.example/gen_204");
  private static final URI HTTPS_FB3 = URI.create("https://fallback3.example/gen_204");
  private static final URI PORTAL = URI.create("http://portal.example/login?session=42");

  private ManualEventLoop clock;
  private FakeProbeClient client;
  private PortalProber prober;
  private List<ValidationResult> results;
  private List<InetAddress> dns;

  @BeforeEach
  void setUp() throws Exception {
    clock = new ManualEventLoop();
    client = new FakeProbeClient();
    ProbingConfiguration config = new ProbingConfiguration(
        HTTP, HTTPS, List.of(HTTP_FB1, HTTP_FB2), List.of(HTTPS_FB1, HTTPS_FB2, HTTPS_FB3));
    AttemptBackoff backoff = new AttemptBackoff(Duration.ofSeconds(3), Duration.ofMinutes(5), clock);
    prober = new PortalProber(config, client, clock, new Random(7), backoff, "wlan0", "");
    results = new ArrayList<>();
    dns = List.of(InetAddress.getByAddress(new byte[] {8, 8, 8, 8}));
  }

  private void start() {
    prober.start(false, IpFamily.IPV4, dns, results::add);
  }

  @Test
  void startIssuesHttpAndHttpsProbes() {
    start();

    assertEquals(2, client.count());
    ProbeRequest http = client.http().request();
    ProbeRequest https = client.https().request();
    assertEquals(HTTP, http.url());
    assertEquals(HTTPS, https.url());
    assertEquals(PortalProber.DEFAULT_USER_AGENT, http.headers().get("User-Agent"));
    assertEquals(dns, http.dnsServers());
    assertEquals("wlan0", http.interfaceName());
    assertEquals(IpFamily.IPV4, https.ipFamily());
    assertTrue(prober.isRunning());
    assertEquals("wlan0 IPFamily=IPV4 attempt=1", prober.loggingTag());
  }

  @Test
  void httpOnlySkipsHttpsProbe() {
    prober.start(true, IpFamily.IPV6, dns, results::add);

    assertEquals(1, client.count());
    client.http().respond(204);

    assertEquals(1, results.size());
    assertTrue(results.get(0).httpOnly());
    assertEquals(ValidationState.INTERNET_CONNECTIVITY, results.get(0).validationState());
  }

  @Test
  void waitsForBothProbesBeforeReportingConnectivity() {
    start();
    clock.tick(Duration.ofMillis(40));
    client.http().respond(204);
    assertTrue(results.isEmpty());

    clock.tick(Duration.ofMillis(30));
    client.https().respond(200);

    assertEquals(1, results.size());
    ValidationResult result = results.get(0);
    assertEquals(ValidationState.INTERNET_CONNECTIVITY, result.validationState());
    assertEquals(Duration.ofMillis(40), result.httpDuration());
    assertEquals(Duration.ofMillis(70), result.httpsDuration());
    assertEquals(1, result.numAttempts());
    assertFalse(prober.isRunning());
  }

  @Test
  void anyHttpsResponseCountsAsSuccess() {
    start();
    client.https().respond(503);
    client.http().respond(204);

    assertEquals(ProbeResult.SUCCESS, results.get(0).httpsResult());
  }

  @Test
  void redirectCompletesEarlyAndDropsLateHttps() {
    start();
    client.http().redirect(302, PORTAL.toString());

    assertEquals(1, results.size());
    ValidationResult result = results.get(0);
    assertEquals(ValidationState.PORTAL_REDIRECT, result.validationState());
    assertEquals(Optional.of(PORTAL), result.redirectUrl());
    assertEquals(Optional.of(HTTP), result.probeUrl());
    assertFalse(prober.isRunning());

    client.https().respond(204);
    assertEquals(1, results.size());
  }

  @Test
  void portalUrlIsReusedUntilReset() {
    start();
    client.http().redirect(307, PORTAL.toString());
    assertEquals(Optional.of(HTTP), prober.portalFoundHttpUrl());

    start();
    assertEquals(HTTP, client.http().request().url());
    assertEquals(HTTPS_FB1, client.https().request().url());

    prober.reset();
    assertEquals(Optional.empty(), prober.portalFoundHttpUrl());
    assertEquals(0, prober.attemptCount());

    start();
    assertEquals(HTTP, client.http().request().url());
    assertEquals(HTTPS, client.https().request().url());
  }

  @Test
  void rotatesThroughFallbacksThenPicksRandomly() {
    List<URI> httpUrls = new ArrayList<>();
    List<URI> httpsUrls = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      start();
      httpUrls.add(client.http().request().url());
      httpsUrls.add(client.https().request().url());
      client.http().fail(ProbeError.CONNECTION_FAILURE);
      client.https().fail(ProbeError.CONNECTION_FAILURE);
    }

    assertEquals(List.of(HTTP, HTTP_FB1, HTTP_FB2), httpUrls.subList(0, 3));
    assertEquals(List.of(HTTPS, HTTPS_FB1, HTTPS_FB2, HTTPS_FB3), httpsUrls.subList(0, 4));
    Set<URI> httpCandidates = Set.of(HTTP, HTTP_FB1, HTTP_FB2);
    Set<URI> httpsCandidates = Set.of(HTTPS, HTTPS_FB1, HTTPS_FB2, HTTPS_FB3);
    httpUrls.subList(3, 8).forEach(url -> assertTrue(httpCandidates.contains(url), url.toString()));
    httpsUrls.subList(4, 8).forEach(url -> assertTrue(httpsCandidates.contains(url), url.toString()));
    assertEquals(8, results.size());
    assertEquals(8, prober.attemptCount());
  }

  @Test
  void randomPhaseReachesPrimaryAndEveryFallback() {
    int trials = 300;
    Set<URI> httpSeen = new HashSet<>();
    Set<URI> httpsSeen = new HashSet<>();
    for (int i = 0; i < trials; i++) {
      start();
      URI httpUrl = client.http().request().url();
      URI httpsUrl = client.https().request().url();
      // attempts 1..4 walk the fixed order; only later attempts draw at random
      if (i >= 3) {
        httpSeen.add(httpUrl);
      }
      if (i >= 4) {
        httpsSeen.add(httpsUrl);
      }
      client.http().fail(ProbeError.CONNECTION_FAILURE);
      client.https().fail(ProbeError.CONNECTION_FAILURE);
    }

    assertEquals(Set.of(HTTP, HTTP_FB1, HTTP_FB2), httpSeen);
    assertEquals(Set.of(HTTPS, HTTPS_FB1, HTTPS_FB2, HTTPS_FB3), httpsSeen);
    assertEquals(trials, prober.attemptCount());
  }

  @Test
  void withoutFallbacksAlwaysUsesPrimary() {
    PortalProber plain = new PortalProber(
        new ProbingConfiguration(HTTP, HTTPS, List.of(), List.of()), client, clock, new Random(1),
        new AttemptBackoff(Duration.ZERO, Duration.ZERO, clock), "eth0", "probe/1.0");
    for (int i = 0; i < 4; i++) {
      plain.start(true, IpFamily.IPV4, dns, results::add);
      assertEquals(HTTP, client.http().request().url());
      assertEquals("probe/1.0", client.http().request().headers().get("User-Agent"));
      client.http().respond(204);
    }
  }

  @Test
  void okWithSmallBodyIsSuccess() {
    start();
    client.http().respond(200, Map.of("Content-Length", "1"), 1);
    client.https().respond(204);

    assertEquals(ProbeResult.SUCCESS, results.get(0).httpResult());
    assertEquals(OptionalLong.of(1), results.get(0).httpContentLength());
  }

  @Test
  void okWithLargeBodyIsSuspectedPortal() {
    start();
    client.http().respond(200, Map.of("Content-Length", "512"), 512);

    assertEquals(1, results.size());
    ValidationResult result = results.get(0);
    assertEquals(ValidationState.PORTAL_SUSPECTED, result.validationState());
    assertEquals(Optional.of(HTTP), result.signInUrl());
    assertEquals(Optional.of(HTTP), prober.portalFoundHttpUrl());
  }

  @Test
  void missingContentLengthFallsBackToBodySize() {
    start();
    client.http().respond(200, Map.of(), 300);

    assertEquals(ProbeResult.PORTAL_SUSPECTED, results.get(0).httpResult());
    assertEquals(OptionalLong.of(300), results.get(0).httpContentLength());
  }

  @Test
  void invalidContentLengthIsFailure() {
    start();
    client.http().respond(200, Map.of("Content-Length", "lots"), 10);
    client.https().respond(204);

    ValidationResult result = results.get(0);
    assertEquals(ProbeResult.FAILURE, result.httpResult());
    assertEquals(OptionalLong.empty(), result.httpContentLength());
    assertEquals(ValidationState.NO_CONNECTIVITY, result.validationState());
  }

  @Test
  void redirectWithUnusableLocationWaitsForHttps() {
    start();
    client.http().redirect(302, "/relative/login");
    assertTrue(results.isEmpty());

    client.https().fail(ProbeError.TLS_FAILURE);

    ValidationResult result = results.get(0);
    assertEquals(ProbeResult.PORTAL_INVALID_REDIRECT, result.httpResult());
    assertEquals(ValidationState.NO_CONNECTIVITY, result.validationState());
  }

  @Test
  void redirectWithoutLocationIsInvalid() {
    start();
    client.http().redirect(301, null);
    client.https().respond(204);

    assertEquals(ProbeResult.PORTAL_INVALID_REDIRECT, results.get(0).httpResult());
  }

  @Test
  void otherStatusIsFailure() {
    start();
    client.http().respond(404);
    client.https().respond(204);

    assertEquals(ProbeResult.FAILURE, results.get(0).httpResult());
    assertEquals(ValidationState.NO_CONNECTIVITY, results.get(0).validationState());
  }

  @Test
  void stopCancelsProbesAndDropsCallbacks() {
    start();
    FakeProbeClient.Issued http = client.http();
    FakeProbeClient.Issued https = client.https();

    prober.stop();
    http.respond(204);
    https.respond(204);

    assertTrue(http.cancelled());
    assertTrue(https.cancelled());
    assertTrue(results.isEmpty());
    assertFalse(prober.isRunning());
  }

  @Test
  void callbacksFromPreviousAttemptAreIgnored() {
    start();
    FakeProbeClient.Issued oldHttp = client.http();
    prober.stop();
    start();

    oldHttp.redirect(302, PORTAL.toString());

    assertTrue(results.isEmpty());
    assertTrue(prober.isRunning());
  }

  @Test
  void startWhileRunningIsIgnored() {
    start();
    start();

    assertEquals(2, client.count());
    assertEquals(1, prober.attemptCount());
  }

  @Test
  void duplicateCallbackIsIgnored() {
    start();
    FakeProbeClient.Issued http = client.http();
    http.respond(204);
    http.redirect(302, PORTAL.toString());
    client.https().respond(204);

    assertEquals(1, results.size());
    assertEquals(ValidationState.INTERNET_CONNECTIVITY, results.get(0).validationState());
  }

  @Test
  void clientThatThrowsIsRecordedAsConnectionFailure() {
    client.failOnIssue(new IllegalStateException("no sockets"));

    start();

    assertEquals(1, results.size());
    ValidationResult result = results.get(0);
    assertEquals(ProbeResult.CONNECTION_FAILURE, result.httpResult());
    assertEquals(ProbeResult.CONNECTION_FAILURE, result.httpsResult());
    assertEquals(ValidationState.NO_CONNECTIVITY, result.validationState());
    assertFalse(prober.isRunning());
  }

  @Test
  void attemptStartFeedsBackoff() {
    assertEquals(Duration.ZERO, prober.nextAttemptDelay());
    start();
    assertEquals(Duration.ofSeconds(3), prober.nextAttemptDelay());

    prober.resetAttemptDelays();

    assertEquals(Duration.ZERO, prober.nextAttemptDelay());
  }
}
