package ca.gc.cra.portalwatch.application.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.portalwatch.domain.probe.IpFamily;
import ca.gc.cra.portalwatch.domain.probe.ProbeError;
import ca.gc.cra.portalwatch.domain.probe.ProbingConfiguration;
import ca.gc.cra.portalwatch.domain.probe.ValidationMode;
import ca.gc.cra.portalwatch.domain.probe.ValidationReason;
import ca.gc.cra.portalwatch.domain.probe.ValidationResult;
import ca.gc.cra.portalwatch.domain.probe.ValidationState;
import ca.gc.cra.portalwatch.testutil.FakeProbeClient;
import ca.gc.cra.portalwatch.testutil.ManualEventLoop;
import ca.gc.cra.portalwatch.testutil.RecordingMetricsPort;
import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectivityMonitorTest {
  private static final int IFINDEX = 4;

  private ManualEventLoop loop;
  private FakeProbeClient client;
  private RecordingMetricsPort metrics;
  private List<ValidationResult> results;
  private List<Integer> indexes;
  private int probersCreated;
  private ConnectivityMonitor monitor;
  private List<InetAddress> dns;

  @BeforeEach
  void setUp() throws Exception {
    loop = new ManualEventLoop();
    client = new FakeProbeClient();
    metrics = new RecordingMetricsPort();
    results = new ArrayList<>();
    indexes = new ArrayList<>();
    dns = List.of(InetAddress.getByAddress(new byte[] {1, 1, 1, 1}));
    ConnectivityMonitor.ProberFactory factory = () -> {
      probersCreated++;
      return new PortalProber(
          ProbingConfiguration.defaults(),
          client,
          loop,
          new Random(3),
          new AttemptBackoff(Duration.ofSeconds(3), Duration.ofMinutes(5), loop),
          "wlan0",
          null);
    };
    monitor = new ConnectivityMonitor(IFINDEX, "wlan0", factory, loop, metrics, (index, result) -> {
      indexes.add(index);
      results.add(result);
    });
  }

  private boolean start(ValidationReason reason) {
    return monitor.start(reason, IpFamily.IPV4, dns);
  }

  private void failCurrentAttempt() {
    client.http().fail(ProbeError.CONNECTION_FAILURE);
    client.https().fail(ProbeError.CONNECTION_FAILURE);
  }

  @Test
  void cannotStartWithoutDnsServers() {
    assertFalse(monitor.start(ValidationReason.NETWORK_CONNECTION_UPDATE, IpFamily.IPV4, List.of()));
    assertEquals(0, client.count());
    assertFalse(monitor.isRunning());
  }

  @Test
  void firstStartRunsImmediately() {
    assertTrue(start(ValidationReason.NETWORK_CONNECTION_UPDATE));

    assertEquals(2, client.count());
    assertTrue(monitor.isRunning());
    assertEquals(1, probersCreated);
  }

  @Test
  void startWhileRunningIsCoalesced() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);
    PortalProber prober = monitor.currentProber();

    assertTrue(start(ValidationReason.SERVICE_PROPERTY_UPDATE));
    assertTrue(start(ValidationReason.DBUS_REQUEST));

    assertEquals(2, client.count());
    assertSame(prober, monitor.currentProber());
  }

  @Test
  void retryWaitsForBackoff() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);
    failCurrentAttempt();
    assertEquals(ValidationState.NO_CONNECTIVITY, results.get(0).validationState());

    assertTrue(start(ValidationReason.RETRY_VALIDATION));
    assertEquals(2, client.count());
    assertTrue(monitor.isRunning());

    loop.advance(Duration.ofMillis(2_999));
    assertEquals(2, client.count());
    loop.advance(Duration.ofMillis(1));
    assertEquals(4, client.count());
  }

  @Test
  void backoffGrowsAcrossRetries() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);
    failCurrentAttempt();
    start(ValidationReason.RETRY_VALIDATION);
    loop.advance(Duration.ofSeconds(3));
    failCurrentAttempt();

    start(ValidationReason.RETRY_VALIDATION);

    assertEquals(Duration.ofSeconds(6), loop.nextDelay().orElseThrow());
  }

  @Test
  void resettingReasonStartsImmediately() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);
    failCurrentAttempt();

    start(ValidationReason.ETHERNET_GATEWAY_REACHABLE);

    assertEquals(4, client.count());
    assertEquals(0, loop.pendingTasks());
  }

  @Test
  void connectionUpdateReplacesProberAndDropsOldAttempt() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);
    PortalProber first = monitor.currentProber();
    FakeProbeClient.Issued oldHttp = client.http();

    start(ValidationReason.NETWORK_CONNECTION_UPDATE);

    assertNotSame(first, monitor.currentProber());
    assertEquals(2, probersCreated);
    assertTrue(oldHttp.cancelled());
    assertEquals(4, client.count());
    oldHttp.redirect(302, "http://portal.example/");
    assertTrue(results.isEmpty());
  }

  @Test
  void laterStartSupersedesPendingStart() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);
    failCurrentAttempt();
    start(ValidationReason.RETRY_VALIDATION);
    loop.advance(Duration.ofSeconds(1));

    start(ValidationReason.SERVICE_PROPERTY_UPDATE);

    assertEquals(1, loop.pendingTasks());
    assertEquals(Duration.ofSeconds(2), loop.nextDelay().orElseThrow());
    loop.advance(Duration.ofSeconds(5));
    assertEquals(4, client.count());
  }

  @Test
  void stopCancelsPendingStart() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);
    failCurrentAttempt();
    start(ValidationReason.RETRY_VALIDATION);

    assertTrue(monitor.stop());
    loop.advance(Duration.ofMinutes(1));

    assertEquals(2, client.count());
    assertFalse(monitor.isRunning());
  }

  @Test
  void stopDropsRunningAttempt() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);

    assertTrue(monitor.stop());
    client.http().respond(204);
    client.https().respond(204);

    assertTrue(results.isEmpty());
    assertFalse(monitor.stop());
  }

  @Test
  void httpOnlyModeSkipsHttps() {
    monitor.setValidationMode(ValidationMode.HTTP_ONLY);
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);

    assertEquals(1, client.count());
    client.http().respond(204);
    assertTrue(results.get(0).httpOnly());
  }

  @Test
  void disabledModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> monitor.setValidationMode(ValidationMode.DISABLED));
    assertEquals(ValidationMode.FULL_VALIDATION, monitor.validationMode());
  }

  @Test
  void onlineResultRecordsDurationsAndResult() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);
    loop.tick(Duration.ofMillis(20));
    client.http().respond(204);
    loop.tick(Duration.ofMillis(30));
    client.https().respond(204);

    assertEquals(List.of(IFINDEX), indexes);
    assertEquals(List.of(20L), metrics.observed(ValidationMetrics.HTTP_DURATION));
    assertEquals(List.of(50L), metrics.observed(ValidationMetrics.HTTPS_DURATION));
    assertEquals(List.of(50L), metrics.observed(ValidationMetrics.INTERNET_DURATION));
    assertEquals(1, metrics.count(ValidationMetrics.HTTP_RESPONSE_CODE_PREFIX + "204"));
    assertEquals(1, metrics.count(ValidationMetrics.RESULT_PREFIX + "online"));
    assertFalse(metrics.hasObservation(ValidationMetrics.PORTAL_DURATION));
  }

  @Test
  void portalResultRecordsPortalMetrics() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);
    client.http().respond(200, Map.of("Content-Length", "2048"), 2048);

    assertTrue(metrics.hasObservation(ValidationMetrics.PORTAL_DURATION));
    assertFalse(metrics.hasObservation(ValidationMetrics.HTTPS_DURATION));
    assertEquals(List.of(2048L), metrics.observed(ValidationMetrics.HTTP_CONTENT_LENGTH));
    assertEquals(1, metrics.count(ValidationMetrics.HTTP_RESPONSE_CODE_PREFIX + "200"));
    assertEquals(1, metrics.count(ValidationMetrics.RESULT_PREFIX + "https_failure"));
  }

  @Test
  void redirectResultCountsRedirectFound() {
    start(ValidationReason.NETWORK_CONNECTION_UPDATE);
    client.http().redirect(302, "https://portal.example/login");

    assertEquals(ValidationState.PORTAL_REDIRECT, results.get(0).validationState());
    assertEquals(1, metrics.count(ValidationMetrics.RESULT_PREFIX + "redirect_found"));
    assertEquals(1, metrics.count(ValidationMetrics.HTTP_RESPONSE_CODE_PREFIX + "302"));
  }
}
