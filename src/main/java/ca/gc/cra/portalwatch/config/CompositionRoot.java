package ca.gc.cra.portalwatch.config;

import ca.gc.cra.portalwatch.application.connection.ConnectionStateAdapter;
import ca.gc.cra.portalwatch.application.port.ClockPort;
import ca.gc.cra.portalwatch.application.port.ConnectStateListener;
import ca.gc.cra.portalwatch.application.port.EventLoopPort;
import ca.gc.cra.portalwatch.application.port.MetricsPort;
import ca.gc.cra.portalwatch.application.port.ProbeClient;
import ca.gc.cra.portalwatch.application.validation.AttemptBackoff;
import ca.gc.cra.portalwatch.application.validation.ConnectivityMonitor;
import ca.gc.cra.portalwatch.application.validation.PortalProber;
import ca.gc.cra.portalwatch.application.validation.ValidationLog;
import ca.gc.cra.portalwatch.domain.service.SerialNumberGenerator;
import ca.gc.cra.portalwatch.infrastructure.http.JdkHttpProbeClient;
import ca.gc.cra.portalwatch.infrastructure.loop.SingleThreadEventLoop;
import ca.gc.cra.portalwatch.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.portalwatch.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.portalwatch.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.portalwatch.infrastructure.time.SystemClockAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the validation components to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate a {@link ValidationConfig} into a runnable object
 * graph.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning event loop, probe client, prober, monitor and
 * connection state adapter.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own the single event loop and the probe client bound to it.</li>
 *   <li>Select the OpenTelemetry or no-op metrics adapter.</li>
 *   <li>Hand out probers, monitors and validation logs, each prober with its own backoff.</li>
 *   <li>Close owned resources in reverse creation order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and close on one thread. The objects it builds must only be used on
 * the event loop thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ValidationConfig config;
  private final EventLoopPort eventLoop;
  private final ProbeClient probeClient;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Random random;
  private final SerialNumberGenerator serialNumbers;
  private final List<AutoCloseable> owned;

  /**
   * Wires explicit collaborators. Used by tests and by {@link #create(ValidationConfig, TelemetrySettings)}.
   *
   * @param config validated configuration
   * @param eventLoop loop every component runs on
   * @param probeClient transport for probes
   * @param clock time source
   * @param metrics metrics sink
   * @param random randomness for URL rotation
   * @param serialNumbers service identifier source
   * @param owned resources closed by {@link #close()}, in reverse order
   */
  public CompositionRoot(
      ValidationConfig config,
      EventLoopPort eventLoop,
      ProbeClient probeClient,
      ClockPort clock,
      MetricsPort metrics,
      Random random,
      SerialNumberGenerator serialNumbers,
      List<AutoCloseable> owned) {
    this.config = Objects.requireNonNull(config, "config");
    this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
    this.probeClient = Objects.requireNonNull(probeClient, "probeClient");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.random = Objects.requireNonNull(random, "random");
    this.serialNumbers = Objects.requireNonNull(serialNumbers, "serialNumbers");
    this.owned = new ArrayList<>(Objects.requireNonNull(owned, "owned"));
  }

  /**
   * Builds the production graph: a {@link SingleThreadEventLoop}, a {@link JdkHttpProbeClient} and the metrics
   * adapter selected by {@code telemetry}.
   *
   * @param config validated configuration
   * @param telemetry OpenTelemetry settings
   * @return composition root owning the loop and the metrics adapter
   */
  public static CompositionRoot create(ValidationConfig config, TelemetrySettings telemetry) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(telemetry, "telemetry");
    List<AutoCloseable> owned = new ArrayList<>();
    SingleThreadEventLoop loop = new SingleThreadEventLoop("portalwatch-loop");
    owned.add(loop);
    MetricsPort metrics;
    if (telemetry.exporter() == TelemetrySettings.Exporter.NONE) {
      NoOpMetricsAdapter noop = new NoOpMetricsAdapter();
      owned.add(noop);
      metrics = noop;
    } else {
      OpenTelemetryMetricsAdapter otel = new OpenTelemetryMetricsAdapter(telemetry, config.iface());
      owned.add(otel);
      metrics = otel;
    }
    ProbeClient client = new JdkHttpProbeClient(loop, config.probeTimeout());
    log.debug("Wired {} with exporter {}", config.iface(), telemetry.exporter());
    return new CompositionRoot(
        config,
        loop,
        client,
        SystemClockAdapter.INSTANCE,
        metrics,
        new Random(),
        new SerialNumberGenerator(),
        owned);
  }

  /**
   * Creates a prober with a fresh backoff.
   *
   * @return new prober for the configured interface
   */
  public PortalProber newProber() {
    AttemptBackoff backoff = new AttemptBackoff(config.backoffInitial(), config.backoffMax(), clock);
    return new PortalProber(
        config.probing(), probeClient, clock, random, backoff, config.iface(), config.userAgent());
  }

  /**
   * Creates a monitor for an interface.
   *
   * @param interfaceIndex index reported with each result
   * @param listener receiver of attempt results
   * @return new monitor
   */
  public ConnectivityMonitor newMonitor(int interfaceIndex, ConnectivityMonitor.ResultListener listener) {
    return new ConnectivityMonitor(
        interfaceIndex, config.iface(), this::newProber, eventLoop, metrics, listener);
  }

  public ValidationLog newValidationLog() {
    return new ValidationLog(config.validationLogCapacity(), clock, metrics);
  }

  /**
   * Creates a connection state adapter for one service, with the configured validation mode applied.
   *
   * @param listener observer of state changes
   * @return adapter; not yet attached to a network
   */
  public ConnectionStateAdapter newService(ConnectStateListener listener) {
    long id = serialNumbers.next();
    ConnectionStateAdapter adapter = new ConnectionStateAdapter(
        id,
        config.iface() + "#" + id,
        this::newMonitor,
        this::newValidationLog,
        listener,
        config.retryOnFailure());
    adapter.setValidationMode(config.mode());
    return adapter;
  }

  public ValidationConfig config() {
    return config;
  }

  public EventLoopPort eventLoop() {
    return eventLoop;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  @Override
  public void close() {
    for (int i = owned.size() - 1; i >= 0; i--) {
      AutoCloseable resource = owned.get(i);
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", resource.getClass().getSimpleName(), ex);
      }
    }
    owned.clear();
  }
}
