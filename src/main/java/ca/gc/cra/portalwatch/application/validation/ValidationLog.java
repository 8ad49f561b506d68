package ca.gc.cra.portalwatch.application.validation;

import ca.gc.cra.portalwatch.application.port.ClockPort;
import ca.gc.cra.portalwatch.application.port.MetricsPort;
import ca.gc.cra.portalwatch.domain.probe.ValidationResult;
import ca.gc.cra.portalwatch.domain.probe.ValidationState;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded, in-memory history of the validation results of one connection session.
 * <p><strong>Why:</strong> Session aggregates (attempts until online, attempts until a portal was found, time to
 * online) can only be computed once the session ends.</p>
 * <p><strong>Role:</strong> Fed by the {@code ConnectionStateAdapter}; never consulted for connectivity
 * decisions.</p>
 * <p><strong>Thread-safety:</strong> Confined to the event loop thread.</p>
 *
 * @since 0.1.0
 */
public final class ValidationLog {
  private static final Logger log = LoggerFactory.getLogger(ValidationLog.class);

  /**
   * One retained result with the time it was appended.
   *
   * @param timestampMillis epoch millis of the append
   * @param result appended result
   */
  public record Entry(long timestampMillis, ValidationResult result) {}

  private final int capacity;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final long sessionStartMillis;
  private final Deque<Entry> entries;

  private int appended;
  private int firstOnlineAttempt;
  private long firstOnlineMillis;
  private int firstRedirectAttempt;
  private boolean metricsRecorded;

  /**
   * Creates an empty log and marks the start of the session.
   *
   * @param capacity maximum retained entries; must be positive
   * @param clock time source
   * @param metrics sink for the session aggregates
   */
  public ValidationLog(int capacity, ClockPort clock, MetricsPort metrics) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.sessionStartMillis = clock.nowMillis();
    this.entries = new ArrayDeque<>(capacity);
  }

  /**
   * Records a result, evicting the oldest entry when full. Ignored after {@link #recordMetrics()}.
   *
   * @param result validation result
   */
  public void append(ValidationResult result) {
    Objects.requireNonNull(result, "result");
    if (metricsRecorded) {
      log.debug("Validation log closed, dropping result");
      return;
    }
    long now = clock.nowMillis();
    appended++;
    ValidationState state = result.validationState();
    if (state == ValidationState.INTERNET_CONNECTIVITY && firstOnlineAttempt == 0) {
      firstOnlineAttempt = appended;
      firstOnlineMillis = now;
    }
    if (state == ValidationState.PORTAL_REDIRECT && firstRedirectAttempt == 0) {
      firstRedirectAttempt = appended;
    }
    if (entries.size() == capacity) {
      entries.removeFirst();
    }
    entries.addLast(new Entry(now, result));
  }

  /**
   * Emits the session aggregates. Only the first call has an effect; an empty session emits nothing.
   */
  public void recordMetrics() {
    if (metricsRecorded) {
      return;
    }
    metricsRecorded = true;
    if (appended == 0) {
      return;
    }
    if (firstOnlineAttempt > 0) {
      metrics.observe(ValidationMetrics.ATTEMPTS_TO_ONLINE, firstOnlineAttempt);
      metrics.observe(ValidationMetrics.TIME_TO_ONLINE, Math.max(0L, firstOnlineMillis - sessionStartMillis));
    } else {
      metrics.observe(ValidationMetrics.ATTEMPTS_TO_DISCONNECT, appended);
    }
    if (firstRedirectAttempt > 0) {
      metrics.observe(ValidationMetrics.ATTEMPTS_TO_REDIRECT_FOUND, firstRedirectAttempt);
    }
    log.debug("Validation session closed after {} results", appended);
  }

  /**
   * Returns the retained entries, oldest first.
   *
   * @return snapshot of retained entries
   */
  public List<Entry> entries() {
    return List.copyOf(entries);
  }

  /**
   * Returns the number of results appended during the session, including evicted ones.
   *
   * @return total appended
   */
  public int appendedCount() {
    return appended;
  }

  public boolean isClosed() {
    return metricsRecorded;
  }
}
