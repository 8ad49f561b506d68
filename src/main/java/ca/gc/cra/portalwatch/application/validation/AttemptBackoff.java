package ca.gc.cra.portalwatch.application.validation;

import ca.gc.cra.portalwatch.application.port.ClockPort;
import java.time.Duration;
import java.util.Objects;

/**
 * Exponential spacing between validation attempts.
 *
 * <p>The first attempt after construction or {@link #reset()} may start immediately. Each started attempt sets the
 * interval the next one must wait, measured from that start: {@code initial} first, then doubling up to
 * {@code max}.</p>
 *
 * <p>Not thread-safe; owned by one {@link PortalProber}.</p>
 *
 * @since 0.1.0
 */
public final class AttemptBackoff {
  private final Duration initial;
  private final Duration max;
  private final ClockPort clock;

  private long lastAttemptStartMillis = -1L;
  private Duration interval = Duration.ZERO;

  /**
   * Creates a backoff policy.
   *
   * @param initial delay enforced before the second attempt; must be non-negative
   * @param max upper bound on the delay; must be at least {@code initial}
   * @param clock time source
   */
  public AttemptBackoff(Duration initial, Duration max, ClockPort clock) {
    this.initial = Objects.requireNonNull(initial, "initial");
    this.max = Objects.requireNonNull(max, "max");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (initial.isNegative()) {
      throw new IllegalArgumentException("initial backoff must be >= 0");
    }
    if (max.compareTo(initial) < 0) {
      throw new IllegalArgumentException("max backoff must be >= initial backoff");
    }
  }

  /**
   * Returns how long the caller must still wait before the next attempt may start.
   *
   * @return remaining delay, {@link Duration#ZERO} when an attempt may start now
   */
  public Duration nextAttemptDelay() {
    if (lastAttemptStartMillis < 0) {
      return Duration.ZERO;
    }
    long dueMillis = lastAttemptStartMillis + interval.toMillis();
    long remaining = dueMillis - clock.nowMillis();
    return remaining > 0 ? Duration.ofMillis(remaining) : Duration.ZERO;
  }

  /** Records that an attempt started now and grows the interval for the following one. */
  public void recordAttemptStart() {
    lastAttemptStartMillis = clock.nowMillis();
    if (interval.isZero()) {
      interval = initial;
    } else {
      Duration doubled = interval.multipliedBy(2);
      interval = doubled.compareTo(max) > 0 ? max : doubled;
    }
  }

  /** Forgets all previous attempts so the next one may start immediately. */
  public void reset() {
    lastAttemptStartMillis = -1L;
    interval = Duration.ZERO;
  }

  /**
   * Returns the interval the next attempt will wait after the most recent start.
   *
   * @return current interval, zero after a reset
   */
  public Duration currentInterval() {
    return interval;
  }
}
