package ca.gc.cra.portalwatch.infrastructure.time;

import ca.gc.cra.portalwatch.application.port.ClockPort;

/**
 * {@link ClockPort} backed by the JVM wall clock.
 *
 * <p>Backoff and probe durations tolerate the occasional wall-clock step: delays are clamped at zero and
 * durations are floored at zero by their consumers.</p>
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /** Shared instance. */
  public static final SystemClockAdapter INSTANCE = new SystemClockAdapter();

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
