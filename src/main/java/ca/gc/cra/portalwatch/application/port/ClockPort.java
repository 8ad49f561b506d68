package ca.gc.cra.portalwatch.application.port;

/**
 * <strong>What:</strong> Port supplying timestamps to the validation core.
 * <p><strong>Why:</strong> Probe durations, retry backoff and validation log entries are all measured against this
 * clock so tests can drive time by hand.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.portalwatch.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
