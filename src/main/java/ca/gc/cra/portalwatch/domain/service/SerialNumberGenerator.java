package ca.gc.cra.portalwatch.domain.service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out process-unique serial numbers. One instance is created by the composition root and passed to the
 * components that need identifiers.
 *
 * @since 0.1.0
 */
public final class SerialNumberGenerator {
  private final AtomicLong next;

  public SerialNumberGenerator() {
    this(1);
  }

  /**
   * Creates a generator starting at the given value.
   *
   * @param first first serial number to return
   */
  public SerialNumberGenerator(long first) {
    this.next = new AtomicLong(first);
  }

  /**
   * Returns the next serial number.
   *
   * @return unique serial number
   */
  public long next() {
    return next.getAndIncrement();
  }
}
