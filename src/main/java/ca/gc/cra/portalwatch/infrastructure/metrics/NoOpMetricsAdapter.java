package ca.gc.cra.portalwatch.infrastructure.metrics;

import ca.gc.cra.portalwatch.application.port.MetricsPort;

/**
 * Metrics adapter selected by {@code metricsExporter=none}; discards everything.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort, AutoCloseable {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}

  @Override
  public void close() {}
}
