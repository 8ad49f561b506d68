package ca.gc.cra.portalwatch.api;

import ca.gc.cra.portalwatch.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.portalwatch.validation.Net;
import ca.gc.cra.portalwatch.validation.Strings;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts and validates the telemetry keys of the effective configuration.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from {@code args} and
   * resolves them into settings.
   *
   * @param args mutable effective configuration
   * @return resolved telemetry settings
   * @throws IllegalArgumentException when a telemetry value is invalid
   */
  static TelemetrySettings configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return TelemetrySettings.resolve(null, null, null);
    }
    String exporter = args.remove("metricsExporter");
    // Parsed eagerly so a bad value is reported even when the environment would override it.
    TelemetrySettings.Exporter.from(exporter);

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      Net.requireUrl("otelEndpoint", endpoint, "http", "https");
    }

    String resourceAttributes = args.remove("otelResourceAttributes");
    if (resourceAttributes != null && !resourceAttributes.isBlank()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    TelemetrySettings settings = TelemetrySettings.resolve(exporter, endpoint, resourceAttributes);
    log.debug("Telemetry exporter {} endpoint {}", settings.exporter(), settings.endpoint());
    return settings;
  }
}
