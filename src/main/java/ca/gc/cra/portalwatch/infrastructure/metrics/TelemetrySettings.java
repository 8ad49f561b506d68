package ca.gc.cra.portalwatch.infrastructure.metrics;

import java.util.Locale;

/**
 * Effective OpenTelemetry settings. Blank configured values fall back to the standard {@code otel.*} system
 * properties, then to the {@code OTEL_*} environment variables, then to built-in defaults.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}
 * @since 0.1.0
 */
public record TelemetrySettings(Exporter exporter, String endpoint, String resourceAttributes) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /** Supported exporters. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive; blank means {@code otlp}
     * @return exporter
     * @throws IllegalArgumentException for any other value
     */
    public static Exporter from(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      };
    }
  }

  public TelemetrySettings {
    exporter = exporter == null ? Exporter.OTLP : exporter;
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Resolves settings from configured values with system property and environment fallbacks.
   *
   * @param exporter configured exporter, may be blank
   * @param endpoint configured endpoint, may be blank
   * @param resourceAttributes configured resource attributes, may be blank
   * @return effective settings
   */
  public static TelemetrySettings resolve(String exporter, String endpoint, String resourceAttributes) {
    String exporterValue = firstNonBlank(
        exporter, System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"));
    String endpointValue = firstNonBlank(
        endpoint,
        System.getProperty("otel.exporter.otlp.endpoint"),
        System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"));
    String attributesValue = firstNonBlank(
        resourceAttributes,
        System.getProperty("otel.resource.attributes"),
        System.getenv("OTEL_RESOURCE_ATTRIBUTES"));
    return new TelemetrySettings(Exporter.from(exporterValue), endpointValue, attributesValue);
  }

  /**
   * Settings that disable export.
   *
   * @return settings with {@link Exporter#NONE}
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, null, null);
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
