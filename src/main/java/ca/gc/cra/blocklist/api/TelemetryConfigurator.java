package ca.gc.cra.blocklist.api;

import ca.gc.cra.blocklist.application.port.MetricsPort;
import ca.gc.cra.blocklist.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.blocklist.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.blocklist.validation.Strings;
import ca.gc.cra.blocklist.validation.Uris;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the telemetry settings of the effective configuration to the JVM and selects the metrics adapter.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Publishes {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes} as the
   * {@code otel.*} system properties read by the OpenTelemetry bootstrap.
   *
   * @param config effective configuration
   * @return exporter name, {@code otlp} or {@code none}
   * @throws IllegalArgumentException if a telemetry value is invalid
   */
  static String configureMetrics(Map<String, String> config) {
    String exporter = config.getOrDefault("metricsExporter", "none").trim().toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = "none";
    }
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    System.setProperty("otel.metrics.exporter", exporter);

    String endpoint = config.getOrDefault("otelEndpoint", "").trim();
    if (!endpoint.isEmpty()) {
      Uris.requireHttpUri("otelEndpoint", endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String attributes = config.getOrDefault("otelResourceAttributes", "").trim();
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
    }
    return exporter;
  }

  /**
   * Creates the metrics adapter matching {@code exporter}.
   *
   * @param exporter {@code otlp} or {@code none}
   * @return metrics port
   */
  static MetricsPort createMetrics(String exporter) {
    return "otlp".equals(exporter) ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter();
  }

  /**
   * Flushes and closes an OpenTelemetry adapter; other adapters need no cleanup.
   *
   * @param metrics adapter created by {@link #createMetrics(String)}
   */
  static void close(MetricsPort metrics) {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
