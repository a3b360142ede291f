package io.github.themoah.breakout.metrics;

import io.github.themoah.breakout.config.Env;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.AggregationTemporality;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";
  static final String DEFAULT_SERVICE_NAME = "breakout";

  private MicrometerConfig() {}

  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates an OTLP meter registry (HTTP, cumulative temporality).
   */
  public static MeterRegistry createOtlpRegistry(Env env) {
    log.info("Creating OTLP meter registry");

    String url = otlpUrl(env);
    Duration step = otlpStep(env);
    Map<String, String> headers = parseKeyValues(firstNonBlank(env,
      "OTLP_HEADERS", "OTEL_EXPORTER_OTLP_METRICS_HEADERS", "OTEL_EXPORTER_OTLP_HEADERS"));
    Map<String, String> attributes = resourceAttributes(env);

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        return url;
      }

      @Override
      public AggregationTemporality aggregationTemporality() {
        return AggregationTemporality.CUMULATIVE;
      }

      @Override
      public Duration step() {
        return step;
      }

      @Override
      public Map<String, String> headers() {
        return headers;
      }

      @Override
      public Map<String, String> resourceAttributes() {
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}, step: {}", url, step);
    return registry;
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType "prometheus" or "otlp"
   * @param env environment used by the OTLP settings
   * @return the configured MeterRegistry, or null if type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType, Env env) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.toLowerCase(Locale.ROOT)) {
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry(env);
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  // Priority: OTLP_ENDPOINT > OTEL_EXPORTER_OTLP_METRICS_ENDPOINT > OTEL_EXPORTER_OTLP_ENDPOINT + /v1/metrics
  static String otlpUrl(Env env) {
    String url = firstNonBlank(env, "OTLP_ENDPOINT", "OTEL_EXPORTER_OTLP_METRICS_ENDPOINT");
    if (url != null) {
      return url;
    }
    String base = firstNonBlank(env, "OTEL_EXPORTER_OTLP_ENDPOINT");
    if (base != null) {
      return base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
    }
    return DEFAULT_OTLP_URL;
  }

  static Duration otlpStep(Env env) {
    long stepMs = env.getLong("OTLP_STEP_MS", env.getLong("OTEL_METRIC_EXPORT_INTERVAL", 60_000L));
    return Duration.ofMillis(stepMs);
  }

  static Map<String, String> resourceAttributes(Env env) {
    Map<String, String> attributes = new HashMap<>();
    String serviceName = firstNonBlank(env, "OTEL_SERVICE_NAME");
    if (serviceName != null) {
      attributes.put("service.name", serviceName);
    }
    attributes.putAll(parseKeyValues(env.getString("OTEL_RESOURCE_ATTRIBUTES", null)));
    attributes.putAll(parseKeyValues(env.getString("OTLP_RESOURCE_ATTRIBUTES", null)));
    attributes.putIfAbsent("service.name", DEFAULT_SERVICE_NAME);
    return attributes;
  }

  /**
   * Parses "key1=value1,key2=value2". Malformed pairs are logged and skipped.
   */
  static Map<String, String> parseKeyValues(String raw) {
    if (raw == null || raw.isBlank()) {
      return Map.of();
    }
    Map<String, String> result = new HashMap<>();
    for (String pair : raw.split(",")) {
      String[] parts = pair.trim().split("=", 2);
      if (parts.length == 2) {
        result.put(parts[0].trim(), parts[1].trim());
      } else {
        log.warn("Invalid key=value pair: {}", pair);
      }
    }
    return result;
  }

  private static String firstNonBlank(Env env, String... names) {
    for (String name : names) {
      String value = env.getString(name, null);
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }
}
