package io.github.themoah.breakout.metrics;

import io.github.themoah.breakout.config.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics reporting configuration.
 *
 * @param enabled whether meters are exported at all
 * @param reporterType registry backend: "prometheus" or "otlp"
 * @param jvmMetricsEnabled whether JVM binders are registered
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {
  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";

  /**
   * Loads configuration with defaults.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_ENABLED - Export meters (default: true)</li>
   *   <li>METRICS_REPORTER - prometheus or otlp (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - Bind JVM metrics (default: true)</li>
   * </ul>
   */
  public static MetricsConfig from(Env env) {
    boolean enabled = env.getBoolean("METRICS_ENABLED", true);
    String reporter = env.getString("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = env.getBoolean("METRICS_JVM_ENABLED", true);

    MetricsConfig config = new MetricsConfig(enabled, reporter, jvm);
    log.info("Metrics config: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return config;
  }
}
