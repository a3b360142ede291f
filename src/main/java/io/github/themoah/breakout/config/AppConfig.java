package io.github.themoah.breakout.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param cronSecret bearer token required by trigger endpoints (null if not configured)
 * @param healthCheckIntervalMs readiness check interval in milliseconds
 */
public record AppConfig(
  int httpPort,
  String cronSecret,
  long healthCheckIntervalMs
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;

  /**
   * Loads configuration with defaults.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>HTTP_PORT - HTTP server port (default: 8888)</li>
   *   <li>CRON_SECRET - Bearer token for trigger endpoints (no default)</li>
   *   <li>HEALTH_CHECK_INTERVAL_MS - Readiness check interval (default: 30000)</li>
   * </ul>
   */
  public static AppConfig from(Env env) {
    int port = env.getInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    String secret = env.getString("CRON_SECRET", null);
    long interval = env.getLong("HEALTH_CHECK_INTERVAL_MS", DEFAULT_HEALTH_CHECK_INTERVAL_MS);

    if (secret == null) {
      log.warn("CRON_SECRET is not set - trigger endpoints will reject all requests");
    }
    log.info("AppConfig loaded: httpPort={}, cronSecretSet={}, healthCheckIntervalMs={}",
      port, secret != null, interval);
    return new AppConfig(port, secret, interval);
  }
}
