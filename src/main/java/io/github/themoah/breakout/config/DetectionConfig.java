package io.github.themoah.breakout.config;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for breakout detection.
 *
 * @param percentileThreshold percentile at or above which score/comment velocity alerts fire (0-100)
 * @param activeWindow items first seen within this window are analyzed
 * @param maxConcurrency maximum items analyzed concurrently
 */
public record DetectionConfig(
  double percentileThreshold,
  Duration activeWindow,
  int maxConcurrency
) {

  private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

  private static final int DEFAULT_THRESHOLD = 95;
  private static final int DEFAULT_ACTIVE_WINDOW_HOURS = 48;
  private static final int DEFAULT_MAX_CONCURRENCY = 16;

  public static DetectionConfig defaults() {
    return new DetectionConfig(DEFAULT_THRESHOLD, Duration.ofHours(DEFAULT_ACTIVE_WINDOW_HOURS),
      DEFAULT_MAX_CONCURRENCY);
  }

  /**
   * Loads configuration with defaults.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>ALERT_PERCENTILE_THRESHOLD - Alert threshold, clamped to [0, 100] (default: 95)</li>
   *   <li>ACTIVE_WINDOW_HOURS - Age window of analyzed items (default: 48)</li>
   *   <li>DETECTION_MAX_CONCURRENCY - Items analyzed concurrently (default: 16)</li>
   * </ul>
   */
  public static DetectionConfig from(Env env) {
    int rawThreshold = env.getInt("ALERT_PERCENTILE_THRESHOLD", DEFAULT_THRESHOLD);
    double threshold = Math.min(100, Math.max(0, rawThreshold));
    int activeHours = env.getPositiveInt("ACTIVE_WINDOW_HOURS", DEFAULT_ACTIVE_WINDOW_HOURS);
    int concurrency = env.getPositiveInt("DETECTION_MAX_CONCURRENCY", DEFAULT_MAX_CONCURRENCY);

    DetectionConfig config = new DetectionConfig(threshold, Duration.ofHours(activeHours), concurrency);
    log.info("Detection config: threshold={}, activeWindowHours={}, maxConcurrency={}",
      threshold, activeHours, concurrency);
    return config;
  }
}
