package io.github.themoah.breakout.config;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for digest batching.
 *
 * @param batchSize maximum alerts per digest
 * @param maxDigestsPerDay daily digest quota (local calendar day of the injected clock)
 * @param unsentWindow only alerts detected within this window are eligible
 */
public record DigestConfig(
  int batchSize,
  int maxDigestsPerDay,
  Duration unsentWindow
) {

  private static final Logger log = LoggerFactory.getLogger(DigestConfig.class);

  private static final int DEFAULT_BATCH_SIZE = 10;
  private static final int DEFAULT_MAX_PER_DAY = 5;
  private static final int DEFAULT_UNSENT_WINDOW_HOURS = 4;

  public static DigestConfig defaults() {
    return new DigestConfig(DEFAULT_BATCH_SIZE, DEFAULT_MAX_PER_DAY,
      Duration.ofHours(DEFAULT_UNSENT_WINDOW_HOURS));
  }

  /**
   * Loads configuration with defaults.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>DIGEST_BATCH_SIZE - Alerts per digest (default: 10)</li>
   *   <li>MAX_DIGESTS_PER_DAY - Daily quota (default: 5)</li>
   *   <li>UNSENT_ALERT_WINDOW_HOURS - Eligibility window of unsent alerts (default: 4)</li>
   * </ul>
   */
  public static DigestConfig from(Env env) {
    int batchSize = env.getPositiveInt("DIGEST_BATCH_SIZE", DEFAULT_BATCH_SIZE);
    int maxPerDay = Math.max(0, env.getInt("MAX_DIGESTS_PER_DAY", DEFAULT_MAX_PER_DAY));
    int windowHours = env.getPositiveInt("UNSENT_ALERT_WINDOW_HOURS", DEFAULT_UNSENT_WINDOW_HOURS);

    DigestConfig config = new DigestConfig(batchSize, maxPerDay, Duration.ofHours(windowHours));
    log.info("Digest config: batchSize={}, maxDigestsPerDay={}, unsentWindowHours={}",
      batchSize, maxPerDay, windowHours);
    return config;
  }
}
