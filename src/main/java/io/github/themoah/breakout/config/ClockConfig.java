package io.github.themoah.breakout.config;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the clock shared by all stages. Its zone defines the "local day" of the digest quota.
 */
public final class ClockConfig {

  private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

  private ClockConfig() {}

  /**
   * Returns a system clock in DIGEST_TIMEZONE, or the system default zone when unset or invalid.
   */
  public static Clock from(Env env) {
    String zone = env.getString("DIGEST_TIMEZONE", null);
    if (zone == null) {
      return Clock.systemDefaultZone();
    }
    try {
      Clock clock = Clock.system(ZoneId.of(zone));
      log.info("Using time zone {} for the digest quota", zone);
      return clock;
    } catch (DateTimeException e) {
      log.warn("Invalid DIGEST_TIMEZONE: '{}', using system default: {}", zone, ZoneId.systemDefault());
      return Clock.systemDefaultZone();
    }
  }
}
