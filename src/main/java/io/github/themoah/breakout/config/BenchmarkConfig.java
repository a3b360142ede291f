package io.github.themoah.breakout.config;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for benchmark recomputation.
 *
 * @param lookback trailing window of snapshots used as history
 * @param minSampleSize samples required before a cell is overwritten
 * @param pairingWindow maximum gap between the two snapshots of a velocity sample
 */
public record BenchmarkConfig(
  Duration lookback,
  int minSampleSize,
  Duration pairingWindow
) {

  private static final Logger log = LoggerFactory.getLogger(BenchmarkConfig.class);

  private static final int DEFAULT_LOOKBACK_DAYS = 7;
  private static final int DEFAULT_MIN_SAMPLES = 10;
  private static final int DEFAULT_PAIRING_WINDOW_MINUTES = 10;

  public static BenchmarkConfig defaults() {
    return new BenchmarkConfig(Duration.ofDays(DEFAULT_LOOKBACK_DAYS), DEFAULT_MIN_SAMPLES,
      Duration.ofMinutes(DEFAULT_PAIRING_WINDOW_MINUTES));
  }

  /**
   * Loads configuration with defaults.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>BENCHMARK_LOOKBACK_DAYS - History window (default: 7)</li>
   *   <li>BENCHMARK_MIN_SAMPLES - Minimum samples per cell (default: 10)</li>
   *   <li>BENCHMARK_PAIRING_WINDOW_MINUTES - Maximum snapshot pair gap (default: 10)</li>
   * </ul>
   */
  public static BenchmarkConfig from(Env env) {
    int lookbackDays = env.getPositiveInt("BENCHMARK_LOOKBACK_DAYS", DEFAULT_LOOKBACK_DAYS);
    int minSamples = env.getPositiveInt("BENCHMARK_MIN_SAMPLES", DEFAULT_MIN_SAMPLES);
    int pairingMinutes = env.getPositiveInt("BENCHMARK_PAIRING_WINDOW_MINUTES", DEFAULT_PAIRING_WINDOW_MINUTES);

    BenchmarkConfig config = new BenchmarkConfig(Duration.ofDays(lookbackDays), minSamples,
      Duration.ofMinutes(pairingMinutes));
    log.info("Benchmark config: lookbackDays={}, minSamples={}, pairingWindowMinutes={}",
      lookbackDays, minSamples, pairingMinutes);
    return config;
  }
}
