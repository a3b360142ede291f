package io.github.themoah.breakout.analysis.benchmark;

import io.github.themoah.breakout.model.Benchmark;

/**
 * Estimates the percentile rank of a velocity against a benchmark.
 *
 * <p>Piecewise-linear interpolation through (0, 0), (p50, 50), (p75, 75), (p90, 90),
 * (p95, 95) and (p99, 99). Beyond p99 the rank grows towards 100 and saturates once the
 * value is twice p99. This is an approximation built from five stored quantiles, not an
 * empirical CDF; alert thresholds are tuned against it.
 */
public final class PercentileScorer {

  private PercentileScorer() {}

  /**
   * Calculates the estimated percentile of a value.
   *
   * @param value observed velocity (non-negative)
   * @param benchmark benchmark cell of the item's age bucket and metric
   * @return percentile in [0, 100]
   */
  public static double calculatePercentile(double value, Benchmark benchmark) {
    if (value <= benchmark.p50()) {
      if (benchmark.p50() <= 0) {
        return value < benchmark.p50() ? 0 : 50;  // Degenerate p50 = 0: at the median or below it
      }
      return Math.min(50, value / benchmark.p50() * 50);
    }
    if (value <= benchmark.p75()) {
      return interpolate(value, benchmark.p50(), benchmark.p75(), 50, 75);
    }
    if (value <= benchmark.p90()) {
      return interpolate(value, benchmark.p75(), benchmark.p90(), 75, 90);
    }
    if (value <= benchmark.p95()) {
      return interpolate(value, benchmark.p90(), benchmark.p95(), 90, 95);
    }
    if (value <= benchmark.p99()) {
      return interpolate(value, benchmark.p95(), benchmark.p99(), 95, 99);
    }

    if (benchmark.p99() <= 0) {
      return 100;
    }
    return 99 + Math.min(1, (value - benchmark.p99()) / benchmark.p99());
  }

  // Only reached with lower < value <= upper, so the span is never zero
  private static double interpolate(double value, double lower, double upper, double lowerRank, double upperRank) {
    return lowerRank + (value - lower) / (upper - lower) * (upperRank - lowerRank);
  }
}
