package io.github.themoah.breakout.analysis.benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Nearest-rank percentile calculations used for benchmark recomputation.
 */
public final class PercentileUtils {

  private PercentileUtils() {}

  /**
   * Returns the nearest-rank percentile of an ascending list:
   * the value at index {@code ceil(p / 100 * n) - 1}, clamped to index 0.
   *
   * @param sorted values sorted ascending, not empty
   * @param percentile percentile in (0, 100]
   * @return the percentile value
   */
  public static double nearestRank(List<Double> sorted, double percentile) {
    int index = (int) Math.ceil(percentile / 100.0 * sorted.size()) - 1;
    return sorted.get(Math.max(0, Math.min(index, sorted.size() - 1)));
  }

  /**
   * Calculates the five benchmark percentiles of a sample set.
   * The input is not modified.
   *
   * @param values samples in any order
   * @return percentiles, all zero for an empty sample set
   */
  public static Percentiles calculatePercentiles(List<Double> values) {
    if (values == null || values.isEmpty()) {
      return new Percentiles(0, 0, 0, 0, 0);
    }

    List<Double> sorted = new ArrayList<>(values);
    Collections.sort(sorted);

    return new Percentiles(
      nearestRank(sorted, 50),
      nearestRank(sorted, 75),
      nearestRank(sorted, 90),
      nearestRank(sorted, 95),
      nearestRank(sorted, 99)
    );
  }

  /**
   * Percentile values of a sample set.
   */
  public record Percentiles(double p50, double p75, double p90, double p95, double p99) {}
}
