package io.github.themoah.breakout.model;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Complete set of benchmarks: one per (age bucket, metric) cell, six in total.
 * Instances only exist when every cell is present.
 */
public final class BenchmarkMap {

  private final Map<AgeBucket, Map<MetricType, Benchmark>> cells;

  private BenchmarkMap(Map<AgeBucket, Map<MetricType, Benchmark>> cells) {
    this.cells = cells;
  }

  /**
   * Builds a map from stored rows.
   *
   * @param rows benchmark rows as read from the store
   * @return the map, or empty if any of the six cells is missing
   */
  public static Optional<BenchmarkMap> fromRows(Collection<Benchmark> rows) {
    Map<AgeBucket, Map<MetricType, Benchmark>> cells = new EnumMap<>(AgeBucket.class);
    for (Benchmark row : rows) {
      cells.computeIfAbsent(row.bucket(), b -> new EnumMap<>(MetricType.class))
        .put(row.metric(), row);
    }

    for (AgeBucket bucket : AgeBucket.values()) {
      Map<MetricType, Benchmark> byMetric = cells.get(bucket);
      if (byMetric == null || byMetric.size() != MetricType.values().length) {
        return Optional.empty();
      }
    }
    return Optional.of(new BenchmarkMap(cells));
  }

  public Benchmark get(AgeBucket bucket, MetricType metric) {
    return cells.get(bucket).get(metric);
  }
}
