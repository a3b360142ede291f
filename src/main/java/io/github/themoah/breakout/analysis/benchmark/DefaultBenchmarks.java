package io.github.themoah.breakout.analysis.benchmark;

import io.github.themoah.breakout.model.AgeBucket;
import io.github.themoah.breakout.model.Benchmark;
import io.github.themoah.breakout.model.MetricType;
import java.time.Instant;
import java.util.List;

/**
 * Hand-picked cold-start benchmarks, used until enough history exists for recomputation.
 * Deliberately generous so that early detection produces few false positives.
 */
public final class DefaultBenchmarks {

  private static final int SEED_SAMPLE_SIZE = 100;

  private DefaultBenchmarks() {}

  /**
   * Returns the six default cells stamped with the given time.
   */
  public static List<Benchmark> all(Instant calculatedAt) {
    return List.of(
      // New items (0-30 min): bursty
      cell(AgeBucket.NEW, MetricType.SCORE_VELOCITY, 0.5, 1.0, 2.0, 3.5, 6.0, calculatedAt),
      cell(AgeBucket.NEW, MetricType.COMMENT_VELOCITY, 0.1, 0.3, 0.6, 1.0, 2.0, calculatedAt),
      // Young items (31-120 min): stabilizing
      cell(AgeBucket.YOUNG, MetricType.SCORE_VELOCITY, 0.3, 0.6, 1.2, 2.0, 4.0, calculatedAt),
      cell(AgeBucket.YOUNG, MetricType.COMMENT_VELOCITY, 0.05, 0.15, 0.3, 0.5, 1.0, calculatedAt),
      // Mature items (121+ min): slow growth
      cell(AgeBucket.MATURE, MetricType.SCORE_VELOCITY, 0.1, 0.2, 0.5, 0.8, 1.5, calculatedAt),
      cell(AgeBucket.MATURE, MetricType.COMMENT_VELOCITY, 0.02, 0.05, 0.1, 0.2, 0.4, calculatedAt)
    );
  }

  private static Benchmark cell(
      AgeBucket bucket, MetricType metric,
      double p50, double p75, double p90, double p95, double p99,
      Instant calculatedAt) {
    return new Benchmark(bucket, metric, p50, p75, p90, p95, p99, SEED_SAMPLE_SIZE, calculatedAt);
  }
}
