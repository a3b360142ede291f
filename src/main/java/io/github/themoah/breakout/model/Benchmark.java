package io.github.themoah.breakout.model;

import java.time.Instant;

/**
 * Cached percentile profile of historical velocity for one (age bucket, metric) cell.
 *
 * @param bucket age bucket of the cell
 * @param metric metric of the cell
 * @param p50 50th percentile velocity
 * @param p75 75th percentile velocity
 * @param p90 90th percentile velocity
 * @param p95 95th percentile velocity
 * @param p99 99th percentile velocity
 * @param sampleSize number of velocity samples behind the percentiles
 * @param calculatedAt when the percentiles were computed
 */
public record Benchmark(
  AgeBucket bucket,
  MetricType metric,
  double p50,
  double p75,
  double p90,
  double p95,
  double p99,
  int sampleSize,
  Instant calculatedAt
) {

  /**
   * Returns the store key for the cell, in format "bucket:metric".
   */
  public String key() {
    return makeKey(bucket, metric);
  }

  public static String makeKey(AgeBucket bucket, MetricType metric) {
    return bucket.key() + ":" + metric.key();
  }
}
