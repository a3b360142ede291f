package io.github.themoah.breakout.analysis.benchmark;

import io.github.themoah.breakout.analysis.benchmark.PercentileUtils.Percentiles;
import io.github.themoah.breakout.analysis.benchmark.VelocitySampler.Samples;
import io.github.themoah.breakout.config.BenchmarkConfig;
import io.github.themoah.breakout.model.AgeBucket;
import io.github.themoah.breakout.model.Benchmark;
import io.github.themoah.breakout.model.BenchmarkMap;
import io.github.themoah.breakout.model.MetricType;
import io.github.themoah.breakout.model.RecomputeResult;
import io.github.themoah.breakout.store.BenchmarkStore;
import io.github.themoah.breakout.store.SnapshotStore;
import io.vertx.core.Future;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains the six benchmark cells: loading, periodic recomputation and cold-start seeding.
 *
 * <p>Recomputation upserts one cell at a time. Readers only ever use a complete map
 * (see {@link BenchmarkMap#fromRows}), so a concurrent detection cycle sees either the
 * old or the new value of each cell, never a missing one.
 */
public class BenchmarkService {

  private static final Logger log = LoggerFactory.getLogger(BenchmarkService.class);

  private final BenchmarkStore benchmarkStore;
  private final SnapshotStore snapshotStore;
  private final BenchmarkConfig config;
  private final VelocitySampler sampler;
  private final Clock clock;

  public BenchmarkService(
    BenchmarkStore benchmarkStore,
    SnapshotStore snapshotStore,
    BenchmarkConfig config,
    Clock clock
  ) {
    this.benchmarkStore = benchmarkStore;
    this.snapshotStore = snapshotStore;
    this.config = config;
    this.sampler = new VelocitySampler(config.pairingWindow());
    this.clock = clock;
  }

  /**
   * Loads the benchmark map.
   *
   * @return Future with the complete map, or empty if any of the six cells is missing
   */
  public Future<Optional<BenchmarkMap>> loadBenchmarkMap() {
    return benchmarkStore.findAllBenchmarks()
      .map(rows -> {
        Optional<BenchmarkMap> map = BenchmarkMap.fromRows(rows);
        if (map.isEmpty()) {
          log.debug("Benchmark map incomplete: {} of 6 cells present", rows.size());
        }
        return map;
      });
  }

  /**
   * Recomputes every cell from the snapshot history of the lookback window.
   *
   * <p>Cells with fewer than the minimum samples keep their current value and are reported
   * in the error list; a failure writing one cell does not stop the others. Only a failure
   * to read the history fails the returned future.
   *
   * @return Future with the number of cells updated and one message per skipped cell
   */
  public Future<RecomputeResult> recompute() {
    Instant now = clock.instant();
    Instant since = now.minus(config.lookback());
    log.info("Recomputing benchmarks from snapshots captured since {}", since);

    return snapshotStore.findSnapshotsCapturedSince(since)
      .compose(history -> {
        Map<AgeBucket, Samples> samplesByBucket = sampler.collect(history, since);
        List<String> errors = new ArrayList<>();

        Future<Integer> chain = Future.succeededFuture(0);
        for (AgeBucket bucket : AgeBucket.values()) {
          Samples samples = samplesByBucket.get(bucket);
          chain = chain.compose(updated ->
            recomputeBucket(bucket, samples, now, errors).map(count -> updated + count));
        }

        return chain.map(updated -> {
          RecomputeResult result = new RecomputeResult(updated, errors);
          log.info("Benchmark recomputation finished: {} cells updated, {} skipped",
            updated, errors.size());
          errors.forEach(error -> log.warn("  - {}", error));
          return result;
        });
      });
  }

  private Future<Integer> recomputeBucket(AgeBucket bucket, Samples samples, Instant now, List<String> errors) {
    if (samples.pairCount() == 0) {
      errors.add("No data for age bucket: " + bucket.key());
      return Future.succeededFuture(0);
    }

    Future<Integer> chain = Future.succeededFuture(0);
    for (MetricType metric : MetricType.values()) {
      List<Double> values = samples.forMetric(metric);
      if (values.size() < config.minSampleSize()) {
        errors.add(String.format("Insufficient data for %s/%s: %d samples",
          bucket.key(), metric.key(), values.size()));
        continue;
      }

      Percentiles p = PercentileUtils.calculatePercentiles(values);
      Benchmark benchmark = new Benchmark(bucket, metric, p.p50(), p.p75(), p.p90(), p.p95(), p.p99(),
        values.size(), now);

      chain = chain.compose(updated -> benchmarkStore.upsertBenchmark(benchmark)
        .map(v -> {
          log.debug("Updated benchmark {}: p50={}, p95={}, p99={}, samples={}",
            benchmark.key(), benchmark.p50(), benchmark.p95(), benchmark.p99(), benchmark.sampleSize());
          return updated + 1;
        })
        .recover(err -> {
          errors.add("Error processing " + benchmark.key() + ": " + err.getMessage());
          return Future.succeededFuture(updated);
        }));
    }
    return chain;
  }

  /**
   * Writes the default benchmarks for cells that have no row yet. Existing rows are kept.
   *
   * @return Future with the number of cells seeded
   */
  public Future<Integer> seedDefaults() {
    List<Future<Boolean>> inserts = new ArrayList<>();
    for (Benchmark benchmark : DefaultBenchmarks.all(clock.instant())) {
      inserts.add(benchmarkStore.insertBenchmarkIfAbsent(benchmark));
    }

    return Future.all(inserts)
      .map(composite -> {
        int seeded = 0;
        for (int i = 0; i < composite.size(); i++) {
          if (Boolean.TRUE.equals(composite.resultAt(i))) {
            seeded++;
          }
        }
        log.info("Seeded {} default benchmark cells", seeded);
        return seeded;
      });
  }
}
