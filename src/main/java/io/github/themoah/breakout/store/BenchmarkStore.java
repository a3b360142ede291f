package io.github.themoah.breakout.store;

import io.github.themoah.breakout.model.Benchmark;
import io.vertx.core.Future;
import java.util.List;

/**
 * Benchmark rows keyed by (age bucket, metric). Exactly one row per key.
 */
public interface BenchmarkStore {

  Future<List<Benchmark>> findAllBenchmarks();

  /**
   * Inserts or overwrites the row for the benchmark's (bucket, metric) key.
   */
  Future<Void> upsertBenchmark(Benchmark benchmark);

  /**
   * Inserts the row only if its key has no row yet.
   *
   * @return Future with true if the row was inserted
   */
  Future<Boolean> insertBenchmarkIfAbsent(Benchmark benchmark);
}
