package io.github.themoah.breakout.health;

import io.github.themoah.breakout.analysis.benchmark.BenchmarkService;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically checks that a complete benchmark map can be loaded from the store.
 * Detection cannot run without one, so this drives readiness.
 */
public class BenchmarkHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(BenchmarkHealthMonitor.class);

  private final Vertx vertx;
  private final BenchmarkService benchmarkService;
  private final long checkIntervalMs;
  private final AtomicReference<HealthStatus> benchmarkStatus;

  private Long timerId;

  public BenchmarkHealthMonitor(Vertx vertx, BenchmarkService benchmarkService, long checkIntervalMs) {
    this.vertx = vertx;
    this.benchmarkService = benchmarkService;
    this.checkIntervalMs = checkIntervalMs;
    this.benchmarkStatus = new AtomicReference<>(HealthStatus.DOWN);
  }

  /**
   * Runs an initial check, then schedules the periodic one.
   *
   * @return Future that completes when the initial check finishes
   */
  public Future<Void> start() {
    log.info("Starting benchmark health monitor with interval: {}ms", checkIntervalMs);

    return check()
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(checkIntervalMs, id -> check());
        log.debug("Benchmark health monitor timer ID: {}", timerId);
      });
  }

  public Future<Void> stop() {
    log.info("Stopping benchmark health monitor");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    benchmarkStatus.set(HealthStatus.DOWN);
    return Future.succeededFuture();
  }

  public boolean isBenchmarksAvailable() {
    return benchmarkStatus.get() == HealthStatus.UP;
  }

  /**
   * Loads the benchmark map and updates the status. Never fails.
   */
  public Future<Void> check() {
    return benchmarkService.loadBenchmarkMap()
      .map(map -> map.isPresent() ? HealthStatus.UP : HealthStatus.DOWN)
      .otherwise(err -> {
        log.debug("Benchmark health check failed: {}", err.getMessage());
        return HealthStatus.DOWN;
      })
      .map(status -> {
        HealthStatus previous = benchmarkStatus.getAndSet(status);
        if (previous != status) {
          if (status == HealthStatus.UP) {
            log.info("Benchmarks available");
          } else {
            log.warn("Benchmarks unavailable - detection cycles will be skipped");
          }
        }
        return null;
      });
  }
}
