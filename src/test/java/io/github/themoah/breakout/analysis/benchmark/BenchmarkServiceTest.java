package io.github.themoah.breakout.analysis.benchmark;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.breakout.config.BenchmarkConfig;
import io.github.themoah.breakout.model.AgeBucket;
import io.github.themoah.breakout.model.Benchmark;
import io.github.themoah.breakout.model.Item;
import io.github.themoah.breakout.model.ItemType;
import io.github.themoah.breakout.model.MetricType;
import io.github.themoah.breakout.model.Snapshot;
import io.github.themoah.breakout.store.InMemoryBreakoutStore;
import io.vertx.core.Future;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for BenchmarkService.
 */
@ExtendWith(VertxExtension.class)
public class BenchmarkServiceTest {

  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(T0.plusSeconds(3600), ZoneOffset.UTC);

  private InMemoryBreakoutStore store;
  private BenchmarkService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryBreakoutStore();
    service = new BenchmarkService(store, store, BenchmarkConfig.defaults(), CLOCK);
  }

  /**
   * Adds an item with two snapshots five minutes apart, the first at the given age.
   */
  private void addPair(long itemId, int ageMinutes, int scoreGain, int commentGain) {
    store.upsertItem(new Item(itemId, "Item " + itemId, null, "author", ItemType.STORY,
      T0.minusSeconds(ageMinutes * 60L), T0, false, false));
    store.insertSnapshot(new Snapshot(itemId, 10, 2, T0, ageMinutes));
    store.insertSnapshot(new Snapshot(itemId, 10 + scoreGain, 2 + commentGain, T0.plusSeconds(300), ageMinutes + 5));
  }

  @Test
  void recompute_updatesBucketsWithEnoughSamples(VertxTestContext ctx) throws Exception {
    for (int i = 1; i <= 12; i++) {
      addPair(i, 5, 5 * i, i);
    }

    service.recompute()
      .compose(result -> store.findAllBenchmarks().map(rows -> {
        ctx.verify(() -> {
          assertEquals(2, result.benchmarksUpdated());
          assertEquals(List.of("No data for age bucket: young", "No data for age bucket: mature"), result.errors());
          assertEquals(2, rows.size());

          Benchmark score = rows.stream()
            .filter(b -> b.metric() == MetricType.SCORE_VELOCITY).findFirst().orElseThrow();
          assertEquals(AgeBucket.NEW, score.bucket());
          assertEquals(12, score.sampleSize());
          // Velocities are 1..12 per minute
          assertEquals(6.0, score.p50(), 1e-9);
          assertEquals(12.0, score.p99(), 1e-9);
          assertEquals(CLOCK.instant(), score.calculatedAt());
        });
        return rows;
      }))
      .onComplete(ctx.succeeding(rows -> ctx.completeNow()));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void recompute_insufficientSamples_keepsExistingRow(VertxTestContext ctx) throws Exception {
    for (int i = 1; i <= 3; i++) {
      addPair(i, 60, 3, 1);
    }
    Benchmark seeded = DefaultBenchmarks.all(T0).stream()
      .filter(b -> b.bucket() == AgeBucket.YOUNG && b.metric() == MetricType.SCORE_VELOCITY)
      .findFirst().orElseThrow();
    store.upsertBenchmark(seeded);

    service.recompute()
      .compose(result -> store.findAllBenchmarks().map(rows -> {
        ctx.verify(() -> {
          assertEquals(0, result.benchmarksUpdated());
          assertTrue(result.errors().contains("Insufficient data for young/score_velocity: 3 samples"));
          assertTrue(result.errors().contains("Insufficient data for young/comment_velocity: 3 samples"));
          assertEquals(List.of(seeded), rows);
        });
        return rows;
      }))
      .onComplete(ctx.succeeding(rows -> ctx.completeNow()));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void recompute_emptyHistory_reportsEveryBucket(VertxTestContext ctx) throws Exception {
    service.recompute()
      .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
        assertEquals(0, result.benchmarksUpdated());
        assertEquals(3, result.errors().size());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void seedDefaults_insertsOnlyMissingCells(VertxTestContext ctx) throws Exception {
    Benchmark custom = new Benchmark(AgeBucket.MATURE, MetricType.COMMENT_VELOCITY,
      1, 2, 3, 4, 5, 42, T0);
    store.upsertBenchmark(custom);

    service.seedDefaults()
      .compose(first -> service.seedDefaults().map(second -> List.of(first, second)))
      .compose(counts -> store.findAllBenchmarks().map(rows -> {
        ctx.verify(() -> {
          assertEquals(5, counts.get(0));
          assertEquals(0, counts.get(1));
          assertEquals(6, rows.size());
          assertTrue(rows.contains(custom));
        });
        return rows;
      }))
      .onComplete(ctx.succeeding(rows -> ctx.completeNow()));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void loadBenchmarkMap_incompleteMapIsEmpty(VertxTestContext ctx) throws Exception {
    List<Benchmark> defaults = DefaultBenchmarks.all(T0);
    for (int i = 0; i < defaults.size() - 1; i++) {
      store.upsertBenchmark(defaults.get(i));
    }

    service.loadBenchmarkMap()
      .compose(partial -> store.upsertBenchmark(defaults.get(defaults.size() - 1))
        .compose(v -> service.loadBenchmarkMap())
        .map(complete -> {
          ctx.verify(() -> {
            assertFalse(partial.isPresent());
            assertTrue(complete.isPresent());
            assertEquals(3.5, complete.get().get(AgeBucket.NEW, MetricType.SCORE_VELOCITY).p95(), 1e-9);
          });
          return complete;
        }))
      .onComplete(ctx.succeeding(map -> ctx.completeNow()));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void recompute_cellWriteFailure_doesNotStopOtherCells(VertxTestContext ctx) throws Exception {
    String failingKey = Benchmark.makeKey(AgeBucket.NEW, MetricType.SCORE_VELOCITY);
    store = new InMemoryBreakoutStore() {
      @Override
      public synchronized Future<Void> upsertBenchmark(Benchmark benchmark) {
        if (benchmark.key().equals(failingKey)) {
          return Future.failedFuture(new IllegalStateException("write rejected"));
        }
        return super.upsertBenchmark(benchmark);
      }
    };
    service = new BenchmarkService(store, store, BenchmarkConfig.defaults(), CLOCK);
    for (int i = 1; i <= 12; i++) {
      addPair(i, 5, 5 * i, i);
    }
    for (int i = 13; i <= 24; i++) {
      addPair(i, 60, 2 * i, i);
    }

    service.recompute()
      .compose(result -> store.findAllBenchmarks().map(rows -> {
        ctx.verify(() -> {
          assertEquals(3, result.benchmarksUpdated());
          assertTrue(result.errors().contains("Error processing " + failingKey + ": write rejected"));
          assertTrue(result.errors().contains("No data for age bucket: mature"));
          assertEquals(2, result.errors().size());

          assertEquals(3, rows.size());
          assertFalse(rows.stream().anyMatch(b -> b.key().equals(failingKey)));
          assertTrue(rows.stream().anyMatch(b -> b.bucket() == AgeBucket.NEW && b.metric() == MetricType.COMMENT_VELOCITY));
          assertEquals(2, rows.stream().filter(b -> b.bucket() == AgeBucket.YOUNG).count());
        });
        return rows;
      }))
      .onComplete(ctx.succeeding(rows -> ctx.completeNow()));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void recompute_historyReadFailure_failsCycle(VertxTestContext ctx) throws Exception {
    InMemoryBreakoutStore failing = new InMemoryBreakoutStore() {
      @Override
      public synchronized Future<List<Snapshot>> findSnapshotsCapturedSince(Instant since) {
        return Future.failedFuture(new IllegalStateException("store unavailable"));
      }
    };
    BenchmarkService failingService = new BenchmarkService(failing, failing, BenchmarkConfig.defaults(), CLOCK);

    failingService.recompute()
      .onComplete(ctx.failing(err -> ctx.verify(() -> {
        assertEquals("store unavailable", err.getMessage());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }
}
