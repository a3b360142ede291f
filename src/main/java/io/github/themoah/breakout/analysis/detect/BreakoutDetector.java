package io.github.themoah.breakout.analysis.detect;

import io.github.themoah.breakout.analysis.benchmark.BenchmarkService;
import io.github.themoah.breakout.analysis.velocity.VelocityCalculator;
import io.github.themoah.breakout.config.DetectionConfig;
import io.github.themoah.breakout.model.AlertCandidate;
import io.github.themoah.breakout.model.AlertType;
import io.github.themoah.breakout.model.BenchmarkMap;
import io.github.themoah.breakout.model.DetectionSummary;
import io.github.themoah.breakout.model.Item;
import io.github.themoah.breakout.model.Snapshot;
import io.github.themoah.breakout.model.Velocity;
import io.github.themoah.breakout.store.AlertStore;
import io.github.themoah.breakout.store.SnapshotStore;
import io.vertx.core.Future;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one detection cycle over all active items.
 *
 * <p>Items are analyzed in chunks of {@link DetectionConfig#maxConcurrency()}; an error on
 * one item is logged and counted, and never aborts the cycle. Alert inserts are idempotent
 * per (item, type), so a rule that keeps firing produces one alert.
 */
public class BreakoutDetector {

  private static final Logger log = LoggerFactory.getLogger(BreakoutDetector.class);

  private static final int SNAPSHOTS_PER_ITEM = 2;

  private final SnapshotStore snapshotStore;
  private final AlertStore alertStore;
  private final BenchmarkService benchmarkService;
  private final DetectionConfig config;
  private final Clock clock;

  public BreakoutDetector(
    SnapshotStore snapshotStore,
    AlertStore alertStore,
    BenchmarkService benchmarkService,
    DetectionConfig config,
    Clock clock
  ) {
    this.snapshotStore = snapshotStore;
    this.alertStore = alertStore;
    this.benchmarkService = benchmarkService;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Scans active items and persists new alerts.
   *
   * @return Future with the cycle summary; benchmarks_available=false if the map is incomplete
   */
  public Future<DetectionSummary> detect() {
    return benchmarkService.loadBenchmarkMap()
      .compose(maybeMap -> {
        if (maybeMap.isEmpty()) {
          log.warn("Benchmarks unavailable, skipping detection cycle");
          return Future.succeededFuture(DetectionSummary.benchmarksUnavailable());
        }
        return scan(maybeMap.get());
      });
  }

  private Future<DetectionSummary> scan(BenchmarkMap benchmarks) {
    Instant now = clock.instant();
    Instant activeSince = now.minus(config.activeWindow());

    return snapshotStore.findActiveItems(activeSince)
      .compose(items -> {
        log.debug("Analyzing {} active items in chunks of {}", items.size(), config.maxConcurrency());
        List<List<Item>> chunks = ChunkProcessor.partition(items, config.maxConcurrency());

        return ChunkProcessor.processSequentially(chunks, chunk -> analyzeChunk(chunk, benchmarks))
          .compose(chunkResults -> {
            List<ItemAnalysis> analyses = new ArrayList<>(items.size());
            chunkResults.forEach(analyses::addAll);
            return persist(analyses, now);
          });
      });
  }

  private Future<List<ItemAnalysis>> analyzeChunk(List<Item> chunk, BenchmarkMap benchmarks) {
    List<Future<ItemAnalysis>> futures = new ArrayList<>(chunk.size());
    for (Item item : chunk) {
      futures.add(analyzeItem(item.id(), benchmarks)
        .recover(err -> {
          log.warn("Failed to analyze item {}: {}", item.id(), err.getMessage());
          return Future.succeededFuture(ItemAnalysis.failed(item.id()));
        }));
    }

    return Future.all(futures)
      .map(composite -> {
        List<ItemAnalysis> results = new ArrayList<>(chunk.size());
        for (int i = 0; i < composite.size(); i++) {
          results.add(composite.resultAt(i));
        }
        return results;
      });
  }

  /**
   * Analyzes a single item against the benchmark map.
   *
   * @param itemId item to analyze
   * @param benchmarks complete benchmark map
   * @return Future with the analysis; fails if the stored snapshots are malformed
   */
  Future<ItemAnalysis> analyzeItem(long itemId, BenchmarkMap benchmarks) {
    return snapshotStore.findRecentSnapshots(itemId, SNAPSHOTS_PER_ITEM)
      .map(snapshots -> {
        snapshots.forEach(BreakoutDetector::validate);

        Velocity velocity = VelocityCalculator.calculateRecent(snapshots);
        if (velocity == null) {
          return ItemAnalysis.skipped(itemId);
        }

        List<AlertCandidate> candidates = BreakoutRules.evaluate(
          snapshots.get(0), velocity, benchmarks, config.percentileThreshold());
        if (!candidates.isEmpty()) {
          log.debug("Item {} triggered {} rule(s) at score velocity {}/min",
            itemId, candidates.size(), String.format("%.2f", velocity.scoreVelocity()));
        }
        return ItemAnalysis.analyzed(itemId, candidates);
      });
  }

  private static void validate(Snapshot snapshot) {
    if (snapshot.capturedAt() == null) {
      throw new IllegalStateException("Snapshot for item " + snapshot.itemId() + " has no capture time");
    }
    if (snapshot.score() < 0 || snapshot.commentCount() < 0) {
      throw new IllegalStateException(String.format("Snapshot for item %d has negative counts: score=%d, comments=%d",
        snapshot.itemId(), snapshot.score(), snapshot.commentCount()));
    }
  }

  /**
   * Inserts candidates one after another. A failed insert counts its item as failed
   * and does not stop the remaining inserts.
   */
  private Future<DetectionSummary> persist(List<ItemAnalysis> analyses, Instant detectedAt) {
    Map<AlertType, Integer> candidatesByType = DetectionSummary.emptyCounts();
    int skipped = 0;
    int failed = 0;
    List<AlertCandidate> candidates = new ArrayList<>();

    for (ItemAnalysis analysis : analyses) {
      switch (analysis.outcome()) {
        case SKIPPED:
          skipped++;
          break;
        case FAILED:
          failed++;
          break;
        default:
          for (AlertCandidate candidate : analysis.candidates()) {
            candidatesByType.merge(candidate.type(), 1, Integer::sum);
            candidates.add(candidate);
          }
      }
    }

    int itemsScanned = analyses.size();
    int itemsSkipped = skipped;
    int[] insertFailures = new int[1];

    Future<Integer> chain = Future.succeededFuture(0);
    for (AlertCandidate candidate : candidates) {
      chain = chain.compose(created -> alertStore.insertAlertIfAbsent(candidate, detectedAt)
        .map(inserted -> inserted ? created + 1 : created)
        .recover(err -> {
          log.warn("Failed to store {} alert for item {}: {}",
            candidate.type().getValue(), candidate.itemId(), err.getMessage());
          insertFailures[0]++;
          return Future.succeededFuture(created);
        }));
    }

    int itemsFailed = failed;
    return chain.map(created -> {
      DetectionSummary summary = new DetectionSummary(true, itemsScanned, itemsSkipped,
        itemsFailed + insertFailures[0], candidatesByType, created);
      log.info("Detection cycle finished: {} items scanned, {} skipped, {} failed, {} candidates, {} new alerts",
        summary.itemsScanned(), summary.itemsSkipped(), summary.itemsFailed(),
        summary.totalCandidates(), summary.alertsCreated());
      return summary;
    });
  }

  /**
   * Per-item result of a detection cycle.
   */
  record ItemAnalysis(long itemId, Outcome outcome, List<AlertCandidate> candidates) {

    enum Outcome { ANALYZED, SKIPPED, FAILED }

    static ItemAnalysis analyzed(long itemId, List<AlertCandidate> candidates) {
      return new ItemAnalysis(itemId, Outcome.ANALYZED, List.copyOf(candidates));
    }

    static ItemAnalysis skipped(long itemId) {
      return new ItemAnalysis(itemId, Outcome.SKIPPED, List.of());
    }

    static ItemAnalysis failed(long itemId) {
      return new ItemAnalysis(itemId, Outcome.FAILED, List.of());
    }
  }
}
