package io.github.themoah.breakout.stats;

import io.github.themoah.breakout.config.DetectionConfig;
import io.github.themoah.breakout.config.DigestConfig;
import io.github.themoah.breakout.store.AlertStore;
import io.github.themoah.breakout.store.DigestStore;
import io.github.themoah.breakout.store.SnapshotStore;
import io.vertx.core.Future;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Collects {@link PipelineStats} from the stores.
 */
public class StatsService {

  static final Duration INGESTION_FRESHNESS = Duration.ofMinutes(10);

  private final SnapshotStore snapshotStore;
  private final AlertStore alertStore;
  private final DigestStore digestStore;
  private final DetectionConfig detectionConfig;
  private final DigestConfig digestConfig;
  private final Clock clock;

  public StatsService(
    SnapshotStore snapshotStore,
    AlertStore alertStore,
    DigestStore digestStore,
    DetectionConfig detectionConfig,
    DigestConfig digestConfig,
    Clock clock
  ) {
    this.snapshotStore = snapshotStore;
    this.alertStore = alertStore;
    this.digestStore = digestStore;
    this.detectionConfig = detectionConfig;
    this.digestConfig = digestConfig;
    this.clock = clock;
  }

  public Future<PipelineStats> collect() {
    Instant now = clock.instant();
    Instant startOfDay = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();

    Future<Long> itemsTotal = snapshotStore.countItems();
    Future<Long> itemsActive = snapshotStore.findActiveItems(now.minus(detectionConfig.activeWindow()))
      .map(items -> (long) items.size());
    Future<Long> snapshotsTotal = snapshotStore.countSnapshotsCapturedSince(Instant.EPOCH);
    Future<Long> snapshotsToday = snapshotStore.countSnapshotsCapturedSince(startOfDay);
    Future<Long> alertsTotal = alertStore.countAlertsDetectedSince(Instant.EPOCH);
    Future<Long> alertsLast24h = alertStore.countAlertsDetectedSince(now.minus(Duration.ofHours(24)));
    Future<Long> alertsUnsent = alertStore.countUnsentAlerts();
    Future<Long> digestsToday = digestStore.countDigestsSentSince(startOfDay);
    Future<Optional<Instant>> lastCapture = snapshotStore.latestCaptureTime();

    List<Future<?>> all = List.of(itemsTotal, itemsActive, snapshotsTotal, snapshotsToday, alertsTotal,
      alertsLast24h, alertsUnsent, digestsToday, lastCapture);

    return Future.all(all)
      .map(v -> {
        Instant latest = lastCapture.result().orElse(null);
        boolean healthy = latest != null && Duration.between(latest, now).compareTo(INGESTION_FRESHNESS) < 0;
        return new PipelineStats(
          itemsTotal.result(),
          itemsActive.result(),
          snapshotsTotal.result(),
          snapshotsToday.result(),
          alertsTotal.result(),
          alertsLast24h.result(),
          alertsUnsent.result(),
          digestsToday.result(),
          digestConfig.maxDigestsPerDay(),
          latest,
          healthy
        );
      });
  }
}
