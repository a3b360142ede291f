package io.github.themoah.breakout.ingest;

import io.github.themoah.breakout.config.DetectionConfig;
import io.github.themoah.breakout.config.IngestionConfig;
import io.github.themoah.breakout.model.IngestionSummary;
import io.github.themoah.breakout.model.Item;
import io.github.themoah.breakout.model.ItemObservation;
import io.github.themoah.breakout.model.ItemType;
import io.github.themoah.breakout.model.Snapshot;
import io.github.themoah.breakout.store.SnapshotStore;
import io.vertx.core.Future;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns pushed observations into item rows and snapshots.
 *
 * <p>All snapshots of one batch share the same capture time ("now"), so the snapshot series
 * of every item advances by at most one point per batch.
 */
public class IngestionService {

  private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

  private final SnapshotStore snapshotStore;
  private final IngestionConfig config;
  private final Duration activeWindow;
  private final Clock clock;

  public IngestionService(
    SnapshotStore snapshotStore,
    IngestionConfig config,
    DetectionConfig detectionConfig,
    Clock clock
  ) {
    this.snapshotStore = snapshotStore;
    this.config = config;
    this.activeWindow = detectionConfig.activeWindow();
    this.clock = clock;
  }

  /**
   * Ingests one batch.
   *
   * @param observations observations in upstream order; later duplicates of an id win
   * @return Future with the ingestion summary
   */
  public Future<IngestionSummary> ingest(List<ItemObservation> observations) {
    Instant now = clock.instant();

    Map<Long, ItemObservation> accepted = new LinkedHashMap<>();
    int invalid = 0;
    int dropped = 0;
    for (ItemObservation observation : observations) {
      if (!observation.isValid()) {
        invalid++;
        continue;
      }
      if (accepted.size() >= config.maxItemsPerBatch() && !accepted.containsKey(observation.id())) {
        dropped++;
        continue;
      }
      accepted.put(observation.id(), observation);
    }

    int received = observations.size();
    if (dropped > 0) {
      log.warn("Ingestion batch exceeds {} items, dropped {} observations", config.maxItemsPerBatch(), dropped);
    }
    int rejected = invalid + dropped;

    List<Future<Void>> upserts = new ArrayList<>(accepted.size());
    for (ItemObservation observation : accepted.values()) {
      upserts.add(snapshotStore.upsertItem(toItem(observation, now)));
    }

    return Future.all(upserts)
      .compose(v -> snapshotStore.findItems(accepted.keySet()))
      .compose(items -> appendSnapshots(accepted, items, now)
        .map(counts -> {
          IngestionSummary summary = new IngestionSummary(received, rejected, accepted.size(), counts[0], counts[1]);
          log.info("Ingested {} observations: {} rejected, {} items upserted, {} active, {} snapshots created",
            received, rejected, summary.itemsUpserted(), summary.activeItems(), summary.snapshotsCreated());
          return summary;
        }));
  }

  /**
   * Returns {active items, snapshots created}.
   */
  private Future<int[]> appendSnapshots(Map<Long, ItemObservation> accepted, Map<Long, Item> items, Instant now) {
    Instant activeSince = now.minus(activeWindow);
    List<Future<Boolean>> inserts = new ArrayList<>();

    for (ItemObservation observation : accepted.values()) {
      Item item = items.get(observation.id());
      if (item == null || !item.isActiveSince(activeSince)) {
        continue;
      }
      inserts.add(snapshotStore.insertSnapshot(new Snapshot(
        item.id(),
        observation.score(),
        observation.comments(),
        now,
        ageMinutes(item.firstSeenAt(), now)
      )));
    }

    return Future.all(inserts)
      .map(composite -> {
        int created = 0;
        for (int i = 0; i < composite.size(); i++) {
          if (Boolean.TRUE.equals(composite.resultAt(i))) {
            created++;
          }
        }
        return new int[] {inserts.size(), created};
      });
  }

  static Item toItem(ItemObservation observation, Instant now) {
    return new Item(
      observation.id(),
      observation.title(),
      observation.url(),
      observation.author(),
      ItemType.classify(observation.type(), observation.title()),
      observation.createdAt(),
      now,
      observation.dead(),
      observation.deleted()
    );
  }

  /**
   * Whole minutes between creation and capture, never negative.
   */
  static int ageMinutes(Instant firstSeenAt, Instant capturedAt) {
    long minutes = Duration.between(firstSeenAt, capturedAt).toMinutes();
    return (int) Math.max(0, Math.min(minutes, Integer.MAX_VALUE));
  }
}
