package io.github.themoah.breakout.store;

import io.github.themoah.breakout.model.Item;
import io.github.themoah.breakout.model.Snapshot;
import io.vertx.core.Future;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Access patterns for items and their append-only snapshot time series.
 */
public interface SnapshotStore {

  /**
   * Inserts an item, or on conflict updates only its title, url, liveness flags and lastUpdatedAt.
   *
   * @param item the observed item
   * @return Future that completes when the row is written
   */
  Future<Void> upsertItem(Item item);

  /**
   * Looks up items by identity. Unknown ids are absent from the result.
   */
  Future<Map<Long, Item>> findItems(Collection<Long> itemIds);

  /**
   * Returns alive items first seen at or after the given instant, newest first.
   */
  Future<List<Item>> findActiveItems(Instant firstSeenSince);

  Future<Long> countItems();

  /**
   * Appends a snapshot. Ignored when the item already has a snapshot at the same
   * or a later capture time.
   *
   * @return Future with true if the snapshot was stored
   */
  Future<Boolean> insertSnapshot(Snapshot snapshot);

  /**
   * Returns the most recent snapshots of an item, newest first.
   *
   * @param itemId the item
   * @param limit maximum snapshots to return
   */
  Future<List<Snapshot>> findRecentSnapshots(long itemId, int limit);

  /**
   * Returns every snapshot captured at or after the given instant, ordered by item then capture time.
   */
  Future<List<Snapshot>> findSnapshotsCapturedSince(Instant since);

  Future<Long> countSnapshotsCapturedSince(Instant since);

  /**
   * Returns the capture time of the newest snapshot, if any.
   */
  Future<Optional<Instant>> latestCaptureTime();
}
