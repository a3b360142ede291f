package io.github.themoah.breakout.store;

import io.github.themoah.breakout.model.Alert;
import io.github.themoah.breakout.model.AlertCandidate;
import io.github.themoah.breakout.model.Benchmark;
import io.github.themoah.breakout.model.DeliveryStatus;
import io.github.themoah.breakout.model.Digest;
import io.github.themoah.breakout.model.Item;
import io.github.themoah.breakout.model.Snapshot;
import io.vertx.core.Future;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe in-memory implementation of all store contracts.
 *
 * <p>Enforces the same constraints a relational schema would: unique (item, capturedAt)
 * snapshots, unique (item, type) alerts, unique (bucket, metric) benchmarks. Every
 * operation runs under the instance monitor, so multi-row updates such as
 * {@link #markAlertsSentForItems(Collection)} apply atomically.
 *
 * TODO: Add a Postgres-backed implementation on vertx-pg-client so history survives restarts.
 */
public class InMemoryBreakoutStore implements SnapshotStore, BenchmarkStore, AlertStore, DigestStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryBreakoutStore.class);

  private final Map<Long, Item> items = new HashMap<>();
  private final Map<Long, NavigableMap<Instant, Snapshot>> snapshotsByItem = new HashMap<>();
  private final Map<String, Benchmark> benchmarks = new LinkedHashMap<>();
  private final Map<Long, Alert> alerts = new LinkedHashMap<>();
  private final Map<String, Long> alertIdsByKey = new HashMap<>();
  private final Map<Long, Digest> digests = new LinkedHashMap<>();

  private long nextAlertId = 1;
  private long nextDigestId = 1;

  // ---- items and snapshots ----

  @Override
  public synchronized Future<Void> upsertItem(Item item) {
    items.merge(item.id(), item, (existing, update) -> new Item(
      existing.id(),
      update.title(),
      update.url(),
      existing.author(),
      existing.type(),
      existing.firstSeenAt(),
      update.lastUpdatedAt(),
      update.dead(),
      update.deleted()
    ));
    return Future.succeededFuture();
  }

  @Override
  public synchronized Future<Map<Long, Item>> findItems(Collection<Long> itemIds) {
    Map<Long, Item> result = new HashMap<>();
    for (Long id : itemIds) {
      Item item = items.get(id);
      if (item != null) {
        result.put(id, item);
      }
    }
    return Future.succeededFuture(result);
  }

  @Override
  public synchronized Future<List<Item>> findActiveItems(Instant firstSeenSince) {
    List<Item> active = items.values().stream()
      .filter(item -> item.isActiveSince(firstSeenSince))
      .sorted(Comparator.comparing(Item::firstSeenAt).reversed())
      .collect(Collectors.toList());
    return Future.succeededFuture(active);
  }

  @Override
  public synchronized Future<Long> countItems() {
    return Future.succeededFuture((long) items.size());
  }

  @Override
  public synchronized Future<Boolean> insertSnapshot(Snapshot snapshot) {
    if (!items.containsKey(snapshot.itemId())) {
      return Future.failedFuture(new StoreException("Unknown item for snapshot: " + snapshot.itemId()));
    }

    NavigableMap<Instant, Snapshot> series = snapshotsByItem
      .computeIfAbsent(snapshot.itemId(), k -> new TreeMap<>());

    if (!series.isEmpty() && !snapshot.capturedAt().isAfter(series.lastKey())) {
      log.trace("Ignoring snapshot for item {} at {} - series already at {}",
        snapshot.itemId(), snapshot.capturedAt(), series.lastKey());
      return Future.succeededFuture(false);
    }

    series.put(snapshot.capturedAt(), snapshot);
    return Future.succeededFuture(true);
  }

  @Override
  public synchronized Future<List<Snapshot>> findRecentSnapshots(long itemId, int limit) {
    NavigableMap<Instant, Snapshot> series = snapshotsByItem.get(itemId);
    if (series == null) {
      return Future.succeededFuture(List.of());
    }
    List<Snapshot> recent = series.descendingMap().values().stream()
      .limit(limit)
      .collect(Collectors.toList());
    return Future.succeededFuture(recent);
  }

  @Override
  public synchronized Future<List<Snapshot>> findSnapshotsCapturedSince(Instant since) {
    List<Snapshot> result = new ArrayList<>();
    snapshotsByItem.keySet().stream().sorted().forEach(itemId ->
      result.addAll(snapshotsByItem.get(itemId).tailMap(since, true).values()));
    return Future.succeededFuture(result);
  }

  @Override
  public synchronized Future<Long> countSnapshotsCapturedSince(Instant since) {
    long count = 0;
    for (NavigableMap<Instant, Snapshot> series : snapshotsByItem.values()) {
      count += series.tailMap(since, true).size();
    }
    return Future.succeededFuture(count);
  }

  @Override
  public synchronized Future<Optional<Instant>> latestCaptureTime() {
    Optional<Instant> latest = snapshotsByItem.values().stream()
      .filter(series -> !series.isEmpty())
      .map(NavigableMap::lastKey)
      .max(Comparator.naturalOrder());
    return Future.succeededFuture(latest);
  }

  // ---- benchmarks ----

  @Override
  public synchronized Future<List<Benchmark>> findAllBenchmarks() {
    return Future.succeededFuture(new ArrayList<>(benchmarks.values()));
  }

  @Override
  public synchronized Future<Void> upsertBenchmark(Benchmark benchmark) {
    benchmarks.put(benchmark.key(), benchmark);
    return Future.succeededFuture();
  }

  @Override
  public synchronized Future<Boolean> insertBenchmarkIfAbsent(Benchmark benchmark) {
    return Future.succeededFuture(benchmarks.putIfAbsent(benchmark.key(), benchmark) == null);
  }

  // ---- alerts ----

  @Override
  public synchronized Future<Boolean> insertAlertIfAbsent(AlertCandidate candidate, Instant detectedAt) {
    if (!items.containsKey(candidate.itemId())) {
      return Future.failedFuture(new StoreException("Unknown item for alert: " + candidate.itemId()));
    }

    String key = makeAlertKey(candidate.itemId(), candidate.type().getValue());
    if (alertIdsByKey.containsKey(key)) {
      return Future.succeededFuture(false);
    }

    long id = nextAlertId++;
    alerts.put(id, Alert.fromCandidate(id, candidate, detectedAt));
    alertIdsByKey.put(key, id);
    return Future.succeededFuture(true);
  }

  @Override
  public synchronized Future<List<Alert>> findUnsentAlerts(Instant detectedSince, int limit) {
    Set<Long> itemsAlreadySent = alerts.values().stream()
      .filter(Alert::sent)
      .map(Alert::itemId)
      .collect(Collectors.toSet());

    List<Alert> unsent = alerts.values().stream()
      .filter(alert -> !alert.sent())
      .filter(alert -> !alert.detectedAt().isBefore(detectedSince))
      .filter(alert -> !itemsAlreadySent.contains(alert.itemId()))
      .sorted(Comparator.comparingDouble(Alert::percentile).reversed()
        .thenComparing(Comparator.comparing(Alert::detectedAt).reversed()))
      .limit(limit)
      .collect(Collectors.toList());
    return Future.succeededFuture(unsent);
  }

  @Override
  public synchronized Future<Integer> markAlertsSentForItems(Collection<Long> alertIds) {
    Set<Long> itemIds = new HashSet<>();
    for (Long alertId : alertIds) {
      Alert alert = alerts.get(alertId);
      if (alert != null) {
        itemIds.add(alert.itemId());
      }
    }

    int marked = 0;
    for (Map.Entry<Long, Alert> entry : alerts.entrySet()) {
      Alert alert = entry.getValue();
      if (!alert.sent() && itemIds.contains(alert.itemId())) {
        entry.setValue(alert.markSent());
        marked++;
      }
    }
    return Future.succeededFuture(marked);
  }

  @Override
  public synchronized Future<List<Alert>> findAlertsForItem(long itemId) {
    List<Alert> result = alerts.values().stream()
      .filter(alert -> alert.itemId() == itemId)
      .collect(Collectors.toList());
    return Future.succeededFuture(result);
  }

  @Override
  public synchronized Future<List<Alert>> findAlertsDetectedSince(Instant since, int limit) {
    List<Alert> result = alerts.values().stream()
      .filter(alert -> !alert.detectedAt().isBefore(since))
      .sorted(Comparator.comparing(Alert::detectedAt).reversed()
        .thenComparing(Comparator.comparingLong(Alert::id).reversed()))
      .limit(limit)
      .collect(Collectors.toList());
    return Future.succeededFuture(result);
  }

  @Override
  public synchronized Future<Long> countAlertsDetectedSince(Instant since) {
    long count = alerts.values().stream()
      .filter(alert -> !alert.detectedAt().isBefore(since))
      .count();
    return Future.succeededFuture(count);
  }

  @Override
  public synchronized Future<Long> countUnsentAlerts() {
    return Future.succeededFuture(alerts.values().stream().filter(alert -> !alert.sent()).count());
  }

  // ---- digests ----

  @Override
  public synchronized Future<Digest> insertDigest(Digest digest) {
    Digest stored = digest.withId(nextDigestId++);
    digests.put(stored.id(), stored);
    return Future.succeededFuture(stored);
  }

  @Override
  public synchronized Future<Void> updateDigestStatus(long digestId, DeliveryStatus status, String errorMessage) {
    Digest digest = digests.get(digestId);
    if (digest == null) {
      return Future.failedFuture(new StoreException("Unknown digest: " + digestId));
    }
    digests.put(digestId, digest.withStatus(status, errorMessage));
    return Future.succeededFuture();
  }

  @Override
  public synchronized Future<Long> countDigestsSentSince(Instant since) {
    return Future.succeededFuture((long) digestsSentSince(since).size());
  }

  @Override
  public synchronized Future<List<Digest>> findDigestsSentSince(Instant since) {
    return Future.succeededFuture(digestsSentSince(since));
  }

  private List<Digest> digestsSentSince(Instant since) {
    return digests.values().stream()
      .filter(digest -> !digest.sentAt().isBefore(since))
      .collect(Collectors.toList());
  }

  /**
   * Creates a key for the alert uniqueness index.
   *
   * @return the key in format "itemId:alertType"
   */
  static String makeAlertKey(long itemId, String alertType) {
    return itemId + ":" + alertType;
  }
}
