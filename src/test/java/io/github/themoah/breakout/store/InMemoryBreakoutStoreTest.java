package io.github.themoah.breakout.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.breakout.model.Alert;
import io.github.themoah.breakout.model.AlertCandidate;
import io.github.themoah.breakout.model.AlertType;
import io.github.themoah.breakout.model.DeliveryStatus;
import io.github.themoah.breakout.model.Digest;
import io.github.themoah.breakout.model.DigestType;
import io.github.themoah.breakout.model.Item;
import io.github.themoah.breakout.model.ItemType;
import io.github.themoah.breakout.model.Snapshot;
import io.vertx.core.Future;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for InMemoryBreakoutStore. Every operation completes synchronously.
 */
public class InMemoryBreakoutStoreTest {

  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  private InMemoryBreakoutStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryBreakoutStore();
    for (long id = 1; id <= 3; id++) {
      store.upsertItem(item(id, "Item " + id));
    }
  }

  private static Item item(long id, String title) {
    return new Item(id, title, null, "author" + id, ItemType.STORY, T0, T0, false, false);
  }

  private static AlertCandidate candidate(long itemId, AlertType type, double percentile) {
    return new AlertCandidate(itemId, type, percentile, 2.0, 30, 5, 10);
  }

  private static <T> T await(Future<T> future) {
    assertTrue(future.succeeded(), () -> "future failed: " + future.cause());
    return future.result();
  }

  private List<Long> unsentItemIds(Instant since) {
    return await(store.findUnsentAlerts(since, 100)).stream().map(Alert::itemId).collect(Collectors.toList());
  }

  @Test
  void upsertItem_keepsIdentityFieldsAndUpdatesMutableOnes() {
    Item update = new Item(1, "Renamed", "https://example.com", "someone-else", ItemType.JOB,
      T0.plusSeconds(600), T0.plusSeconds(600), true, false);

    await(store.upsertItem(update));
    Item stored = await(store.findItems(List.of(1L))).get(1L);

    assertEquals("Renamed", stored.title());
    assertEquals("https://example.com", stored.url());
    assertEquals("author1", stored.author());
    assertEquals(ItemType.STORY, stored.type());
    assertEquals(T0, stored.firstSeenAt());
    assertEquals(T0.plusSeconds(600), stored.lastUpdatedAt());
    assertTrue(stored.dead());
  }

  @Test
  void insertSnapshot_rejectsOutOfOrderAndDuplicateCaptures() {
    assertTrue(await(store.insertSnapshot(new Snapshot(1, 10, 0, T0.plusSeconds(60), 1))));
    assertFalse(await(store.insertSnapshot(new Snapshot(1, 12, 0, T0.plusSeconds(60), 1))));
    assertFalse(await(store.insertSnapshot(new Snapshot(1, 12, 0, T0, 0))));
    assertTrue(await(store.insertSnapshot(new Snapshot(1, 15, 1, T0.plusSeconds(120), 2))));

    List<Snapshot> recent = await(store.findRecentSnapshots(1, 5));
    assertEquals(2, recent.size());
    assertEquals(15, recent.get(0).score());
    assertEquals(10, recent.get(1).score());
    assertEquals(Optional.of(T0.plusSeconds(120)), await(store.latestCaptureTime()));
  }

  @Test
  void insertSnapshot_unknownItemFails() {
    Future<Boolean> result = store.insertSnapshot(new Snapshot(99, 1, 0, T0, 0));

    assertTrue(result.failed());
    assertTrue(result.cause() instanceof StoreException);
  }

  @Test
  void insertAlertIfAbsent_firstDetectionWins() {
    assertTrue(await(store.insertAlertIfAbsent(candidate(1, AlertType.SCORE_VELOCITY, 96), T0)));
    assertFalse(await(store.insertAlertIfAbsent(candidate(1, AlertType.SCORE_VELOCITY, 99.9), T0.plusSeconds(60))));
    assertTrue(await(store.insertAlertIfAbsent(candidate(1, AlertType.BREAKTHROUGH, 96), T0)));

    List<Alert> alerts = await(store.findAlertsForItem(1));
    assertEquals(2, alerts.size());
    Alert score = alerts.stream().filter(a -> a.type() == AlertType.SCORE_VELOCITY).findFirst().orElseThrow();
    assertEquals(96, score.percentile());
    assertEquals(T0, score.detectedAt());
  }

  @Test
  void findUnsentAlerts_ordersByPercentileThenRecency() {
    await(store.insertAlertIfAbsent(candidate(1, AlertType.SCORE_VELOCITY, 96), T0));
    await(store.insertAlertIfAbsent(candidate(2, AlertType.SCORE_VELOCITY, 99), T0));
    await(store.insertAlertIfAbsent(candidate(3, AlertType.SCORE_VELOCITY, 96), T0.plusSeconds(60)));

    assertEquals(List.of(2L, 3L, 1L), unsentItemIds(T0));
    assertEquals(1, await(store.findUnsentAlerts(T0, 1)).size());
  }

  @Test
  void findUnsentAlerts_respectsWindow() {
    await(store.insertAlertIfAbsent(candidate(1, AlertType.SCORE_VELOCITY, 96), T0));
    await(store.insertAlertIfAbsent(candidate(2, AlertType.SCORE_VELOCITY, 96), T0.plusSeconds(3600)));

    assertEquals(List.of(2L), unsentItemIds(T0.plusSeconds(1800)));
  }

  @Test
  void markSent_excludesItemForeverAcrossTypes() {
    await(store.insertAlertIfAbsent(candidate(1, AlertType.SCORE_VELOCITY, 97), T0));
    await(store.insertAlertIfAbsent(candidate(1, AlertType.COMMENT_VELOCITY, 96), T0));
    await(store.insertAlertIfAbsent(candidate(2, AlertType.SCORE_VELOCITY, 95), T0));

    Alert scoreAlert = await(store.findAlertsForItem(1)).stream()
      .filter(a -> a.type() == AlertType.SCORE_VELOCITY).findFirst().orElseThrow();

    // Only the score alert is passed in, but both alerts of item 1 flip
    assertEquals(2, await(store.markAlertsSentForItems(List.of(scoreAlert.id()))));
    assertTrue(await(store.findAlertsForItem(1)).stream().allMatch(Alert::sent));
    assertEquals(List.of(2L), unsentItemIds(T0));

    // A later alert of a third type never makes the item eligible again
    await(store.insertAlertIfAbsent(candidate(1, AlertType.BREAKTHROUGH, 99.9), T0.plusSeconds(3600)));
    assertEquals(List.of(2L), unsentItemIds(T0));
    assertEquals(2L, await(store.countUnsentAlerts()));
  }

  @Test
  void markSent_unknownAlertIdsAreIgnored() {
    assertEquals(0, await(store.markAlertsSentForItems(List.of(42L))));
  }

  @Test
  void digests_countSinceAndStatusUpdate() {
    Digest first = await(store.insertDigest(Digest.pending(List.of(1L, 2L), DigestType.HOURLY, T0)));
    Digest second = await(store.insertDigest(Digest.pending(List.of(3L), DigestType.URGENT, T0.plusSeconds(3600))));

    assertEquals(1L, first.id());
    assertEquals(2L, second.id());
    assertEquals(DeliveryStatus.PENDING, first.status());
    assertEquals(2L, await(store.countDigestsSentSince(T0)));
    assertEquals(1L, await(store.countDigestsSentSince(T0.plusSeconds(1))));

    await(store.updateDigestStatus(first.id(), DeliveryStatus.FAILED, "smtp down"));
    Digest updated = await(store.findDigestsSentSince(T0)).get(0);
    assertEquals(DeliveryStatus.FAILED, updated.status());
    assertEquals("smtp down", updated.errorMessage());
    assertEquals(List.of(1L, 2L), updated.alertIds());
  }

  @Test
  void updateDigestStatus_unknownDigestFails() {
    assertTrue(store.updateDigestStatus(7, DeliveryStatus.SENT, null).failed());
  }

  @Test
  void findAlertsDetectedSince_newestFirst() {
    await(store.insertAlertIfAbsent(candidate(1, AlertType.SCORE_VELOCITY, 96), T0));
    await(store.insertAlertIfAbsent(candidate(2, AlertType.SCORE_VELOCITY, 99), T0.plusSeconds(60)));

    List<Alert> recent = await(store.findAlertsDetectedSince(T0, 10));

    assertEquals(List.of(2L, 1L), recent.stream().map(Alert::itemId).collect(Collectors.toList()));
  }
}
