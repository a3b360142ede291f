package io.github.themoah.breakout.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.breakout.config.DetectionConfig;
import io.github.themoah.breakout.config.IngestionConfig;
import io.github.themoah.breakout.model.Item;
import io.github.themoah.breakout.model.ItemObservation;
import io.github.themoah.breakout.model.ItemType;
import io.github.themoah.breakout.model.Snapshot;
import io.github.themoah.breakout.store.InMemoryBreakoutStore;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for IngestionService.
 */
@ExtendWith(VertxExtension.class)
public class IngestionServiceTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private InMemoryBreakoutStore store;
  private IngestionService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryBreakoutStore();
    service = newService(Clock.fixed(NOW, ZoneOffset.UTC), new IngestionConfig(200));
  }

  private IngestionService newService(Clock clock, IngestionConfig config) {
    return new IngestionService(store, config, DetectionConfig.defaults(), clock);
  }

  private static ItemObservation observation(long id, String title, Duration age, int score, int comments) {
    return new ItemObservation(id, title, null, "author", "story", NOW.minus(age), score, comments, false, false);
  }

  @Test
  void ingest_createsItemsAndSnapshots(VertxTestContext ctx) throws Exception {
    List<ItemObservation> batch = List.of(
      observation(1, "Ask HN: How do you test?", Duration.ofSeconds(10 * 60 + 59), 12, 3),
      observation(2, "A story", Duration.ofHours(3), 150, 40)
    );

    service.ingest(batch)
      .compose(summary -> store.findItems(List.of(1L, 2L))
        .compose(items -> store.findRecentSnapshots(1, 5).map(snapshots -> {
          ctx.verify(() -> {
            assertEquals(2, summary.received());
            assertEquals(0, summary.rejected());
            assertEquals(2, summary.itemsUpserted());
            assertEquals(2, summary.activeItems());
            assertEquals(2, summary.snapshotsCreated());

            Item ask = items.get(1L);
            assertEquals(ItemType.ASK, ask.type());
            assertEquals(NOW.minusSeconds(659), ask.firstSeenAt());

            Snapshot snapshot = snapshots.get(0);
            assertEquals(12, snapshot.score());
            assertEquals(3, snapshot.commentCount());
            assertEquals(NOW, snapshot.capturedAt());
            assertEquals(10, snapshot.ageMinutes());
          });
          return snapshots;
        })))
      .onComplete(ctx.succeeding(v -> ctx.completeNow()));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void ingest_rejectsInvalidObservations(VertxTestContext ctx) throws Exception {
    List<ItemObservation> batch = List.of(
      observation(0, "No id", Duration.ofMinutes(5), 1, 0),
      observation(2, " ", Duration.ofMinutes(5), 1, 0),
      new ItemObservation(3, "No author", null, null, "story", NOW, 1, 0, false, false),
      observation(4, "Negative", Duration.ofMinutes(5), -2, 0),
      observation(5, "Fine", Duration.ofMinutes(5), 1, 0)
    );

    service.ingest(batch)
      .onComplete(ctx.succeeding(summary -> ctx.verify(() -> {
        assertEquals(5, summary.received());
        assertEquals(4, summary.rejected());
        assertEquals(1, summary.itemsUpserted());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void ingest_capsBatchSize(VertxTestContext ctx) throws Exception {
    IngestionService capped = newService(Clock.fixed(NOW, ZoneOffset.UTC), new IngestionConfig(2));
    List<ItemObservation> batch = List.of(
      observation(1, "One", Duration.ofMinutes(5), 1, 0),
      observation(2, "Two", Duration.ofMinutes(5), 1, 0),
      observation(3, "Three", Duration.ofMinutes(5), 1, 0)
    );

    capped.ingest(batch)
      .compose(summary -> store.countItems().map(count -> {
        ctx.verify(() -> {
          assertEquals(1, summary.rejected());
          assertEquals(2, summary.itemsUpserted());
          assertEquals(2L, count);
        });
        return count;
      }))
      .onComplete(ctx.succeeding(v -> ctx.completeNow()));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void ingest_inactiveItemsGetNoSnapshot(VertxTestContext ctx) throws Exception {
    List<ItemObservation> batch = List.of(
      observation(1, "Old", Duration.ofHours(49), 500, 100),
      new ItemObservation(2, "Dead", null, "author", "story", NOW.minusSeconds(60), 1, 0, true, false)
    );

    service.ingest(batch)
      .onComplete(ctx.succeeding(summary -> ctx.verify(() -> {
        assertEquals(2, summary.itemsUpserted());
        assertEquals(0, summary.activeItems());
        assertEquals(0, summary.snapshotsCreated());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void ingest_repeatedCaptureTimeIsIgnored(VertxTestContext ctx) throws Exception {
    List<ItemObservation> first = List.of(observation(1, "Story", Duration.ofMinutes(5), 10, 0));
    List<ItemObservation> second = List.of(observation(1, "Story (edited)", Duration.ofMinutes(5), 20, 0));
    IngestionService later = newService(Clock.fixed(NOW.plusSeconds(300), ZoneOffset.UTC), new IngestionConfig(200));

    service.ingest(first)
      .compose(s1 -> service.ingest(second))
      .compose(s2 -> later.ingest(second).map(s3 -> List.of(s2, s3)))
      .compose(summaries -> store.findRecentSnapshots(1, 5).compose(snapshots -> store.findItems(List.of(1L))
        .map(items -> {
          ctx.verify(() -> {
            assertEquals(0, summaries.get(0).snapshotsCreated());
            assertEquals(1, summaries.get(1).snapshotsCreated());
            assertEquals(2, snapshots.size());
            assertEquals(20, snapshots.get(0).score());
            assertEquals(10, snapshots.get(0).ageMinutes());
            assertEquals("Story (edited)", items.get(1L).title());
          });
          return items;
        })))
      .onComplete(ctx.succeeding(v -> ctx.completeNow()));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void observation_fromJson() {
    JsonObject json = new JsonObject()
      .put("id", 42)
      .put("title", "Show HN: A thing")
      .put("author", "pg")
      .put("createdAt", NOW.getEpochSecond())
      .put("score", 7)
      .put("comments", 2);

    ItemObservation observation = ItemObservation.fromJson(json);

    assertEquals(42L, observation.id());
    assertEquals("story", observation.type());
    assertEquals(NOW, observation.createdAt());
    assertEquals(7, observation.score());
    assertTrue(observation.isValid());
    assertEquals(ItemType.SHOW, IngestionService.toItem(observation, NOW).type());
  }

  @Test
  void ageMinutes_floorsAndClamps() {
    assertEquals(0, IngestionService.ageMinutes(NOW.plusSeconds(120), NOW));
    assertEquals(1, IngestionService.ageMinutes(NOW.minusSeconds(119), NOW));
  }
}
