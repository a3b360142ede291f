package io.github.themoah.breakout.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.breakout.analysis.benchmark.BenchmarkService;
import io.github.themoah.breakout.analysis.detect.BreakoutDetector;
import io.github.themoah.breakout.config.BenchmarkConfig;
import io.github.themoah.breakout.config.DetectionConfig;
import io.github.themoah.breakout.config.IngestionConfig;
import io.github.themoah.breakout.ingest.IngestionService;
import io.github.themoah.breakout.metrics.PipelineMetrics;
import io.github.themoah.breakout.model.ItemObservation;
import io.github.themoah.breakout.pipeline.Stage;
import io.github.themoah.breakout.pipeline.StageLock;
import io.github.themoah.breakout.store.InMemoryBreakoutStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for request parsing and authorization in CycleHandler.
 */
@ExtendWith(VertxExtension.class)
public class CycleHandlerTest {

  private final CycleHandler handler = new CycleHandler(null, null, null, null, null, null, "s3cret");

  @Test
  void matchesSecret_requiresExactBearerToken() {
    assertTrue(handler.matchesSecret("Bearer s3cret"));

    assertFalse(handler.matchesSecret(null));
    assertFalse(handler.matchesSecret("s3cret"));
    assertFalse(handler.matchesSecret("Bearer s3cre"));
    assertFalse(handler.matchesSecret("Bearer s3cret "));
    assertFalse(handler.matchesSecret("bearer s3cret"));
  }

  @Test
  void parseObservations_readsEachObject() {
    JsonArray body = new JsonArray()
      .add(new JsonObject().put("id", 1).put("title", "First").put("author", "a")
        .put("createdAt", 1714564800L).put("score", 3).put("comments", 1).put("url", "https://example.com"))
      .add(new JsonObject().put("id", 2).put("title", "Poll").put("author", "b").put("type", "poll")
        .put("createdAt", 1714564800L).put("dead", true));

    List<ItemObservation> observations = CycleHandler.parseObservations(body);

    assertEquals(2, observations.size());
    assertEquals("https://example.com", observations.get(0).url());
    assertEquals(3, observations.get(0).score());
    assertEquals("poll", observations.get(1).type());
    assertEquals(0, observations.get(1).score());
    assertNull(observations.get(1).url());
    assertTrue(observations.get(1).dead());
  }

  @Test
  void parseObservations_outOfRangeCreatedAtIsInvalid() {
    JsonArray body = new JsonArray()
      .add(new JsonObject().put("id", 1).put("title", "t").put("author", "a").put("createdAt", Long.MAX_VALUE))
      .add(new JsonObject().put("id", 2).put("title", "t").put("author", "a").put("createdAt", Long.MIN_VALUE));

    List<ItemObservation> observations = CycleHandler.parseObservations(body);

    assertEquals(2, observations.size());
    assertNull(observations.get(0).createdAt());
    assertFalse(observations.get(0).isValid());
    assertFalse(observations.get(1).isValid());
  }

  @Test
  void parseObservations_rejectsMalformedBodies() {
    assertThrows(DecodeException.class, () -> CycleHandler.parseObservations(null));
    assertThrows(ClassCastException.class, () -> CycleHandler.parseObservations(new JsonArray().add("not an object")));
  }

  @Test
  void ingestAndDetect_busyDetectionKeepsIngestionSummary(Vertx vertx, VertxTestContext ctx) throws Exception {
    Clock clock = Clock.systemUTC();
    InMemoryBreakoutStore store = new InMemoryBreakoutStore();
    BenchmarkService benchmarks = new BenchmarkService(store, store, BenchmarkConfig.defaults(), clock);
    IngestionService ingestion = new IngestionService(store, IngestionConfig.defaults(), DetectionConfig.defaults(), clock);
    BreakoutDetector detector = new BreakoutDetector(store, store, benchmarks, DetectionConfig.defaults(), clock);
    StageLock stageLock = new StageLock(vertx, 50);
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    CycleHandler busyHandler = new CycleHandler(ingestion, detector, benchmarks, null, stageLock,
      new PipelineMetrics(registry), "s3cret");

    Promise<Void> runningDetection = Promise.promise();
    stageLock.runExclusively(Stage.DETECT, runningDetection::future);

    ItemObservation observation = new ItemObservation(1, "Story", null, "a", "story",
      Instant.now().minusSeconds(300), 4, 0, false, false);

    busyHandler.ingestAndDetect(List.of(observation))
      .onComplete(ctx.succeeding(payload -> ctx.verify(() -> {
        assertEquals(1, payload.getJsonObject("ingestion").getInteger("snapshots_created"));
        JsonObject detection = payload.getJsonObject("detection");
        assertTrue(detection.getBoolean("skipped"));
        assertEquals("busy", detection.getString("reason"));
        assertEquals(1.0, registry.get("breakout.stage.rejected").tag("stage", "detect").counter().count());
        runningDetection.complete();
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }
}
