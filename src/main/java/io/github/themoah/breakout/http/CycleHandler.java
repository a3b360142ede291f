package io.github.themoah.breakout.http;

import io.github.themoah.breakout.analysis.benchmark.BenchmarkService;
import io.github.themoah.breakout.analysis.detect.BreakoutDetector;
import io.github.themoah.breakout.digest.DigestBatcher;
import io.github.themoah.breakout.ingest.IngestionService;
import io.github.themoah.breakout.metrics.PipelineMetrics;
import io.github.themoah.breakout.model.DetectionSummary;
import io.github.themoah.breakout.model.ItemObservation;
import io.github.themoah.breakout.pipeline.Stage;
import io.github.themoah.breakout.pipeline.StageBusyException;
import io.github.themoah.breakout.pipeline.StageLock;
import io.micrometer.core.instrument.Timer;
import io.vertx.core.Future;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trigger endpoints for the pipeline stages, called by the external scheduler.
 * Every route requires {@code Authorization: Bearer <CRON_SECRET>}.
 */
public class CycleHandler {

  private static final Logger log = LoggerFactory.getLogger(CycleHandler.class);

  private static final long MAX_BODY_BYTES = 1024 * 1024;
  private static final String BEARER_PREFIX = "Bearer ";

  private final IngestionService ingestionService;
  private final BreakoutDetector detector;
  private final BenchmarkService benchmarkService;
  private final DigestBatcher digestBatcher;
  private final StageLock stageLock;
  private final PipelineMetrics metrics;
  private final String cronSecret;

  public CycleHandler(
    IngestionService ingestionService,
    BreakoutDetector detector,
    BenchmarkService benchmarkService,
    DigestBatcher digestBatcher,
    StageLock stageLock,
    PipelineMetrics metrics,
    String cronSecret
  ) {
    this.ingestionService = ingestionService;
    this.detector = detector;
    this.benchmarkService = benchmarkService;
    this.digestBatcher = digestBatcher;
    this.stageLock = stageLock;
    this.metrics = metrics;
    this.cronSecret = cronSecret;
  }

  public void registerRoutes(Router router) {
    router.post("/cycles/ingest").handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES));
    router.post("/cycles/*").handler(this::authorize);
    router.post("/benchmarks/*").handler(this::authorize);

    router.post("/cycles/ingest").handler(this::handleIngest);
    router.post("/cycles/detect").handler(this::handleDetect);
    router.post("/cycles/benchmarks").handler(this::handleRecompute);
    router.post("/cycles/digest").handler(this::handleDigest);
    router.post("/benchmarks/seed").handler(this::handleSeed);
    log.info("Cycle routes registered: /cycles/{ingest,detect,benchmarks,digest}, /benchmarks/seed");
  }

  private void authorize(RoutingContext ctx) {
    if (cronSecret == null) {
      log.error("CRON_SECRET is not configured, rejecting {}", ctx.normalizedPath());
      JsonResponses.error(ctx, 500, "Server configuration error");
      return;
    }

    String header = ctx.request().getHeader(HttpHeaders.AUTHORIZATION);
    if (!matchesSecret(header)) {
      log.warn("Unauthorized request to {}", ctx.normalizedPath());
      JsonResponses.error(ctx, 401, "Unauthorized");
      return;
    }
    ctx.next();
  }

  boolean matchesSecret(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
      return false;
    }
    byte[] presented = authorizationHeader.substring(BEARER_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(presented, cronSecret.getBytes(StandardCharsets.UTF_8));
  }

  private void handleIngest(RoutingContext ctx) {
    List<ItemObservation> observations;
    try {
      observations = parseObservations(ctx.body().asJsonArray());
    } catch (DecodeException | ClassCastException e) {
      JsonResponses.error(ctx, 400, "Body must be a JSON array of observations");
      return;
    }

    ingestAndDetect(observations)
      .onSuccess(payload -> JsonResponses.ok(ctx, payload))
      .onFailure(err -> handleFailure(ctx, Stage.INGEST, err));
  }

  /**
   * Ingests a batch, then runs a detection cycle. Once ingestion has succeeded a busy
   * detection stage no longer fails the call: the payload keeps the ingestion summary and
   * marks detection as skipped.
   */
  Future<JsonObject> ingestAndDetect(List<ItemObservation> observations) {
    return stageLock.runExclusively(Stage.INGEST, () -> ingestionService.ingest(observations))
      .onSuccess(metrics::recordIngestion)
      .compose(ingestion -> runDetection()
        .map(DetectionSummary::toJson)
        .recover(err -> {
          if (err instanceof StageBusyException busy) {
            log.info("Detection still running, skipped after ingestion");
            metrics.recordStageBusy(busy.stage());
            return Future.succeededFuture(new JsonObject()
              .put("skipped", true)
              .put("reason", "busy"));
          }
          return Future.failedFuture(err);
        })
        .map(detection -> new JsonObject()
          .put("ingestion", ingestion.toJson())
          .put("detection", detection)));
  }

  static List<ItemObservation> parseObservations(JsonArray array) {
    if (array == null) {
      throw new DecodeException("Missing body");
    }
    List<ItemObservation> observations = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      observations.add(ItemObservation.fromJson(array.getJsonObject(i)));
    }
    return observations;
  }

  private void handleDetect(RoutingContext ctx) {
    runDetection()
      .onSuccess(summary -> JsonResponses.ok(ctx, new JsonObject().put("detection", summary.toJson())))
      .onFailure(err -> handleFailure(ctx, Stage.DETECT, err));
  }

  private Future<DetectionSummary> runDetection() {
    return stageLock.runExclusively(Stage.DETECT, () -> {
      Timer.Sample sample = metrics.startTimer();
      return detector.detect().onSuccess(summary -> metrics.recordDetection(summary, sample));
    });
  }

  private void handleRecompute(RoutingContext ctx) {
    stageLock.runExclusively(Stage.BENCHMARKS, benchmarkService::recompute)
      .onSuccess(metrics::recordRecompute)
      .onSuccess(result -> JsonResponses.ok(ctx, result.toJson()))
      .onFailure(err -> handleFailure(ctx, Stage.BENCHMARKS, err));
  }

  private void handleSeed(RoutingContext ctx) {
    stageLock.runExclusively(Stage.BENCHMARKS, benchmarkService::seedDefaults)
      .onSuccess(seeded -> JsonResponses.ok(ctx, new JsonObject().put("benchmarks_seeded", seeded)))
      .onFailure(err -> handleFailure(ctx, Stage.BENCHMARKS, err));
  }

  private void handleDigest(RoutingContext ctx) {
    stageLock.runExclusively(Stage.DIGEST, digestBatcher::runBatch)
      .onSuccess(metrics::recordDigest)
      .onSuccess(outcome -> JsonResponses.ok(ctx, outcome.toJson()))
      .onFailure(err -> handleFailure(ctx, Stage.DIGEST, err));
  }

  private void handleFailure(RoutingContext ctx, Stage stage, Throwable err) {
    if (err instanceof StageBusyException busy) {
      metrics.recordStageBusy(busy.stage());
      JsonResponses.error(ctx, 409, err.getMessage());
      return;
    }
    log.error("{} cycle failed", stage.getValue(), err);
    metrics.recordStageFailure(stage);
    JsonResponses.error(ctx, 500, err.getMessage());
  }
}
