package io.github.themoah.breakout.http;

import io.github.themoah.breakout.model.Alert;
import io.github.themoah.breakout.model.Item;
import io.github.themoah.breakout.stats.StatsService;
import io.github.themoah.breakout.store.AlertStore;
import io.github.themoah.breakout.store.SnapshotStore;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only endpoints: pipeline statistics and recent alerts.
 */
public class QueryHandler {

  private static final Logger log = LoggerFactory.getLogger(QueryHandler.class);

  static final int DEFAULT_ALERT_LIMIT = 20;
  static final int MAX_ALERT_LIMIT = 100;
  static final int DEFAULT_ALERT_HOURS = 24;

  private final StatsService statsService;
  private final AlertStore alertStore;
  private final SnapshotStore snapshotStore;
  private final Clock clock;

  public QueryHandler(StatsService statsService, AlertStore alertStore, SnapshotStore snapshotStore, Clock clock) {
    this.statsService = statsService;
    this.alertStore = alertStore;
    this.snapshotStore = snapshotStore;
    this.clock = clock;
  }

  public void registerRoutes(Router router) {
    router.get("/stats").handler(this::handleStats);
    router.get("/alerts").handler(this::handleAlerts);
    log.info("Query routes registered: /stats, /alerts");
  }

  private void handleStats(RoutingContext ctx) {
    statsService.collect()
      .onSuccess(stats -> JsonResponses.ok(ctx, new JsonObject().put("stats", stats.toJson())))
      .onFailure(err -> {
        log.error("Failed to collect stats", err);
        JsonResponses.error(ctx, 500, err.getMessage());
      });
  }

  /**
   * Recent alerts joined with their items. Query parameters: hours (default 24) and
   * limit (default 20, at most 100).
   */
  private void handleAlerts(RoutingContext ctx) {
    int hours = queryInt(ctx, "hours", DEFAULT_ALERT_HOURS);
    int limit = Math.min(queryInt(ctx, "limit", DEFAULT_ALERT_LIMIT), MAX_ALERT_LIMIT);

    alertStore.findAlertsDetectedSince(clock.instant().minus(Duration.ofHours(hours)), limit)
      .compose(alerts -> snapshotStore.findItems(alerts.stream().map(Alert::itemId).collect(Collectors.toSet()))
        .map(items -> toJson(alerts, items)))
      .onSuccess(array -> JsonResponses.ok(ctx, new JsonObject().put("alerts", array).put("count", array.size())))
      .onFailure(err -> {
        log.error("Failed to load alerts", err);
        JsonResponses.error(ctx, 500, err.getMessage());
      });
  }

  static JsonArray toJson(List<Alert> alerts, Map<Long, Item> items) {
    JsonArray array = new JsonArray();
    for (Alert alert : alerts) {
      JsonObject json = new JsonObject()
        .put("id", alert.id())
        .put("item_id", alert.itemId())
        .put("type", alert.type().getValue())
        .put("percentile", alert.percentile())
        .put("growth_rate", alert.growthRate())
        .put("score_at_alert", alert.scoreAtAlert())
        .put("comments_at_alert", alert.commentsAtAlert())
        .put("item_age_minutes", alert.itemAgeMinutes())
        .put("detected_at", alert.detectedAt().toString())
        .put("sent", alert.sent());
      Item item = items.get(alert.itemId());
      if (item != null) {
        json.put("item", new JsonObject()
          .put("id", item.id())
          .put("title", item.title())
          .put("url", item.url())
          .put("author", item.author())
          .put("type", item.type().getValue())
          .put("first_seen_at", item.firstSeenAt().toString()));
      }
      array.add(json);
    }
    return array;
  }

  private static int queryInt(RoutingContext ctx, String name, int defaultValue) {
    String value = ctx.request().getParam(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      return parsed > 0 ? parsed : defaultValue;
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }
}
