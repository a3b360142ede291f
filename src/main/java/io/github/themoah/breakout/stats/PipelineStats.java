package io.github.themoah.breakout.stats;

import io.vertx.core.json.JsonObject;
import java.time.Instant;

/**
 * Point-in-time counts across the pipeline.
 *
 * @param itemsTotal all tracked items
 * @param itemsActive items inside the active window and not dead or deleted
 * @param snapshotsTotal all snapshots
 * @param snapshotsToday snapshots captured since the start of the local day
 * @param alertsTotal all alerts
 * @param alertsLast24h alerts detected in the last 24 hours
 * @param alertsUnsent alerts not yet marked sent
 * @param digestsToday digests recorded since the start of the local day
 * @param maxDigestsPerDay configured daily quota
 * @param lastCapture latest snapshot capture time, null if there is none
 * @param ingestionHealthy true if the latest snapshot is younger than the freshness limit
 */
public record PipelineStats(
  long itemsTotal,
  long itemsActive,
  long snapshotsTotal,
  long snapshotsToday,
  long alertsTotal,
  long alertsLast24h,
  long alertsUnsent,
  long digestsToday,
  int maxDigestsPerDay,
  Instant lastCapture,
  boolean ingestionHealthy
) {

  public long digestsRemaining() {
    return Math.max(0, maxDigestsPerDay - digestsToday);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("items", new JsonObject()
        .put("total", itemsTotal)
        .put("active", itemsActive))
      .put("snapshots", new JsonObject()
        .put("total", snapshotsTotal)
        .put("today", snapshotsToday))
      .put("alerts", new JsonObject()
        .put("total", alertsTotal)
        .put("last_24h", alertsLast24h)
        .put("unsent", alertsUnsent))
      .put("digests", new JsonObject()
        .put("today", digestsToday)
        .put("max", maxDigestsPerDay)
        .put("remaining", digestsRemaining()))
      .put("ingestion", new JsonObject()
        .put("last_capture", lastCapture != null ? lastCapture.toString() : null)
        .put("status", ingestionHealthy ? "healthy" : "warning"));
  }
}
