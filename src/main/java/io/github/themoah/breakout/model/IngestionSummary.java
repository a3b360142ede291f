package io.github.themoah.breakout.model;

import io.vertx.core.json.JsonObject;

/**
 * Result of ingesting one pushed batch of observations.
 */
public record IngestionSummary(
  int received,
  int rejected,
  int itemsUpserted,
  int activeItems,
  int snapshotsCreated
) {

  public JsonObject toJson() {
    return new JsonObject()
      .put("received", received)
      .put("rejected", rejected)
      .put("items_upserted", itemsUpserted)
      .put("active_items", activeItems)
      .put("snapshots_created", snapshotsCreated);
  }
}
