package io.github.themoah.breakout.model;

import io.vertx.core.json.JsonObject;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of one detection cycle.
 *
 * @param benchmarksAvailable false when the cycle was aborted for lack of a complete benchmark map
 * @param itemsScanned active items considered
 * @param itemsSkipped items without two usable snapshots
 * @param itemsFailed items whose analysis raised an error
 * @param candidatesByType alert candidates per rule
 * @param alertsCreated candidates that were new (not already alerted for that type)
 */
public record DetectionSummary(
  boolean benchmarksAvailable,
  int itemsScanned,
  int itemsSkipped,
  int itemsFailed,
  Map<AlertType, Integer> candidatesByType,
  int alertsCreated
) {

  public static DetectionSummary benchmarksUnavailable() {
    return new DetectionSummary(false, 0, 0, 0, emptyCounts(), 0);
  }

  public static Map<AlertType, Integer> emptyCounts() {
    Map<AlertType, Integer> counts = new EnumMap<>(AlertType.class);
    for (AlertType type : AlertType.values()) {
      counts.put(type, 0);
    }
    return counts;
  }

  public int totalCandidates() {
    return candidatesByType.values().stream().mapToInt(Integer::intValue).sum();
  }

  public JsonObject toJson() {
    JsonObject byType = new JsonObject();
    candidatesByType.forEach((type, count) -> byType.put(type.getValue(), count));
    return new JsonObject()
      .put("benchmarks_available", benchmarksAvailable)
      .put("items_scanned", itemsScanned)
      .put("items_skipped", itemsSkipped)
      .put("items_failed", itemsFailed)
      .put("alert_candidates", byType)
      .put("alerts_created", alertsCreated);
  }
}
