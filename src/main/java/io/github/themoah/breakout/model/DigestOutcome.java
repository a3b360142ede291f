package io.github.themoah.breakout.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Result of one digest batch invocation.
 *
 * @param result whether a batch was built or why it was skipped
 * @param digestId stored digest identity, 0 when skipped
 * @param type batch type, null when skipped
 * @param alertIds alerts included in the batch
 * @param deliveryStatus status reported by the notification collaborator, null when skipped
 * @param digestsToday digests counted for the current day, including this one
 * @param maxPerDay configured daily quota
 */
public record DigestOutcome(
  Result result,
  long digestId,
  DigestType type,
  List<Long> alertIds,
  DeliveryStatus deliveryStatus,
  int digestsToday,
  int maxPerDay
) {

  /**
   * Batch outcome. Skips are expected, non-error results.
   */
  public enum Result {
    BATCHED("batched"),
    SKIPPED_QUOTA_REACHED("quota reached"),
    SKIPPED_NO_UNSENT_ALERTS("no unsent alerts");

    private final String value;

    Result(String value) {
      this.value = value;
    }

    public String getValue() {
      return value;
    }
  }

  public DigestOutcome {
    alertIds = List.copyOf(alertIds);
  }

  public static DigestOutcome skipped(Result reason, int digestsToday, int maxPerDay) {
    return new DigestOutcome(reason, 0, null, List.of(), null, digestsToday, maxPerDay);
  }

  public boolean isSkipped() {
    return result != Result.BATCHED;
  }

  public int alertCount() {
    return alertIds.size();
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("skipped", isSkipped())
      .put("quota", new JsonObject().put("sent", digestsToday).put("max", maxPerDay));
    if (isSkipped()) {
      return json.put("reason", result.getValue());
    }
    return json.put("digest", new JsonObject()
      .put("id", digestId)
      .put("type", type.getValue())
      .put("alerts_count", alertCount())
      .put("alert_ids", new JsonArray(alertIds))
      .put("delivery_status", deliveryStatus.getValue()));
  }
}
