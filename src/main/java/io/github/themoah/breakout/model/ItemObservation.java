package io.github.themoah.breakout.model;

import io.vertx.core.json.JsonObject;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * Raw item attributes pushed by the upstream source for one ingestion batch.
 *
 * @param id upstream identity
 * @param title item title
 * @param url optional link
 * @param author author handle
 * @param type upstream type tag ("story", "job", "poll")
 * @param createdAt item creation time
 * @param score current score
 * @param comments current comment count
 * @param dead upstream "dead" flag
 * @param deleted upstream "deleted" flag
 */
public record ItemObservation(
  long id,
  String title,
  String url,
  String author,
  String type,
  Instant createdAt,
  int score,
  int comments,
  boolean dead,
  boolean deleted
) {

  /**
   * Returns true if the observation carries enough data to be tracked.
   */
  public boolean isValid() {
    return id > 0
      && title != null && !title.isBlank()
      && author != null && !author.isBlank()
      && createdAt != null
      && score >= 0 && comments >= 0;
  }

  /**
   * Parses an observation. {@code createdAt} is epoch seconds.
   *
   * @param json observation object
   * @return the observation; missing fields become null, zero or false, and an
   *     out-of-range creation time becomes null so the observation is rejected as invalid
   */
  public static ItemObservation fromJson(JsonObject json) {
    return new ItemObservation(
      json.getLong("id", 0L),
      json.getString("title"),
      json.getString("url"),
      json.getString("author"),
      json.getString("type", "story"),
      parseCreatedAt(json.getLong("createdAt")),
      json.getInteger("score", 0),
      json.getInteger("comments", 0),
      json.getBoolean("dead", false),
      json.getBoolean("deleted", false)
    );
  }

  private static Instant parseCreatedAt(Long epochSeconds) {
    if (epochSeconds == null) {
      return null;
    }
    try {
      return Instant.ofEpochSecond(epochSeconds);
    } catch (DateTimeException e) {
      return null;  // Rejected by isValid()
    }
  }
}
