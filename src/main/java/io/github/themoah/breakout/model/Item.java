package io.github.themoah.breakout.model;

import java.time.Instant;

/**
 * A tracked item. Never deleted, only flagged dead or deleted.
 *
 * @param id stable upstream identity
 * @param title current title
 * @param url optional link (null for text posts)
 * @param author author handle
 * @param type type tag
 * @param firstSeenAt creation time of the item, used for its age
 * @param lastUpdatedAt last time an observation touched this row
 * @param dead upstream "dead" flag
 * @param deleted upstream "deleted" flag
 */
public record Item(
  long id,
  String title,
  String url,
  String author,
  ItemType type,
  Instant firstSeenAt,
  Instant lastUpdatedAt,
  boolean dead,
  boolean deleted
) {

  /**
   * Returns true if the item is alive and was first seen at or after the given instant.
   */
  public boolean isActiveSince(Instant firstSeenSince) {
    return !dead && !deleted && !firstSeenAt.isBefore(firstSeenSince);
  }
}
