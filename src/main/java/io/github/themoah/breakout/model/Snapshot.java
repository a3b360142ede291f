package io.github.themoah.breakout.model;

import java.time.Instant;

/**
 * Immutable point-in-time observation of an item.
 */
public record Snapshot(
  long itemId,
  int score,
  int commentCount,
  Instant capturedAt,
  int ageMinutes    // minutes since item creation at capture time
) {}
