package io.github.themoah.breakout.model;

/**
 * An alert produced by one detection rule, before it is persisted.
 */
public record AlertCandidate(
  long itemId,
  AlertType type,
  double percentile,   // estimated percentile of the triggering velocity
  double growthRate,   // triggering velocity, per minute
  int score,
  int comments,
  int itemAgeMinutes
) {}
