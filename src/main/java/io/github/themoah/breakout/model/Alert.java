package io.github.themoah.breakout.model;

import java.time.Instant;

/**
 * Persisted alert. Only the sent flag ever changes after insertion.
 *
 * @param id store-assigned identity
 * @param itemId item the alert is about
 * @param type rule that fired
 * @param percentile percentile recorded at first detection
 * @param growthRate velocity recorded at first detection
 * @param scoreAtAlert item score at first detection
 * @param commentsAtAlert item comment count at first detection
 * @param itemAgeMinutes item age at first detection
 * @param detectedAt first detection time
 * @param sent whether the item has been included in a digest
 */
public record Alert(
  long id,
  long itemId,
  AlertType type,
  double percentile,
  double growthRate,
  int scoreAtAlert,
  int commentsAtAlert,
  int itemAgeMinutes,
  Instant detectedAt,
  boolean sent
) {

  public static Alert fromCandidate(long id, AlertCandidate candidate, Instant detectedAt) {
    return new Alert(
      id,
      candidate.itemId(),
      candidate.type(),
      candidate.percentile(),
      candidate.growthRate(),
      candidate.score(),
      candidate.comments(),
      candidate.itemAgeMinutes(),
      detectedAt,
      false
    );
  }

  public Alert markSent() {
    return new Alert(id, itemId, type, percentile, growthRate, scoreAtAlert,
      commentsAtAlert, itemAgeMinutes, detectedAt, true);
  }
}
