package io.github.themoah.breakout.analysis.velocity;

import io.github.themoah.breakout.model.Snapshot;
import io.github.themoah.breakout.model.Velocity;
import java.time.Duration;
import java.util.List;

/**
 * Derives growth rates from pairs of snapshots of the same item.
 *
 * <p>Decreases (moderation, deleted comments) are clamped to zero: flat or declining
 * metrics mean "no growth", never negative growth.
 */
public final class VelocityCalculator {

  private static final double MILLIS_PER_MINUTE = 60_000.0;

  private VelocityCalculator() {}

  /**
   * Calculates velocity between two snapshots.
   *
   * @param current the later snapshot
   * @param previous the earlier snapshot
   * @return velocity per minute, or null if current is not strictly later than previous
   */
  public static Velocity calculate(Snapshot current, Snapshot previous) {
    if (!current.capturedAt().isAfter(previous.capturedAt())) {
      return null;
    }

    double elapsedMinutes = elapsedMinutes(previous, current);
    if (elapsedMinutes <= 0) {
      return null;  // Sub-millisecond gap
    }

    double scoreVelocity = Math.max(0, (current.score() - previous.score()) / elapsedMinutes);
    double commentVelocity = Math.max(0, (current.commentCount() - previous.commentCount()) / elapsedMinutes);

    return new Velocity(scoreVelocity, commentVelocity, elapsedMinutes);
  }

  /**
   * Calculates the current velocity of an item from its most recent snapshots.
   *
   * @param recentSnapshots snapshots ordered newest first
   * @return velocity between the two newest snapshots, or null if fewer than two exist
   */
  public static Velocity calculateRecent(List<Snapshot> recentSnapshots) {
    if (recentSnapshots.size() < 2) {
      return null;
    }
    return calculate(recentSnapshots.get(0), recentSnapshots.get(1));
  }

  /**
   * Minutes elapsed between two snapshots, with millisecond precision.
   */
  public static double elapsedMinutes(Snapshot earlier, Snapshot later) {
    return Duration.between(earlier.capturedAt(), later.capturedAt()).toMillis() / MILLIS_PER_MINUTE;
  }
}
