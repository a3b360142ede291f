package io.github.themoah.breakout.analysis.detect;

import io.github.themoah.breakout.analysis.benchmark.PercentileScorer;
import io.github.themoah.breakout.model.AgeBucket;
import io.github.themoah.breakout.model.AlertCandidate;
import io.github.themoah.breakout.model.AlertType;
import io.github.themoah.breakout.model.BenchmarkMap;
import io.github.themoah.breakout.model.MetricType;
import io.github.themoah.breakout.model.Snapshot;
import io.github.themoah.breakout.model.Velocity;
import java.util.ArrayList;
import java.util.List;

/**
 * The three independent breakout rules. An item may trigger several in the same cycle.
 *
 * <ul>
 *   <li>score_velocity: score percentile &gt;= threshold and score &gt;= 10</li>
 *   <li>comment_velocity: comment percentile &gt;= threshold and comments &gt;= 5</li>
 *   <li>breakthrough: age &lt; 30 min, score percentile &gt;= 90 and score &gt;= 20</li>
 * </ul>
 */
public final class BreakoutRules {

  static final int MIN_SCORE = 10;
  static final int MIN_COMMENTS = 5;
  static final int BREAKTHROUGH_MAX_AGE_MINUTES = 30;
  static final double BREAKTHROUGH_PERCENTILE = 90;
  static final int BREAKTHROUGH_MIN_SCORE = 20;

  private BreakoutRules() {}

  /**
   * Scores the current velocity of an item against its age bucket and applies every rule.
   *
   * @param current newest snapshot of the item
   * @param velocity velocity between the two newest snapshots
   * @param benchmarks complete benchmark map
   * @param threshold percentile threshold of the velocity rules
   * @return alert candidates, empty if no rule fired
   */
  public static List<AlertCandidate> evaluate(
      Snapshot current,
      Velocity velocity,
      BenchmarkMap benchmarks,
      double threshold) {

    int age = current.ageMinutes();
    AgeBucket bucket = AgeBucket.forAge(age);

    double scorePercentile = PercentileScorer.calculatePercentile(
      velocity.scoreVelocity(), benchmarks.get(bucket, MetricType.SCORE_VELOCITY));
    double commentPercentile = PercentileScorer.calculatePercentile(
      velocity.commentVelocity(), benchmarks.get(bucket, MetricType.COMMENT_VELOCITY));

    List<AlertCandidate> candidates = new ArrayList<>(3);

    if (scorePercentile >= threshold && current.score() >= MIN_SCORE) {
      candidates.add(candidate(current, AlertType.SCORE_VELOCITY, scorePercentile, velocity.scoreVelocity()));
    }

    if (commentPercentile >= threshold && current.commentCount() >= MIN_COMMENTS) {
      candidates.add(candidate(current, AlertType.COMMENT_VELOCITY, commentPercentile, velocity.commentVelocity()));
    }

    if (age < BREAKTHROUGH_MAX_AGE_MINUTES
        && scorePercentile >= BREAKTHROUGH_PERCENTILE
        && current.score() >= BREAKTHROUGH_MIN_SCORE) {
      candidates.add(candidate(current, AlertType.BREAKTHROUGH, scorePercentile, velocity.scoreVelocity()));
    }

    return candidates;
  }

  private static AlertCandidate candidate(Snapshot current, AlertType type, double percentile, double growthRate) {
    return new AlertCandidate(
      current.itemId(),
      type,
      percentile,
      growthRate,
      current.score(),
      current.commentCount(),
      current.ageMinutes()
    );
  }
}
