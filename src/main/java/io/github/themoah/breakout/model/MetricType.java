package io.github.themoah.breakout.model;

/**
 * Growth metrics that carry a benchmark per age bucket.
 */
public enum MetricType {
  SCORE_VELOCITY("score_velocity"),
  COMMENT_VELOCITY("comment_velocity");

  private final String key;

  MetricType(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  /**
   * Picks this metric's component out of a velocity.
   */
  public double valueOf(Velocity velocity) {
    return this == SCORE_VELOCITY ? velocity.scoreVelocity() : velocity.commentVelocity();
  }
}
