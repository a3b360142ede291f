package io.github.themoah.breakout.model;

/**
 * Detection rules that can raise an alert. One alert per (item, type) at most.
 */
public enum AlertType {
  SCORE_VELOCITY("score_velocity"),
  COMMENT_VELOCITY("comment_velocity"),
  BREAKTHROUGH("breakthrough");

  private final String value;

  AlertType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
