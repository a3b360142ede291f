package io.github.themoah.breakout.health;

/**
 * Health status of a probe.
 */
public enum HealthStatus {
  UP("UP"),
  DOWN("DOWN");

  private final String value;

  HealthStatus(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
