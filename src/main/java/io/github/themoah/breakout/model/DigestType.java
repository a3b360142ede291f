package io.github.themoah.breakout.model;

/**
 * Batch typing by urgency. Urgent batches contain at least one alert at or above the 99th percentile.
 */
public enum DigestType {
  HOURLY("hourly"),
  URGENT("urgent");

  private final String value;

  DigestType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
