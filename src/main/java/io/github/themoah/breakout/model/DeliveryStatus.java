package io.github.themoah.breakout.model;

/**
 * Delivery outcome of a digest as reported by the notification collaborator.
 */
public enum DeliveryStatus {
  PENDING("pending"),
  SENT("sent"),
  PARTIAL("partial"),
  FAILED("failed");

  private final String value;

  DeliveryStatus(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
