package io.github.themoah.breakout.model;

import java.util.Locale;

/**
 * Type tag of a tracked item.
 */
public enum ItemType {
  STORY("story"),
  ASK("ask"),
  SHOW("show"),
  JOB("job"),
  POLL("poll");

  private final String value;

  ItemType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Classifies an item from its upstream type and title.
   * Jobs and polls keep their type; stories are split into ask/show by title prefix.
   *
   * @param rawType upstream type ("story", "job", "poll", ...), may be null
   * @param title item title, may be null
   * @return the item type
   */
  public static ItemType classify(String rawType, String title) {
    if ("job".equalsIgnoreCase(rawType)) {
      return JOB;
    }
    if ("poll".equalsIgnoreCase(rawType)) {
      return POLL;
    }
    String lower = title == null ? "" : title.toLowerCase(Locale.ROOT);
    if (lower.startsWith("ask hn:")) {
      return ASK;
    }
    if (lower.startsWith("show hn:")) {
      return SHOW;
    }
    return STORY;
  }
}
