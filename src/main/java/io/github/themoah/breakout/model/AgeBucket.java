package io.github.themoah.breakout.model;

/**
 * Age regimes with structurally different growth statistics.
 *
 * <p>Ranges are inclusive and partition the non-negative minutes without gaps:
 * new = 0-30, young = 31-120, mature = 121+. Benchmarks are both computed and
 * looked up per bucket.
 */
public enum AgeBucket {
  NEW("new", 0, 30),
  YOUNG("young", 31, 120),
  MATURE("mature", 121, Integer.MAX_VALUE);

  private final String key;
  private final int minMinutes;
  private final int maxMinutes;

  AgeBucket(String key, int minMinutes, int maxMinutes) {
    this.key = key;
    this.minMinutes = minMinutes;
    this.maxMinutes = maxMinutes;
  }

  /**
   * Returns the bucket for an item age. Negative ages (clock skew) fall into {@link #NEW}.
   *
   * @param minutesSinceCreation item age in minutes
   * @return the matching bucket
   */
  public static AgeBucket forAge(int minutesSinceCreation) {
    if (minutesSinceCreation <= NEW.maxMinutes) {
      return NEW;
    }
    if (minutesSinceCreation <= YOUNG.maxMinutes) {
      return YOUNG;
    }
    return MATURE;
  }

  public boolean contains(int minutesSinceCreation) {
    return minutesSinceCreation >= minMinutes && minutesSinceCreation <= maxMinutes;
  }

  public String key() {
    return key;
  }

  public int minMinutes() {
    return minMinutes;
  }

  public int maxMinutes() {
    return maxMinutes;
  }
}
