package io.github.themoah.breakout.pipeline;

/**
 * Pipeline stages that must never overlap with themselves.
 */
public enum Stage {
  INGEST("ingest"),
  DETECT("detect"),
  BENCHMARKS("benchmarks"),
  DIGEST("digest");

  private final String value;

  Stage(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public String lockName() {
    return "breakout.stage." + value;
  }
}
