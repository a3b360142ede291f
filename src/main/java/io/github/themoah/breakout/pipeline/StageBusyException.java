package io.github.themoah.breakout.pipeline;

/**
 * Raised when a stage is triggered while a previous invocation of it is still running.
 */
public class StageBusyException extends RuntimeException {

  private final Stage stage;

  public StageBusyException(Stage stage) {
    super("Stage already running: " + stage.getValue());
    this.stage = stage;
  }

  public Stage stage() {
    return stage;
  }
}
