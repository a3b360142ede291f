package io.github.themoah.breakout.pipeline;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.shareddata.Lock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advisory per-stage lock on top of Vert.x local shared-data locks.
 * A second invocation of a running stage fails fast with {@link StageBusyException}.
 */
public class StageLock {

  private static final Logger log = LoggerFactory.getLogger(StageLock.class);

  private static final long DEFAULT_ACQUIRE_TIMEOUT_MS = 100L;

  private final Vertx vertx;
  private final long acquireTimeoutMs;

  public StageLock(Vertx vertx) {
    this(vertx, DEFAULT_ACQUIRE_TIMEOUT_MS);
  }

  public StageLock(Vertx vertx, long acquireTimeoutMs) {
    this.vertx = vertx;
    this.acquireTimeoutMs = acquireTimeoutMs;
  }

  /**
   * Runs the work while holding the stage lock. The lock is released when the work's
   * future completes, whether it succeeds or fails.
   *
   * @param stage the stage to lock
   * @param work supplier of the stage invocation
   * @return Future with the work's result, or failed with StageBusyException
   */
  public <T> Future<T> runExclusively(Stage stage, Supplier<Future<T>> work) {
    return vertx.sharedData().getLocalLockWithTimeout(stage.lockName(), acquireTimeoutMs)
      .recover(err -> {
        log.warn("Rejected {} invocation: previous run still in progress", stage.getValue());
        return Future.failedFuture(new StageBusyException(stage));
      })
      .compose(lock -> runAndRelease(stage, lock, work));
  }

  private <T> Future<T> runAndRelease(Stage stage, Lock lock, Supplier<Future<T>> work) {
    log.debug("Acquired lock for stage {}", stage.getValue());
    return Future.<Void>succeededFuture()
      .compose(v -> work.get())
      .onComplete(ar -> {
        lock.release();
        log.debug("Released lock for stage {}", stage.getValue());
      });
  }
}
