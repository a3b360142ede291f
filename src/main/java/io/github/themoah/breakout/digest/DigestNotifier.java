package io.github.themoah.breakout.digest;

import io.github.themoah.breakout.model.DeliveryStatus;
import io.vertx.core.Future;

/**
 * Delivers a digest to subscribers. Rendering, transport and subscriber management live
 * behind this interface.
 */
public interface DigestNotifier {

  /**
   * Delivers the batch.
   *
   * @param batch the digest to deliver
   * @return Future with SENT, PARTIAL or FAILED; a failed future is recorded as FAILED
   */
  Future<DeliveryStatus> deliver(DigestBatch batch);
}
