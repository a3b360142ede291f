package io.github.themoah.breakout.store;

import io.github.themoah.breakout.model.DeliveryStatus;
import io.github.themoah.breakout.model.Digest;
import io.vertx.core.Future;
import java.time.Instant;
import java.util.List;

/**
 * Digest records, one per outbound notification attempt.
 */
public interface DigestStore {

  /**
   * Stores a digest and assigns its identity.
   *
   * @return Future with the stored digest
   */
  Future<Digest> insertDigest(Digest digest);

  /**
   * Updates the only mutable part of a digest.
   */
  Future<Void> updateDigestStatus(long digestId, DeliveryStatus status, String errorMessage);

  Future<Long> countDigestsSentSince(Instant since);

  Future<List<Digest>> findDigestsSentSince(Instant since);
}
