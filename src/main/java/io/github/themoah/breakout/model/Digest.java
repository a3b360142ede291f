package io.github.themoah.breakout.model;

import java.time.Instant;
import java.util.List;

/**
 * One outbound notification attempt. Immutable except for status and error message.
 *
 * @param id store-assigned identity (0 before insertion)
 * @param alertIds alerts included in the batch
 * @param alertCount number of alerts included
 * @param type batch type
 * @param status delivery status
 * @param errorMessage delivery error, null unless delivery failed
 * @param sentAt when the batch was built; counts toward the daily quota
 */
public record Digest(
  long id,
  List<Long> alertIds,
  int alertCount,
  DigestType type,
  DeliveryStatus status,
  String errorMessage,
  Instant sentAt
) {

  public static Digest pending(List<Long> alertIds, DigestType type, Instant sentAt) {
    return new Digest(0, List.copyOf(alertIds), alertIds.size(), type, DeliveryStatus.PENDING, null, sentAt);
  }

  public Digest withId(long newId) {
    return new Digest(newId, alertIds, alertCount, type, status, errorMessage, sentAt);
  }

  public Digest withStatus(DeliveryStatus newStatus, String newErrorMessage) {
    return new Digest(id, alertIds, alertCount, type, newStatus, newErrorMessage, sentAt);
  }
}
