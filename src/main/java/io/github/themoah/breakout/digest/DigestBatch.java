package io.github.themoah.breakout.digest;

import io.github.themoah.breakout.model.DigestType;
import java.util.List;

/**
 * A digest handed to the notification collaborator.
 *
 * @param digestId identity of the stored digest row
 * @param type batch type
 * @param entries alerts in batch order (highest percentile first)
 */
public record DigestBatch(long digestId, DigestType type, List<DigestEntry> entries) {

  public DigestBatch {
    entries = List.copyOf(entries);
  }

  public boolean isUrgent() {
    return type == DigestType.URGENT;
  }

  public int size() {
    return entries.size();
  }
}
