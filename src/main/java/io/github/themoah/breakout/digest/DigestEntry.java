package io.github.themoah.breakout.digest;

import io.github.themoah.breakout.model.Alert;
import io.github.themoah.breakout.model.Item;

/**
 * An alert joined with the item it is about, for rendering.
 *
 * @param alert the alert
 * @param item the item, or null if the item row could not be loaded
 */
public record DigestEntry(Alert alert, Item item) {

  public String title() {
    return item != null ? item.title() : "item " + alert.itemId();
  }

  public String url() {
    return item != null ? item.url() : null;
  }
}
