package io.github.themoah.breakout.digest;

import io.github.themoah.breakout.config.DigestConfig;
import io.github.themoah.breakout.model.Alert;
import io.github.themoah.breakout.model.DeliveryStatus;
import io.github.themoah.breakout.model.Digest;
import io.github.themoah.breakout.model.DigestOutcome;
import io.github.themoah.breakout.model.DigestType;
import io.github.themoah.breakout.model.Item;
import io.github.themoah.breakout.store.AlertStore;
import io.github.themoah.breakout.store.DigestStore;
import io.github.themoah.breakout.store.SnapshotStore;
import io.vertx.core.Future;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups unsent alerts into a digest under a daily quota.
 *
 * <p>Notification is at-most-once: the included items are marked sent whatever the delivery
 * outcome, so a failed delivery is never retried with the same alerts.
 */
public class DigestBatcher {

  private static final Logger log = LoggerFactory.getLogger(DigestBatcher.class);

  static final double URGENT_PERCENTILE = 99;

  private final AlertStore alertStore;
  private final DigestStore digestStore;
  private final SnapshotStore snapshotStore;
  private final DigestNotifier notifier;
  private final DigestConfig config;
  private final Clock clock;

  public DigestBatcher(
    AlertStore alertStore,
    DigestStore digestStore,
    SnapshotStore snapshotStore,
    DigestNotifier notifier,
    DigestConfig config,
    Clock clock
  ) {
    this.alertStore = alertStore;
    this.digestStore = digestStore;
    this.snapshotStore = snapshotStore;
    this.notifier = notifier;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Builds and delivers at most one digest.
   *
   * @return Future with the batch outcome; quota and empty-queue skips are successful outcomes
   */
  public Future<DigestOutcome> runBatch() {
    Instant now = clock.instant();

    return digestStore.countDigestsSentSince(startOfDay())
      .compose(sentToday -> {
        int today = sentToday.intValue();
        if (today >= config.maxDigestsPerDay()) {
          log.info("Digest quota reached: {}/{} sent today", today, config.maxDigestsPerDay());
          return Future.succeededFuture(
            DigestOutcome.skipped(DigestOutcome.Result.SKIPPED_QUOTA_REACHED, today, config.maxDigestsPerDay()));
        }

        return alertStore.findUnsentAlerts(now.minus(config.unsentWindow()), config.batchSize())
          .compose(alerts -> {
            if (alerts.isEmpty()) {
              log.info("No unsent alerts to batch");
              return Future.succeededFuture(
                DigestOutcome.skipped(DigestOutcome.Result.SKIPPED_NO_UNSENT_ALERTS, today, config.maxDigestsPerDay()));
            }
            return batch(alerts, now, today);
          });
      });
  }

  private Future<DigestOutcome> batch(List<Alert> alerts, Instant now, int sentToday) {
    DigestType type = classify(alerts);
    List<Long> alertIds = alerts.stream().map(Alert::id).collect(Collectors.toList());

    return digestStore.insertDigest(Digest.pending(alertIds, type, now))
      .compose(digest -> loadEntries(alerts)
        .compose(entries -> deliver(new DigestBatch(digest.id(), type, entries)))
        .compose(delivery -> alertStore.markAlertsSentForItems(alertIds)
          .compose(marked -> {
            log.debug("Marked {} alerts sent for digest {}", marked, digest.id());
            return digestStore.updateDigestStatus(digest.id(), delivery.status(), delivery.error());
          })
          .map(v -> {
            log.info("Digest {} ({}) with {} alerts: {}",
              digest.id(), type.getValue(), alertIds.size(), delivery.status().getValue());
            return new DigestOutcome(DigestOutcome.Result.BATCHED, digest.id(), type, alertIds,
              delivery.status(), sentToday + 1, config.maxDigestsPerDay());
          })));
  }

  /**
   * Returns URGENT if any alert is at or above the 99th percentile, else HOURLY.
   */
  static DigestType classify(List<Alert> alerts) {
    boolean urgent = alerts.stream().anyMatch(alert -> alert.percentile() >= URGENT_PERCENTILE);
    return urgent ? DigestType.URGENT : DigestType.HOURLY;
  }

  private Future<List<DigestEntry>> loadEntries(List<Alert> alerts) {
    List<Long> itemIds = alerts.stream().map(Alert::itemId).distinct().collect(Collectors.toList());
    return snapshotStore.findItems(itemIds)
      .recover(err -> {
        log.warn("Failed to load items for digest, rendering without titles: {}", err.getMessage());
        return Future.succeededFuture(Map.of());
      })
      .map(items -> alerts.stream()
        .map(alert -> new DigestEntry(alert, items.get(alert.itemId())))
        .collect(Collectors.toList()));
  }

  private Future<Delivery> deliver(DigestBatch batch) {
    return Future.<Void>succeededFuture()
      .compose(v -> notifier.deliver(batch))
      .map(status -> new Delivery(status, null))
      .recover(err -> {
        log.error("Delivery of digest {} failed: {}", batch.digestId(), err.getMessage());
        return Future.succeededFuture(new Delivery(DeliveryStatus.FAILED, err.getMessage()));
      });
  }

  private Instant startOfDay() {
    return LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
  }

  private record Delivery(DeliveryStatus status, String error) {}
}
