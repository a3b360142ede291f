package io.github.themoah.breakout.store;

import io.github.themoah.breakout.model.Alert;
import io.github.themoah.breakout.model.AlertCandidate;
import io.vertx.core.Future;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Alert persistence with (item, type) uniqueness and item-level sent tracking.
 */
public interface AlertStore {

  /**
   * Inserts an alert unless one already exists for the same (item, type).
   * An existing alert is left untouched.
   *
   * @param candidate the alert to store
   * @param detectedAt detection time
   * @return Future with true if a new alert was stored
   */
  Future<Boolean> insertAlertIfAbsent(AlertCandidate candidate, Instant detectedAt);

  /**
   * Selects alerts eligible for a digest: unsent, detected at or after {@code detectedSince},
   * and belonging to an item that never had any alert marked sent.
   * Ordered by percentile descending, then detection time descending.
   *
   * @param detectedSince start of the eligibility window
   * @param limit maximum alerts to return
   */
  Future<List<Alert>> findUnsentAlerts(Instant detectedSince, int limit);

  /**
   * Resolves the items owning the given alerts and marks every alert of those items as sent.
   *
   * @param alertIds alerts included in a digest
   * @return Future with the number of alert rows flipped to sent
   */
  Future<Integer> markAlertsSentForItems(Collection<Long> alertIds);

  Future<List<Alert>> findAlertsForItem(long itemId);

  /**
   * Recent alerts, newest detection first.
   *
   * @param since earliest detection time
   * @param limit maximum alerts to return
   */
  Future<List<Alert>> findAlertsDetectedSince(Instant since, int limit);

  Future<Long> countAlertsDetectedSince(Instant since);

  Future<Long> countUnsentAlerts();
}
