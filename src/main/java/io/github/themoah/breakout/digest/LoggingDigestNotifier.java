package io.github.themoah.breakout.digest;

import io.github.themoah.breakout.model.Alert;
import io.github.themoah.breakout.model.DeliveryStatus;
import io.vertx.core.Future;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notifier that renders the digest as plain text into the log.
 */
public class LoggingDigestNotifier implements DigestNotifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingDigestNotifier.class);

  @Override
  public Future<DeliveryStatus> deliver(DigestBatch batch) {
    log.info("{}\n{}", subject(batch), render(batch));
    return Future.succeededFuture(DeliveryStatus.SENT);
  }

  static String subject(DigestBatch batch) {
    String noun = batch.size() == 1 ? "story" : "stories";
    if (batch.isUrgent()) {
      return String.format("[digest %d] %d URGENT breakout %s", batch.digestId(), batch.size(), noun);
    }
    return String.format("[digest %d] %d trending %s", batch.digestId(), batch.size(), noun);
  }

  static String render(DigestBatch batch) {
    StringBuilder sb = new StringBuilder();
    int index = 1;
    for (DigestEntry entry : batch.entries()) {
      Alert alert = entry.alert();
      sb.append(String.format(Locale.ROOT, "%d. %s (%s, p%.1f, %.2f/min, %d points, %d comments, %d min old)",
        index++,
        entry.title(),
        alert.type().getValue(),
        alert.percentile(),
        alert.growthRate(),
        alert.scoreAtAlert(),
        alert.commentsAtAlert(),
        alert.itemAgeMinutes()));
      if (entry.url() != null) {
        sb.append("\n   ").append(entry.url());
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
