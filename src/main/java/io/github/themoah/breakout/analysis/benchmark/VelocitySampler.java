package io.github.themoah.breakout.analysis.benchmark;

import io.github.themoah.breakout.analysis.velocity.VelocityCalculator;
import io.github.themoah.breakout.model.AgeBucket;
import io.github.themoah.breakout.model.MetricType;
import io.github.themoah.breakout.model.Snapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts historical velocity samples from snapshot history.
 *
 * <p>Pairs each snapshot with the earliest snapshot of the same item captured strictly
 * after it, provided the gap is within the pairing window. This is a single scan over
 * each item's time-ordered series rather than a cross join. Pairs where the score or the
 * comment count decreased are dropped as noise (not clamped). Each pair is attributed to
 * the age bucket of its first snapshot.
 */
public class VelocitySampler {

  private static final Logger log = LoggerFactory.getLogger(VelocitySampler.class);

  private final Duration pairingWindow;

  public VelocitySampler(Duration pairingWindow) {
    this.pairingWindow = pairingWindow;
  }

  /**
   * Collects velocity samples per age bucket.
   *
   * @param history snapshots in any order
   * @param capturedSince first snapshots of a pair must be captured at or after this instant
   * @return samples for every bucket (possibly empty)
   */
  public Map<AgeBucket, Samples> collect(List<Snapshot> history, Instant capturedSince) {
    Map<AgeBucket, Samples> result = new EnumMap<>(AgeBucket.class);
    for (AgeBucket bucket : AgeBucket.values()) {
      result.put(bucket, new Samples(new ArrayList<>(), new ArrayList<>()));
    }

    Map<Long, List<Snapshot>> seriesByItem = new LinkedHashMap<>();
    for (Snapshot snapshot : history) {
      seriesByItem.computeIfAbsent(snapshot.itemId(), k -> new ArrayList<>()).add(snapshot);
    }

    int pairs = 0;
    int dropped = 0;
    for (List<Snapshot> series : seriesByItem.values()) {
      series.sort(Comparator.comparing(Snapshot::capturedAt));

      for (int i = 0; i + 1 < series.size(); i++) {
        Snapshot first = series.get(i);
        Snapshot second = series.get(i + 1);

        if (first.capturedAt().isBefore(capturedSince)) {
          continue;
        }
        double elapsedMinutes = VelocityCalculator.elapsedMinutes(first, second);
        if (elapsedMinutes <= 0) {
          continue;  // Duplicate capture time
        }
        if (Duration.between(first.capturedAt(), second.capturedAt()).compareTo(pairingWindow) > 0) {
          continue;
        }
        if (second.score() < first.score() || second.commentCount() < first.commentCount()) {
          dropped++;
          continue;
        }

        Samples samples = result.get(AgeBucket.forAge(first.ageMinutes()));
        samples.scoreVelocities().add((second.score() - first.score()) / elapsedMinutes);
        samples.commentVelocities().add((second.commentCount() - first.commentCount()) / elapsedMinutes);
        pairs++;
      }
    }

    log.debug("Collected {} velocity samples from {} items ({} decreasing pairs dropped)",
      pairs, seriesByItem.size(), dropped);
    return result;
  }

  /**
   * Velocity samples of one age bucket. Both lists have one entry per snapshot pair.
   */
  public record Samples(List<Double> scoreVelocities, List<Double> commentVelocities) {

    public List<Double> forMetric(MetricType metric) {
      return metric == MetricType.SCORE_VELOCITY ? scoreVelocities : commentVelocities;
    }

    public int pairCount() {
      return scoreVelocities.size();
    }
  }
}
