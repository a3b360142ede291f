package io.github.themoah.breakout.metrics;

import io.github.themoah.breakout.model.AlertType;
import io.github.themoah.breakout.model.DetectionSummary;
import io.github.themoah.breakout.model.DigestOutcome;
import io.github.themoah.breakout.model.IngestionSummary;
import io.github.themoah.breakout.model.RecomputeResult;
import io.github.themoah.breakout.pipeline.Stage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records stage summaries as Micrometer meters.
 * Works with any Micrometer-supported backend (Prometheus, OTLP).
 */
public class PipelineMetrics {

  private static final Logger log = LoggerFactory.getLogger(PipelineMetrics.class);

  private final MeterRegistry registry;
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

  public PipelineMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  /**
   * Metrics that are recorded nowhere, used when reporting is disabled.
   */
  public static PipelineMetrics disabled() {
    return new PipelineMetrics(new CompositeMeterRegistry());
  }

  public Timer.Sample startTimer() {
    return Timer.start(registry);
  }

  public void recordIngestion(IngestionSummary summary) {
    counter("breakout.ingest.observations", Tags.of("result", "accepted"))
      .increment(summary.received() - summary.rejected());
    counter("breakout.ingest.observations", Tags.of("result", "rejected")).increment(summary.rejected());
    counter("breakout.ingest.snapshots.created", Tags.empty()).increment(summary.snapshotsCreated());
    recordGauge("breakout.ingest.active.items", Tags.empty(), summary.activeItems());
  }

  public void recordDetection(DetectionSummary summary, Timer.Sample sample) {
    String availability = summary.benchmarksAvailable() ? "available" : "unavailable";
    counter("breakout.detection.cycles", Tags.of("benchmarks", availability)).increment();
    sample.stop(Timer.builder("breakout.detection.duration")
      .description("Duration of a detection cycle")
      .register(registry));

    recordGauge("breakout.detection.items.scanned", Tags.empty(), summary.itemsScanned());
    recordGauge("breakout.detection.items.failed", Tags.empty(), summary.itemsFailed());

    for (Map.Entry<AlertType, Integer> entry : summary.candidatesByType().entrySet()) {
      counter("breakout.alerts.candidates", Tags.of("type", entry.getKey().getValue()))
        .increment(entry.getValue());
    }
    counter("breakout.alerts.created", Tags.empty()).increment(summary.alertsCreated());
  }

  public void recordRecompute(RecomputeResult result) {
    counter("breakout.benchmarks.updated", Tags.empty()).increment(result.benchmarksUpdated());
    counter("breakout.benchmarks.errors", Tags.empty()).increment(result.errors().size());
  }

  public void recordDigest(DigestOutcome outcome) {
    if (outcome.isSkipped()) {
      counter("breakout.digests.skipped", Tags.of("reason", outcome.result().getValue())).increment();
      return;
    }
    counter("breakout.digests", Tags.of(
      "type", outcome.type().getValue(),
      "status", outcome.deliveryStatus().getValue()
    )).increment();
    counter("breakout.digests.alerts", Tags.empty()).increment(outcome.alertCount());
  }

  public void recordStageBusy(Stage stage) {
    counter("breakout.stage.rejected", Tags.of("stage", stage.getValue())).increment();
  }

  public void recordStageFailure(Stage stage) {
    counter("breakout.stage.failures", Tags.of("stage", stage.getValue())).increment();
  }

  public MeterRegistry registry() {
    return registry;
  }

  public void close() {
    log.info("Closing meter registry");
    registry.close();
  }

  private Counter counter(String name, Tags tags) {
    return Counter.builder(name).tags(tags).register(registry);
  }

  private void recordGauge(String name, Tags tags, long value) {
    String key = name + tags.toString();
    AtomicLong atomicValue = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(value);
      Gauge.builder(name, newValue, AtomicLong::get)
        .tags(tags)
        .register(registry);
      return newValue;
    });
    atomicValue.set(value);
  }
}
