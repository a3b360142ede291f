package io.github.themoah.breakout;

import io.github.themoah.breakout.analysis.benchmark.BenchmarkService;
import io.github.themoah.breakout.analysis.detect.BreakoutDetector;
import io.github.themoah.breakout.config.AppConfig;
import io.github.themoah.breakout.config.BenchmarkConfig;
import io.github.themoah.breakout.config.ClockConfig;
import io.github.themoah.breakout.config.DetectionConfig;
import io.github.themoah.breakout.config.DigestConfig;
import io.github.themoah.breakout.config.Env;
import io.github.themoah.breakout.config.IngestionConfig;
import io.github.themoah.breakout.digest.DigestBatcher;
import io.github.themoah.breakout.digest.LoggingDigestNotifier;
import io.github.themoah.breakout.health.BenchmarkHealthMonitor;
import io.github.themoah.breakout.health.HealthCheckHandler;
import io.github.themoah.breakout.http.CycleHandler;
import io.github.themoah.breakout.http.QueryHandler;
import io.github.themoah.breakout.ingest.IngestionService;
import io.github.themoah.breakout.metrics.MetricsConfig;
import io.github.themoah.breakout.metrics.MicrometerConfig;
import io.github.themoah.breakout.metrics.PipelineMetrics;
import io.github.themoah.breakout.metrics.PrometheusHandler;
import io.github.themoah.breakout.pipeline.StageLock;
import io.github.themoah.breakout.stats.StatsService;
import io.github.themoah.breakout.store.InMemoryBreakoutStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for the breakout pipeline.
 * Wires the store, pipeline stages, metrics, health monitoring and the HTTP server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final Env env;

  private BenchmarkHealthMonitor healthMonitor;
  private PipelineMetrics metrics;
  private HttpServer httpServer;

  public MainVerticle() {
    this(Env.system());
  }

  public MainVerticle(Env env) {
    this.env = env;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting breakout MainVerticle");

    AppConfig appConfig = AppConfig.from(env);
    DetectionConfig detectionConfig = DetectionConfig.from(env);
    BenchmarkConfig benchmarkConfig = BenchmarkConfig.from(env);
    DigestConfig digestConfig = DigestConfig.from(env);
    IngestionConfig ingestionConfig = IngestionConfig.from(env);
    MetricsConfig metricsConfig = MetricsConfig.from(env);
    Clock clock = ClockConfig.from(env);

    InMemoryBreakoutStore store = new InMemoryBreakoutStore();

    BenchmarkService benchmarkService = new BenchmarkService(store, store, benchmarkConfig, clock);
    BreakoutDetector detector = new BreakoutDetector(store, store, benchmarkService, detectionConfig, clock);
    DigestBatcher digestBatcher = new DigestBatcher(store, store, store, new LoggingDigestNotifier(),
      digestConfig, clock);
    IngestionService ingestionService = new IngestionService(store, ingestionConfig, detectionConfig, clock);
    StatsService statsService = new StatsService(store, store, store, detectionConfig, digestConfig, clock);

    healthMonitor = new BenchmarkHealthMonitor(vertx, benchmarkService, appConfig.healthCheckIntervalMs());

    Router router = Router.router(vertx);
    new HealthCheckHandler(healthMonitor).registerRoutes(router);

    // Also registers /metrics when the Prometheus reporter is active
    metrics = createMetrics(metricsConfig, router);

    new CycleHandler(ingestionService, detector, benchmarkService, digestBatcher,
      new StageLock(vertx), metrics, appConfig.cronSecret()).registerRoutes(router);
    new QueryHandler(statsService, store, store, clock).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    benchmarkService.seedDefaults()
      .compose(seeded -> healthMonitor.start())
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("Breakout pipeline started successfully on port {}", server.actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start breakout pipeline", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping breakout MainVerticle");

    Future<Void> stopHealthMonitor = (healthMonitor != null)
      ? healthMonitor.stop()
      : Future.succeededFuture();

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    stopHealthMonitor
      .compose(v -> stopHttpServer)
      .onComplete(ar -> {
        if (metrics != null) {
          metrics.close();
        }
      })
      .onSuccess(v -> {
        log.info("Breakout pipeline stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during breakout pipeline shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Port the HTTP server is bound to, or -1 before startup.
   */
  public int actualPort() {
    return httpServer != null ? httpServer.actualPort() : -1;
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private PipelineMetrics createMetrics(MetricsConfig config, Router router) {
    if (!config.enabled()) {
      log.info("Metrics reporting is disabled");
      return PipelineMetrics.disabled();
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType(), env);
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return PipelineMetrics.disabled();
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new PipelineMetrics(registry);
  }
}
