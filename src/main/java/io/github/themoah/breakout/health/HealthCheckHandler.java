package io.github.themoah.breakout.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final BenchmarkHealthMonitor healthMonitor;

  public HealthCheckHandler(BenchmarkHealthMonitor healthMonitor) {
    this.healthMonitor = healthMonitor;
  }

  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  private void handleLiveness(RoutingContext ctx) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(200)
      .end(HealthCheckResponse.liveness().toJson().encode());
  }

  /**
   * 200 when the last check found a complete benchmark map, 503 otherwise.
   */
  private void handleReadiness(RoutingContext ctx) {
    boolean available = healthMonitor.isBenchmarksAvailable();
    HealthCheckResponse response = HealthCheckResponse.readiness(available);

    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(available ? 200 : 503)
      .end(response.toJson().encode());
  }
}
