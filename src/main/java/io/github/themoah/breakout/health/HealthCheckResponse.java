package io.github.themoah.breakout.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param benchmarks benchmark map availability (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String benchmarks
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * Creates a readiness response. The service is ready once a complete benchmark map exists.
   *
   * @param benchmarksAvailable true if all six benchmark cells are present
   */
  public static HealthCheckResponse readiness(boolean benchmarksAvailable) {
    HealthStatus status = benchmarksAvailable ? HealthStatus.UP : HealthStatus.DOWN;
    String benchmarks = benchmarksAvailable ? "available" : "unavailable";
    return new HealthCheckResponse(status, benchmarks);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (benchmarks != null) {
      json.put("benchmarks", benchmarks);
    }
    return json;
  }
}
