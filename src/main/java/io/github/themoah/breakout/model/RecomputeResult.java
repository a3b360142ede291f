package io.github.themoah.breakout.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Result of a benchmark recomputation.
 *
 * @param benchmarksUpdated cells overwritten with fresh percentiles (0-6)
 * @param errors one message per skipped or failed cell or bucket
 */
public record RecomputeResult(int benchmarksUpdated, List<String> errors) {

  public RecomputeResult {
    errors = List.copyOf(errors);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("benchmarks_updated", benchmarksUpdated)
      .put("errors", new JsonArray(errors));
  }
}
