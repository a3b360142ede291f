package io.github.themoah.breakout.http;

import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * JSON envelope shared by the HTTP handlers: {@code {"success": true, ...}} on success and
 * {@code {"success": false, "error": "..."}} on failure.
 */
final class JsonResponses {

  static final String CONTENT_TYPE_JSON = "application/json";

  private JsonResponses() {}

  static void ok(RoutingContext ctx, JsonObject payload) {
    JsonObject body = new JsonObject().put("success", true).mergeIn(payload);
    send(ctx, 200, body);
  }

  static void error(RoutingContext ctx, int statusCode, String message) {
    JsonObject body = new JsonObject()
      .put("success", false)
      .put("error", message != null ? message : "Unknown error");
    send(ctx, statusCode, body);
  }

  private static void send(RoutingContext ctx, int statusCode, JsonObject body) {
    if (ctx.response().ended()) {
      return;
    }
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(statusCode)
      .end(body.encode());
  }
}
