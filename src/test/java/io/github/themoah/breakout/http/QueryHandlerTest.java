package io.github.themoah.breakout.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import io.github.themoah.breakout.model.Alert;
import io.github.themoah.breakout.model.AlertType;
import io.github.themoah.breakout.model.Item;
import io.github.themoah.breakout.model.ItemType;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for alert serialization in QueryHandler.
 */
public class QueryHandlerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @Test
  void toJson_joinsItems() {
    Alert withItem = new Alert(1, 10, AlertType.BREAKTHROUGH, 96.5, 2.5, 25, 3, 12, NOW, false);
    Alert orphan = new Alert(2, 11, AlertType.SCORE_VELOCITY, 99.0, 4.0, 80, 9, 40, NOW, true);
    Item item = new Item(10, "Show HN: Breakout", "https://example.com", "pg", ItemType.SHOW,
      NOW.minusSeconds(720), NOW, false, false);

    JsonArray array = QueryHandler.toJson(List.of(withItem, orphan), Map.of(10L, item));

    assertEquals(2, array.size());
    JsonObject first = array.getJsonObject(0);
    assertEquals("breakthrough", first.getString("type"));
    assertEquals(96.5, first.getDouble("percentile"), 0.0001);
    assertEquals(12, first.getInteger("item_age_minutes"));
    assertEquals("2024-05-01T12:00:00Z", first.getString("detected_at"));
    assertEquals("Show HN: Breakout", first.getJsonObject("item").getString("title"));
    assertEquals("show", first.getJsonObject("item").getString("type"));

    JsonObject second = array.getJsonObject(1);
    assertEquals(true, second.getBoolean("sent"));
    assertFalse(second.containsKey("item"));
  }
}
