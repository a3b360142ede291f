package io.github.themoah.breakout.analysis.benchmark;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.themoah.breakout.analysis.benchmark.PercentileUtils.Percentiles;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PercentileUtils.
 */
public class PercentileUtilsTest {

  @Test
  void nearestRank_oneToTen() {
    List<Double> values = List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 10.0);

    assertEquals(5.0, PercentileUtils.nearestRank(values, 50));
    assertEquals(8.0, PercentileUtils.nearestRank(values, 75));
    assertEquals(9.0, PercentileUtils.nearestRank(values, 90));
    assertEquals(10.0, PercentileUtils.nearestRank(values, 95));
    assertEquals(10.0, PercentileUtils.nearestRank(values, 99));
  }

  @Test
  void calculatePercentiles_unsortedInputNotModified() {
    List<Double> values = new ArrayList<>(List.of(10.0, 1.0, 7.0, 3.0, 5.0, 9.0, 2.0, 8.0, 4.0, 6.0));
    List<Double> copy = new ArrayList<>(values);

    Percentiles p = PercentileUtils.calculatePercentiles(values);

    assertEquals(5.0, p.p50());
    assertEquals(9.0, p.p90());
    assertEquals(copy, values);
  }

  @Test
  void calculatePercentiles_singleValue() {
    Percentiles p = PercentileUtils.calculatePercentiles(List.of(2.5));

    assertEquals(2.5, p.p50());
    assertEquals(2.5, p.p99());
  }

  @Test
  void calculatePercentiles_empty_allZero() {
    Percentiles p = PercentileUtils.calculatePercentiles(List.of());

    assertEquals(new Percentiles(0, 0, 0, 0, 0), p);
  }
}
