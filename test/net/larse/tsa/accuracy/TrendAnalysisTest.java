package net.larse.tsa.accuracy;

import static org.junit.Assert.assertEquals;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import net.larse.tsa.accuracy.TrendAnalysis.Alignment;
import net.larse.tsa.accuracy.TrendAnalysis.Direction;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TrendAnalysisTest {
  private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

  private static List<PredictionRecord> records(double[] predicted, double[] actual) {
    List<PredictionRecord> records = new ArrayList<>();
    for (int i = 0; i < predicted.length; i++) {
      records.add(PredictionRecord.builder(T0.plus(Duration.ofDays(i)), predicted[i])
          .actual(actual[i]).build());
    }
    return records;
  }

  @Test
  public void testMatchingTrends() {
    TrendAnalysis analysis = TrendAnalysis.of(records(
        new double[] {100, 105, 110, 115, 120}, new double[] {101, 106, 111, 116, 121}));
    assertEquals(Direction.INCREASING, analysis.forecastTrend);
    assertEquals(Direction.INCREASING, analysis.actualTrend);
    assertEquals(Alignment.EXCELLENT, analysis.alignment);
    assertEquals(0.5, analysis.trendAccuracy, 1e-9);
  }

  @Test
  public void testSameDirectionDifferentSlope() {
    TrendAnalysis analysis = TrendAnalysis.of(records(
        new double[] {100, 102, 104, 106, 108}, new double[] {100, 110, 120, 130, 140}));
    assertEquals(Alignment.GOOD, analysis.alignment);
  }

  @Test
  public void testOpposingTrends() {
    TrendAnalysis analysis = TrendAnalysis.of(records(
        new double[] {100, 95, 90, 85}, new double[] {100, 104, 108, 115}));
    assertEquals(Direction.DECREASING, analysis.forecastTrend);
    assertEquals(Direction.INCREASING, analysis.actualTrend);
    assertEquals(Alignment.POOR, analysis.alignment);
  }

  @Test
  public void testFlatSeriesIsStable() {
    TrendAnalysis analysis = TrendAnalysis.of(records(
        new double[] {100, 100.2, 99.9, 100.1}, new double[] {100, 100, 100, 100}));
    assertEquals(Direction.STABLE, analysis.forecastTrend);
    assertEquals(Direction.STABLE, analysis.actualTrend);
  }

  @Test
  public void testTooFewPoints() {
    TrendAnalysis analysis =
        TrendAnalysis.of(records(new double[] {1, 2}, new double[] {2, 1}));
    assertEquals(Alignment.GOOD, analysis.alignment);
    assertEquals(0.0, analysis.trendAccuracy, 0);
  }
}
