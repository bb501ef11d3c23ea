package net.larse.tsa.accuracy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import net.larse.tsa.accuracy.BiasAnalysis.BiasDirection;
import net.larse.tsa.accuracy.BiasAnalysis.BiasPattern;
import net.larse.tsa.accuracy.BiasAnalysis.BiasTrend;
import net.larse.tsa.helper.NoDataException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BiasAnalyzerTest {
  // A Monday.
  private static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");

  private final BiasAnalyzer analyzer = new BiasAnalyzer();

  private static List<PredictionRecord> offset(int days, double actual, double delta) {
    List<PredictionRecord> records = new ArrayList<>();
    for (int i = 0; i < days; i++) {
      records.add(PredictionRecord.builder(T0.plus(Duration.ofDays(i)), actual + delta)
          .actual(actual).build());
    }
    return records;
  }

  @Test
  public void testPositiveOffsetIsOverforecast() throws Exception {
    BiasAnalysis bias = analyzer.analyze(offset(14, 100, 10));
    assertEquals(BiasDirection.OVERFORECAST, bias.getDirection());
    assertTrue(bias.isSignificant());
    assertEquals(10.0, bias.getMeanBias(), 1e-9);
    assertEquals(10.0, bias.getMedianBias(), 1e-9);
    assertEquals(10.0, bias.getOverallBias(), 1e-9);
    assertEquals(BiasPattern.RANDOM, bias.getPattern());
    assertEquals(BiasTrend.STABLE, bias.getTrend());
  }

  @Test
  public void testNegativeOffsetIsUnderforecast() throws Exception {
    BiasAnalysis bias = analyzer.analyze(offset(14, 50, -5));
    assertEquals(BiasDirection.UNDERFORECAST, bias.getDirection());
    assertTrue(bias.isSignificant());
    assertEquals(-10.0, bias.getMeanBias(), 1e-9);
  }

  @Test
  public void testSmallOffsetIsNeutral() throws Exception {
    BiasAnalysis bias = analyzer.analyze(offset(14, 100, 1));
    assertEquals(BiasDirection.NEUTRAL, bias.getDirection());
    assertFalse(bias.isSignificant());
  }

  @Test
  public void testGrowingErrorIsSystematic() throws Exception {
    List<PredictionRecord> records = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      records.add(PredictionRecord.builder(T0.plus(Duration.ofDays(i)), 100 + i)
          .actual(100).build());
    }
    BiasAnalysis bias = analyzer.analyze(records);
    assertEquals(BiasPattern.SYSTEMATIC, bias.getPattern());
    assertEquals(BiasTrend.INCREASING, bias.getTrend());
  }

  @Test
  public void testShortHistoryTrendIsStable() throws Exception {
    List<PredictionRecord> records = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      records.add(PredictionRecord.builder(T0.plus(Duration.ofDays(i)), 100 + 5 * i)
          .actual(100).build());
    }
    assertEquals(BiasTrend.STABLE, analyzer.analyze(records).getTrend());
  }

  @Test
  public void testWeekdayErrorIsSeasonal() throws Exception {
    List<PredictionRecord> records = new ArrayList<>();
    for (int i = 0; i < 28; i++) {
      double predicted = i % 7 == 0 ? 110 : 100;
      records.add(PredictionRecord.builder(T0.plus(Duration.ofDays(i)), predicted)
          .actual(100).build());
    }
    assertEquals(BiasPattern.SEASONAL, analyzer.analyze(records).getPattern());
  }

  @Test
  public void testSeasonalBiasByMonth() throws Exception {
    List<PredictionRecord> records = new ArrayList<>();
    records.add(PredictionRecord.builder(T0, 110).actual(100).build());
    records.add(PredictionRecord.builder(T0.plus(Duration.ofDays(1)), 130).actual(100).build());
    records.add(PredictionRecord.builder(T0.plus(Duration.ofDays(40)), 95).actual(100).build());
    BiasAnalysis bias = analyzer.analyze(records);
    assertEquals(20.0, bias.getSeasonalBias().get("January"), 1e-9);
    assertEquals(-5.0, bias.getSeasonalBias().get("February"), 1e-9);
  }

  @Test
  public void testCustomPeriodLabel() throws Exception {
    BiasAnalyzer quarters = new BiasAnalyzer(ZoneOffset.UTC,
        t -> "Q" + ((t.atZone(ZoneOffset.UTC).getMonthValue() - 1) / 3 + 1));
    BiasAnalysis bias = quarters.analyze(offset(3, 100, 10));
    assertEquals(1, bias.getSeasonalBias().size());
    assertEquals(10.0, bias.getSeasonalBias().get("Q1"), 1e-9);
  }

  @Test
  public void testZeroActualsSkippedInPercentages() throws Exception {
    List<PredictionRecord> records = new ArrayList<>();
    records.add(PredictionRecord.builder(T0, 3).actual(0).build());
    records.add(PredictionRecord.builder(T0.plus(Duration.ofDays(1)), 110).actual(100).build());
    BiasAnalysis bias = analyzer.analyze(records);
    assertEquals(10.0, bias.getMeanBias(), 1e-9);
    assertEquals(6.5, bias.getOverallBias(), 1e-9);
  }

  @Test(expected = NoDataException.class)
  public void testNoActualized() throws Exception {
    List<PredictionRecord> records = new ArrayList<>();
    records.add(PredictionRecord.builder(T0, 3).build());
    analyzer.analyze(records);
  }
}
