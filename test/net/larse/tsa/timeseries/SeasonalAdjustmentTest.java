package net.larse.tsa.timeseries;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneOffset;
import java.util.Map;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.InsufficientDataException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SeasonalAdjustmentTest {
  private static final Instant T0 = Instant.parse("2018-01-01T00:00:00Z");

  private static double[] seasonal(int n) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = 100 + 0.2 * i + 10 * Math.sin(2 * Math.PI * i / 12) + 0.5 * Math.sin(2 * i);
    }
    return values;
  }

  private static double[] noise(int n) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = 100 + 0.5 * Math.sin(2 * i);
    }
    return values;
  }

  private static SeasonalAdjustment.Args never() {
    SeasonalAdjustment.Args args = new SeasonalAdjustment.Args();
    args.logTransform = SeasonalAdjustment.LogTransform.NEVER;
    return args;
  }

  @Test
  public void testComponentsAddUpToInput() throws Exception {
    double[] values = seasonal(48);
    SeasonalAdjustmentResult result = new SeasonalAdjustment().adjust(values);
    assertFalse(result.isLogTransformed());
    double error = ArrayHelper.maxReconstructionError(values, result.getTrend(),
        result.getSeasonal(), result.getIrregular());
    assertTrue(error < 1e-6 * ArrayHelper.maxAbs(values));
    assertEquals(2, result.getArCoefficients().length);
  }

  @Test
  public void testSeasonalFactorsCentred() throws Exception {
    SeasonalAdjustmentResult result = new SeasonalAdjustment().adjust(seasonal(48));
    Map<Integer, Double> factors = result.getSeasonalFactors();
    assertEquals(12, factors.size());
    double sum = 0;
    for (double f : factors.values()) {
      sum += f;
    }
    assertEquals(0.0, sum, 1e-9);
    assertTrue(factors.get(3) > 8);
    assertTrue(factors.get(9) < -8);
  }

  @Test
  public void testLogTransformChosenForWideSpread() throws Exception {
    double[] values = new double[48];
    for (int i = 0; i < values.length; i++) {
      values[i] = 10 * Math.pow(1.08, i) * (1 + 0.2 * Math.sin(2 * Math.PI * i / 12));
    }
    SeasonalAdjustmentResult result = new SeasonalAdjustment().adjust(values);
    assertTrue(result.isLogTransformed());
    double error = ArrayHelper.maxReconstructionError(values, result.getTrend(),
        result.getSeasonal(), result.getIrregular());
    assertTrue(error < 1e-6 * ArrayHelper.maxAbs(values));
    for (double factor : result.getSeasonalFactors().values()) {
      assertTrue(factor > 0.5 && factor < 1.5);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testForcedLogNeedsPositiveValues() throws Exception {
    SeasonalAdjustment.Args args = new SeasonalAdjustment.Args();
    args.logTransform = SeasonalAdjustment.LogTransform.ALWAYS;
    double[] values = seasonal(36);
    values[5] = -1;
    new SeasonalAdjustment(args).adjust(values);
  }

  @Test
  public void testSpikeIsAdditiveOutlier() throws Exception {
    double[] values = noise(60);
    values[30] += 5;
    SeasonalAdjustmentResult result = new SeasonalAdjustment().adjust(values);
    assertEquals(1, result.getOutliers().size());
    Outlier outlier = result.getOutliers().get(0);
    assertEquals(30, outlier.index);
    assertEquals(Outlier.Type.AO, outlier.type);
    assertEquals(5.0, outlier.impact, 0.7);
  }

  @Test
  public void testStepIsLevelShift() throws Exception {
    double[] values = noise(90);
    for (int i = 80; i < 90; i++) {
      values[i] += 10;
    }
    SeasonalAdjustmentResult result = new SeasonalAdjustment(never()).adjust(values);
    boolean found = false;
    for (Outlier outlier : result.getOutliers()) {
      if (outlier.index == 80) {
        assertEquals(Outlier.Type.LS, outlier.type);
        found = true;
      }
    }
    assertTrue(found);
  }

  @Test
  public void testClassifyWithoutNeighbours() {
    assertEquals(Outlier.Type.AO,
        SeasonalAdjustment.classify(new double[] {50, 1, 1, 1, 1, 1}, 0, 0.1));
  }

  @Test
  public void testCalendarEffectsRemoved() throws Exception {
    CalendarProvider calendar = new CalendarProvider() {
      @Override
      public int tradingDays(LocalDate periodStart) {
        return periodStart.getMonthValue() % 2 == 0 ? 22 : 20;
      }

      @Override
      public double holidayFactor(LocalDate date) {
        return date.getMonth() == Month.DECEMBER ? 1.1 : 1.0;
      }
    };

    int n = 48;
    Instant[] timestamps = new Instant[n];
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      timestamps[i] = T0.atZone(ZoneOffset.UTC).plusMonths(i).toInstant();
      LocalDate date = timestamps[i].atZone(ZoneOffset.UTC).toLocalDate();
      values[i] = 100 * calendar.tradingDays(date) / 21.0 * calendar.holidayFactor(date);
    }

    SeasonalAdjustment.Args args = never();
    args.tradingDayAdjustment = true;
    args.holidayAdjustment = true;
    SeasonalAdjustmentResult result =
        new SeasonalAdjustment(args, calendar).adjust(new TimeSeries(timestamps, values));

    double[] adjusted = result.getSeasonallyAdjusted();
    for (int i = 0; i < n; i++) {
      assertEquals(100.0, adjusted[i], 1e-9);
    }
    assertTrue(result.getOutliers().isEmpty());
  }

  @Test(expected = IllegalStateException.class)
  public void testCalendarRequired() {
    SeasonalAdjustment.Args args = new SeasonalAdjustment.Args();
    args.holidayAdjustment = true;
    new SeasonalAdjustment(args, null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCalendarNeedsTimestamps() throws Exception {
    SeasonalAdjustment.Args args = new SeasonalAdjustment.Args();
    args.tradingDayAdjustment = true;
    CalendarProvider calendar = new CalendarProvider() {
      @Override
      public int tradingDays(LocalDate periodStart) {
        return 21;
      }

      @Override
      public double holidayFactor(LocalDate date) {
        return 1;
      }
    };
    new SeasonalAdjustment(args, calendar).adjust(seasonal(36));
  }

  @Test
  public void testTooShort() throws Exception {
    try {
      new SeasonalAdjustment().adjust(TimeSeries.regular(T0, Duration.ofDays(30), seasonal(20)));
      fail("20 observations accepted for period 12");
    } catch (InsufficientDataException e) {
      assertEquals(24, e.getRequired());
    }
  }

  @Test
  public void testNoAutoregressionRequested() throws Exception {
    SeasonalAdjustment.Args args = never();
    args.arOrder = 0;
    assertEquals(0, new SeasonalAdjustment(args).adjust(seasonal(36)).getArCoefficients().length);
  }

  @Test
  public void testDifference() {
    double[] d = SeasonalAdjustment.difference(new double[] {1, 4, 9, 16}, 2);
    assertEquals(2, d.length);
    assertEquals(8.0, d[0], 0);
    assertEquals(12.0, d[1], 0);
  }
}
