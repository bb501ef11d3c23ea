package net.larse.tsa.accuracy;

import static org.junit.Assert.assertEquals;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;
import net.larse.tsa.helper.NoDataException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AccuracyCalculatorTest {
  private static final double EPS = 1e-9;

  @Test
  public void testPerfectForecast() throws Exception {
    double[] actual = {12, 15, 9, 20};
    AccuracyMetrics m = AccuracyCalculator.compute(actual, actual.clone());
    assertEquals(0.0, m.mape, EPS);
    assertEquals(0.0, m.bias, EPS);
    assertEquals(0.0, m.rmse, EPS);
    assertEquals(1.0, m.r2, EPS);
    assertEquals(0.0, m.theilU, EPS);
    assertEquals(100.0, m.accuracy, EPS);
  }

  @Test
  public void testKnownValues() throws Exception {
    AccuracyMetrics m =
        AccuracyCalculator.compute(new double[] {100, 200}, new double[] {110, 180});
    assertEquals(10.0, m.mape, EPS);
    assertEquals(Math.sqrt(250), m.rmse, EPS);
    assertEquals(15.0, m.mae, EPS);
    assertEquals(-5.0, m.bias, EPS);
    assertEquals(90.0, m.accuracy, EPS);
    assertEquals(0.9, m.r2, EPS);
    assertEquals(Math.sqrt(250) / (Math.sqrt(25000) + Math.sqrt(22250)), m.theilU, EPS);
    assertEquals(2, m.count);
  }

  @Test
  public void testRounded() throws Exception {
    AccuracyMetrics m =
        AccuracyCalculator.compute(new double[] {100, 200}, new double[] {110, 180}).rounded();
    assertEquals(15.81, m.rmse, 0);
    assertEquals(0.051, m.theilU, 0);
  }

  @Test
  public void testZeroActualsSkippedInMape() throws Exception {
    AccuracyMetrics m = AccuracyCalculator.compute(new double[] {0, 100}, new double[] {5, 110});
    assertEquals(10.0, m.mape, EPS);
    assertEquals(7.5, m.mae, EPS);
  }

  @Test
  public void testAccuracyFloorsAtZero() throws Exception {
    AccuracyMetrics m = AccuracyCalculator.compute(new double[] {10}, new double[] {40});
    assertEquals(300.0, m.mape, EPS);
    assertEquals(0.0, m.accuracy, 0);
  }

  @Test
  public void testConstantActualsGiveUnitR2() throws Exception {
    AccuracyMetrics m = AccuracyCalculator.compute(new double[] {5, 5, 5}, new double[] {4, 6, 5});
    assertEquals(1.0, m.r2, 0);
  }

  @Test
  public void testRecordsUseOnlyActualized() throws Exception {
    Instant t = Instant.parse("2024-01-01T00:00:00Z");
    List<PredictionRecord> records = ImmutableList.of(
        PredictionRecord.builder(t, 110).actual(100).build(),
        PredictionRecord.builder(t.plusSeconds(60), 999).build());
    AccuracyMetrics m = AccuracyCalculator.compute(records);
    assertEquals(1, m.count);
    assertEquals(10.0, m.mape, EPS);
  }

  @Test(expected = NoDataException.class)
  public void testNoActualizedRecords() throws Exception {
    AccuracyCalculator.compute(ImmutableList.of(
        PredictionRecord.builder(Instant.EPOCH, 1).build()));
  }

  @Test(expected = NoDataException.class)
  public void testEmptyArrays() throws Exception {
    AccuracyCalculator.compute(new double[0], new double[0]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBoundsOrdered() {
    PredictionRecord.builder(Instant.EPOCH, 1).interval(3, 2).build();
  }
}
