package net.larse.tsa.timeseries;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import java.time.Duration;
import java.time.Instant;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TimeSeriesTest {
  private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

  @Test
  public void testRegularSpacing() {
    TimeSeries series = TimeSeries.regular(T0, Duration.ofHours(6), 1, 2, 3);
    assertEquals(3, series.size());
    assertEquals(T0.plus(Duration.ofHours(12)), series.getTimestamp(2));
    assertEquals(2.0, series.getValue(1), 0);
  }

  @Test
  public void testValuesAreCopied() {
    double[] values = {1, 2, 3};
    TimeSeries series = TimeSeries.of(values);
    values[0] = 99;
    series.getValues()[1] = 99;
    assertEquals(1.0, series.getValue(0), 0);
    assertEquals(2.0, series.getValue(1), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTimestampsMustIncrease() {
    new TimeSeries(new Instant[] {T0, T0}, new double[] {1, 2});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNaNRejected() {
    TimeSeries.of(1, Double.NaN, 3);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLengthMismatchRejected() {
    new TimeSeries(new Instant[] {T0}, new double[] {1, 2});
  }

  @Test
  public void testEquality() {
    assertEquals(TimeSeries.of(1, 2), TimeSeries.of(1, 2));
    assertEquals(TimeSeries.of(1, 2).hashCode(), TimeSeries.of(1, 2).hashCode());
    assertNotEquals(TimeSeries.of(1, 2), TimeSeries.of(1, 3));
  }
}
