/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsa.timeseries;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * An immutable ordered sequence of (timestamp, value) observations with strictly increasing
 * timestamps. No fixed cadence is enforced; decomposers rely on a caller-declared period.
 */
public final class TimeSeries {
  private static final Instant DEFAULT_START = Instant.parse("2000-01-01T00:00:00Z");

  private final Instant[] timestamps;
  private final double[] values;

  public TimeSeries(Instant[] timestamps, double[] values) {
    Preconditions.checkNotNull(timestamps, "timestamps");
    Preconditions.checkNotNull(values, "values");
    Preconditions.checkArgument(timestamps.length == values.length,
        "%s timestamps for %s values", timestamps.length, values.length);
    for (int i = 0; i < timestamps.length; i++) {
      Preconditions.checkNotNull(timestamps[i], "timestamp %s is null", i);
      Preconditions.checkArgument(!Double.isNaN(values[i]), "value %s is NaN", i);
      if (i > 0) {
        Preconditions.checkArgument(timestamps[i].isAfter(timestamps[i - 1]),
            "timestamps must be strictly increasing at index %s", i);
      }
    }
    this.timestamps = timestamps.clone();
    this.values = values.clone();
  }

  /** Observations spaced {@code step} apart starting at {@code start}. */
  public static TimeSeries regular(Instant start, Duration step, double... values) {
    Preconditions.checkArgument(!step.isNegative() && !step.isZero(), "step must be positive");
    Instant[] timestamps = new Instant[values.length];
    for (int i = 0; i < values.length; i++) {
      timestamps[i] = start.plus(step.multipliedBy(i));
    }
    return new TimeSeries(timestamps, values);
  }

  /** Daily observations from 2000-01-01, for callers that only care about the values. */
  public static TimeSeries of(double... values) {
    return regular(DEFAULT_START, Duration.ofDays(1), values);
  }

  public int size() {
    return values.length;
  }

  public double getValue(int index) {
    return values[index];
  }

  public Instant getTimestamp(int index) {
    return timestamps[index];
  }

  /** A copy of the values. */
  public double[] getValues() {
    return values.clone();
  }

  /** A copy of the timestamps. */
  public Instant[] getTimestamps() {
    return timestamps.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeSeries)) {
      return false;
    }
    TimeSeries other = (TimeSeries) o;
    return Arrays.equals(timestamps, other.timestamps) && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(timestamps) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    if (values.length == 0) {
      return "TimeSeries[empty]";
    }
    return String.format("TimeSeries[%d points, %s .. %s]", values.length, timestamps[0],
        timestamps[values.length - 1]);
  }
}
