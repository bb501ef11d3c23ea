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
package net.larse.tsa.accuracy;

import java.util.List;
import net.larse.tsa.helper.DegenerateInputException;
import net.larse.tsa.helper.StatsHelper;
import org.apache.commons.math.util.MathUtils;

/**
 * Whether a forecast moves the same way as the actuals. Directions come from least squares
 * slopes against the record index; a slope within 1% of the mean absolute level per step is
 * STABLE. The trend accuracy maps the correlation r of the first differences onto [0, 1] as
 * (r + 1) / 2.
 */
public final class TrendAnalysis {
  static final double STABLE_TOLERANCE = 0.01;
  static final double EXCELLENT_SLOPE_RATIO = 0.2;
  static final int MIN_POINTS = 3;

  public enum Direction {
    INCREASING,
    DECREASING,
    STABLE
  }

  public enum Alignment {
    EXCELLENT,
    GOOD,
    POOR
  }

  public final Direction forecastTrend;
  public final Direction actualTrend;
  public final Alignment alignment;
  public final double trendAccuracy;

  public TrendAnalysis(Direction forecastTrend, Direction actualTrend, Alignment alignment,
      double trendAccuracy) {
    this.forecastTrend = forecastTrend;
    this.actualTrend = actualTrend;
    this.alignment = alignment;
    this.trendAccuracy = trendAccuracy;
  }

  public static TrendAnalysis of(List<PredictionRecord> records) {
    List<PredictionRecord> actualized = AccuracyCalculator.actualized(records);
    int n = actualized.size();
    if (n < MIN_POINTS) {
      return new TrendAnalysis(Direction.STABLE, Direction.STABLE, Alignment.GOOD, 0);
    }
    double[] predicted = new double[n];
    double[] actual = new double[n];
    for (int i = 0; i < n; i++) {
      predicted[i] = actualized.get(i).getPredictedValue();
      actual[i] = actualized.get(i).getActualValue();
    }

    double predictedSlope;
    double actualSlope;
    try {
      predictedSlope = StatsHelper.linearRegression(predicted).slope;
      actualSlope = StatsHelper.linearRegression(actual).slope;
    } catch (DegenerateInputException e) {
      // the index 0..n-1 is never constant once n >= MIN_POINTS
      throw new IllegalStateException(e);
    }
    Direction forecastTrend = direction(predictedSlope, predicted);
    Direction actualTrend = direction(actualSlope, actual);

    Alignment alignment;
    if (forecastTrend != actualTrend) {
      alignment = Alignment.POOR;
    } else if (Math.abs(predictedSlope - actualSlope)
        <= EXCELLENT_SLOPE_RATIO * Math.abs(actualSlope)) {
      alignment = Alignment.EXCELLENT;
    } else {
      alignment = Alignment.GOOD;
    }

    double r = StatsHelper.correlation(differences(predicted), differences(actual));
    return new TrendAnalysis(forecastTrend, actualTrend, alignment,
        MathUtils.round((r + 1) / 2, 2));
  }

  private static Direction direction(double slope, double[] values) {
    double level = 0;
    for (double v : values) {
      level += Math.abs(v);
    }
    double tolerance = STABLE_TOLERANCE * level / values.length;
    if (slope > tolerance) {
      return Direction.INCREASING;
    }
    if (slope < -tolerance) {
      return Direction.DECREASING;
    }
    return Direction.STABLE;
  }

  private static double[] differences(double[] values) {
    double[] result = new double[values.length - 1];
    for (int i = 0; i < result.length; i++) {
      result[i] = values[i + 1] - values[i];
    }
    return result;
  }

  @Override
  public String toString() {
    return String.format("TrendAnalysis[forecast=%s actual=%s %s accuracy=%.2f]", forecastTrend,
        actualTrend, alignment, trendAccuracy);
  }
}
