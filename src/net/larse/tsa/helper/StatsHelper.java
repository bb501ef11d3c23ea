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
package net.larse.tsa.helper;

import com.google.common.base.Preconditions;
import org.apache.commons.math.stat.StatUtils;
import org.apache.commons.math.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math.stat.descriptive.moment.Variance;
import org.apache.commons.math.stat.regression.SimpleRegression;

/** Static numeric primitives shared by the decomposers and the accuracy engine. */
public class StatsHelper {
  // Loess falls back to the weighted mean when the weighted spread of x is below this.
  private static final double DEGENERATE_TOLERANCE = 1e-12;

  private StatsHelper() {}

  /**
   * Ordinary least squares of y on x.
   *
   * @throws DegenerateInputException when x is constant or has fewer than two points
   */
  public static LinearFit linearRegression(double[] x, double[] y)
      throws DegenerateInputException {
    Preconditions.checkArgument(x.length == y.length,
        "x and y differ in length: %s vs %s", x.length, y.length);
    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < x.length; i++) {
      regression.addData(x[i], y[i]);
    }

    double slope = regression.getSlope();
    if (Double.isNaN(slope)) {
      throw new DegenerateInputException(
          "linear regression needs at least two distinct x values (n=" + x.length + ")");
    }
    return new LinearFit(slope, regression.getIntercept());
  }

  /** Regression of y on its index 0..n-1. */
  public static LinearFit linearRegression(double[] y) throws DegenerateInputException {
    return linearRegression(ArrayHelper.indices(y.length), y);
  }

  /** The residuals of y after removing its OLS line against the index. */
  public static double[] detrend(double[] y, LinearFit fit) {
    double[] result = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      result[i] = y[i] - fit.valueAt(i);
    }
    return result;
  }

  /**
   * Centered moving average. The window shrinks at both ends of the series instead of padding,
   * so every output is the plain mean of the points that exist.
   */
  public static double[] movingAverage(double[] series, int window) {
    Preconditions.checkArgument(window >= 1, "window must be positive: %s", window);
    int n = series.length;
    double[] prefix = new double[n + 1];
    for (int i = 0; i < n; i++) {
      prefix[i + 1] = prefix[i] + series[i];
    }

    double[] result = new double[n];
    int before = window / 2;
    int after = window - 1 - before;
    for (int i = 0; i < n; i++) {
      int lo = Math.max(0, i - before);
      int hi = Math.min(n - 1, i + after);
      result[i] = (prefix[hi + 1] - prefix[lo]) / (hi - lo + 1);
    }
    return result;
  }

  /** Loess smoothing without robustness weights. */
  public static double[] loessSmooth(double[] series, double bandwidth) {
    return loessSmooth(series, bandwidth, null);
  }

  /**
   * Local linear regression with tricube weights. The neighbourhood radius is
   * h = ceil(bandwidth * n); point j gets weight (1 - u^3)^3 for u = |i - j| / h below one,
   * multiplied by {@code robustnessWeights[j]} when given.
   */
  public static double[] loessSmooth(double[] series, double bandwidth,
      double[] robustnessWeights) {
    Preconditions.checkArgument(bandwidth > 0 && bandwidth <= 1,
        "bandwidth must be in (0, 1]: %s", bandwidth);
    Preconditions.checkArgument(robustnessWeights == null
        || robustnessWeights.length == series.length, "weights length mismatch");
    int n = series.length;
    double[] result = new double[n];
    if (n == 0) {
      return result;
    }
    int h = Math.max(1, (int) Math.ceil(bandwidth * n));

    for (int i = 0; i < n; i++) {
      int lo = Math.max(0, i - h + 1);
      int hi = Math.min(n - 1, i + h - 1);

      double sumW = 0;
      double sumWX = 0;
      double sumWY = 0;
      for (int j = lo; j <= hi; j++) {
        double w = tricube(Math.abs(i - j) / (double) h);
        if (robustnessWeights != null) {
          w *= robustnessWeights[j];
        }
        sumW += w;
        sumWX += w * j;
        sumWY += w * series[j];
      }
      if (sumW <= 0) {
        result[i] = series[i];
        continue;
      }

      double meanX = sumWX / sumW;
      double meanY = sumWY / sumW;
      double sxx = 0;
      double sxy = 0;
      for (int j = lo; j <= hi; j++) {
        double w = tricube(Math.abs(i - j) / (double) h);
        if (robustnessWeights != null) {
          w *= robustnessWeights[j];
        }
        sxx += w * (j - meanX) * (j - meanX);
        sxy += w * (j - meanX) * (series[j] - meanY);
      }
      // Fall back to the local weighted mean when only one abscissa carries weight.
      result[i] = sxx > DEGENERATE_TOLERANCE ? meanY + sxy / sxx * (i - meanX) : meanY;
    }
    return result;
  }

  static double tricube(double u) {
    if (u >= 1) {
      return 0;
    }
    double t = 1 - u * u * u;
    return t * t * t;
  }

  public static double mean(double[] values) {
    Preconditions.checkArgument(values.length > 0, "mean of an empty array");
    return StatUtils.mean(values);
  }

  public static double median(double[] values) {
    Preconditions.checkArgument(values.length > 0, "median of an empty array");
    return StatUtils.percentile(values, 50.0);
  }

  /** Median absolute deviation around the median, unscaled. */
  public static double medianAbsoluteDeviation(double[] values) {
    double median = median(values);
    double[] deviations = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      deviations[i] = Math.abs(values[i] - median);
    }
    return median(deviations);
  }

  /** Population variance (divides by n). */
  public static double variance(double[] values) {
    Preconditions.checkArgument(values.length > 0, "variance of an empty array");
    return new Variance(false).evaluate(values);
  }

  /** Pearson correlation; 0 rather than NaN when either series has no variance. */
  public static double correlation(double[] x, double[] y) {
    Preconditions.checkArgument(x.length == y.length,
        "x and y differ in length: %s vs %s", x.length, y.length);
    if (x.length < 2 || variance(x) <= 0 || variance(y) <= 0) {
      return 0;
    }
    return new PearsonsCorrelation().correlation(x, y);
  }
}
