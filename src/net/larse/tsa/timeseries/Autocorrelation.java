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
import net.larse.tsa.helper.LinearSystemSolver;
import net.larse.tsa.helper.SingularSystemException;
import org.ejml.data.DenseMatrix64F;

/**
 * Sample autocorrelation and partial autocorrelation, plus the Yule-Walker fit they share.
 * Cost is O(n * maxLag) for the ACF; callers with long series should cap maxLag.
 */
public class Autocorrelation {
  private Autocorrelation() {}

  /**
   * Autocovariance at lags 0..maxLag normalized by the lag-0 value, all computed around the
   * full-series mean. Index 0 is always 1. A constant series has no defined correlation; it
   * is reported as 1 at lag 0 and 0 elsewhere.
   */
  public static double[] acf(double[] series, int maxLag) {
    int n = series.length;
    Preconditions.checkArgument(n > 0, "acf of an empty series");
    Preconditions.checkArgument(maxLag >= 0 && maxLag < n,
        "maxLag must be in [0, %s): %s", n, maxLag);

    double mean = 0;
    for (double v : series) {
      mean += v;
    }
    mean /= n;

    double c0 = 0;
    for (double v : series) {
      c0 += (v - mean) * (v - mean);
    }

    double[] result = new double[maxLag + 1];
    result[0] = 1.0;
    if (c0 <= 0) {
      return result;
    }
    for (int lag = 1; lag <= maxLag; lag++) {
      double sum = 0;
      for (int t = 0; t + lag < n; t++) {
        sum += (series[t] - mean) * (series[t + lag] - mean);
      }
      result[lag] = sum / c0;
    }
    return result;
  }

  /**
   * Partial autocorrelation: for each order k = 1..maxLag the Yule-Walker system of order k is
   * solved and its last coefficient becomes pacf[k]. Index 0 is 1.
   */
  public static double[] pacf(double[] series, int maxLag) throws SingularSystemException {
    double[] r = acf(series, maxLag);
    double[] result = new double[maxLag + 1];
    result[0] = 1.0;
    for (int k = 1; k <= maxLag; k++) {
      double[] phi = yuleWalker(r, k);
      result[k] = phi[k - 1];
    }
    return result;
  }

  /**
   * Autoregressive coefficients phi_1..phi_order from autocorrelations r[0..order] by solving
   * the Toeplitz system R phi = (r_1..r_order), R[i][j] = r[|i - j|].
   */
  public static double[] yuleWalker(double[] r, int order) throws SingularSystemException {
    Preconditions.checkArgument(order >= 1 && order < r.length,
        "order must be in [1, %s): %s", r.length, order);
    DenseMatrix64F toeplitz = new DenseMatrix64F(order, order);
    DenseMatrix64F rhs = new DenseMatrix64F(order, 1);
    for (int i = 0; i < order; i++) {
      for (int j = 0; j < order; j++) {
        toeplitz.set(i, j, r[Math.abs(i - j)]);
      }
      rhs.set(i, 0, r[i + 1]);
    }
    return LinearSystemSolver.solve(toeplitz, rhs);
  }
}
