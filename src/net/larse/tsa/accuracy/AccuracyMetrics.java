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

import org.apache.commons.math.util.MathUtils;

/**
 * Point-forecast accuracy over a set of actualized predictions. MAPE, accuracy and the bias
 * figures are percentages or value units as named; R^2 and Theil's U are dimensionless.
 */
public final class AccuracyMetrics {
  /** All zero; stands in for a window without actualized predictions. */
  public static final AccuracyMetrics EMPTY = new AccuracyMetrics(0, 0, 0, 0, 0, 0, 0, 0);

  public final double mape;
  public final double rmse;
  public final double mae;
  public final double bias;
  public final double accuracy;
  public final double r2;
  public final double theilU;
  public final int count;

  public AccuracyMetrics(double mape, double rmse, double mae, double bias, double accuracy,
      double r2, double theilU, int count) {
    this.mape = mape;
    this.rmse = rmse;
    this.mae = mae;
    this.bias = bias;
    this.accuracy = accuracy;
    this.r2 = r2;
    this.theilU = theilU;
    this.count = count;
  }

  /** Report form: two decimals, three for R^2 and Theil's U. */
  public AccuracyMetrics rounded() {
    return new AccuracyMetrics(MathUtils.round(mape, 2), MathUtils.round(rmse, 2),
        MathUtils.round(mae, 2), MathUtils.round(bias, 2), MathUtils.round(accuracy, 2),
        MathUtils.round(r2, 3), MathUtils.round(theilU, 3), count);
  }

  @Override
  public String toString() {
    return String.format(
        "AccuracyMetrics[n=%d mape=%.4f rmse=%.4f mae=%.4f bias=%.4f accuracy=%.4f r2=%.4f u=%.4f]",
        count, mape, rmse, mae, bias, accuracy, r2, theilU);
  }
}
