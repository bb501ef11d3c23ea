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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link SeasonalAdjustment}. The three components are additive in the units of the
 * input: trend[i] + seasonal[i] + irregular[i] reproduces value[i]. The seasonal component
 * includes any trading-day and holiday effects that were removed.
 *
 * <p>Seasonal factors are additive offsets per position within the period, or multiplicative
 * ratios when the series was log transformed ({@link #isLogTransformed()}).
 */
public class SeasonalAdjustmentResult {
  private final double[] seasonal;
  private final double[] trend;
  private final double[] irregular;
  private final ImmutableMap<Integer, Double> seasonalFactors;
  private final ImmutableList<Outlier> outliers;
  private final boolean logTransformed;
  private final double[] arCoefficients;

  public SeasonalAdjustmentResult(double[] seasonal, double[] trend, double[] irregular,
      Map<Integer, Double> seasonalFactors, List<Outlier> outliers, boolean logTransformed,
      double[] arCoefficients) {
    this.seasonal = seasonal;
    this.trend = trend;
    this.irregular = irregular;
    this.seasonalFactors = ImmutableMap.copyOf(seasonalFactors);
    this.outliers = ImmutableList.copyOf(outliers);
    this.logTransformed = logTransformed;
    this.arCoefficients = arCoefficients;
  }

  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getIrregular() {
    return irregular.clone();
  }

  /** Input with the seasonal (and calendar) component removed. */
  public double[] getSeasonallyAdjusted() {
    double[] result = new double[trend.length];
    for (int i = 0; i < result.length; i++) {
      result[i] = trend[i] + irregular[i];
    }
    return result;
  }

  public ImmutableMap<Integer, Double> getSeasonalFactors() {
    return seasonalFactors;
  }

  public ImmutableList<Outlier> getOutliers() {
    return outliers;
  }

  public boolean isLogTransformed() {
    return logTransformed;
  }

  /** Autoregressive coefficients fitted to the differenced series. */
  public double[] getArCoefficients() {
    return arCoefficients.clone();
  }
}
