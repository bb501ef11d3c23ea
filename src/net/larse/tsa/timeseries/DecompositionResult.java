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

/**
 * Trend, seasonal and remainder components of equal length to the input, with
 * trend[i] + seasonal[i] + remainder[i] equal to the input value up to rounding.
 *
 * <p>Strength measures are kept raw: with a degenerate remainder they can drop below zero.
 * {@link #getSeasonalStrength()} and {@link #getTrendStrength()} clamp into [0, 1], the
 * {@code getRaw*} accessors expose the unclamped values for diagnostics.
 */
public class DecompositionResult {
  private final double[] trend;
  private final double[] seasonal;
  private final double[] remainder;
  private final double rawSeasonalStrength;
  private final double rawTrendStrength;
  private final int iterations;

  public DecompositionResult(double[] trend, double[] seasonal, double[] remainder,
      double rawSeasonalStrength, double rawTrendStrength, int iterations) {
    if (trend.length != seasonal.length || trend.length != remainder.length) {
      throw new IllegalArgumentException("component lengths differ");
    }
    this.trend = trend;
    this.seasonal = seasonal;
    this.remainder = remainder;
    this.rawSeasonalStrength = rawSeasonalStrength;
    this.rawTrendStrength = rawTrendStrength;
    this.iterations = iterations;
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double[] getRemainder() {
    return remainder.clone();
  }

  public int size() {
    return trend.length;
  }

  public double getSeasonalStrength() {
    return clamp(rawSeasonalStrength);
  }

  public double getTrendStrength() {
    return clamp(rawTrendStrength);
  }

  public double getRawSeasonalStrength() {
    return rawSeasonalStrength;
  }

  public double getRawTrendStrength() {
    return rawTrendStrength;
  }

  /** Number of passes the decomposer ran before stopping. */
  public int getIterations() {
    return iterations;
  }

  private static double clamp(double v) {
    return Math.max(0, Math.min(1, v));
  }
}
