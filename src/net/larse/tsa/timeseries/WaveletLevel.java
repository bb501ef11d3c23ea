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
 * Detail coefficients of one Haar decomposition level. Level 1 is the finest; higher levels
 * describe slower variation.
 */
public final class WaveletLevel {
  public final int level;
  private final double[] coefficients;
  private final double[] frequencies;
  private final double[] timeLocalization;

  public WaveletLevel(int level, double[] coefficients, double[] frequencies,
      double[] timeLocalization) {
    this.level = level;
    this.coefficients = coefficients;
    this.frequencies = frequencies;
    this.timeLocalization = timeLocalization;
  }

  public double[] getCoefficients() {
    return coefficients.clone();
  }

  /** Rough frequency, in cycles per observation, attributed to each coefficient. */
  public double[] getFrequencies() {
    return frequencies.clone();
  }

  /** Share of this level's energy carried by each coefficient; sums to 1 unless all are zero. */
  public double[] getTimeLocalization() {
    return timeLocalization.clone();
  }

  public double energy() {
    double sum = 0;
    for (double c : coefficients) {
      sum += c * c;
    }
    return sum;
  }

  @Override
  public String toString() {
    return String.format("WaveletLevel[level=%d, coefficients=%d, energy=%.4g]", level,
        coefficients.length, energy());
  }
}
