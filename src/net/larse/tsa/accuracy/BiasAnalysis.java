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

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Systematic error profile of a forecast. {@code overallBias} is in value units, the other bias
 * figures are percentage errors (predicted - actual) / actual * 100. All are rounded to two
 * decimals.
 */
public final class BiasAnalysis {
  public enum BiasDirection {
    UNDERFORECAST,
    OVERFORECAST,
    NEUTRAL
  }

  public enum BiasPattern {
    SYSTEMATIC,
    RANDOM,
    SEASONAL
  }

  public enum BiasTrend {
    INCREASING,
    DECREASING,
    STABLE
  }

  /** Placeholder for windows without actualized predictions. */
  public static final BiasAnalysis NONE = new BiasAnalysis(0, BiasDirection.NEUTRAL, false,
      BiasPattern.RANDOM, 0, 0, BiasTrend.STABLE, ImmutableMap.<String, Double>of());

  private final double overallBias;
  private final BiasDirection direction;
  private final boolean significant;
  private final BiasPattern pattern;
  private final double meanBias;
  private final double medianBias;
  private final BiasTrend trend;
  private final ImmutableMap<String, Double> seasonalBias;

  public BiasAnalysis(double overallBias, BiasDirection direction, boolean significant,
      BiasPattern pattern, double meanBias, double medianBias, BiasTrend trend,
      Map<String, Double> seasonalBias) {
    this.overallBias = overallBias;
    this.direction = direction;
    this.significant = significant;
    this.pattern = pattern;
    this.meanBias = meanBias;
    this.medianBias = medianBias;
    this.trend = trend;
    this.seasonalBias = ImmutableMap.copyOf(seasonalBias);
  }

  /** Mean of predicted - actual. */
  public double getOverallBias() {
    return overallBias;
  }

  public BiasDirection getDirection() {
    return direction;
  }

  /** Mean percentage error beyond 5% either way. */
  public boolean isSignificant() {
    return significant;
  }

  public BiasPattern getPattern() {
    return pattern;
  }

  public double getMeanBias() {
    return meanBias;
  }

  public double getMedianBias() {
    return medianBias;
  }

  public BiasTrend getTrend() {
    return trend;
  }

  /** Mean percentage error per calendar label, in order of first appearance. */
  public ImmutableMap<String, Double> getSeasonalBias() {
    return seasonalBias;
  }

  @Override
  public String toString() {
    return String.format("BiasAnalysis[%s %s significant=%s mean=%.2f median=%.2f trend=%s]",
        direction, pattern, significant, meanBias, medianBias, trend);
  }
}
