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

import java.util.Arrays;
import net.larse.tsa.helper.AlgorithmBase;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.InsufficientDataException;
import net.larse.tsa.helper.StatsHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seasonal decomposition of time series by Loess, after
 *
 * R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning (1990) STL:
 * A Seasonal-Trend Decomposition Procedure Based on Loess. Journal of Official Statistics, 6, 3-73.
 *
 * <p>This is a pragmatic variant: the low-pass step is a zero-phase single-pole filter
 * (forward then backward) instead of the moving-average cascade, and robustness is applied by
 * pulling observations toward the current fit with bisquare weights before the next pass.
 * Each pass:
 *
 * <ol>
 *   <li>detrend the (reweighted) input with the current trend;
 *   <li>Loess-smooth every cycle-subseries and reassemble;
 *   <li>low-pass the result and subtract, leaving the seasonal component;
 *   <li>Loess-smooth the deseasonalized input into the new trend;
 *   <li>remainder = original - seasonal - trend.
 * </ol>
 *
 * The pass count is bounded by {@link #MAX_ITERATIONS} (robust) or {@link #NON_ROBUST_ITERATIONS}.
 */
public class STLDecomposition {
  private static final Logger logger = LoggerFactory.getLogger(STLDecomposition.class);

  public static final int MAX_ITERATIONS = 15;
  public static final int NON_ROBUST_ITERATIONS = 2;

  // Residuals beyond this many MADs get zero robustness weight.
  private static final double BISQUARE_CUTOFF = 6.0;
  private static final double CONVERGENCE_TOLERANCE = 1e-9;

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Number of observations per seasonal cycle.")
    @Required
    public int period = 0;

    @Doc(help = "Span, in cycles, of the seasonal subseries smoother (ns).")
    @Optional
    public int seasonalSpan = 7;

    @Doc(help = "Span of the trend smoother (nt). 0 derives it from period and seasonalSpan.")
    @Optional
    public int trendSpan = 0;

    @Doc(help = "Span of the low-pass filter (nl). 0 uses the period.")
    @Optional
    public int lowPassSpan = 0;

    @Doc(help = "Down-weight outlying observations between passes.")
    @Optional
    public boolean robust = true;

    @Doc(help = "Upper bound on robust passes; never more than 15.")
    @Optional
    public int maxIterations = MAX_ITERATIONS;
  }

  private final int period;
  private final int seasonalSpan;
  private final int trendSpan;
  private final int lowPassSpan;
  private final boolean robust;
  private final int iterations;

  public STLDecomposition(int period) {
    this(argsFor(period));
  }

  public STLDecomposition(Args args) {
    if (args.period < 2) {
      throw new IllegalArgumentException("period must be at least 2: " + args.period);
    }
    if (args.seasonalSpan < 2) {
      throw new IllegalArgumentException("seasonalSpan must be at least 2: " + args.seasonalSpan);
    }
    this.period = args.period;
    this.seasonalSpan = args.seasonalSpan;
    this.trendSpan = args.trendSpan > 0
        ? args.trendSpan
        : defaultTrendSpan(args.period, args.seasonalSpan);
    this.lowPassSpan = args.lowPassSpan > 0 ? args.lowPassSpan : args.period;
    this.robust = args.robust;
    this.iterations = args.robust
        ? Math.max(1, Math.min(args.maxIterations, MAX_ITERATIONS))
        : NON_ROBUST_ITERATIONS;
  }

  private static Args argsFor(int period) {
    Args args = new Args();
    args.period = period;
    return args;
  }

  /** nt = ceil(1.5 * np / (1 - 1.5 / ns)). */
  static int defaultTrendSpan(int period, int seasonalSpan) {
    return (int) Math.ceil(1.5 * period / (1 - 1.5 / seasonalSpan));
  }

  public int getTrendSpan() {
    return trendSpan;
  }

  public DecompositionResult decompose(TimeSeries series) throws InsufficientDataException {
    return decompose(series.getValues());
  }

  /**
   * @throws InsufficientDataException when fewer than two full periods are supplied
   */
  public DecompositionResult decompose(double[] values) throws InsufficientDataException {
    int n = values.length;
    if (n < 2 * period) {
      throw new InsufficientDataException("STL decomposition", 2 * period, n);
    }

    double trendBandwidth = Math.min(1.0, (double) trendSpan / n);
    double[] y = values.clone();
    double[] trend = StatsHelper.movingAverage(values, period);
    double[] seasonal = new double[n];
    double[] remainder = new double[n];
    double scale = Math.max(1.0, ArrayHelper.maxAbs(values));

    int pass = 0;
    while (pass < iterations) {
      pass++;
      double[] detrended = ArrayHelper.subtract(y, trend);
      double[] cycle = smoothSubseries(detrended);
      double[] newSeasonal = ArrayHelper.subtract(cycle, lowPass(cycle, lowPassSpan));
      double[] newTrend = StatsHelper.loessSmooth(ArrayHelper.subtract(y, newSeasonal),
          trendBandwidth);

      double change = pass == 1 ? Double.POSITIVE_INFINITY
          : Math.max(maxDifference(newSeasonal, seasonal), maxDifference(newTrend, trend));
      seasonal = newSeasonal;
      trend = newTrend;
      for (int i = 0; i < n; i++) {
        remainder[i] = values[i] - seasonal[i] - trend[i];
      }

      if (change <= CONVERGENCE_TOLERANCE * scale) {
        logger.debug("STL converged after {} of {} passes", pass, iterations);
        break;
      }
      if (robust && pass < iterations) {
        double[] weights = robustnessWeights(remainder);
        for (int i = 0; i < n; i++) {
          double fit = seasonal[i] + trend[i];
          y[i] = fit + weights[i] * (values[i] - fit);
        }
      }
    }

    double[] seasonalPlusRemainder = ArrayHelper.add(seasonal, remainder);
    double[] trendPlusRemainder = ArrayHelper.add(trend, remainder);
    double remainderVariance = StatsHelper.variance(remainder);
    double seasonalStrength = strength(remainderVariance,
        StatsHelper.variance(seasonalPlusRemainder));
    double trendStrength = strength(remainderVariance, StatsHelper.variance(trendPlusRemainder));

    logger.debug("STL n={} period={} passes={} seasonalStrength={} trendStrength={}", n, period,
        pass, seasonalStrength, trendStrength);
    return new DecompositionResult(trend, seasonal, remainder.clone(), seasonalStrength,
        trendStrength, pass);
  }

  /**
   * Loess-smooth each cycle-subseries, i.e. the observations sharing a position within the
   * period, and put them back in place.
   */
  private double[] smoothSubseries(double[] detrended) {
    double[] result = new double[detrended.length];
    for (int position = 0; position < period; position++) {
      double[] subseries = ArrayHelper.stride(detrended, position, period);
      if (subseries.length == 0) {
        continue;
      }
      double bandwidth = Math.min(1.0, (double) seasonalSpan / subseries.length);
      ArrayHelper.scatter(StatsHelper.loessSmooth(subseries, bandwidth), result, position,
          period);
    }
    return result;
  }

  /** Single-pole recursive filter run forward and then backward, so it has no phase shift. */
  static double[] lowPass(double[] values, int span) {
    int n = values.length;
    double alpha = 2.0 / (span + 1);
    double[] forward = new double[n];
    forward[0] = values[0];
    for (int i = 1; i < n; i++) {
      forward[i] = forward[i - 1] + alpha * (values[i] - forward[i - 1]);
    }
    double[] result = new double[n];
    result[n - 1] = forward[n - 1];
    for (int i = n - 2; i >= 0; i--) {
      result[i] = result[i + 1] + alpha * (forward[i] - result[i + 1]);
    }
    return result;
  }

  /**
   * Bisquare weights (1 - u^2)^2 with u = |r| / (6 * MAD), zero for u >= 1. A remainder whose
   * MAD is zero gives unit weights.
   */
  static double[] robustnessWeights(double[] remainder) {
    double[] weights = new double[remainder.length];
    double h = BISQUARE_CUTOFF * StatsHelper.medianAbsoluteDeviation(remainder);
    if (h <= 0) {
      Arrays.fill(weights, 1.0);
      return weights;
    }
    for (int i = 0; i < remainder.length; i++) {
      double u = Math.abs(remainder[i]) / h;
      if (u < 1) {
        double t = 1 - u * u;
        weights[i] = t * t;
      }
    }
    return weights;
  }

  private static double strength(double remainderVariance, double totalVariance) {
    if (totalVariance <= 0) {
      return 0;
    }
    return 1 - remainderVariance / totalVariance;
  }

  private static double maxDifference(double[] a, double[] b) {
    double max = 0;
    for (int i = 0; i < a.length; i++) {
      max = Math.max(max, Math.abs(a[i] - b[i]));
    }
    return max;
  }
}
