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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.larse.tsa.helper.AlgorithmBase;
import net.larse.tsa.helper.AnalysisException;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.InsufficientDataException;
import net.larse.tsa.helper.LinearFit;
import net.larse.tsa.helper.StatsHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodogram analysis of a series after removing its OLS trend.
 *
 * <p>For each harmonic k = 1..min(maxFrequencies, n/2) the discrete Fourier sums give
 * amplitude 2 * sqrt(re^2 + im^2) / n, phase atan2(im, re) and period n / k.
 *
 * <p>The significance attached to each harmonic is an approximation and not a spectral test:
 * it is 1 - exp(-amplitude^2 * n / (2 * variance)), i.e. the share of the detrended variance a
 * harmonic of that amplitude would explain, squashed into [0, 1]. Harmonics at or below
 * {@code significanceThreshold} (0.05) are dropped. This threshold is independent of any
 * confidence cut-offs used by higher level pattern heuristics.
 */
public class FourierAnalyzer {
  private static final Logger logger = LoggerFactory.getLogger(FourierAnalyzer.class);

  static final int MIN_OBSERVATIONS = 4;
  // Residual variance at this level relative to the squared data scale is rounding noise.
  private static final double RESIDUAL_VARIANCE_TOLERANCE = 1e-20;

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Highest harmonic index examined. Capped at n / 2.")
    @Optional
    public int maxFrequencies = 10;

    @Doc(help = "Components whose significance does not exceed this value are discarded.")
    @Optional
    public double significanceThreshold = 0.05;
  }

  private final Args args;

  public FourierAnalyzer() {
    this(new Args());
  }

  public FourierAnalyzer(Args args) {
    if (args.maxFrequencies < 1) {
      throw new IllegalArgumentException("maxFrequencies must be positive: " + args.maxFrequencies);
    }
    this.args = args;
  }

  public List<FourierComponent> analyze(TimeSeries series) throws AnalysisException {
    return analyze(series.getValues());
  }

  /**
   * Returns the retained components sorted by descending amplitude. A series without variance
   * after detrending has no periodic content and yields an empty list.
   */
  public List<FourierComponent> analyze(double[] values) throws AnalysisException {
    int n = values.length;
    if (n < MIN_OBSERVATIONS) {
      throw new InsufficientDataException("Fourier analysis", MIN_OBSERVATIONS, n);
    }

    LinearFit trend = StatsHelper.linearRegression(values);
    double[] detrended = StatsHelper.detrend(values, trend);
    double variance = StatsHelper.variance(detrended);
    double scale = ArrayHelper.maxAbs(values);
    if (variance <= RESIDUAL_VARIANCE_TOLERANCE * Math.max(1.0, scale * scale)) {
      logger.debug("No variance left after detrending {} observations", n);
      return ImmutableList.of();
    }

    int maxHarmonic = Math.min(args.maxFrequencies, n / 2);
    List<FourierComponent> components = new ArrayList<>();
    for (int k = 1; k <= maxHarmonic; k++) {
      FourierComponent c = harmonic(detrended, k, variance);
      if (c.significance > args.significanceThreshold) {
        components.add(c);
      }
    }
    components.sort(Comparator.comparingDouble((FourierComponent c) -> c.amplitude).reversed());

    logger.debug("Fourier analysis of {} observations kept {} of {} harmonics", n,
        components.size(), maxHarmonic);
    return ImmutableList.copyOf(components);
  }

  private static FourierComponent harmonic(double[] detrended, int k, double variance) {
    int n = detrended.length;
    double omega = 2 * Math.PI * k / n;
    double real = 0;
    double imag = 0;
    for (int t = 0; t < n; t++) {
      real += detrended[t] * Math.cos(omega * t);
      imag -= detrended[t] * Math.sin(omega * t);
    }

    double amplitude = 2 * Math.sqrt(real * real + imag * imag) / n;
    // The Nyquist harmonic has no conjugate partner, so its amplitude is not doubled.
    if (2 * k == n) {
      amplitude /= 2;
    }
    double phase = Math.atan2(imag, real);
    double significance = 1 - Math.exp(-amplitude * amplitude * n / (2 * variance));
    return new FourierComponent(k, (double) k / n, amplitude, phase, (double) n / k,
        significance);
  }

  /**
   * Rebuild n observations from {@code components} plus the linear {@code trend} that was
   * removed before analysis. With every harmonic up to n / 2 retained this reproduces the
   * input; each discarded harmonic adds at most its amplitude to the pointwise error.
   */
  public static double[] reconstruct(List<FourierComponent> components, int n, LinearFit trend) {
    double[] result = new double[n];
    for (int t = 0; t < n; t++) {
      double value = trend == null ? 0 : trend.valueAt(t);
      for (FourierComponent c : components) {
        value += c.valueAt(t);
      }
      result[t] = value;
    }
    return result;
  }
}
