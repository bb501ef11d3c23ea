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
import java.util.Collections;
import java.util.List;
import net.larse.tsa.helper.AlgorithmBase;
import net.larse.tsa.helper.InsufficientDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-level Haar discrete wavelet transform.
 *
 * <p>Each level combines adjacent pairs (a, b) into approximation (a + b) / sqrt(2) and detail
 * (a - b) / sqrt(2). An odd trailing sample is carried into the approximation unchanged. The
 * next level works on the approximation.
 */
public class WaveletTransform {
  private static final Logger logger = LoggerFactory.getLogger(WaveletTransform.class);

  private static final double SQRT2 = Math.sqrt(2.0);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Number of decomposition levels. Capped at floor(log2(n)).")
    @Optional
    public int levels = 3;
  }

  private final Args args;

  public WaveletTransform() {
    this(new Args());
  }

  public WaveletTransform(Args args) {
    if (args.levels < 1) {
      throw new IllegalArgumentException("levels must be positive: " + args.levels);
    }
    this.args = args;
  }

  public List<WaveletLevel> transform(TimeSeries series) throws InsufficientDataException {
    return transform(series.getValues());
  }

  /**
   * Returns one {@link WaveletLevel} of detail coefficients per level, coarsest first.
   *
   * @throws InsufficientDataException for fewer than two observations
   */
  public List<WaveletLevel> transform(double[] values) throws InsufficientDataException {
    if (values.length < 2) {
      throw new InsufficientDataException("Haar wavelet transform", 2, values.length);
    }
    int maxLevels = 31 - Integer.numberOfLeadingZeros(values.length);
    int levels = Math.min(args.levels, maxLevels);

    List<WaveletLevel> result = new ArrayList<>(levels);
    double[] approximation = values;
    for (int level = 1; level <= levels && approximation.length >= 2; level++) {
      double[][] step = haarStep(approximation);
      approximation = step[0];
      result.add(describe(level, step[1]));
    }
    Collections.reverse(result);

    logger.debug("Haar transform of {} observations produced {} levels", values.length,
        result.size());
    return ImmutableList.copyOf(result);
  }

  /** One analysis step: {approximation, detail}. */
  static double[][] haarStep(double[] values) {
    int pairs = values.length / 2;
    boolean odd = values.length % 2 == 1;
    double[] approximation = new double[pairs + (odd ? 1 : 0)];
    double[] detail = new double[pairs];
    for (int i = 0; i < pairs; i++) {
      double a = values[2 * i];
      double b = values[2 * i + 1];
      approximation[i] = (a + b) / SQRT2;
      detail[i] = (a - b) / SQRT2;
    }
    if (odd) {
      approximation[pairs] = values[values.length - 1];
    }
    return new double[][] {approximation, detail};
  }

  private static WaveletLevel describe(int level, double[] detail) {
    int m = detail.length;
    double baseFrequency = 0.5 / Math.pow(2, level);
    double[] frequencies = new double[m];
    double energy = 0;
    for (int i = 0; i < m; i++) {
      // spread linearly across the dyadic band [base, 2 * base)
      frequencies[i] = baseFrequency * (1 + (double) i / m);
      energy += detail[i] * detail[i];
    }

    double[] localization = new double[m];
    if (energy > 0) {
      for (int i = 0; i < m; i++) {
        localization[i] = detail[i] * detail[i] / energy;
      }
    }
    return new WaveletLevel(level, detail, frequencies, localization);
  }
}
