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
 * One harmonic found by {@link FourierAnalyzer}.
 *
 * <p>{@code significance} lies in [0, 1] but is a heuristic score, not a calibrated p-value.
 */
public final class FourierComponent {
  /** Harmonic index k; the component completes k cycles over the analysed window. */
  public final int harmonic;

  /** Cycles per observation, k / n. */
  public final double frequency;

  public final double amplitude;

  /** Phase in radians such that the component is amplitude * cos(2 pi k t / n + phase). */
  public final double phase;

  /** Observations per cycle, n / k. */
  public final double period;

  public final double significance;

  public FourierComponent(int harmonic, double frequency, double amplitude, double phase,
      double period, double significance) {
    this.harmonic = harmonic;
    this.frequency = frequency;
    this.amplitude = amplitude;
    this.phase = phase;
    this.period = period;
    this.significance = significance;
  }

  /** Value of this component at observation index t. */
  public double valueAt(int t) {
    return amplitude * Math.cos(2 * Math.PI * frequency * t + phase);
  }

  @Override
  public String toString() {
    return String.format("FourierComponent[k=%d, period=%.3f, amplitude=%.4g, phase=%.3f, "
        + "significance=%.3f]", harmonic, period, amplitude, phase, significance);
  }
}
