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
package net.larse.tsa.helper;

import com.google.common.base.Preconditions;

/** Static array manipulation functions. */
public class ArrayHelper {
  private ArrayHelper() {}

  /** The sequence 0, 1, ..., n-1 as doubles. */
  public static double[] indices(int n) {
    double[] result = new double[n];
    for (int i = 0; i < n; i++) {
      result[i] = i;
    }
    return result;
  }

  /** Element-wise a - b. */
  public static double[] subtract(double[] a, double[] b) {
    checkSameLength(a, b);
    double[] result = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      result[i] = a[i] - b[i];
    }
    return result;
  }

  /** Element-wise a + b. */
  public static double[] add(double[] a, double[] b) {
    checkSameLength(a, b);
    double[] result = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      result[i] = a[i] + b[i];
    }
    return result;
  }

  /**
   * Largest |a[i] + b[i] + c[i] - expected[i]| over the arrays. Used to check that a
   * decomposition reassembles its input.
   */
  public static double maxReconstructionError(double[] expected, double[] a, double[] b,
      double[] c) {
    checkSameLength(expected, a);
    checkSameLength(expected, b);
    checkSameLength(expected, c);
    double max = 0;
    for (int i = 0; i < expected.length; i++) {
      max = Math.max(max, Math.abs(a[i] + b[i] + c[i] - expected[i]));
    }
    return max;
  }

  /** Largest absolute value in the array, 0 for an empty array. */
  public static double maxAbs(double[] values) {
    double max = 0;
    for (double v : values) {
      max = Math.max(max, Math.abs(v));
    }
    return max;
  }

  /**
   * Pick every {@code step}-th value starting at {@code offset}. This is how a cycle-subseries
   * (all observations at one position within the period) is pulled out of a series.
   */
  public static double[] stride(double[] values, int offset, int step) {
    Preconditions.checkArgument(step > 0 && offset >= 0, "bad stride %s/%s", offset, step);
    int count = offset >= values.length ? 0 : (values.length - offset + step - 1) / step;
    double[] result = new double[count];
    for (int i = 0; i < count; i++) {
      result[i] = values[offset + i * step];
    }
    return result;
  }

  /** Inverse of {@link #stride}: write {@code source} back at every {@code step}-th slot. */
  public static void scatter(double[] source, double[] target, int offset, int step) {
    for (int i = 0; i < source.length; i++) {
      target[offset + i * step] = source[i];
    }
  }

  private static void checkSameLength(double[] a, double[] b) {
    Preconditions.checkArgument(a.length == b.length,
        "array lengths differ: %s vs %s", a.length, b.length);
  }
}
