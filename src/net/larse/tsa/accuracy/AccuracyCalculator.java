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

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.larse.tsa.helper.NoDataException;

/**
 * Accuracy metrics for paired actual and predicted values.
 *
 * <p>MAPE averages |a - p| / |a| * 100 over the pairs whose actual is non-zero; a window where
 * every actual is zero reports MAPE 0. R^2 is 1 when the actuals have no spread. Theil's U is
 * RMS(a - p) / (RMS(a) + RMS(p)) and 0 when both series are all zero.
 */
public class AccuracyCalculator {
  private AccuracyCalculator() {}

  public static AccuracyMetrics compute(List<PredictionRecord> records) throws NoDataException {
    List<PredictionRecord> actualized = actualized(records);
    DoubleArrayList actual = new DoubleArrayList(actualized.size());
    DoubleArrayList predicted = new DoubleArrayList(actualized.size());
    for (PredictionRecord record : actualized) {
      actual.add(record.getActualValue().doubleValue());
      predicted.add(record.getPredictedValue());
    }
    return compute(actual.toDoubleArray(), predicted.toDoubleArray());
  }

  /**
   * @throws NoDataException if there is no pair to evaluate
   */
  public static AccuracyMetrics compute(double[] actual, double[] predicted)
      throws NoDataException {
    Preconditions.checkArgument(actual.length == predicted.length,
        "actual and predicted differ in length: %s vs %s", actual.length, predicted.length);
    int n = actual.length;
    if (n == 0) {
      throw new NoDataException("No actualized predictions to evaluate");
    }

    double percentageSum = 0;
    int percentageCount = 0;
    double squaredError = 0;
    double absoluteError = 0;
    double signedError = 0;
    double actualSquares = 0;
    double predictedSquares = 0;
    double actualMean = 0;
    for (int i = 0; i < n; i++) {
      double a = actual[i];
      double p = predicted[i];
      double e = a - p;
      if (a != 0) {
        percentageSum += Math.abs(e / a);
        percentageCount++;
      }
      squaredError += e * e;
      absoluteError += Math.abs(e);
      signedError += p - a;
      actualSquares += a * a;
      predictedSquares += p * p;
      actualMean += a;
    }
    actualMean /= n;

    double totalSquares = 0;
    for (double a : actual) {
      totalSquares += (a - actualMean) * (a - actualMean);
    }

    double mape = percentageCount > 0 ? percentageSum / percentageCount * 100 : 0;
    double rmse = Math.sqrt(squaredError / n);
    double r2 = totalSquares == 0 ? 1 : 1 - squaredError / totalSquares;
    double scale = Math.sqrt(actualSquares / n) + Math.sqrt(predictedSquares / n);
    double theilU = scale == 0 ? 0 : rmse / scale;

    return new AccuracyMetrics(mape, rmse, absoluteError / n, signedError / n,
        Math.max(0, 100 - mape), r2, theilU, n);
  }

  /** Actualized records in timestamp order. */
  static List<PredictionRecord> actualized(List<PredictionRecord> records) {
    List<PredictionRecord> result = new ArrayList<>(records.size());
    for (PredictionRecord record : records) {
      if (record.isActualized()) {
        result.add(record);
      }
    }
    result.sort(Comparator.comparing(PredictionRecord::getTimestamp));
    return result;
  }
}
