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
import java.util.List;
import org.apache.commons.math.util.MathUtils;

/**
 * How well the stated confidence of a forecast matches the share of actuals that land inside
 * its prediction intervals.
 */
public final class ConfidenceAnalysis {
  static final double CALIBRATION_TOLERANCE = 0.1;

  public enum Calibration {
    WELL_CALIBRATED,
    OVERCONFIDENT,
    UNDERCONFIDENT,
    UNKNOWN
  }

  public final double withinInterval;
  public final double averageConfidence;
  public final Calibration calibration;
  public final double confidenceAccuracy;

  public ConfidenceAnalysis(double withinInterval, double averageConfidence,
      Calibration calibration, double confidenceAccuracy) {
    this.withinInterval = withinInterval;
    this.averageConfidence = averageConfidence;
    this.calibration = Preconditions.checkNotNull(calibration);
    this.confidenceAccuracy = confidenceAccuracy;
  }

  /**
   * Records without bounds count as outside their interval. Shares and accuracy are rounded to
   * two decimals; the calibration is judged on the unrounded values.
   */
  public static ConfidenceAnalysis of(List<PredictionRecord> records) {
    List<PredictionRecord> actualized = AccuracyCalculator.actualized(records);
    if (actualized.isEmpty()) {
      return new ConfidenceAnalysis(0, 0, Calibration.UNKNOWN, 0);
    }
    int within = 0;
    double confidence = 0;
    for (PredictionRecord record : actualized) {
      if (record.isWithinInterval()) {
        within++;
      }
      confidence += record.getConfidence();
    }
    double share = (double) within / actualized.size();
    double average = confidence / actualized.size();
    double gap = Math.abs(share - average);

    Calibration calibration;
    if (gap < CALIBRATION_TOLERANCE) {
      calibration = Calibration.WELL_CALIBRATED;
    } else if (share < average) {
      calibration = Calibration.OVERCONFIDENT;
    } else {
      calibration = Calibration.UNDERCONFIDENT;
    }
    return new ConfidenceAnalysis(MathUtils.round(share, 2), MathUtils.round(average, 2),
        calibration, MathUtils.round(1 - gap, 2));
  }

  @Override
  public String toString() {
    return String.format("ConfidenceAnalysis[%s within=%.2f confidence=%.2f]", calibration,
        withinInterval, averageConfidence);
  }
}
