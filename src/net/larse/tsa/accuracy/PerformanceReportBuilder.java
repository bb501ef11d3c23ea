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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.larse.tsa.accuracy.ConfidenceAnalysis.Calibration;
import net.larse.tsa.accuracy.ModelPerformanceReport.Alert;
import net.larse.tsa.accuracy.ModelPerformanceReport.EvaluationPeriod;
import net.larse.tsa.helper.NoDataException;

/**
 * Assembles a {@link ModelPerformanceReport} from one window of prediction records and a
 * degradation assessment, and derives recommendations and alerts from the results:
 *
 * <ul>
 *   <li>MAPE above 20: retraining recommendation and a HIGH {@code high_mape} alert;
 *   <li>MAPE above 10: recommendation to monitor;
 *   <li>significant bias: feature engineering recommendation and a MEDIUM
 *       {@code significant_bias} alert;
 *   <li>over- or underconfident intervals: a recommendation;
 *   <li>detected degradation: a {@code performance_degradation} alert at its severity.
 * </ul>
 */
public class PerformanceReportBuilder {
  static final double HIGH_MAPE = 20;
  static final double ELEVATED_MAPE = 10;

  static final String NO_METRICS_NOTE =
      "No actualized predictions in the evaluation window; accuracy metrics are unavailable";

  private final BiasAnalyzer biasAnalyzer;

  public PerformanceReportBuilder() {
    this(new BiasAnalyzer());
  }

  public PerformanceReportBuilder(BiasAnalyzer biasAnalyzer) {
    this.biasAnalyzer = biasAnalyzer;
  }

  public ModelPerformanceReport build(String modelId, String modelType, Instant start,
      Instant end, List<PredictionRecord> records, DegradationAssessment degradation) {
    int actualized = 0;
    for (PredictionRecord record : records) {
      if (record.isActualized()) {
        actualized++;
      }
    }
    EvaluationPeriod period = new EvaluationPeriod(start, end, records.size(), actualized);

    AccuracyMetrics metrics;
    BiasAnalysis bias;
    boolean available = true;
    String note = null;
    try {
      metrics = AccuracyCalculator.compute(records).rounded();
      bias = biasAnalyzer.analyze(records);
    } catch (NoDataException e) {
      metrics = AccuracyMetrics.EMPTY;
      bias = BiasAnalysis.NONE;
      available = false;
      note = NO_METRICS_NOTE;
    }
    TrendAnalysis trend = TrendAnalysis.of(records);
    ConfidenceAnalysis confidence = ConfidenceAnalysis.of(records);

    List<String> recommendations = new ArrayList<>();
    List<Alert> alerts = new ArrayList<>();
    recommend(metrics, bias, confidence, degradation, recommendations, alerts);

    return new ModelPerformanceReport(modelId, modelType, period, metrics, available, note, bias,
        trend, confidence, degradation, recommendations, alerts);
  }

  static void recommend(AccuracyMetrics metrics, BiasAnalysis bias,
      ConfidenceAnalysis confidence, DegradationAssessment degradation,
      List<String> recommendations, List<Alert> alerts) {
    if (metrics.mape > HIGH_MAPE) {
      recommendations.add("High MAPE (>20%) - consider retraining the model with more data");
      alerts.add(new Alert("high_mape", Severity.HIGH, "Model accuracy is low with MAPE > 20%",
          "Model retraining required"));
    } else if (metrics.mape > ELEVATED_MAPE) {
      recommendations.add("Elevated MAPE (>10%) - monitor model performance regularly");
    }

    if (bias.isSignificant()) {
      String direction = bias.getDirection().name().toLowerCase(Locale.ROOT);
      recommendations.add(String.format(
          "Significant %s bias detected - review feature engineering or model configuration",
          direction));
      alerts.add(new Alert("significant_bias", Severity.MEDIUM,
          String.format("Model shows significant %s bias", direction),
          "Review and correct the model bias"));
    }

    if (confidence.calibration == Calibration.OVERCONFIDENT) {
      recommendations.add("Model is overconfident - prediction intervals are too narrow for "
          + "the observed accuracy");
    } else if (confidence.calibration == Calibration.UNDERCONFIDENT) {
      recommendations.add("Model is underconfident - prediction intervals are wider than "
          + "needed and can be narrowed");
    }

    if (degradation.isDetected()) {
      alerts.add(new Alert("performance_degradation", degradation.getSeverity(),
          String.format(Locale.ROOT, "Performance degradation detected: %.1f%%",
              degradation.getDegradationRate()),
          degradation.isTriggersRetraining() ? "Model retraining required" : "Monitor closely"));
    }
  }
}
