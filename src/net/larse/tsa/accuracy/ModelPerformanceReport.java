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

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;

/**
 * Everything known about a model's forecast quality over one evaluation window. When the window
 * holds no actualized predictions the metrics are zero, {@link #isMetricsAvailable()} is false
 * and {@link #getNote()} says why.
 */
public final class ModelPerformanceReport {
  /** The window evaluated and how much of it could be scored. */
  public static final class EvaluationPeriod {
    public final Instant start;
    public final Instant end;
    public final int totalPredictions;
    public final int actualizedPredictions;

    public EvaluationPeriod(Instant start, Instant end, int totalPredictions,
        int actualizedPredictions) {
      this.start = start;
      this.end = end;
      this.totalPredictions = totalPredictions;
      this.actualizedPredictions = actualizedPredictions;
    }

    @Override
    public String toString() {
      return String.format("[%s, %s] %d/%d actualized", start, end, actualizedPredictions,
          totalPredictions);
    }
  }

  public static final class Alert {
    public final String type;
    public final Severity severity;
    public final String message;
    public final String actionRequired;

    public Alert(String type, Severity severity, String message, String actionRequired) {
      this.type = type;
      this.severity = severity;
      this.message = message;
      this.actionRequired = actionRequired;
    }

    @Override
    public String toString() {
      return String.format("Alert[%s %s: %s]", type, severity, message);
    }
  }

  private final String modelId;
  private final String modelType;
  private final EvaluationPeriod evaluationPeriod;
  private final AccuracyMetrics accuracyMetrics;
  private final boolean metricsAvailable;
  private final String note;
  private final BiasAnalysis biasAnalysis;
  private final TrendAnalysis trendAnalysis;
  private final ConfidenceAnalysis confidenceAnalysis;
  private final DegradationAssessment degradation;
  private final ImmutableList<String> recommendations;
  private final ImmutableList<Alert> alerts;

  public ModelPerformanceReport(String modelId, String modelType,
      EvaluationPeriod evaluationPeriod, AccuracyMetrics accuracyMetrics,
      boolean metricsAvailable, String note, BiasAnalysis biasAnalysis,
      TrendAnalysis trendAnalysis, ConfidenceAnalysis confidenceAnalysis,
      DegradationAssessment degradation, List<String> recommendations, List<Alert> alerts) {
    this.modelId = modelId;
    this.modelType = modelType;
    this.evaluationPeriod = evaluationPeriod;
    this.accuracyMetrics = accuracyMetrics;
    this.metricsAvailable = metricsAvailable;
    this.note = note;
    this.biasAnalysis = biasAnalysis;
    this.trendAnalysis = trendAnalysis;
    this.confidenceAnalysis = confidenceAnalysis;
    this.degradation = degradation;
    this.recommendations = ImmutableList.copyOf(recommendations);
    this.alerts = ImmutableList.copyOf(alerts);
  }

  public String getModelId() {
    return modelId;
  }

  public String getModelType() {
    return modelType;
  }

  public EvaluationPeriod getEvaluationPeriod() {
    return evaluationPeriod;
  }

  /** Rounded metrics, see {@link AccuracyMetrics#rounded()}. */
  public AccuracyMetrics getAccuracyMetrics() {
    return accuracyMetrics;
  }

  public boolean isMetricsAvailable() {
    return metricsAvailable;
  }

  /** Why metrics are missing; null when they are available. */
  public String getNote() {
    return note;
  }

  public BiasAnalysis getBiasAnalysis() {
    return biasAnalysis;
  }

  public TrendAnalysis getTrendAnalysis() {
    return trendAnalysis;
  }

  public ConfidenceAnalysis getConfidenceAnalysis() {
    return confidenceAnalysis;
  }

  public DegradationAssessment getDegradation() {
    return degradation;
  }

  public ImmutableList<String> getRecommendations() {
    return recommendations;
  }

  public ImmutableList<Alert> getAlerts() {
    return alerts;
  }
}
