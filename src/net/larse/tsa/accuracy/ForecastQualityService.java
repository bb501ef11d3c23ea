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
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import net.larse.tsa.helper.NoDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forecast quality operations for stored model predictions. History comes from a
 * {@link PredictionHistoryProvider}; retraining requests leave through the
 * {@link DegradationDetector}'s notifier; finished reports may be cached.
 */
public class ForecastQualityService {
  private static final Logger logger = LoggerFactory.getLogger(ForecastQualityService.class);

  public static final Duration DEFAULT_REPORT_TTL = Duration.ofMinutes(5);
  public static final int DEFAULT_EVALUATION_DAYS = 30;

  private final PredictionHistoryProvider history;
  private final DegradationDetector detector;
  private final BiasAnalyzer biasAnalyzer;
  private final PerformanceReportBuilder reportBuilder;
  private final ResultCache<ModelPerformanceReport> cache;
  private final Duration reportTtl;
  private final Clock clock;

  public ForecastQualityService(PredictionHistoryProvider history, DegradationDetector detector,
      Clock clock) {
    this(history, detector, null, DEFAULT_REPORT_TTL, clock);
  }

  /** @param cache may be null to disable report caching */
  public ForecastQualityService(PredictionHistoryProvider history, DegradationDetector detector,
      ResultCache<ModelPerformanceReport> cache, Duration reportTtl, Clock clock) {
    this.history = Preconditions.checkNotNull(history, "history");
    this.detector = Preconditions.checkNotNull(detector, "detector");
    this.cache = cache;
    this.reportTtl = Preconditions.checkNotNull(reportTtl, "reportTtl");
    this.clock = Preconditions.checkNotNull(clock, "clock");
    this.biasAnalyzer = new BiasAnalyzer(clock.getZone());
    this.reportBuilder = new PerformanceReportBuilder(biasAnalyzer);
  }

  /** Raw (unrounded) metrics over the actualized records. */
  public AccuracyMetrics evaluateAccuracy(List<PredictionRecord> predictions)
      throws NoDataException {
    logger.debug("Calculating accuracy metrics for {} predictions", predictions.size());
    return AccuracyCalculator.compute(predictions);
  }

  public BiasAnalysis analyzeBias(List<PredictionRecord> predictions) throws NoDataException {
    logger.debug("Performing bias analysis for {} predictions", predictions.size());
    return biasAnalyzer.analyze(predictions);
  }

  /** Degradation over caller supplied history, windows anchored at the service clock. */
  public DegradationAssessment assessDegradation(String modelId,
      List<PredictionRecord> predictions) {
    return detector.detect(modelId, predictions, clock.instant());
  }

  /** Degradation over the history the provider holds for the recent and baseline windows. */
  public DegradationAssessment assessDegradation(String modelId) {
    Instant now = clock.instant();
    List<PredictionRecord> records = history.fetch(modelId, detector.historyStart(now), now);
    return detector.detect(modelId, records, now);
  }

  public ModelPerformanceReport buildPerformanceReport(String modelId, String modelType) {
    return buildPerformanceReport(modelId, modelType, DEFAULT_EVALUATION_DAYS);
  }

  public ModelPerformanceReport buildPerformanceReport(String modelId, String modelType,
      int evaluationDays) {
    Preconditions.checkArgument(evaluationDays > 0, "evaluationDays must be positive");
    return buildPerformanceReport(modelId, modelType, Duration.ofDays(evaluationDays));
  }

  /** Report over [now - window, now]; served from the cache while a fresh copy exists. */
  public ModelPerformanceReport buildPerformanceReport(String modelId, String modelType,
      Duration window) {
    String key = reportKey(modelId, window);
    if (cache != null) {
      ModelPerformanceReport cached = cache.get(key);
      if (cached != null) {
        logger.debug("Serving cached performance report for model {}", modelId);
        return cached;
      }
    }

    logger.debug("Generating performance report for model {}", modelId);
    Instant end = clock.instant();
    Instant start = end.minus(window);
    List<PredictionRecord> records = history.fetch(modelId, start, end);
    DegradationAssessment degradation = assessDegradation(modelId);
    ModelPerformanceReport report =
        reportBuilder.build(modelId, modelType, start, end, records, degradation);
    if (!report.isMetricsAvailable()) {
      logger.warn("No actualized predictions for model {} between {} and {}", modelId, start,
          end);
    }

    if (cache != null) {
      cache.put(key, report, reportTtl);
    }
    return report;
  }

  /** Drop cached reports of {@code modelId} for the given window. */
  public void invalidateReport(String modelId, Duration window) {
    if (cache != null) {
      cache.invalidate(reportKey(modelId, window));
    }
  }

  private static String reportKey(String modelId, Duration window) {
    return "report:" + modelId + ":" + window;
  }
}
