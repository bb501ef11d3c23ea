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
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.larse.tsa.accuracy.RetrainingTrigger.TriggerType;
import net.larse.tsa.helper.AlgorithmBase;
import net.larse.tsa.helper.AnalysisException;
import org.apache.commons.math.util.MathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares the MAPE of a recent window against the window before it.
 *
 * <p>rate = (recentMape - baselineMape) / baselineMape * 100. Above {@code highThreshold} the
 * severity is HIGH and retraining is triggered; above {@code mediumThreshold} it is MEDIUM and
 * triggers only above {@code mediumRetrainThreshold}; above {@code lowThreshold} it is LOW
 * without a trigger. Anything lower is not a degradation.
 *
 * <p>A baseline MAPE of zero gives rate 0 when the recent MAPE is zero too and rate 100
 * otherwise.
 *
 * <p>Monitoring must not stop on bad data: when either window has no actualized predictions the
 * failure is logged and a "not detected" assessment returned.
 */
public class DegradationDetector {
  private static final Logger logger = LoggerFactory.getLogger(DegradationDetector.class);

  static final double ZERO_BASELINE_RATE = 100.0;

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Length in days of the recent window, ending now.")
    @Optional
    public int recentDays = 7;

    @Doc(help = "Length in days of the baseline window, ending one day before the recent one.")
    @Optional
    public int baselineDays = 30;

    @Doc(help = "Degradation rate (%) above which severity is HIGH and retraining triggers.")
    @Optional
    public double highThreshold = 20;

    @Doc(help = "Degradation rate (%) above which severity is MEDIUM.")
    @Optional
    public double mediumThreshold = 10;

    @Doc(help = "MEDIUM degradations above this rate (%) also trigger retraining.")
    @Optional
    public double mediumRetrainThreshold = 15;

    @Doc(help = "Degradation rate (%) above which a LOW degradation is reported.")
    @Optional
    public double lowThreshold = 5;
  }

  private final Args args;
  private final RetrainingNotifier notifier;

  public DegradationDetector() {
    this(new Args(), RetrainingNotifier.NONE);
  }

  public DegradationDetector(Args args, RetrainingNotifier notifier) {
    Preconditions.checkArgument(args.recentDays > 0 && args.baselineDays > 0,
        "window lengths must be positive");
    Preconditions.checkArgument(args.lowThreshold <= args.mediumThreshold
            && args.mediumThreshold <= args.highThreshold,
        "thresholds must be ordered low <= medium <= high");
    this.args = args;
    this.notifier = Preconditions.checkNotNull(notifier, "notifier");
  }

  /** Start of the span {@link #detect} needs, for fetching history ending at {@code now}. */
  public Instant historyStart(Instant now) {
    return baselineEnd(now).minus(Duration.ofDays(args.baselineDays));
  }

  /**
   * Split {@code history} into the recent window [now - recentDays, now] and the baseline window
   * [now - recentDays - 1 - baselineDays, now - recentDays - 1] and compare them.
   */
  public DegradationAssessment detect(String modelId, List<PredictionRecord> history,
      Instant now) {
    Instant recentStart = now.minus(Duration.ofDays(args.recentDays));
    Instant baselineEnd = baselineEnd(now);
    Instant baselineStart = historyStart(now);

    List<PredictionRecord> recent = new ArrayList<>();
    List<PredictionRecord> baseline = new ArrayList<>();
    for (PredictionRecord record : history) {
      Instant t = record.getTimestamp();
      if (!t.isBefore(recentStart) && !t.isAfter(now)) {
        recent.add(record);
      } else if (!t.isBefore(baselineStart) && !t.isAfter(baselineEnd)) {
        baseline.add(record);
      }
    }
    return evaluate(modelId, recent, baseline);
  }

  /** Compare two already separated windows. */
  public DegradationAssessment evaluate(String modelId, List<PredictionRecord> recent,
      List<PredictionRecord> baseline) {
    logger.debug("Detecting performance degradation for model {}", modelId);
    AccuracyMetrics recentMetrics;
    AccuracyMetrics baselineMetrics;
    try {
      recentMetrics = AccuracyCalculator.compute(recent);
      baselineMetrics = AccuracyCalculator.compute(baseline);
    } catch (AnalysisException e) {
      logger.warn("Performance degradation detection failed for model {}: {}", modelId,
          e.getMessage());
      return DegradationAssessment.notDetected();
    }
    return assess(modelId, recentMetrics.mape, baselineMetrics.mape);
  }

  DegradationAssessment assess(String modelId, double recentMape, double baselineMape) {
    double rate;
    if (baselineMape == 0) {
      rate = recentMape == 0 ? 0 : ZERO_BASELINE_RATE;
    } else {
      rate = (recentMape - baselineMape) / baselineMape * 100;
    }

    boolean detected = false;
    Severity severity = Severity.LOW;
    boolean retrain = false;
    if (rate > args.highThreshold) {
      detected = true;
      severity = Severity.HIGH;
      retrain = true;
    } else if (rate > args.mediumThreshold) {
      detected = true;
      severity = Severity.MEDIUM;
      retrain = rate > args.mediumRetrainThreshold;
    } else if (rate > args.lowThreshold) {
      detected = true;
    }

    RetrainingTrigger trigger = null;
    if (retrain) {
      String description =
          String.format(Locale.ROOT, "Model accuracy degraded by %.1f%%", rate);
      trigger = new RetrainingTrigger(modelId, TriggerType.ACCURACY_DEGRADATION, rate,
          args.highThreshold, description,
          severity == Severity.HIGH ? Severity.CRITICAL : Severity.HIGH,
          "Immediate model retraining recommended");
      emit(trigger);
    }
    return new DegradationAssessment(detected, severity, MathUtils.round(rate, 2), retrain,
        trigger, recentMape, baselineMape);
  }

  private void emit(RetrainingTrigger trigger) {
    logger.warn("Retraining trigger for model {}: {}", trigger.getModelId(),
        trigger.getDescription());
    try {
      notifier.onRetrainingTrigger(trigger);
    } catch (RuntimeException e) {
      // The trigger stays in the returned assessment for the caller to act on.
      logger.error("Retraining notifier failed for model {}", trigger.getModelId(), e);
    }
  }

  private Instant baselineEnd(Instant now) {
    return now.minus(Duration.ofDays(args.recentDays + 1L));
  }
}
