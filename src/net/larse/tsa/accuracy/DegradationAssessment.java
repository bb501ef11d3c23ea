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

import java.util.Optional;

/**
 * Recent versus baseline accuracy of one model. The degradation rate is the relative MAPE
 * increase in percent, rounded to two decimals.
 */
public final class DegradationAssessment {
  private static final DegradationAssessment NOT_DETECTED =
      new DegradationAssessment(false, Severity.LOW, 0, false, null, Double.NaN, Double.NaN);

  private final boolean detected;
  private final Severity severity;
  private final double degradationRate;
  private final boolean triggersRetraining;
  private final RetrainingTrigger trigger;
  private final double recentMape;
  private final double baselineMape;

  public DegradationAssessment(boolean detected, Severity severity, double degradationRate,
      boolean triggersRetraining, RetrainingTrigger trigger, double recentMape,
      double baselineMape) {
    this.detected = detected;
    this.severity = severity;
    this.degradationRate = degradationRate;
    this.triggersRetraining = triggersRetraining;
    this.trigger = trigger;
    this.recentMape = recentMape;
    this.baselineMape = baselineMape;
  }

  /** Result used when either window cannot be evaluated. */
  public static DegradationAssessment notDetected() {
    return NOT_DETECTED;
  }

  public boolean isDetected() {
    return detected;
  }

  public Severity getSeverity() {
    return severity;
  }

  public double getDegradationRate() {
    return degradationRate;
  }

  public boolean isTriggersRetraining() {
    return triggersRetraining;
  }

  /** The trigger that was emitted, present exactly when {@link #isTriggersRetraining()}. */
  public Optional<RetrainingTrigger> getTrigger() {
    return Optional.ofNullable(trigger);
  }

  /** MAPE of the recent window; NaN when it was not evaluated. */
  public double getRecentMape() {
    return recentMape;
  }

  /** MAPE of the baseline window; NaN when it was not evaluated. */
  public double getBaselineMape() {
    return baselineMape;
  }

  @Override
  public String toString() {
    return String.format("DegradationAssessment[detected=%s %s rate=%.2f retrain=%s]", detected,
        severity, degradationRate, triggersRetraining);
  }
}
