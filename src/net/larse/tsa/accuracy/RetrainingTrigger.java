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

/** Request to retrain a model, handed to a {@link RetrainingNotifier}. */
public final class RetrainingTrigger {
  public enum TriggerType {
    ACCURACY_DEGRADATION,
    BIAS_DRIFT,
    DATA_DRIFT,
    TIME_BASED,
    MANUAL
  }

  private final String modelId;
  private final TriggerType triggerType;
  private final double triggerValue;
  private final double threshold;
  private final String description;
  private final Severity priority;
  private final String recommendedAction;

  public RetrainingTrigger(String modelId, TriggerType triggerType, double triggerValue,
      double threshold, String description, Severity priority, String recommendedAction) {
    this.modelId = Preconditions.checkNotNull(modelId, "modelId");
    this.triggerType = Preconditions.checkNotNull(triggerType, "triggerType");
    this.triggerValue = triggerValue;
    this.threshold = threshold;
    this.description = description;
    this.priority = Preconditions.checkNotNull(priority, "priority");
    this.recommendedAction = recommendedAction;
  }

  public String getModelId() {
    return modelId;
  }

  public TriggerType getTriggerType() {
    return triggerType;
  }

  /** The observed value that crossed {@link #getThreshold()}, e.g. a degradation rate in %. */
  public double getTriggerValue() {
    return triggerValue;
  }

  public double getThreshold() {
    return threshold;
  }

  public String getDescription() {
    return description;
  }

  public Severity getPriority() {
    return priority;
  }

  public String getRecommendedAction() {
    return recommendedAction;
  }

  @Override
  public String toString() {
    return String.format("RetrainingTrigger[%s %s %s: %s]", modelId, triggerType, priority,
        description);
  }
}
