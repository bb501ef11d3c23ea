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
import java.time.Instant;

/**
 * One forecast and, once observed, its outcome. Only actualized records take part in accuracy
 * computations. The interval bounds are optional but, when both are present, ordered.
 */
public final class PredictionRecord {
  private final Instant timestamp;
  private final double predictedValue;
  private final Double actualValue;
  private final double confidence;
  private final Double lowerBound;
  private final Double upperBound;

  private PredictionRecord(Builder builder) {
    this.timestamp = builder.timestamp;
    this.predictedValue = builder.predictedValue;
    this.actualValue = builder.actualValue;
    this.confidence = builder.confidence;
    this.lowerBound = builder.lowerBound;
    this.upperBound = builder.upperBound;
  }

  public static class Builder {
    private Instant timestamp;
    private double predictedValue;
    private Double actualValue;
    private double confidence;
    private Double lowerBound;
    private Double upperBound;

    public Builder(Instant timestamp, double predictedValue) {
      this.timestamp = timestamp;
      this.predictedValue = predictedValue;
    }

    public Builder actual(double value) {
      this.actualValue = value;
      return this;
    }

    public Builder confidence(double value) {
      this.confidence = value;
      return this;
    }

    public Builder interval(double lower, double upper) {
      this.lowerBound = lower;
      this.upperBound = upper;
      return this;
    }

    public PredictionRecord build() {
      Preconditions.checkNotNull(timestamp, "timestamp");
      Preconditions.checkArgument(!Double.isNaN(predictedValue), "predicted value is NaN");
      Preconditions.checkArgument(confidence >= 0 && confidence <= 1,
          "confidence must be in [0, 1]: %s", confidence);
      Preconditions.checkArgument(lowerBound == null || upperBound == null
              || lowerBound <= upperBound,
          "lowerBound %s exceeds upperBound %s", lowerBound, upperBound);
      return new PredictionRecord(this);
    }
  }

  public static Builder builder(Instant timestamp, double predictedValue) {
    return new Builder(timestamp, predictedValue);
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public double getPredictedValue() {
    return predictedValue;
  }

  /** The observed outcome, or null while the record is not actualized. */
  public Double getActualValue() {
    return actualValue;
  }

  public boolean isActualized() {
    return actualValue != null;
  }

  public double getConfidence() {
    return confidence;
  }

  public Double getLowerBound() {
    return lowerBound;
  }

  public Double getUpperBound() {
    return upperBound;
  }

  /** True when the record carries both bounds and its actual value lies between them. */
  public boolean isWithinInterval() {
    return actualValue != null && lowerBound != null && upperBound != null
        && actualValue >= lowerBound && actualValue <= upperBound;
  }

  @Override
  public String toString() {
    return String.format("PredictionRecord[%s predicted=%s actual=%s]", timestamp,
        predictedValue, actualValue);
  }
}
