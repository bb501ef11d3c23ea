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

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import net.larse.tsa.accuracy.BiasAnalysis.BiasDirection;
import net.larse.tsa.accuracy.BiasAnalysis.BiasPattern;
import net.larse.tsa.accuracy.BiasAnalysis.BiasTrend;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.NoDataException;
import net.larse.tsa.helper.StatsHelper;
import org.apache.commons.math.util.MathUtils;

/**
 * Direction, size and structure of forecast bias.
 *
 * <ul>
 *   <li>direction: NEUTRAL while |mean percentage error| < 2, otherwise by its sign;
 *   <li>significant: |mean percentage error| > 5;
 *   <li>pattern: SYSTEMATIC when the error correlates with time (|r| > 0.3), SEASONAL when the
 *       day-of-week mean errors vary by more than 1, RANDOM otherwise;
 *   <li>trend: the sign of the same correlation beyond 0.2, STABLE under five points.
 * </ul>
 *
 * Percentage errors skip records whose actual value is zero.
 */
public class BiasAnalyzer {
  static final double NEUTRAL_LIMIT = 2.0;
  static final double SIGNIFICANT_LIMIT = 5.0;
  static final double SYSTEMATIC_CORRELATION = 0.3;
  static final double TREND_CORRELATION = 0.2;
  static final double SEASONAL_VARIANCE = 1.0;
  static final int MIN_TREND_POINTS = 5;

  private final ZoneId zone;
  private final Function<Instant, String> periodLabel;

  /** Day-of-week grouping in UTC and seasonal bias keyed by English month name. */
  public BiasAnalyzer() {
    this(ZoneOffset.UTC);
  }

  public BiasAnalyzer(ZoneId zone) {
    this(zone, t -> t.atZone(zone).getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
  }

  /**
   * @param periodLabel maps a prediction timestamp to the calendar label its percentage error is
   *     grouped under in the seasonal bias
   */
  public BiasAnalyzer(ZoneId zone, Function<Instant, String> periodLabel) {
    this.zone = zone;
    this.periodLabel = periodLabel;
  }

  /**
   * @throws NoDataException if none of the records is actualized
   */
  public BiasAnalysis analyze(List<PredictionRecord> records) throws NoDataException {
    List<PredictionRecord> actualized = AccuracyCalculator.actualized(records);
    int n = actualized.size();
    if (n == 0) {
      throw new NoDataException("No actualized predictions for bias analysis");
    }

    double[] errors = new double[n];
    DoubleArrayList percentageErrors = new DoubleArrayList(n);
    Map<String, DoubleArrayList> byLabel = new LinkedHashMap<>();
    for (int i = 0; i < n; i++) {
      PredictionRecord record = actualized.get(i);
      double actual = record.getActualValue();
      errors[i] = record.getPredictedValue() - actual;
      if (actual != 0) {
        double percentage = errors[i] / actual * 100;
        percentageErrors.add(percentage);
        byLabel.computeIfAbsent(periodLabel.apply(record.getTimestamp()),
            k -> new DoubleArrayList()).add(percentage);
      }
    }

    double overallBias = StatsHelper.mean(errors);
    double[] percentages = percentageErrors.toDoubleArray();
    double meanBias = percentages.length == 0 ? 0 : StatsHelper.mean(percentages);
    double medianBias = percentages.length == 0 ? 0 : StatsHelper.median(percentages);

    BiasDirection direction;
    if (Math.abs(meanBias) < NEUTRAL_LIMIT) {
      direction = BiasDirection.NEUTRAL;
    } else if (meanBias > 0) {
      direction = BiasDirection.OVERFORECAST;
    } else {
      direction = BiasDirection.UNDERFORECAST;
    }

    double timeCorrelation = StatsHelper.correlation(ArrayHelper.indices(n), errors);

    Map<String, Double> seasonalBias = new LinkedHashMap<>();
    for (Map.Entry<String, DoubleArrayList> entry : byLabel.entrySet()) {
      seasonalBias.put(entry.getKey(),
          MathUtils.round(StatsHelper.mean(entry.getValue().toDoubleArray()), 2));
    }

    return new BiasAnalysis(MathUtils.round(overallBias, 2), direction,
        Math.abs(meanBias) > SIGNIFICANT_LIMIT,
        pattern(actualized, errors, timeCorrelation), MathUtils.round(meanBias, 2),
        MathUtils.round(medianBias, 2), trend(n, timeCorrelation), seasonalBias);
  }

  private BiasPattern pattern(List<PredictionRecord> actualized, double[] errors,
      double timeCorrelation) {
    if (Math.abs(timeCorrelation) > SYSTEMATIC_CORRELATION) {
      return BiasPattern.SYSTEMATIC;
    }
    // Days without records count as a zero mean error.
    double[] sums = new double[7];
    int[] counts = new int[7];
    for (int i = 0; i < errors.length; i++) {
      int day = actualized.get(i).getTimestamp().atZone(zone).getDayOfWeek().getValue() % 7;
      sums[day] += errors[i];
      counts[day]++;
    }
    double[] means = new double[7];
    for (int d = 0; d < 7; d++) {
      means[d] = counts[d] == 0 ? 0 : sums[d] / counts[d];
    }
    return StatsHelper.variance(means) > SEASONAL_VARIANCE
        ? BiasPattern.SEASONAL : BiasPattern.RANDOM;
  }

  private static BiasTrend trend(int n, double timeCorrelation) {
    if (n < MIN_TREND_POINTS) {
      return BiasTrend.STABLE;
    }
    if (timeCorrelation > TREND_CORRELATION) {
      return BiasTrend.INCREASING;
    }
    if (timeCorrelation < -TREND_CORRELATION) {
      return BiasTrend.DECREASING;
    }
    return BiasTrend.STABLE;
  }
}
