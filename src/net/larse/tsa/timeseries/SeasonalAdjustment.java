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
package net.larse.tsa.timeseries;

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.larse.tsa.helper.AlgorithmBase;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.AnalysisException;
import net.larse.tsa.helper.InsufficientDataException;
import net.larse.tsa.helper.SingularSystemException;
import net.larse.tsa.helper.StatsHelper;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * X13-style seasonal adjustment, heavily simplified:
 *
 * <ol>
 *   <li>optional log transform, chosen automatically for skewed or widely spread data;
 *   <li>optional trading-day and holiday normalization through a {@link CalendarProvider};
 *   <li>outlier scan against a rolling median/MAD, each hit classified as additive outlier
 *       or level shift;
 *   <li>a low-order autoregressive fit (Yule-Walker) on the seasonally and regularly
 *       differenced series;
 *   <li>seasonal factors as the mean detrended value at each position in the period, centred
 *       to sum to zero;
 *   <li>back-transformation into the units of the input.
 * </ol>
 *
 * This is not a certified X-13ARIMA-SEATS estimator.
 */
public class SeasonalAdjustment {
  private static final Logger logger = LoggerFactory.getLogger(SeasonalAdjustment.class);

  // Consistency constant that turns a MAD into a normal standard deviation estimate.
  static final double MAD_SCALE = 1.4826;
  // Points on each side compared when telling level shifts from additive outliers.
  static final int SHIFT_WINDOW = 5;

  // Spread below this fraction of the local level counts as a flat neighbourhood.
  private static final double FLAT_TOLERANCE = 1e-9;
  private static final double COEFFICIENT_OF_VARIATION_LIMIT = 0.5;
  private static final double SKEWNESS_LIMIT = 1.0;

  public enum LogTransform {
    AUTO,
    ALWAYS,
    NEVER
  }

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Observations per seasonal cycle. 1 disables seasonal extraction.")
    @Optional
    public int seasonalPeriod = 12;

    @Doc(help = "Order of the autoregressive model fitted to the differenced series.")
    @Optional
    public int arOrder = 2;

    @Doc(help = "AUTO logs the series when its coefficient of variation exceeds 0.5 or its "
        + "absolute skewness exceeds 1; ALWAYS and NEVER force the choice.")
    @Optional
    public LogTransform logTransform = LogTransform.AUTO;

    @Doc(help = "Robust z-score above which an observation is flagged as an outlier.")
    @Optional
    public double outlierThreshold = 3.5;

    @Doc(help = "Upper bound on the rolling outlier window; the window is at most n / 3.")
    @Optional
    public int outlierWindow = 30;

    @Doc(help = "Normalize by the ratio of trading days to averageTradingDays.")
    @Optional
    public boolean tradingDayAdjustment = false;

    @Doc(help = "Divide out the per-date holiday factors of the calendar.")
    @Optional
    public boolean holidayAdjustment = false;

    @Doc(help = "Reference number of trading days per period.")
    @Optional
    public double averageTradingDays = 21.0;

    @Doc(help = "Zone used to turn observation timestamps into calendar dates.")
    @Optional
    public String zoneId = "UTC";
  }

  private final Args args;
  private final CalendarProvider calendar;

  public SeasonalAdjustment() {
    this(new Args(), null);
  }

  public SeasonalAdjustment(Args args) {
    this(args, null);
  }

  /**
   * @param calendar consulted when trading-day or holiday adjustment is enabled; may be null
   *     otherwise
   */
  public SeasonalAdjustment(Args args, CalendarProvider calendar) {
    Preconditions.checkArgument(args.seasonalPeriod >= 1, "seasonalPeriod must be positive");
    Preconditions.checkArgument(args.arOrder >= 0, "arOrder must not be negative");
    Preconditions.checkArgument(args.averageTradingDays > 0, "averageTradingDays must be > 0");
    Preconditions.checkState(calendar != null
            || !(args.tradingDayAdjustment || args.holidayAdjustment),
        "calendar adjustments requested without a CalendarProvider");
    this.args = args;
    this.calendar = calendar;
  }

  public SeasonalAdjustmentResult adjust(TimeSeries series) throws AnalysisException {
    return adjust(series.getValues(), series.getTimestamps());
  }

  /** Adjust bare values; calendar adjustments need timestamps and are rejected here. */
  public SeasonalAdjustmentResult adjust(double[] values) throws AnalysisException {
    return adjust(values, null);
  }

  private SeasonalAdjustmentResult adjust(double[] values, Instant[] timestamps)
      throws AnalysisException {
    int n = values.length;
    int period = args.seasonalPeriod;
    int minimum = Math.max(2 * period, args.arOrder + 3);
    if (n < minimum) {
      throw new InsufficientDataException("Seasonal adjustment", minimum, n);
    }

    boolean log = shouldLog(values);
    double[] working = new double[n];
    for (int i = 0; i < n; i++) {
      working[i] = log ? Math.log(values[i]) : values[i];
    }

    double[] calendarEffect = calendarEffect(working, timestamps, log);
    double[] adjusted = ArrayHelper.subtract(working, calendarEffect);

    List<Outlier> outliers = new ArrayList<>();
    double[] corrected = correctOutliers(adjusted, log, outliers);

    double[] ar = fitAutoregressive(corrected);

    double[] trend = StatsHelper.movingAverage(corrected, period > 1 ? period : 3);
    double[] factors = seasonalFactors(ArrayHelper.subtract(corrected, trend), period);

    double[] seasonal = new double[n];
    double[] irregular = new double[n];
    for (int i = 0; i < n; i++) {
      seasonal[i] = factors[i % period] + calendarEffect[i];
      irregular[i] = working[i] - trend[i] - seasonal[i];
    }

    Map<Integer, Double> factorMap = new LinkedHashMap<>();
    for (int p = 0; p < period; p++) {
      factorMap.put(p, log ? Math.exp(factors[p]) : factors[p]);
    }

    if (log) {
      for (int i = 0; i < n; i++) {
        double level = Math.exp(trend[i]);
        double seasonalLevel = Math.exp(trend[i] + seasonal[i]);
        trend[i] = level;
        seasonal[i] = seasonalLevel - level;
        irregular[i] = values[i] - level - seasonal[i];
      }
    }

    logger.debug("Seasonal adjustment n={} period={} log={} outliers={}", n, period, log,
        outliers.size());
    return new SeasonalAdjustmentResult(seasonal, trend, irregular, factorMap, outliers, log, ar);
  }

  boolean shouldLog(double[] values) {
    boolean positive = true;
    for (double v : values) {
      positive &= v > 0;
    }
    switch (args.logTransform) {
      case ALWAYS:
        Preconditions.checkArgument(positive, "log transform needs strictly positive values");
        return true;
      case NEVER:
        return false;
      default:
        if (!positive) {
          return false;
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (double v : values) {
          stats.addValue(v);
        }
        double cv = stats.getStandardDeviation() / Math.abs(stats.getMean());
        double skewness = stats.getSkewness();
        return cv > COEFFICIENT_OF_VARIATION_LIMIT
            || (!Double.isNaN(skewness) && Math.abs(skewness) > SKEWNESS_LIMIT);
    }
  }

  /**
   * Calendar component in working units: log of the combined factor for logged series,
   * otherwise value minus value / factor.
   */
  private double[] calendarEffect(double[] working, Instant[] timestamps, boolean log) {
    double[] effect = new double[working.length];
    if (!args.tradingDayAdjustment && !args.holidayAdjustment) {
      return effect;
    }
    Preconditions.checkArgument(timestamps != null,
        "calendar adjustments need a TimeSeries with timestamps");

    ZoneId zone = ZoneId.of(args.zoneId);
    for (int i = 0; i < working.length; i++) {
      LocalDate date = timestamps[i].atZone(zone).toLocalDate();
      double factor = 1.0;
      if (args.tradingDayAdjustment) {
        int days = calendar.tradingDays(date);
        Preconditions.checkState(days > 0, "no trading days in period starting %s", date);
        factor *= days / args.averageTradingDays;
      }
      if (args.holidayAdjustment) {
        double holiday = calendar.holidayFactor(date);
        Preconditions.checkState(holiday > 0, "holiday factor for %s must be positive", date);
        factor *= holiday;
      }
      effect[i] = log ? Math.log(factor) : working[i] - working[i] / factor;
    }
    return effect;
  }

  /**
   * Flag outliers in {@code values} and return a copy where additive outliers are replaced by
   * their local median. Level shifts are left in place; they belong to the trend.
   */
  private double[] correctOutliers(double[] values, boolean log, List<Outlier> outliers) {
    double[] corrected = values.clone();
    double[] medians = new double[values.length];
    IntArrayList flagged = detectOutliers(values, medians);

    for (int k = 0; k < flagged.size(); k++) {
      int i = flagged.getInt(k);
      double median = medians[i];
      Outlier.Type type = classify(values, i, localMad(values, i));
      double impact = log ? Math.exp(values[i]) - Math.exp(median) : values[i] - median;
      outliers.add(new Outlier(i, type, impact));
      if (type == Outlier.Type.AO) {
        corrected[i] = median;
      }
    }
    return corrected;
  }

  /**
   * Indices whose distance from the rolling median exceeds {@code outlierThreshold} robust
   * standard deviations (1.4826 * MAD). The local medians are written to {@code medians}.
   */
  IntArrayList detectOutliers(double[] values, double[] medians) {
    IntArrayList flagged = new IntArrayList();
    for (int i = 0; i < values.length; i++) {
      double[] window = window(values, i);
      double median = StatsHelper.median(window);
      double mad = StatsHelper.medianAbsoluteDeviation(window);
      medians[i] = median;

      double deviation = Math.abs(values[i] - median);
      double resolution = FLAT_TOLERANCE * Math.max(1.0, Math.abs(median));
      double score;
      if (mad > resolution) {
        score = deviation / (MAD_SCALE * mad);
      } else {
        // A flat neighbourhood: anything off the median is an outlier.
        score = deviation > resolution ? Double.POSITIVE_INFINITY : 0;
      }
      if (score > args.outlierThreshold) {
        flagged.add(i);
      }
    }
    return flagged;
  }

  /**
   * LS when the means of the five points after and before {@code index} differ by more than
   * twice the local MAD, AO otherwise (including when either side is empty).
   */
  static Outlier.Type classify(double[] values, int index, double mad) {
    int beforeStart = Math.max(0, index - SHIFT_WINDOW);
    int afterEnd = Math.min(values.length, index + 1 + SHIFT_WINDOW);
    if (beforeStart == index || afterEnd == index + 1) {
      return Outlier.Type.AO;
    }
    double before = StatsHelper.mean(ArrayUtils.subarray(values, beforeStart, index));
    double after = StatsHelper.mean(ArrayUtils.subarray(values, index + 1, afterEnd));
    return Math.abs(after - before) > 2 * mad ? Outlier.Type.LS : Outlier.Type.AO;
  }

  private double localMad(double[] values, int index) {
    return StatsHelper.medianAbsoluteDeviation(window(values, index));
  }

  private double[] window(double[] values, int index) {
    int size = Math.max(3, Math.min(args.outlierWindow, values.length / 3));
    int half = size / 2;
    int lo = Math.max(0, index - half);
    int hi = Math.min(values.length, index + half + 1);
    return ArrayUtils.subarray(values, lo, hi);
  }

  /**
   * Yule-Walker AR fit on the series after seasonal differencing (when the period exceeds one)
   * and first differencing.
   *
   * @throws SingularSystemException if the Toeplitz system collapses; retry with a lower order
   */
  double[] fitAutoregressive(double[] values) throws AnalysisException {
    if (args.arOrder == 0) {
      return new double[0];
    }
    double[] z = values;
    if (args.seasonalPeriod > 1) {
      z = difference(z, args.seasonalPeriod);
    }
    z = difference(z, 1);
    if (z.length <= args.arOrder + 1) {
      throw new InsufficientDataException("Autoregressive fit on differenced series",
          args.arOrder + 2, z.length);
    }
    double[] r = Autocorrelation.acf(z, args.arOrder);
    return Autocorrelation.yuleWalker(r, args.arOrder);
  }

  static double[] difference(double[] values, int lag) {
    double[] result = new double[Math.max(0, values.length - lag)];
    for (int i = 0; i < result.length; i++) {
      result[i] = values[i + lag] - values[i];
    }
    return result;
  }

  /** Mean detrended value per position within the period, shifted so the factors sum to 0. */
  static double[] seasonalFactors(double[] detrended, int period) {
    double[] factors = new double[period];
    if (period == 1) {
      return factors;
    }
    int[] counts = new int[period];
    for (int i = 0; i < detrended.length; i++) {
      factors[i % period] += detrended[i];
      counts[i % period]++;
    }
    double mean = 0;
    for (int p = 0; p < period; p++) {
      factors[p] = counts[p] == 0 ? 0 : factors[p] / counts[p];
      mean += factors[p];
    }
    mean /= period;
    for (int p = 0; p < period; p++) {
      factors[p] -= mean;
    }
    return factors;
  }
}
