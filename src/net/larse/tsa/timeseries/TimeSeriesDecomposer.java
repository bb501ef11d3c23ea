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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import net.larse.tsa.helper.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point to the decomposition algorithms. Parameters arrive as a name to value map
 * and are bound onto the algorithm's {@code Args}; unknown names are rejected.
 *
 * <p>Instances hold no mutable state, so one decomposer can serve any number of threads.
 */
public class TimeSeriesDecomposer {
  private static final Logger logger = LoggerFactory.getLogger(TimeSeriesDecomposer.class);

  public enum Algorithm {
    /** Result: {@code List<FourierComponent>}. */
    FOURIER,
    /** Result: {@link DecompositionResult}. */
    STL,
    /** Result: {@code List<WaveletLevel>}. */
    WAVELET,
    /** Result: {@link SeasonalAdjustmentResult}. */
    SEASONAL_ADJUST
  }

  private final CalendarProvider calendar;

  public TimeSeriesDecomposer() {
    this(null);
  }

  /** @param calendar handed to seasonal adjustment; may be null */
  public TimeSeriesDecomposer(CalendarProvider calendar) {
    this.calendar = calendar;
  }

  /**
   * Run {@code algorithm} on {@code series}. The runtime type of the result depends on the
   * algorithm, see {@link Algorithm}.
   *
   * @throws IllegalArgumentException for parameters the algorithm does not know or cannot parse
   */
  public Object decompose(TimeSeries series, Algorithm algorithm, Map<String, ?> params)
      throws AnalysisException {
    Preconditions.checkNotNull(series, "series");
    Preconditions.checkNotNull(algorithm, "algorithm");
    Map<String, ?> p = params == null ? Collections.<String, Object>emptyMap() : params;
    logger.debug("Decomposing {} observations with {} {}", series.size(), algorithm, p);

    switch (algorithm) {
      case FOURIER:
        FourierAnalyzer.Args fourierArgs = new FourierAnalyzer.Args().populate(p);
        return fourier(series, fourierArgs);
      case STL:
        STLDecomposition.Args stlArgs = new STLDecomposition.Args().populate(p);
        return stl(series, stlArgs);
      case WAVELET:
        WaveletTransform.Args waveletArgs = new WaveletTransform.Args().populate(p);
        return wavelet(series, waveletArgs);
      case SEASONAL_ADJUST:
        SeasonalAdjustment.Args adjustArgs = new SeasonalAdjustment.Args().populate(p);
        return seasonalAdjust(series, adjustArgs);
      default:
        throw new IllegalArgumentException("Unsupported algorithm: " + algorithm);
    }
  }

  public List<FourierComponent> fourier(TimeSeries series, FourierAnalyzer.Args args)
      throws AnalysisException {
    return new FourierAnalyzer(args).analyze(series);
  }

  public DecompositionResult stl(TimeSeries series, STLDecomposition.Args args)
      throws AnalysisException {
    return new STLDecomposition(args).decompose(series);
  }

  public List<WaveletLevel> wavelet(TimeSeries series, WaveletTransform.Args args)
      throws AnalysisException {
    return new WaveletTransform(args).transform(series);
  }

  public SeasonalAdjustmentResult seasonalAdjust(TimeSeries series, SeasonalAdjustment.Args args)
      throws AnalysisException {
    return new SeasonalAdjustment(args, calendar).adjust(series);
  }

  /**
   * Decompose every series with the same algorithm and parameters, one task per series on
   * {@code executor}. Results come back in input order. The first failure, in input order, is
   * rethrown with its original type when it is an {@link AnalysisException} or unchecked.
   * Tasks still pending when a failure or an interrupt ends the wait are cancelled.
   */
  public List<Object> decomposeAll(ExecutorService executor, List<TimeSeries> series,
      final Algorithm algorithm, final Map<String, ?> params)
      throws AnalysisException, InterruptedException {
    Preconditions.checkNotNull(executor, "executor");
    List<Future<Object>> futures = new ArrayList<>(series.size());
    for (final TimeSeries s : series) {
      Callable<Object> task = () -> decompose(s, algorithm, params);
      futures.add(executor.submit(task));
    }

    List<Object> results = new ArrayList<>(futures.size());
    try {
      for (Future<Object> future : futures) {
        results.add(future.get());
      }
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof AnalysisException) {
        throw (AnalysisException) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Decomposition task failed", cause);
    } finally {
      if (results.size() < futures.size()) {
        for (Future<Object> future : futures) {
          future.cancel(true);
        }
      }
    }
    return ImmutableList.copyOf(results);
  }
}
