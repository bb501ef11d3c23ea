package net.larse.tsa.timeseries;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.larse.tsa.helper.InsufficientDataException;
import net.larse.tsa.helper.LinearFit;
import net.larse.tsa.helper.StatsHelper;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * The significance score is a heuristic (share of variance explained, squashed to [0, 1]), so
 * these tests only check that strong harmonics clear the 0.05 gate, not calibrated p-values.
 */
@RunWith(JUnit4.class)
public class FourierAnalyzerTest {
  static double[] sine(int n, double period, double amplitude) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = amplitude * Math.sin(2 * Math.PI * i / period);
    }
    return values;
  }

  @Test
  public void testMonthlySineHasPeriodTwelve() throws Exception {
    List<FourierComponent> components = new FourierAnalyzer().analyze(sine(36, 12, 10));
    assertTrue(!components.isEmpty());
    FourierComponent top = components.get(0);
    assertEquals(12.0, top.period, 1e-9);
    assertEquals(3, top.harmonic);
    assertEquals(3.0 / 36, top.frequency, 1e-12);
    assertEquals(10.0, top.amplitude, 1.0);
    assertTrue(top.significance > 0.05);
  }

  @Test
  public void testSortedByAmplitude() throws Exception {
    double[] a = sine(48, 12, 3);
    double[] b = sine(48, 6, 8);
    double[] values = new double[48];
    for (int i = 0; i < 48; i++) {
      values[i] = a[i] + b[i];
    }
    List<FourierComponent> components = new FourierAnalyzer().analyze(values);
    assertEquals(6.0, components.get(0).period, 1e-9);
    for (int i = 1; i < components.size(); i++) {
      assertTrue(components.get(i - 1).amplitude >= components.get(i).amplitude);
    }
  }

  @Test
  public void testConstantSeriesHasNoComponents() throws Exception {
    assertTrue(new FourierAnalyzer().analyze(new double[] {4, 4, 4, 4, 4, 4}).isEmpty());
  }

  @Test
  public void testLinearSeriesHasNoComponents() throws Exception {
    assertTrue(new FourierAnalyzer().analyze(new double[] {1, 2, 3, 4, 5, 6, 7, 8}).isEmpty());
  }

  @Test(expected = InsufficientDataException.class)
  public void testTooShort() throws Exception {
    new FourierAnalyzer().analyze(new double[] {1, 2, 3});
  }

  @Test
  public void testMaxFrequenciesLimitsHarmonics() throws Exception {
    FourierAnalyzer.Args args = new FourierAnalyzer.Args();
    args.maxFrequencies = 2;
    // Period 12 is harmonic 3 of 36 and must not be examined.
    for (FourierComponent c : new FourierAnalyzer(args).analyze(sine(36, 12, 10))) {
      assertTrue(c.harmonic <= 2);
    }
  }

  @Test
  public void testFullReconstructionIsExact() throws Exception {
    double[] values = series(36);
    FourierAnalyzer.Args args = new FourierAnalyzer.Args();
    args.maxFrequencies = 18;
    args.significanceThreshold = 0;
    List<FourierComponent> all = new FourierAnalyzer(args).analyze(values);

    LinearFit trend = StatsHelper.linearRegression(values);
    double[] rebuilt = FourierAnalyzer.reconstruct(all, values.length, trend);
    for (int i = 0; i < values.length; i++) {
      assertEquals(values[i], rebuilt[i], 1e-6);
    }
  }

  @Test
  public void testReconstructionErrorBoundedByDiscardedAmplitude() throws Exception {
    double[] values = series(36);
    FourierAnalyzer.Args args = new FourierAnalyzer.Args();
    args.maxFrequencies = 18;
    args.significanceThreshold = 0;
    List<FourierComponent> all = new FourierAnalyzer(args).analyze(values);
    List<FourierComponent> kept = new FourierAnalyzer().analyze(values);

    Set<Integer> keptHarmonics = new HashSet<>();
    for (FourierComponent c : kept) {
      keptHarmonics.add(c.harmonic);
    }
    double discarded = 0;
    for (FourierComponent c : all) {
      if (!keptHarmonics.contains(c.harmonic)) {
        discarded += c.amplitude;
      }
    }

    LinearFit trend = StatsHelper.linearRegression(values);
    double[] rebuilt = FourierAnalyzer.reconstruct(kept, values.length, trend);
    for (int i = 0; i < values.length; i++) {
      assertTrue(Math.abs(values[i] - rebuilt[i]) <= discarded + 1e-8);
    }
  }

  private static double[] series(int n) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = 2 + 0.3 * i + 5 * Math.sin(2 * Math.PI * i / 12)
          + 2 * Math.cos(2 * Math.PI * i / 6) + 0.4 * Math.sin(1.7 * i);
    }
    return values;
  }
}
