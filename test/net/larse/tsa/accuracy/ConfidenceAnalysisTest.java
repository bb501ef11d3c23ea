package net.larse.tsa.accuracy;

import static org.junit.Assert.assertEquals;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import net.larse.tsa.accuracy.ConfidenceAnalysis.Calibration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConfidenceAnalysisTest {
  private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

  /** Ten records at the given confidence, the first {@code inside} of them inside [90, 110]. */
  private static List<PredictionRecord> records(int inside, double confidence) {
    List<PredictionRecord> records = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      double actual = i < inside ? 100 : 150;
      records.add(PredictionRecord.builder(T0.plus(Duration.ofHours(i)), 100)
          .actual(actual).confidence(confidence).interval(90, 110).build());
    }
    return records;
  }

  @Test
  public void testWellCalibrated() {
    ConfidenceAnalysis analysis = ConfidenceAnalysis.of(records(9, 0.95));
    assertEquals(0.9, analysis.withinInterval, 1e-9);
    assertEquals(0.95, analysis.averageConfidence, 1e-9);
    assertEquals(Calibration.WELL_CALIBRATED, analysis.calibration);
    assertEquals(0.95, analysis.confidenceAccuracy, 1e-9);
  }

  @Test
  public void testOverconfident() {
    ConfidenceAnalysis analysis = ConfidenceAnalysis.of(records(5, 0.9));
    assertEquals(Calibration.OVERCONFIDENT, analysis.calibration);
    assertEquals(0.6, analysis.confidenceAccuracy, 1e-9);
  }

  @Test
  public void testUnderconfident() {
    assertEquals(Calibration.UNDERCONFIDENT, ConfidenceAnalysis.of(records(10, 0.5)).calibration);
  }

  @Test
  public void testMissingBoundsCountAsOutside() {
    List<PredictionRecord> records = new ArrayList<>();
    records.add(PredictionRecord.builder(T0, 100).actual(100).confidence(0.8).build());
    assertEquals(0.0, ConfidenceAnalysis.of(records).withinInterval, 0);
  }

  @Test
  public void testNoData() {
    ConfidenceAnalysis analysis = ConfidenceAnalysis.of(new ArrayList<PredictionRecord>());
    assertEquals(Calibration.UNKNOWN, analysis.calibration);
    assertEquals(0.0, analysis.confidenceAccuracy, 0);
  }
}
