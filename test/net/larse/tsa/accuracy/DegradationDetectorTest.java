package net.larse.tsa.accuracy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import net.larse.tsa.accuracy.RetrainingTrigger.TriggerType;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DegradationDetectorTest {
  private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

  private final List<RetrainingTrigger> emitted = new ArrayList<>();
  private DegradationDetector detector;

  @Before
  public void setUp() {
    detector = new DegradationDetector(new DegradationDetector.Args(), emitted::add);
  }

  private static PredictionRecord record(int daysAgo, double predicted, double actual) {
    return PredictionRecord.builder(NOW.minus(Duration.ofDays(daysAgo)), predicted)
        .actual(actual).build();
  }

  @Test
  public void testEqualWindowsNotDetected() {
    List<PredictionRecord> recent = new ArrayList<>();
    List<PredictionRecord> baseline = new ArrayList<>();
    recent.add(record(1, 110, 100));
    recent.add(record(2, 95, 100));
    baseline.add(record(10, 110, 100));
    baseline.add(record(20, 95, 100));

    DegradationAssessment assessment = detector.evaluate("m1", recent, baseline);
    assertEquals(0.0, assessment.getDegradationRate(), 0);
    assertFalse(assessment.isDetected());
    assertFalse(assessment.isTriggersRetraining());
    assertFalse(assessment.getTrigger().isPresent());
    assertTrue(emitted.isEmpty());
  }

  @Test
  public void testHighSeverityTriggersRetraining() {
    DegradationAssessment assessment = detector.assess("m1", 12.5, 10);
    assertEquals(25.0, assessment.getDegradationRate(), 1e-9);
    assertTrue(assessment.isDetected());
    assertEquals(Severity.HIGH, assessment.getSeverity());
    assertTrue(assessment.isTriggersRetraining());

    RetrainingTrigger trigger = assessment.getTrigger().get();
    assertEquals(TriggerType.ACCURACY_DEGRADATION, trigger.getTriggerType());
    assertEquals(Severity.CRITICAL, trigger.getPriority());
    assertEquals(20.0, trigger.getThreshold(), 0);
    assertEquals("Model accuracy degraded by 25.0%", trigger.getDescription());
    assertEquals(1, emitted.size());
    assertEquals("m1", emitted.get(0).getModelId());
  }

  @Test
  public void testMediumSeverity() {
    DegradationAssessment quiet = detector.assess("m1", 11.2, 10);
    assertEquals(Severity.MEDIUM, quiet.getSeverity());
    assertTrue(quiet.isDetected());
    assertFalse(quiet.isTriggersRetraining());

    DegradationAssessment loud = detector.assess("m1", 11.6, 10);
    assertEquals(Severity.MEDIUM, loud.getSeverity());
    assertTrue(loud.isTriggersRetraining());
    assertEquals(Severity.HIGH, loud.getTrigger().get().getPriority());
    assertEquals(1, emitted.size());
  }

  @Test
  public void testLowSeverity() {
    DegradationAssessment low = detector.assess("m1", 10.6, 10);
    assertTrue(low.isDetected());
    assertEquals(Severity.LOW, low.getSeverity());
    assertFalse(low.isTriggersRetraining());

    assertFalse(detector.assess("m1", 10.4, 10).isDetected());
    assertFalse(detector.assess("m1", 8, 10).isDetected());
  }

  @Test
  public void testZeroBaseline() {
    assertEquals(0.0, detector.assess("m1", 0, 0).getDegradationRate(), 0);
    DegradationAssessment assessment = detector.assess("m1", 3, 0);
    assertEquals(100.0, assessment.getDegradationRate(), 0);
    assertEquals(Severity.HIGH, assessment.getSeverity());
  }

  @Test
  public void testMissingWindowIsNotDetected() {
    List<PredictionRecord> baseline = new ArrayList<>();
    baseline.add(record(10, 110, 100));
    DegradationAssessment assessment =
        detector.evaluate("m1", new ArrayList<PredictionRecord>(), baseline);
    assertFalse(assessment.isDetected());
    assertEquals(Severity.LOW, assessment.getSeverity());
    assertEquals(0.0, assessment.getDegradationRate(), 0);
    assertTrue(emitted.isEmpty());
  }

  @Test
  public void testFailingNotifierDoesNotStopDetection() {
    DegradationDetector failing = new DegradationDetector(new DegradationDetector.Args(),
        trigger -> {
          throw new IllegalStateException("bus down");
        });
    DegradationAssessment assessment = failing.assess("m1", 20, 10);
    assertTrue(assessment.isTriggersRetraining());
    assertTrue(assessment.getTrigger().isPresent());
  }

  @Test
  public void testDetectSplitsWindows() {
    List<PredictionRecord> history = new ArrayList<>();
    history.add(record(1, 120, 100));
    history.add(record(6, 120, 100));
    history.add(record(10, 110, 100));
    history.add(record(37, 110, 100));
    // Between the windows and before the baseline: ignored.
    history.add(PredictionRecord.builder(NOW.minus(Duration.ofHours(180)), 500)
        .actual(100).build());
    history.add(record(45, 500, 100));

    DegradationAssessment assessment = detector.detect("m1", history, NOW);
    assertEquals(20.0, assessment.getRecentMape(), 1e-9);
    assertEquals(10.0, assessment.getBaselineMape(), 1e-9);
    assertEquals(100.0, assessment.getDegradationRate(), 1e-9);
    assertEquals(Severity.HIGH, assessment.getSeverity());
  }

  @Test
  public void testHistoryStart() {
    assertEquals(NOW.minus(Duration.ofDays(38)), detector.historyStart(NOW));
  }
}
