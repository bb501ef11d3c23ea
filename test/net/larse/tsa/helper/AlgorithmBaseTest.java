package net.larse.tsa.helper;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AlgorithmBaseTest {
  enum Mode {
    FAST,
    EXACT
  }

  static class TestArgs extends AlgorithmBase.ArgsBase {
    @Doc(help = "Window length.")
    @Required
    public int window = 0;

    @Doc(help = "Tolerance.")
    @Optional
    public double tolerance = 0.5;

    @Optional
    public boolean verbose = false;

    @Doc(help = "Mode.")
    @Optional
    public Mode mode = Mode.FAST;

    @Doc(help = "Label.")
    @Optional
    public String label = "none";
  }

  @Test
  public void testPopulateConvertsValues() {
    TestArgs args = new TestArgs().populate(ImmutableMap.of(
        "window", 12L, "tolerance", "0.25", "verbose", "TRUE", "mode", "exact", "label", 7));
    assertEquals(12, args.window);
    assertEquals(0.25, args.tolerance, 0);
    assertTrue(args.verbose);
    assertEquals(Mode.EXACT, args.mode);
    assertEquals("7", args.label);
  }

  @Test
  public void testDefaultsKept() {
    TestArgs args = new TestArgs().populate(ImmutableMap.of("window", 3));
    assertEquals(0.5, args.tolerance, 0);
    assertFalse(args.verbose);
    assertEquals(Mode.FAST, args.mode);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownArgumentRejected() {
    new TestArgs().populate(ImmutableMap.of("window", 3, "windw", 4));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingRequiredRejected() {
    new TestArgs().populate(ImmutableMap.of("tolerance", 1.0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnparsableValueRejected() {
    new TestArgs().populate(ImmutableMap.of("window", "twelve"));
  }

  @Test
  public void testDescribe() {
    Map<String, String> help = new TestArgs().describe();
    assertEquals("Window length.", help.get("window"));
    assertEquals("", help.get("verbose"));
    assertEquals(5, help.size());
  }
}
