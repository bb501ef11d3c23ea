package net.larse.tsa.helper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.ejml.data.DenseMatrix64F;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LinearSystemSolverTest {
  private static final double EPS = 1e-10;

  @Test
  public void testSolveNeedsPivoting() throws Exception {
    // A zero in the leading position fails without row exchange.
    double[][] a = {{0, 2, 1}, {1, 1, 1}, {2, 1, 0}};
    double[] x = LinearSystemSolver.solve(a, new double[] {7, 6, 4});
    assertArrayEquals(new double[] {1, 2, 3}, x, EPS);
  }

  @Test
  public void testSolveDoesNotModifyInput() throws Exception {
    double[][] a = {{4, 1}, {1, 3}};
    double[] b = {1, 2};
    LinearSystemSolver.solve(a, b);
    assertArrayEquals(new double[] {4, 1}, a[0], 0);
    assertArrayEquals(new double[] {1, 2}, b, 0);
  }

  @Test
  public void testSolveDenseMatrix() throws Exception {
    DenseMatrix64F a = new DenseMatrix64F(2, 2, true, 2, 1, 1, 3);
    DenseMatrix64F b = new DenseMatrix64F(2, 1, true, 3, 5);
    double[] x = LinearSystemSolver.solve(a, b);
    assertEquals(0.8, x[0], EPS);
    assertEquals(1.4, x[1], EPS);
  }

  @Test
  public void testSingularSystem() {
    double[][] a = {{1, 2}, {2, 4}};
    try {
      LinearSystemSolver.solve(a, new double[] {1, 2});
      fail("singular system solved");
    } catch (SingularSystemException e) {
      assertEquals(1, e.getColumn());
    }
  }

  @Test
  public void testRankDeficientSystemReportsLastColumn() {
    // The third row is the sum of the first two.
    double[][] a = {{2, 1, 1}, {1, 3, 2}, {3, 4, 3}};
    try {
      LinearSystemSolver.solve(a, new double[] {1, 1, 2});
      fail("rank deficient system solved");
    } catch (SingularSystemException e) {
      assertEquals(2, e.getColumn());
    }
  }

  @Test
  public void testSmallScaleSystemIsNotSingular() throws Exception {
    double[][] a = {{4e-9, 1e-9}, {1e-9, 3e-9}};
    double[] x = LinearSystemSolver.solve(a, new double[] {1e-9, 2e-9});
    assertEquals(1.0 / 11, x[0], EPS);
    assertEquals(7.0 / 11, x[1], EPS);
  }

  @Test
  public void testToeplitzSystem() throws Exception {
    double[][] a = {{1, 0.5, 0.25}, {0.5, 1, 0.5}, {0.25, 0.5, 1}};
    double[] expected = {0.3, -0.2, 0.1};
    double[] b = new double[3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        b[i] += a[i][j] * expected[j];
      }
    }
    assertArrayEquals(expected, LinearSystemSolver.solve(a, b), EPS);
  }
}
