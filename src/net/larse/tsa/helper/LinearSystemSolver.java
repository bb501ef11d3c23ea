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
package net.larse.tsa.helper;

import com.google.common.base.Preconditions;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.DecompositionFactory;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.decomposition.LUDecomposition;
import org.ejml.interfaces.linsol.LinearSolver;
import org.ejml.ops.CommonOps;

/**
 * Solves the small dense systems that come out of Yule-Walker fits with EJML's LU
 * decomposition (partial pivoting). Inputs are left untouched.
 */
public class LinearSystemSolver {
  // A diagonal entry of U below this fraction of the largest matrix entry is treated as zero.
  private static final double PIVOT_TOLERANCE = 1e-12;

  private LinearSystemSolver() {}

  public static double[] solve(double[][] a, double[] b) throws SingularSystemException {
    Preconditions.checkArgument(a.length == b.length, "row count differs from rhs length");
    return solve(new DenseMatrix64F(a), DenseMatrix64F.wrap(b.length, 1, b.clone()));
  }

  /**
   * Solve a x = b for a square a and a column vector b.
   *
   * @throws SingularSystemException when a pivot of the LU decomposition is numerically zero
   */
  public static double[] solve(DenseMatrix64F a, DenseMatrix64F b)
      throws SingularSystemException {
    Preconditions.checkArgument(a.numRows == a.numCols, "matrix must be square");
    Preconditions.checkArgument(b.numRows == a.numRows && b.numCols == 1,
        "rhs must be a column vector with %s rows", a.numRows);
    int n = a.numRows;
    checkPivots(a);

    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.linear(n);
    if (!solver.setA(a.copy()) || solver.quality() == 0) {
      throw new SingularSystemException(n - 1, 0);
    }
    DenseMatrix64F x = new DenseMatrix64F(n, 1);
    solver.solve(b.copy(), x);
    return x.getData().clone();
  }

  /** Throws for the first column whose pivot in U is negligible against the matrix scale. */
  private static void checkPivots(DenseMatrix64F a) throws SingularSystemException {
    LUDecomposition<DenseMatrix64F> lu = DecompositionFactory.lu(a.numRows, a.numCols);
    if (!lu.decompose(a.copy())) {
      throw new SingularSystemException(0, Double.NaN);
    }
    DenseMatrix64F upper = lu.getUpper(null);
    double tolerance = PIVOT_TOLERANCE * Math.max(CommonOps.elementMaxAbs(a), Double.MIN_NORMAL);
    for (int col = 0; col < a.numCols; col++) {
      double pivot = upper.get(col, col);
      if (Math.abs(pivot) <= tolerance) {
        throw new SingularSystemException(col, pivot);
      }
    }
  }
}
