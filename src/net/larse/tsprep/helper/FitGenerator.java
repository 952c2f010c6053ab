/*
 * Copyright (c) 2015 Zhiqiang Yang.
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

package net.larse.tsprep.helper;

import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;
import org.ejml.simple.SimpleMatrix;

/**
 * A wrapper for least squares fitting of one or more targets against a
 * shared design matrix.
 */
public class FitGenerator {
  private int numCols;
  private int numRows;
  private int numTargets;

  private DenseMatrix64F matrixA;
  private DenseMatrix64F matrixB;

  public void init(int numCols, int numRows, int numTargets) {
    this.numCols = numCols;
    this.numRows = numRows;
    this.numTargets = numTargets;
    matrixA = new DenseMatrix64F(numRows, numCols);
    matrixB = new DenseMatrix64F(numRows, numTargets);
  }

  public void setObservation(int idx, int feature, double value) {
    matrixA.set(idx, feature, value);
  }

  public void setTarget(int idx, int targetIdx, double target) {
    matrixB.set(idx, targetIdx, target);
  }

  /**
   * Solves all targets. When the design matrix is rank deficient or has fewer
   * rows than columns the minimum norm solution is returned.
   */
  public DenseMatrix64F fit() {
    DenseMatrix64F matrixX = new DenseMatrix64F(numCols, numTargets);
    if (numRows >= numCols) {
      LinearSolver<DenseMatrix64F> solver =
          LinearSolverFactory.leastSquares(matrixA.getNumRows(), matrixA.getNumCols());
      if (solver.setA(matrixA.copy()) && solver.quality() > 1e-12) {
        solver.solve(matrixB.copy(), matrixX);
        return matrixX;
      }
    }
    return solveMinimumNorm(matrixA, matrixB);
  }

  /** Minimum norm least squares solution of a * x = b through the pseudo-inverse. */
  public static DenseMatrix64F solveMinimumNorm(DenseMatrix64F a, DenseMatrix64F b) {
    SimpleMatrix pinv = SimpleMatrix.wrap(a).pseudoInverse();
    return pinv.mult(SimpleMatrix.wrap(b)).getMatrix();
  }

  /**
   * Least squares solution of a * x = b for row-major arrays, the equivalent of
   * lstsq in numerical packages. Returns x as [a columns][b columns].
   */
  public static double[][] lstsq(double[][] a, double[][] b) {
    FitGenerator fg = new FitGenerator();
    int cols = a[0].length;
    int targets = b[0].length;
    fg.init(cols, a.length, targets);
    for (int i = 0; i < a.length; i++) {
      for (int j = 0; j < cols; j++) {
        fg.setObservation(i, j, a[i][j]);
      }
      for (int k = 0; k < targets; k++) {
        fg.setTarget(i, k, b[i][k]);
      }
    }
    DenseMatrix64F x = fg.fit();
    double[][] out = new double[cols][targets];
    for (int j = 0; j < cols; j++) {
      for (int k = 0; k < targets; k++) {
        out[j][k] = x.get(j, k);
      }
    }
    return out;
  }
}
