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

import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math.stat.descriptive.rank.Median;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;
import org.ejml.ops.CommonOps;

import java.util.Arrays;

/**
 * Iteratively reweighted least squares with the bisquare weight function.
 * Residuals are inflated by their leverage, scaled by their median absolute
 * deviation, and observations beyond beta scales get zero weight.
 */
public final class RobustLeastSquareBisquare {
  /** The usual bisquare tuning constant. */
  public static final double DEFAULT_BETA = 4.685;

  private static final int MAX_ITERATIONS = 50;
  private static final double MAD_TO_SIGMA = 0.6745;

  private RobustLeastSquareBisquare() {}

  /**
   * Robust coefficients of a * x = b, or null when a has fewer rows than
   * columns or is rank deficient.
   */
  public static double[] solve(double[][] a, double[] b, double beta) {
    int n = a.length;
    int p = a[0].length;
    if (n < p) {
      return null;
    }
    DenseMatrix64F design = new DenseMatrix64F(a);
    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.leastSquares(n, p);
    if (!solver.setA(design.copy())) {
      return null;
    }
    DenseMatrix64F x = new DenseMatrix64F(p, 1);
    solver.solve(DenseMatrix64F.wrap(n, 1, b.clone()), x);

    double[] inflate = leverageInflation(design);
    if (inflate == null) {
      return null;
    }
    // a perfect fit would otherwise make every point an outlier
    double floor = 1e-6 * new StandardDeviation().evaluate(b);
    if (floor == 0) {
      floor = 1.0;
    }

    double[] residual = new double[n];
    DenseMatrix64F weighted = new DenseMatrix64F(n, p);
    DenseMatrix64F target = new DenseMatrix64F(n, 1);
    DenseMatrix64F next = new DenseMatrix64F(p, 1);
    for (int iter = 0; iter < MAX_ITERATIONS; iter++) {
      for (int i = 0; i < n; i++) {
        double fitted = 0;
        for (int j = 0; j < p; j++) {
          fitted += a[i][j] * x.get(j, 0);
        }
        residual[i] = (b[i] - fitted) * inflate[i];
      }
      double scale = Math.max(madSigma(residual, p), floor) * beta;
      for (int i = 0; i < n; i++) {
        double w = Math.sqrt(bisquare(residual[i] / scale));
        for (int j = 0; j < p; j++) {
          weighted.set(i, j, a[i][j] * w);
        }
        target.set(i, 0, b[i] * w);
      }
      if (!solver.setA(weighted.copy())) {
        return null;
      }
      solver.solve(target.copy(), next);
      boolean converged = true;
      for (int j = 0; j < p; j++) {
        if (Math.abs(next.get(j, 0) - x.get(j, 0)) > Math.sqrt(Math.ulp(1.0))) {
          converged = false;
        }
      }
      x.set(next);
      if (converged) {
        break;
      }
    }
    return x.getData().clone();
  }

  /** 1 / sqrt(1 - h) for the diagonal h of the hat matrix. */
  private static double[] leverageInflation(DenseMatrix64F a) {
    DenseMatrix64F gram = new DenseMatrix64F(a.numCols, a.numCols);
    CommonOps.multTransA(a, a, gram);
    if (!CommonOps.invert(gram)) {
      return null;
    }
    DenseMatrix64F ag = new DenseMatrix64F(a.numRows, a.numCols);
    CommonOps.mult(a, gram, ag);
    double[] out = new double[a.numRows];
    for (int i = 0; i < a.numRows; i++) {
      double h = 0;
      for (int j = 0; j < a.numCols; j++) {
        h += ag.get(i, j) * a.get(i, j);
      }
      out[i] = 1.0 / Math.sqrt(1 - Math.min(0.9999, h));
    }
    return out;
  }

  static double bisquare(double u) {
    if (Math.abs(u) >= 1) {
      return 0;
    }
    double t = 1 - u * u;
    return t * t;
  }

  /** MAD scale of the residuals, ignoring the p - 1 closest to zero. */
  private static double madSigma(double[] residual, int p) {
    double[] abs = new double[residual.length];
    for (int i = 0; i < abs.length; i++) {
      abs[i] = Math.abs(residual[i]);
    }
    Arrays.sort(abs);
    double[] kept = Arrays.copyOfRange(abs, Math.max(0, p - 1), abs.length);
    return new Median().evaluate(kept) / MAD_TO_SIGMA;
  }
}
