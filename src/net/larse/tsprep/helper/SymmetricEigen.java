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

import com.google.common.base.Preconditions;

import org.apache.commons.math.linear.EigenDecompositionImpl;
import org.apache.commons.math.linear.MatrixUtils;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Eigen decomposition of symmetric matrices, eigenvalues in descending order.
 *
 * <p>{@link #generalized} solves {@code a v = lambda b v} for symmetric {@code a} and positive
 * definite {@code b} by reducing it to the ordinary problem on
 * {@code b^-1/2 a b^-1/2}; the eigenvectors are then normalized so that
 * {@code v' b v = 1}.
 */
public final class SymmetricEigen {
  private final double[] values;
  // vectors[k] is the eigenvector of values[k]
  private final double[][] vectors;

  private SymmetricEigen(double[] values, double[][] vectors) {
    this.values = values;
    this.vectors = vectors;
  }

  public double[] values() {
    return values.clone();
  }

  /** Eigenvectors as rows, in the order of {@link #values()}. */
  public double[][] vectors() {
    return ArrayHelper.copy(vectors);
  }

  public static SymmetricEigen of(double[][] a) {
    Preconditions.checkArgument(a.length > 0 && a.length == a[0].length,
        "matrix must be square");
    double[][] sym = symmetrize(a);
    EigenDecompositionImpl eig =
        new EigenDecompositionImpl(MatrixUtils.createRealMatrix(sym), Double.MIN_NORMAL);
    double[] raw = eig.getRealEigenvalues();
    Integer[] order = IntStream.range(0, raw.length).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingDouble(i -> -raw[i]));
    double[] values = new double[raw.length];
    double[][] vectors = new double[raw.length][];
    for (int k = 0; k < order.length; k++) {
      values[k] = raw[order[k]];
      vectors[k] = eig.getEigenvector(order[k]).getData();
    }
    return new SymmetricEigen(values, vectors);
  }

  public static SymmetricEigen generalized(double[][] a, double[][] b) {
    double[][] root = inverseSqrt(b);
    double[][] m = Matrices.multiply(Matrices.multiply(root, a), root);
    SymmetricEigen inner = of(m);
    double[][] vectors = new double[inner.vectors.length][];
    for (int k = 0; k < vectors.length; k++) {
      vectors[k] = Matrices.multiply(root, inner.vectors[k]);
    }
    return new SymmetricEigen(inner.values, vectors);
  }

  /** {@code b^-1/2}, with eigenvalues below a relative floor clamped to it. */
  public static double[][] inverseSqrt(double[][] b) {
    SymmetricEigen e = of(b);
    int n = b.length;
    double floor = Math.max(Math.abs(e.values[0]) * 1e-12, 1e-300);
    double[][] out = new double[n][n];
    for (int k = 0; k < n; k++) {
      double s = 1 / Math.sqrt(Math.max(e.values[k], floor));
      double[] v = e.vectors[k];
      for (int i = 0; i < n; i++) {
        for (int j = 0; j < n; j++) {
          out[i][j] += s * v[i] * v[j];
        }
      }
    }
    return out;
  }

  private static double[][] symmetrize(double[][] a) {
    int n = a.length;
    double[][] out = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        out[i][j] = (a[i][j] + a[j][i]) / 2;
      }
    }
    return out;
  }
}
