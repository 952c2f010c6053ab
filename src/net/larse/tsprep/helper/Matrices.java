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

import org.ejml.simple.SimpleMatrix;

/** Small dense matrix helpers over row-major arrays. */
public final class Matrices {
  private Matrices() {}

  public static double[][] multiply(double[][] a, double[][] b) {
    Preconditions.checkArgument(a[0].length == b.length, "inner dimensions differ: %s vs %s",
        a[0].length, b.length);
    return toArray(new SimpleMatrix(a).mult(new SimpleMatrix(b)));
  }

  public static double[] multiply(double[][] a, double[] v) {
    double[] out = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      double s = 0;
      for (int j = 0; j < v.length; j++) {
        s += a[i][j] * v[j];
      }
      out[i] = s;
    }
    return out;
  }

  public static double[][] identity(int n) {
    double[][] out = new double[n][n];
    for (int i = 0; i < n; i++) {
      out[i][i] = 1;
    }
    return out;
  }

  public static double[][] inverse(double[][] a) {
    return toArray(new SimpleMatrix(a).invert());
  }

  public static double[][] pseudoInverse(double[][] a) {
    return toArray(new SimpleMatrix(a).pseudoInverse());
  }

  /** Solves {@code a x = b} for square {@code a}. */
  public static double[][] solve(double[][] a, double[][] b) {
    return toArray(new SimpleMatrix(a).solve(new SimpleMatrix(b)));
  }

  /** Sample covariance (ddof 1) of the columns of x, x given as {@code [row][variable]}. */
  public static double[][] covariance(double[][] x) {
    int n = x.length;
    int p = x[0].length;
    double[] mean = columnMeans(x);
    double[][] cov = new double[p][p];
    for (double[] row : x) {
      for (int i = 0; i < p; i++) {
        double di = row[i] - mean[i];
        for (int j = i; j < p; j++) {
          cov[i][j] += di * (row[j] - mean[j]);
        }
      }
    }
    for (int i = 0; i < p; i++) {
      for (int j = i; j < p; j++) {
        cov[i][j] /= n - 1;
        cov[j][i] = cov[i][j];
      }
    }
    return cov;
  }

  public static double[] columnMeans(double[][] x) {
    double[] mean = new double[x[0].length];
    for (double[] row : x) {
      for (int j = 0; j < mean.length; j++) {
        mean[j] += row[j];
      }
    }
    for (int j = 0; j < mean.length; j++) {
      mean[j] /= x.length;
    }
    return mean;
  }

  /** Residuals of regressing each column of y on the columns of x without intercept. */
  public static double[][] residuals(double[][] y, double[][] x) {
    if (x.length == 0 || x[0].length == 0) {
      return ArrayHelper.copy(y);
    }
    double[][] coef = FitGenerator.lstsq(x, y);
    double[][] fitted = multiply(x, coef);
    double[][] out = new double[y.length][y[0].length];
    for (int i = 0; i < y.length; i++) {
      for (int j = 0; j < y[0].length; j++) {
        out[i][j] = y[i][j] - fitted[i][j];
      }
    }
    return out;
  }

  public static double[][] toArray(SimpleMatrix m) {
    double[][] out = new double[m.numRows()][m.numCols()];
    for (int i = 0; i < out.length; i++) {
      for (int j = 0; j < out[i].length; j++) {
        out[i][j] = m.get(i, j);
      }
    }
    return out;
  }
}
