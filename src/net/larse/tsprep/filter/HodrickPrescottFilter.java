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
package net.larse.tsprep.filter;

import com.google.common.base.Preconditions;

import net.larse.tsprep.exception.NullValueException;
import net.larse.tsprep.helper.ArrayHelper;

/**
 * Hodrick-Prescott filter. The trend solves {@code (I + lamb * K'K) trend = y} where K is the
 * second difference operator; the system is symmetric positive definite and pentadiagonal, so
 * it is solved with a banded Cholesky factorization.
 */
public final class HodrickPrescottFilter {
  private HodrickPrescottFilter() {}

  /** The trend component. */
  public static double[] trend(double[] y, double lamb) {
    if (ArrayHelper.hasNaN(y)) {
      throw new NullValueException("HPFilter");
    }
    int n = y.length;
    Preconditions.checkArgument(lamb >= 0, "lambda must be non-negative");
    if (n < 3) {
      return y.clone();
    }
    // the three non-zero diagonals of I + lamb * K'K
    double[] d0 = new double[n];
    double[] d1 = new double[n - 1];
    double[] d2 = new double[n - 2];
    for (int r = 0; r < n - 2; r++) {
      // row r of K is (1, -2, 1) at columns r, r+1, r+2
      double[] k = {1, -2, 1};
      for (int a = 0; a < 3; a++) {
        d0[r + a] += lamb * k[a] * k[a];
        if (a < 2) {
          d1[r + a] += lamb * k[a] * k[a + 1];
        }
        if (a < 1) {
          d2[r + a] += lamb * k[a] * k[a + 2];
        }
      }
    }
    for (int i = 0; i < n; i++) {
      d0[i] += 1;
    }
    return solvePentadiagonal(d0, d1, d2, y);
  }

  /** The cycle, y minus the trend. */
  public static double[] cycle(double[] y, double lamb) {
    double[] t = trend(y, lamb);
    double[] c = new double[y.length];
    for (int i = 0; i < c.length; i++) {
      c[i] = y[i] - t[i];
    }
    return c;
  }

  /** Banded Cholesky L D L' solve of a symmetric pentadiagonal system. */
  static double[] solvePentadiagonal(double[] d0, double[] d1, double[] d2, double[] b) {
    int n = d0.length;
    double[] d = new double[n];
    double[] l1 = new double[n];
    double[] l2 = new double[n];
    for (int i = 0; i < n; i++) {
      double v = d0[i];
      if (i >= 1) {
        v -= l1[i - 1] * l1[i - 1] * d[i - 1];
      }
      if (i >= 2) {
        v -= l2[i - 2] * l2[i - 2] * d[i - 2];
      }
      d[i] = v;
      if (i < n - 1) {
        double u = d1[i];
        if (i >= 1) {
          u -= l1[i - 1] * l2[i - 1] * d[i - 1];
        }
        l1[i] = u / d[i];
      }
      if (i < n - 2) {
        l2[i] = d2[i] / d[i];
      }
    }
    double[] z = new double[n];
    for (int i = 0; i < n; i++) {
      double v = b[i];
      if (i >= 1) {
        v -= l1[i - 1] * z[i - 1];
      }
      if (i >= 2) {
        v -= l2[i - 2] * z[i - 2];
      }
      z[i] = v;
    }
    double[] x = new double[n];
    for (int i = n - 1; i >= 0; i--) {
      double v = z[i] / d[i];
      if (i < n - 1) {
        v -= l1[i] * x[i + 1];
      }
      if (i < n - 2) {
        v -= l2[i] * x[i + 2];
      }
      x[i] = v;
    }
    return x;
  }
}
