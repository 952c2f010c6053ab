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
package net.larse.tsprep.transforms;

import java.util.Random;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.Matrices;
import net.larse.tsprep.helper.SymmetricEigen;
import net.larse.tsprep.helper.WeightedChoice;

/**
 * Projects the series onto the Johansen cointegrating vectors, strongest first.
 *
 * <p>The vectors solve the generalized eigenproblem of the reduced rank regression of the
 * differenced series on the lagged levels, after both are purged of the lagged differences.
 */
public class Cointegration extends LinearDecomposition<Cointegration.Args> {
  public static final String NAME = "Cointegration";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "-1 no deterministic terms, 0 constant, 1 linear trend.")
    @Optional
    public int detOrder = -1;

    @Doc(help = "Number of lagged differences in the model.")
    @Optional
    public int kArDiff = 1;

    @Override
    protected void checkValues() {
      if (detOrder < -1 || detOrder > 1) {
        throw new IllegalArgumentException("detOrder must be -1, 0 or 1");
      }
      if (kArDiff < 0) {
        throw new IllegalArgumentException("kArDiff must be non-negative");
      }
    }
  }

  public Cointegration(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.detOrder = WeightedChoice.uniform(random, -1, 0, 1);
    a.kArDiff = WeightedChoice.uniform(random, 0, 1, 2);
    return a;
  }

  @Override
  protected double[][] components(double[][] rows) {
    return johansen(rows, args.detOrder, args.kArDiff);
  }

  static double[][] johansen(double[][] endog, int detOrder, int kArDiff) {
    int f = detOrder > -1 ? 0 : detOrder;
    double[][] levels = detrend(endog, detOrder);
    int n = levels.length;
    int p = levels[0].length;
    int t = n - 1 - kArDiff;
    if (t <= p) {
      throw new IllegalArgumentException(
          "too few observations for cointegration: " + n + " rows, " + p + " series");
    }
    double[][] dx = new double[n - 1][p];
    for (int i = 1; i < n; i++) {
      for (int j = 0; j < p; j++) {
        dx[i - 1][j] = levels[i][j] - levels[i - 1][j];
      }
    }
    double[][] z = new double[t][kArDiff * p];
    double[][] dxTrim = new double[t][];
    double[][] lx = new double[t][];
    for (int r = 0; r < t; r++) {
      int row = r + kArDiff;
      dxTrim[r] = dx[row].clone();
      lx[r] = levels[r + 1].clone();
      for (int lag = 1; lag <= kArDiff; lag++) {
        System.arraycopy(dx[row - lag], 0, z[r], (lag - 1) * p, p);
      }
    }
    z = detrend(z, f);
    double[][] r0 = Matrices.residuals(detrend(dxTrim, f), z);
    double[][] rk = Matrices.residuals(detrend(lx, f), z);
    double[][] skk = crossProduct(rk, rk);
    double[][] sk0 = crossProduct(rk, r0);
    double[][] s00 = crossProduct(r0, r0);
    double[][] sig = Matrices.multiply(Matrices.multiply(sk0, Matrices.inverse(s00)),
        ArrayHelper.transpose(sk0));
    return SymmetricEigen.generalized(sig, skk).vectors();
  }

  private static double[][] crossProduct(double[][] a, double[][] b) {
    int p = a[0].length;
    int q = b[0].length;
    double[][] out = new double[p][q];
    for (int i = 0; i < a.length; i++) {
      for (int j = 0; j < p; j++) {
        for (int k = 0; k < q; k++) {
          out[j][k] += a[i][j] * b[i][k];
        }
      }
    }
    for (double[] row : out) {
      for (int k = 0; k < q; k++) {
        row[k] /= a.length;
      }
    }
    return out;
  }

  /** Removes a polynomial time trend of the given order from each column, none for -1. */
  static double[][] detrend(double[][] y, int order) {
    if (order == -1 || y.length == 0 || y[0].length == 0) {
      return y;
    }
    double[][] trend = new double[y.length][order + 1];
    for (int i = 0; i < y.length; i++) {
      for (int k = 0; k <= order; k++) {
        trend[i][k] = Math.pow(i, k);
      }
    }
    return Matrices.residuals(y, trend);
  }
}
