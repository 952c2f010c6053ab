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
package net.larse.tsprep.regression;

import com.google.common.base.Preconditions;

import java.util.Random;

/**
 * Elastic net by cyclic (or random) coordinate descent, minimizing
 * {@code 1/(2n) ||y - Xw||^2 + alpha * l1Ratio * ||w||_1 + alpha * (1 - l1Ratio) / 2 * ||w||^2}.
 * Each target is fit separately.
 */
public class ElasticNetRegression implements Regressor {
  private final double alpha;
  private final double l1Ratio;
  private final boolean fitIntercept;
  private final boolean randomSelection;
  private final int maxIter;
  private final double tol;
  private final Random random;

  public ElasticNetRegression(double alpha, double l1Ratio, boolean fitIntercept,
      boolean randomSelection, int maxIter, double tol, Random random) {
    Preconditions.checkArgument(alpha >= 0, "alpha must be non-negative");
    Preconditions.checkArgument(l1Ratio >= 0 && l1Ratio <= 1, "l1_ratio must be in [0, 1]");
    this.alpha = alpha;
    this.l1Ratio = l1Ratio;
    this.fitIntercept = fitIntercept;
    this.randomSelection = randomSelection;
    this.maxIter = maxIter;
    this.tol = tol;
    this.random = random;
  }

  public ElasticNetRegression(double alpha, double l1Ratio) {
    this(alpha, l1Ratio, true, false, 1000, 1e-4, new Random(0));
  }

  @Override
  public Predictor fit(double[][] x, double[][] y) {
    Preconditions.checkArgument(x.length == y.length && x.length > 0,
        "x and y must have the same, positive, number of rows");
    int n = x.length;
    int p = x[0].length;
    int targets = y[0].length;

    double[] xMean = new double[p];
    if (fitIntercept) {
      for (double[] row : x) {
        for (int j = 0; j < p; j++) {
          xMean[j] += row[j] / n;
        }
      }
    }
    double[][] xc = new double[p][n];
    double[] norms = new double[p];
    for (int j = 0; j < p; j++) {
      for (int i = 0; i < n; i++) {
        xc[j][i] = x[i][j] - xMean[j];
        norms[j] += xc[j][i] * xc[j][i];
      }
    }
    double l1 = alpha * l1Ratio * n;
    double l2 = alpha * (1 - l1Ratio) * n;

    double[][] coef = new double[p + 1][targets];
    for (int k = 0; k < targets; k++) {
      double yMean = 0;
      if (fitIntercept) {
        for (int i = 0; i < n; i++) {
          yMean += y[i][k] / n;
        }
      }
      double[] r = new double[n];
      double yScale = 0;
      for (int i = 0; i < n; i++) {
        r[i] = y[i][k] - yMean;
        yScale = Math.max(yScale, Math.abs(r[i]));
      }
      double[] w = new double[p];
      for (int iter = 0; iter < maxIter; iter++) {
        double maxChange = 0;
        double maxW = 0;
        for (int step = 0; step < p; step++) {
          int j = randomSelection ? random.nextInt(p) : step;
          if (norms[j] == 0) {
            continue;
          }
          double old = w[j];
          double rho = 0;
          for (int i = 0; i < n; i++) {
            rho += xc[j][i] * (r[i] + xc[j][i] * old);
          }
          double updated = softThreshold(rho, l1) / (norms[j] + l2);
          if (updated != old) {
            double delta = updated - old;
            for (int i = 0; i < n; i++) {
              r[i] -= xc[j][i] * delta;
            }
            w[j] = updated;
          }
          maxChange = Math.max(maxChange, Math.abs(updated - old));
          maxW = Math.max(maxW, Math.abs(updated));
        }
        if (maxW == 0 || maxChange / Math.max(maxW, 1e-12) < tol
            || maxChange < tol * Math.max(yScale, 1e-12) * 1e-3) {
          break;
        }
      }
      double b = yMean;
      for (int j = 0; j < p; j++) {
        coef[j + 1][k] = w[j];
        b -= w[j] * xMean[j];
      }
      coef[0][k] = b;
    }
    return new LinearRegression.LinearPredictor(coef, true);
  }

  static double softThreshold(double v, double threshold) {
    if (v > threshold) {
      return v - threshold;
    } else if (v < -threshold) {
      return v + threshold;
    }
    return 0;
  }
}
