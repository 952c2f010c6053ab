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

import org.ejml.simple.SimpleMatrix;

/** Least squares with an L2 penalty on the slopes. The intercept is not penalized. */
public class RidgeRegression implements Regressor {
  private final double alpha;
  private final boolean fitIntercept;

  public RidgeRegression(double alpha, boolean fitIntercept) {
    Preconditions.checkArgument(alpha >= 0, "alpha must be non-negative, got %s", alpha);
    this.alpha = alpha;
    this.fitIntercept = fitIntercept;
  }

  public RidgeRegression() {
    this(1.0, true);
  }

  @Override
  public Predictor fit(double[][] x, double[][] y) {
    Preconditions.checkArgument(x.length == y.length && x.length > 0,
        "x and y must have the same, positive, number of rows");
    int n = x.length;
    int p = x[0].length;
    int targets = y[0].length;
    double[] xMean = new double[p];
    double[] yMean = new double[targets];
    if (fitIntercept) {
      for (int i = 0; i < n; i++) {
        for (int j = 0; j < p; j++) {
          xMean[j] += x[i][j] / n;
        }
        for (int k = 0; k < targets; k++) {
          yMean[k] += y[i][k] / n;
        }
      }
    }
    SimpleMatrix xc = new SimpleMatrix(n, p);
    SimpleMatrix yc = new SimpleMatrix(n, targets);
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < p; j++) {
        xc.set(i, j, x[i][j] - xMean[j]);
      }
      for (int k = 0; k < targets; k++) {
        yc.set(i, k, y[i][k] - yMean[k]);
      }
    }
    SimpleMatrix gram = xc.transpose().mult(xc).plus(SimpleMatrix.identity(p).scale(alpha));
    SimpleMatrix w = gram.pseudoInverse().mult(xc.transpose().mult(yc));

    double[][] coef = new double[p + 1][targets];
    for (int k = 0; k < targets; k++) {
      double b = yMean[k];
      for (int j = 0; j < p; j++) {
        coef[j + 1][k] = w.get(j, k);
        b -= w.get(j, k) * xMean[j];
      }
      coef[0][k] = b;
    }
    return new LinearRegression.LinearPredictor(coef, true);
  }
}
