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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import net.larse.tsprep.helper.FitGenerator;
import net.larse.tsprep.helper.RobustLeastSquareBisquare;

/**
 * Linear regression with an intercept, fit by iteratively reweighted least squares with the
 * bisquare weight function so outliers pull less on the line.
 */
public class RobustLinearRegression implements Regressor {
  private static final Logger LOG = LogManager.getLogger(RobustLinearRegression.class);

  private final double beta;

  public RobustLinearRegression(double beta) {
    this.beta = beta;
  }

  public RobustLinearRegression() {
    this(RobustLeastSquareBisquare.DEFAULT_BETA);
  }

  @Override
  public Predictor fit(double[][] x, double[][] y) {
    Preconditions.checkArgument(x.length == y.length && x.length > 0,
        "x and y must have the same, positive, number of rows");
    double[][] design = LinearRegression.withIntercept(x);
    int p = design[0].length;
    int targets = y[0].length;
    double[][] coef = new double[p][targets];
    for (int k = 0; k < targets; k++) {
      double[][] target = column(y, k);
      double[] b = new double[target.length];
      for (int i = 0; i < b.length; i++) {
        b[i] = target[i][0];
      }
      double[] solution = RobustLeastSquareBisquare.solve(design, b, beta);
      if (solution == null) {
        LOG.warn("Bisquare fit failed for target {}, using ordinary least squares", k);
        double[][] ols = FitGenerator.lstsq(design, target);
        for (int j = 0; j < p; j++) {
          coef[j][k] = ols[j][0];
        }
      } else {
        for (int j = 0; j < p; j++) {
          coef[j][k] = solution[j];
        }
      }
    }
    return new LinearRegression.LinearPredictor(coef, true);
  }

  private static double[][] column(double[][] y, int k) {
    double[][] out = new double[y.length][1];
    for (int i = 0; i < y.length; i++) {
      out[i][0] = y[i][k];
    }
    return out;
  }
}
