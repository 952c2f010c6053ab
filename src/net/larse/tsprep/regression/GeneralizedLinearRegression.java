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
import org.ejml.simple.SimpleMatrix;

/**
 * Generalized linear model with a log link, fit by iteratively reweighted least squares.
 * Features are standardized internally. Each target is fit separately.
 */
public class GeneralizedLinearRegression implements Regressor {
  private static final Logger LOG = LogManager.getLogger(GeneralizedLinearRegression.class);

  /** Response distribution, through the power of its variance function. */
  public enum Family {
    POISSON(1.0),
    GAMMA(2.0),
    TWEEDIE(1.5);

    private final double power;

    Family(double power) {
      this.power = power;
    }

    public double power() {
      return power;
    }
  }

  private final Family family;
  private final double alpha;
  private final int maxIter;

  public GeneralizedLinearRegression(Family family, double alpha, int maxIter) {
    Preconditions.checkArgument(alpha >= 0, "alpha must be non-negative");
    this.family = family;
    this.alpha = alpha;
    this.maxIter = maxIter;
  }

  public GeneralizedLinearRegression(Family family) {
    this(family, 1e-8, 200);
  }

  @Override
  public Predictor fit(double[][] x, double[][] y) {
    Preconditions.checkArgument(x.length == y.length && x.length > 0,
        "x and y must have the same, positive, number of rows");
    int n = x.length;
    int p = x[0].length;
    int targets = y[0].length;
    double[] mean = new double[p];
    double[] scale = new double[p];
    for (int j = 0; j < p; j++) {
      for (double[] row : x) {
        mean[j] += row[j] / n;
      }
      double ss = 0;
      for (double[] row : x) {
        ss += (row[j] - mean[j]) * (row[j] - mean[j]);
      }
      scale[j] = ss > 0 ? Math.sqrt(ss / n) : 1;
    }
    SimpleMatrix design = new SimpleMatrix(n, p + 1);
    for (int i = 0; i < n; i++) {
      design.set(i, 0, 1);
      for (int j = 0; j < p; j++) {
        design.set(i, j + 1, (x[i][j] - mean[j]) / scale[j]);
      }
    }
    double[][] coef = new double[p + 1][targets];
    for (int k = 0; k < targets; k++) {
      double[] beta = fitTarget(design, y, k);
      coef[0][k] = beta[0];
      for (int j = 0; j < p; j++) {
        coef[j + 1][k] = beta[j + 1] / scale[j];
        coef[0][k] -= beta[j + 1] * mean[j] / scale[j];
      }
    }
    LinearRegression.LinearPredictor linear = new LinearRegression.LinearPredictor(coef, true);
    return features -> {
      double[][] eta = linear.predict(features);
      for (double[] row : eta) {
        for (int k = 0; k < row.length; k++) {
          row[k] = Math.exp(row[k]);
        }
      }
      return eta;
    };
  }

  private double[] fitTarget(SimpleMatrix design, double[][] y, int k) {
    int n = design.numRows();
    int p = design.numCols();
    double yMean = 0;
    for (int i = 0; i < n; i++) {
      Preconditions.checkArgument(y[i][k] >= 0 && (family != Family.GAMMA || y[i][k] > 0),
          "%s regression needs %s targets", family,
          family == Family.GAMMA ? "positive" : "non-negative");
      yMean += y[i][k] / n;
    }
    double[] beta = new double[p];
    beta[0] = Math.log(Math.max(yMean, 1e-12));
    double previous = Double.MAX_VALUE;
    for (int iter = 0; iter < maxIter; iter++) {
      SimpleMatrix weighted = new SimpleMatrix(n, p);
      SimpleMatrix z = new SimpleMatrix(n, 1);
      double deviance = 0;
      for (int i = 0; i < n; i++) {
        double eta = 0;
        for (int j = 0; j < p; j++) {
          eta += design.get(i, j) * beta[j];
        }
        double mu = Math.exp(eta);
        // log link: d mu / d eta = mu, weight = mu^2 / V(mu)
        double w = Math.pow(mu, 2 - family.power());
        double sw = Math.sqrt(w);
        for (int j = 0; j < p; j++) {
          weighted.set(i, j, design.get(i, j) * sw);
        }
        z.set(i, 0, (eta + (y[i][k] - mu) / mu) * sw);
        deviance += (y[i][k] - mu) * (y[i][k] - mu) / Math.pow(mu, family.power());
      }
      SimpleMatrix penalty = SimpleMatrix.identity(p).scale(alpha * n);
      penalty.set(0, 0, 0);
      SimpleMatrix gram = weighted.transpose().mult(weighted).plus(penalty);
      SimpleMatrix solution = gram.pseudoInverse().mult(weighted.transpose().mult(z));
      for (int j = 0; j < p; j++) {
        beta[j] = solution.get(j, 0);
      }
      if (Math.abs(previous - deviance) <= 1e-8 * Math.max(1, Math.abs(deviance))) {
        return beta;
      }
      previous = deviance;
    }
    LOG.debug("{} regression reached {} iterations without converging", family, maxIter);
    return beta;
  }
}
