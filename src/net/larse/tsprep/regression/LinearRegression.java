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

import net.larse.tsprep.helper.FitGenerator;

/** Ordinary least squares, minimum norm when the design is rank deficient. */
public class LinearRegression implements Regressor {
  private final boolean fitIntercept;

  public LinearRegression(boolean fitIntercept) {
    this.fitIntercept = fitIntercept;
  }

  public LinearRegression() {
    this(true);
  }

  @Override
  public Predictor fit(double[][] x, double[][] y) {
    Preconditions.checkArgument(x.length == y.length, "%s rows of x but %s of y",
        x.length, y.length);
    Preconditions.checkArgument(x.length > 0, "no rows to fit");
    double[][] design = fitIntercept ? withIntercept(x) : x;
    double[][] coef = FitGenerator.lstsq(design, y);
    return new LinearPredictor(coef, fitIntercept);
  }

  static double[][] withIntercept(double[][] x) {
    double[][] out = new double[x.length][];
    for (int i = 0; i < x.length; i++) {
      out[i] = new double[x[i].length + 1];
      out[i][0] = 1;
      System.arraycopy(x[i], 0, out[i], 1, x[i].length);
    }
    return out;
  }

  /** Linear predictor, coefficients {@code [feature][target]}, intercept first if present. */
  static final class LinearPredictor implements Predictor {
    private final double[][] coef;
    private final boolean intercept;

    LinearPredictor(double[][] coef, boolean intercept) {
      this.coef = coef;
      this.intercept = intercept;
    }

    double[][] coefficients() {
      return coef;
    }

    @Override
    public double[][] predict(double[][] x) {
      int targets = coef[0].length;
      double[][] out = new double[x.length][targets];
      int off = intercept ? 1 : 0;
      for (int i = 0; i < x.length; i++) {
        for (int k = 0; k < targets; k++) {
          double v = intercept ? coef[0][k] : 0;
          for (int j = 0; j < x[i].length; j++) {
            v += coef[j + off][k] * x[i][j];
          }
          out[i][k] = v;
        }
      }
      return out;
    }
  }
}
