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
package net.larse.tsprep.transforms.scalers;

import net.larse.tsprep.exception.TransformException;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import net.larse.tsprep.transforms.AbstractTransformer;

import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.UnivariateRealFunction;
import org.apache.commons.math.optimization.GoalType;
import org.apache.commons.math.optimization.univariate.BrentOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Yeo-Johnson power transform of each series followed by standardization. The exponent
 * maximizes the Gaussian log likelihood of the transformed values.
 */
public class PowerTransformer extends AbstractTransformer<AbstractTransformer.NoArgs> {
  private static final Logger LOG = LogManager.getLogger(PowerTransformer.class);

  public static final String NAME = "PowerTransformer";

  private static final double LAMBDA_MIN = -5;
  private static final double LAMBDA_MAX = 5;
  private static final double EPS = 1e-12;

  private double[] lambdas;
  private StandardScaler scaler;

  public PowerTransformer() {
    super(NAME, new NoArgs());
  }

  static double yeoJohnson(double x, double lambda) {
    if (x >= 0) {
      return Math.abs(lambda) < EPS ? Math.log1p(x) : (Math.pow(x + 1, lambda) - 1) / lambda;
    }
    return Math.abs(lambda - 2) < EPS
        ? -Math.log1p(-x)
        : -(Math.pow(1 - x, 2 - lambda) - 1) / (2 - lambda);
  }

  static double inverseYeoJohnson(double y, double lambda) {
    if (y >= 0) {
      return Math.abs(lambda) < EPS ? Math.expm1(y) : Math.pow(y * lambda + 1, 1 / lambda) - 1;
    }
    return Math.abs(lambda - 2) < EPS
        ? -Math.expm1(-y)
        : 1 - Math.pow(-(2 - lambda) * y + 1, 1 / (2 - lambda));
  }

  static double logLikelihood(double[] x, double lambda) {
    double[] t = new double[x.length];
    double jacobian = 0;
    int n = 0;
    for (int i = 0; i < x.length; i++) {
      if (Double.isNaN(x[i])) {
        t[i] = Double.NaN;
        continue;
      }
      t[i] = yeoJohnson(x[i], lambda);
      jacobian += Math.signum(x[i]) * Math.log1p(Math.abs(x[i]));
      n++;
    }
    double sd = ArrayHelper.nanStd(t, 0);
    return -n / 2.0 * Math.log(sd * sd) + (lambda - 1) * jacobian;
  }

  /** The likelihood maximizing exponent, 1 for constant series. */
  static double fitLambda(final double[] x) throws MathException {
    if (!(ArrayHelper.nanStd(x, 0) > 0)) {
      return 1;
    }
    UnivariateRealFunction f = new UnivariateRealFunction() {
      @Override
      public double value(double lambda) {
        return logLikelihood(x, lambda);
      }
    };
    return new BrentOptimizer().optimize(f, GoalType.MAXIMIZE, LAMBDA_MIN, LAMBDA_MAX);
  }

  private TimeSeriesFrame power(TimeSeriesFrame df) {
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < data[j].length; i++) {
        data[j][i] = yeoJohnson(data[j][i], lambdas[j]);
      }
    }
    return df.withData(data);
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    lambdas = new double[df.cols()];
    for (int j = 0; j < df.cols(); j++) {
      try {
        lambdas[j] = fitLambda(df.column(j));
      } catch (MathException e) {
        throw new TransformException(NAME, "no exponent found for " + df.getColumn(j), e);
      }
    }
    LOG.debug("Yeo-Johnson exponents {}", lambdas);
    scaler = new StandardScaler();
    scaler.fit(power(df));
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    return scaler.transform(power(df));
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    double[][] data = scaler.inverseTransform(df).columnData();
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < data[j].length; i++) {
        data[j][i] = inverseYeoJohnson(data[j][i], lambdas[j]);
      }
    }
    return df.withData(data);
  }

  double[] lambdas() {
    return lambdas.clone();
  }
}
