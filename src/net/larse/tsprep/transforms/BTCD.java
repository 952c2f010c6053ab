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
import net.larse.tsprep.helper.Matrices;
import net.larse.tsprep.helper.SymmetricEigen;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.regression.Predictor;
import net.larse.tsprep.regression.RegressionModel;

/**
 * Box and Tiao canonical decomposition: the series are regressed on their own lags and the
 * components maximize the share of variance the regression predicts, most predictable first.
 */
public class BTCD extends LinearDecomposition<BTCD.Args> {
  public static final String NAME = "BTCD";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Regression of each row on the lagged rows.")
    @Optional
    public RegressionModel regressionModel = RegressionModel.of("LinearRegression");

    @Doc(help = "Number of lagged rows used as features.")
    @Optional
    public int maxLags = 1;

    @Doc(help = "Seed of the regression model.")
    @Optional
    public long randomSeed = 2020;

    @Override
    protected void checkValues() {
      if (maxLags < 1) {
        throw new IllegalArgumentException("maxLags must be at least 1");
      }
    }
  }

  public BTCD(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.regressionModel = RegressionModel.of(
        WeightedChoice.uniform(random, "LinearRegression", "FastRidge"));
    a.maxLags = WeightedChoice.uniform(random, 1, 2);
    return a;
  }

  @Override
  protected double[][] components(double[][] rows) {
    int lags = args.maxLags;
    int n = rows.length - lags;
    int p = rows[0].length;
    if (n <= p) {
      throw new IllegalArgumentException("too few observations for BTCD: " + rows.length);
    }
    double[][] x = new double[n][lags * p];
    double[][] y = new double[n][];
    for (int i = 0; i < n; i++) {
      y[i] = rows[i + lags].clone();
      for (int lag = 1; lag <= lags; lag++) {
        System.arraycopy(rows[i + lags - lag], 0, x[i], (lag - 1) * p, p);
      }
    }
    Predictor model = args.regressionModel.create(args.randomSeed).fit(x, y);
    double[][] predicted = model.predict(x);
    return SymmetricEigen.generalized(Matrices.covariance(predicted), Matrices.covariance(y))
        .vectors();
  }
}
