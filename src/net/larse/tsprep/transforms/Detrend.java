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

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.Random;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.pipeline.GeneralTransformer;
import net.larse.tsprep.pipeline.RandomTransform;
import net.larse.tsprep.pipeline.TransformConfig;
import net.larse.tsprep.regression.GeneralizedLinearRegression;
import net.larse.tsprep.regression.LinearRegression;
import net.larse.tsprep.regression.Predictor;
import net.larse.tsprep.regression.Regressor;
import net.larse.tsprep.regression.RobustLinearRegression;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Removes a regression of each series on time, in days since the epoch.
 *
 * <p>GLS is a least squares line through the origin, Linear has an intercept, Robust down
 * weights outliers. Poisson, Gamma and Tweedie fit a log link model to the series shifted to
 * a minimum of one, and the prediction is shifted back. The inverse adds the prediction,
 * damped by {@code phi^i} on the i-th row.
 */
public class Detrend extends AbstractTransformer<Detrend.Args> {
  public static final String NAME = "Detrend";

  static final ImmutableList<String> MODELS =
      ImmutableList.of("GLS", "Linear", "Poisson", "Tweedie", "Gamma", "Robust");
  private static final ImmutableList<String> NEED_POSITIVE =
      ImmutableList.of("Poisson", "Gamma", "Tweedie");

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "GLS, Linear, Poisson, Tweedie, Gamma or Robust.")
    @Optional
    public String model = "GLS";

    @Doc(help = "Damping of the trend added back on inverse, 1 for none.")
    @Optional
    public double phi = 1.0;

    @Doc(help = "Fit on the most recent rows only, null for all.")
    @Optional
    public Integer window = null;

    @Doc(help = "Pipeline that cleans the data the trend is fit on.")
    @Optional
    public TransformConfig transformDict = null;

    @Override
    protected void checkValues() {
      if (!MODELS.contains(model)) {
        throw new IllegalArgumentException("unknown Detrend model " + model);
      }
      if (window != null && window < 2) {
        throw new IllegalArgumentException("window must be at least 2");
      }
    }
  }

  private Predictor trend;
  private PositiveShift shift;

  public Detrend(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.window = WeightedChoice.choose(random,
        Arrays.asList(null, 365, 900, 30, 90, 10), 2.0, 0.1, 0.1, 0.1, 0.1, 0.1);
    ImmutableList<Double> phis = ImmutableList.of(1.0, 0.999, 0.998, 0.99);
    if (tier.isFast()) {
      a.model = WeightedChoice.uniform(random, "GLS", "Linear");
      a.phi = WeightedChoice.choose(random, phis, 0.9, 0.05, 0.01, 0.01);
    } else {
      a.model = WeightedChoice.choose(random, MODELS, 0.3, 0.2, 0.1, 0.1, 0.1, 0.05);
      a.phi = WeightedChoice.choose(random, phis, 0.9, 0.1, 0.05, 0.05);
    }
    a.transformDict = RandomTransform.randomCleaners(random);
    return a;
  }

  private Regressor regressor() {
    switch (args.model) {
      case "GLS":
        return new LinearRegression(false);
      case "Linear":
        return new LinearRegression(true);
      case "Robust":
        return new RobustLinearRegression();
      case "Poisson":
        return new GeneralizedLinearRegression(GeneralizedLinearRegression.Family.POISSON);
      case "Gamma":
        return new GeneralizedLinearRegression(GeneralizedLinearRegression.Family.GAMMA);
      default:
        return new GeneralizedLinearRegression(GeneralizedLinearRegression.Family.TWEEDIE);
    }
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    TimeSeriesFrame y = df;
    if (args.transformDict != null) {
      y = new GeneralTransformer(args.transformDict).fitTransform(df);
    }
    if (args.window != null && args.window < y.rows()) {
      y = y.tail(args.window);
    }
    if (NEED_POSITIVE.contains(args.model)) {
      PositiveShift.Args shiftArgs = new PositiveShift.Args();
      shiftArgs.centerOne = true;
      shift = new PositiveShift(shiftArgs);
      y = shift.fitTransform(y);
    } else {
      shift = null;
    }
    double[] t = y.epochDays();
    double[][] rows = y.rowData();
    int kept = 0;
    for (double[] row : rows) {
      if (!hasNaN(row)) {
        kept++;
      }
    }
    double[][] x = new double[kept][];
    double[][] target = new double[kept][];
    int k = 0;
    for (int i = 0; i < rows.length; i++) {
      if (!hasNaN(rows[i])) {
        x[k] = new double[] {t[i]};
        target[k++] = rows[i];
      }
    }
    trend = regressor().fit(x, target);
  }

  private static boolean hasNaN(double[] row) {
    for (double v : row) {
      if (Double.isNaN(v)) {
        return true;
      }
    }
    return false;
  }

  /** The fitted trend at the timestamps of df, on the original scale. */
  TimeSeriesFrame trend(TimeSeriesFrame df) {
    double[] t = df.epochDays();
    double[][] x = new double[t.length][];
    for (int i = 0; i < t.length; i++) {
      x[i] = new double[] {t[i]};
    }
    TimeSeriesFrame pred = df.withRows(trend.predict(x));
    return shift != null ? shift.inverseTransform(pred) : pred;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    return df.minus(trend(df));
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    TimeSeriesFrame pred = trend(df);
    if (args.phi != 1) {
      double[][] rows = pred.rowData();
      double damp = 1;
      for (double[] row : rows) {
        for (int j = 0; j < row.length; j++) {
          row[j] *= damp;
        }
        damp *= args.phi;
      }
      pred = pred.withRows(rows);
    }
    return df.plus(pred);
  }
}
