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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.Random;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.pipeline.GeneralTransformer;
import net.larse.tsprep.pipeline.RandomTransform;
import net.larse.tsprep.pipeline.TransformConfig;
import net.larse.tsprep.regression.Predictor;
import net.larse.tsprep.regression.RegressionModel;
import net.larse.tsprep.timeseries.FeatureMatrix;
import net.larse.tsprep.timeseries.SeasonalFeatures;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Removes a regression of every series on calendar features of the index. An optional
 * regressor frame, aligned with the index, adds further feature columns; the same regressors
 * must then be passed to transform and inverse.
 */
public class DatepartRegression extends AbstractTransformer<DatepartRegression.Args> {
  public static final String NAME = "DatepartRegression";

  static final ImmutableList<String> DATEPART_CHOICES = ImmutableList.of("simple", "expanded",
      "recurring", "simple_2", "simple_binarized", "lunar_phase", "common_fourier");

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Model regressing the series on the date features.")
    @Optional
    public RegressionModel regressionModel = new RegressionModel("DecisionTree",
        ImmutableMap.of("max_depth", 5, "min_samples_split", 2));

    @Doc(help = "Date feature set, see SeasonalFeatures.DATE_PART_METHODS.")
    @Optional
    public String datepartMethod = "expanded";

    @Doc(help = "Degree of polynomial expansion of the features, null for none.")
    @Optional
    public Integer polynomialDegree = null;

    @Doc(help = "Pipeline that cleans the data the regression is fit on.")
    @Optional
    public TransformConfig transformDict = null;

    @Doc(help = "Seed of the regression model.")
    @Optional
    public long randomSeed = 2020;

    @Override
    protected void checkValues() {
      String base = datepartMethod.replace("_poly", "");
      if (!SeasonalFeatures.DATE_PART_METHODS.contains(base)) {
        throw new IllegalArgumentException("unknown datepart method " + datepartMethod);
      }
      if (polynomialDegree != null && polynomialDegree < 1) {
        throw new IllegalArgumentException("polynomialDegree must be positive");
      }
    }
  }

  private Predictor model;
  private int featureCount;

  public DatepartRegression(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.datepartMethod = WeightedChoice.choose(random, DATEPART_CHOICES,
        0.1, 0.25, 0.2, 0.1, 0.3, 0.01, 0.1);
    if (ImmutableList.of("simple", "simple_2", "recurring").contains(a.datepartMethod)) {
      a.polynomialDegree = WeightedChoice.choose(random, Arrays.asList(null, 2), 0.5, 0.2);
    }
    a.regressionModel = RegressionModel.random(
        tier.isFast() ? RegressionModel.FAST_MODELS : RegressionModel.DATEPART_MODELS, random);
    a.transformDict = RandomTransform.randomCleaners(random);
    return a;
  }

  private double[][] features(TimeSeriesFrame df, TimeSeriesFrame regressor) {
    FeatureMatrix x =
        SeasonalFeatures.datePart(df.index(), args.datepartMethod, args.polynomialDegree);
    double[][] rows = x.values();
    if (regressor == null) {
      return rows;
    }
    Preconditions.checkArgument(regressor.rows() == df.rows(),
        "regressor has %s rows, data has %s", regressor.rows(), df.rows());
    double[][] extra = regressor.rowData();
    double[][] out = new double[rows.length][];
    for (int i = 0; i < rows.length; i++) {
      out[i] = Arrays.copyOf(rows[i], rows[i].length + extra[i].length);
      System.arraycopy(extra[i], 0, out[i], rows[i].length, extra[i].length);
    }
    return out;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    fitModel(df, null);
  }

  /** Fits on the date features of df's index plus the regressor's columns. */
  public DatepartRegression fit(TimeSeriesFrame df, TimeSeriesFrame regressor) {
    Preconditions.checkNotNull(df, "df");
    fitModel(df, regressor);
    markFitted();
    return this;
  }

  private void fitModel(TimeSeriesFrame df, TimeSeriesFrame regressor) {
    TimeSeriesFrame y = df;
    if (args.transformDict != null) {
      y = new GeneralTransformer(args.transformDict).fitTransform(df);
    }
    double[][] x = features(df, regressor);
    double[][] target = y.rowData();
    int kept = 0;
    for (double[] row : target) {
      if (!hasNaN(row)) {
        kept++;
      }
    }
    Preconditions.checkArgument(kept > 0, "no complete rows to fit %s on", NAME);
    double[][] xs = new double[kept][];
    double[][] ys = new double[kept][];
    for (int i = 0, j = 0; i < target.length; i++) {
      if (!hasNaN(target[i])) {
        xs[j] = x[i];
        ys[j++] = target[i];
      }
    }
    featureCount = x[0].length;
    model = args.regressionModel.create(args.randomSeed).fit(xs, ys);
  }

  private TimeSeriesFrame prediction(TimeSeriesFrame df, TimeSeriesFrame regressor) {
    checkFitted();
    double[][] x = features(df, regressor);
    Preconditions.checkArgument(x[0].length == featureCount,
        "fit with %s features, got %s", featureCount, x[0].length);
    return df.withRows(model.predict(x));
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    return transform(df, null);
  }

  public TimeSeriesFrame transform(TimeSeriesFrame df, TimeSeriesFrame regressor) {
    return df.minus(prediction(df, regressor));
  }

  public TimeSeriesFrame fitTransform(TimeSeriesFrame df, TimeSeriesFrame regressor) {
    return fit(df, regressor).transform(df, regressor);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    return inverseTransform(df, null);
  }

  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df, TimeSeriesFrame regressor) {
    return df.plus(prediction(df, regressor));
  }

  private static boolean hasNaN(double[] row) {
    for (double v : row) {
      if (Double.isNaN(v)) {
        return true;
      }
    }
    return false;
  }
}
