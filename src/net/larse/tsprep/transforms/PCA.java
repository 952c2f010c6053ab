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

import java.util.Random;

import net.larse.tsprep.exception.MultivariateRequiredException;
import net.larse.tsprep.exception.TransformException;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.Matrices;
import net.larse.tsprep.helper.SymmetricEigen;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Principal component projection fit jointly over all series. Output columns are the
 * components, named by their rank; the inverse projects back onto the original series.
 */
public class PCA extends AbstractTransformer<PCA.Args> {
  public static final String NAME = "PCA";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Scale components to unit variance.")
    @Optional
    public boolean whiten = false;
  }

  private String[] columns;
  private double[] mean;
  // components[k] is the k-th principal axis
  private double[][] components;
  private double[] scale;

  public PCA(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.whiten = WeightedChoice.choose(random, ImmutableList.of(true, false), 0.2, 0.8);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    if (df.cols() < 2) {
      throw new MultivariateRequiredException(NAME, df.cols());
    }
    if (df.cols() > df.rows()) {
      throw new TransformException(NAME, "PCA fails when n series > n observations");
    }
    columns = df.columns();
    double[][] x = df.rowData();
    mean = Matrices.columnMeans(x);
    SymmetricEigen eig = SymmetricEigen.of(Matrices.covariance(x));
    components = eig.vectors();
    double[] variance = eig.values();
    scale = new double[variance.length];
    for (int k = 0; k < scale.length; k++) {
      scale[k] = args.whiten ? Math.sqrt(Math.max(variance[k], 1e-300)) : 1;
    }
  }

  static String[] rankNames(int n) {
    String[] out = new String[n];
    for (int k = 0; k < n; k++) {
      out[k] = Integer.toString(k);
    }
    return out;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    double[][] x = df.rowData();
    int p = components.length;
    double[][] out = new double[x.length][p];
    for (int i = 0; i < x.length; i++) {
      for (int k = 0; k < p; k++) {
        double s = 0;
        for (int j = 0; j < mean.length; j++) {
          s += (x[i][j] - mean[j]) * components[k][j];
        }
        out[i][k] = s / scale[k];
      }
    }
    return TimeSeriesFrame.fromRows(df.index(), rankNames(p), out);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    double[][] z = df.rowData();
    double[][] out = new double[z.length][mean.length];
    for (int i = 0; i < z.length; i++) {
      for (int j = 0; j < mean.length; j++) {
        double s = mean[j];
        for (int k = 0; k < components.length; k++) {
          s += z[i][k] * scale[k] * components[k][j];
        }
        out[i][j] = s;
      }
    }
    return TimeSeriesFrame.fromRows(df.index(), columns, out);
  }
}
