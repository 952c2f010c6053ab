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

import net.larse.tsprep.fill.FillNA;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Clips values more than {@code stdThreshold} standard deviations from the fitted mean of
 * their series, or removes them and optionally refills the gaps. Not inverted.
 */
public class ClipOutliers extends AbstractTransformer<ClipOutliers.Args> {
  public static final String NAME = "ClipOutliers";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "clip to the threshold, or remove (set NaN).")
    @Optional
    public String method = "clip";

    @Doc(help = "Number of standard deviations from the mean that counts as an outlier.")
    @Optional
    public double stdThreshold = 4;

    @Doc(help = "FillNA method for removed values, null to leave them missing.")
    @Optional
    public String fillna = null;

    @Override
    protected void checkValues() {
      if (!method.equals("clip") && !method.equals("remove")) {
        throw new IllegalArgumentException("method must be clip or remove, got " + method);
      }
    }
  }

  private double[] mean;
  private double[] std;

  public ClipOutliers(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    if (tier.isFast()) {
      a.method = "clip";
    } else {
      a.method = WeightedChoice.uniform(random, "clip", "remove");
      if (a.method.equals("remove")) {
        a.fillna = WeightedChoice.uniform(random, "ffill", "mean", "rolling_mean_24");
      }
    }
    a.stdThreshold = WeightedChoice.choose(random,
        ImmutableList.of(1.0, 2.0, 3.0, 3.5, 4.0, 5.0), 0.1, 0.2, 0.2, 0.2, 0.2, 0.1);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    mean = new double[df.cols()];
    std = new double[df.cols()];
    for (int j = 0; j < df.cols(); j++) {
      double[] c = df.column(j);
      mean[j] = ArrayHelper.nanMean(c);
      std[j] = ArrayHelper.nanStd(c, 1);
    }
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    double[][] data = df.columnData();
    boolean remove = args.method.equals("remove");
    for (int j = 0; j < data.length; j++) {
      double lower = mean[j] - std[j] * args.stdThreshold;
      double upper = mean[j] + std[j] * args.stdThreshold;
      for (int i = 0; i < data[j].length; i++) {
        double v = data[j][i];
        if (remove) {
          if (!(Math.abs(v - mean[j]) <= args.stdThreshold * std[j])) {
            data[j][i] = Double.NaN;
          }
        } else if (v < lower) {
          data[j][i] = lower;
        } else if (v > upper) {
          data[j][i] = upper;
        }
      }
    }
    TimeSeriesFrame out = df.withData(data);
    return args.fillna != null ? FillNA.fill(out, args.fillna, 10) : out;
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    return df;
  }
}
