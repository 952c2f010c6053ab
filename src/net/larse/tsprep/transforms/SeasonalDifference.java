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

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.SeasonalFeatures;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Removes a seasonal profile of length {@code lag}: the last {@code lag} values, or the mean or
 * median of each phase. Phases are counted so that the last fitted row is the last phase.
 */
public class SeasonalDifference extends AbstractTransformer<SeasonalDifference.Args>
    implements ModeAwareTransformer {
  public static final String NAME = "SeasonalDifference";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Length of the seasonal period.")
    @Optional
    public int lag1 = 7;

    @Doc(help = "Seasonal profile: LastValue, Mean or Median.")
    @Optional
    public String method = "LastValue";

    @Override
    protected void checkValues() {
      if (lag1 == 0) {
        throw new IllegalArgumentException("lag_1 must not be 0");
      }
      if (!ImmutableList.of("LastValue", "Mean", "Median").contains(method)) {
        throw new IllegalArgumentException("Unknown method " + method);
      }
    }
  }

  /** {@code profile[column][phase]}. */
  private double[][] profile;

  public SeasonalDifference(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.method = WeightedChoice.uniform(random, "LastValue", "Mean", "Median");
    a.lag1 = tier.isFast()
        ? WeightedChoice.uniform(random, 7, 12)
        : SeasonalFeatures.seasonalInt(random, false, false, false);
    return a;
  }

  private int lag() {
    return Math.abs(args.lag1);
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    int lag = lag();
    int n = df.rows();
    if (args.method.equals("LastValue")) {
      profile = df.tail(lag).columnData();
      return;
    }
    int phases = Math.min(lag, n);
    profile = new double[df.cols()][phases];
    // row i falls in phase (i + offset) mod lag, the last row in phase lag - 1
    int offset = ((lag - n) % lag + lag) % lag;
    for (int j = 0; j < df.cols(); j++) {
      double[] c = df.column(j);
      for (int k = 0; k < phases; k++) {
        int phase = lag - phases + k;
        int count = 0;
        for (int i = 0; i < n; i++) {
          if ((i + offset) % lag == phase) {
            count++;
          }
        }
        double[] values = new double[count];
        int pos = 0;
        for (int i = 0; i < n; i++) {
          if ((i + offset) % lag == phase) {
            values[pos++] = c[i];
          }
        }
        profile[j][k] = args.method.equals("Median")
            ? ArrayHelper.nanMedian(values)
            : ArrayHelper.nanMean(values);
      }
    }
  }

  /** The profile tiled to n rows, ending on the last phase (alignEnd) or starting on the first. */
  private double[][] tiled(int n, boolean alignEnd) {
    double[][] out = new double[profile.length][n];
    for (int j = 0; j < profile.length; j++) {
      int len = profile[j].length;
      int reps = (n + len - 1) / len;
      int start = alignEnd ? reps * len - n : 0;
      for (int i = 0; i < n; i++) {
        out[j][i] = profile[j][(start + i) % len];
      }
    }
    return out;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    return apply(df, tiled(df.rows(), true), -1);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df, InverseMode mode) {
    checkFitted();
    return apply(df, tiled(df.rows(), mode == InverseMode.ORIGINAL), 1);
  }

  private static TimeSeriesFrame apply(TimeSeriesFrame df, double[][] seasonal, double sign) {
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < data[j].length; i++) {
        data[j][i] += sign * seasonal[j][i];
      }
    }
    return df.withData(data);
  }
}
