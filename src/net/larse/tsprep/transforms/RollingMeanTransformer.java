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
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.SeasonalFeatures;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Trailing rolling mean. Unless {@code fixed}, the inverse rebuilds the values one row at a
 * time: {@code x[t] = (r[t] - r[t-1]) * window + x[t - window]}, seeded with the first
 * (original) or last (forecast) {@code window} fitted values.
 */
public class RollingMeanTransformer extends AbstractTransformer<RollingMeanTransformer.Args>
    implements ModeAwareTransformer {
  public static final String NAME = "RollingMeanTransformer";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Number of periods to average over.")
    @Optional
    public int window = 10;

    @Doc(help = "Do not invert: the inverse returns its input.")
    @Optional
    public boolean fixed = false;

    @Override
    protected void checkValues() {
      if (window < 1) {
        throw new IllegalArgumentException("window must be >= 1, got " + window);
      }
    }
  }

  private double[][] firstValues;
  private double[][] lastValues;
  private double[] lastRolling;

  public RollingMeanTransformer(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.fixed = WeightedChoice.choose(random, ImmutableList.of(true, false), 0.7, 0.3);
    a.window = tier.isFast()
        ? WeightedChoice.uniform(random, 3, 7, 10, 12)
        : SeasonalFeatures.seasonalInt(random, false, false, false);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    int w = args.window;
    TimeSeriesFrame last = df.tail(w).ffillBfill();
    TimeSeriesFrame first = df.head(w).ffillBfill();
    lastValues = last.columnData();
    firstValues = first.columnData();
    TimeSeriesFrame tailRolling = transform(df.tail(w + 1));
    lastRolling = tailRolling.row(tailRolling.rows() - 1);
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    return df.mapColumns(c -> ArrayHelper.rollingMean(c, args.window, 1));
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df, InverseMode mode) {
    checkFitted();
    if (args.fixed) {
      return df;
    }
    int w = args.window;
    int n = df.rows();
    double[][] data = df.columnData();
    double[][] out = new double[data.length][];
    for (int j = 0; j < data.length; j++) {
      double[] r = data[j];
      if (mode == InverseMode.ORIGINAL) {
        double[] staged = new double[Math.max(n, firstValues[j].length)];
        int seed = firstValues[j].length;
        System.arraycopy(firstValues[j], 0, staged, 0, seed);
        for (int t = seed; t < n; t++) {
          staged[t] = (r[t] - r[t - 1]) * w + staged[t - seed];
        }
        out[j] = Arrays.copyOf(staged, n);
      } else {
        int seed = lastValues[j].length;
        double[] staged = new double[seed + n];
        System.arraycopy(lastValues[j], 0, staged, 0, seed);
        double previous = lastRolling[j];
        for (int t = 0; t < n; t++) {
          staged[seed + t] = (r[t] - previous) * w + staged[t];
          previous = r[t];
        }
        out[j] = Arrays.copyOfRange(staged, seed, seed + n);
      }
    }
    return df.withData(out);
  }
}
