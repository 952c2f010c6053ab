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
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Bins each value to 1 above the center of its series, -1 below and 0 at it. The inverse maps
 * a bin score back by the mean excess above or below the center, so it does not recover the
 * original values.
 */
public class IntermittentOccurrence extends AbstractTransformer<IntermittentOccurrence.Args> {
  public static final String NAME = "IntermittentOccurrence";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Center of each series: mean, median or midhinge.")
    @Optional
    public String center = "median";

    @Override
    protected void checkValues() {
      if (!ImmutableList.of("mean", "median", "midhinge").contains(center)) {
        throw new IllegalArgumentException("Unknown center " + center);
      }
    }
  }

  private double[] center;
  private double[] upperMean;
  private double[] lowerMean;

  public IntermittentOccurrence(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.center = tier.isFast()
        ? "mean"
        : WeightedChoice.choose(random, ImmutableList.of("mean", "median", "midhinge"),
            0.4, 0.3, 0.3);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    int p = df.cols();
    center = new double[p];
    upperMean = new double[p];
    lowerMean = new double[p];
    for (int j = 0; j < p; j++) {
      double[] c = df.column(j);
      switch (args.center) {
        case "mean":
          center[j] = ArrayHelper.nanMean(c);
          break;
        case "midhinge":
          center[j] = (ArrayHelper.nanQuantile(c, 0.75) + ArrayHelper.nanQuantile(c, 0.25)) / 2;
          break;
        default:
          center[j] = ArrayHelper.nanMedian(c);
      }
      double up = 0;
      int nUp = 0;
      double low = 0;
      int nLow = 0;
      for (double v : c) {
        if (v > center[j]) {
          up += v;
          nUp++;
        } else if (v < center[j]) {
          low += v;
          nLow++;
        }
      }
      upperMean[j] = nUp > 0 ? up / nUp - center[j] : 0;
      lowerMean[j] = nLow > 0 ? low / nLow - center[j] : 0;
    }
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < data[j].length; i++) {
        double v = data[j][i];
        if (v > center[j]) {
          data[j][i] = 1;
        } else if (v < center[j]) {
          data[j][i] = -1;
        } else if (v == center[j]) {
          data[j][i] = 0;
        }
      }
    }
    return df.withData(data);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < data[j].length; i++) {
        double v = data[j][i];
        if (v > 0) {
          data[j][i] = upperMean[j] * v + center[j];
        } else if (v < 0) {
          data[j][i] = -Math.abs(lowerMean[j] * v) + center[j];
        } else if (v == 0) {
          data[j][i] = center[j];
        }
      }
    }
    return df.withData(data);
  }
}
