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
 * Leaves the data unchanged going forward and, on inversion of a forecast, shifts it so that
 * its first row lines up with the last fitted value(s) of each series.
 *
 * <p>Reconstructing the original history, or prediction interval bounds computed around an
 * already aligned forecast, passes through unchanged.
 */
public class AlignLastValue extends AbstractTransformer<AlignLastValue.Args>
    implements BoundsAwareTransformer {
  public static final String NAME = "AlignLastValue";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Number of rows averaged into the last value.")
    @Optional
    public int rows = 1;

    @Doc(help = "Position of the last value from the end, 1 for the final row.")
    @Optional
    public int lag = 1;

    @Doc(help = "additive or multiplicative.")
    @Optional
    public String method = "additive";

    @Doc(help = "Share of the gap closed, in [0, 1].")
    @Optional
    public double strength = 1.0;

    @Doc(help = "Shift only the first forecast row.")
    @Optional
    public boolean firstValueOnly = false;

    @Override
    protected void checkValues() {
      if (!method.equals("additive") && !method.equals("multiplicative")) {
        throw new IllegalArgumentException("method must be additive or multiplicative");
      }
      if (rows < 1 || lag < 1) {
        throw new IllegalArgumentException("rows and lag must be positive");
      }
    }
  }

  private double[] center;

  public AlignLastValue(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.rows = WeightedChoice.choose(random, ImmutableList.of(1, 2, 4, 7), 0.83, 0.02, 0.05, 0.1);
    a.lag = WeightedChoice.choose(random, ImmutableList.of(1, 2, 7, 28), 0.8, 0.05, 0.1, 0.05);
    a.method = WeightedChoice.choose(random,
        ImmutableList.of("additive", "multiplicative"), 0.9, 0.1);
    a.strength = WeightedChoice.choose(random,
        ImmutableList.of(1.0, 0.9, 0.7, 0.5, 0.2), 0.8, 0.05, 0.05, 0.05, 0.05);
    a.firstValueOnly = WeightedChoice.choose(random, ImmutableList.of(true, false), 0.1, 0.9);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    int n = df.rows();
    int end = Math.max(1, n - (args.lag - 1));
    int start = Math.max(0, end - args.rows);
    center = new double[df.cols()];
    for (int j = 0; j < df.cols(); j++) {
      double[] c = ArrayHelper.ffill(df.column(j));
      center[j] = ArrayHelper.nanMean(c, start, end);
    }
  }

  /** The fitted per-series anchor values. */
  public double[] center() {
    checkFitted();
    return center.clone();
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    return df;
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df, InverseMode mode,
      boolean bounds) {
    checkFitted();
    if (mode == InverseMode.ORIGINAL || bounds || df.rows() == 0) {
      return df;
    }
    boolean multiplicative = args.method.equals("multiplicative");
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      double first = data[j][0];
      int last = args.firstValueOnly ? 1 : data[j].length;
      for (int i = 0; i < last; i++) {
        if (multiplicative) {
          data[j][i] *= 1 + (center[j] / first - 1) * args.strength;
        } else {
          data[j][i] += args.strength * (center[j] - first);
        }
      }
    }
    return df.withData(data);
  }
}
