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
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/** Scales each series by the mean of its last {@code rows} values. */
public class CenterLastValue extends AbstractTransformer<CenterLastValue.Args> {
  public static final String NAME = "CenterLastValue";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Number of most recent rows to average.")
    @Optional
    public int rows = 1;

    @Override
    protected void checkValues() {
      if (rows < 1) {
        throw new IllegalArgumentException("rows must be positive");
      }
    }
  }

  private double[] center;

  public CenterLastValue(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.rows = WeightedChoice.randint(random, 1, 6);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    TimeSeriesFrame last = df.tail(Math.min(args.rows, df.rows()));
    center = new double[df.cols()];
    for (int j = 0; j < df.cols(); j++) {
      double c = ArrayHelper.nanMean(last.column(j));
      if (c == 0 || Double.isNaN(c)) {
        // Fall back to the median of the nonzero values, or 1.
        double[] col = df.column(j);
        for (int i = 0; i < col.length; i++) {
          if (col[i] == 0) {
            col[i] = Double.NaN;
          }
        }
        c = ArrayHelper.nanMedian(col);
        if (Double.isNaN(c)) {
          c = 1;
        }
      }
      center[j] = c;
    }
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    return scale(df, false);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    return scale(df, true);
  }

  private TimeSeriesFrame scale(TimeSeriesFrame df, boolean multiply) {
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < data[j].length; i++) {
        data[j][i] = multiply ? data[j][i] * center[j] : data[j][i] / center[j];
      }
    }
    return df.withData(data);
  }
}
