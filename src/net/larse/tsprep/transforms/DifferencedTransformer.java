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

import net.larse.tsprep.exception.ReconstructionException;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * First difference, {@code x[t] - x[t-1]}; the undefined first row is back filled. The inverse
 * re-integrates from the first fitted row (original) or the last one (forecast).
 */
public class DifferencedTransformer extends AbstractTransformer<AbstractTransformer.NoArgs>
    implements ModeAwareTransformer {
  public static final String NAME = "DifferencedTransformer";

  private TimeSeriesFrame firstValues;
  private TimeSeriesFrame lastValues;

  public DifferencedTransformer() {
    super(NAME, new NoArgs());
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    firstValues = df.head(1);
    lastValues = df.tail(1);
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    return df.mapColumns(c -> ArrayHelper.bfill(diff(c)));
  }

  static double[] diff(double[] c) {
    double[] out = new double[c.length];
    if (c.length > 0) {
      out[0] = Double.NaN;
    }
    for (int i = 1; i < c.length; i++) {
      out[i] = c[i] - c[i - 1];
    }
    return out;
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df, InverseMode mode) {
    checkFitted();
    if (mode == InverseMode.ORIGINAL) {
      TimeSeriesFrame seeded = firstValues.concatRows(df.tail(df.rows() - 1));
      return seeded.mapColumns(ArrayHelper::cumsum);
    }
    TimeSeriesFrame seeded = lastValues.concatRows(df);
    if (seeded.hasNaN()) {
      throw new ReconstructionException(NAME, "NaN in DifferencedTransformer.inverse_transform");
    }
    return seeded.mapColumns(ArrayHelper::cumsum).tail(df.rows());
  }
}
