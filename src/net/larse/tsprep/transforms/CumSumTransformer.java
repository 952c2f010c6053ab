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
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Cumulative sum, skipping missing values. The inverse differences the input, seeded with the
 * first fitted value (original) or the last fitted cumulative sum (forecast).
 */
public class CumSumTransformer extends AbstractTransformer<AbstractTransformer.NoArgs>
    implements ModeAwareTransformer {
  public static final String NAME = "CumSumTransformer";

  private TimeSeriesFrame firstValues;
  private TimeSeriesFrame lastSums;

  public CumSumTransformer() {
    super(NAME, new NoArgs());
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    firstValues = df.head(1);
    lastSums = transform(df).tail(1);
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    return df.mapColumns(c -> {
      double sum = 0;
      for (int i = 0; i < c.length; i++) {
        if (!Double.isNaN(c[i])) {
          sum += c[i];
          c[i] = sum;
        }
      }
      return c;
    });
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df, InverseMode mode) {
    checkFitted();
    TimeSeriesFrame out;
    if (mode == InverseMode.ORIGINAL) {
      TimeSeriesFrame diffs = df.mapColumns(DifferencedTransformer::diff);
      out = firstValues.concatRows(diffs.tail(df.rows() - 1));
    } else {
      out = lastSums.concatRows(df).mapColumns(DifferencedTransformer::diff).tail(df.rows());
    }
    if (out.hasNaN() && !df.hasNaN()) {
      throw new ReconstructionException(NAME, "NaN in CumSumTransformer.inverse_transform");
    }
    return out;
  }
}
