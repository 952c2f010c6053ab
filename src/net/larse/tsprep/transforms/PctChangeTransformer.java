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
 * Percent change from the previous row. Zeros are first replaced with the smallest absolute
 * non-zero value of the series (0.1 if there is none); infinite changes become 0.
 */
public class PctChangeTransformer extends AbstractTransformer<AbstractTransformer.NoArgs>
    implements ModeAwareTransformer {
  public static final String NAME = "PctChangeTransformer";

  private TimeSeriesFrame firstValues;
  private TimeSeriesFrame lastValues;

  public PctChangeTransformer() {
    super(NAME, new NoArgs());
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    TimeSeriesFrame cleaned = df.mapColumns(PctChangeTransformer::replaceZeros);
    firstValues = cleaned.head(1);
    lastValues = cleaned.tail(1);
  }

  /** Replaces zeros and NaN with the smallest absolute non-zero value, or 0.1. */
  static double[] replaceZeros(double[] c) {
    double min = Double.NaN;
    for (double v : c) {
      if (v != 0 && !Double.isNaN(v) && !(Math.abs(v) >= min)) {
        min = Math.abs(v);
      }
    }
    double fill = Double.isNaN(min) ? 0.1 : min;
    for (int i = 0; i < c.length; i++) {
      if (c[i] == 0 || Double.isNaN(c[i])) {
        c[i] = fill;
      }
    }
    return c;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    return df.mapColumns(c -> {
      double[] v = replaceZeros(c);
      double[] out = new double[v.length];
      for (int i = 1; i < v.length; i++) {
        double pct = v[i] / v[i - 1] - 1;
        out[i] = Double.isInfinite(pct) || Double.isNaN(pct) ? 0 : pct;
      }
      return out;
    });
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df, InverseMode mode) {
    checkFitted();
    TimeSeriesFrame growth = df.mapColumns(c -> {
      for (int i = 0; i < c.length; i++) {
        c[i] += 1;
      }
      return replaceZeros(c);
    });
    TimeSeriesFrame seeded = mode == InverseMode.ORIGINAL
        ? firstValues.concatRows(growth.tail(growth.rows() - 1))
        : lastValues.concatRows(growth);
    TimeSeriesFrame out = seeded.mapColumns(c -> {
      for (int i = 1; i < c.length; i++) {
        c[i] *= c[i - 1];
      }
      return c;
    });
    if (out.hasNaN()) {
      throw new ReconstructionException(NAME, "NaN in PctChangeTransformer.inverse_transform");
    }
    return mode == InverseMode.ORIGINAL ? out : out.tail(df.rows());
  }
}
