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
 * Subtracts from every series the previous row's mean across all series. The first row,
 * which has no previous mean, is back filled.
 *
 * <p>The inverse replays the fitted row means (original) or rebuilds them row by row from the
 * last fitted mean (forecast), so it only applies to the fit history or a frame immediately
 * following it.
 */
public class MeanDifference extends AbstractTransformer<AbstractTransformer.NoArgs>
    implements ModeAwareTransformer {
  public static final String NAME = "MeanDifference";

  private double[] means;
  private double[] firstRow;
  private double lastMean;

  public MeanDifference() {
    super(NAME, new NoArgs());
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    means = rowMeans(df.rowData());
    firstRow = df.row(0);
    lastMean = means[means.length - 1];
  }

  private static double[] rowMeans(double[][] rows) {
    double[] out = new double[rows.length];
    for (int i = 0; i < rows.length; i++) {
      out[i] = ArrayHelper.nanMean(rows[i]);
    }
    return out;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    double[] m = rowMeans(df.rowData());
    double[][] data = df.columnData();
    for (double[] c : data) {
      for (int i = c.length - 1; i >= 0; i--) {
        c[i] = i == 0 ? Double.NaN : c[i] - m[i - 1];
      }
    }
    return df.withData(data).mapColumns(ArrayHelper::bfill);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df, InverseMode mode) {
    checkFitted();
    double[][] rows = df.rowData();
    if (mode == InverseMode.ORIGINAL) {
      for (int i = 0; i < rows.length; i++) {
        if (i == 0) {
          rows[0] = firstRow.clone();
        } else {
          for (int j = 0; j < rows[i].length; j++) {
            rows[i][j] += means[i - 1];
          }
        }
      }
      return df.withRows(rows);
    }
    double last = lastMean;
    for (double[] row : rows) {
      for (int j = 0; j < row.length; j++) {
        row[j] += last;
      }
      last = ArrayHelper.nanMean(row);
    }
    TimeSeriesFrame out = df.withRows(rows);
    if (out.hasNaN()) {
      throw new ReconstructionException(NAME, "NaN in MeanDifference.inverse_transform");
    }
    return out;
  }
}
