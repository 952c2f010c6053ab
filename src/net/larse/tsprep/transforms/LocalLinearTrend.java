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
import org.apache.commons.lang3.ArrayUtils;

/**
 * Removes a rolling linear trend on the Julian date. Each fitted row gets the slope and
 * intercept of a centered window (truncated at the ends of the history); dates outside the
 * history use the mean or median line of the first or last {@code nFuture} rows. Dates are
 * looked up in the sorted fit dates, so the inverse works for any timestamps.
 */
public class LocalLinearTrend extends AbstractTransformer<LocalLinearTrend.Args> {
  public static final String NAME = "LocalLinearTrend";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Window width, a share of the history when below 1.")
    @Optional
    public double rollingWindow = 0.1;

    @Doc(help = "Rows whose trend extends beyond the history, a share when below 1.")
    @Optional
    public double nFuture = 0.2;

    @Doc(help = "mean or median of the edge trends.")
    @Optional
    public String method = "mean";

    @Override
    protected void checkValues() {
      if (rollingWindow <= 0) {
        throw new IllegalArgumentException("rolling_window " + rollingWindow
            + " arg is not valid");
      }
      if (nFuture <= 0) {
        throw new IllegalArgumentException("n_future " + nFuture + " arg is not valid");
      }
      if (!method.equals("mean") && !method.equals("median")) {
        throw new IllegalArgumentException("method must be mean or median");
      }
    }
  }

  // One entry per fit row plus the before and after edges (the last twice).
  private double[] fullDates;
  private double[][] fullSlope;
  private double[][] fullIntercept;

  public LocalLinearTrend(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.rollingWindow = WeightedChoice.choose(random,
        ImmutableList.of(0.1, 90.0, 30.0, 180.0, 360.0, 0.05), 0.5, 0.1, 0.1, 0.1, 0.1, 0.2);
    a.nFuture = WeightedChoice.choose(random,
        ImmutableList.of(0.2, 90.0, 360.0, 0.1, 0.05), 0.5, 0.1, 0.1, 0.1, 0.2);
    a.method = WeightedChoice.uniform(random, "mean", "median");
    return a;
  }

  private static int count(double value, int n) {
    int c = value < 1 ? (int) (value * n) : (int) value;
    return Math.max(1, Math.min(c, n));
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    double[] dates = df.julianDates();
    int n = dates.length;
    int window = Math.max(2, count(args.rollingWindow, n));
    int nFuture = count(args.nFuture, n);
    int before = (window - 1) / 2;
    int after = window - 1 - before;
    int p = df.cols();
    fullDates = new double[n + 2];
    fullDates[0] = dates[0] - 0.01;
    System.arraycopy(dates, 0, fullDates, 1, n);
    fullDates[n + 1] = dates[n - 1] + 0.01;
    fullSlope = new double[p][n + 3];
    fullIntercept = new double[p][n + 3];
    for (int j = 0; j < p; j++) {
      double[] y = df.column(j);
      double[] slope = new double[n];
      double[] intercept = new double[n];
      for (int i = 0; i < n; i++) {
        double[] line = fitLine(dates, y, Math.max(0, i - before), Math.min(n, i + after + 1));
        slope[i] = line[0];
        intercept[i] = line[1];
      }
      fill(fullSlope[j], slope, nFuture);
      fill(fullIntercept[j], intercept, nFuture);
    }
  }

  private void fill(double[] full, double[] values, int nFuture) {
    int n = values.length;
    full[0] = aggregate(ArrayUtils.subarray(values, 0, nFuture));
    System.arraycopy(values, 0, full, 1, n);
    double end = aggregate(ArrayUtils.subarray(values, n - nFuture, n));
    full[n + 1] = end;
    full[n + 2] = end;
  }

  private double aggregate(double[] values) {
    return args.method.equals("median")
        ? ArrayHelper.nanMedian(values)
        : ArrayHelper.nanMean(values);
  }

  /** Least squares slope and intercept over [from, to), ignoring missing values. */
  static double[] fitLine(double[] x, double[] y, int from, int to) {
    double sx = 0;
    double sy = 0;
    int m = 0;
    for (int i = from; i < to; i++) {
      if (!Double.isNaN(y[i])) {
        sx += x[i];
        sy += y[i];
        m++;
      }
    }
    if (m == 0) {
      return new double[] {Double.NaN, Double.NaN};
    }
    double mx = sx / m;
    double my = sy / m;
    double sxy = 0;
    double sxx = 0;
    for (int i = from; i < to; i++) {
      if (!Double.isNaN(y[i])) {
        sxy += (x[i] - mx) * (y[i] - my);
        sxx += (x[i] - mx) * (x[i] - mx);
      }
    }
    double slope = sxx > 0 ? sxy / sxx : 0;
    return new double[] {slope, my - slope * mx};
  }

  private TimeSeriesFrame apply(TimeSeriesFrame df, double sign) {
    checkFitted();
    double[] dates = df.julianDates();
    double[][] data = df.columnData();
    for (int i = 0; i < dates.length; i++) {
      int idx = ArrayHelper.searchSorted(fullDates, dates[i]);
      for (int j = 0; j < data.length; j++) {
        data[j][i] += sign * (fullSlope[j][idx] * dates[i] + fullIntercept[j][idx]);
      }
    }
    return df.withData(data);
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    return apply(df, -1);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    return apply(df, 1);
  }
}
