package net.larse.tsprep.fill;

import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Fills missing (NaN) values of a frame.
 *
 * <p>Most strategies work one series at a time through {@link #imputeColumn}; strategies that
 * borrow strength across series override {@link #impute} instead.
 */
public abstract class Imputer {

  /** Returns a frame with the same shape and labels and the missing values filled. */
  public TimeSeriesFrame impute(TimeSeriesFrame df) {
    double[] time = df.epochDays();
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      data[j] = imputeColumn(data[j], time);
    }
    return df.withData(data);
  }

  /**
   * Fills one series.
   *
   * @param values the series, NaN where missing; not modified
   * @param time the timestamps as fractional days
   * @return a new array
   */
  public abstract double[] imputeColumn(double[] values, double[] time);
}
