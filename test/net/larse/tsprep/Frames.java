package net.larse.tsprep;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Random;

import net.larse.tsprep.timeseries.TimeSeriesFrame;

/** Synthetic frames shared by the tests. */
public final class Frames {
  public static final LocalDate START = LocalDate.of(2020, 1, 1);

  private Frames() {}

  public static LocalDateTime[] daily(int rows) {
    return TimeSeriesFrame.dailyIndex(START, rows);
  }

  /** Weekly sine plus a linear trend plus small noise, one column per series. */
  public static TimeSeriesFrame seasonal(int rows, int series, long seed) {
    Random random = new Random(seed);
    String[] names = new String[series];
    double[][] cols = new double[series][rows];
    for (int j = 0; j < series; j++) {
      names[j] = "s" + j;
      double level = 50 + 10 * j;
      double slope = 0.05 * (j + 1);
      for (int i = 0; i < rows; i++) {
        cols[j][i] = level + slope * i + 5 * Math.sin(2 * Math.PI * i / 7.0 + j)
            + 0.1 * random.nextGaussian();
      }
    }
    return new TimeSeriesFrame(daily(rows), names, cols);
  }

  /** Strictly positive random walks. */
  public static TimeSeriesFrame walks(int rows, int series, long seed) {
    Random random = new Random(seed);
    String[] names = new String[series];
    double[][] cols = new double[series][rows];
    for (int j = 0; j < series; j++) {
      names[j] = "w" + j;
      double v = 100 + 20 * j;
      for (int i = 0; i < rows; i++) {
        v += random.nextGaussian();
        cols[j][i] = v;
      }
    }
    return new TimeSeriesFrame(daily(rows), names, cols);
  }

  /** A single named column on a daily index. */
  public static TimeSeriesFrame single(double... values) {
    return new TimeSeriesFrame(daily(values.length), new String[] {"a"},
        new double[][] {values});
  }

  /** The rows following df's last timestamp, with the given values per column. */
  public static TimeSeriesFrame following(TimeSeriesFrame df, double[][] columnData) {
    LocalDateTime last = df.getIndex(df.rows() - 1);
    LocalDateTime[] idx = TimeSeriesFrame.dailyIndex(last.toLocalDate().plusDays(1),
        columnData[0].length);
    return new TimeSeriesFrame(idx, df.columns(), columnData);
  }

  public static double maxAbsDiff(TimeSeriesFrame a, TimeSeriesFrame b) {
    double max = 0;
    for (int j = 0; j < a.cols(); j++) {
      for (int i = 0; i < a.rows(); i++) {
        max = Math.max(max, Math.abs(a.get(i, j) - b.get(i, j)));
      }
    }
    return max;
  }
}
