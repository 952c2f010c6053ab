package net.larse.tsprep.fill;

import com.google.common.base.Preconditions;

import java.util.Arrays;

import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Fills a missing value with the mean of that series at the k most similar timestamps, where
 * similarity is the Euclidean distance over the series observed at both timestamps, scaled up
 * for the series missing at either. Timestamps with no overlap fall back to the series mean.
 */
public class KnnImputer extends Imputer {
  private final int neighbors;

  public KnnImputer(int neighbors) {
    Preconditions.checkArgument(neighbors >= 1, "n_neighbors must be >= 1");
    this.neighbors = neighbors;
  }

  public KnnImputer() {
    this(5);
  }

  @Override
  public TimeSeriesFrame impute(TimeSeriesFrame df) {
    double[][] rows = df.rowData();
    int n = rows.length;
    int p = df.cols();
    double[][] filled = ArrayHelper.copy(rows);
    double[] means = new double[p];
    for (int j = 0; j < p; j++) {
      means[j] = ArrayHelper.nanMean(df.column(j));
      if (Double.isNaN(means[j])) {
        means[j] = 0;
      }
    }
    double[] dist = new double[n];
    Integer[] order = new Integer[n];
    for (int i = 0; i < n; i++) {
      if (!ArrayHelper.hasNaN(rows[i])) {
        continue;
      }
      for (int r = 0; r < n; r++) {
        dist[r] = distance(rows[i], rows[r]);
        order[r] = r;
      }
      Arrays.sort(order, (a, b) -> Double.compare(dist[a], dist[b]));
      for (int j = 0; j < p; j++) {
        if (!Double.isNaN(rows[i][j])) {
          continue;
        }
        double sum = 0;
        int count = 0;
        for (int r = 0; r < n && count < neighbors; r++) {
          int other = order[r];
          if (other == i || Double.isNaN(dist[other]) || Double.isNaN(rows[other][j])) {
            continue;
          }
          sum += rows[other][j];
          count++;
        }
        filled[i][j] = count > 0 ? sum / count : means[j];
      }
    }
    return df.withRows(filled);
  }

  /** Euclidean distance ignoring missing coordinates, NaN when no coordinate is shared. */
  static double distance(double[] a, double[] b) {
    double sum = 0;
    int present = 0;
    for (int j = 0; j < a.length; j++) {
      if (!Double.isNaN(a[j]) && !Double.isNaN(b[j])) {
        double d = a[j] - b[j];
        sum += d * d;
        present++;
      }
    }
    if (present == 0) {
      return Double.NaN;
    }
    return Math.sqrt(sum * a.length / present);
  }

  @Override
  public double[] imputeColumn(double[] values, double[] time) {
    return new StatisticImputer(StatisticImputer.Statistic.MEAN).imputeColumn(values, time);
  }
}
