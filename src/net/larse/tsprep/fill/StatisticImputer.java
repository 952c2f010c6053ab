package net.larse.tsprep.fill;

import net.larse.tsprep.helper.ArrayHelper;

/**
 * Fills with a statistic of the observed values of the series: the mean, the median, or the
 * average of the forward filled value and the mean.
 */
public class StatisticImputer extends Imputer {
  /** Which statistic. */
  public enum Statistic {
    MEAN,
    MEDIAN,
    FFILL_MEAN_BIASED
  }

  private final Statistic statistic;

  public StatisticImputer(Statistic statistic) {
    this.statistic = statistic;
  }

  @Override
  public double[] imputeColumn(double[] values, double[] time) {
    double fill = statistic == Statistic.MEDIAN
        ? ArrayHelper.nanMedian(values)
        : ArrayHelper.nanMean(values);
    if (Double.isNaN(fill)) {
      fill = 0;
    }
    double[] out = new FixedValueImputer(fill).imputeColumn(values, time);
    if (statistic == Statistic.FFILL_MEAN_BIASED) {
      double[] forward = ArrayHelper.bfill(ArrayHelper.ffill(values));
      for (int i = 0; i < out.length; i++) {
        if (Double.isNaN(values[i])) {
          out[i] = (out[i] + forward[i]) / 2;
        }
      }
    }
    return out;
  }
}
