package net.larse.tsprep.fill;

import com.google.common.collect.ImmutableList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import net.larse.tsprep.regression.RidgeRegression;
import net.larse.tsprep.regression.TreeEnsembleRegressor;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/** Named NaN filling strategies. */
public final class FillNA {
  private static final Logger LOG = LogManager.getLogger(FillNA.class);

  /** Default window of the rolling mean fill. */
  public static final int DEFAULT_WINDOW = 10;

  public static final ImmutableList<String> METHODS = ImmutableList.of(
      "ffill", "fake_date", "rolling_mean", "rolling_mean_24", "mean", "median", "zero",
      "ffill_mean_biased", "interpolate", "KNNImputer", "IterativeImputer",
      "IterativeImputerExtraTrees");

  private FillNA() {}

  public static TimeSeriesFrame fill(TimeSeriesFrame df, String method) {
    return fill(df, method, DEFAULT_WINDOW);
  }

  /**
   * Fills the missing values of df.
   *
   * @param method a name from {@link #METHODS} or an interpolation method; null or "None"
   *     returns df unchanged
   * @param window window of the {@code rolling_mean} method
   */
  public static TimeSeriesFrame fill(TimeSeriesFrame df, String method, int window) {
    if (method == null || method.equals("None")) {
      return df;
    }
    return imputer(method, window).impute(df);
  }

  /** The imputer behind a method name. */
  public static Imputer imputer(String method, int window) {
    switch (method) {
      case "ffill":
        return new PreviousValueImputer();
      case "zero":
        return new FixedValueImputer(0);
      case "mean":
        return new StatisticImputer(StatisticImputer.Statistic.MEAN);
      case "median":
        return new StatisticImputer(StatisticImputer.Statistic.MEDIAN);
      case "ffill_mean_biased":
        return new StatisticImputer(StatisticImputer.Statistic.FFILL_MEAN_BIASED);
      case "rolling_mean":
        return new RollingMeanImputer(window);
      case "rolling_mean_24":
        return new RollingMeanImputer(24);
      case "fake_date":
        return new FakeDateImputer();
      case "interpolate":
        return new InterpolationImputer("linear");
      case "KNNImputer":
        return new KnnImputer();
      case "IterativeImputer":
        return new IterativeImputer(new RidgeRegression(1.0, true), 10, 1e-3);
      case "IterativeImputerExtraTrees":
        return new IterativeImputer(
            new TreeEnsembleRegressor(10, true, null, 1, 1.0, 2020), 10, 1e-3);
      default:
        if (InterpolationImputer.METHODS.contains(method)) {
          return new InterpolationImputer(method);
        }
        LOG.warn("FillNA method {} not known, using ffill", method);
        return new PreviousValueImputer();
    }
  }
}
