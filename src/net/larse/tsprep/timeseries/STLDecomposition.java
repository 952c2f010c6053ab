package net.larse.tsprep.timeseries;

import com.google.common.base.Preconditions;

import net.larse.tsprep.helper.ArrayHelper;

/**
 * Seasonal Decomposition of Time Series by Loess.
 *
 * R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning (1990) STL:
 * A Seasonal-Trend Decomposition Procedure Based on Loess. Journal of Official Statistics, 6, 3-73.
 *
 * <p>The smoother spans default the way most STL front ends choose them: the trend span is the
 * next odd integer above {@code 1.5 * period / (1 - 1.5 / seasonal)}, the low-pass span the next
 * odd integer above the period, all smoothers locally linear and each evaluated every
 * {@code ceil(span / 10)} points.
 */
public class STLDecomposition {
  private final double[] y;
  private final int period;
  private final int seasonal;
  private final boolean robust;

  private double[] trend;
  private double[] season;
  private double[] weights;

  /**
   * @param y the series, without missing values
   * @param period number of observations per cycle, at least 2
   * @param seasonal odd span of the seasonal smoother, at least 3
   * @param robust whether to run the robustness iterations
   */
  public STLDecomposition(double[] y, int period, int seasonal, boolean robust) {
    Preconditions.checkArgument(period >= 2, "period must be at least 2, got %s", period);
    Preconditions.checkArgument(seasonal >= 3 && seasonal % 2 == 1,
        "seasonal must be an odd integer >= 3, got %s", seasonal);
    Preconditions.checkArgument(y.length > 2 * period,
        "STL needs more than two cycles, got %s values for period %s", y.length, period);
    Preconditions.checkArgument(!ArrayHelper.hasNaN(y), "STL does not handle missing values");
    this.y = y.clone();
    this.period = period;
    this.seasonal = seasonal;
    this.robust = robust;
  }

  public STLDecomposition(double[] y, int period) {
    this(y, period, 7, false);
  }

  private void decompose() {
    if (trend != null) {
      return;
    }
    int n = y.length;
    int nt = TimeSeriesUtils.nextOdd(1.5 * period / (1 - 1.5 / seasonal));
    int nl = period % 2 == 0 ? period + 1 : period + 2;
    int ni = robust ? 1 : 2;
    int no = robust ? 15 : 0;
    trend = new double[n];
    season = new double[n];
    weights = new double[n];
    TimeSeriesUtils.stl(y, period, seasonal, nt, nl, 1, 1, 1,
        jump(seasonal), jump(nt), jump(nl), ni, no, weights, season, trend);
  }

  private static int jump(int span) {
    return (int) Math.ceil(span / 10.0);
  }

  public double[] getTrend() {
    decompose();
    return trend.clone();
  }

  public double[] getSeasonal() {
    decompose();
    return season.clone();
  }

  public double[] getRemainder() {
    decompose();
    double[] r = new double[y.length];
    for (int i = 0; i < r.length; i++) {
      r[i] = y[i] - trend[i] - season[i];
    }
    return r;
  }
}
