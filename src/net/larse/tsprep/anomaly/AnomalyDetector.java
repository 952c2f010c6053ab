package net.larse.tsprep.anomaly;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.Distributions;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Flags outlying points of each series.
 *
 * <p>Methods:
 * <ul>
 *   <li>zscore: standard score against the series mean and deviation
 *   <li>rolling_zscore: standard score against a trailing window ({@code rolling_periods})
 *   <li>mad: deviation from the median in units of the scaled median absolute deviation
 *   <li>med_diff: size of the step from the previous point relative to the median step,
 *       flagged above {@code threshold}
 *   <li>IQR: flagged outside {@code iqr_threshold} interquartile ranges of the
 *       {@code iqr_quantiles}
 *   <li>minmax: distance from the mean relative to the largest distance, flagged above
 *       {@code 1 - alpha}
 * </ul>
 * The score based methods turn scores into p-values with the {@code distribution} (norm,
 * gamma, chi2 or uniform) and flag p-values below {@code alpha}.
 *
 * <p>With univariate output a single column {@value #UNIVARIATE_COLUMN} is flagged wherever
 * any series is, and scored with the largest absolute score of the row.
 */
public final class AnomalyDetector {
  private static final Logger LOG = LogManager.getLogger(AnomalyDetector.class);

  public static final String UNIVARIATE_COLUMN = "ALL";

  public static final ImmutableList<String> METHODS =
      ImmutableList.of("zscore", "rolling_zscore", "mad", "med_diff", "IQR", "minmax");
  public static final ImmutableList<String> DISTRIBUTIONS =
      ImmutableList.of("norm", "gamma", "chi2", "uniform");

  /** Median absolute deviation to standard deviation for normal data. */
  private static final double MAD_SCALE = 1.4826;

  private final String output;
  private final String method;
  private final Map<String, Object> params;

  /**
   * @param output multivariate or univariate
   * @param method one of {@link #METHODS}
   * @param params method parameters, missing ones take their defaults
   */
  public AnomalyDetector(String output, String method, Map<String, ?> params) {
    Preconditions.checkArgument(output.equals("multivariate") || output.equals("univariate"),
        "output must be multivariate or univariate, got %s", output);
    Preconditions.checkArgument(METHODS.contains(method), "unknown anomaly method %s", method);
    this.output = output;
    this.method = method;
    this.params = params == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    String distribution = distribution();
    Preconditions.checkArgument(DISTRIBUTIONS.contains(distribution),
        "unknown distribution %s", distribution);
  }

  public AnomalyDetector(String method, Map<String, ?> params) {
    this("multivariate", method, params);
  }

  public String method() {
    return method;
  }

  public Map<String, Object> params() {
    return params;
  }

  public AnomalyResult detect(TimeSeriesFrame df) {
    double[][] cols = df.columnData();
    double[][] scores = new double[cols.length][];
    double[][] flags = new double[cols.length][];
    for (int j = 0; j < cols.length; j++) {
      scores[j] = score(cols[j]);
      flags[j] = flag(cols[j], scores[j]);
    }
    AnomalyResult result = new AnomalyResult(df.withData(flags), df.withData(scores));
    if (output.equals("univariate")) {
      result = collapse(result);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("{} flagged {} points in {} series", method, result.count(), df.cols());
    }
    return result;
  }

  private static AnomalyResult collapse(AnomalyResult result) {
    TimeSeriesFrame flags = result.flags();
    TimeSeriesFrame scores = result.scores();
    double[] anyFlag = ArrayHelper.fill(flags.rows(), AnomalyResult.NORMAL);
    double[] maxScore = ArrayHelper.fill(flags.rows(), Double.NaN);
    for (int i = 0; i < flags.rows(); i++) {
      for (int j = 0; j < flags.cols(); j++) {
        if (result.isAnomaly(i, j)) {
          anyFlag[i] = AnomalyResult.ANOMALY;
        }
        double s = Math.abs(scores.get(i, j));
        if (!Double.isNaN(s) && !(s <= maxScore[i])) {
          maxScore[i] = s;
        }
      }
    }
    String[] col = {UNIVARIATE_COLUMN};
    return new AnomalyResult(
        flags.withColumns(col, new double[][] {anyFlag}),
        scores.withColumns(col, new double[][] {maxScore}));
  }

  /** The score of every point of one series. NaN in, NaN out. */
  double[] score(double[] x) {
    int n = x.length;
    double[] s = ArrayHelper.fill(n, Double.NaN);
    switch (method) {
      case "zscore": {
        double mean = ArrayHelper.nanMean(x);
        double sd = nonZero(ArrayHelper.nanStd(x, 0));
        for (int i = 0; i < n; i++) {
          s[i] = (x[i] - mean) / sd;
        }
        break;
      }
      case "rolling_zscore": {
        int window = intParam("rolling_periods", 200);
        double[] mean = ArrayHelper.rollingMean(x, window, 1);
        double[] sd = ArrayHelper.rollingStd(x, window, 2);
        double overall = nonZero(ArrayHelper.nanStd(x, 1));
        for (int i = 0; i < n; i++) {
          double d = Double.isNaN(sd[i]) || sd[i] == 0 ? overall : sd[i];
          s[i] = (x[i] - mean[i]) / d;
        }
        break;
      }
      case "mad": {
        double median = ArrayHelper.nanMedian(x);
        double[] dev = new double[n];
        for (int i = 0; i < n; i++) {
          dev[i] = Math.abs(x[i] - median);
        }
        double mad = nonZero(MAD_SCALE * ArrayHelper.nanMedian(dev));
        for (int i = 0; i < n; i++) {
          s[i] = (x[i] - median) / mad;
        }
        break;
      }
      case "med_diff": {
        double[] step = ArrayHelper.fill(n, Double.NaN);
        for (int i = 1; i < n; i++) {
          step[i] = Math.abs(x[i] - x[i - 1]);
        }
        double median = nonZero(ArrayHelper.nanMedian(step));
        for (int i = 1; i < n; i++) {
          s[i] = step[i] / median;
        }
        break;
      }
      case "IQR": {
        double[] q = iqrQuantiles();
        double lo = ArrayHelper.nanQuantile(x, q[0]);
        double hi = ArrayHelper.nanQuantile(x, q[1]);
        double iqr = nonZero(hi - lo);
        for (int i = 0; i < n; i++) {
          double below = lo - x[i];
          double above = x[i] - hi;
          s[i] = below > 0 ? -below / iqr : above > 0 ? above / iqr : 0;
          if (Double.isNaN(x[i])) {
            s[i] = Double.NaN;
          }
        }
        break;
      }
      default: {
        double mean = ArrayHelper.nanMean(x);
        double max = 0;
        for (double v : x) {
          if (!Double.isNaN(v)) {
            max = Math.max(max, Math.abs(v - mean));
          }
        }
        max = nonZero(max);
        for (int i = 0; i < n; i++) {
          s[i] = (x[i] - mean) / max;
        }
      }
    }
    return s;
  }

  private double[] flag(double[] x, double[] score) {
    int n = x.length;
    double[] f = ArrayHelper.fill(n, AnomalyResult.NORMAL);
    switch (method) {
      case "med_diff": {
        double threshold = doubleParam("threshold", 7);
        for (int i = 0; i < n; i++) {
          if (score[i] > threshold) {
            f[i] = AnomalyResult.ANOMALY;
          }
        }
        break;
      }
      case "IQR": {
        double threshold = doubleParam("iqr_threshold", 2.0);
        for (int i = 0; i < n; i++) {
          if (Math.abs(score[i]) > threshold) {
            f[i] = AnomalyResult.ANOMALY;
          }
        }
        break;
      }
      case "minmax": {
        double alpha = doubleParam("alpha", 0.05);
        for (int i = 0; i < n; i++) {
          if (Math.abs(score[i]) > 1 - alpha) {
            f[i] = AnomalyResult.ANOMALY;
          }
        }
        break;
      }
      default: {
        double alpha = doubleParam("alpha", 0.05);
        double[] p = pValues(score, distribution());
        for (int i = 0; i < n; i++) {
          if (p[i] < alpha) {
            f[i] = AnomalyResult.ANOMALY;
          }
        }
      }
    }
    return f;
  }

  /** Two sided p-values of the scores under the named distribution. */
  static double[] pValues(double[] score, String distribution) {
    int n = score.length;
    double[] p = ArrayHelper.fill(n, Double.NaN);
    switch (distribution) {
      case "gamma": {
        double[] abs = new double[n];
        for (int i = 0; i < n; i++) {
          abs[i] = Math.abs(score[i]);
        }
        double mean = ArrayHelper.nanMean(abs);
        double var = ArrayHelper.nanStd(abs, 0);
        var = var * var;
        if (!(mean > 0) || !(var > 0)) {
          return p;
        }
        double shape = mean * mean / var;
        double scale = var / mean;
        for (int i = 0; i < n; i++) {
          p[i] = Distributions.gammaSf(abs[i], shape, 0, scale);
        }
        break;
      }
      case "chi2":
        for (int i = 0; i < n; i++) {
          p[i] = Distributions.chiSquaredSf(score[i] * score[i], 1);
        }
        break;
      case "uniform": {
        double max = 0;
        for (double s : score) {
          if (!Double.isNaN(s)) {
            max = Math.max(max, Math.abs(s));
          }
        }
        if (max == 0) {
          return p;
        }
        for (int i = 0; i < n; i++) {
          p[i] = 1 - Math.abs(score[i]) / max;
        }
        break;
      }
      default:
        for (int i = 0; i < n; i++) {
          p[i] = 2 * Distributions.normalSf(Math.abs(score[i]));
        }
    }
    return p;
  }

  private String distribution() {
    Object d = params.get("distribution");
    return d == null ? "norm" : d.toString();
  }

  private double[] iqrQuantiles() {
    Object q = params.get("iqr_quantiles");
    if (q == null) {
      return new double[] {0.25, 0.75};
    }
    double[] out = new double[2];
    if (q instanceof double[]) {
      out = ((double[]) q).clone();
    } else {
      List<?> values = (List<?>) q;
      out[0] = ((Number) values.get(0)).doubleValue();
      out[1] = ((Number) values.get(1)).doubleValue();
    }
    Preconditions.checkArgument(out.length == 2 && out[0] < out[1],
        "iqr_quantiles must be two increasing values, got %s", Arrays.toString(out));
    return out;
  }

  private double doubleParam(String key, double fallback) {
    Object v = params.get(key);
    if (v == null) {
      return fallback;
    }
    return v instanceof Number ? ((Number) v).doubleValue() : Double.parseDouble(v.toString());
  }

  private int intParam(String key, int fallback) {
    return (int) doubleParam(key, fallback);
  }

  private static double nonZero(double scale) {
    if (scale == 0 || Double.isNaN(scale)) {
      LOG.warn("Zero spread series, scores use a unit scale");
      return 1;
    }
    return scale;
  }

  /** Draws a detection method, fast leaves out the rolling one. */
  public static String randomMethod(Random random, boolean fast) {
    if (fast) {
      return WeightedChoice.choose(random,
          ImmutableList.of("zscore", "mad", "med_diff", "IQR", "minmax"),
          0.3, 0.15, 0.1, 0.3, 0.1);
    }
    return WeightedChoice.choose(random, METHODS, 0.25, 0.2, 0.15, 0.1, 0.2, 0.1);
  }

  /** Random parameters for a detection method. */
  public static Map<String, Object> randomParams(String method, Random random) {
    Map<String, Object> p = new LinkedHashMap<>();
    switch (method) {
      case "med_diff":
        p.put("threshold", WeightedChoice.uniform(random, 5.0, 7.0, 10.0));
        break;
      case "IQR":
        p.put("iqr_threshold", WeightedChoice.choose(random,
            ImmutableList.of(1.5, 2.0, 2.5, 3.0, 4.0), 0.2, 0.3, 0.2, 0.2, 0.1));
        p.put("iqr_quantiles", WeightedChoice.choose(random,
            ImmutableList.of(ImmutableList.of(0.25, 0.75), ImmutableList.of(0.4, 0.6)),
            0.8, 0.2));
        break;
      case "minmax":
        p.put("alpha", WeightedChoice.uniform(random, 0.05, 0.1, 0.01));
        break;
      default:
        p.put("distribution", WeightedChoice.choose(random, DISTRIBUTIONS, 0.4, 0.2, 0.2, 0.2));
        p.put("alpha", WeightedChoice.choose(random,
            ImmutableList.of(0.05, 0.1, 0.01, 0.03), 0.4, 0.2, 0.2, 0.2));
        if (method.equals("rolling_zscore")) {
          p.put("rolling_periods", WeightedChoice.uniform(random, 28, 90, 200, 300));
        }
    }
    return p;
  }
}
