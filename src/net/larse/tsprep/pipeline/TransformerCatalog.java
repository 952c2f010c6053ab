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
package net.larse.tsprep.pipeline;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Weighted transformer catalogs drawn from by {@link RandomTransform}. Weights are relative
 * and need not sum to one.
 */
public final class TransformerCatalog {
  private TransformerCatalog() {}

  public static final ImmutableMap<String, Double> ALL = ImmutableMap.<String, Double>builder()
      .put("MinMaxScaler", 0.05)
      .put("PowerTransformer", 0.02)
      .put("QuantileTransformer", 0.05)
      .put("MaxAbsScaler", 0.05)
      .put("StandardScaler", 0.04)
      .put("RobustScaler", 0.05)
      .put("PCA", 0.01)
      .put("FastICA", 0.01)
      .put("Detrend", 0.1)
      .put("RollingMeanTransformer", 0.02)
      .put("RollingMean100thN", 0.01)
      .put("DifferencedTransformer", 0.07)
      .put("SinTrend", 0.01)
      .put("PctChangeTransformer", 0.01)
      .put("CumSumTransformer", 0.02)
      .put("PositiveShift", 0.02)
      .put("Log", 0.01)
      .put("IntermittentOccurrence", 0.01)
      .put("SeasonalDifference", 0.1)
      .put("cffilter", 0.01)
      .put("bkfilter", 0.05)
      .put("convolution_filter", 0.001)
      .put("HPFilter", 0.01)
      .put("DatepartRegression", 0.01)
      .put("ClipOutliers", 0.05)
      .put("Discretize", 0.01)
      .put("CenterLastValue", 0.01)
      .put("Round", 0.02)
      .put("Slice", 0.02)
      .put("ScipyFilter", 0.02)
      .put("STLFilter", 0.01)
      .put("EWMAFilter", 0.02)
      .put("MeanDifference", 0.002)
      .put("BTCD", 0.01)
      .put("Cointegration", 0.01)
      .put("AlignLastValue", 0.2)
      .put("AnomalyRemoval", 0.03)
      .put("HolidayTransformer", 0.01)
      .put("LocalLinearTrend", 0.01)
      .put("KalmanSmoothing", 0.01)
      .build();

  /** {@link #ALL} without the slow multivariate fits. */
  public static final ImmutableMap<String, Double> FAST = without(ALL, "FastICA",
      "Cointegration", "BTCD");

  /** Cheap transformers, none of which fit jointly across series. */
  public static final ImmutableMap<String, Double> SUPERFAST =
      ImmutableMap.<String, Double>builder()
          .put("MinMaxScaler", 0.05)
          .put("MaxAbsScaler", 0.05)
          .put("StandardScaler", 0.04)
          .put("RobustScaler", 0.05)
          .put("Detrend", 0.1)
          .put("RollingMeanTransformer", 0.02)
          .put("DifferencedTransformer", 0.1)
          .put("PositiveShift", 0.02)
          .put("Log", 0.01)
          .put("SeasonalDifference", 0.1)
          .put("bkfilter", 0.05)
          .put("ClipOutliers", 0.05)
          .put("Discretize", 0.01)
          .put("Slice", 0.02)
          .put("EWMAFilter", 0.01)
          .put("AlignLastValue", 0.05)
          .build();

  /** Filters that mostly stay in the original space. */
  public static final ImmutableMap<String, Double> FILTERS = ImmutableMap.<String, Double>builder()
      .put("ScipyFilter", 0.1)
      .put("EWMAFilter", 0.1)
      .put("bkfilter", 0.1)
      .put("Slice", 0.01)
      .put("AlignLastValue", 0.15)
      .put("KalmanSmoothing", 0.1)
      .put("ClipOutliers", 0.1)
      .build();

  public static final ImmutableMap<String, Double> SCALERS = ImmutableMap.<String, Double>builder()
      .put("MinMaxScaler", 0.05)
      .put("MaxAbsScaler", 0.05)
      .put("StandardScaler", 0.05)
      .put("RobustScaler", 0.05)
      .put("Log", 0.03)
      .put("Discretize", 0.01)
      .put("QuantileTransformer", 0.1)
      .put("PowerTransformer", 0.05)
      .build();

  /** Used to clean up regressors. */
  public static final ImmutableMap<String, Double> DECOMPOSITIONS =
      ImmutableMap.<String, Double>builder()
          .put("STLFilter", 0.05)
          .put("Detrend", 0.05)
          .put("DifferencedTransformer", 0.05)
          .put("DatepartRegression", 0.05)
          .put("ClipOutliers", 0.05)
          .build();

  /** NaN fill methods. "None" stands for no fill. */
  public static final ImmutableMap<String, Double> NA_PROBS = ImmutableMap.<String, Double>builder()
      .put("ffill", 0.4)
      .put("fake_date", 0.1)
      .put("rolling_mean", 0.1)
      .put("rolling_mean_24", 0.1)
      .put("IterativeImputer", 0.05)
      .put("mean", 0.06)
      .put("zero", 0.05)
      .put("ffill_mean_biased", 0.1)
      .put("median", 0.03)
      .put("None", 0.001)
      .put("interpolate", 0.4)
      .put("KNNImputer", 0.05)
      .put("IterativeImputerExtraTrees", 0.0001)
      .build();

  /** Interpolation methods drawn when {@code interpolate} is the fill. */
  public static final ImmutableMap<String, Double> INTERPOLATION =
      ImmutableMap.<String, Double>builder()
          .put("linear", 0.4)
          .put("time", 0.1)
          .put("nearest", 0.1)
          .put("zero", 0.05)
          .put("slinear", 0.05)
          .put("cubic", 0.1)
          .put("akima", 0.05)
          .put("pchip", 0.1)
          .put("spline", 0.05)
          .build();

  /**
   * The catalog behind an alias: null or "all" for {@link #ALL}; "fast", "default" or "auto"
   * for {@link #FAST}; "superfast" for {@link #SUPERFAST}; or one of "filters", "scalers",
   * "decompositions".
   */
  public static ImmutableMap<String, Double> resolve(String alias) {
    if (alias == null) {
      return ALL;
    }
    switch (alias.toLowerCase(Locale.ROOT)) {
      case "all":
        return ALL;
      case "fast":
      case "default":
      case "auto":
        return FAST;
      case "superfast":
        return SUPERFAST;
      case "filters":
        return FILTERS;
      case "scalers":
        return SCALERS;
      case "decompositions":
        return DECOMPOSITIONS;
      default:
        throw new IllegalArgumentException("transformer list alias not recognized: " + alias);
    }
  }

  /** Equal weights over names. */
  public static ImmutableMap<String, Double> uniform(List<String> names) {
    Map<String, Double> out = new LinkedHashMap<>();
    for (String name : names) {
      out.put(name, 1.0 / names.size());
    }
    return ImmutableMap.copyOf(out);
  }

  static ImmutableMap<String, Double> without(Map<String, Double> catalog, String... names) {
    Map<String, Double> out = new LinkedHashMap<>(catalog);
    for (String name : names) {
      out.remove(name);
    }
    return ImmutableMap.copyOf(out);
  }
}
