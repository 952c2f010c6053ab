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

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import java.util.Arrays;
import java.util.Random;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Rounds values to bins. The center/lower/upper methods snap each value to the nearest bin
 * value learned from the quantiles of its series and are not inverted. The binning methods
 * (quantile, uniform or k-means edges) emit the ordinal bin index and invert to the center of
 * the bin.
 */
public class Discretize extends AbstractTransformer<Discretize.Args> {
  public static final String NAME = "Discretize";

  static final ImmutableList<String> METHODS = ImmutableList.of("center", "upper", "lower",
      "sklearn-quantile", "sklearn-uniform", "sklearn-kmeans");

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "center, lower, upper, sklearn-quantile, sklearn-uniform or sklearn-kmeans.")
    @Optional
    public String discretization = "center";

    @Doc(help = "Number of bins.")
    @Optional
    public int nBins = 10;

    @Override
    protected void checkValues() {
      if (discretization != null && !discretization.equals("None")
          && !METHODS.contains(discretization)) {
        throw new IllegalArgumentException("unknown discretization " + discretization);
      }
      if (nBins < 2) {
        throw new IllegalArgumentException("nBins must be at least 2");
      }
    }
  }

  // Per column: bin values for snapping, or bin edges for the ordinal methods.
  private double[][] bins;
  private double[] binMin;
  private double[] binMax;

  public Discretize(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    if (tier.isFast()) {
      a.discretization = WeightedChoice.uniform(random, "center", "upper", "lower");
      a.nBins = WeightedChoice.uniform(random, 5, 10, 20);
    } else {
      a.discretization = WeightedChoice.choose(random, METHODS, 0.3, 0.2, 0.2, 0.1, 0.1, 0.1);
      a.nBins = WeightedChoice.uniform(random, 5, 10, 20, 50);
    }
    return a;
  }

  private boolean disabled() {
    return args.discretization == null || args.discretization.equals("None");
  }

  private boolean ordinal() {
    return args.discretization.startsWith("sklearn-");
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    if (disabled()) {
      return;
    }
    bins = new double[df.cols()][];
    for (int j = 0; j < df.cols(); j++) {
      double[] c = df.column(j);
      bins[j] = ordinal() ? edges(c) : snapValues(c);
    }
    if (ordinal()) {
      binMin = new double[df.cols()];
      binMax = new double[df.cols()];
      for (int j = 0; j < df.cols(); j++) {
        double[] idx = toOrdinal(df.column(j), bins[j]);
        binMin[j] = ArrayHelper.nanMin(idx);
        binMax[j] = ArrayHelper.nanMax(idx);
      }
    }
  }

  private double[] snapValues(double[] c) {
    int n = args.nBins;
    double[] q = new double[n + 1];
    for (int k = 0; k <= n; k++) {
      q[k] = ArrayHelper.nanQuantile(c, (double) k / n);
    }
    double[] out = new double[n];
    for (int k = 0; k < n; k++) {
      switch (args.discretization) {
        case "center":
          out[k] = (q[k] + q[k + 1]) / 2;
          break;
        case "lower":
          out[k] = q[k];
          break;
        default:
          out[k] = q[k + 1];
      }
    }
    return out;
  }

  private double[] edges(double[] c) {
    int n = args.nBins;
    double min = ArrayHelper.nanMin(c);
    double max = ArrayHelper.nanMax(c);
    double[] e;
    switch (args.discretization) {
      case "sklearn-uniform":
        e = new double[n + 1];
        for (int k = 0; k <= n; k++) {
          e[k] = min + (max - min) * k / n;
        }
        break;
      case "sklearn-quantile":
        e = new double[n + 1];
        for (int k = 0; k <= n; k++) {
          e[k] = ArrayHelper.nanQuantile(c, (double) k / n);
        }
        break;
      default:
        e = kmeansEdges(ArrayHelper.finiteSorted(c), min, max, n);
    }
    // Bins narrower than 1e-8 are dropped.
    DoubleArrayList kept = new DoubleArrayList();
    kept.add(e[0]);
    for (int k = 1; k < e.length; k++) {
      if (e[k] - kept.getDouble(kept.size() - 1) > 1e-8) {
        kept.add(e[k]);
      }
    }
    if (kept.size() < 2) {
      kept.add(e[0] + 1e-8);
    }
    return kept.toDoubleArray();
  }

  /** One dimensional Lloyd iterations started from uniform bin centers. */
  private static double[] kmeansEdges(double[] sorted, double min, double max, int n) {
    double[] centers = new double[n];
    for (int k = 0; k < n; k++) {
      centers[k] = min + (max - min) * (k + 0.5) / n;
    }
    double[] sum = new double[n];
    int[] count = new int[n];
    for (int iter = 0; iter < 300; iter++) {
      Arrays.fill(sum, 0);
      Arrays.fill(count, 0);
      for (double v : sorted) {
        int best = nearest(centers, v);
        sum[best] += v;
        count[best]++;
      }
      double shift = 0;
      for (int k = 0; k < n; k++) {
        if (count[k] > 0) {
          double c = sum[k] / count[k];
          shift = Math.max(shift, Math.abs(c - centers[k]));
          centers[k] = c;
        }
      }
      if (shift < 1e-4 * (max - min + 1e-12)) {
        break;
      }
    }
    Arrays.sort(centers);
    double[] e = new double[n + 1];
    e[0] = min;
    e[n] = max;
    for (int k = 1; k < n; k++) {
      e[k] = (centers[k - 1] + centers[k]) / 2;
    }
    return e;
  }

  private static int nearest(double[] values, double v) {
    int best = 0;
    double dist = Double.POSITIVE_INFINITY;
    for (int k = 0; k < values.length; k++) {
      double d = Math.abs(v - values[k]);
      if (d < dist) {
        dist = d;
        best = k;
      }
    }
    return best;
  }

  private static double[] toOrdinal(double[] c, double[] edges) {
    int nb = edges.length - 1;
    double[] out = new double[c.length];
    for (int i = 0; i < c.length; i++) {
      if (Double.isNaN(c[i])) {
        out[i] = Double.NaN;
        continue;
      }
      // Interior edges only, values on an edge go to the upper bin.
      int k = 0;
      while (k < nb - 1 && c[i] >= edges[k + 1]) {
        k++;
      }
      out[i] = k;
    }
    return out;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    if (disabled()) {
      return df;
    }
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      if (ordinal()) {
        data[j] = toOrdinal(data[j], bins[j]);
      } else {
        for (int i = 0; i < data[j].length; i++) {
          if (!Double.isNaN(data[j][i])) {
            data[j][i] = bins[j][nearest(bins[j], data[j][i])];
          }
        }
      }
    }
    return df.withData(data);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    if (disabled() || !ordinal()) {
      return df;
    }
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      double[] e = bins[j];
      int top = e.length - 2;
      for (int i = 0; i < data[j].length; i++) {
        double v = data[j][i];
        if (Double.isNaN(v)) {
          continue;
        }
        v = Math.max(binMin[j], Math.min(binMax[j], v));
        int k = Math.max(0, Math.min(top, (int) v));
        data[j][i] = (e[k] + e[k + 1]) / 2;
      }
    }
    return df.withData(data);
  }
}
