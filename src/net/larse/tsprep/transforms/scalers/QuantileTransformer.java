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
package net.larse.tsprep.transforms.scalers;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.Random;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.Distributions;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import net.larse.tsprep.transforms.AbstractTransformer;
import net.larse.tsprep.transforms.SpeedTier;

/**
 * Maps each series through its empirical quantile function onto a uniform or a standard
 * normal distribution. Values beyond the fitted range map to the bounds.
 */
public class QuantileTransformer extends AbstractTransformer<QuantileTransformer.Args> {
  public static final String NAME = "QuantileTransformer";

  private static final double BOUNDS_THRESHOLD = 1e-7;
  private static final double CLIP_MIN = Distributions.normalPpf(BOUNDS_THRESHOLD - 1e-10);
  private static final double CLIP_MAX = Distributions.normalPpf(1 - (BOUNDS_THRESHOLD - 1e-10));

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Number of quantiles: an integer, or quarter, fifth or tenth of the rows.")
    @Optional
    public Object nQuantiles = 1000;

    @Doc(help = "uniform or normal.")
    @Optional
    public String outputDistribution = "uniform";

    @Override
    protected void checkValues() {
      if (!outputDistribution.equals("uniform") && !outputDistribution.equals("normal")) {
        throw new IllegalArgumentException("outputDistribution must be uniform or normal");
      }
      if (!(nQuantiles instanceof Number)
          && !ImmutableList.of("quarter", "fifth", "tenth").contains(String.valueOf(nQuantiles))
          && Ints.tryParse(String.valueOf(nQuantiles)) == null) {
        throw new IllegalArgumentException("invalid nQuantiles " + nQuantiles);
      }
    }
  }

  private double[] references;
  private double[][] quantiles;

  public QuantileTransformer(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.nQuantiles = WeightedChoice.choose(random,
        ImmutableList.<Object>of("quarter", "fifth", "tenth", 1000, 100, 20),
        0.05, 0.05, 0.05, 0.7, 0.1, 0.05);
    a.outputDistribution =
        WeightedChoice.choose(random, ImmutableList.of("uniform", "normal"), 0.8, 0.2);
    return a;
  }

  /** The quantile count for a frame with the given number of rows. */
  static int resolveQuantiles(Object nQuantiles, int rows) {
    int n;
    String text = String.valueOf(nQuantiles);
    switch (text) {
      case "quarter":
        n = rows / 4;
        break;
      case "fifth":
        n = rows / 5;
        break;
      case "tenth":
        n = rows / 10;
        break;
      default:
        n = nQuantiles instanceof Number ? ((Number) nQuantiles).intValue() : Ints.tryParse(text);
    }
    return Math.max(2, Math.min(n, rows));
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    int nq = resolveQuantiles(args.nQuantiles, df.rows());
    references = new double[nq];
    for (int k = 0; k < nq; k++) {
      references[k] = (double) k / (nq - 1);
    }
    quantiles = new double[df.cols()][nq];
    for (int j = 0; j < df.cols(); j++) {
      double[] sorted = ArrayHelper.finiteSorted(df.column(j));
      double running = Double.NEGATIVE_INFINITY;
      for (int k = 0; k < nq; k++) {
        running = Math.max(running, ArrayHelper.quantileSorted(sorted, references[k]));
        quantiles[j][k] = running;
      }
    }
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    boolean normal = args.outputDistribution.equals("normal");
    double[] negRefs = reverseNegate(references);
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      double[] q = quantiles[j];
      double[] negQ = reverseNegate(q);
      for (int i = 0; i < data[j].length; i++) {
        double x = data[j][i];
        if (Double.isNaN(x)) {
          continue;
        }
        double u;
        if (x - BOUNDS_THRESHOLD < q[0]) {
          u = 0;
        } else if (x + BOUNDS_THRESHOLD > q[q.length - 1]) {
          u = 1;
        } else {
          // average of the two directions keeps ties at the middle of their range
          u = 0.5 * (interp(x, q, references) - interp(-x, negQ, negRefs));
        }
        if (normal) {
          double z = u <= 0 ? CLIP_MIN : u >= 1 ? CLIP_MAX : Distributions.normalPpf(u);
          u = Math.max(CLIP_MIN, Math.min(CLIP_MAX, z));
        }
        data[j][i] = u;
      }
    }
    return df.withData(data);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    boolean normal = args.outputDistribution.equals("normal");
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      double[] q = quantiles[j];
      for (int i = 0; i < data[j].length; i++) {
        double u = data[j][i];
        if (Double.isNaN(u)) {
          continue;
        }
        if (normal) {
          u = Distributions.normalCdf(u);
        }
        if (u - BOUNDS_THRESHOLD < 0) {
          data[j][i] = q[0];
        } else if (u + BOUNDS_THRESHOLD > 1) {
          data[j][i] = q[q.length - 1];
        } else {
          data[j][i] = interp(u, references, q);
        }
      }
    }
    return df.withData(data);
  }

  /** Piecewise linear interpolation on non-decreasing xp, constant beyond the ends. */
  static double interp(double x, double[] xp, double[] fp) {
    int n = xp.length;
    if (x <= xp[0]) {
      return fp[0];
    }
    if (x >= xp[n - 1]) {
      return fp[n - 1];
    }
    int hi = 1;
    while (xp[hi] < x) {
      hi++;
    }
    // right-most knot of a run of equal xp values
    while (hi < n - 1 && xp[hi] == x && xp[hi + 1] == x) {
      hi++;
    }
    int lo = hi - 1;
    double span = xp[hi] - xp[lo];
    if (span == 0) {
      return fp[hi];
    }
    return fp[lo] + (fp[hi] - fp[lo]) * (x - xp[lo]) / span;
  }

  private static double[] reverseNegate(double[] a) {
    double[] out = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = -a[a.length - 1 - i];
    }
    return out;
  }
}
