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
package net.larse.tsprep.regression;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * CART regression tree with the squared error criterion summed over all targets.
 *
 * <p>With {@code randomSplits} each considered feature gets a single threshold drawn uniformly
 * between its node minimum and maximum, as in extremely randomized trees.
 */
public class DecisionTreeRegressor implements Regressor {
  private final Integer maxDepth;
  private final double minSamplesSplit;
  private final int minSamplesLeaf;
  private final int maxFeatures;
  private final boolean randomSplits;
  private final Random random;

  /**
   * @param maxDepth maximum depth, null for unlimited
   * @param minSamplesSplit minimum node size to split, a count if at least 1 else a fraction
   *     of the rows
   * @param minSamplesLeaf minimum rows on each side of a split
   * @param maxFeatures features considered per split, 0 or less for all
   * @param randomSplits draw one random threshold per feature
   * @param random source of feature subsets and random thresholds
   */
  public DecisionTreeRegressor(Integer maxDepth, double minSamplesSplit, int minSamplesLeaf,
      int maxFeatures, boolean randomSplits, Random random) {
    Preconditions.checkArgument(maxDepth == null || maxDepth >= 1, "max_depth must be >= 1");
    Preconditions.checkArgument(minSamplesSplit > 0, "min_samples_split must be positive");
    Preconditions.checkArgument(minSamplesLeaf >= 1, "min_samples_leaf must be >= 1");
    this.maxDepth = maxDepth;
    this.minSamplesSplit = minSamplesSplit;
    this.minSamplesLeaf = minSamplesLeaf;
    this.maxFeatures = maxFeatures;
    this.randomSplits = randomSplits;
    this.random = random;
  }

  public DecisionTreeRegressor(Integer maxDepth, double minSamplesSplit) {
    this(maxDepth, minSamplesSplit, 1, 0, false, new Random(0));
  }

  @Override
  public TreePredictor fit(double[][] x, double[][] y) {
    int[] rows = new int[x.length];
    for (int i = 0; i < rows.length; i++) {
      rows[i] = i;
    }
    return fit(x, y, rows);
  }

  /** Fits on the given rows of x and y, which may repeat (bootstrap samples). */
  TreePredictor fit(double[][] x, double[][] y, int[] rows) {
    Preconditions.checkArgument(x.length == y.length && rows.length > 0,
        "x and y must have the same, positive, number of rows");
    int minSplit = minSamplesSplit >= 1
        ? (int) minSamplesSplit
        : Math.max(2, (int) Math.ceil(minSamplesSplit * rows.length));
    Builder builder = new Builder(x, y, Math.max(2, minSplit));
    builder.grow(rows, 0);
    return builder.build();
  }

  /** Array-backed tree: internal nodes split on feature {@code <= threshold}, leaves hold means. */
  public static final class TreePredictor implements Predictor {
    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final double[][] value;

    TreePredictor(int[] feature, double[] threshold, int[] left, int[] right, double[][] value) {
      this.feature = feature;
      this.threshold = threshold;
      this.left = left;
      this.right = right;
      this.value = value;
    }

    public double[] predictRow(double[] row) {
      int node = 0;
      while (feature[node] >= 0) {
        node = row[feature[node]] <= threshold[node] ? left[node] : right[node];
      }
      return value[node];
    }

    @Override
    public double[][] predict(double[][] x) {
      double[][] out = new double[x.length][];
      for (int i = 0; i < x.length; i++) {
        out[i] = predictRow(x[i]).clone();
      }
      return out;
    }
  }

  private final class Builder {
    private final double[][] x;
    private final double[][] y;
    private final int minSplit;
    private final int targets;
    private final IntArrayList feature = new IntArrayList();
    private final DoubleArrayList threshold = new DoubleArrayList();
    private final IntArrayList left = new IntArrayList();
    private final IntArrayList right = new IntArrayList();
    private final List<double[]> value = new ArrayList<>();

    Builder(double[][] x, double[][] y, int minSplit) {
      this.x = x;
      this.y = y;
      this.minSplit = minSplit;
      this.targets = y[0].length;
    }

    int grow(int[] rows, int depth) {
      int node = feature.size();
      feature.add(-1);
      threshold.add(0);
      left.add(-1);
      right.add(-1);
      value.add(mean(rows));

      if (rows.length < minSplit || (maxDepth != null && depth >= maxDepth)) {
        return node;
      }
      Split split = bestSplit(rows);
      if (split == null) {
        return node;
      }
      IntArrayList l = new IntArrayList();
      IntArrayList r = new IntArrayList();
      for (int i : rows) {
        if (x[i][split.feature] <= split.threshold) {
          l.add(i);
        } else {
          r.add(i);
        }
      }
      feature.set(node, split.feature);
      threshold.set(node, split.threshold);
      int ln = grow(l.toIntArray(), depth + 1);
      int rn = grow(r.toIntArray(), depth + 1);
      left.set(node, ln);
      right.set(node, rn);
      return node;
    }

    private double[] mean(int[] rows) {
      double[] m = new double[targets];
      for (int i : rows) {
        for (int k = 0; k < targets; k++) {
          m[k] += y[i][k];
        }
      }
      for (int k = 0; k < targets; k++) {
        m[k] /= rows.length;
      }
      return m;
    }

    private Split bestSplit(int[] rows) {
      int p = x[0].length;
      int[] candidates = candidateFeatures(p);
      double[] totalSum = new double[targets];
      double totalSq = 0;
      for (int i : rows) {
        for (int k = 0; k < targets; k++) {
          totalSum[k] += y[i][k];
          totalSq += y[i][k] * y[i][k];
        }
      }
      double parentSse = totalSq - sumSquares(totalSum) / rows.length;
      Split best = null;
      double bestSse = parentSse - 1e-12 * Math.max(1, Math.abs(parentSse));
      for (int f : candidates) {
        Split s = randomSplits ? randomSplit(rows, f, totalSum, totalSq)
            : exhaustiveSplit(rows, f, totalSum, totalSq);
        if (s != null && s.sse < bestSse) {
          best = s;
          bestSse = s.sse;
        }
      }
      return best;
    }

    private int[] candidateFeatures(int p) {
      int[] all = new int[p];
      for (int j = 0; j < p; j++) {
        all[j] = j;
      }
      if (maxFeatures <= 0 || maxFeatures >= p) {
        return all;
      }
      for (int j = p - 1; j > 0; j--) {
        int swap = random.nextInt(j + 1);
        int t = all[j];
        all[j] = all[swap];
        all[swap] = t;
      }
      return Arrays.copyOf(all, maxFeatures);
    }

    private Split exhaustiveSplit(int[] rows, int f, double[] totalSum, double totalSq) {
      Integer[] order = new Integer[rows.length];
      for (int i = 0; i < rows.length; i++) {
        order[i] = rows[i];
      }
      Arrays.sort(order, (a, b) -> Double.compare(x[a][f], x[b][f]));
      double[] leftSum = new double[targets];
      double leftSq = 0;
      Split best = null;
      for (int pos = 0; pos < order.length - 1; pos++) {
        int i = order[pos];
        for (int k = 0; k < targets; k++) {
          leftSum[k] += y[i][k];
          leftSq += y[i][k] * y[i][k];
        }
        int nl = pos + 1;
        int nr = order.length - nl;
        double v = x[i][f];
        double next = x[order[pos + 1]][f];
        if (v == next || nl < minSamplesLeaf || nr < minSamplesLeaf) {
          continue;
        }
        double sse = sse(leftSum, leftSq, nl, totalSum, totalSq, nr);
        if (best == null || sse < best.sse) {
          best = new Split(f, v + (next - v) / 2, sse);
        }
      }
      return best;
    }

    private Split randomSplit(int[] rows, int f, double[] totalSum, double totalSq) {
      double lo = Double.POSITIVE_INFINITY;
      double hi = Double.NEGATIVE_INFINITY;
      for (int i : rows) {
        lo = Math.min(lo, x[i][f]);
        hi = Math.max(hi, x[i][f]);
      }
      if (!(hi > lo)) {
        return null;
      }
      double t = lo + random.nextDouble() * (hi - lo);
      double[] leftSum = new double[targets];
      double leftSq = 0;
      int nl = 0;
      for (int i : rows) {
        if (x[i][f] <= t) {
          nl++;
          for (int k = 0; k < targets; k++) {
            leftSum[k] += y[i][k];
            leftSq += y[i][k] * y[i][k];
          }
        }
      }
      int nr = rows.length - nl;
      if (nl < minSamplesLeaf || nr < minSamplesLeaf) {
        return null;
      }
      return new Split(f, t, sse(leftSum, leftSq, nl, totalSum, totalSq, nr));
    }

    private double sse(double[] leftSum, double leftSq, int nl, double[] totalSum,
        double totalSq, int nr) {
      double[] rightSum = new double[targets];
      for (int k = 0; k < targets; k++) {
        rightSum[k] = totalSum[k] - leftSum[k];
      }
      double rightSq = totalSq - leftSq;
      return leftSq - sumSquares(leftSum) / nl + rightSq - sumSquares(rightSum) / nr;
    }

    TreePredictor build() {
      return new TreePredictor(feature.toIntArray(), threshold.toDoubleArray(),
          left.toIntArray(), right.toIntArray(), value.toArray(new double[0][]));
    }
  }

  private static double sumSquares(double[] v) {
    double s = 0;
    for (double d : v) {
      s += d * d;
    }
    return s;
  }

  private static final class Split {
    final int feature;
    final double threshold;
    final double sse;

    Split(int feature, double threshold, double sse) {
      this.feature = feature;
      this.threshold = threshold;
      this.sse = sse;
    }
  }
}
