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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Averaged ensemble of regression trees: a random forest (bootstrap rows, best splits over a
 * feature subset) or extra trees (all rows, random thresholds).
 */
public class TreeEnsembleRegressor implements Regressor {
  private final int nEstimators;
  private final boolean extraTrees;
  private final Integer maxDepth;
  private final int minSamplesLeaf;
  private final double maxFeaturesFraction;
  private final long seed;

  /**
   * @param nEstimators number of trees
   * @param extraTrees extra trees instead of a random forest
   * @param maxDepth maximum depth of each tree, null for unlimited
   * @param minSamplesLeaf minimum rows per leaf
   * @param maxFeaturesFraction share of the features considered at each split
   * @param seed random seed
   */
  public TreeEnsembleRegressor(int nEstimators, boolean extraTrees, Integer maxDepth,
      int minSamplesLeaf, double maxFeaturesFraction, long seed) {
    Preconditions.checkArgument(nEstimators >= 1, "n_estimators must be >= 1");
    Preconditions.checkArgument(maxFeaturesFraction > 0 && maxFeaturesFraction <= 1,
        "max_features must be in (0, 1]");
    this.nEstimators = nEstimators;
    this.extraTrees = extraTrees;
    this.maxDepth = maxDepth;
    this.minSamplesLeaf = minSamplesLeaf;
    this.maxFeaturesFraction = maxFeaturesFraction;
    this.seed = seed;
  }

  public static TreeEnsembleRegressor randomForest(int nEstimators, long seed) {
    return new TreeEnsembleRegressor(nEstimators, false, null, 1, 1.0, seed);
  }

  public static TreeEnsembleRegressor extraTrees(int nEstimators, long seed) {
    return new TreeEnsembleRegressor(nEstimators, true, null, 1, 1.0, seed);
  }

  @Override
  public Predictor fit(double[][] x, double[][] y) {
    Preconditions.checkArgument(x.length == y.length && x.length > 0,
        "x and y must have the same, positive, number of rows");
    Random random = new Random(seed);
    int n = x.length;
    int features = Math.max(1, (int) Math.round(maxFeaturesFraction * x[0].length));
    List<DecisionTreeRegressor.TreePredictor> trees = new ArrayList<>(nEstimators);
    for (int t = 0; t < nEstimators; t++) {
      DecisionTreeRegressor tree = new DecisionTreeRegressor(maxDepth, 2, minSamplesLeaf,
          features, extraTrees, new Random(random.nextLong()));
      int[] rows = new int[n];
      for (int i = 0; i < n; i++) {
        rows[i] = extraTrees ? i : random.nextInt(n);
      }
      trees.add(tree.fit(x, y, rows));
    }
    return rowsIn -> {
      double[][] out = null;
      for (DecisionTreeRegressor.TreePredictor tree : trees) {
        double[][] p = tree.predict(rowsIn);
        if (out == null) {
          out = p;
        } else {
          for (int i = 0; i < p.length; i++) {
            for (int k = 0; k < p[i].length; k++) {
              out[i][k] += p[i][k];
            }
          }
        }
      }
      for (double[] row : out) {
        for (int k = 0; k < row.length; k++) {
          row[k] /= trees.size();
        }
      }
      return out;
    };
  }
}
