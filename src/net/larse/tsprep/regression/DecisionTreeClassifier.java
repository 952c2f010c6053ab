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

import java.util.Random;
import java.util.TreeSet;

/**
 * Gini decision tree classifier. The squared error of one-hot class indicators equals the Gini
 * impurity times the node size, so the classifier is a regression tree over those indicators
 * that predicts the class with the largest leaf share.
 */
public class DecisionTreeClassifier {
  private final DecisionTreeRegressor tree;

  public DecisionTreeClassifier(Integer maxDepth, int minSamplesLeaf, long seed) {
    this.tree = new DecisionTreeRegressor(maxDepth, 2, minSamplesLeaf, 0, false,
        new Random(seed));
  }

  public DecisionTreeClassifier() {
    this(null, 1, 0);
  }

  /** Fits on integer class labels. */
  public Model fit(double[][] x, int[] labels) {
    Preconditions.checkArgument(x.length == labels.length && x.length > 0,
        "x and labels must have the same, positive, number of rows");
    TreeSet<Integer> distinct = new TreeSet<>();
    for (int label : labels) {
      distinct.add(label);
    }
    int[] classes = distinct.stream().mapToInt(Integer::intValue).toArray();
    double[][] indicators = new double[labels.length][classes.length];
    for (int i = 0; i < labels.length; i++) {
      for (int c = 0; c < classes.length; c++) {
        indicators[i][c] = labels[i] == classes[c] ? 1 : 0;
      }
    }
    return new Model(tree.fit(x, indicators), classes);
  }

  /** A fitted classifier. */
  public static final class Model {
    private final DecisionTreeRegressor.TreePredictor tree;
    private final int[] classes;

    Model(DecisionTreeRegressor.TreePredictor tree, int[] classes) {
      this.tree = tree;
      this.classes = classes;
    }

    public int[] predict(double[][] x) {
      int[] out = new int[x.length];
      for (int i = 0; i < x.length; i++) {
        double[] share = tree.predictRow(x[i]);
        int best = 0;
        for (int c = 1; c < share.length; c++) {
          if (share[c] > share[best]) {
            best = c;
          }
        }
        out[i] = classes[best];
      }
      return out;
    }
  }
}
