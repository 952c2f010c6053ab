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

import java.util.Arrays;

/** Averages the targets of the k nearest training rows by Euclidean distance. */
public class KNeighborsRegressor implements Regressor {
  private final int neighbors;
  private final boolean distanceWeights;

  /**
   * @param neighbors k
   * @param distanceWeights weight neighbors by inverse distance instead of uniformly
   */
  public KNeighborsRegressor(int neighbors, boolean distanceWeights) {
    Preconditions.checkArgument(neighbors >= 1, "n_neighbors must be >= 1");
    this.neighbors = neighbors;
    this.distanceWeights = distanceWeights;
  }

  @Override
  public Predictor fit(double[][] x, double[][] y) {
    Preconditions.checkArgument(x.length == y.length && x.length > 0,
        "x and y must have the same, positive, number of rows");
    double[][] trainX = x.clone();
    double[][] trainY = y.clone();
    int k = Math.min(neighbors, trainX.length);
    int targets = trainY[0].length;
    return query -> {
      double[][] out = new double[query.length][targets];
      Integer[] order = new Integer[trainX.length];
      double[] dist = new double[trainX.length];
      for (int q = 0; q < query.length; q++) {
        for (int i = 0; i < trainX.length; i++) {
          double d = 0;
          for (int j = 0; j < query[q].length; j++) {
            double diff = query[q][j] - trainX[i][j];
            d += diff * diff;
          }
          dist[i] = Math.sqrt(d);
          order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(dist[a], dist[b]));
        boolean exact = distanceWeights && dist[order[0]] == 0;
        double total = 0;
        for (int r = 0; r < k; r++) {
          int i = order[r];
          double w;
          if (!distanceWeights) {
            w = 1;
          } else if (exact) {
            w = dist[i] == 0 ? 1 : 0;
          } else {
            w = 1 / dist[i];
          }
          total += w;
          for (int t = 0; t < targets; t++) {
            out[q][t] += w * trainY[i][t];
          }
        }
        for (int t = 0; t < targets; t++) {
          out[q][t] /= total;
        }
      }
      return out;
    };
  }
}
