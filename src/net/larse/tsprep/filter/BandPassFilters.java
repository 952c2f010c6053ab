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
package net.larse.tsprep.filter;

import com.google.common.base.Preconditions;

import net.larse.tsprep.helper.ArrayHelper;

/**
 * Business cycle band-pass filters and a plain convolution filter.
 *
 * <p>Both band-pass filters isolate fluctuations with periods between {@code low} and
 * {@code high} observations, 6 and 32 by default.
 */
public final class BandPassFilters {
  public static final int DEFAULT_LOW = 6;
  public static final int DEFAULT_HIGH = 32;

  private BandPassFilters() {}

  /**
   * Baxter-King symmetric moving-average filter with lead-lag length k. The cycle is
   * undefined (NaN) for the first and last k observations.
   */
  public static double[] baxterKing(double[] x, int low, int high, int k) {
    Preconditions.checkArgument(k >= 1, "K must be positive, got %s", k);
    double omega1 = 2 * Math.PI / high;
    double omega2 = 2 * Math.PI / low;
    double[] weights = new double[2 * k + 1];
    weights[k] = (omega2 - omega1) / Math.PI;
    for (int j = 1; j <= k; j++) {
      double w = (Math.sin(omega2 * j) - Math.sin(omega1 * j)) / (Math.PI * j);
      weights[k + j] = w;
      weights[k - j] = w;
    }
    double mean = 0;
    for (double w : weights) {
      mean += w;
    }
    mean /= weights.length;
    for (int j = 0; j < weights.length; j++) {
      weights[j] -= mean;
    }
    int n = x.length;
    double[] cycle = ArrayHelper.fill(n, Double.NaN);
    for (int t = k; t < n - k; t++) {
      double s = 0;
      for (int j = -k; j <= k; j++) {
        s += weights[k + j] * x[t + j];
      }
      cycle[t] = s;
    }
    return cycle;
  }

  /**
   * Christiano-Fitzgerald asymmetric filter under a random walk assumption.
   *
   * @param drift whether to remove the line through the end points first
   * @return {cycle, trend}
   */
  public static double[][] christianoFitzgerald(double[] x, int low, int high, boolean drift) {
    Preconditions.checkArgument(low >= 2, "low must be >= 2, got %s", low);
    int n = x.length;
    double[] xx = x.clone();
    if (drift && n > 1) {
      double slope = (x[n - 1] - x[0]) / (n - 1.0);
      for (int i = 0; i < n; i++) {
        xx[i] = x[i] - i * slope;
      }
    }
    double a = 2 * Math.PI / high;
    double b = 2 * Math.PI / low;
    double[] bj = new double[n + 1];
    bj[0] = (b - a) / Math.PI;
    for (int j = 1; j <= n; j++) {
      bj[j] = (Math.sin(b * j) - Math.sin(a * j)) / (Math.PI * j);
    }
    double[] cycle = new double[n];
    for (int i = 0; i < n; i++) {
      int forward = Math.max(0, n - i - 2);
      double sumForward = 0;
      for (int j = 1; j <= forward; j++) {
        sumForward += bj[j];
      }
      double sumBackward = 0;
      for (int j = 1; j < i; j++) {
        sumBackward += bj[j];
      }
      double bEnd = -0.5 * bj[0] - sumForward;
      double aStart = -bj[0] - sumForward - sumBackward - bEnd;
      double y = bj[0] * xx[i];
      for (int j = 1; j <= forward; j++) {
        y += bj[j] * xx[i + j];
      }
      y += bEnd * xx[n - 1];
      for (int j = 1; j < i; j++) {
        y += bj[j] * xx[i - j];
      }
      y += aStart * xx[0];
      cycle[i] = y;
    }
    double[] trend = new double[n];
    for (int i = 0; i < n; i++) {
      trend[i] = xx[i] - cycle[i];
    }
    return new double[][] {cycle, trend};
  }

  /**
   * Two-sided convolution {@code y[t] = sum_k filt[k] * x[t + k - head]} where the
   * head is {@code ceil(len / 2) - 1}. Positions the filter does not fully cover are NaN.
   */
  public static double[] convolution(double[] x, double[] filt) {
    int len = filt.length;
    int head = (int) Math.ceil(len / 2.0) - 1;
    int n = x.length;
    double[] out = ArrayHelper.fill(n, Double.NaN);
    for (int start = 0; start + len <= n; start++) {
      double s = 0;
      // full convolution reverses the filter
      for (int k = 0; k < len; k++) {
        s += filt[len - 1 - k] * x[start + k];
      }
      out[start + head] = s;
    }
    return out;
  }
}
