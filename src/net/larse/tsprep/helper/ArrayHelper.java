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
package net.larse.tsprep.helper;

import java.util.Arrays;

import org.apache.commons.lang3.ArrayUtils;

/** Static array manipulation functions. NaN marks a missing value throughout. */
public class ArrayHelper {
  private ArrayHelper() {}

  /**
   * Find the first finite value in array, between start (incl) and end (excl). if end is
   * negative, it is taken as the number of entries from the end (ie: -1 = len-1).
   */
  public static int firstFinite(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    for (int i = start; i < end; i++) {
      if (!Double.isNaN(array[i])) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Find the last finite value in array, between start (incl) and end (excl). if end is
   * negative, it is taken as the number of entries from the end (ie: -1 = len-1).
   */
  public static int lastFinite(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    for (int i = end - 1; i >= start; i--) {
      if (!Double.isNaN(array[i])) {
        return i;
      }
    }
    return -1;
  }

  /** Count the number of NaN entries. */
  public static int countNaN(double[] array) {
    int count = 0;
    for (double v : array) {
      if (Double.isNaN(v)) {
        count++;
      }
    }
    return count;
  }

  public static boolean hasNaN(double[] array) {
    for (double v : array) {
      if (Double.isNaN(v)) {
        return true;
      }
    }
    return false;
  }

  /** Mean of the non-NaN values, NaN if there are none. */
  public static double nanMean(double[] array) {
    return nanMean(array, 0, array.length);
  }

  public static double nanMean(double[] array, int start, int end) {
    double sum = 0;
    int n = 0;
    for (int i = start; i < end; i++) {
      if (!Double.isNaN(array[i])) {
        sum += array[i];
        n++;
      }
    }
    return n == 0 ? Double.NaN : sum / n;
  }

  /** Standard deviation of the non-NaN values with the given delta degrees of freedom. */
  public static double nanStd(double[] array, int ddof) {
    double mean = nanMean(array);
    double ss = 0;
    int n = 0;
    for (double v : array) {
      if (!Double.isNaN(v)) {
        ss += (v - mean) * (v - mean);
        n++;
      }
    }
    if (n - ddof <= 0) {
      return Double.NaN;
    }
    return Math.sqrt(ss / (n - ddof));
  }

  public static double nanMedian(double[] array) {
    return nanQuantile(array, 0.5);
  }

  public static double nanMedian(double[] array, int start, int end) {
    return nanQuantile(ArrayUtils.subarray(array, start, end), 0.5);
  }

  /**
   * Quantile of the non-NaN values with linear interpolation between the closest ranks, the
   * definition numerical packages use by default.
   */
  public static double nanQuantile(double[] array, double q) {
    double[] sorted = finiteSorted(array);
    return quantileSorted(sorted, q);
  }

  /** Quantile of an already sorted array holding no NaN. */
  public static double quantileSorted(double[] sorted, double q) {
    if (sorted.length == 0) {
      return Double.NaN;
    }
    double pos = q * (sorted.length - 1);
    int lo = (int) Math.floor(pos);
    int hi = Math.min(lo + 1, sorted.length - 1);
    double frac = pos - lo;
    return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
  }

  /** The non-NaN values, sorted ascending. */
  public static double[] finiteSorted(double[] array) {
    double[] out = new double[array.length];
    int n = 0;
    for (double v : array) {
      if (!Double.isNaN(v)) {
        out[n++] = v;
      }
    }
    out = Arrays.copyOf(out, n);
    Arrays.sort(out);
    return out;
  }

  public static double nanMin(double[] array) {
    double min = Double.NaN;
    for (double v : array) {
      if (!Double.isNaN(v) && (Double.isNaN(min) || v < min)) {
        min = v;
      }
    }
    return min;
  }

  public static double nanMax(double[] array) {
    double max = Double.NaN;
    for (double v : array) {
      if (!Double.isNaN(v) && (Double.isNaN(max) || v > max)) {
        max = v;
      }
    }
    return max;
  }

  /** Propagates the last non-NaN value forward, in place. Returns the array. */
  public static double[] ffill(double[] array) {
    double last = Double.NaN;
    for (int i = 0; i < array.length; i++) {
      if (Double.isNaN(array[i])) {
        array[i] = last;
      } else {
        last = array[i];
      }
    }
    return array;
  }

  /** Propagates the next non-NaN value backward, in place. Returns the array. */
  public static double[] bfill(double[] array) {
    double next = Double.NaN;
    for (int i = array.length - 1; i >= 0; i--) {
      if (Double.isNaN(array[i])) {
        array[i] = next;
      } else {
        next = array[i];
      }
    }
    return array;
  }

  /**
   * Trailing rolling mean ignoring NaN, requiring at least minPeriods values in the window.
   */
  public static double[] rollingMean(double[] array, int window, int minPeriods) {
    double[] out = new double[array.length];
    double sum = 0;
    int n = 0;
    for (int i = 0; i < array.length; i++) {
      if (!Double.isNaN(array[i])) {
        sum += array[i];
        n++;
      }
      if (i >= window && !Double.isNaN(array[i - window])) {
        sum -= array[i - window];
        n--;
      }
      out[i] = n >= minPeriods && n > 0 ? sum / n : Double.NaN;
    }
    return out;
  }

  /** Trailing rolling sample standard deviation (ddof 1), NaN where fewer than minPeriods. */
  public static double[] rollingStd(double[] array, int window, int minPeriods) {
    double[] out = new double[array.length];
    for (int i = 0; i < array.length; i++) {
      int start = Math.max(0, i - window + 1);
      double mean = nanMean(array, start, i + 1);
      double ss = 0;
      int n = 0;
      for (int j = start; j <= i; j++) {
        if (!Double.isNaN(array[j])) {
          ss += (array[j] - mean) * (array[j] - mean);
          n++;
        }
      }
      out[i] = n >= Math.max(minPeriods, 2) ? Math.sqrt(ss / (n - 1)) : Double.NaN;
    }
    return out;
  }

  public static double[] cumsum(double[] array) {
    double[] out = new double[array.length];
    double sum = 0;
    for (int i = 0; i < array.length; i++) {
      sum += array[i];
      out[i] = sum;
    }
    return out;
  }

  public static double[] fill(int length, double value) {
    double[] out = new double[length];
    Arrays.fill(out, value);
    return out;
  }

  /** Deep copy of a rectangular array. */
  public static double[][] copy(double[][] array) {
    double[][] out = new double[array.length][];
    for (int i = 0; i < array.length; i++) {
      out[i] = array[i].clone();
    }
    return out;
  }

  public static double[][] transpose(double[][] array) {
    if (array.length == 0) {
      return new double[0][0];
    }
    double[][] out = new double[array[0].length][array.length];
    for (int i = 0; i < array.length; i++) {
      for (int j = 0; j < array[i].length; j++) {
        out[j][i] = array[i][j];
      }
    }
    return out;
  }

  /** Index of the first element of the sorted array that is not less than value. */
  public static int searchSorted(double[] sorted, double value) {
    int lo = 0;
    int hi = sorted.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (sorted[mid] < value) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }
}
