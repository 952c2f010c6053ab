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

import org.ejml.simple.SimpleMatrix;

import net.larse.tsprep.helper.FitGenerator;

/**
 * Savitzky-Golay smoothing: a least-squares polynomial is fit in a sliding window and
 * evaluated (or differentiated) at the window center.
 */
public final class SavitzkyGolayFilter {
  /** Handling of the window where it runs over the ends of the series. */
  public enum Mode {
    /** Reflect about the end points without repeating them. */
    MIRROR,
    /** Repeat the end values. */
    NEAREST,
    /** Fit one polynomial to the first and last full window and evaluate it there. */
    INTERP
  }

  private final int windowLength;
  private final int polyorder;
  private final int deriv;
  private final Mode mode;
  private final double[] coeffs;

  public SavitzkyGolayFilter(int windowLength, int polyorder, int deriv, Mode mode) {
    Preconditions.checkArgument(windowLength % 2 == 1 && windowLength > 0,
        "window_length must be a positive odd integer, got %s", windowLength);
    Preconditions.checkArgument(polyorder < windowLength,
        "polyorder must be less than window_length");
    Preconditions.checkArgument(deriv >= 0, "deriv must be non-negative");
    this.windowLength = windowLength;
    this.polyorder = polyorder;
    this.deriv = deriv;
    this.mode = mode;
    this.coeffs = coefficients();
  }

  /** Convolution weights for the window center, in window order. */
  private double[] coefficients() {
    int half = windowLength / 2;
    double[] out = new double[windowLength];
    if (deriv > polyorder) {
      return out;
    }
    SimpleMatrix a = new SimpleMatrix(windowLength, polyorder + 1);
    for (int i = 0; i < windowLength; i++) {
      for (int j = 0; j <= polyorder; j++) {
        a.set(i, j, Math.pow(i - half, j));
      }
    }
    SimpleMatrix pinv = a.pseudoInverse();
    double fact = factorial(deriv);
    for (int i = 0; i < windowLength; i++) {
      out[i] = fact * pinv.get(deriv, i);
    }
    return out;
  }

  private static double factorial(int k) {
    double f = 1;
    for (int i = 2; i <= k; i++) {
      f *= i;
    }
    return f;
  }

  public double[] filter(double[] x) {
    int n = x.length;
    int half = windowLength / 2;
    if (mode == Mode.INTERP) {
      Preconditions.checkArgument(n >= windowLength,
          "interp mode needs at least window_length=%s values, got %s", windowLength, n);
    }
    double[] y = new double[n];
    for (int t = 0; t < n; t++) {
      double s = 0;
      for (int k = 0; k < windowLength; k++) {
        s += coeffs[k] * at(x, t - half + k);
      }
      y[t] = s;
    }
    if (mode == Mode.INTERP) {
      fitEdge(x, y, 0, 0, half);
      fitEdge(x, y, n - windowLength, n - half, n);
    }
    return y;
  }

  private double at(double[] x, int i) {
    int n = x.length;
    if (i >= 0 && i < n) {
      return x[i];
    }
    if (mode == Mode.NEAREST || n == 1) {
      return i < 0 ? x[0] : x[n - 1];
    }
    // mirror, also used for the interior pass of interp whose edges are overwritten
    int period = 2 * (n - 1);
    int j = Math.abs(i) % period;
    return j < n ? x[j] : x[period - j];
  }

  /** Overwrites y[from..to) with the polynomial fit to x[start..start+window). */
  private void fitEdge(double[] x, double[] y, int start, int from, int to) {
    int degree = Math.min(polyorder, windowLength - 1);
    double[][] a = new double[windowLength][degree + 1];
    double[][] b = new double[windowLength][1];
    for (int i = 0; i < windowLength; i++) {
      for (int j = 0; j <= degree; j++) {
        a[i][j] = Math.pow(i, j);
      }
      b[i][0] = x[start + i];
    }
    double[][] c = FitGenerator.lstsq(a, b);
    for (int t = from; t < to; t++) {
      double u = t - start;
      double v = 0;
      for (int j = deriv; j <= degree; j++) {
        v += c[j][0] * factorial(j) / factorial(j - deriv) * Math.pow(u, j - deriv);
      }
      y[t] = v;
    }
  }
}
