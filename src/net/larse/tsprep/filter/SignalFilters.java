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

import org.apache.commons.math.complex.Complex;
import org.apache.commons.math.transform.FastFourierTransformer;

/**
 * Small signal processing helpers: discrete Fourier transforms, the analytic signal envelope,
 * the local Wiener filter and exponentially weighted moving averages.
 */
public final class SignalFilters {
  private SignalFilters() {}

  /** Forward DFT, radix-2 when the length is a power of two, direct summation otherwise. */
  public static Complex[] fft(double[] x) {
    if (FastFourierTransformer.isPowerOf2(x.length)) {
      return new FastFourierTransformer().transform(x);
    }
    return dft(toComplex(x), -1);
  }

  /** Inverse DFT including the 1/n scaling. */
  public static Complex[] ifft(Complex[] x) {
    if (FastFourierTransformer.isPowerOf2(x.length)) {
      return new FastFourierTransformer().inversetransform(x);
    }
    Complex[] y = dft(x, 1);
    for (int i = 0; i < y.length; i++) {
      y[i] = new Complex(y[i].getReal() / x.length, y[i].getImaginary() / x.length);
    }
    return y;
  }

  private static Complex[] toComplex(double[] x) {
    Complex[] c = new Complex[x.length];
    for (int i = 0; i < x.length; i++) {
      c[i] = new Complex(x[i], 0);
    }
    return c;
  }

  private static Complex[] dft(Complex[] x, int sign) {
    int n = x.length;
    Complex[] out = new Complex[n];
    for (int k = 0; k < n; k++) {
      double re = 0;
      double im = 0;
      for (int t = 0; t < n; t++) {
        double angle = sign * 2 * Math.PI * ((long) k * t % n) / n;
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        re += x[t].getReal() * c - x[t].getImaginary() * s;
        im += x[t].getReal() * s + x[t].getImaginary() * c;
      }
      out[k] = new Complex(re, im);
    }
    return out;
  }

  /** Sample frequencies of a length-n DFT with sample spacing d, in DFT order. */
  public static double[] fftFreq(int n, double d) {
    double[] f = new double[n];
    int positive = (n - 1) / 2;
    for (int i = 0; i <= positive; i++) {
      f[i] = i / (n * d);
    }
    for (int i = positive + 1; i < n; i++) {
      f[i] = (i - n) / (n * d);
    }
    return f;
  }

  /** Magnitude of the analytic signal, the instantaneous envelope of x. */
  public static double[] hilbertEnvelope(double[] x) {
    int n = x.length;
    if (n == 0) {
      return new double[0];
    }
    Complex[] spectrum = fft(x);
    double[] h = new double[n];
    h[0] = 1;
    if (n % 2 == 0) {
      h[n / 2] = 1;
      for (int i = 1; i < n / 2; i++) {
        h[i] = 2;
      }
    } else {
      for (int i = 1; i < (n + 1) / 2; i++) {
        h[i] = 2;
      }
    }
    Complex[] weighted = new Complex[n];
    for (int i = 0; i < n; i++) {
      weighted[i] = new Complex(spectrum[i].getReal() * h[i], spectrum[i].getImaginary() * h[i]);
    }
    Complex[] analytic = ifft(weighted);
    double[] out = new double[n];
    for (int i = 0; i < n; i++) {
      out[i] = analytic[i].abs();
    }
    return out;
  }

  /**
   * Local Wiener filter over a window of the given odd size, with zero padding at the ends.
   * The noise power is the mean of the local variances.
   */
  public static double[] wiener(double[] x, int size) {
    Preconditions.checkArgument(size % 2 == 1, "window size must be odd, got %s", size);
    int n = x.length;
    int half = size / 2;
    double[] mean = new double[n];
    double[] var = new double[n];
    double noise = 0;
    for (int t = 0; t < n; t++) {
      double s = 0;
      double s2 = 0;
      for (int k = -half; k <= half; k++) {
        int i = t + k;
        if (i >= 0 && i < n) {
          s += x[i];
          s2 += x[i] * x[i];
        }
      }
      mean[t] = s / size;
      var[t] = s2 / size - mean[t] * mean[t];
      noise += var[t];
    }
    noise /= n;
    double[] out = new double[n];
    for (int t = 0; t < n; t++) {
      if (var[t] < noise) {
        out[t] = mean[t];
      } else {
        out[t] = (x[t] - mean[t]) * (1 - noise / var[t]) + mean[t];
      }
    }
    return out;
  }

  /**
   * Exponentially weighted mean with {@code alpha = 2 / (span + 1)}, each output the weighted
   * average of all observations so far. Missing values keep decaying the earlier weights.
   */
  public static double[] ewma(double[] x, double span) {
    Preconditions.checkArgument(span >= 1, "span must be >= 1, got %s", span);
    double alpha = 2.0 / (span + 1.0);
    double decay = 1 - alpha;
    double num = 0;
    double den = 0;
    double[] out = new double[x.length];
    for (int t = 0; t < x.length; t++) {
      num *= decay;
      den *= decay;
      if (!Double.isNaN(x[t])) {
        num += x[t];
        den += 1;
      }
      out[t] = den > 0 ? num / den : Double.NaN;
    }
    return out;
  }
}
