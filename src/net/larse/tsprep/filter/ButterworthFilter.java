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

import java.util.ArrayList;
import java.util.List;

/**
 * Digital Butterworth filter designed as cascaded second-order sections and applied forward
 * and backward for zero phase.
 *
 * <p>The design follows the usual route: analog prototype poles on the unit circle, frequency
 * pre-warping, low-pass or high-pass transformation, bilinear transform with sampling rate 2,
 * then pairing of conjugate poles into sections. The cutoff is normalized so that 1 is the
 * Nyquist frequency.
 */
public final class ButterworthFilter {
  /** Pass band of the filter. */
  public enum BandType {
    LOWPASS, HIGHPASS
  }

  /** Rows of {b0, b1, b2, 1, a1, a2}. */
  private final double[][] sos;

  public ButterworthFilter(int order, double cutoff, BandType type) {
    Preconditions.checkArgument(order >= 1, "filter order must be positive, got %s", order);
    Preconditions.checkArgument(cutoff > 0 && cutoff < 1,
        "cutoff must be in (0, 1), got %s", cutoff);
    this.sos = design(order, cutoff, type);
  }

  /** The second-order sections, one row of {b0, b1, b2, 1, a1, a2} per section. */
  public double[][] sections() {
    double[][] out = new double[sos.length][];
    for (int i = 0; i < sos.length; i++) {
      out[i] = sos[i].clone();
    }
    return out;
  }

  private static double[][] design(int order, double cutoff, BandType type) {
    // analog prototype
    List<Complex> poles = new ArrayList<>();
    for (int k = 0; k < order; k++) {
      double theta = Math.PI * (2 * k + order + 1) / (2.0 * order);
      poles.add(new Complex(Math.cos(theta), Math.sin(theta)));
    }
    double fs = 2.0;
    double warped = 2 * fs * Math.tan(Math.PI * cutoff / fs);

    List<Complex> zeros = new ArrayList<>();
    double gain;
    if (type == BandType.LOWPASS) {
      List<Complex> scaled = new ArrayList<>();
      for (Complex p : poles) {
        scaled.add(p.multiply(new Complex(warped, 0)));
      }
      poles = scaled;
      gain = Math.pow(warped, order);
    } else {
      List<Complex> inverted = new ArrayList<>();
      Complex prod = Complex.ONE;
      for (Complex p : poles) {
        inverted.add(new Complex(warped, 0).divide(p));
        prod = prod.multiply(p.negate());
      }
      poles = inverted;
      for (int k = 0; k < order; k++) {
        zeros.add(Complex.ZERO);
      }
      gain = Complex.ONE.divide(prod).getReal();
    }

    // bilinear transform
    double fs2 = 2 * fs;
    Complex numer = Complex.ONE;
    Complex denom = Complex.ONE;
    List<Complex> zd = new ArrayList<>();
    List<Complex> pd = new ArrayList<>();
    for (Complex z : zeros) {
      zd.add(new Complex(fs2, 0).add(z).divide(new Complex(fs2, 0).subtract(z)));
      numer = numer.multiply(new Complex(fs2, 0).subtract(z));
    }
    for (Complex p : poles) {
      pd.add(new Complex(fs2, 0).add(p).divide(new Complex(fs2, 0).subtract(p)));
      denom = denom.multiply(new Complex(fs2, 0).subtract(p));
    }
    while (zd.size() < pd.size()) {
      zd.add(new Complex(-1, 0));
    }
    double k = gain * numer.divide(denom).getReal();

    // every zero sits at +1 or -1, so sections pair a conjugate pole pair with two zeros
    int nSections = (order + 1) / 2;
    double[][] out = new double[nSections][6];
    double zeroAt = zd.get(0).getReal();
    List<Complex> upper = new ArrayList<>();
    Complex real = null;
    for (Complex p : pd) {
      if (Math.abs(p.getImaginary()) < 1e-12) {
        real = p;
      } else if (p.getImaginary() > 0) {
        upper.add(p);
      }
    }
    // sections ordered with the poles closest to the unit circle last
    upper.sort((a, b) -> Double.compare(a.abs(), b.abs()));
    int s = 0;
    if (real != null) {
      out[s][0] = 1;
      out[s][1] = -zeroAt;
      out[s][2] = 0;
      out[s][3] = 1;
      out[s][4] = -real.getReal();
      out[s][5] = 0;
      s++;
    }
    for (Complex p : upper) {
      out[s][0] = 1;
      out[s][1] = -2 * zeroAt;
      out[s][2] = zeroAt * zeroAt;
      out[s][3] = 1;
      out[s][4] = -2 * p.getReal();
      out[s][5] = p.abs() * p.abs();
      s++;
    }
    out[0][0] *= k;
    out[0][1] *= k;
    out[0][2] *= k;
    return out;
  }

  /** Causal filtering with the given initial section states, {@code zi[section][2]}. */
  static double[] sosfilt(double[][] sos, double[] x, double[][] zi) {
    double[] y = x.clone();
    for (int s = 0; s < sos.length; s++) {
      double b0 = sos[s][0];
      double b1 = sos[s][1];
      double b2 = sos[s][2];
      double a1 = sos[s][4];
      double a2 = sos[s][5];
      double z0 = zi[s][0];
      double z1 = zi[s][1];
      for (int i = 0; i < y.length; i++) {
        double xi = y[i];
        double yi = b0 * xi + z0;
        z0 = b1 * xi - a1 * yi + z1;
        z1 = b2 * xi - a2 * yi;
        y[i] = yi;
      }
    }
    return y;
  }

  /** Steady-state section states for a unit step input. */
  static double[][] sosfiltZi(double[][] sos) {
    double[][] zi = new double[sos.length][2];
    double scale = 1.0;
    for (int s = 0; s < sos.length; s++) {
      double b0 = sos[s][0];
      double b1 = sos[s][1];
      double b2 = sos[s][2];
      double a1 = sos[s][4];
      double a2 = sos[s][5];
      // (I - A^T) z = b[1:] - a[1:] * b0 with A the companion matrix of a
      double r0 = b1 - a1 * b0;
      double r1 = b2 - a2 * b0;
      double m00 = 1 + a1;
      double m01 = -1;
      double m10 = a2;
      double m11 = 1;
      double det = m00 * m11 - m01 * m10;
      zi[s][0] = scale * (r0 * m11 - m01 * r1) / det;
      zi[s][1] = scale * (m00 * r1 - m10 * r0) / det;
      scale *= (b0 + b1 + b2) / (1 + a1 + a2);
    }
    return zi;
  }

  /**
   * Zero-phase filtering: odd extension at both ends, forward pass, backward pass.
   *
   * @throws IllegalArgumentException if x is not longer than the padding
   */
  public double[] filtfilt(double[] x) {
    int zerosB = 0;
    int zerosA = 0;
    for (double[] row : sos) {
      zerosB += row[2] == 0 ? 1 : 0;
      zerosA += row[5] == 0 ? 1 : 0;
    }
    int padlen = 3 * (2 * sos.length + 1 - Math.min(zerosB, zerosA));
    int n = x.length;
    Preconditions.checkArgument(n > padlen,
        "The length of the input must be greater than %s, got %s", padlen, n);
    double[] ext = new double[n + 2 * padlen];
    for (int i = 0; i < padlen; i++) {
      ext[i] = 2 * x[0] - x[padlen - i];
      ext[n + padlen + i] = 2 * x[n - 1] - x[n - 2 - i];
    }
    System.arraycopy(x, 0, ext, padlen, n);

    double[][] zi = sosfiltZi(sos);
    double[] fwd = sosfilt(sos, ext, scaled(zi, ext[0]));
    double[] rev = reverse(fwd);
    double[] bwd = sosfilt(sos, rev, scaled(zi, rev[0]));
    double[] y = reverse(bwd);
    double[] out = new double[n];
    System.arraycopy(y, padlen, out, 0, n);
    return out;
  }

  private static double[][] scaled(double[][] zi, double v) {
    double[][] out = new double[zi.length][2];
    for (int s = 0; s < zi.length; s++) {
      out[s][0] = zi[s][0] * v;
      out[s][1] = zi[s][1] * v;
    }
    return out;
  }

  private static double[] reverse(double[] x) {
    double[] r = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      r[i] = x[x.length - 1 - i];
    }
    return r;
  }
}
