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

import com.google.common.base.Preconditions;

import org.apache.commons.math.MathException;
import org.apache.commons.math.distribution.ChiSquaredDistributionImpl;
import org.apache.commons.math.distribution.ContinuousDistribution;
import org.apache.commons.math.distribution.GammaDistributionImpl;
import org.apache.commons.math.distribution.NormalDistributionImpl;

/**
 * Cumulative and quantile functions of the few continuous distributions in use, with the
 * checked {@link MathException} of the series expansions turned into an unchecked one.
 */
public final class Distributions {
  private Distributions() {}

  private static final NormalDistributionImpl STANDARD_NORMAL = new NormalDistributionImpl(0, 1);

  public static double normalCdf(double x) {
    if (Double.isNaN(x)) {
      return Double.NaN;
    }
    return cdf(STANDARD_NORMAL, x);
  }

  /** Upper tail probability of the standard normal. */
  public static double normalSf(double x) {
    if (Double.isNaN(x)) {
      return Double.NaN;
    }
    // symmetric, keeps precision far in the upper tail
    return cdf(STANDARD_NORMAL, -x);
  }

  public static double normalPpf(double p) {
    Preconditions.checkArgument(p > 0 && p < 1, "probability must be in (0, 1), got %s", p);
    try {
      return STANDARD_NORMAL.inverseCumulativeProbability(p);
    } catch (MathException e) {
      throw new IllegalStateException("normal quantile failed for " + p, e);
    }
  }

  public static double chiSquaredSf(double x, double degreesOfFreedom) {
    if (Double.isNaN(x)) {
      return Double.NaN;
    }
    if (x <= 0) {
      return 1;
    }
    return 1 - cdf(new ChiSquaredDistributionImpl(degreesOfFreedom), x);
  }

  /** Upper tail of the gamma distribution with the given shape, location and scale. */
  public static double gammaSf(double x, double shape, double loc, double scale) {
    if (Double.isNaN(x)) {
      return Double.NaN;
    }
    double z = x - loc;
    if (z <= 0) {
      return 1;
    }
    return 1 - cdf(new GammaDistributionImpl(shape, scale), z);
  }

  private static double cdf(ContinuousDistribution d, double x) {
    try {
      return d.cumulativeProbability(x);
    } catch (MathException e) {
      throw new IllegalStateException("cumulative probability failed for " + x, e);
    }
  }
}
