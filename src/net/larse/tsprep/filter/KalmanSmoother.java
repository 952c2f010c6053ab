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

import java.util.Random;

import net.larse.tsprep.helper.WeightedChoice;

/**
 * Linear Gaussian state space filter with Rauch-Tung-Striebel smoothing of a univariate
 * observation sequence.
 *
 * <p>State {@code x[t] = F x[t-1] + w}, {@code w ~ N(0, Q)}; observation
 * {@code y[t] = H x[t] + v}, {@code v ~ N(0, R)}. Missing observations skip the update
 * step. The initial state is diffuse, centered on the first observation.
 */
public final class KalmanSmoother {
  private static final double DIFFUSE_SCALE = 1e4;

  private final SimpleMatrix f;
  private final SimpleMatrix q;
  private final SimpleMatrix h;
  private final double r;

  /**
   * @param stateTransition F, square
   * @param processNoise Q, same shape as F
   * @param observationModel H, a single row with as many columns as F
   * @param observationNoise R, the observation variance
   */
  public KalmanSmoother(double[][] stateTransition, double[][] processNoise,
      double[][] observationModel, double observationNoise) {
    int dim = stateTransition.length;
    Preconditions.checkArgument(stateTransition[0].length == dim,
        "state transition must be square");
    Preconditions.checkArgument(processNoise.length == dim && processNoise[0].length == dim,
        "process noise must match the state dimension %s", dim);
    Preconditions.checkArgument(observationModel.length == 1
        && observationModel[0].length == dim,
        "observation model must be a single row of %s values", dim);
    this.f = new SimpleMatrix(stateTransition);
    this.q = new SimpleMatrix(processNoise);
    this.h = new SimpleMatrix(observationModel);
    this.r = observationNoise;
  }

  public int stateDimension() {
    return f.numRows();
  }

  /** Smoothed means of the observations, H times the smoothed state. */
  public double[] smooth(double[] y) {
    int n = y.length;
    int dim = f.numRows();
    if (n == 0) {
      return new double[0];
    }
    SimpleMatrix[] predMean = new SimpleMatrix[n];
    SimpleMatrix[] predCov = new SimpleMatrix[n];
    SimpleMatrix[] filtMean = new SimpleMatrix[n];
    SimpleMatrix[] filtCov = new SimpleMatrix[n];

    double first = Double.NaN;
    double scale = 0;
    for (double v : y) {
      if (!Double.isNaN(v)) {
        if (Double.isNaN(first)) {
          first = v;
        }
        scale = Math.max(scale, Math.abs(v));
      }
    }
    if (Double.isNaN(first)) {
      return y.clone();
    }
    SimpleMatrix hPinv = h.pseudoInverse();
    SimpleMatrix mean = hPinv.scale(first);
    SimpleMatrix cov =
        SimpleMatrix.identity(dim).scale(DIFFUSE_SCALE * Math.max(1, scale * scale));

    for (int t = 0; t < n; t++) {
      if (t > 0) {
        mean = f.mult(filtMean[t - 1]);
        cov = f.mult(filtCov[t - 1]).mult(f.transpose()).plus(q);
      }
      predMean[t] = mean;
      predCov[t] = cov;
      if (Double.isNaN(y[t])) {
        filtMean[t] = mean;
        filtCov[t] = cov;
        continue;
      }
      double innovation = y[t] - h.mult(mean).get(0, 0);
      double s = h.mult(cov).mult(h.transpose()).get(0, 0) + r;
      SimpleMatrix gain = cov.mult(h.transpose()).divide(s);
      filtMean[t] = mean.plus(gain.scale(innovation));
      filtCov[t] = SimpleMatrix.identity(dim).minus(gain.mult(h)).mult(cov);
    }

    SimpleMatrix smoothMean = filtMean[n - 1];
    double[] out = new double[n];
    out[n - 1] = h.mult(smoothMean).get(0, 0);
    for (int t = n - 2; t >= 0; t--) {
      SimpleMatrix gain = filtCov[t].mult(f.transpose()).mult(predCov[t + 1].pseudoInverse());
      smoothMean = filtMean[t].plus(gain.mult(smoothMean.minus(predMean[t + 1])));
      out[t] = h.mult(smoothMean).get(0, 0);
    }
    return out;
  }

  /**
   * A random stable state space: transition entries scaled so the absolute row sums stay below
   * one, a positive definite process noise, a 0/1 observation row with at least one 1 and a
   * noise level from a small catalog.
   */
  public static KalmanSmoother randomStateSpace(Random random) {
    int[] dims = {1, 2, 3, 4, 8};
    double[] dimWeights = {0.1, 0.2, 0.3, 0.4, 0.3};
    int dim = dims[WeightedChoice.chooseIndex(random, dimWeights)];
    double[][] st = new double[dim][dim];
    double maxRow = 0;
    for (int i = 0; i < dim; i++) {
      double row = 0;
      for (int j = 0; j < dim; j++) {
        st[i][j] = random.nextDouble();
        row += st[i][j];
      }
      maxRow = Math.max(maxRow, row);
    }
    for (int i = 0; i < dim; i++) {
      for (int j = 0; j < dim; j++) {
        st[i][j] /= maxRow * 1.01;
      }
    }
    double[][] b = new double[dim][dim];
    for (int i = 0; i < dim; i++) {
      for (int j = 0; j < dim; j++) {
        b[i][j] = random.nextDouble() * 0.3;
      }
    }
    SimpleMatrix bm = new SimpleMatrix(b);
    double[][] noise =
        toArray(bm.mult(bm.transpose()).plus(SimpleMatrix.identity(dim).scale(0.01)));
    double[][] obs = new double[1][dim];
    boolean any = false;
    for (int j = 0; j < dim; j++) {
      obs[0][j] = random.nextBoolean() ? 1 : 0;
      any |= obs[0][j] == 1;
    }
    if (!any) {
      obs[0][random.nextInt(dim)] = 1;
    }
    double[] obsNoise = {1.0, 0.5, 0.1, 2.0};
    return new KalmanSmoother(st, noise, obs, obsNoise[random.nextInt(obsNoise.length)]);
  }

  public double[][] stateTransition() {
    return toArray(f);
  }

  public double[][] processNoise() {
    return toArray(q);
  }

  public double[][] observationModel() {
    return toArray(h);
  }

  public double observationNoise() {
    return r;
  }

  private static double[][] toArray(SimpleMatrix m) {
    double[][] out = new double[m.numRows()][m.numCols()];
    for (int i = 0; i < m.numRows(); i++) {
      for (int j = 0; j < m.numCols(); j++) {
        out[i][j] = m.get(i, j);
      }
    }
    return out;
  }
}
