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
package net.larse.tsprep.transforms;

import com.google.common.collect.ImmutableList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Random;

import net.larse.tsprep.exception.MultivariateRequiredException;
import net.larse.tsprep.exception.TransformException;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.Matrices;
import net.larse.tsprep.helper.SymmetricEigen;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Independent component analysis by the FastICA fixed point iteration, fit jointly over all
 * series with as many components as series. The inverse applies the mixing matrix.
 */
public class FastICA extends AbstractTransformer<FastICA.Args> {
  private static final Logger LOG = LogManager.getLogger(FastICA.class);

  public static final String NAME = "FastICA";
  static final int MAX_SERIES = 500;

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "parallel or deflation.")
    @Optional
    public String algorithm = "parallel";

    @Doc(help = "Contrast function: logcosh, exp or cube.")
    @Optional
    public String fun = "logcosh";

    @Doc(help = "Maximum number of iterations.")
    @Optional
    public int maxIter = 200;

    @Doc(help = "Whiten the data before the iteration.")
    @Optional
    public boolean whiten = true;

    @Doc(help = "Convergence tolerance.")
    @Optional
    public double tol = 1e-4;

    @Doc(help = "Seed of the initial unmixing matrix.")
    @Optional
    public long randomSeed = 2020;

    @Override
    protected void checkValues() {
      if (!algorithm.equals("parallel") && !algorithm.equals("deflation")) {
        throw new IllegalArgumentException("algorithm must be parallel or deflation");
      }
      if (!ImmutableList.of("logcosh", "exp", "cube").contains(fun)) {
        throw new IllegalArgumentException("unknown fun " + fun);
      }
    }
  }

  private String[] columns;
  private double[] mean;
  // sources = (x - mean) * unmixing'
  private double[][] unmixing;
  private double[][] mixing;

  public FastICA(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.algorithm = WeightedChoice.uniform(random, "parallel", "deflation");
    a.fun = WeightedChoice.uniform(random, "logcosh", "exp", "cube");
    a.maxIter = WeightedChoice.choose(random, ImmutableList.of(100, 250, 500), 0.2, 0.7, 0.1);
    a.whiten = WeightedChoice.choose(random, ImmutableList.of(true, false), 0.9, 0.1);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    int p = df.cols();
    if (p < 2) {
      throw new MultivariateRequiredException(NAME, p);
    }
    if (p > MAX_SERIES) {
      throw new TransformException(NAME, "FastICA fails with > " + MAX_SERIES + " series");
    }
    columns = df.columns();
    double[][] x = df.rowData();
    int n = x.length;
    mean = args.whiten ? Matrices.columnMeans(x) : new double[p];
    double[][] xc = new double[n][p];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < p; j++) {
        xc[i][j] = x[i][j] - mean[j];
      }
    }
    double[][] whitening = Matrices.identity(p);
    if (args.whiten) {
      double[][] cov = Matrices.multiply(ArrayHelper.transpose(xc), xc);
      for (double[] row : cov) {
        for (int j = 0; j < p; j++) {
          row[j] /= n;
        }
      }
      whitening = SymmetricEigen.inverseSqrt(cov);
    }
    double[][] x1 = Matrices.multiply(xc, whitening);
    Random random = new Random(args.randomSeed);
    double[][] w = new double[p][p];
    for (int i = 0; i < p; i++) {
      for (int j = 0; j < p; j++) {
        w[i][j] = random.nextGaussian();
      }
    }
    w = args.algorithm.equals("parallel") ? parallel(x1, w) : deflation(x1, w);
    unmixing = Matrices.multiply(w, whitening);
    mixing = Matrices.pseudoInverse(unmixing);
  }

  private double[][] parallel(double[][] x, double[][] w0) {
    int n = x.length;
    int p = w0.length;
    double[][] w = symmetricDecorrelation(w0);
    for (int iter = 0; iter < args.maxIter; iter++) {
      double[][] u = Matrices.multiply(x, ArrayHelper.transpose(w));
      double[][] w1 = new double[p][p];
      double[] gPrimeMean = new double[p];
      for (int i = 0; i < n; i++) {
        for (int k = 0; k < p; k++) {
          double[] g = contrast(u[i][k]);
          gPrimeMean[k] += g[1] / n;
          for (int j = 0; j < p; j++) {
            w1[k][j] += g[0] * x[i][j] / n;
          }
        }
      }
      for (int k = 0; k < p; k++) {
        for (int j = 0; j < p; j++) {
          w1[k][j] -= gPrimeMean[k] * w[k][j];
        }
      }
      w1 = symmetricDecorrelation(w1);
      double lim = 0;
      for (int k = 0; k < p; k++) {
        double dot = 0;
        for (int j = 0; j < p; j++) {
          dot += w1[k][j] * w[k][j];
        }
        lim = Math.max(lim, Math.abs(Math.abs(dot) - 1));
      }
      w = w1;
      if (lim < args.tol) {
        return w;
      }
    }
    LOG.warn("FastICA did not converge in {} iterations", args.maxIter);
    return w;
  }

  private double[][] deflation(double[][] x, double[][] w0) {
    int n = x.length;
    int p = w0.length;
    double[][] w = new double[p][];
    for (int k = 0; k < p; k++) {
      double[] v = normalize(w0[k].clone());
      boolean converged = false;
      for (int iter = 0; iter < args.maxIter && !converged; iter++) {
        double[] v1 = new double[p];
        double gPrimeMean = 0;
        for (int i = 0; i < n; i++) {
          double u = 0;
          for (int j = 0; j < p; j++) {
            u += v[j] * x[i][j];
          }
          double[] g = contrast(u);
          gPrimeMean += g[1] / n;
          for (int j = 0; j < p; j++) {
            v1[j] += g[0] * x[i][j] / n;
          }
        }
        for (int j = 0; j < p; j++) {
          v1[j] -= gPrimeMean * v[j];
        }
        // Gram-Schmidt against the components already found
        for (int m = 0; m < k; m++) {
          double dot = 0;
          for (int j = 0; j < p; j++) {
            dot += v1[j] * w[m][j];
          }
          for (int j = 0; j < p; j++) {
            v1[j] -= dot * w[m][j];
          }
        }
        v1 = normalize(v1);
        double dot = 0;
        for (int j = 0; j < p; j++) {
          dot += v1[j] * v[j];
        }
        converged = Math.abs(Math.abs(dot) - 1) < args.tol;
        v = v1;
      }
      if (!converged) {
        LOG.warn("FastICA component {} did not converge in {} iterations", k, args.maxIter);
      }
      w[k] = v;
    }
    return w;
  }

  /** g and its derivative at u. */
  private double[] contrast(double u) {
    switch (args.fun) {
      case "exp":
        double e = Math.exp(-u * u / 2);
        return new double[] {u * e, (1 - u * u) * e};
      case "cube":
        return new double[] {u * u * u, 3 * u * u};
      default:
        double t = Math.tanh(u);
        return new double[] {t, 1 - t * t};
    }
  }

  /** {@code (w w')^-1/2 w}. */
  private static double[][] symmetricDecorrelation(double[][] w) {
    double[][] gram = Matrices.multiply(w, ArrayHelper.transpose(w));
    return Matrices.multiply(SymmetricEigen.inverseSqrt(gram), w);
  }

  private static double[] normalize(double[] v) {
    double norm = 0;
    for (double d : v) {
      norm += d * d;
    }
    norm = Math.sqrt(norm);
    for (int j = 0; j < v.length; j++) {
      v[j] /= norm;
    }
    return v;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    double[][] x = df.rowData();
    for (double[] row : x) {
      for (int j = 0; j < row.length; j++) {
        row[j] -= mean[j];
      }
    }
    double[][] s = Matrices.multiply(x, ArrayHelper.transpose(unmixing));
    return TimeSeriesFrame.fromRows(df.index(), PCA.rankNames(unmixing.length), s);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    double[][] out = Matrices.multiply(df.rowData(), ArrayHelper.transpose(mixing));
    for (double[] row : out) {
      for (int j = 0; j < row.length; j++) {
        row[j] += mean[j];
      }
    }
    return TimeSeriesFrame.fromRows(df.index(), columns, out);
  }
}
