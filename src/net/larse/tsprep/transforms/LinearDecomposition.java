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

import net.larse.tsprep.exception.MultivariateRequiredException;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.Matrices;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * A square linear map fit jointly across all series. The forward transform multiplies every
 * row by the component matrix; the inverse solves the same system in the least squares sense.
 * Column names are kept.
 */
abstract class LinearDecomposition<A extends AlgorithmBase.ArgsBase>
    extends AbstractTransformer<A> {
  // components[k] is the k-th component over the series
  private double[][] components;
  private double[][] backProjection;

  protected LinearDecomposition(String name, A args) {
    super(name, args);
  }

  @Override
  protected final void doFit(TimeSeriesFrame df) {
    if (df.cols() < 2) {
      throw new MultivariateRequiredException(name(), df.cols());
    }
    components = components(df.rowData());
    backProjection = Matrices.pseudoInverse(components);
  }

  /** The components as rows, one per series. */
  protected abstract double[][] components(double[][] rows);

  double[][] components() {
    return components;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    return df.withRows(apply(components, df.rowData()));
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    return df.withRows(apply(backProjection, df.rowData()));
  }

  private static double[][] apply(double[][] m, double[][] rows) {
    double[][] out = new double[rows.length][];
    for (int i = 0; i < rows.length; i++) {
      out[i] = Matrices.multiply(m, rows[i]);
    }
    return out;
  }
}
