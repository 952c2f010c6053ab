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
package net.larse.tsprep.transforms.scalers;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import net.larse.tsprep.transforms.AbstractTransformer;

/**
 * A per-series {@code (x - center) / scale}. A zero or undefined scale is replaced by 1 so
 * constant series pass through shifted only.
 */
abstract class AffineScaler<A extends AlgorithmBase.ArgsBase> extends AbstractTransformer<A> {
  private double[] center;
  private double[] scale;

  AffineScaler(String name, A args) {
    super(name, args);
  }

  /** The center of one series. */
  protected abstract double center(double[] column);

  /** The scale of one series. */
  protected abstract double scale(double[] column);

  @Override
  protected void doFit(TimeSeriesFrame df) {
    center = new double[df.cols()];
    scale = new double[df.cols()];
    for (int j = 0; j < df.cols(); j++) {
      double[] c = df.column(j);
      center[j] = center(c);
      double s = scale(c);
      scale[j] = s == 0 || Double.isNaN(s) ? 1 : s;
    }
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < data[j].length; i++) {
        data[j][i] = (data[j][i] - center[j]) / scale[j];
      }
    }
    return df.withData(data);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < data[j].length; i++) {
        data[j][i] = data[j][i] * scale[j] + center[j];
      }
    }
    return df.withData(data);
  }

  double[] centers() {
    return center.clone();
  }

  double[] scales() {
    return scale.clone();
  }
}
