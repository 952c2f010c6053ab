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

import java.util.Random;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Shifts each series up just enough that its minimum becomes 0 (or 1 with {@code centerOne}
 * or {@code log}), then optionally squares and takes the log. Series already above the floor
 * are not shifted.
 */
public class PositiveShift extends AbstractTransformer<PositiveShift.Args> {
  public static final String NAME = "PositiveShift";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Take the natural log after shifting.")
    @Optional
    public boolean log = false;

    @Doc(help = "Shift the minimum to 1 instead of 0.")
    @Optional
    public boolean centerOne = true;

    @Doc(help = "Square the values after shifting.")
    @Optional
    public boolean squared = false;
  }

  private double[] shift;

  public PositiveShift(Args args) {
    super(NAME, args);
  }

  public PositiveShift() {
    this(new Args());
  }

  public static Args newParams(SpeedTier tier, Random random) {
    return new Args();
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    shift = new double[df.cols()];
    for (int j = 0; j < df.cols(); j++) {
      double min = ArrayHelper.nanMin(df.column(j));
      double amount = args.log || args.centerOne ? min - 1 : min;
      shift[j] = amount < 0 ? Math.abs(amount) : 0;
    }
  }

  /** The per-series shift learned by fit. */
  public double[] shift() {
    checkFitted();
    return shift.clone();
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < data[j].length; i++) {
        double v = data[j][i] + shift[j];
        if (args.squared) {
          v = v * v;
        }
        if (args.log) {
          v = Math.log(v);
        }
        data[j][i] = v;
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
        double v = data[j][i];
        if (args.log) {
          v = Math.exp(v);
        }
        if (args.squared) {
          v = Math.sqrt(v);
        }
        data[j][i] = v - shift[j];
      }
    }
    return df.withData(data);
  }
}
