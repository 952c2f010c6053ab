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

import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * A stateful, usually invertible, transformation of a time series frame.
 *
 * <p>{@link #fit} learns whatever the transformation needs from the data, {@link #transform}
 * applies it to a frame with the same columns, and {@link #inverseTransform} maps transformed
 * values (typically a forecast) back to the original scale. Transformers whose inverse
 * depends on where the input sits relative to the fit history implement
 * {@link ModeAwareTransformer}.
 */
public interface Transformer {

  /** The registered name of the transformer. */
  String name();

  /** Learns the transformation from df and returns this. */
  Transformer fit(TimeSeriesFrame df);

  TimeSeriesFrame transform(TimeSeriesFrame df);

  TimeSeriesFrame inverseTransform(TimeSeriesFrame df);

  /** Fits on df and returns df transformed. */
  default TimeSeriesFrame fitTransform(TimeSeriesFrame df) {
    fit(df);
    return transform(df);
  }
}
