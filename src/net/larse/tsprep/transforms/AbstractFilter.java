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

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * A smoothing transformation with nothing to learn and no inverse: the inverse returns its
 * input unchanged.
 */
public abstract class AbstractFilter<A extends AlgorithmBase.ArgsBase>
    extends AbstractTransformer<A> {

  protected AbstractFilter(String name, A args) {
    super(name, args);
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {}

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    return df;
  }
}
