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

import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.transforms.AbstractTransformer;

/** Divides each series by its largest absolute value, keeping zero at zero. */
public class MaxAbsScaler extends AffineScaler<AbstractTransformer.NoArgs> {
  public static final String NAME = "MaxAbsScaler";

  public MaxAbsScaler() {
    super(NAME, new NoArgs());
  }

  @Override
  protected double center(double[] column) {
    return 0;
  }

  @Override
  protected double scale(double[] column) {
    return Math.max(Math.abs(ArrayHelper.nanMin(column)), Math.abs(ArrayHelper.nanMax(column)));
  }
}
