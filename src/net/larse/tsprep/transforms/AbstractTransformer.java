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

import com.google.common.base.Preconditions;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Common state of the transformers: the name, the validated arguments and whether
 * {@link #fit} has run. Subclasses put their fit logic in {@link #doFit}.
 *
 * @param <A> the arguments type
 */
public abstract class AbstractTransformer<A extends AlgorithmBase.ArgsBase>
    implements Transformer {

  /** Arguments of transformers that take none. */
  public static final class NoArgs extends AlgorithmBase.ArgsBase {}

  protected final A args;
  private final String name;
  private boolean fitted;

  protected AbstractTransformer(String name, A args) {
    this.name = Preconditions.checkNotNull(name);
    this.args = Preconditions.checkNotNull(args, "args");
    args.validate();
  }

  @Override
  public String name() {
    return name;
  }

  /** A copy of the arguments. */
  public A args() {
    return args.copy();
  }

  @Override
  public final Transformer fit(TimeSeriesFrame df) {
    Preconditions.checkNotNull(df, "df");
    doFit(df);
    fitted = true;
    return this;
  }

  /** Learns the state of the transformation. */
  protected abstract void doFit(TimeSeriesFrame df);

  /** For fit overloads that take more than the data and so bypass {@link #fit}. */
  protected final void markFitted() {
    fitted = true;
  }

  protected final void checkFitted() {
    Preconditions.checkState(fitted, "%s has not been fit", name);
  }

  @Override
  public String toString() {
    return "Transformer " + name + " " + args.toMap();
  }
}
