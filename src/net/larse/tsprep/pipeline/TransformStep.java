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
package net.larse.tsprep.pipeline;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import net.larse.tsprep.helper.AlgorithmBase;

/**
 * One step of a pipeline: its position, the name of the transformer and its arguments.
 * Steps run in ascending index order and are inverted in descending order.
 */
public final class TransformStep {
  private final int index;
  private final String name;
  private final AlgorithmBase.ArgsBase args;

  public TransformStep(int index, String name, AlgorithmBase.ArgsBase args) {
    this.index = index;
    this.name = Preconditions.checkNotNull(name, "name");
    this.args = Preconditions.checkNotNull(args, "args");
  }

  /** A step with the default arguments of the named transformer. */
  public static TransformStep of(int index, String name) {
    return new TransformStep(index, name, TransformerRegistry.args(name, null));
  }

  public int index() {
    return index;
  }

  public String name() {
    return name;
  }

  /** A copy of the arguments. */
  public AlgorithmBase.ArgsBase args() {
    return args.copy();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransformStep)) {
      return false;
    }
    TransformStep other = (TransformStep) o;
    return index == other.index && name.equals(other.name)
        && args.toMap().equals(other.args.toMap());
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(index, name, args.toMap());
  }

  @Override
  public String toString() {
    return index + ":" + name + args.toMap();
  }
}
