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

import com.google.common.base.Preconditions;

/** Settings shared by every transformer a pipeline builds. */
public final class TransformContext {
  public static final long DEFAULT_SEED = 2020;
  public static final TransformContext DEFAULT = new TransformContext(DEFAULT_SEED, 1);

  private final long randomSeed;
  private final int nJobs;

  public TransformContext(long randomSeed, int nJobs) {
    Preconditions.checkArgument(nJobs >= 1, "nJobs must be positive, got %s", nJobs);
    this.randomSeed = randomSeed;
    this.nJobs = nJobs;
  }

  public long randomSeed() {
    return randomSeed;
  }

  /** Worker threads available to transformers that fit series independently. */
  public int nJobs() {
    return nJobs;
  }
}
