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

import java.util.Random;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Rounds to {@code decimals} places (negative rounds to tens, hundreds), on the way in, on the
 * way out, or both. Halves round to even.
 */
public class Round extends AbstractTransformer<Round.Args> {
  public static final String NAME = "Round";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Decimal places to round to.")
    @Optional
    public int decimals = 0;

    @Doc(help = "Round in transform.")
    @Optional
    public boolean onTransform = false;

    @Doc(help = "Round in inverse_transform.")
    @Optional
    public boolean onInverse = true;

    @Doc(help = "Truncate to whole numbers after rounding.")
    @Optional
    public boolean forceInt = false;
  }

  public Round(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.onInverse = random.nextBoolean();
    a.onTransform = random.nextBoolean();
    if (!a.onInverse && !a.onTransform) {
      a.onInverse = true;
    }
    a.decimals = WeightedChoice.choose(random, ImmutableList.of(-2, -1, 0, 1, 2),
        0.1, 0.2, 0.4, 0.2, 0.1);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {}

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    return args.onTransform ? round(df) : df;
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    return args.onInverse ? round(df) : df;
  }

  private TimeSeriesFrame round(TimeSeriesFrame df) {
    double scale = Math.pow(10, args.decimals);
    return df.mapColumns(c -> {
      for (int i = 0; i < c.length; i++) {
        if (Double.isNaN(c[i])) {
          continue;
        }
        double v = Math.rint(c[i] * scale) / scale;
        c[i] = args.forceInt ? (long) v : v;
      }
      return c;
    });
  }
}
