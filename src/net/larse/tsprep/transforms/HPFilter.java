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

import net.larse.tsprep.exception.NullValueException;
import net.larse.tsprep.filter.HodrickPrescottFilter;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/** Keeps the Hodrick-Prescott trend, or cycle, of each series. Not inverted. */
public class HPFilter extends AbstractFilter<HPFilter.Args> {
  public static final String NAME = "HPFilter";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "trend or cycle.")
    @Optional
    public String part = "trend";

    @Doc(help = "Smoothing parameter lambda.")
    @Optional
    public double lamb = 1600;

    @Override
    protected void checkValues() {
      if (!part.equals("trend") && !part.equals("cycle")) {
        throw new IllegalArgumentException("part must be trend or cycle");
      }
    }
  }

  public HPFilter(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.part = WeightedChoice.choose(random, ImmutableList.of("trend", "cycle"), 0.98, 0.02);
    a.lamb = WeightedChoice.choose(random,
        ImmutableList.of(1600.0, 6.25, 129600.0, 104976000000.0), 0.5, 0.2, 0.2, 0.1);
    return a;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    if (df.hasNaN()) {
      throw new NullValueException(NAME);
    }
    return args.part.equals("cycle")
        ? df.mapColumns(c -> HodrickPrescottFilter.cycle(c, args.lamb))
        : df.mapColumns(c -> HodrickPrescottFilter.trend(c, args.lamb));
  }
}
