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

import net.larse.tsprep.filter.SignalFilters;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.SeasonalFeatures;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/** Exponentially weighted moving average of each series. Not inverted. */
public class EWMAFilter extends AbstractFilter<EWMAFilter.Args> {
  public static final String NAME = "EWMAFilter";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Span converted to alpha = 2 / (span + 1).")
    @Optional
    public int span = 7;

    @Override
    protected void checkValues() {
      if (span < 1) {
        throw new IllegalArgumentException("span must be >= 1");
      }
    }
  }

  public EWMAFilter(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.span = tier.isFast()
        ? WeightedChoice.uniform(random, 3, 7, 10, 12)
        : SeasonalFeatures.seasonalInt(random);
    return a;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    return df.mapColumns(c -> SignalFilters.ewma(c, args.span));
  }
}
