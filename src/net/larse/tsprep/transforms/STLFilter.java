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
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.STLDecomposition;
import net.larse.tsprep.timeseries.SeasonalFeatures;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import net.larse.tsprep.timeseries.TimeSeriesUtils;

/**
 * Replaces each series with one part of its seasonal decomposition, either STL (Loess based)
 * or the classical moving average decomposition. The period is inferred from the index
 * spacing. Not inverted.
 */
public class STLFilter extends AbstractFilter<STLFilter.Args> {
  public static final String NAME = "STLFilter";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "STL or seasonal_decompose.")
    @Optional
    public String decompositionType = "STL";

    @Doc(help = "Which part to keep: trend, seasonal or resid.")
    @Optional
    public String part = "trend";

    @Doc(help = "Odd span of the STL seasonal smoother.")
    @Optional
    public int seasonal = 7;

    @Override
    protected void checkValues() {
      if (!decompositionType.equals("STL") && !decompositionType.equals("seasonal_decompose")) {
        throw new IllegalArgumentException("unknown decomposition " + decompositionType);
      }
      if (!ImmutableList.of("trend", "seasonal", "resid").contains(part)) {
        throw new IllegalArgumentException("part must be trend, seasonal or resid");
      }
      if (seasonal < 3 || seasonal % 2 == 0) {
        throw new IllegalArgumentException("seasonal must be odd and at least 3");
      }
    }
  }

  public STLFilter(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.decompositionType =
        WeightedChoice.choose(random, ImmutableList.of("STL", "seasonal_decompose"), 0.5, 0.5);
    a.part = WeightedChoice.choose(random, ImmutableList.of("trend", "seasonal", "resid"),
        0.98, 0.02, 0.001);
    int seasonal = SeasonalFeatures.seasonalInt(random, false, true, false);
    if (seasonal < 7 || tier.isFast()) {
      seasonal = 7;
    } else if (seasonal % 2 == 0) {
      seasonal = seasonal - 1;
    }
    a.seasonal = seasonal;
    return a;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    if (df.hasNaN()) {
      throw new NullValueException(NAME);
    }
    // a yearly index has no usable cycle, treat every two observations as one
    int period = Math.max(2, TimeSeriesUtils.inferPeriod(df.index()));
    int partIndex = ImmutableList.of("trend", "seasonal", "resid").indexOf(args.part);
    if (args.decompositionType.equals("seasonal_decompose")) {
      return df.mapColumns(c -> TimeSeriesUtils.classicalDecompose(c, period)[partIndex])
          .ffillBfill();
    }
    return df.mapColumns(c -> {
      STLDecomposition stl = new STLDecomposition(c, period, args.seasonal, false);
      switch (partIndex) {
        case 1:
          return stl.getSeasonal();
        case 2:
          return stl.getRemainder();
        default:
          return stl.getTrend();
      }
    });
  }
}
