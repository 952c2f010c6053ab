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

import net.larse.tsprep.filter.BandPassFilters;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Irreversible band-pass smoothing. {@code bkfilter} subtracts the Baxter-King cycle (lead-lag
 * of one), {@code cffilter} the Christiano-Fitzgerald cycle with drift removal, and
 * {@code convolution_filter} applies the two tap filter {0.75, 0.25}. Rows the filter leaves
 * undefined are forward then back filled, except for cffilter which defines every row.
 */
public class StatsmodelsFilter extends AbstractFilter<StatsmodelsFilter.Args> {
  public static final String NAME = "StatsmodelsFilter";

  static final ImmutableList<String> METHODS =
      ImmutableList.of("bkfilter", "cffilter", "convolution_filter");

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "bkfilter, cffilter or convolution_filter.")
    @Optional
    public String method = "bkfilter";

    @Override
    protected void checkValues() {
      if (!METHODS.contains(method)) {
        throw new IllegalArgumentException("unknown filter " + method);
      }
    }
  }

  public StatsmodelsFilter(Args args) {
    super(NAME, args);
  }

  public static Args of(String method) {
    Args a = new Args();
    a.method = method;
    return a;
  }

  public static Args newParams(SpeedTier tier, Random random) {
    return new Args();
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    switch (args.method) {
      case "cffilter":
        return df.mapColumns(c -> {
          double[] cycle = BandPassFilters.christianoFitzgerald(c, BandPassFilters.DEFAULT_LOW,
              BandPassFilters.DEFAULT_HIGH, true)[0];
          double[] out = new double[c.length];
          for (int i = 0; i < c.length; i++) {
            out[i] = c[i] - cycle[i];
          }
          return out;
        });
      case "convolution_filter":
        return df.mapColumns(c -> BandPassFilters.convolution(c, new double[] {0.75, 0.25}))
            .ffillBfill();
      default:
        return df.mapColumns(c -> {
          double[] cycle = BandPassFilters.baxterKing(c, BandPassFilters.DEFAULT_LOW,
              BandPassFilters.DEFAULT_HIGH, 1);
          double[] out = new double[c.length];
          for (int i = 0; i < c.length; i++) {
            out[i] = c[i] - cycle[i];
          }
          return ArrayHelper.bfill(ArrayHelper.ffill(out));
        });
    }
  }
}
