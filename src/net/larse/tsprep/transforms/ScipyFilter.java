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

import java.util.Locale;
import java.util.Random;

import net.larse.tsprep.filter.ButterworthFilter;
import net.larse.tsprep.filter.SavitzkyGolayFilter;
import net.larse.tsprep.filter.SignalFilters;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.SeasonalFeatures;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Irreversible signal filters applied to each series: the magnitude of the analytic signal
 * (hilbert), a local Wiener filter, Savitzky-Golay smoothing, or a zero-phase Butterworth
 * filter run as second-order sections.
 */
public class ScipyFilter extends AbstractFilter<ScipyFilter.Args> {
  public static final String NAME = "ScipyFilter";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "hilbert, wiener, savgol_filter or butter.")
    @Optional
    public String method = "hilbert";

    @Doc(help = "savgol_filter: odd window length.")
    @Optional
    public int windowLength = 7;

    @Doc(help = "savgol_filter: polynomial order.")
    @Optional
    public int polyorder = 2;

    @Doc(help = "savgol_filter: derivative order.")
    @Optional
    public int deriv = 0;

    @Doc(help = "savgol_filter: mirror, nearest or interp.")
    @Optional
    public String mode = "mirror";

    @Doc(help = "butter: filter order.")
    @Optional
    public int order = 4;

    @Doc(help = "butter: the cutoff is 1 / windowSize of the Nyquist frequency.")
    @Optional
    public int windowSize = 8;

    @Doc(help = "butter: lowpass or highpass.")
    @Optional
    public String btype = "lowpass";

    @Override
    protected void checkValues() {
      if (!ImmutableList.of("hilbert", "wiener", "savgol_filter", "butter").contains(method)) {
        throw new IllegalArgumentException("ScipyFilter method " + method + " not found.");
      }
      if (method.equals("butter") && windowSize < 2) {
        throw new IllegalArgumentException("windowSize must be at least 2");
      }
    }
  }

  public ScipyFilter(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    if (tier.isFast()) {
      a.method = WeightedChoice.uniform(random, "butter", "savgol_filter");
    } else {
      a.method = WeightedChoice.choose(random,
          ImmutableList.of("hilbert", "wiener", "savgol_filter", "butter"), 0.1, 0.1, 0.9, 0.9);
    }
    if (a.method.equals("savgol_filter")) {
      a.windowLength = WeightedChoice.choose(random, ImmutableList.of(7, 31, 91), 0.4, 0.3, 0.3);
      a.polyorder = WeightedChoice.uniform(random, 1, 2, 3, 4);
      a.deriv = WeightedChoice.choose(random, ImmutableList.of(0, 1), 0.8, 0.2);
      a.mode = WeightedChoice.uniform(random, "mirror", "nearest", "interp");
    } else if (a.method.equals("butter")) {
      a.order = WeightedChoice.randint(random, 1, 8);
      a.windowSize = Math.max(2, SeasonalFeatures.seasonalInt(random, false, true, false));
      a.btype = WeightedChoice.uniform(random, "lowpass", "highpass");
    }
    return a;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    switch (args.method) {
      case "hilbert":
        return df.mapColumns(SignalFilters::hilbertEnvelope);
      case "wiener":
        return df.mapColumns(c -> SignalFilters.wiener(c, 3));
      case "savgol_filter":
        SavitzkyGolayFilter savgol = new SavitzkyGolayFilter(args.windowLength, args.polyorder,
            args.deriv, SavitzkyGolayFilter.Mode.valueOf(args.mode.toUpperCase(Locale.ROOT)));
        return df.mapColumns(savgol::filter);
      default:
        ButterworthFilter butter = new ButterworthFilter(args.order, 1.0 / args.windowSize,
            ButterworthFilter.BandType.valueOf(args.btype.toUpperCase(Locale.ROOT)));
        return df.mapColumns(butter::filtfilt);
    }
  }
}
