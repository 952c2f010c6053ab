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
import com.google.common.primitives.Doubles;

import java.util.Locale;
import java.util.Random;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Keeps only the most recent rows. The method is a count ({@code >= 1}), a share of the rows
 * (between -1 and 1), a count to drop ({@code <= -1}), "HalfMax", or "nForecastLength" for n
 * times the forecast length. Not inverted.
 */
public class Slice extends AbstractTransformer<Slice.Args> {
  private static final Logger LOG = LogManager.getLogger(Slice.class);

  public static final String NAME = "Slice";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "How many rows to keep, see the class description.")
    @Optional
    public Object method = "100";

    @Doc(help = "Forecast horizon, scales the ForecastLength methods.")
    @Optional
    public int forecastLength = 30;
  }

  public Slice(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.method = tier.isFast()
        ? WeightedChoice.choose(random, ImmutableList.<Object>of(100, 0.5, 0.2), 0.3, 0.5, 0.2)
        : WeightedChoice.uniform(random, (Object) 100, 0.5, 0.8, 0.9, 0.3);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {}

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    Object method = args.method;
    if (method == null || "None".equals(method)) {
      return df;
    }
    String text = method.toString();
    int n = df.rows();
    if (text.toLowerCase(Locale.ROOT).contains("forecastlength")) {
      int multiple = 1;
      for (char ch : text.toCharArray()) {
        if (Character.isDigit(ch)) {
          multiple = ch - '0';
          break;
        }
      }
      return df.tail(multiple * args.forecastLength);
    }
    if (text.equals("HalfMax")) {
      return df.tail(n / 2);
    }
    Double m = method instanceof Number ? ((Number) method).doubleValue() : Doubles.tryParse(text);
    if (m == null) {
      LOG.info("Slice method {} not recognized, returning data unchanged", text);
      return df;
    }
    if (m >= 1) {
      return df.tail(m.intValue());
    } else if (m > -1) {
      return df.tail((int) (n * Math.abs(m)));
    }
    return df.tail((int) (n + m));
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    return df;
  }
}
