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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

import net.larse.tsprep.exception.TransformException;
import net.larse.tsprep.filter.SignalFilters;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

import org.apache.commons.math.MathException;
import org.apache.commons.math.complex.Complex;
import org.apache.commons.math.optimization.fitting.CurveFitter;
import org.apache.commons.math.optimization.fitting.ParametricRealFunction;
import org.apache.commons.math.optimization.general.LevenbergMarquardtOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Removes a fitted sine wave {@code A sin(w t + p)} from each series. The offset is fit but
 * left in the data. Time is in days from the first fitted row.
 */
public class SinTrend extends AbstractTransformer<SinTrend.Args> {
  private static final Logger LOG = LogManager.getLogger(SinTrend.class);

  public static final String NAME = "SinTrend";

  /** Series count from which fitting is spread over {@code nJobs} threads. */
  static final int PARALLEL_MIN_SERIES = 100;

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Least squares method: lm, trf or dogbox. All run Levenberg-Marquardt.")
    @Optional
    public String method = "lm";

    @Doc(help = "Threads used when there are many series.")
    @Optional
    public int nJobs = 1;

    @Override
    protected void checkValues() {
      if (!ImmutableList.of("lm", "trf", "dogbox").contains(method)) {
        throw new IllegalArgumentException("unknown method " + method);
      }
      if (nJobs < 1) {
        throw new IllegalArgumentException("nJobs must be positive");
      }
    }
  }

  /** {amplitude, angular frequency, phase, offset} per column. */
  private double[][] sinParams;
  private double origin;

  public SinTrend(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.method = WeightedChoice.choose(random, ImmutableList.of("lm", "trf", "dogbox"),
        0.95, 0.025, 0.025);
    return a;
  }

  private static final ParametricRealFunction SINE = new ParametricRealFunction() {
    @Override
    public double value(double t, double[] p) {
      return p[0] * Math.sin(p[1] * t + p[2]) + p[3];
    }

    @Override
    public double[] gradient(double t, double[] p) {
      double arg = p[1] * t + p[2];
      double cos = Math.cos(arg);
      return new double[] {Math.sin(arg), p[0] * t * cos, p[0] * cos, 1};
    }
  };

  /**
   * Fits {@code A sin(w t + p) + c}, starting from the dominant non-zero FFT frequency.
   *
   * @return {A, w, p, c}
   */
  static double[] fitSin(double[] t, double[] y) {
    Complex[] spectrum = SignalFilters.fft(y);
    double[] freq = SignalFilters.fftFreq(y.length, t.length > 1 ? t[1] - t[0] : 1);
    int peak = 1;
    for (int i = 2; i < spectrum.length; i++) {
      if (spectrum[i].abs() > spectrum[peak].abs()) {
        peak = i;
      }
    }
    double[] guess = {
        ArrayHelper.nanStd(y, 0) * Math.sqrt(2),
        2 * Math.PI * Math.abs(freq[Math.min(peak, freq.length - 1)]),
        0,
        ArrayHelper.nanMean(y)};
    LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer();
    optimizer.setMaxEvaluations(10000);
    CurveFitter fitter = new CurveFitter(optimizer);
    for (int i = 0; i < t.length; i++) {
      if (!Double.isNaN(y[i])) {
        fitter.addObservedPoint(t[i], y[i]);
      }
    }
    try {
      return fitter.fit(SINE, guess);
    } catch (MathException | IllegalStateException e) {
      LOG.info("Sine fit did not converge, using the FFT guess: {}", e.getMessage());
      return guess;
    }
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    double[] days = df.epochDays();
    origin = days[0];
    double[] t = new double[days.length];
    for (int i = 0; i < t.length; i++) {
      t[i] = days[i] - origin;
    }
    int cols = df.cols();
    if (args.nJobs > 1 && cols >= PARALLEL_MIN_SERIES) {
      LOG.debug("Fitting {} sine curves on {} threads", cols, args.nJobs);
      ForkJoinPool pool = new ForkJoinPool(args.nJobs);
      try {
        sinParams = pool.submit(() -> IntStream.range(0, cols).parallel()
            .mapToObj(c -> fitSin(t, df.column(c)))
            .toArray(double[][]::new)).get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TransformException(NAME, "interrupted while fitting", e);
      } catch (ExecutionException e) {
        if (e.getCause() instanceof TransformException) {
          throw (TransformException) e.getCause();
        }
        throw new TransformException(NAME, "sine fit failed", e.getCause());
      } finally {
        pool.shutdown();
      }
    } else {
      sinParams = new double[cols][];
      for (int c = 0; c < cols; c++) {
        sinParams[c] = fitSin(t, df.column(c));
      }
    }
  }

  private double[][] sine(TimeSeriesFrame df) {
    checkFitted();
    double[] days = df.epochDays();
    double[][] out = new double[df.cols()][df.rows()];
    for (int c = 0; c < df.cols(); c++) {
      double[] p = sinParams[c];
      for (int i = 0; i < days.length; i++) {
        out[c][i] = p[0] * Math.sin(p[1] * (days[i] - origin) + p[2]);
      }
    }
    return out;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    return df.minus(df.withData(sine(df)));
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    return df.plus(df.withData(sine(df)));
  }

  double[][] sinParams() {
    return ArrayHelper.copy(sinParams);
  }
}
