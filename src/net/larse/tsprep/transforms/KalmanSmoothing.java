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

import net.larse.tsprep.filter.KalmanSmoother;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/** Replaces each series by its Kalman smoothed observation means. Not inverted. */
public class KalmanSmoothing extends AbstractFilter<KalmanSmoothing.Args> {
  public static final String NAME = "KalmanSmoothing";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "State transition matrix F.")
    @Optional
    public double[][] stateTransition = {{1, 1}, {0, 1}};

    @Doc(help = "Process noise covariance Q.")
    @Optional
    public double[][] processNoise = {{0.1, 0.0}, {0.0, 0.01}};

    @Doc(help = "Observation model H, one row.")
    @Optional
    public double[][] observationModel = {{1, 0}};

    @Doc(help = "Observation noise variance R.")
    @Optional
    public double observationNoise = 1.0;
  }

  private KalmanSmoother smoother;

  public KalmanSmoothing(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    int choice = WeightedChoice.chooseIndex(random, new double[] {0.25, 0.25, 0.5});
    if (choice == 1) {
      a.stateTransition = new double[][] {{1, 1, 0}, {0, 1, 0}, {0, 0, 1}};
      a.processNoise = new double[][] {{0.1, 0, 0}, {0, 0.01, 0}, {0, 0, 0.1}};
      a.observationModel = new double[][] {{1, 1, 1}};
    } else if (choice == 2) {
      KalmanSmoother space = KalmanSmoother.randomStateSpace(random);
      a.stateTransition = space.stateTransition();
      a.processNoise = space.processNoise();
      a.observationModel = space.observationModel();
      a.observationNoise = space.observationNoise();
    }
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    smoother = new KalmanSmoother(args.stateTransition, args.processNoise,
        args.observationModel, args.observationNoise);
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    return df.mapColumns(smoother::smooth);
  }
}
