package net.larse.tsprep.fill;

import net.larse.tsprep.helper.ArrayHelper;

/**
 * Fills each gap with the trailing rolling mean of the observed values, then forward and back
 * fills whatever the window could not reach.
 */
public class RollingMeanImputer extends Imputer {
  private final int window;

  public RollingMeanImputer(int window) {
    this.window = window;
  }

  @Override
  public double[] imputeColumn(double[] values, double[] time) {
    double[] rolling = ArrayHelper.rollingMean(values, window, 1);
    double[] out = values.clone();
    for (int i = 0; i < out.length; i++) {
      if (Double.isNaN(out[i])) {
        out[i] = rolling[i];
      }
    }
    return ArrayHelper.bfill(ArrayHelper.ffill(out));
  }
}
