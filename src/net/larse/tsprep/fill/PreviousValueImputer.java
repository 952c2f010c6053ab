package net.larse.tsprep.fill;

import net.larse.tsprep.helper.ArrayHelper;

/** Carries the last observed value forward, then the first observed value backward. */
public class PreviousValueImputer extends Imputer {
  @Override
  public double[] imputeColumn(double[] values, double[] time) {
    return ArrayHelper.bfill(ArrayHelper.ffill(values));
  }
}
