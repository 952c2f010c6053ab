package net.larse.tsprep.fill;

/** Replaces every missing value with one constant. */
public class FixedValueImputer extends Imputer {
  private final double value;

  public FixedValueImputer(double value) {
    this.value = value;
  }

  @Override
  public double[] imputeColumn(double[] values, double[] time) {
    double[] out = values.clone();
    for (int i = 0; i < out.length; i++) {
      if (Double.isNaN(out[i])) {
        out[i] = value;
      }
    }
    return out;
  }
}
