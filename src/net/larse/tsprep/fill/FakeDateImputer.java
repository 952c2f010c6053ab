package net.larse.tsprep.fill;

/**
 * Drops the missing values and slides the observed ones forward so they end on the last
 * timestamp, as if the series had no gaps. Rows left at the start repeat the first observed
 * value.
 */
public class FakeDateImputer extends Imputer {
  @Override
  public double[] imputeColumn(double[] values, double[] time) {
    int n = values.length;
    double[] out = new double[n];
    int pos = n - 1;
    for (int i = n - 1; i >= 0; i--) {
      if (!Double.isNaN(values[i])) {
        out[pos--] = values[i];
      }
    }
    double first = pos < n - 1 ? out[pos + 1] : 0;
    for (int i = pos; i >= 0; i--) {
      out[i] = first;
    }
    return out;
  }
}
