package net.larse.tsprep.timeseries;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Named regression features, one row per timestamp.
 */
public final class FeatureMatrix {
  private final String[] names;
  private final double[][] rows;

  public FeatureMatrix(String[] names, double[][] rows) {
    for (double[] row : rows) {
      Preconditions.checkArgument(row.length == names.length, "ragged feature row");
    }
    this.names = names;
    this.rows = rows;
  }

  public String[] names() {
    return names.clone();
  }

  /** The feature values, {@code [row][feature]}. Not copied. */
  public double[][] values() {
    return rows;
  }

  public int rows() {
    return rows.length;
  }

  public int cols() {
    return names.length;
  }

  /**
   * Polynomial expansion without bias: the original columns followed by every product
   * x_i * x_j with i &lt;= j for degree 2 (and the analogous monomials for higher degrees).
   */
  public FeatureMatrix polynomial(int degree) {
    Preconditions.checkArgument(degree >= 1, "degree must be positive");
    int n = names.length;
    List<int[]> terms = new ArrayList<>();
    for (int d = 1; d <= degree; d++) {
      addCombinations(terms, new int[d], 0, 0, n);
    }
    String[] outNames = new String[terms.size()];
    for (int t = 0; t < outNames.length; t++) {
      outNames[t] = "dp" + t;
    }
    double[][] out = new double[rows.length][terms.size()];
    for (int i = 0; i < rows.length; i++) {
      for (int t = 0; t < terms.size(); t++) {
        double v = 1;
        for (int f : terms.get(t)) {
          v *= rows[i][f];
        }
        out[i][t] = v;
      }
    }
    return new FeatureMatrix(outNames, out);
  }

  private static void addCombinations(List<int[]> out, int[] current, int pos,
      int start, int n) {
    if (pos == current.length) {
      out.add(current.clone());
      return;
    }
    for (int i = start; i < n; i++) {
      current[pos] = i;
      addCombinations(out, current, pos + 1, i, n);
    }
  }
}
