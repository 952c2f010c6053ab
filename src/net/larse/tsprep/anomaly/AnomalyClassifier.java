package net.larse.tsprep.anomaly;

import com.google.common.base.Preconditions;

import java.util.Arrays;

import net.larse.tsprep.regression.DecisionTreeClassifier;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Learns which scores a detector flagged, per series, so that scores of new points can be
 * labelled without rerunning detection. Features are a one-hot series id and the score. The
 * tree is grown on first use.
 */
public class AnomalyClassifier {
  private final AnomalyResult training;
  private final String[] series;
  private DecisionTreeClassifier.Model model;

  public AnomalyClassifier(AnomalyResult training) {
    this.training = Preconditions.checkNotNull(training, "training");
    this.series = training.scores().columns();
  }

  private DecisionTreeClassifier.Model model() {
    if (model == null) {
      TimeSeriesFrame scores = training.scores();
      TimeSeriesFrame flags = training.flags();
      int rows = 0;
      for (int j = 0; j < scores.cols(); j++) {
        for (int i = 0; i < scores.rows(); i++) {
          if (!Double.isNaN(scores.get(i, j))) {
            rows++;
          }
        }
      }
      Preconditions.checkState(rows > 0, "no scores to learn from");
      double[][] x = new double[rows][];
      int[] labels = new int[rows];
      int k = 0;
      for (int j = 0; j < scores.cols(); j++) {
        for (int i = 0; i < scores.rows(); i++) {
          double s = scores.get(i, j);
          if (!Double.isNaN(s)) {
            x[k] = features(j, s);
            labels[k++] = (int) flags.get(i, j);
          }
        }
      }
      model = new DecisionTreeClassifier().fit(x, labels);
    }
    return model;
  }

  private double[] features(int seriesIndex, double score) {
    double[] f = new double[series.length + 1];
    f[seriesIndex] = 1;
    f[series.length] = score;
    return f;
  }

  /**
   * Flags for new scores of the same series, -1 anomalous and 1 normal. NaN scores are
   * normal.
   */
  public TimeSeriesFrame scoreToAnomaly(TimeSeriesFrame scores) {
    Preconditions.checkArgument(Arrays.equals(scores.columns(), series),
        "scores must have the training columns %s", Arrays.toString(series));
    DecisionTreeClassifier.Model m = model();
    double[][] flags = new double[scores.cols()][scores.rows()];
    for (int j = 0; j < scores.cols(); j++) {
      double[][] x = new double[scores.rows()][];
      for (int i = 0; i < scores.rows(); i++) {
        double s = scores.get(i, j);
        x[i] = features(j, Double.isNaN(s) ? 0 : s);
      }
      int[] labels = m.predict(x);
      for (int i = 0; i < labels.length; i++) {
        flags[j][i] = Double.isNaN(scores.get(i, j)) ? AnomalyResult.NORMAL : labels[i];
      }
    }
    return scores.withData(flags);
  }
}
