package net.larse.tsprep.fill;

import com.google.common.base.Preconditions;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.regression.Predictor;
import net.larse.tsprep.regression.Regressor;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Round-robin regression imputation. Missing values start at the series mean; each round then
 * regresses every incomplete series on the other series and the row position, using the rows
 * where it was observed, and replaces its missing values with the predictions.
 */
public class IterativeImputer extends Imputer {
  private static final Logger LOG = LogManager.getLogger(IterativeImputer.class);

  private final Regressor regressor;
  private final int maxIter;
  private final double tol;

  public IterativeImputer(Regressor regressor, int maxIter, double tol) {
    Preconditions.checkArgument(maxIter >= 1, "max_iter must be >= 1");
    this.regressor = regressor;
    this.maxIter = maxIter;
    this.tol = tol;
  }

  @Override
  public TimeSeriesFrame impute(TimeSeriesFrame df) {
    int n = df.rows();
    int p = df.cols();
    double[][] original = df.columnData();
    double[][] current = new double[p][];
    IntArrayList incomplete = new IntArrayList();
    for (int j = 0; j < p; j++) {
      current[j] = new StatisticImputer(StatisticImputer.Statistic.MEAN)
          .imputeColumn(original[j], null);
      if (ArrayHelper.hasNaN(original[j]) && ArrayHelper.countNaN(original[j]) < n) {
        incomplete.add(j);
      }
    }
    for (int iter = 0; iter < maxIter && !incomplete.isEmpty(); iter++) {
      double maxChange = 0;
      double scale = 0;
      for (int j : incomplete) {
        int observed = n - ArrayHelper.countNaN(original[j]);
        double[][] trainX = new double[observed][];
        double[][] trainY = new double[observed][1];
        double[][] missingX = new double[n - observed][];
        int[] missingRows = new int[n - observed];
        int a = 0;
        int b = 0;
        for (int i = 0; i < n; i++) {
          double[] features = features(current, i, j);
          if (Double.isNaN(original[j][i])) {
            missingX[b] = features;
            missingRows[b++] = i;
          } else {
            trainX[a] = features;
            trainY[a++][0] = original[j][i];
          }
        }
        Predictor predictor = regressor.fit(trainX, trainY);
        double[][] predicted = predictor.predict(missingX);
        for (int k = 0; k < missingRows.length; k++) {
          double v = predicted[k][0];
          int i = missingRows[k];
          maxChange = Math.max(maxChange, Math.abs(v - current[j][i]));
          scale = Math.max(scale, Math.abs(v));
          current[j][i] = v;
        }
      }
      if (maxChange <= tol * Math.max(scale, 1e-12)) {
        LOG.debug("Iterative imputation converged after {} rounds", iter + 1);
        break;
      }
    }
    return df.withData(current);
  }

  private static double[] features(double[][] current, int row, int target) {
    double[] out = new double[current.length];
    int k = 0;
    for (int j = 0; j < current.length; j++) {
      if (j != target) {
        out[k++] = current[j][row];
      }
    }
    out[k] = row;
    return out;
  }

  @Override
  public double[] imputeColumn(double[] values, double[] time) {
    return new StatisticImputer(StatisticImputer.Statistic.MEAN).imputeColumn(values, time);
  }
}
