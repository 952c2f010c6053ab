package net.larse.tsprep.anomaly;

import com.google.common.base.Preconditions;

import net.larse.tsprep.timeseries.TimeSeriesFrame;

/**
 * Output of anomaly detection: a frame of flags, -1 for anomalous and 1 for normal, and a
 * frame of the scores the flags were derived from. Both share index and columns.
 */
public final class AnomalyResult {
  public static final double ANOMALY = -1;
  public static final double NORMAL = 1;

  private final TimeSeriesFrame flags;
  private final TimeSeriesFrame scores;

  public AnomalyResult(TimeSeriesFrame flags, TimeSeriesFrame scores) {
    Preconditions.checkArgument(flags.rows() == scores.rows() && flags.cols() == scores.cols(),
        "flags and scores must have the same shape");
    this.flags = flags;
    this.scores = scores;
  }

  public TimeSeriesFrame flags() {
    return flags;
  }

  public TimeSeriesFrame scores() {
    return scores;
  }

  public boolean isAnomaly(int row, int col) {
    return flags.get(row, col) == ANOMALY;
  }

  /** Number of flagged points over all series. */
  public int count() {
    int n = 0;
    for (int i = 0; i < flags.rows(); i++) {
      for (int j = 0; j < flags.cols(); j++) {
        if (isAnomaly(i, j)) {
          n++;
        }
      }
    }
    return n;
  }
}
