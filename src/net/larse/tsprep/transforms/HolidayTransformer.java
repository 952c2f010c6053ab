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

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import net.larse.tsprep.anomaly.AnomalyResult;
import net.larse.tsprep.anomaly.HolidayDetector;
import net.larse.tsprep.fill.FillNA;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.FitGenerator;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.regression.RegressionModel;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Detects holidays from recurring anomalies and removes their effect.
 *
 * <p>Impacts:
 * <ul>
 *   <li>median_value: subtracts the median deviation seen on each holiday
 *   <li>anomaly_score: scales each holiday by the ratio of its median anomaly score to the
 *       median anomaly score of the series
 *   <li>datepart_regression: a {@link DatepartRegression} with the holiday flags as extra
 *       regressors
 *   <li>regression: a least squares fit on the holiday flags, weighting recent rows more
 * </ul>
 * The inverse adds the impact back, or divides the anomaly_score ratio out. With
 * {@code removeExcessAnomalies} the anomalies found at fit time that fall on no holiday are
 * filled over and stay removed.
 */
public class HolidayTransformer extends AbstractTransformer<HolidayTransformer.Args> {
  private static final Logger LOG = LogManager.getLogger(HolidayTransformer.class);

  public static final String NAME = "HolidayTransformer";

  static final ImmutableList<String> IMPACTS = ImmutableList.of(
      "median_value", "anomaly_score", "datepart_regression", "regression");

  /** Exponent of the row multipliers of the regression impact. */
  private static final double WEIGHT_POWER = 0.6;

  public static class Args extends HolidayDetector.Args {
    @Doc(help = "Fill over anomalies that are not on a holiday.")
    @Optional
    public boolean removeExcessAnomalies = true;

    @Doc(help = "How holiday effects are removed, null to only detect.")
    @Optional
    public String impact = null;

    @Doc(help = "Model of the datepart_regression impact.")
    @Optional
    public RegressionModel regressionModel = RegressionModel.of("ElasticNet");

    @Doc(help = "Date features of the datepart_regression impact.")
    @Optional
    public String datepartMethod = "simple_binarized";

    @Doc(help = "Fill method for removed anomalies.")
    @Optional
    public String fillna = "ffill";

    @Override
    protected void checkValues() {
      super.checkValues();
      if (impact != null && !impact.equals("None") && !IMPACTS.contains(impact)) {
        throw new IllegalArgumentException("unknown impact " + impact);
      }
    }

    boolean hasImpact() {
      return impact != null && !impact.equals("None");
    }
  }

  private HolidayDetector detector;
  private List<Set<LocalDateTime>> excess;
  private double[] scoreMedians;
  private double[][] coefficients;
  private DatepartRegression datepart;

  public HolidayTransformer(Args args) {
    super(NAME, args);
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.randomize(random);
    a.removeExcessAnomalies =
        WeightedChoice.choose(random, ImmutableList.of(true, false), 0.9, 0.1);
    a.impact = WeightedChoice.choose(random,
        Arrays.asList(null, "median_value", "anomaly_score", "datepart_regression", "regression"),
        0.1, 0.3, 0.3, 0.2, 0.2);
    a.regressionModel = RegressionModel.random(RegressionModel.FAST_MODELS, random);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    detector = new HolidayDetector(args).detect(df);
    LocalDateTime[] index = df.index();
    AnomalyResult anomalies = detector.anomalies();
    excess = new ArrayList<>();
    for (int j = 0; j < df.cols(); j++) {
      int flagCol = Math.min(j, anomalies.flags().cols() - 1);
      Set<LocalDateTime> times = new HashSet<>();
      for (int i = 0; i < index.length; i++) {
        if (anomalies.isAnomaly(i, flagCol) && !detector.isHoliday(index[i].toLocalDate(), j)) {
          times.add(index[i]);
        }
      }
      excess.add(times);
    }
    LOG.debug("Holidays found: {}", detector.holidays());
    TimeSeriesFrame base = clean(df);
    if (!args.hasImpact()) {
      return;
    }
    switch (args.impact) {
      case "anomaly_score": {
        TimeSeriesFrame scores = anomalies.scores();
        scoreMedians = new double[df.cols()];
        for (int j = 0; j < df.cols(); j++) {
          double median = ArrayHelper.nanMedian(scores.column(Math.min(j, scores.cols() - 1)));
          scoreMedians[j] = Double.isNaN(median) || median == 0 ? 1 : median;
        }
        break;
      }
      case "datepart_regression": {
        DatepartRegression.Args dp = new DatepartRegression.Args();
        dp.regressionModel = args.regressionModel;
        dp.datepartMethod = args.datepartMethod;
        datepart = new DatepartRegression(dp);
        datepart.fit(base, detector.datesToHolidays(index, "flag"));
        break;
      }
      case "regression":
        coefficients = fitRegression(base, clippedFlags(index));
        break;
      default:
        break;
    }
  }

  /**
   * Least squares of each series on an intercept and the flags, with every row multiplied
   * by {@code i^0.6} so recent rows count more.
   */
  private static double[][] fitRegression(TimeSeriesFrame y, TimeSeriesFrame flags) {
    int k = flags.cols();
    double[][] f = flags.rowData();
    double[][] out = new double[y.cols()][];
    for (int j = 0; j < y.cols(); j++) {
      double[] v = y.column(j);
      List<double[]> xs = new ArrayList<>();
      List<double[]> ys = new ArrayList<>();
      for (int i = 0; i < v.length; i++) {
        if (Double.isNaN(v[i])) {
          continue;
        }
        double w = Math.pow(i, WEIGHT_POWER);
        double[] row = new double[k + 1];
        row[0] = w;
        for (int c = 0; c < k; c++) {
          row[c + 1] = f[i][c] * w;
        }
        xs.add(row);
        ys.add(new double[] {v[i] * w});
      }
      if (xs.isEmpty()) {
        out[j] = new double[k + 1];
        continue;
      }
      double[][] beta =
          FitGenerator.lstsq(xs.toArray(new double[0][]), ys.toArray(new double[0][]));
      out[j] = new double[k + 1];
      for (int c = 0; c <= k; c++) {
        out[j][c] = beta[c][0];
      }
    }
    return out;
  }

  private TimeSeriesFrame clean(TimeSeriesFrame df) {
    if (!args.removeExcessAnomalies) {
      return df;
    }
    LocalDateTime[] index = df.index();
    double[][] data = df.columnData();
    boolean any = false;
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < index.length; i++) {
        if (excess.get(j).contains(index[i])) {
          data[j][i] = Double.NaN;
          any = true;
        }
      }
    }
    return any ? FillNA.fill(df.withData(data), args.fillna) : df;
  }

  /** Holiday flags capped at one, so a holiday shared by several series counts once. */
  private TimeSeriesFrame clippedFlags(LocalDateTime[] index) {
    TimeSeriesFrame flags = detector.datesToHolidays(index, "flag");
    double[][] data = flags.columnData();
    for (double[] column : data) {
      for (int i = 0; i < column.length; i++) {
        column[i] = Math.min(column[i], 1);
      }
    }
    return flags.withData(data);
  }

  /** Per-series multiplier of the anomaly_score impact, 1 off the holidays. */
  private double[][] scoreRatio(LocalDateTime[] index) {
    double[][] ratio =
        detector.datesToHolidays(index, "impact", "anomaly_score").columnData();
    for (int j = 0; j < ratio.length; j++) {
      for (int i = 0; i < ratio[j].length; i++) {
        double r = ratio[j][i] / scoreMedians[j];
        ratio[j][i] = r == 0 ? 1 : r;
      }
    }
    return ratio;
  }

  private static TimeSeriesFrame scale(TimeSeriesFrame df, double[][] ratio, boolean divide) {
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      for (int i = 0; i < data[j].length; i++) {
        data[j][i] = divide ? data[j][i] / ratio[j][i] : data[j][i] * ratio[j][i];
      }
    }
    return df.withData(data);
  }

  /** The additive holiday effect on each series at the timestamps of df. */
  private TimeSeriesFrame effect(TimeSeriesFrame df) {
    LocalDateTime[] index = df.index();
    switch (args.impact) {
      case "median_value":
        return df.withData(detector.datesToHolidays(index, "impact", "value").columnData());
      default: {
        double[][] f = clippedFlags(index).rowData();
        double[][] data = new double[df.cols()][index.length];
        for (int j = 0; j < data.length; j++) {
          for (int i = 0; i < index.length; i++) {
            for (int c = 0; c < f[i].length; c++) {
              data[j][i] += f[i][c] * coefficients[j][c + 1];
            }
          }
        }
        return df.withData(data);
      }
    }
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    TimeSeriesFrame x = clean(df);
    if (!args.hasImpact()) {
      return x;
    }
    if (datepart != null) {
      return datepart.transform(x, detector.datesToHolidays(x.index(), "flag"));
    }
    if (scoreMedians != null) {
      return scale(x, scoreRatio(x.index()), false);
    }
    return x.minus(effect(x));
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    checkFitted();
    if (!args.hasImpact()) {
      return df;
    }
    if (datepart != null) {
      return datepart.inverseTransform(df, detector.datesToHolidays(df.index(), "flag"));
    }
    if (scoreMedians != null) {
      return scale(df, scoreRatio(df.index()), true);
    }
    return df.plus(effect(df));
  }

  /** The fitted detector, for its holidays and anomalies. */
  public HolidayDetector detector() {
    checkFitted();
    return detector;
  }
}
