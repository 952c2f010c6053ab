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
import java.util.Map;
import java.util.Random;
import java.util.Set;

import net.larse.tsprep.anomaly.AnomalyClassifier;
import net.larse.tsprep.anomaly.AnomalyDetector;
import net.larse.tsprep.anomaly.AnomalyResult;
import net.larse.tsprep.fill.FillNA;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.pipeline.GeneralTransformer;
import net.larse.tsprep.pipeline.TransformConfig;
import net.larse.tsprep.pipeline.TransformStep;
import net.larse.tsprep.regression.RegressionModel;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Detects anomalies at fit time, on the data run through an inner pipeline, and replaces the
 * anomalous points with missing values that are then filled. Points are matched by timestamp,
 * so transforming other rows only touches the fitted anomalies among them. Not inverted.
 */
public class AnomalyRemoval extends AbstractTransformer<AnomalyRemoval.Args> {
  private static final Logger LOG = LogManager.getLogger(AnomalyRemoval.class);

  public static final String NAME = "AnomalyRemoval";

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "multivariate: per series. univariate: a row is removed from every series.")
    @Optional
    public String output = "multivariate";

    @Doc(help = "Anomaly detection method.")
    @Optional
    public String method = "zscore";

    @Doc(help = "Parameters of the detection method.")
    @Optional
    public Map<String, Object> methodParams = null;

    @Doc(help = "Pipeline applied before detection, null for none.")
    @Optional
    public TransformConfig transformDict = defaultTransform();

    @Doc(help = "How the removed points are filled, None to leave them missing.")
    @Optional
    public String fillna = "ffill";

    @Override
    protected void checkValues() {
      if (!output.equals("multivariate") && !output.equals("univariate")) {
        throw new IllegalArgumentException("output must be multivariate or univariate");
      }
      if (!AnomalyDetector.METHODS.contains(method)) {
        throw new IllegalArgumentException("unknown anomaly method " + method);
      }
    }
  }

  private AnomalyResult anomalies;
  private List<Set<LocalDateTime>> removed;

  public AnomalyRemoval(Args args) {
    super(NAME, args);
  }

  /** Removal of datepart regression residual outliers. */
  public static TransformConfig defaultTransform() {
    DatepartRegression.Args dp = new DatepartRegression.Args();
    dp.datepartMethod = "simple_3";
    dp.regressionModel = RegressionModel.of("ElasticNet");
    return new TransformConfig(null,
        ImmutableList.of(new TransformStep(0, DatepartRegression.NAME, dp)));
  }

  public static Args newParams(SpeedTier tier, Random random) {
    Args a = new Args();
    a.output = WeightedChoice.choose(random,
        ImmutableList.of("multivariate", "univariate"), 0.9, 0.1);
    a.method = AnomalyDetector.randomMethod(random, tier.isFast());
    a.methodParams = AnomalyDetector.randomParams(a.method, random);
    a.transformDict = WeightedChoice.choose(random,
        Arrays.asList(null, defaultTransform()), 0.3, 0.7);
    a.fillna = WeightedChoice.choose(random,
        Arrays.asList(null, "ffill", "mean", "rolling_mean_24", "linear", "fake_date"),
        0.01, 0.39, 0.1, 0.3, 0.15, 0.05);
    return a;
  }

  @Override
  protected void doFit(TimeSeriesFrame df) {
    TimeSeriesFrame x = df;
    if (args.transformDict != null) {
      x = new GeneralTransformer(args.transformDict).fitTransform(df);
    }
    anomalies = new AnomalyDetector(args.output, args.method, args.methodParams).detect(x);
    TimeSeriesFrame flags = anomalies.flags();
    LocalDateTime[] index = flags.index();
    removed = new ArrayList<>();
    for (int j = 0; j < flags.cols(); j++) {
      Set<LocalDateTime> times = new HashSet<>();
      for (int i = 0; i < index.length; i++) {
        if (anomalies.isAnomaly(i, j)) {
          times.add(index[i]);
        }
      }
      removed.add(times);
    }
    if (anomalies.count() == 0) {
      LOG.info("No anomalies found by {}", args.method);
    }
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    LocalDateTime[] index = df.index();
    double[][] data = df.columnData();
    for (int j = 0; j < data.length; j++) {
      Set<LocalDateTime> times = removed.get(removed.size() == 1 ? 0 : j);
      for (int i = 0; i < index.length; i++) {
        if (times.contains(index[i])) {
          data[j][i] = Double.NaN;
        }
      }
    }
    return FillNA.fill(df.withData(data), args.fillna);
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df) {
    return df;
  }

  /** The anomalies found at fit time. */
  public AnomalyResult anomalies() {
    checkFitted();
    return anomalies;
  }

  /** A classifier of new scores trained on the fitted anomalies. */
  public AnomalyClassifier anomalyClassifier() {
    checkFitted();
    return new AnomalyClassifier(anomalies);
  }
}
