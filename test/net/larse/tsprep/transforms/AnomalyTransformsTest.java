package net.larse.tsprep.transforms;

import com.google.common.collect.ImmutableMap;

import java.time.LocalDate;
import java.time.LocalDateTime;

import net.larse.tsprep.Frames;
import net.larse.tsprep.anomaly.AnomalyResult;
import net.larse.tsprep.anomaly.HolidayDetector;
import net.larse.tsprep.anomaly.HolidayKey;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.regression.RegressionModel;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import org.junit.Test;

import static org.junit.Assert.*;

public class AnomalyTransformsTest {
  private static TimeSeriesFrame sineWithSpike(int rows, int spikeAt) {
    double[] x = new double[rows];
    for (int i = 0; i < rows; i++) {
      x[i] = Math.sin(2 * Math.PI * i / 25.0);
    }
    x[spikeAt] += 20;
    return Frames.single(x);
  }

  /** Three years of a flat series with spikes every Christmas and Fourth of July. */
  static TimeSeriesFrame holidaySpikes() {
    LocalDateTime[] index = TimeSeriesFrame.dailyIndex(LocalDate.of(2020, 1, 1), 1096);
    double[] x = new double[index.length];
    for (int i = 0; i < x.length; i++) {
      LocalDate d = index[i].toLocalDate();
      x[i] = 10 + 0.5 * Math.sin(2 * Math.PI * i / 7.0);
      if ((d.getMonthValue() == 12 && d.getDayOfMonth() == 25)
          || (d.getMonthValue() == 7 && d.getDayOfMonth() == 4)) {
        x[i] += 50;
      }
    }
    return new TimeSeriesFrame(index, new String[] {"sales"}, new double[][] {x});
  }

  static <A extends HolidayDetector.Args> A dayOfMonthOnly(A args) {
    args.useWkdomHolidays = false;
    args.useLunarHolidays = false;
    args.useIslamicHolidays = false;
    args.useHebrewHolidays = false;
    args.splashThreshold = null;
    args.anomalyMethod = "zscore";
    args.anomalyMethodParams = ImmutableMap.<String, Object>of("distribution", "norm",
        "alpha", 0.05);
    return args;
  }

  @Test
  public void testAnomalyRemovalFlagsTheSpike() {
    AnomalyRemoval.Args args = new AnomalyRemoval.Args();
    args.transformDict = null;
    args.methodParams = ImmutableMap.<String, Object>of("distribution", "norm", "alpha", 0.05);
    AnomalyRemoval t = new AnomalyRemoval(args);
    TimeSeriesFrame df = sineWithSpike(200, 100);
    TimeSeriesFrame cleaned = t.fitTransform(df);
    AnomalyResult anomalies = t.anomalies();
    assertEquals(1, anomalies.count());
    assertTrue(anomalies.isAnomaly(100, 0));
    // forward filled from the previous row
    assertEquals(df.get(99, 0), cleaned.get(100, 0), 0);
    assertEquals(df.get(101, 0), cleaned.get(101, 0), 0);
    assertSame(cleaned, t.inverseTransform(cleaned));
  }

  @Test
  public void testAnomalyRemovalUnivariateRemovesRowsEverywhere() {
    double[] quiet = new double[200];
    for (int i = 0; i < quiet.length; i++) {
      quiet[i] = Math.cos(2 * Math.PI * i / 25.0);
    }
    TimeSeriesFrame spiky = sineWithSpike(200, 50);
    TimeSeriesFrame df = spiky.withColumns(new String[] {"a", "b"},
        new double[][] {spiky.column(0), quiet});
    AnomalyRemoval.Args args = new AnomalyRemoval.Args();
    args.output = "univariate";
    args.transformDict = null;
    args.fillna = null;
    AnomalyRemoval t = new AnomalyRemoval(args);
    TimeSeriesFrame cleaned = t.fitTransform(df);
    assertTrue(Double.isNaN(cleaned.get(50, 0)));
    assertTrue(Double.isNaN(cleaned.get(50, 1)));
    assertFalse(Double.isNaN(cleaned.get(51, 1)));
  }

  @Test
  public void testAnomalyClassifierRelabelsScores() {
    AnomalyRemoval.Args args = new AnomalyRemoval.Args();
    args.transformDict = null;
    AnomalyRemoval t = new AnomalyRemoval(args);
    t.fit(sineWithSpike(200, 100));
    TimeSeriesFrame scores = t.anomalies().scores();
    TimeSeriesFrame flags = t.anomalyClassifier().scoreToAnomaly(scores);
    assertEquals(AnomalyResult.ANOMALY, flags.get(100, 0), 0);
    assertEquals(AnomalyResult.NORMAL, flags.get(10, 0), 0);
  }

  @Test
  public void testHolidayTransformerRemovesTheHolidayEffect() {
    HolidayTransformer.Args args = dayOfMonthOnly(new HolidayTransformer.Args());
    args.impact = "median_value";
    HolidayTransformer t = new HolidayTransformer(args);
    TimeSeriesFrame df = holidaySpikes();
    TimeSeriesFrame out = t.fitTransform(df);

    assertEquals(2, t.detector().allHolidays().size());
    assertTrue(t.detector().allHolidays().contains(
        HolidayKey.dayOfMonth(HolidayKey.Kind.DAY_OF_MONTH, 12, 25)));
    assertTrue(t.detector().allHolidays().contains(
        HolidayKey.dayOfMonth(HolidayKey.Kind.DAY_OF_MONTH, 7, 4)));

    int christmas = df.indexOf(LocalDateTime.of(2021, 12, 25, 0, 0));
    assertEquals(10, out.get(christmas, 0), 1.5);
    assertEquals(0, Frames.maxAbsDiff(df, t.inverseTransform(out)), 1e-9);
  }

  @Test
  public void testHolidayTransformerWithoutImpactOnlyDetects() {
    HolidayTransformer t = new HolidayTransformer(dayOfMonthOnly(new HolidayTransformer.Args()));
    TimeSeriesFrame df = holidaySpikes();
    assertEquals(0, Frames.maxAbsDiff(df, t.fitTransform(df)), 0);
  }

  @Test
  public void testHolidayTransformerRegressionImpact() {
    HolidayTransformer.Args args = dayOfMonthOnly(new HolidayTransformer.Args());
    args.impact = "regression";
    HolidayTransformer t = new HolidayTransformer(args);
    TimeSeriesFrame df = holidaySpikes();
    TimeSeriesFrame out = t.fitTransform(df);

    int christmas = df.indexOf(LocalDateTime.of(2021, 12, 25, 0, 0));
    int july = df.indexOf(LocalDateTime.of(2022, 7, 4, 0, 0));
    assertEquals(10, out.get(christmas, 0), 1.5);
    assertEquals(10, out.get(july, 0), 1.5);
    assertEquals(df.get(100, 0), out.get(100, 0), 1e-9);
    assertEquals(0, Frames.maxAbsDiff(df, t.inverseTransform(out)), 1e-9);
  }

  @Test
  public void testHolidayTransformerDatepartRegressionImpact() {
    HolidayTransformer.Args args = dayOfMonthOnly(new HolidayTransformer.Args());
    args.impact = "datepart_regression";
    args.regressionModel = RegressionModel.of("LinearRegression");
    HolidayTransformer t = new HolidayTransformer(args);
    TimeSeriesFrame df = holidaySpikes();
    TimeSeriesFrame out = t.fitTransform(df);

    // residuals, so the holiday lands near zero rather than 60
    int christmas = df.indexOf(LocalDateTime.of(2021, 12, 25, 0, 0));
    assertEquals(0, out.get(christmas, 0), 2);
    assertEquals(0, Frames.maxAbsDiff(df, t.inverseTransform(out)), 1e-6);
  }

  @Test
  public void testHolidayTransformerAnomalyScoreImpact() {
    HolidayTransformer.Args args = dayOfMonthOnly(new HolidayTransformer.Args());
    args.impact = "anomaly_score";
    HolidayTransformer t = new HolidayTransformer(args);
    TimeSeriesFrame df = holidaySpikes();
    TimeSeriesFrame out = t.fitTransform(df);

    double seriesMedian = ArrayHelper.nanMedian(t.detector().anomalies().scores().column(0));
    TimeSeriesFrame holidayScores =
        t.detector().datesToHolidays(df.index(), "impact", "anomaly_score");
    int christmas = df.indexOf(LocalDateTime.of(2021, 12, 25, 0, 0));
    double ratio = holidayScores.get(christmas, 0) / seriesMedian;
    assertEquals(df.get(christmas, 0) * ratio, out.get(christmas, 0), 1e-6 * Math.abs(ratio));
    // days that are not holidays pass through
    assertEquals(df.get(100, 0), out.get(100, 0), 0);
    assertEquals(0, Frames.maxAbsDiff(df, t.inverseTransform(out)), 1e-9);
  }

  @Test
  public void testHolidayTransformerInverseOnFutureDates() {
    HolidayTransformer.Args args = dayOfMonthOnly(new HolidayTransformer.Args());
    args.impact = "median_value";
    HolidayTransformer t = new HolidayTransformer(args);
    t.fit(holidaySpikes());

    LocalDateTime[] future = TimeSeriesFrame.dailyIndex(LocalDate.of(2024, 12, 20), 17);
    TimeSeriesFrame forecast =
        new TimeSeriesFrame(future, new String[] {"sales"}, new double[1][future.length]);
    TimeSeriesFrame restored = t.inverseTransform(forecast);
    for (int i = 0; i < future.length; i++) {
      LocalDate d = future[i].toLocalDate();
      if (d.equals(LocalDate.of(2024, 12, 25))) {
        assertEquals(50, restored.get(i, 0), 1.5);
      } else {
        assertEquals(d.toString(), 0, restored.get(i, 0), 0);
      }
    }
    assertEquals(0, Frames.maxAbsDiff(forecast, t.transform(restored)), 1e-9);
  }
}
