package net.larse.tsprep.transforms;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import net.larse.tsprep.Frames;
import net.larse.tsprep.exception.MultivariateRequiredException;
import net.larse.tsprep.regression.RegressionModel;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import org.junit.Test;

import static org.junit.Assert.*;

public class SimpleTransformsTest {
  private static double[] range(int n) {
    double[] out = new double[n];
    for (int i = 0; i < n; i++) {
      out[i] = i;
    }
    return out;
  }

  @Test
  public void testClipOutliers() {
    ClipOutliers.Args args = new ClipOutliers.Args();
    args.stdThreshold = 1;
    TimeSeriesFrame df = Frames.single(1, 2, 3, 4, 100);
    double[] clipped = new ClipOutliers(args).fitTransform(df).column(0);
    // mean 22, sample variance 7610 / 4
    assertEquals(22 + Math.sqrt(1902.5), clipped[4], 1e-9);
    assertArrayEquals(new double[] {1, 2, 3, 4}, Arrays.copyOf(clipped, 4), 0);

    args.method = "remove";
    assertTrue(Double.isNaN(new ClipOutliers(args).fitTransform(df).get(4, 0)));
    args.fillna = "ffill";
    assertEquals(4, new ClipOutliers(args).fitTransform(df).get(4, 0), 0);
  }

  @Test
  public void testRound() {
    Round.Args args = new Round.Args();
    Round defaults = new Round(args);
    TimeSeriesFrame df = Frames.single(1.26, 2.4, 2.6);
    assertSame(df, defaults.fitTransform(df));
    assertArrayEquals(new double[] {1, 2, 3}, defaults.inverseTransform(df).column(0), 0);

    args.decimals = 1;
    args.onTransform = true;
    assertArrayEquals(new double[] {1.3, 2.4, 2.6},
        new Round(args).fitTransform(df).column(0), 1e-12);
    args.forceInt = true;
    assertArrayEquals(new double[] {1, 2, 2}, new Round(args).fitTransform(df).column(0), 0);
  }

  @Test
  public void testSlice() {
    TimeSeriesFrame df = Frames.walks(150, 1, 3);
    Slice.Args args = new Slice.Args();
    assertEquals(100, new Slice(args).fitTransform(df).rows());
    args.method = 0.5;
    assertEquals(75, new Slice(args).fitTransform(df).rows());
    args.method = "HalfMax";
    assertEquals(75, new Slice(args).fitTransform(df).rows());
    args.method = "ForecastLength2";
    args.forecastLength = 30;
    assertEquals(60, new Slice(args).fitTransform(df).rows());
    args.method = -10;
    TimeSeriesFrame sliced = new Slice(args).fitTransform(df);
    assertEquals(140, sliced.rows());
    assertEquals(df.getIndex(149), sliced.getIndex(139));
    assertSame(sliced, new Slice(args).inverseTransform(sliced));
  }

  @Test
  public void testDiscretizeSnapsToBinCenters() {
    Discretize.Args args = new Discretize.Args();
    args.nBins = 4;
    TimeSeriesFrame df = Frames.single(range(100));
    Discretize t = new Discretize(args);
    double[] out = t.fitTransform(df).column(0);
    Set<Double> distinct = new HashSet<>();
    for (double v : out) {
      distinct.add(v);
    }
    assertEquals(4, distinct.size());
    assertEquals(12.375, out[0], 1e-9);
    assertEquals(86.625, out[99], 1e-9);
  }

  @Test
  public void testDiscretizeOrdinal() {
    Discretize.Args args = new Discretize.Args();
    args.nBins = 4;
    args.discretization = "sklearn-uniform";
    Discretize t = new Discretize(args);
    TimeSeriesFrame bins = t.fitTransform(Frames.single(range(100)));
    assertEquals(0, bins.get(0, 0), 0);
    assertEquals(1, bins.get(30, 0), 0);
    assertEquals(3, bins.get(99, 0), 0);
    TimeSeriesFrame back = t.inverseTransform(bins);
    assertEquals(12.375, back.get(0, 0), 1e-9);
    assertEquals(86.625, back.get(99, 0), 1e-9);
  }

  @Test
  public void testIntermittentOccurrence() {
    IntermittentOccurrence t = new IntermittentOccurrence(new IntermittentOccurrence.Args());
    TimeSeriesFrame signs = t.fitTransform(Frames.single(1, 2, 3, 10, 20));
    assertArrayEquals(new double[] {-1, -1, 0, 1, 1}, signs.column(0), 0);
    // upper values average 12 above the median, lower ones 1.5 below
    assertArrayEquals(new double[] {1.5, 1.5, 3, 15, 15},
        t.inverseTransform(signs).column(0), 1e-12);
  }

  @Test
  public void testAlignLastValue() {
    TimeSeriesFrame history = Frames.single(1, 2, 3, 10);
    TimeSeriesFrame forecast = Frames.following(history, new double[][] {{5, 6}});
    AlignLastValue t = new AlignLastValue(new AlignLastValue.Args());
    assertSame(history, t.fitTransform(history));
    assertArrayEquals(new double[] {10}, t.center(), 0);
    assertArrayEquals(new double[] {10, 11},
        t.inverseTransform(forecast, InverseMode.FORECAST).column(0), 1e-12);
    assertSame(forecast, t.inverseTransform(forecast, InverseMode.ORIGINAL));
    assertSame(forecast, t.inverseTransform(forecast, InverseMode.FORECAST, true));

    AlignLastValue.Args args = new AlignLastValue.Args();
    args.method = "multiplicative";
    t = new AlignLastValue(args);
    t.fit(history);
    assertArrayEquals(new double[] {10, 12}, t.inverseTransform(forecast).column(0), 1e-12);

    args = new AlignLastValue.Args();
    args.firstValueOnly = true;
    args.strength = 0.5;
    t = new AlignLastValue(args);
    t.fit(history);
    assertArrayEquals(new double[] {7.5, 6}, t.inverseTransform(forecast).column(0), 1e-12);
  }

  @Test
  public void testDetrendDampsTheAddedTrend() {
    double[] line = new double[30];
    for (int i = 0; i < line.length; i++) {
      line[i] = 2 * i + 5;
    }
    TimeSeriesFrame df = Frames.single(line);
    Detrend.Args args = new Detrend.Args();
    args.model = "Linear";
    args.phi = 0.5;
    Detrend t = new Detrend(args);
    TimeSeriesFrame residual = t.fitTransform(df);
    for (int i = 0; i < line.length; i++) {
      assertEquals(0, residual.get(i, 0), 1e-6);
    }
    TimeSeriesFrame zeros = Frames.following(df, new double[][] {{0, 0, 0}});
    // the trend would be 65, 67, 69; each step keeps half of the last
    assertArrayEquals(new double[] {65, 33.5, 17.25}, t.inverseTransform(zeros).column(0),
        1e-6);
  }

  @Test
  public void testSinTrendRecoversTheWave() {
    double[] wave = new double[180];
    for (int i = 0; i < wave.length; i++) {
      wave[i] = 3 * Math.sin(2 * Math.PI * i / 30.0) + 10;
    }
    SinTrend t = new SinTrend(new SinTrend.Args());
    TimeSeriesFrame rest = t.fitTransform(Frames.single(wave));
    double[] p = t.sinParams()[0];
    assertEquals(3, Math.abs(p[0]), 1e-3);
    assertEquals(2 * Math.PI / 30, Math.abs(p[1]), 1e-4);
    // the offset stays in the data
    for (int i = 0; i < wave.length; i++) {
      assertEquals(10, rest.get(i, 0), 1e-3);
    }
  }

  @Test
  public void testDatepartRegressionWithRegressor() {
    TimeSeriesFrame df = Frames.seasonal(90, 1, 4);
    double[] extra = new double[90];
    for (int i = 0; i < extra.length; i++) {
      extra[i] = i % 5;
    }
    TimeSeriesFrame regressor = df.withColumns(new String[] {"r"}, new double[][] {extra});
    DatepartRegression.Args args = new DatepartRegression.Args();
    args.regressionModel = RegressionModel.of("Ridge");
    DatepartRegression t = new DatepartRegression(args);
    TimeSeriesFrame residual = t.fitTransform(df, regressor);
    assertEquals(0, Frames.maxAbsDiff(df, t.inverseTransform(residual, regressor)), 1e-9);
    try {
      t.transform(df);
      fail("expected the missing regressor to be rejected");
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().contains("features"));
    }
  }

  @Test
  public void testDecompositionsNeedSeveralSeries() {
    TimeSeriesFrame one = Frames.walks(50, 1, 9);
    Transformer[] multivariate = {
        new PCA(new PCA.Args()),
        new FastICA(new FastICA.Args()),
        new Cointegration(new Cointegration.Args()),
        new BTCD(new BTCD.Args())};
    for (Transformer t : multivariate) {
      try {
        t.fit(one);
        fail(t.name() + " accepted a single series");
      } catch (MultivariateRequiredException expected) {
        assertEquals(t.name(), expected.getTransformerName());
      }
    }
  }

  @Test
  public void testPcaColumnsAreRankNames() {
    TimeSeriesFrame out = new PCA(new PCA.Args()).fitTransform(Frames.walks(60, 3, 2));
    assertArrayEquals(new String[] {"0", "1", "2"}, out.columns());
  }

  @Test(expected = IllegalStateException.class)
  public void testTransformBeforeFit() {
    new CenterLastValue(new CenterLastValue.Args()).transform(Frames.single(1, 2));
  }
}
