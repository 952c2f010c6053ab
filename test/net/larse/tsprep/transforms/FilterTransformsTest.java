package net.larse.tsprep.transforms;

import net.larse.tsprep.Frames;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class FilterTransformsTest {
  private TimeSeriesFrame df;

  @Before
  public void setUp() {
    df = Frames.seasonal(120, 2, 7);
  }

  /** Same shape out, no NaN, and the inverse hands its input back. */
  private TimeSeriesFrame assertFilter(Transformer t) {
    TimeSeriesFrame out = t.fitTransform(df);
    assertEquals(t.name(), df.rows(), out.rows());
    assertArrayEquals(df.columns(), out.columns());
    assertFalse(t.name(), out.hasNaN());
    assertSame(out, t.inverseTransform(out));
    return out;
  }

  private static double roughness(double[] x) {
    double sum = 0;
    for (int i = 2; i < x.length; i++) {
      double d = x[i] - 2 * x[i - 1] + x[i - 2];
      sum += d * d;
    }
    return sum;
  }

  @Test
  public void testSmoothersReduceRoughness() {
    double before = roughness(df.column(0));
    Transformer[] smoothers = {
        new EWMAFilter(new EWMAFilter.Args()),
        new HPFilter(new HPFilter.Args()),
        new KalmanSmoothing(new KalmanSmoothing.Args()),
        new STLFilter(new STLFilter.Args())};
    for (Transformer t : smoothers) {
      TimeSeriesFrame out = assertFilter(t);
      assertTrue(t.name(), roughness(out.column(0)) < before);
    }
  }

  @Test
  public void testScipyFilters() {
    for (String method : new String[] {"hilbert", "wiener", "savgol_filter", "butter"}) {
      ScipyFilter.Args args = new ScipyFilter.Args();
      args.method = method;
      assertFilter(new ScipyFilter(args));
    }
  }

  @Test
  public void testStatsmodelsFilters() {
    for (String method : StatsmodelsFilter.METHODS) {
      assertFilter(new StatsmodelsFilter(StatsmodelsFilter.of(method)));
    }
  }

  @Test
  public void testHpCycleIsDataMinusTrend() {
    HPFilter.Args trendArgs = new HPFilter.Args();
    HPFilter.Args cycleArgs = new HPFilter.Args();
    cycleArgs.part = "cycle";
    TimeSeriesFrame trend = new HPFilter(trendArgs).fitTransform(df);
    TimeSeriesFrame cycle = new HPFilter(cycleArgs).fitTransform(df);
    assertEquals(0, Frames.maxAbsDiff(df, trend.plus(cycle)), 1e-8);
  }

  @Test
  public void testStlPartsAddUp() {
    TimeSeriesFrame sum = null;
    for (String part : new String[] {"trend", "seasonal", "resid"}) {
      STLFilter.Args args = new STLFilter.Args();
      args.part = part;
      TimeSeriesFrame out = new STLFilter(args).fitTransform(df);
      sum = sum == null ? out : sum.plus(out);
    }
    assertEquals(0, Frames.maxAbsDiff(df, sum), 1e-8);
  }

  @Test
  public void testEwmaOfConstantIsConstant() {
    TimeSeriesFrame constant = Frames.single(4, 4, 4, 4, 4);
    TimeSeriesFrame out = new EWMAFilter(new EWMAFilter.Args()).fitTransform(constant);
    assertArrayEquals(constant.column(0), out.column(0), 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownScipyMethod() {
    ScipyFilter.Args args = new ScipyFilter.Args();
    args.method = "median";
    new ScipyFilter(args);
  }
}
