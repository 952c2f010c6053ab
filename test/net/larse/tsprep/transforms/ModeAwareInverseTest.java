package net.larse.tsprep.transforms;

import net.larse.tsprep.Frames;
import net.larse.tsprep.exception.ReconstructionException;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Transformers whose inverse depends on whether it replays the fitted history or continues
 * it as a forecast.
 */
public class ModeAwareInverseTest {
  private static final int FIT_ROWS = 100;
  private static final int HORIZON = 20;

  private TimeSeriesFrame full;
  private TimeSeriesFrame history;
  private TimeSeriesFrame future;

  @Before
  public void setUp() {
    full = Frames.walks(FIT_ROWS + HORIZON, 2, 5);
    history = full.head(FIT_ROWS);
    future = full.tail(HORIZON);
  }

  private void assertOriginal(ModeAwareTransformer t) {
    TimeSeriesFrame back = t.inverseTransform(t.fitTransform(history), InverseMode.ORIGINAL);
    assertEquals(t.name(), 0, Frames.maxAbsDiff(history, back), 1e-8);
  }

  /** The transformed future, inverted as a forecast, gives back the future values. */
  private void assertForecast(ModeAwareTransformer t) {
    t.fit(history);
    TimeSeriesFrame transformedFuture = t.transform(full).tail(HORIZON);
    TimeSeriesFrame back = t.inverseTransform(transformedFuture, InverseMode.FORECAST);
    assertEquals(HORIZON, back.rows());
    assertEquals(t.name(), 0, Frames.maxAbsDiff(future, back), 1e-8);
  }

  @Test
  public void testDifferenced() {
    assertOriginal(new DifferencedTransformer());
    assertForecast(new DifferencedTransformer());
  }

  @Test
  public void testDifferencedForecastRejectsNaN() {
    DifferencedTransformer t = new DifferencedTransformer();
    t.fit(history);
    try {
      t.inverseTransform(Frames.following(history,
          new double[][] {{1, Double.NaN}, {1, 1}}), InverseMode.FORECAST);
      fail("expected a ReconstructionException");
    } catch (ReconstructionException e) {
      assertEquals(DifferencedTransformer.NAME, e.getTransformerName());
    }
  }

  @Test
  public void testRollingMean() {
    RollingMeanTransformer.Args args = new RollingMeanTransformer.Args();
    args.window = 7;
    assertOriginal(new RollingMeanTransformer(args));
    assertForecast(new RollingMeanTransformer(args));
  }

  @Test
  public void testFixedRollingMeanIsNotInverted() {
    RollingMeanTransformer.Args args = new RollingMeanTransformer.Args();
    args.fixed = true;
    RollingMeanTransformer t = new RollingMeanTransformer(args);
    TimeSeriesFrame smoothed = t.fitTransform(history);
    assertSame(smoothed, t.inverseTransform(smoothed, InverseMode.ORIGINAL));
    assertEquals(mean(history.column(0), 0, 10), smoothed.get(9, 0), 1e-9);
  }

  @Test
  public void testCumSum() {
    assertOriginal(new CumSumTransformer());
    assertForecast(new CumSumTransformer());
  }

  @Test
  public void testPctChange() {
    assertOriginal(new PctChangeTransformer());
    assertForecast(new PctChangeTransformer());
    TimeSeriesFrame withZero = Frames.single(0, 2, 4);
    TimeSeriesFrame pct = new PctChangeTransformer().fitTransform(withZero);
    // the zero is replaced by the smallest non-zero magnitude
    assertArrayEquals(new double[] {0, 0, 1}, pct.column(0), 1e-12);
  }

  @Test
  public void testMeanDifference() {
    assertOriginal(new MeanDifference());
    assertForecast(new MeanDifference());
  }

  @Test
  public void testSeasonalDifferenceLastValue() {
    double[] weekly = new double[28];
    for (int i = 0; i < weekly.length; i++) {
      weekly[i] = i % 7 * 3.0 + 10;
    }
    SeasonalDifference t = new SeasonalDifference(new SeasonalDifference.Args());
    TimeSeriesFrame df = Frames.single(weekly);
    TimeSeriesFrame diffed = t.fitTransform(df);
    for (int i = 0; i < weekly.length; i++) {
      assertEquals(0, diffed.get(i, 0), 1e-12);
    }
    assertEquals(0, Frames.maxAbsDiff(df, t.inverseTransform(diffed, InverseMode.ORIGINAL)),
        1e-12);
    // a zero forecast continues the weekly pattern from the next phase
    TimeSeriesFrame next = t.inverseTransform(
        Frames.following(df, new double[][] {new double[10]}), InverseMode.FORECAST);
    for (int i = 0; i < 10; i++) {
      assertEquals(weekly[i % 7], next.get(i, 0), 1e-12);
    }
  }

  @Test
  public void testSeasonalDifferenceMean() {
    SeasonalDifference.Args args = new SeasonalDifference.Args();
    args.method = "Mean";
    args.lag1 = 12;
    SeasonalDifference t = new SeasonalDifference(args);
    TimeSeriesFrame df = Frames.seasonal(90, 2, 3);
    TimeSeriesFrame back = t.inverseTransform(t.fitTransform(df), InverseMode.ORIGINAL);
    assertEquals(0, Frames.maxAbsDiff(df, back), 1e-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSeasonalDifferenceRejectsZeroLag() {
    SeasonalDifference.Args args = new SeasonalDifference.Args();
    args.lag1 = 0;
    new SeasonalDifference(args);
  }

  private static double mean(double[] values, int from, int to) {
    double sum = 0;
    for (int i = from; i < to; i++) {
      sum += values[i];
    }
    return sum / (to - from);
  }
}
