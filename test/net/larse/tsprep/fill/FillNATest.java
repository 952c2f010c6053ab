package net.larse.tsprep.fill;

import net.larse.tsprep.Frames;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import org.junit.Test;

import static org.junit.Assert.*;

public class FillNATest {
  static final double NaN = Double.NaN;

  private static double[] fill(String method, double... values) {
    return FillNA.fill(Frames.single(values), method).column(0);
  }

  @Test
  public void testForwardFill() {
    assertArrayEquals(new double[] {2, 2, 3, 3}, fill("ffill", NaN, 2, 3, NaN), 0);
  }

  @Test
  public void testStatistics() {
    assertArrayEquals(new double[] {1, 3.5, 6, 3.5}, fill("mean", 1, NaN, 6, NaN), 1e-12);
    assertArrayEquals(new double[] {1, 2, 10, 2}, fill("median", 1, 2, 10, NaN), 1e-12);
    assertArrayEquals(new double[] {0, 1, 0}, fill("zero", NaN, 1, NaN), 0);
    // mean 3, forward value 5
    assertArrayEquals(new double[] {1, 5, 4}, fill("ffill_mean_biased", 1, 5, NaN), 1e-12);
  }

  @Test
  public void testRollingMean() {
    assertArrayEquals(new double[] {1, 3, 3, 3, 3},
        FillNA.fill(Frames.single(1, 3, NaN, NaN, NaN), "rolling_mean", 2).column(0), 1e-12);
  }

  @Test
  public void testFakeDateShiftsValues() {
    assertArrayEquals(new double[] {1, 1, 2, 3}, fill("fake_date", 1, NaN, 2, 3), 0);
  }

  @Test
  public void testInterpolationMethods() {
    assertArrayEquals(new double[] {0, 1, 2, 3}, fill("linear", 0, NaN, NaN, 3), 1e-12);
    assertArrayEquals(new double[] {0, 0, 0, 3}, fill("zero", 0, NaN, NaN, 3), 0);
    assertArrayEquals(new double[] {0, 0, 3, 3}, fill("nearest", 0, NaN, NaN, 3), 0);
    double[] cubic = fill("cubic", 0, 1, NaN, 9, 16);
    assertTrue(cubic[2] > 1 && cubic[2] < 9);
  }

  @Test
  public void testNoneLeavesGaps() {
    TimeSeriesFrame df = Frames.single(1, NaN);
    assertSame(df, FillNA.fill(df, null));
    assertSame(df, FillNA.fill(df, "None"));
  }

  @Test
  public void testUnknownFallsBackToForwardFill() {
    assertArrayEquals(new double[] {1, 1}, fill("mystery", 1, NaN), 0);
  }

  @Test
  public void testEveryMethodRemovesNaN() {
    TimeSeriesFrame df = Frames.seasonal(60, 3, 9);
    double[][] cols = df.columnData();
    for (int j = 0; j < cols.length; j++) {
      for (int i = j; i < 60; i += 7) {
        cols[j][i] = NaN;
      }
    }
    TimeSeriesFrame gappy = df.withData(cols);
    for (String method : FillNA.METHODS) {
      assertFalse(method, FillNA.fill(gappy, method).hasNaN());
    }
    for (String method : InterpolationImputer.METHODS) {
      assertFalse(method, FillNA.fill(gappy, method).hasNaN());
    }
  }

  @Test
  public void testKnnAndIterativeStayClose() {
    TimeSeriesFrame df = Frames.seasonal(80, 3, 4);
    double[][] cols = df.columnData();
    double truth = cols[1][40];
    cols[1][40] = NaN;
    TimeSeriesFrame gappy = df.withData(cols);
    assertEquals(truth, FillNA.fill(gappy, "IterativeImputer").get(40, 1), 5);
    assertEquals(truth, FillNA.fill(gappy, "KNNImputer").get(40, 1), 10);
  }
}
