package net.larse.tsprep.helper;

import org.junit.Test;

import static org.junit.Assert.*;

public class ArrayHelperTest {
  static final double NaN = Double.NaN;

  @Test
  public void testNanStatistics() {
    double[] x = {1, NaN, 2, 3, NaN, 4};
    assertEquals(2, ArrayHelper.countNaN(x));
    assertEquals(2.5, ArrayHelper.nanMean(x), 1e-12);
    assertEquals(2.5, ArrayHelper.nanMedian(x), 1e-12);
    assertEquals(Math.sqrt(1.25), ArrayHelper.nanStd(x, 0), 1e-12);
    assertEquals(Math.sqrt(5.0 / 3), ArrayHelper.nanStd(x, 1), 1e-12);
    assertEquals(1, ArrayHelper.nanMin(x), 0);
    assertEquals(4, ArrayHelper.nanMax(x), 0);
  }

  @Test
  public void testQuantileInterpolates() {
    double[] x = {4, 1, 3, 2};
    assertEquals(1.75, ArrayHelper.nanQuantile(x, 0.25), 1e-12);
    assertEquals(4, ArrayHelper.nanQuantile(x, 1), 0);
    assertTrue(Double.isNaN(ArrayHelper.nanQuantile(new double[] {NaN}, 0.5)));
  }

  @Test
  public void testFinite() {
    double[] x = {NaN, NaN, 5, NaN, 6, NaN};
    assertEquals(2, ArrayHelper.firstFinite(x, 0, x.length));
    assertEquals(4, ArrayHelper.lastFinite(x, 0, x.length));
  }

  @Test
  public void testRollingMeanSkipsNaN() {
    double[] out = ArrayHelper.rollingMean(new double[] {1, 2, NaN, 4, 5}, 2, 1);
    assertArrayEquals(new double[] {1, 1.5, 2, 4, 4.5}, out, 1e-12);
    assertTrue(Double.isNaN(ArrayHelper.rollingMean(new double[] {1, 2}, 3, 2)[0]));
  }

  @Test
  public void testCumsumAndSearch() {
    assertArrayEquals(new double[] {1, 3, 6}, ArrayHelper.cumsum(new double[] {1, 2, 3}), 0);
    double[] sorted = {1, 3, 5};
    assertEquals(0, ArrayHelper.searchSorted(sorted, 0));
    assertEquals(1, ArrayHelper.searchSorted(sorted, 2));
    assertEquals(3, ArrayHelper.searchSorted(sorted, 9));
  }

  @Test
  public void testTranspose() {
    double[][] t = ArrayHelper.transpose(new double[][] {{1, 2, 3}, {4, 5, 6}});
    assertArrayEquals(new double[] {1, 4}, t[0], 0);
    assertEquals(3, t.length);
  }
}
