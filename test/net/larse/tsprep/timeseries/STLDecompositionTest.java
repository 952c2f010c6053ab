package net.larse.tsprep.timeseries;

import net.larse.tsprep.Frames;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class STLDecompositionTest {
  double[] y;

  @Before
  public void setUp() {
    y = new double[140];
    for (int i = 0; i < y.length; i++) {
      y[i] = 10 + 0.1 * i + 3 * Math.sin(2 * Math.PI * i / 7.0);
    }
  }

  @Test
  public void testComponentsAddUp() {
    STLDecomposition stl = new STLDecomposition(y, 7);
    double[] trend = stl.getTrend();
    double[] seasonal = stl.getSeasonal();
    double[] remainder = stl.getRemainder();
    for (int i = 0; i < y.length; i++) {
      assertEquals(y[i], trend[i] + seasonal[i] + remainder[i], 1e-9);
    }
  }

  @Test
  public void testSeparatesSeason() {
    STLDecomposition stl = new STLDecomposition(y, 7, 7, false);
    double[] seasonal = stl.getSeasonal();
    // interior points, away from the loess edges
    for (int i = 21; i < 119; i++) {
      assertEquals(3 * Math.sin(2 * Math.PI * i / 7.0), seasonal[i], 0.5);
    }
  }

  @Test
  public void testClassicalDecompose() {
    double[][] parts = TimeSeriesUtils.classicalDecompose(y, 7);
    // trend is undefined for the first half window
    assertTrue(Double.isNaN(parts[0][0]));
    assertEquals(10 + 0.1 * 70, parts[0][70], 1e-9);
  }

  @Test
  public void testInferPeriod() {
    assertEquals(7, TimeSeriesUtils.inferPeriod(Frames.daily(30)));
  }
}
