package net.larse.tsprep.filter;

import org.junit.Test;

import static org.junit.Assert.*;

public class BandPassFiltersTest {

  @Test
  public void testBaxterKingRemovesLevel() {
    double[] x = new double[30];
    java.util.Arrays.fill(x, 7);
    double[] cycle = BandPassFilters.baxterKing(x, 6, 32, 3);
    for (int i = 0; i < 3; i++) {
      assertTrue(Double.isNaN(cycle[i]));
      assertTrue(Double.isNaN(cycle[29 - i]));
    }
    for (int i = 3; i < 27; i++) {
      assertEquals(0, cycle[i], 1e-12);
    }
  }

  @Test
  public void testChristianoFitzgeraldParts() {
    double[] x = new double[40];
    for (int i = 0; i < x.length; i++) {
      x[i] = 0.3 * i + Math.sin(2 * Math.PI * i / 12.0);
    }
    double[][] parts = BandPassFilters.christianoFitzgerald(x, 6, 32, true);
    double slope = (x[39] - x[0]) / 39;
    for (int i = 0; i < x.length; i++) {
      assertEquals(x[i] - i * slope, parts[0][i] + parts[1][i], 1e-9);
    }
  }

  @Test
  public void testConvolution() {
    double[] y = BandPassFilters.convolution(new double[] {0, 4, 8}, new double[] {0.75, 0.25});
    assertEquals(3, y[0], 1e-12);
    assertEquals(7, y[1], 1e-12);
    assertTrue(Double.isNaN(y[2]));
  }
}
