package net.larse.tsprep.filter;

import org.junit.Test;

import static org.junit.Assert.*;

public class ButterworthFilterTest {

  @Test
  public void testLowpassKeepsLevel() {
    double[] x = new double[100];
    java.util.Arrays.fill(x, 5);
    double[] y = new ButterworthFilter(4, 0.125, ButterworthFilter.BandType.LOWPASS)
        .filtfilt(x);
    assertArrayEquals(x, y, 1e-8);
  }

  @Test
  public void testHighpassRemovesLevel() {
    double[] x = new double[100];
    java.util.Arrays.fill(x, 5);
    double[] y = new ButterworthFilter(2, 0.2, ButterworthFilter.BandType.HIGHPASS)
        .filtfilt(x);
    for (double v : y) {
      assertEquals(0, v, 1e-8);
    }
  }

  @Test
  public void testLowpassDampsFastOscillation() {
    double[] x = new double[200];
    for (int i = 0; i < x.length; i++) {
      x[i] = Math.sin(2 * Math.PI * i / 50.0) + Math.sin(Math.PI * i * 0.9);
    }
    double[] y = new ButterworthFilter(4, 0.125, ButterworthFilter.BandType.LOWPASS)
        .filtfilt(x);
    for (int i = 30; i < 170; i++) {
      assertEquals(Math.sin(2 * Math.PI * i / 50.0), y[i], 0.05);
    }
  }

  @Test
  public void testSectionsPerOrder() {
    assertEquals(2, new ButterworthFilter(4, 0.3, ButterworthFilter.BandType.LOWPASS)
        .sections().length);
  }
}
