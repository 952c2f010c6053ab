package net.larse.tsprep.filter;

import org.apache.commons.math.complex.Complex;
import org.junit.Test;

import static org.junit.Assert.*;

public class SignalFiltersTest {

  @Test
  public void testFftRoundTripAnyLength() {
    for (int n : new int[] {8, 6}) {
      double[] x = new double[n];
      for (int i = 0; i < n; i++) {
        x[i] = Math.cos(i) + i;
      }
      Complex[] back = SignalFilters.ifft(SignalFilters.fft(x));
      for (int i = 0; i < n; i++) {
        assertEquals(x[i], back[i].getReal(), 1e-9);
        assertEquals(0, back[i].getImaginary(), 1e-9);
      }
    }
  }

  @Test
  public void testFftFreq() {
    assertArrayEquals(new double[] {0, 0.25, -0.5, -0.25}, SignalFilters.fftFreq(4, 1), 0);
    assertArrayEquals(new double[] {0, 0.2, 0.4, -0.4, -0.2}, SignalFilters.fftFreq(5, 1),
        1e-12);
  }

  @Test
  public void testHilbertEnvelopeOfCosine() {
    double[] x = new double[64];
    for (int i = 0; i < x.length; i++) {
      x[i] = 2 * Math.cos(2 * Math.PI * 4 * i / 64.0);
    }
    for (double v : SignalFilters.hilbertEnvelope(x)) {
      assertEquals(2, v, 1e-9);
    }
  }

  @Test
  public void testEwma() {
    double[] x = {1, 2, 3};
    assertArrayEquals(x, SignalFilters.ewma(x, 1), 1e-12);
    // span 3, alpha 0.5: (2 + 0.5 * 1) / 1.5
    assertEquals(2.5 / 1.5, SignalFilters.ewma(x, 3)[1], 1e-12);
    double[] gap = SignalFilters.ewma(new double[] {1, Double.NaN, 3}, 3);
    assertEquals(1, gap[1], 1e-12);
    assertEquals((3 + 0.25) / 1.25, gap[2], 1e-12);
  }

  @Test
  public void testWienerFlattensConstant() {
    double[] x = new double[20];
    java.util.Arrays.fill(x, 4);
    double[] y = SignalFilters.wiener(x, 3);
    for (int i = 1; i < 19; i++) {
      assertEquals(4, y[i], 1e-12);
    }
  }
}
