package net.larse.tsprep.filter;

import net.larse.tsprep.exception.NullValueException;
import org.junit.Test;

import static org.junit.Assert.*;

public class HodrickPrescottFilterTest {

  @Test
  public void testLineIsAllTrend() {
    double[] y = new double[50];
    for (int i = 0; i < y.length; i++) {
      y[i] = 2 + 0.5 * i;
    }
    assertArrayEquals(y, HodrickPrescottFilter.trend(y, 1600), 1e-6);
    for (double c : HodrickPrescottFilter.cycle(y, 1600)) {
      assertEquals(0, c, 1e-6);
    }
  }

  @Test
  public void testZeroLambdaIsIdentity() {
    double[] y = {3, 1, 4, 1, 5, 9, 2, 6};
    assertArrayEquals(y, HodrickPrescottFilter.trend(y, 0), 1e-10);
  }

  @Test
  public void testLargeLambdaApproachesLine() {
    double[] y = new double[40];
    for (int i = 0; i < y.length; i++) {
      y[i] = i + (i % 2 == 0 ? 1 : -1);
    }
    double[] t = HodrickPrescottFilter.trend(y, 1e9);
    for (int i = 1; i < t.length - 1; i++) {
      assertEquals(0, t[i + 1] - 2 * t[i] + t[i - 1], 1e-4);
    }
  }

  @Test(expected = NullValueException.class)
  public void testNaNRejected() {
    HodrickPrescottFilter.trend(new double[] {1, Double.NaN, 3, 4}, 10);
  }
}
