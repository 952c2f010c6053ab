package net.larse.tsprep.filter;

import org.junit.Test;

import static org.junit.Assert.*;

public class SavitzkyGolayFilterTest {

  private static double[] quadratic(int n) {
    double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = 0.5 * i * i - 3 * i + 2;
    }
    return x;
  }

  @Test
  public void testPreservesPolynomialWithInterpEdges() {
    double[] x = quadratic(25);
    double[] y = new SavitzkyGolayFilter(7, 2, 0, SavitzkyGolayFilter.Mode.INTERP).filter(x);
    assertArrayEquals(x, y, 1e-8);
  }

  @Test
  public void testFirstDerivative() {
    double[] x = quadratic(25);
    double[] y = new SavitzkyGolayFilter(5, 2, 1, SavitzkyGolayFilter.Mode.MIRROR).filter(x);
    for (int i = 2; i < 23; i++) {
      assertEquals(i - 3.0, y[i], 1e-8);
    }
  }

  @Test
  public void testSmoothsNoise() {
    double[] x = new double[60];
    for (int i = 0; i < x.length; i++) {
      x[i] = i % 2 == 0 ? 1 : -1;
    }
    double[] y = new SavitzkyGolayFilter(9, 1, 0, SavitzkyGolayFilter.Mode.NEAREST).filter(x);
    for (int i = 5; i < 55; i++) {
      assertTrue(Math.abs(y[i]) < 0.2);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEvenWindowRejected() {
    new SavitzkyGolayFilter(6, 2, 0, SavitzkyGolayFilter.Mode.MIRROR);
  }
}
