package net.larse.tsprep.helper;

import org.junit.Test;

import static org.junit.Assert.*;

public class DistributionsTest {

  @Test
  public void testNormal() {
    assertEquals(0.5, Distributions.normalCdf(0), 1e-9);
    assertEquals(0.975, Distributions.normalCdf(1.959964), 1e-6);
    assertEquals(0.025, Distributions.normalSf(1.959964), 1e-6);
    assertEquals(1.959964, Distributions.normalPpf(0.975), 1e-5);
  }

  @Test
  public void testChiSquared() {
    // P(X > 3.841) = 0.05 for one degree of freedom
    assertEquals(0.05, Distributions.chiSquaredSf(3.841459, 1), 1e-5);
  }

  @Test
  public void testGammaShiftAndScale() {
    // shape 1 is exponential: sf(x) = exp(-(x - loc) / scale)
    assertEquals(Math.exp(-1), Distributions.gammaSf(5, 1, 3, 2), 1e-7);
    assertEquals(1.0, Distributions.gammaSf(2, 1, 3, 2), 1e-12);
  }
}
