package net.larse.tsprep.filter;

import java.util.Random;

import org.junit.Test;

import static org.junit.Assert.*;

public class KalmanSmootherTest {

  private static KalmanSmoother localLevel(double q, double r) {
    return new KalmanSmoother(new double[][] {{1}}, new double[][] {{q}},
        new double[][] {{1}}, r);
  }

  @Test
  public void testConstantSeriesUnchanged() {
    double[] y = new double[30];
    java.util.Arrays.fill(y, 3);
    assertArrayEquals(y, localLevel(0.1, 1).smooth(y), 1e-3);
  }

  @Test
  public void testReducesNoise() {
    Random random = new Random(5);
    double[] y = new double[200];
    double[] truth = new double[200];
    for (int i = 0; i < y.length; i++) {
      truth[i] = Math.sin(i / 20.0);
      y[i] = truth[i] + 0.5 * random.nextGaussian();
    }
    double[] s = localLevel(0.01, 0.25).smooth(y);
    double rawError = 0;
    double smoothError = 0;
    for (int i = 0; i < y.length; i++) {
      rawError += (y[i] - truth[i]) * (y[i] - truth[i]);
      smoothError += (s[i] - truth[i]) * (s[i] - truth[i]);
    }
    assertTrue(smoothError < rawError / 2);
  }

  @Test
  public void testMissingObservationsInterpolated() {
    double[] s = localLevel(0.1, 0.01).smooth(new double[] {1, 1, Double.NaN, 1, 1});
    assertEquals(1, s[2], 1e-6);
  }

  @Test
  public void testRandomStateSpaceIsConsistent() {
    KalmanSmoother k = KalmanSmoother.randomStateSpace(new Random(2));
    int dim = k.stateDimension();
    assertEquals(dim, k.stateTransition().length);
    assertEquals(dim, k.observationModel()[0].length);
  }
}
