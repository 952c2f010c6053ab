package net.larse.tsprep.helper;

import org.junit.Test;

import static org.junit.Assert.*;

public class MatricesTest {

  @Test
  public void testLstsqRecoversCoefficients() {
    double[][] a = new double[20][2];
    double[][] b = new double[20][2];
    for (int i = 0; i < 20; i++) {
      a[i][0] = 1;
      a[i][1] = i;
      b[i][0] = 3 + 2 * i;
      b[i][1] = -1 + 0.5 * i;
    }
    double[][] x = FitGenerator.lstsq(a, b);
    assertEquals(3, x[0][0], 1e-9);
    assertEquals(2, x[1][0], 1e-9);
    assertEquals(-1, x[0][1], 1e-9);
    assertEquals(0.5, x[1][1], 1e-9);
  }

  @Test
  public void testInverse() {
    double[][] a = {{4, 7}, {2, 6}};
    double[][] product = Matrices.multiply(a, Matrices.inverse(a));
    double[][] id = Matrices.identity(2);
    for (int i = 0; i < 2; i++) {
      assertArrayEquals(id[i], product[i], 1e-12);
    }
  }

  @Test
  public void testSymmetricEigenDescending() {
    SymmetricEigen e = SymmetricEigen.of(new double[][] {{2, 1}, {1, 2}});
    assertArrayEquals(new double[] {3, 1}, e.values(), 1e-9);
    double[] v = e.vectors()[0];
    assertEquals(Math.abs(v[0]), Math.abs(v[1]), 1e-9);
  }

  @Test
  public void testGeneralizedEigen() {
    double[][] a = {{2, 0}, {0, 3}};
    double[][] b = {{4, 0}, {0, 1}};
    SymmetricEigen e = SymmetricEigen.generalized(a, b);
    // a v = lambda b v
    assertArrayEquals(new double[] {3, 0.5}, e.values(), 1e-9);
    double[] v = e.vectors()[1];
    double[] av = Matrices.multiply(a, v);
    double[] bv = Matrices.multiply(b, v);
    assertEquals(av[0], 0.5 * bv[0], 1e-9);
  }

  @Test
  public void testCovariance() {
    double[][] cov = Matrices.covariance(new double[][] {{1, 2}, {2, 4}, {3, 6}});
    assertEquals(1, cov[0][0], 1e-12);
    assertEquals(2, cov[0][1], 1e-12);
    assertEquals(4, cov[1][1], 1e-12);
  }
}
