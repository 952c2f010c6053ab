package net.larse.tsprep.regression;

import java.util.Random;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class RegressorsTest {
  double[][] x;
  double[][] y;

  @Before
  public void setUp() {
    x = new double[40][2];
    y = new double[40][1];
    for (int i = 0; i < 40; i++) {
      x[i][0] = i;
      x[i][1] = (i * 7) % 5;
      y[i][0] = 1 + 2 * x[i][0] - 3 * x[i][1];
    }
  }

  private static double maxError(Predictor p, double[][] x, double[][] y) {
    double[][] pred = p.predict(x);
    double max = 0;
    for (int i = 0; i < y.length; i++) {
      for (int k = 0; k < y[i].length; k++) {
        max = Math.max(max, Math.abs(pred[i][k] - y[i][k]));
      }
    }
    return max;
  }

  @Test
  public void testLinearExact() {
    assertEquals(0, maxError(new LinearRegression().fit(x, y), x, y), 1e-8);
  }

  @Test
  public void testLinearMultiTarget() {
    double[][] two = new double[40][2];
    for (int i = 0; i < 40; i++) {
      two[i][0] = y[i][0];
      two[i][1] = -y[i][0] + 4;
    }
    assertEquals(0, maxError(new LinearRegression().fit(x, two), x, two), 1e-8);
  }

  @Test
  public void testRidgeShrinksTowardsMean() {
    double loose = maxError(new RidgeRegression(1e-9, true).fit(x, y), x, y);
    double tight = maxError(new RidgeRegression(1e6, true).fit(x, y), x, y);
    assertEquals(0, loose, 1e-6);
    assertTrue(tight > 1);
  }

  @Test
  public void testElasticNet() {
    assertEquals(0, maxError(new ElasticNetRegression(1e-6, 0.5).fit(x, y), x, y), 0.1);
    // with a huge penalty every coefficient is zero and the intercept is the mean
    double[][] pred = new ElasticNetRegression(1e6, 0.5).fit(x, y).predict(x);
    double mean = 0;
    for (double[] row : y) {
      mean += row[0] / y.length;
    }
    assertEquals(mean, pred[0][0], 1e-9);
    assertEquals(mean, pred[39][0], 1e-9);
  }

  @Test
  public void testDecisionTreeStep() {
    double[][] step = new double[40][1];
    for (int i = 0; i < 40; i++) {
      step[i][0] = i < 20 ? 1 : 5;
    }
    Predictor p = new DecisionTreeRegressor(1, 2).fit(x, step);
    assertEquals(0, maxError(p, x, step), 1e-12);
  }

  @Test
  public void testUnlimitedTreeMemorizes() {
    Predictor p = new DecisionTreeRegressor(null, 2).fit(x, y);
    assertEquals(0, maxError(p, x, y), 1e-9);
  }

  @Test
  public void testForestsApproximate() {
    double range = 2 * 39 + 12;
    Predictor rf = TreeEnsembleRegressor.randomForest(20, 1).fit(x, y);
    Predictor et = TreeEnsembleRegressor.extraTrees(20, 1).fit(x, y);
    assertTrue(maxError(rf, x, y) < 0.25 * range);
    assertTrue(maxError(et, x, y) < 0.25 * range);
  }

  @Test
  public void testNearestNeighbor() {
    Predictor p = new KNeighborsRegressor(1, false).fit(x, y);
    assertEquals(0, maxError(p, x, y), 1e-12);
  }

  @Test
  public void testPoissonRecoversLogLinear() {
    double[][] xs = new double[30][1];
    double[][] ys = new double[30][1];
    for (int i = 0; i < 30; i++) {
      xs[i][0] = i / 10.0;
      ys[i][0] = Math.exp(0.5 + 0.8 * xs[i][0]);
    }
    Predictor p = new GeneralizedLinearRegression(GeneralizedLinearRegression.Family.POISSON)
        .fit(xs, ys);
    double[][] pred = p.predict(xs);
    for (int i = 0; i < 30; i++) {
      assertEquals(ys[i][0], pred[i][0], 1e-3 * ys[i][0]);
    }
  }

  @Test
  public void testRobustIgnoresOutlier() {
    double[][] noisy = new double[40][1];
    for (int i = 0; i < 40; i++) {
      noisy[i][0] = y[i][0];
    }
    noisy[10][0] += 500;
    double[][] pred = new RobustLinearRegression().fit(x, noisy).predict(x);
    assertEquals(y[20][0], pred[20][0], 0.5);
  }

  @Test
  public void testClassifier() {
    double[][] features = new double[20][1];
    int[] labels = new int[20];
    Random random = new Random(3);
    for (int i = 0; i < 20; i++) {
      features[i][0] = random.nextDouble() * 10;
      labels[i] = features[i][0] > 5 ? -1 : 1;
    }
    DecisionTreeClassifier.Model model = new DecisionTreeClassifier().fit(features, labels);
    assertArrayEquals(new int[] {1, -1}, model.predict(new double[][] {{0.5}, {9.5}}));
  }
}
