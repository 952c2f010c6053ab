package net.larse.tsprep.anomaly;

import com.google.common.collect.ImmutableMap;

import java.util.Random;

import net.larse.tsprep.Frames;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class AnomalyDetectorTest {
  private TimeSeriesFrame df;

  @Before
  public void setUp() {
    Random random = new Random(17);
    double[] x = new double[300];
    for (int i = 0; i < x.length; i++) {
      x[i] = 5 + Math.sin(2 * Math.PI * i / 30.0) + 0.05 * random.nextGaussian();
    }
    x[150] = 40;
    df = Frames.single(x);
  }

  @Test
  public void testEveryMethodFindsTheSpike() {
    for (String method : AnomalyDetector.METHODS) {
      AnomalyResult result = new AnomalyDetector(method, null).detect(df);
      assertTrue(method, result.isAnomaly(150, 0));
      assertEquals(df.rows(), result.scores().rows());
    }
  }

  @Test
  public void testZscoreFlagsOnlyTheSpike() {
    // two-sided 0.0027 is the three sigma band
    AnomalyResult result = new AnomalyDetector("zscore",
        ImmutableMap.of("distribution", "norm", "alpha", 0.0027)).detect(df);
    assertEquals(1, result.count());
    assertTrue(result.scores().get(150, 0) > 5);
  }

  @Test
  public void testIqrScoresAreZeroInsideTheBox() {
    AnomalyResult result = new AnomalyDetector("IQR", null).detect(df);
    int inside = 0;
    for (int i = 0; i < df.rows(); i++) {
      if (result.scores().get(i, 0) == 0) {
        inside++;
      }
    }
    assertTrue(inside >= df.rows() / 2);
  }

  @Test
  public void testMedDiffScoresAreStepsOverTheMedianStep() {
    AnomalyResult result = new AnomalyDetector("med_diff", null).detect(df);
    assertTrue(Double.isNaN(result.scores().get(0, 0)));
    assertTrue(result.isAnomaly(150, 0));
    // the step back down is as large as the step up
    assertTrue(result.isAnomaly(151, 0));
  }

  @Test
  public void testUnivariateCollapsesToOneColumn() {
    TimeSeriesFrame two = df.withColumns(new String[] {"a", "b"},
        new double[][] {df.column(0), Frames.seasonal(300, 1, 2).column(0)});
    AnomalyResult result = new AnomalyDetector("univariate", "zscore", null).detect(two);
    assertArrayEquals(new String[] {AnomalyDetector.UNIVARIATE_COLUMN},
        result.flags().columns());
    assertTrue(result.isAnomaly(150, 0));
  }

  @Test
  public void testNaNIsScoredNaNAndNotFlagged() {
    double[] x = df.column(0);
    x[10] = Double.NaN;
    AnomalyResult result = new AnomalyDetector("mad", null).detect(Frames.single(x));
    assertTrue(Double.isNaN(result.scores().get(10, 0)));
    assertFalse(result.isAnomaly(10, 0));
  }

  @Test
  public void testPValueDistributions() {
    double[] scores = {0, 1.959964, -1.959964};
    double[] norm = AnomalyDetector.pValues(scores, "norm");
    assertEquals(1, norm[0], 1e-9);
    assertEquals(0.05, norm[1], 1e-5);
    assertEquals(0.05, norm[2], 1e-5);
    for (String d : AnomalyDetector.DISTRIBUTIONS) {
      for (double p : AnomalyDetector.pValues(scores, d)) {
        assertTrue(d, p >= 0 && p <= 1);
      }
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownMethod() {
    new AnomalyDetector("isolation_forest", null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownDistribution() {
    new AnomalyDetector("zscore", ImmutableMap.of("distribution", "cauchy"));
  }

  @Test
  public void testRandomParamsAreAccepted() {
    Random random = new Random(3);
    for (int i = 0; i < 50; i++) {
      String method = AnomalyDetector.randomMethod(random, i % 2 == 0);
      new AnomalyDetector(method, AnomalyDetector.randomParams(method, random)).detect(df);
    }
  }

  @Test
  public void testClassifierLearnsTheThreshold() {
    AnomalyResult result = new AnomalyDetector("zscore", null).detect(df);
    AnomalyClassifier classifier = new AnomalyClassifier(result);
    TimeSeriesFrame newScores = Frames.single(0.1, -0.5, 30, Double.NaN);
    TimeSeriesFrame flags = classifier.scoreToAnomaly(newScores);
    assertArrayEquals(new double[] {1, 1, -1, 1}, flags.column(0), 0);
  }
}
