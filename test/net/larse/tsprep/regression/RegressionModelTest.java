package net.larse.tsprep.regression;

import com.google.common.collect.ImmutableMap;

import java.util.Random;

import org.junit.Test;

import static org.junit.Assert.*;

public class RegressionModelTest {

  @Test
  public void testMapForm() {
    RegressionModel m = RegressionModel.fromMap(ImmutableMap.of("model", "DecisionTree",
        "model_params", ImmutableMap.of("max_depth", 3)));
    assertEquals("DecisionTree", m.model());
    assertEquals(3, m.params().get("max_depth"));
    assertEquals(m, RegressionModel.fromMap(m.toMap()));
  }

  @Test
  public void testEveryNamedModelCreates() {
    double[][] x = new double[12][1];
    double[][] y = new double[12][1];
    for (int i = 0; i < 12; i++) {
      x[i][0] = i;
      y[i][0] = 1 + i;
    }
    for (String name : new String[] {"Linear", "Ridge", "FastRidge", "ElasticNet",
        "DecisionTree", "RandomForest", "ExtraTrees", "KNN", "Poisson", "Gamma", "Tweedie",
        "Robust"}) {
      Regressor r = RegressionModel.of(name).create(2020);
      assertEquals(name, 12, r.fit(x, y).predict(x).length);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownModel() {
    RegressionModel.of("Transformer").create(0);
  }

  @Test
  public void testRandomDrawsFromCatalog() {
    Random random = new Random(8);
    for (int i = 0; i < 50; i++) {
      RegressionModel m = RegressionModel.random(RegressionModel.FAST_MODELS, random);
      assertTrue(RegressionModel.FAST_MODELS.containsKey(m.model()));
      assertNotNull(m.create(1));
    }
  }
}
