package net.larse.tsprep.pipeline;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import static org.junit.Assert.*;

public class TransformConfigTest {
  private static Map<String, Object> configMap() {
    Map<Object, Object> names = new LinkedHashMap<>();
    names.put("1", "SeasonalDifference");
    names.put(0, "Detrend");
    Map<Object, Object> params = new LinkedHashMap<>();
    params.put(0, ImmutableMap.of("model", "Linear", "phi", 0.9));
    params.put("1", ImmutableMap.of("lag_1", 12, "method", "Mean"));
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("fillna", "ffill");
    map.put("transformations", names);
    map.put("transformation_params", params);
    return map;
  }

  @Test
  public void testFromMapOrdersStepsAndAppliesParams() {
    TransformConfig config = TransformConfig.fromMap(configMap());
    assertEquals("ffill", config.fillNa());
    assertEquals(2, config.steps().size());
    TransformStep detrend = config.steps().get(0);
    assertEquals("Detrend", detrend.name());
    assertEquals("Linear", detrend.args().toMap().get("model"));
    assertEquals(0.9, (Double) detrend.args().toMap().get("phi"), 0);
    TransformStep seasonal = config.steps().get(1);
    assertEquals(1, seasonal.index());
    assertEquals(12, seasonal.args().toMap().get("lag1"));
    assertEquals("Mean", seasonal.args().toMap().get("method"));
  }

  @Test
  public void testMapFormRoundTrips() {
    TransformConfig config = TransformConfig.fromMap(configMap());
    TransformConfig again = TransformConfig.fromMap(config.toMap());
    assertEquals(config, again);
    assertEquals(config.hashCode(), again.hashCode());
  }

  @Test
  public void testEqualityComparesArguments() {
    TransformConfig a = TransformConfig.of("ffill", "Detrend");
    assertEquals(a, TransformConfig.of("ffill", "Detrend"));
    assertNotEquals(a, TransformConfig.of("mean", "Detrend"));
    assertNotEquals(a, TransformConfig.fromMap(ImmutableMap.of("fillna", "ffill",
        "transformations", ImmutableMap.of(0, "Detrend"),
        "transformation_params", ImmutableMap.of(0, ImmutableMap.of("model", "Linear")))));
  }

  @Test
  public void testStepArgsAreCopies() {
    TransformStep step = TransformStep.of(0, "SeasonalDifference");
    step.args().set("lag1", 30);
    assertEquals(7, step.args().toMap().get("lag1"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateIndexRejected() {
    new TransformConfig(null,
        ImmutableList.of(TransformStep.of(0, "Detrend"), TransformStep.of(0, "Round")));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownParameterRejected() {
    TransformConfig.fromMap(ImmutableMap.of("transformations", ImmutableMap.of(0, "Detrend"),
        "transformation_params", ImmutableMap.of(0, ImmutableMap.of("degree", 2))));
  }

  @Test
  public void testMissingSectionsMakeAnEmptyConfig() {
    TransformConfig config = TransformConfig.fromMap(ImmutableMap.of());
    assertTrue(config.isEmpty());
    assertNull(config.fillNa());
  }

  @Test
  public void testUnknownNamesKeepTheirName() {
    TransformConfig config = TransformConfig.of(null, "NotATransformer");
    assertEquals("NotATransformer", config.steps().get(0).name());
    assertTrue(config.steps().get(0).args().toMap().isEmpty());
  }
}
