package net.larse.tsprep.pipeline;

import com.google.common.collect.ImmutableMap;

import java.util.Random;

import net.larse.tsprep.Frames;
import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import net.larse.tsprep.transforms.EmptyTransformer;
import net.larse.tsprep.transforms.PositiveShift;
import net.larse.tsprep.transforms.RollingMeanTransformer;
import net.larse.tsprep.transforms.SeasonalDifference;
import net.larse.tsprep.transforms.SpeedTier;
import net.larse.tsprep.transforms.StatsmodelsFilter;
import net.larse.tsprep.transforms.Transformer;
import org.junit.Test;

import static org.junit.Assert.*;

public class TransformerRegistryTest {
  private final TimeSeriesFrame df = Frames.walks(200, 2, 8);

  private Transformer create(String name) {
    return TransformerRegistry.create(TransformStep.of(0, name), df, TransformContext.DEFAULT);
  }

  @Test
  public void testEveryCatalogNameIsRegistered() {
    for (String name : TransformerCatalog.ALL.keySet()) {
      assertTrue(name, TransformerRegistry.contains(name));
    }
  }

  @Test
  public void testUnknownNamesCreateEmptyTransformer() {
    assertFalse(TransformerRegistry.contains("Wavelet"));
    assertTrue(create("Wavelet") instanceof EmptyTransformer);
    assertTrue(create("None") instanceof EmptyTransformer);
    assertTrue(TransformerRegistry.create(new TransformStep(0, "Wavelet",
        TransformerRegistry.args("Wavelet", ImmutableMap.of("level", 3))), df,
        TransformContext.DEFAULT) instanceof EmptyTransformer);
  }

  @Test
  public void testRandomParamsCreateAtEveryTier() {
    Random random = new Random(42);
    for (SpeedTier tier : SpeedTier.values()) {
      for (String name : TransformerRegistry.names()) {
        for (int draw = 0; draw < 5; draw++) {
          AlgorithmBase.ArgsBase args = TransformerRegistry.newParams(name, tier, random);
          Transformer t = TransformerRegistry.create(new TransformStep(0, name, args), df,
              TransformContext.DEFAULT);
          assertNotNull(name + " at " + tier, t);
        }
      }
    }
  }

  @Test
  public void testAliasesPresetTheirArguments() {
    assertEquals(12, TransformerRegistry.args("SeasonalDifference12", null).toMap().get("lag1"));
    assertEquals("Mean",
        TransformerRegistry.args("SeasonalDifference12", null).toMap().get("method"));
    assertEquals(true, TransformerRegistry.args("Log", null).toMap().get("log"));
    assertEquals("cffilter", TransformerRegistry.args("cffilter", null).toMap().get("method"));
    assertTrue(create("SeasonalDifference7") instanceof SeasonalDifference);
    assertTrue(create("Log") instanceof PositiveShift);
    assertTrue(create("bkfilter") instanceof StatsmodelsFilter);
    assertTrue(create("FixedRollingMean") instanceof RollingMeanTransformer);
  }

  @Test
  public void testRowShareWindowFollowsTheData() {
    RollingMeanTransformer t = (RollingMeanTransformer) create("RollingMean10thN");
    assertEquals(20, t.args().window);
  }

  @Test
  public void testContextOverridesSeed() {
    AlgorithmBase.ArgsBase args = TransformerRegistry.args("FastICA", null);
    TransformStep step = new TransformStep(0, "FastICA", args);
    TransformContext context = new TransformContext(99, 1);
    TransformerRegistry.create(step, df, context);
    // the step keeps its own copy
    assertEquals(2020L, step.args().toMap().get("randomSeed"));
  }

  @Test
  public void testParamsAccepted() {
    AlgorithmBase.ArgsBase args =
        TransformerRegistry.args("Detrend", ImmutableMap.of("model", "Linear", "phi", 0.98));
    assertEquals("Linear", args.toMap().get("model"));
    assertEquals(0.98, (Double) args.toMap().get("phi"), 0);
  }
}
