package net.larse.tsprep.pipeline;

import com.google.common.collect.ImmutableList;

import java.util.Random;

import net.larse.tsprep.Frames;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import net.larse.tsprep.transforms.InverseMode;
import net.larse.tsprep.transforms.SpeedTier;
import org.junit.Test;

import static org.junit.Assert.*;

public class RandomTransformTest {
  @Test
  public void testSameSeedSameConfig() {
    RandomTransform generator = new RandomTransform().catalog("superfast");
    for (int seed = 0; seed < 20; seed++) {
      assertEquals(generator.generate(new Random(seed)), generator.generate(new Random(seed)));
    }
  }

  @Test
  public void testDepthBounds() {
    RandomTransform generator =
        new RandomTransform().catalog("superfast").minDepth(2).maxDepth(3);
    Random random = new Random(1);
    for (int i = 0; i < 50; i++) {
      int depth = generator.generate(random).steps().size();
      assertTrue(String.valueOf(depth), depth >= 2 && depth <= 3);
    }
    assertTrue(new RandomTransform().maxDepth(0).generate(random).isEmpty());
  }

  @Test
  public void testStepsComeFromTheCatalog() {
    RandomTransform generator = new RandomTransform()
        .catalog(ImmutableList.of("Detrend", "MinMaxScaler"))
        .allowNone(false);
    Random random = new Random(4);
    for (int i = 0; i < 30; i++) {
      for (TransformStep step : generator.generate(random).steps()) {
        assertTrue(step.name(), step.name().equals("Detrend")
            || step.name().equals("MinMaxScaler"));
      }
    }
  }

  @Test
  public void testNoNanFill() {
    RandomTransform generator = new RandomTransform().noNanFill(true);
    Random random = new Random(2);
    for (int i = 0; i < 20; i++) {
      assertNull(generator.generate(random).fillNa());
    }
  }

  @Test
  public void testTraditionalOrder() {
    RandomTransform generator =
        new RandomTransform().traditionalOrder(true).minDepth(4).maxDepth(4);
    TransformConfig config = generator.generate(new Random(9));
    assertEquals(4, config.steps().size());
    assertEquals("ClipOutliers", config.steps().get(0).name());
    assertEquals("Detrend", config.steps().get(1).name());
    assertEquals("AlignLastValue", config.steps().get(3).name());
  }

  @Test
  public void testTierFollowsTheCatalog() {
    assertEquals(SpeedTier.ALL, new RandomTransform().tier());
    assertEquals(SpeedTier.FAST, new RandomTransform().catalog("fast").tier());
    assertEquals(SpeedTier.SUPERFAST, new RandomTransform().catalog("superfast").tier());
    assertEquals(SpeedTier.FAST,
        new RandomTransform().catalog("fast").superfastParams(false).tier());
    assertEquals(SpeedTier.SUPERFAST,
        new RandomTransform().superfastParams(true).tier());
  }

  @Test
  public void testCatalogAliases() {
    assertSame(TransformerCatalog.ALL, TransformerCatalog.resolve(null));
    assertSame(TransformerCatalog.FAST, TransformerCatalog.resolve("Default"));
    assertSame(TransformerCatalog.FILTERS, TransformerCatalog.resolve("filters"));
    assertFalse(TransformerCatalog.FAST.containsKey("BTCD"));
    assertTrue(TransformerCatalog.FAST.containsKey("Detrend"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownCatalogAlias() {
    TransformerCatalog.resolve("everything");
  }

  @Test
  public void testRandomSuperfastPipelinesRun() {
    TimeSeriesFrame df = Frames.walks(150, 2, 30);
    RandomTransform generator = new RandomTransform().catalog("superfast").maxDepth(3);
    Random random = new Random(12);
    for (int i = 0; i < 20; i++) {
      TransformConfig config = generator.generate(random);
      GeneralTransformer t = new GeneralTransformer(config);
      TimeSeriesFrame out = t.fitTransform(df);
      TimeSeriesFrame back = t.inverseTransform(out, InverseMode.ORIGINAL, false);
      assertEquals(config.toString(), df.cols(), back.cols());
    }
  }

  @Test
  public void testRandomCleaners() {
    Random random = new Random(6);
    int none = 0;
    for (int i = 0; i < 100; i++) {
      TransformConfig cleaners = RandomTransform.randomCleaners(random);
      if (cleaners == null) {
        none++;
      } else {
        assertFalse(cleaners.isEmpty());
      }
    }
    // about half are null given the weights
    assertTrue(String.valueOf(none), none > 25 && none < 80);
  }
}
