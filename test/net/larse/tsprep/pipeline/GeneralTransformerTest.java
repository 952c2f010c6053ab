package net.larse.tsprep.pipeline;

import java.util.List;

import net.larse.tsprep.Frames;
import net.larse.tsprep.exception.MultivariateRequiredException;
import net.larse.tsprep.exception.TransformException;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import net.larse.tsprep.transforms.Detrend;
import net.larse.tsprep.transforms.DifferencedTransformer;
import net.larse.tsprep.transforms.EmptyTransformer;
import net.larse.tsprep.transforms.InverseMode;
import net.larse.tsprep.transforms.PCA;
import net.larse.tsprep.transforms.Transformer;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GeneralTransformerTest {
  private TimeSeriesFrame full;
  private TimeSeriesFrame history;

  @Before
  public void setUp() {
    full = Frames.walks(120, 3, 21);
    history = full.head(100);
  }

  @Test
  public void testOriginalRoundTrip() {
    GeneralTransformer t = new GeneralTransformer(TransformConfig.of(null, "Detrend",
        "DifferencedTransformer", "StandardScaler"));
    TimeSeriesFrame out = t.fitTransform(history);
    assertEquals(history.rows(), out.rows());
    TimeSeriesFrame back = t.inverseTransform(out, InverseMode.ORIGINAL, false);
    assertEquals(0, Frames.maxAbsDiff(history, back), 1e-8);
  }

  @Test
  public void testForecastContinuesTheHistory() {
    GeneralTransformer t =
        new GeneralTransformer(TransformConfig.of(null, "Detrend", "DifferencedTransformer"));
    t.fit(history);
    TimeSeriesFrame future = t.transform(full).tail(20);
    TimeSeriesFrame back = t.inverseTransform(future, InverseMode.FORECAST, false);
    assertEquals(0, Frames.maxAbsDiff(full.tail(20), back), 1e-8);
    assertArrayEquals(full.tail(20).index(), t.trackedIndex());
  }

  @Test
  public void testFitMatchesFitTransform() {
    TransformConfig config = TransformConfig.of(null, "Detrend", "MinMaxScaler");
    TimeSeriesFrame a = new GeneralTransformer(config).fitTransform(history);
    GeneralTransformer t = new GeneralTransformer(config).fit(history);
    assertEquals(0, Frames.maxAbsDiff(a, t.transform(history)), 1e-10);
  }

  @Test
  public void testTransformersInStepOrder() {
    GeneralTransformer t =
        new GeneralTransformer(TransformConfig.of(null, "Detrend", "DifferencedTransformer"));
    t.fit(history);
    List<Transformer> fitted = t.transformers();
    assertEquals(2, fitted.size());
    assertTrue(fitted.get(0) instanceof Detrend);
    assertTrue(fitted.get(1) instanceof DifferencedTransformer);
  }

  @Test
  public void testFillsMissingValuesFirst() {
    TimeSeriesFrame df = Frames.single(1, Double.NaN, 3, Double.NaN);
    GeneralTransformer t = new GeneralTransformer(TransformConfig.of("ffill"));
    assertArrayEquals(new double[] {1, 1, 3, 3}, t.fitTransform(df).column(0), 0);
  }

  @Test
  public void testEmptyConfigIsIdentity() {
    GeneralTransformer t = new GeneralTransformer(TransformConfig.of(null));
    assertSame(history, t.fitTransform(history));
    assertSame(history, t.inverseTransform(history, InverseMode.ORIGINAL, false));
  }

  @Test
  public void testTracksDecomposedColumns() {
    GeneralTransformer t = new GeneralTransformer(TransformConfig.of(null, "PCA"));
    t.fitTransform(history);
    assertArrayEquals(new String[] {"0", "1", "2"}, t.trackedColumns());
    t.inverseTransform(t.transform(history), InverseMode.ORIGINAL, false);
    assertArrayEquals(history.columns(), t.trackedColumns());
  }

  @Test
  public void testStepFailureNamesTheStep() {
    GeneralTransformer t = new GeneralTransformer(TransformConfig.of(null, "Round", "PCA"));
    try {
      t.fit(Frames.walks(40, 1, 2));
      fail("expected PCA to fail on one series");
    } catch (TransformException e) {
      assertEquals(PCA.NAME, e.getTransformerName());
      assertEquals("Transformer PCA failed on fit", e.getMessage());
      assertTrue(e.getCause() instanceof MultivariateRequiredException);
    }
  }

  @Test
  public void testUnknownNameIsANoOp() {
    GeneralTransformer t = new GeneralTransformer(TransformConfig.of(null, "NoSuchThing"));
    assertEquals(0, Frames.maxAbsDiff(history, t.fitTransform(history)), 0);
    assertTrue(t.transformers().get(0) instanceof EmptyTransformer);
  }

  @Test
  public void testContextSeedReachesSteps() {
    TransformConfig config = TransformConfig.of(null, "FastICA");
    TimeSeriesFrame a = new GeneralTransformer(config, new TransformContext(5, 1))
        .fitTransform(history);
    TimeSeriesFrame b = new GeneralTransformer(config, new TransformContext(5, 1))
        .fitTransform(history);
    assertEquals(0, Frames.maxAbsDiff(a, b), 0);
  }

  @Test(expected = IllegalStateException.class)
  public void testTransformBeforeFit() {
    new GeneralTransformer(TransformConfig.of(null, "Detrend")).transform(history);
  }

  @Test
  public void testFillZeroAfterInverse() {
    GeneralTransformer t = new GeneralTransformer(TransformConfig.of(null));
    t.fit(Frames.single(1, 2));
    TimeSeriesFrame back = t.inverseTransform(Frames.single(Double.NaN, 4),
        InverseMode.FORECAST, true, false);
    assertArrayEquals(new double[] {0, 4}, back.column(0), 0);
  }
}
