package net.larse.tsprep.transforms;

import net.larse.tsprep.Frames;
import net.larse.tsprep.regression.RegressionModel;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import net.larse.tsprep.transforms.scalers.MaxAbsScaler;
import net.larse.tsprep.transforms.scalers.MinMaxScaler;
import net.larse.tsprep.transforms.scalers.PowerTransformer;
import net.larse.tsprep.transforms.scalers.QuantileTransformer;
import net.larse.tsprep.transforms.scalers.RobustScaler;
import net.larse.tsprep.transforms.scalers.StandardScaler;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/** inverseTransform(transform(x)) recovers x for the invertible transformers. */
public class InverseRoundTripTest {
  private TimeSeriesFrame df;

  @Before
  public void setUp() {
    df = Frames.walks(120, 3, 11);
  }

  private void assertRoundTrip(Transformer t, double tolerance) {
    TimeSeriesFrame transformed = t.fitTransform(df);
    assertEquals(df.rows(), transformed.rows());
    TimeSeriesFrame back = t.inverseTransform(transformed);
    assertArrayEquals(df.columns(), back.columns());
    assertArrayEquals(df.index(), back.index());
    assertEquals(t.name(), 0, Frames.maxAbsDiff(df, back), tolerance);
  }

  @Test
  public void testScalers() {
    assertRoundTrip(new StandardScaler(), 1e-9);
    assertRoundTrip(new MinMaxScaler(), 1e-9);
    assertRoundTrip(new MaxAbsScaler(), 1e-9);
    assertRoundTrip(new RobustScaler(), 1e-9);
    assertRoundTrip(new PowerTransformer(), 1e-6);
  }

  @Test
  public void testQuantileTransformer() {
    assertRoundTrip(new QuantileTransformer(new QuantileTransformer.Args()), 1e-6);
    QuantileTransformer.Args normal = new QuantileTransformer.Args();
    normal.outputDistribution = "normal";
    normal.nQuantiles = "quarter";
    // the normal tails are clipped, so only the bulk comes back exactly
    QuantileTransformer t = new QuantileTransformer(normal);
    TimeSeriesFrame back = t.inverseTransform(t.fitTransform(df));
    assertEquals(0, Frames.maxAbsDiff(df, back), 2);
  }

  @Test
  public void testLinearDecompositions() {
    assertRoundTrip(new PCA(new PCA.Args()), 1e-8);
    PCA.Args whiten = new PCA.Args();
    whiten.whiten = true;
    assertRoundTrip(new PCA(whiten), 1e-8);
    assertRoundTrip(new FastICA(new FastICA.Args()), 1e-6);
    assertRoundTrip(new Cointegration(new Cointegration.Args()), 1e-6);
    assertRoundTrip(new BTCD(new BTCD.Args()), 1e-6);
  }

  @Test
  public void testTrendRemovers() {
    assertRoundTrip(new Detrend(new Detrend.Args()), 1e-9);
    Detrend.Args linear = new Detrend.Args();
    linear.model = "Linear";
    assertRoundTrip(new Detrend(linear), 1e-9);
    Detrend.Args poisson = new Detrend.Args();
    poisson.model = "Poisson";
    assertRoundTrip(new Detrend(poisson), 1e-6);
    assertRoundTrip(new LocalLinearTrend(new LocalLinearTrend.Args()), 1e-9);
    assertRoundTrip(new SinTrend(new SinTrend.Args()), 1e-9);
  }

  @Test
  public void testDatepartRegression() {
    assertRoundTrip(new DatepartRegression(new DatepartRegression.Args()), 1e-9);
    DatepartRegression.Args ridge = new DatepartRegression.Args();
    ridge.regressionModel = RegressionModel.of("Ridge");
    ridge.datepartMethod = "simple_binarized";
    assertRoundTrip(new DatepartRegression(ridge), 1e-9);
  }

  @Test
  public void testShiftsAndScales() {
    assertRoundTrip(new PositiveShift(), 1e-9);
    PositiveShift.Args log = new PositiveShift.Args();
    log.log = true;
    assertRoundTrip(new PositiveShift(log), 1e-9);
    PositiveShift.Args squared = new PositiveShift.Args();
    squared.squared = true;
    assertRoundTrip(new PositiveShift(squared), 1e-9);
    CenterLastValue.Args rows = new CenterLastValue.Args();
    rows.rows = 7;
    assertRoundTrip(new CenterLastValue(rows), 1e-9);
    assertRoundTrip(new EmptyTransformer(), 0);
  }
}
