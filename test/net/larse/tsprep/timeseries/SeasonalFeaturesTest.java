package net.larse.tsprep.timeseries;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Random;

import net.larse.tsprep.timeseries.SeasonalFeatures.SeasonalBucket;
import org.junit.Test;

import static org.junit.Assert.*;

public class SeasonalFeaturesTest {

  @Test
  public void testHourlyYearIsHourlyBucket() {
    LocalDateTime[] idx = TimeSeriesFrame.hourlyIndex(LocalDateTime.of(2021, 1, 1, 0, 0), 8760);
    assertEquals(1.0 / 8760, SeasonalFeatures.seasonalRatio(idx), 1e-12);
    assertEquals(SeasonalBucket.HOURLY, SeasonalFeatures.seasonalBucket(idx));
  }

  @Test
  public void testFiveDailyYearsIsDailyBucket() {
    LocalDateTime[] idx = TimeSeriesFrame.dailyIndex(LocalDate.of(2015, 1, 1), 1826);
    assertEquals(5.0 / 1826, SeasonalFeatures.seasonalRatio(idx), 1e-12);
    assertEquals(SeasonalBucket.DAILY, SeasonalFeatures.seasonalBucket(idx));
  }

  @Test
  public void testBucketThresholds() {
    assertEquals(SeasonalBucket.HOURLY, SeasonalBucket.forRatio(0.0009));
    assertEquals(SeasonalBucket.DAILY, SeasonalBucket.forRatio(0.001));
    assertEquals(SeasonalBucket.WEEKLY, SeasonalBucket.forRatio(0.012));
    assertEquals(SeasonalBucket.MONTHLY, SeasonalBucket.forRatio(0.05));
    assertEquals(SeasonalBucket.YEARLY, SeasonalBucket.forRatio(0.5));
  }

  @Test
  public void testFourierSeries() {
    double[][] f = SeasonalFeatures.fourierSeries(new double[] {0, 1.75}, 7, 2);
    assertEquals(4, f[0].length);
    assertArrayEquals(new double[] {1, 1, 0, 0}, f[0], 1e-12);
    // quarter period: cos(pi/2), cos(pi), sin(pi/2), sin(pi)
    assertArrayEquals(new double[] {0, -1, 1, 0}, f[1], 1e-12);
  }

  @Test
  public void testSimpleDatePart() {
    LocalDateTime[] idx = TimeSeriesFrame.dailyIndex(LocalDate.of(2021, 3, 6), 2);
    FeatureMatrix f = SeasonalFeatures.datePart(idx, "simple");
    assertEquals(Arrays.asList("year", "month", "day", "weekday"), Arrays.asList(f.names()));
    // 2021-03-06 is a Saturday, Monday is 0
    assertArrayEquals(new double[] {2021, 3, 6, 5}, f.values()[0], 0);
  }

  @Test
  public void testOneHotMethodsAreBinary() {
    LocalDateTime[] idx = TimeSeriesFrame.dailyIndex(LocalDate.of(2021, 1, 1), 60);
    FeatureMatrix f = SeasonalFeatures.datePart(idx, "simple_binarized");
    double[][] v = f.values();
    int monthCols = 0;
    for (int c = 0; c < f.cols(); c++) {
      if (f.names()[c].startsWith("month")) {
        monthCols++;
        for (double[] row : v) {
          assertTrue(row[c] == 0 || row[c] == 1);
        }
      }
    }
    assertEquals(12, monthCols);
  }

  @Test
  public void testPolynomialWidensFeatures() {
    LocalDateTime[] idx = TimeSeriesFrame.dailyIndex(LocalDate.of(2021, 1, 1), 10);
    int plain = SeasonalFeatures.datePart(idx, "simple").cols();
    int poly = SeasonalFeatures.datePart(idx, "simple", 2).cols();
    assertTrue(poly > plain);
    assertEquals(poly, SeasonalFeatures.datePart(idx, "simple_poly").cols());
  }

  @Test
  public void testEveryMethodProducesRows() {
    LocalDateTime[] idx = TimeSeriesFrame.dailyIndex(LocalDate.of(2019, 6, 1), 400);
    for (String method : SeasonalFeatures.DATE_PART_METHODS) {
      FeatureMatrix f = SeasonalFeatures.datePart(idx, method);
      assertEquals(method, 400, f.rows());
      assertTrue(method, f.cols() > 0);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownMethod() {
    SeasonalFeatures.datePart(TimeSeriesFrame.dailyIndex(LocalDate.of(2021, 1, 1), 3), "nope");
  }

  @Test
  public void testSeasonalIntBounds() {
    Random random = new Random(11);
    for (int i = 0; i < 500; i++) {
      int lag = SeasonalFeatures.seasonalInt(random);
      assertTrue(lag >= 2);
      assertTrue(SeasonalFeatures.seasonalInt(random, false, false, true) <= 30);
      assertTrue(SeasonalFeatures.seasonalInt(random, true, true, false) <= 364);
    }
  }

  @Test
  public void testNumericSeasonalityIsTenFourierPairs() {
    LocalDateTime[] idx = TimeSeriesFrame.dailyIndex(LocalDate.of(2021, 1, 1), 60);
    double[] t = new double[idx.length];
    for (int i = 0; i < t.length; i++) {
      t[i] = i;
    }
    FeatureMatrix m = SeasonalFeatures.createSeasonalityFeature(idx, t, 7, null);
    assertEquals(20, m.cols());
    assertEquals(60, m.rows());
    for (double v : m.values()[13]) {
      assertTrue(Math.abs(v) <= 1 + 1e-12);
    }
  }

  @Test
  public void testNamedSeasonalityIsOneHot() {
    LocalDateTime[] idx = TimeSeriesFrame.dailyIndex(LocalDate.of(2021, 1, 1), 30);
    FeatureMatrix m = SeasonalFeatures.createSeasonalityFeature(idx, null, "dayofweek", null);
    assertEquals(7, m.cols());
    for (double[] row : m.values()) {
      assertEquals(1, Arrays.stream(row).sum(), 0);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownSeasonality() {
    LocalDateTime[] idx = TimeSeriesFrame.dailyIndex(LocalDate.of(2021, 1, 1), 30);
    SeasonalFeatures.createSeasonalityFeature(idx, null, "fortnight", null);
  }

  @Test
  public void testSeasonalWindowMatch() {
    LocalDateTime[] idx = TimeSeriesFrame.dailyIndex(LocalDate.of(2021, 1, 1), 120);
    SeasonalFeatures.WindowMatch match =
        SeasonalFeatures.seasonalWindowMatch(idx, 3, 7, 7, "simple_binarized", "mae");
    assertEquals(120 - 7 - 7 + 1, match.scores.length);
    assertEquals(7, match.positions.length);
    assertEquals(3, match.positions[0].length);
    double best = Arrays.stream(match.scores).min().getAsDouble();
    assertEquals(best, match.scores[match.positions[0][0] - 7], 0);
    for (int j = 0; j < 3; j++) {
      for (int h = 1; h < 7; h++) {
        assertEquals(match.positions[0][j] + h, match.positions[h][j]);
      }
    }
  }
}
