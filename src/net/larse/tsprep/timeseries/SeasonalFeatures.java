package net.larse.tsprep.timeseries;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import net.larse.tsprep.helper.WeightedChoice;

/**
 * Calendar and Fourier features derived from timestamps, plus the catalog of typical seasonal
 * periods used to randomize lags and windows.
 */
public final class SeasonalFeatures {
  /** Recognized {@link #datePart} methods. Any may carry a "_poly" suffix. */
  public static final ImmutableList<String> DATE_PART_METHODS = ImmutableList.of(
      "recurring", "simple", "expanded", "simple_2", "simple_3", "lunar_phase",
      "simple_binarized", "simple_binarized_poly", "expanded_binarized", "common_fourier",
      "common_fourier_rw");

  /** Fourier time is measured from this instant. */
  static final LocalDateTime FOURIER_ORIGIN = LocalDateTime.of(2030, 1, 1, 0, 0);

  private static final double DAYS_2000 = 10957.0;

  // -1 draws a uniform integer in [2, 100]
  private static final Map<Integer, Double> SEASONAL_INT_WEIGHTS =
      ImmutableMap.<Integer, Double>builder()
          .put(-1, 0.1)
          .put(1, 0.05)
          .put(2, 0.1)
          .put(4, 0.05)
          .put(7, 0.15)
          .put(10, 0.01)
          .put(12, 0.1)
          .put(24, 0.1)
          .put(28, 0.1)
          .put(60, 0.05)
          .put(96, 0.04)
          .put(168, 0.01)
          .put(364, 0.1)
          .put(1440, 0.01)
          .put(420, 0.01)
          .put(52, 0.01)
          .put(84, 0.01)
          .build();

  /**
   * Harmonic band sets, picked by how many calendar years each observation spans.
   */
  public enum SeasonalBucket {
    HOURLY(8766, 24, 168),
    DAILY(365.25, 7),
    WEEKLY(365.25, 28),
    MONTHLY(365.25, 1461),
    YEARLY(1461);

    private final double[] periods;

    SeasonalBucket(double... periods) {
      this.periods = periods;
    }

    /** The base Fourier periods of this bucket, in its time unit. */
    public double[] periods() {
      return periods.clone();
    }

    /** Buckets the ratio at 0.001, 0.012, 0.05 and 0.5. */
    public static SeasonalBucket forRatio(double ratio) {
      if (ratio < 0.001) {
        return HOURLY;
      } else if (ratio < 0.012) {
        return DAILY;
      } else if (ratio < 0.05) {
        return WEEKLY;
      } else if (ratio < 0.5) {
        return MONTHLY;
      }
      return YEARLY;
    }
  }

  private SeasonalFeatures() {}

  /** Calendar years touched by the index divided by its length. */
  public static double seasonalRatio(LocalDateTime[] index) {
    Preconditions.checkArgument(index.length > 0, "empty index");
    int minYear = index[0].getYear();
    int maxYear = index[0].getYear();
    for (LocalDateTime t : index) {
      minYear = Math.min(minYear, t.getYear());
      maxYear = Math.max(maxYear, t.getYear());
    }
    return (maxYear - minYear + 1) / (double) index.length;
  }

  public static SeasonalBucket seasonalBucket(LocalDateTime[] index) {
    return SeasonalBucket.forRatio(seasonalRatio(index));
  }

  /**
   * Cosine then sine bases at 2 pi k / period for k = 1..n, one row per t.
   */
  public static double[][] fourierSeries(double[] t, double period, int n) {
    double[][] out = new double[t.length][2 * n];
    for (int i = 0; i < t.length; i++) {
      for (int k = 1; k <= n; k++) {
        double x = 2 * Math.PI * k / period * t[i];
        out[i][k - 1] = Math.cos(x);
        out[i][n + k - 1] = Math.sin(x);
      }
    }
    return out;
  }

  /** Date part features with no polynomial expansion unless the method ends in "_poly". */
  public static FeatureMatrix datePart(LocalDateTime[] index, String method) {
    return datePart(index, method, null);
  }

  /**
   * Maps timestamps to calendar features.
   *
   * @param index timestamps
   * @param method one of {@link #DATE_PART_METHODS}, optionally suffixed "_poly"
   * @param polynomialDegree degree of polynomial expansion, or null for none
   */
  public static FeatureMatrix datePart(LocalDateTime[] index, String method,
      Integer polynomialDegree) {
    String m = method == null ? "simple" : method;
    if (m.contains("_poly")) {
      m = m.replace("_poly", "");
      polynomialDegree = 2;
    }
    FeatureBuilder fb = new FeatureBuilder(index.length);
    switch (m) {
      case "recurring":
        fb.add("month", index, t -> t.getMonthValue());
        fb.add("day", index, t -> t.getDayOfMonth());
        fb.add("weekday", index, SeasonalFeatures::weekday);
        fb.add("weekend", index, SeasonalFeatures::weekend);
        fb.add("hour", index, t -> t.getHour());
        fb.add("quarter", index, SeasonalFeatures::quarter);
        fb.add("midyear", index, SeasonalFeatures::midyear);
        break;
      case "simple_2":
        fb.add("month", index, t -> t.getMonthValue());
        fb.add("day", index, t -> t.getDayOfMonth());
        fb.add("weekday", index, SeasonalFeatures::weekday);
        fb.add("weekend", index, SeasonalFeatures::weekend);
        fb.add("epoch", index, t -> TimeSeriesFrame.epochDays(t) / 1000.0);
        break;
      case "simple_3":
      case "lunar_phase":
        fb.add("weekend", index, SeasonalFeatures::weekend);
        fb.add("quarter", index, SeasonalFeatures::quarter);
        fb.add("epoch", index, SeasonalFeatures::julian);
        fb.oneHot("month", index, t -> t.getMonthValue(), 1, 12);
        fb.oneHot("weekday", index, t -> (int) weekday(t), 0, 6);
        if (m.equals("lunar_phase")) {
          fb.addColumn("phase", MoonPhase.illumination(index));
        }
        break;
      case "simple_binarized":
        fb.add("day", index, t -> t.getDayOfMonth());
        fb.add("weekend", index, SeasonalFeatures::weekend);
        fb.add("epoch", index, SeasonalFeatures::julian);
        fb.oneHot("month", index, t -> t.getMonthValue(), 1, 12);
        fb.oneHot("weekday", index, t -> (int) weekday(t), 0, 6);
        break;
      case "expanded_binarized":
        fb.add("weekend", index, SeasonalFeatures::weekend);
        fb.add("quarter", index, SeasonalFeatures::quarter);
        fb.add("epoch", index, SeasonalFeatures::julian);
        fb.oneHot("month", index, t -> t.getMonthValue(), 1, 12);
        fb.oneHot("weekday", index, t -> (int) weekday(t), 0, 6);
        fb.oneHot("day", index, t -> t.getDayOfMonth(), 1, 31);
        fb.oneHot("weekdayofmonth", index, t -> (t.getDayOfMonth() - 1) / 7 + 1, 1, 5);
        break;
      case "common_fourier":
      case "common_fourier_rw":
        commonFourier(fb, index);
        if (m.equals("common_fourier_rw")) {
          fb.add("epoch", index, t -> Math.floor(Math.pow(julian(t), 0.65)));
        }
        break;
      case "simple":
      case "expanded":
        fb.add("year", index, t -> t.getYear());
        fb.add("month", index, t -> t.getMonthValue());
        fb.add("day", index, t -> t.getDayOfMonth());
        fb.add("weekday", index, SeasonalFeatures::weekday);
        if (m.equals("expanded")) {
          fb.add("hour", index, t -> t.getHour());
          fb.add("week", index, t -> t.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
          fb.add("quarter", index, SeasonalFeatures::quarter);
          fb.add("dayofyear", index, t -> t.getDayOfYear());
          fb.add("midyear", index, SeasonalFeatures::midyear);
          fb.add("weekend", index, SeasonalFeatures::weekend);
          fb.add("weekdayofmonth", index, t -> (t.getDayOfMonth() - 1) / 7 + 1);
          fb.add("month_end", index, t -> isMonthEnd(t) ? 1 : 0);
          fb.add("month_start", index, t -> t.getDayOfMonth() == 1 ? 1 : 0);
          fb.add("quarter_end", index,
              t -> isMonthEnd(t) && t.getMonthValue() % 3 == 0 ? 1 : 0);
          fb.add("year_end", index,
              t -> t.getMonthValue() == 12 && t.getDayOfMonth() == 31 ? 1 : 0);
          fb.add("daysinmonth", index, t -> t.toLocalDate().lengthOfMonth());
          fb.add("epoch", index, t -> TimeSeriesFrame.epochDays(t) - DAYS_2000);
          fb.add("us_election_year", index, t -> t.getYear() % 4 == 0 ? 1 : 0);
        }
        break;
      default:
        throw new IllegalArgumentException("Unknown datepart method " + method);
    }
    FeatureMatrix features = fb.build();
    if (polynomialDegree != null) {
      features = features.polynomial(polynomialDegree);
    }
    return features;
  }

  private static void commonFourier(FeatureBuilder fb, LocalDateTime[] index) {
    SeasonalBucket bucket = seasonalBucket(index);
    List<double[][]> blocks = new ArrayList<>();
    double origin = TimeSeriesFrame.epochDays(FOURIER_ORIGIN);
    double[] t = new double[index.length];
    if (bucket == SeasonalBucket.HOURLY) {
      for (int i = 0; i < t.length; i++) {
        t[i] = (TimeSeriesFrame.epochDays(index[i]) - origin) * 24.0;
      }
      blocks.add(fourierSeries(t, 8766, 10));
      blocks.add(fourierSeries(t, 24, 3));
      blocks.add(fourierSeries(t, 168, 5));
      blocks.add(multiply(fourierSeries(t, 168, 5), fourierSeries(t, 24, 5)));
      blocks.add(multiply(fourierSeries(t, 168, 3), fourierSeries(t, 8766, 3)));
    } else {
      for (int i = 0; i < t.length; i++) {
        t[i] = Math.floor(TimeSeriesFrame.epochDays(index[i]) - origin);
      }
      switch (bucket) {
        case DAILY:
          blocks.add(fourierSeries(t, 365.25, 10));
          blocks.add(fourierSeries(t, 7, 3));
          blocks.add(multiply(fourierSeries(t, 7, 5), fourierSeries(t, 7, 5)));
          break;
        case WEEKLY:
          blocks.add(fourierSeries(t, 365.25, 10));
          blocks.add(fourierSeries(t, 28, 3));
          break;
        case MONTHLY:
          blocks.add(fourierSeries(t, 365.25, 3));
          blocks.add(fourierSeries(t, 1461, 10));
          break;
        default:
          blocks.add(fourierSeries(t, 1461, 10));
          break;
      }
    }
    int k = 0;
    for (double[][] block : blocks) {
      for (int c = 0; c < block[0].length; c++) {
        double[] col = new double[index.length];
        for (int i = 0; i < col.length; i++) {
          col[i] = block[i][c];
        }
        fb.addColumn("seasonalitycommonfourier_" + k++, col);
      }
    }
  }

  private static double[][] multiply(double[][] a, double[][] b) {
    double[][] out = new double[a.length][a[0].length];
    for (int i = 0; i < a.length; i++) {
      for (int j = 0; j < a[i].length; j++) {
        out[i][j] = a[i][j] * b[i][j];
      }
    }
    return out;
  }

  /**
   * Features for a single seasonality: a numeric period yields 10 Fourier pairs over t scaled
   * by the history length in days, a name yields the matching one-hot or date part block.
   *
   * @param index timestamps
   * @param t the time variable for numeric periods
   * @param seasonality a Number period or a String feature name
   * @param historyDays days of history, or null to use the index span
   */
  public static FeatureMatrix createSeasonalityFeature(LocalDateTime[] index, double[] t,
      Object seasonality, Double historyDays) {
    FeatureBuilder fb = new FeatureBuilder(index.length);
    if (seasonality instanceof Number) {
      double period = ((Number) seasonality).doubleValue();
      double days = historyDays != null ? historyDays
          : Math.floor(TimeSeriesFrame.epochDays(index[index.length - 1])
              - TimeSeriesFrame.epochDays(index[0]));
      double[][] fs = fourierSeries(t, period / days, 10);
      for (int c = 0; c < 20; c++) {
        double[] col = new double[index.length];
        for (int i = 0; i < col.length; i++) {
          col[i] = fs[i][c];
        }
        fb.addColumn("seasonality" + seasonality + "_" + c, col);
      }
      return fb.build();
    }
    String name = String.valueOf(seasonality);
    switch (name) {
      case "dayofweek":
        fb.oneHot(name, index, t2 -> (int) weekday(t2), 0, 6);
        break;
      case "month":
        fb.oneHot(name, index, t2 -> t2.getMonthValue(), 1, 12);
        break;
      case "weekend":
        fb.add(name, index, SeasonalFeatures::weekend);
        break;
      case "weekdayofmonth":
        fb.oneHot(name, index, t2 -> (t2.getDayOfMonth() - 1) / 7 + 1, 1, 5);
        break;
      case "hour":
        fb.oneHot(name, index, t2 -> t2.getHour(), 0, 23);
        break;
      case "daysinmonth":
        fb.add(name, index, t2 -> t2.toLocalDate().lengthOfMonth());
        break;
      case "quarter":
        fb.oneHot(name, index, t2 -> (int) quarter(t2), 1, 4);
        break;
      default:
        if (DATE_PART_METHODS.contains(name)) {
          return datePart(index, name);
        }
        throw new IllegalArgumentException("Seasonality " + name + " not recognized");
    }
    return fb.build();
  }

  /** Result of {@link #seasonalWindowMatch}. */
  public static final class WindowMatch {
    /** {@code [forecastLength][k]} row positions following each matched window. */
    public final int[][] positions;
    /** Distance of every candidate window start. */
    public final double[] scores;

    WindowMatch(int[][] positions, double[] scores) {
      this.positions = positions;
      this.scores = scores;
    }
  }

  /**
   * Finds the k historical windows whose date part features are closest to the last window and
   * returns the positions of the periods that followed them.
   *
   * @param distanceMetric mae, mqae (mean of the lowest 85% absolute errors) or mse
   */
  public static WindowMatch seasonalWindowMatch(LocalDateTime[] index, int k, int windowSize,
      int forecastLength, String datepartMethod, String distanceMetric) {
    double[][] array = datePart(index, datepartMethod).values();
    int minK = 5;
    int nTail = k > minK ? Math.min(windowSize, forecastLength) : forecastLength;
    int candidates = array.length - nTail - windowSize + 1;
    Preconditions.checkArgument(candidates >= k, "not enough history for %s windows", k);
    int features = array[0].length;
    double[] scores = new double[candidates];
    int lastStart = array.length - windowSize;
    for (int s = 0; s < candidates; s++) {
      double featureSum = 0;
      for (int f = 0; f < features; f++) {
        double[] errors = new double[windowSize];
        for (int w = 0; w < windowSize; w++) {
          double d = array[s + w][f] - array[lastStart + w][f];
          errors[w] = distanceMetric.equals("mse") ? d * d : Math.abs(d);
        }
        switch (distanceMetric) {
          case "mae":
          case "mse":
            featureSum += Arrays.stream(errors).average().orElse(0);
            break;
          case "mqae":
            Arrays.sort(errors);
            int qi = windowSize <= 1 ? windowSize : Math.max(1, (int) (windowSize * 0.85));
            featureSum += Arrays.stream(errors, 0, qi).average().orElse(0);
            break;
          default:
            throw new IllegalArgumentException("distance_metric " + distanceMetric
                + " not recognized");
        }
      }
      scores[s] = featureSum / features;
    }
    Integer[] order = new Integer[candidates];
    for (int i = 0; i < candidates; i++) {
      order[i] = i;
    }
    Arrays.sort(order, (a, b) -> Double.compare(scores[a], scores[b]));
    int[][] positions = new int[forecastLength][k];
    for (int j = 0; j < k; j++) {
      for (int h = 0; h < forecastLength; h++) {
        int pos = h + order[j] + windowSize;
        if (k > minK && pos >= index.length) {
          pos = index.length - 1;
        }
        positions[h][j] = pos;
      }
    }
    return new WindowMatch(positions, scores);
  }

  /** A seasonal period drawn from the catalog of typical periods, never 1. */
  public static int seasonalInt(Random random) {
    return seasonalInt(random, false, false, false);
  }

  /**
   * Draws a typical seasonal period.
   *
   * @param includeOne whether 1 is an allowed outcome
   * @param small cap the result at 364
   * @param verySmall redraw until the result is at most 30
   */
  public static int seasonalInt(Random random, boolean includeOne, boolean small,
      boolean verySmall) {
    int lag = WeightedChoice.choose(random, SEASONAL_INT_WEIGHTS);
    if (lag == -1) {
      lag = WeightedChoice.randint(random, 2, 100);
    }
    if (!includeOne && lag == 1) {
      lag = seasonalInt(random, includeOne, small, verySmall);
    }
    if (small) {
      lag = Math.min(lag, 364);
    }
    if (verySmall) {
      while (lag > 30) {
        lag = seasonalInt(random, includeOne, false, true);
      }
    }
    return lag;
  }

  static double weekday(LocalDateTime t) {
    return t.getDayOfWeek().getValue() - 1;
  }

  static double weekend(LocalDateTime t) {
    DayOfWeek d = t.getDayOfWeek();
    return d == DayOfWeek.SATURDAY || d == DayOfWeek.SUNDAY ? 1 : 0;
  }

  static double quarter(LocalDateTime t) {
    return (t.getMonthValue() - 1) / 3 + 1;
  }

  static double midyear(LocalDateTime t) {
    int doy = t.getDayOfYear();
    return doy > 74 && doy < 258 ? 1 : 0;
  }

  static double julian(LocalDateTime t) {
    return TimeSeriesFrame.epochDays(t) + TimeSeriesFrame.JULIAN_EPOCH;
  }

  static boolean isMonthEnd(LocalDateTime t) {
    return t.getDayOfMonth() == t.toLocalDate().lengthOfMonth();
  }

  private interface Feature {
    double value(LocalDateTime t);
  }

  private interface Category {
    int value(LocalDateTime t);
  }

  /** Accumulates named columns. */
  private static final class FeatureBuilder {
    private final int rows;
    private final List<String> names = new ArrayList<>();
    private final List<double[]> columns = new ArrayList<>();

    FeatureBuilder(int rows) {
      this.rows = rows;
    }

    void add(String name, LocalDateTime[] index, Feature f) {
      double[] col = new double[rows];
      for (int i = 0; i < rows; i++) {
        col[i] = f.value(index[i]);
      }
      addColumn(name, col);
    }

    void oneHot(String name, LocalDateTime[] index, Category c, int first, int last) {
      for (int level = first; level <= last; level++) {
        double[] col = new double[rows];
        for (int i = 0; i < rows; i++) {
          col[i] = c.value(index[i]) == level ? 1 : 0;
        }
        addColumn(name + "_" + level, col);
      }
    }

    void addColumn(String name, double[] col) {
      names.add(name);
      columns.add(col);
    }

    FeatureMatrix build() {
      double[][] out = new double[rows][columns.size()];
      for (int j = 0; j < columns.size(); j++) {
        double[] col = columns.get(j);
        for (int i = 0; i < rows; i++) {
          out[i][j] = col[i];
        }
      }
      return new FeatureMatrix(names.toArray(new String[0]), out);
    }
  }
}
