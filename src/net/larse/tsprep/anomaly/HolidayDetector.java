package net.larse.tsprep.anomaly;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.ArrayHelper;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.pipeline.GeneralTransformer;
import net.larse.tsprep.pipeline.TransformConfig;
import net.larse.tsprep.timeseries.TimeSeriesFrame;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds calendar positions where a series is anomalous year after year.
 *
 * <p>Anomalies are detected first, on the data run through the optional inner pipeline. A
 * holiday key of a series is kept when at least {@code threshold} of its occurrences are
 * anomalous and it occurs at least {@code minOccurrences} times. Keys of the days next to a
 * holiday occurrence are then kept at the lower {@code splashThreshold}.
 */
public class HolidayDetector {
  private static final Logger LOG = LogManager.getLogger(HolidayDetector.class);

  public static final ImmutableList<String> STYLES =
      ImmutableList.of("flag", "series_flag", "impact");

  /** Detection settings. */
  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Share of anomalous occurrences that makes a key a holiday.")
    @Optional
    public double threshold = 0.8;

    @Doc(help = "Fewest occurrences of a key in the data.")
    @Optional
    public int minOccurrences = 2;

    @Doc(help = "Threshold for days adjacent to a holiday, null to skip them.")
    @Optional
    public Double splashThreshold = 0.65;

    @Optional
    public boolean useDayOfMonthHolidays = true;

    @Optional
    public boolean useWkdomHolidays = true;

    @Optional
    public boolean useWkdeomHolidays = false;

    @Optional
    public boolean useLunarHolidays = true;

    @Optional
    public boolean useLunarWeekday = false;

    @Optional
    public boolean useIslamicHolidays = true;

    @Optional
    public boolean useHebrewHolidays = true;

    @Doc(help = "multivariate: holidays per series. univariate: shared holidays.")
    @Optional
    public String output = "multivariate";

    @Doc(help = "Anomaly detection method.")
    @Optional
    public String anomalyMethod = "mad";

    @Doc(help = "Parameters of the anomaly detection method.")
    @Optional
    public Map<String, Object> anomalyMethodParams =
        ImmutableMap.<String, Object>of("distribution", "gamma", "alpha", 0.05);

    @Doc(help = "Pipeline applied before anomaly detection, null for none.")
    @Optional
    public TransformConfig anomalyTransform = null;

    @Override
    protected void checkValues() {
      if (threshold <= 0 || threshold > 1) {
        throw new IllegalArgumentException("threshold must be in (0, 1]");
      }
      if (splashThreshold != null && (splashThreshold <= 0 || splashThreshold > 1)) {
        throw new IllegalArgumentException("splashThreshold must be in (0, 1]");
      }
      if (minOccurrences < 1) {
        throw new IllegalArgumentException("minOccurrences must be positive");
      }
      if (!AnomalyDetector.METHODS.contains(anomalyMethod)) {
        throw new IllegalArgumentException("unknown anomaly method " + anomalyMethod);
      }
    }

    public static Args fromMap(Map<String, ?> values) {
      return AlgorithmBase.ArgsBase.fromMap(Args.class, values);
    }

    Set<HolidayKey.Kind> kinds() {
      Set<HolidayKey.Kind> kinds = EnumSet.noneOf(HolidayKey.Kind.class);
      if (useDayOfMonthHolidays) {
        kinds.add(HolidayKey.Kind.DAY_OF_MONTH);
      }
      if (useWkdomHolidays) {
        kinds.add(HolidayKey.Kind.WEEKDAY_OF_MONTH);
      }
      if (useWkdeomHolidays) {
        kinds.add(HolidayKey.Kind.WEEKDAY_FROM_END);
      }
      if (useLunarHolidays) {
        kinds.add(HolidayKey.Kind.LUNAR);
      }
      if (useLunarWeekday) {
        kinds.add(HolidayKey.Kind.LUNAR_WEEKDAY);
      }
      if (useIslamicHolidays) {
        kinds.add(HolidayKey.Kind.ISLAMIC);
      }
      if (useHebrewHolidays) {
        kinds.add(HolidayKey.Kind.HEBREW);
      }
      return kinds;
    }

    /** Fills args with random detection settings. */
    public void randomize(Random random) {
      threshold = WeightedChoice.choose(random, ImmutableList.of(1.0, 0.9, 0.8, 0.7),
          0.1, 0.2, 0.4, 0.3);
      minOccurrences = WeightedChoice.choose(random, ImmutableList.of(1, 2, 3),
          0.1, 0.6, 0.3);
      splashThreshold = WeightedChoice.choose(random,
          Arrays.asList(null, 0.85, 0.65, 0.4), 0.2, 0.2, 0.4, 0.2);
      useDayOfMonthHolidays = WeightedChoice.choose(random,
          ImmutableList.of(true, false), 0.9, 0.1);
      useWkdomHolidays = WeightedChoice.choose(random, ImmutableList.of(true, false), 0.9, 0.1);
      useWkdeomHolidays = WeightedChoice.choose(random, ImmutableList.of(true, false), 0.3, 0.7);
      useLunarHolidays = WeightedChoice.choose(random, ImmutableList.of(true, false), 0.9, 0.1);
      useLunarWeekday = WeightedChoice.choose(random, ImmutableList.of(true, false), 0.1, 0.9);
      useIslamicHolidays = WeightedChoice.choose(random, ImmutableList.of(true, false), 0.3, 0.7);
      useHebrewHolidays = WeightedChoice.choose(random, ImmutableList.of(true, false), 0.3, 0.7);
      output = WeightedChoice.choose(random,
          ImmutableList.of("multivariate", "univariate"), 0.9, 0.1);
      anomalyMethod = AnomalyDetector.randomMethod(random, false);
      anomalyMethodParams = AnomalyDetector.randomParams(anomalyMethod, random);
    }
  }

  private final Args args;
  private final HolidayCalendarSet calendars;

  private String[] series;
  private AnomalyResult anomalies;
  /** Holidays per flag column, one shared entry in univariate mode. */
  private List<Set<HolidayKey>> holidays;
  /** Median deviation from the series median on each holiday, per data column. */
  private List<Map<HolidayKey, Double>> valueImpacts;
  /** Median anomaly score on each holiday, per data column. */
  private List<Map<HolidayKey, Double>> scoreImpacts;

  public HolidayDetector(Args args, HolidayCalendarSet calendars) {
    this.args = args.copy();
    this.args.validate();
    this.calendars = Preconditions.checkNotNull(calendars, "calendars");
  }

  public HolidayDetector(Args args) {
    this(args, new HolidayCalendarSet(args.kinds()));
  }

  /** Detects anomalies in df and the holidays they imply. */
  public HolidayDetector detect(TimeSeriesFrame df) {
    TimeSeriesFrame x = df;
    if (args.anomalyTransform != null) {
      x = new GeneralTransformer(args.anomalyTransform).fitTransform(df);
    }
    anomalies = new AnomalyDetector(args.output, args.anomalyMethod, args.anomalyMethodParams)
        .detect(x);
    series = df.columns();
    LocalDateTime[] index = df.index();
    List<List<HolidayKey>> rowKeys = new ArrayList<>(index.length);
    for (LocalDateTime t : index) {
      rowKeys.add(calendars.keys(t.toLocalDate()));
    }
    TimeSeriesFrame flags = anomalies.flags();
    holidays = new ArrayList<>();
    for (int j = 0; j < flags.cols(); j++) {
      holidays.add(detectColumn(index, rowKeys, flags.column(j)));
    }
    valueImpacts = new ArrayList<>();
    scoreImpacts = new ArrayList<>();
    for (int j = 0; j < df.cols(); j++) {
      Set<HolidayKey> keys = holidaysOf(j);
      double[] values = df.column(j);
      double median = ArrayHelper.nanMedian(values);
      double[] deviation = new double[values.length];
      for (int i = 0; i < values.length; i++) {
        deviation[i] = values[i] - median;
      }
      double[] scores = anomalies.scores().column(Math.min(j, flags.cols() - 1));
      valueImpacts.add(medianOnKeys(rowKeys, keys, deviation));
      scoreImpacts.add(medianOnKeys(rowKeys, keys, scores));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("{} anomalies, {} distinct holidays", anomalies.count(), allHolidays().size());
    }
    return this;
  }

  private Set<HolidayKey> detectColumn(LocalDateTime[] index, List<List<HolidayKey>> rowKeys,
      double[] flag) {
    Map<HolidayKey, int[]> counts = new HashMap<>();
    for (int i = 0; i < rowKeys.size(); i++) {
      for (HolidayKey key : rowKeys.get(i)) {
        int[] c = counts.computeIfAbsent(key, k -> new int[2]);
        c[0]++;
        if (flag[i] == AnomalyResult.ANOMALY) {
          c[1]++;
        }
      }
    }
    Set<HolidayKey> found = new TreeSet<>();
    for (Map.Entry<HolidayKey, int[]> e : counts.entrySet()) {
      if (isHoliday(e.getValue(), args.threshold)) {
        found.add(e.getKey());
      }
    }
    if (args.splashThreshold != null && !found.isEmpty()) {
      Map<LocalDate, Integer> rowOfDate = new HashMap<>();
      for (int i = 0; i < index.length; i++) {
        rowOfDate.put(index[i].toLocalDate(), i);
      }
      Set<HolidayKey> splash = new TreeSet<>();
      for (int i = 0; i < index.length; i++) {
        if (!containsAny(found, rowKeys.get(i))) {
          continue;
        }
        LocalDate day = index[i].toLocalDate();
        for (LocalDate near : ImmutableList.of(day.minusDays(1), day.plusDays(1))) {
          Integer row = rowOfDate.get(near);
          if (row == null) {
            continue;
          }
          for (HolidayKey key : rowKeys.get(row)) {
            if (!found.contains(key) && isHoliday(counts.get(key), args.splashThreshold)) {
              splash.add(key);
            }
          }
        }
      }
      found.addAll(splash);
    }
    return found;
  }

  private boolean isHoliday(int[] count, double threshold) {
    return count[0] >= args.minOccurrences && count[1] >= threshold * count[0];
  }

  private static boolean containsAny(Set<HolidayKey> set, List<HolidayKey> keys) {
    for (HolidayKey k : keys) {
      if (set.contains(k)) {
        return true;
      }
    }
    return false;
  }

  private static Map<HolidayKey, Double> medianOnKeys(List<List<HolidayKey>> rowKeys,
      Set<HolidayKey> keys, double[] values) {
    Map<HolidayKey, Double> out = new HashMap<>();
    for (HolidayKey key : keys) {
      List<Double> on = new ArrayList<>();
      for (int i = 0; i < rowKeys.size(); i++) {
        if (rowKeys.get(i).contains(key)) {
          on.add(values[i]);
        }
      }
      double[] v = new double[on.size()];
      for (int i = 0; i < v.length; i++) {
        v[i] = on.get(i);
      }
      double median = ArrayHelper.nanMedian(v);
      out.put(key, Double.isNaN(median) ? 0 : median);
    }
    return out;
  }

  private void checkDetected() {
    Preconditions.checkState(anomalies != null, "detect has not been run");
  }

  public AnomalyResult anomalies() {
    checkDetected();
    return anomalies;
  }

  /** The holidays of the j-th data column. */
  public Set<HolidayKey> holidaysOf(int column) {
    checkDetected();
    return holidays.get(holidays.size() == 1 ? 0 : column);
  }

  /** Holidays by series name, or under {@value AnomalyDetector#UNIVARIATE_COLUMN}. */
  public Map<String, Set<HolidayKey>> holidays() {
    checkDetected();
    Map<String, Set<HolidayKey>> out = new LinkedHashMap<>();
    String[] names = anomalies.flags().columns();
    for (int j = 0; j < names.length; j++) {
      out.put(names[j], holidays.get(j));
    }
    return out;
  }

  public Set<HolidayKey> allHolidays() {
    checkDetected();
    Set<HolidayKey> all = new TreeSet<>();
    for (Set<HolidayKey> h : holidays) {
      all.addAll(h);
    }
    return all;
  }

  /** Whether the date is an occurrence of a holiday of the j-th data column. */
  public boolean isHoliday(LocalDate date, int column) {
    return containsAny(holidaysOf(column), calendars.keys(date));
  }

  public TimeSeriesFrame datesToHolidays(LocalDateTime[] dates, String style) {
    return datesToHolidays(dates, style, "value");
  }

  /**
   * Holiday features for the dates.
   *
   * @param style flag: one column per holiday holding the number of series it is a holiday
   *     of; series_flag: one column per series, 1 on its holidays; impact: one column per
   *     series holding the summed impact of its holidays on the date
   * @param impactMeasure value (median deviation from the series median) or anomaly_score
   */
  public TimeSeriesFrame datesToHolidays(LocalDateTime[] dates, String style,
      String impactMeasure) {
    checkDetected();
    Preconditions.checkArgument(STYLES.contains(style), "unknown style %s", style);
    Preconditions.checkArgument(impactMeasure.equals("value")
        || impactMeasure.equals("anomaly_score"), "unknown impact %s", impactMeasure);
    List<List<HolidayKey>> dateKeys = new ArrayList<>(dates.length);
    for (LocalDateTime t : dates) {
      dateKeys.add(calendars.keys(t.toLocalDate()));
    }
    if (style.equals("flag")) {
      List<HolidayKey> all = new ArrayList<>(allHolidays());
      String[] names = new String[all.size()];
      double[][] data = new double[all.size()][dates.length];
      for (int k = 0; k < all.size(); k++) {
        HolidayKey key = all.get(k);
        names[k] = key.label();
        int owners = 0;
        for (Set<HolidayKey> h : holidays) {
          if (h.contains(key)) {
            owners++;
          }
        }
        for (int i = 0; i < dates.length; i++) {
          if (dateKeys.get(i).contains(key)) {
            data[k][i] = owners;
          }
        }
      }
      return new TimeSeriesFrame(dates, names, data);
    }
    double[][] data = new double[series.length][dates.length];
    for (int j = 0; j < series.length; j++) {
      Set<HolidayKey> keys = holidaysOf(j);
      Map<HolidayKey, Double> impact =
          impactMeasure.equals("value") ? valueImpacts.get(j) : scoreImpacts.get(j);
      for (int i = 0; i < dates.length; i++) {
        for (HolidayKey key : dateKeys.get(i)) {
          if (keys.contains(key)) {
            data[j][i] = style.equals("series_flag") ? 1 : data[j][i] + impact.get(key);
          }
        }
      }
    }
    return new TimeSeriesFrame(dates, series, data);
  }
}
