package net.larse.tsprep.anomaly;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import net.larse.tsprep.timeseries.TimeSeriesFrame;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class HolidayDetectorTest {
  private TimeSeriesFrame df;
  private HolidayDetector.Args args;

  @Before
  public void setUp() {
    LocalDateTime[] index = TimeSeriesFrame.dailyIndex(LocalDate.of(2019, 1, 1), 3 * 365);
    double[][] data = new double[2][index.length];
    for (int i = 0; i < index.length; i++) {
      LocalDate d = index[i].toLocalDate();
      data[0][i] = 100 + 2 * Math.sin(2 * Math.PI * i / 7.0);
      data[1][i] = 50 + Math.cos(2 * Math.PI * i / 7.0);
      // Thanksgiving, the fourth Thursday of November, in the first series only
      if (d.getMonthValue() == 11 && d.getDayOfWeek().getValue() == 4
          && (d.getDayOfMonth() - 1) / 7 == 3) {
        data[0][i] -= 60;
      }
      // New Year's Day in both
      if (d.getMonthValue() == 1 && d.getDayOfMonth() == 1) {
        data[0][i] -= 60;
        data[1][i] -= 30;
      }
    }
    df = new TimeSeriesFrame(index, new String[] {"a", "b"}, data);

    args = new HolidayDetector.Args();
    args.useLunarHolidays = false;
    args.useIslamicHolidays = false;
    args.useHebrewHolidays = false;
    args.splashThreshold = null;
    args.anomalyMethod = "zscore";
    args.anomalyMethodParams = ImmutableMap.<String, Object>of("alpha", 0.01);
  }

  @Test
  public void testDetectsHolidaysPerSeries() {
    HolidayDetector detector = new HolidayDetector(args).detect(df);
    HolidayKey newYear = HolidayKey.dayOfMonth(HolidayKey.Kind.DAY_OF_MONTH, 1, 1);
    HolidayKey thanksgiving =
        HolidayKey.weekdayOfMonth(HolidayKey.Kind.WEEKDAY_OF_MONTH, 11, 4, 4);
    assertTrue(detector.holidaysOf(0).contains(newYear));
    assertTrue(detector.holidaysOf(0).contains(thanksgiving));
    assertTrue(detector.holidaysOf(1).contains(newYear));
    assertFalse(detector.holidaysOf(1).contains(thanksgiving));
    assertEquals(ImmutableSet.of("a", "b"), detector.holidays().keySet());
    assertTrue(detector.isHoliday(LocalDate.of(2030, 11, 28), 0));
    assertFalse(detector.isHoliday(LocalDate.of(2030, 11, 28), 1));
  }

  @Test
  public void testUnivariateSharesHolidays() {
    args.output = "univariate";
    HolidayDetector detector = new HolidayDetector(args).detect(df);
    assertEquals(ImmutableSet.of(AnomalyDetector.UNIVARIATE_COLUMN),
        detector.holidays().keySet());
    assertEquals(detector.holidaysOf(0), detector.holidaysOf(1));
  }

  @Test
  public void testMinOccurrencesFiltersRareKeys() {
    args.minOccurrences = 4;
    // three years hold only three New Year's Days
    HolidayDetector detector = new HolidayDetector(args).detect(df);
    assertTrue(detector.allHolidays().isEmpty());
  }

  @Test
  public void testDatesToHolidays() {
    HolidayDetector detector = new HolidayDetector(args).detect(df);
    LocalDateTime[] future = {
        LocalDateTime.of(2025, 1, 1, 0, 0),
        LocalDateTime.of(2025, 1, 2, 0, 0),
        LocalDateTime.of(2025, 11, 27, 0, 0)};

    TimeSeriesFrame flag = detector.datesToHolidays(future, "flag");
    int newYear = flag.columnIndex("dom_1_1");
    int thanksgiving = flag.columnIndex("wkdom_11_4_4");
    assertEquals(2, flag.get(0, newYear), 0);
    assertEquals(0, flag.get(1, newYear), 0);
    assertEquals(1, flag.get(2, thanksgiving), 0);

    TimeSeriesFrame seriesFlag = detector.datesToHolidays(future, "series_flag");
    assertArrayEquals(new double[] {1, 0, 1}, seriesFlag.column(0), 0);
    assertArrayEquals(new double[] {1, 0, 0}, seriesFlag.column(1), 0);

    TimeSeriesFrame impact = detector.datesToHolidays(future, "impact");
    assertEquals(-60, impact.get(0, 0), 3);
    assertEquals(-30, impact.get(0, 1), 2);
    assertEquals(0, impact.get(1, 0), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownStyle() {
    new HolidayDetector(args).detect(df).datesToHolidays(df.index(), "calendar");
  }

  @Test(expected = IllegalStateException.class)
  public void testQueryBeforeDetect() {
    new HolidayDetector(args).allHolidays();
  }

  @Test
  public void testCalendarKeys() {
    HolidayCalendarSet calendars = new HolidayCalendarSet(EnumSet.allOf(HolidayKey.Kind.class));
    // 2020-01-25 was Chinese New Year and a Saturday
    List<HolidayKey> keys = calendars.keys(LocalDate.of(2020, 1, 25));
    assertTrue(keys.contains(HolidayKey.dayOfMonth(HolidayKey.Kind.DAY_OF_MONTH, 1, 25)));
    assertTrue(keys.contains(
        HolidayKey.weekdayOfMonth(HolidayKey.Kind.WEEKDAY_OF_MONTH, 1, 4, 6)));
    assertTrue(keys.contains(
        HolidayKey.weekdayOfMonth(HolidayKey.Kind.WEEKDAY_FROM_END, 1, 1, 6)));
    assertTrue(keys.contains(HolidayKey.dayOfMonth(HolidayKey.Kind.LUNAR, 1, 1)));
    assertTrue(keys.contains(
        HolidayKey.weekdayOfMonth(HolidayKey.Kind.LUNAR_WEEKDAY, 1, 1, 6)));
    assertEquals(7, keys.size());

    Set<HolidayKey.Kind> none = EnumSet.noneOf(HolidayKey.Kind.class);
    assertTrue(new HolidayCalendarSet(none).keys(LocalDate.of(2020, 1, 25)).isEmpty());
  }

  @Test
  public void testLeapLunarMonthsHoldNoLunarKeys() {
    HolidayCalendarSet calendars =
        new HolidayCalendarSet(EnumSet.of(HolidayKey.Kind.LUNAR));
    // the leap fourth month of 2020 began on May 23
    assertTrue(calendars.keys(LocalDate.of(2020, 5, 23)).isEmpty());
    assertEquals(1, calendars.keys(LocalDate.of(2020, 5, 22)).size());
  }

  @Test
  public void testKeyLabels() {
    assertEquals("dom_12_25",
        HolidayKey.dayOfMonth(HolidayKey.Kind.DAY_OF_MONTH, 12, 25).label());
    assertEquals("wkdom_11_4_4",
        HolidayKey.weekdayOfMonth(HolidayKey.Kind.WEEKDAY_OF_MONTH, 11, 4, 4).label());
    assertEquals("hebrew_7_1", HolidayKey.dayOfMonth(HolidayKey.Kind.HEBREW, 7, 1).label());
  }
}
