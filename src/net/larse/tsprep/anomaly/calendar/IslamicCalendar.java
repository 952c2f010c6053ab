package net.larse.tsprep.anomaly.calendar;

import java.time.LocalDate;
import java.time.chrono.HijrahChronology;
import java.time.chrono.HijrahDate;
import java.time.temporal.ChronoField;
import java.time.temporal.ValueRange;

/**
 * The Umm al-Qura Islamic calendar of {@link HijrahChronology}. Dates outside the years the
 * chronology has data for map to null.
 */
public class IslamicCalendar implements CalendarLookup {
  public static final String NAME = "islamic";

  private final long firstEpochDay;
  private final long lastEpochDay;

  public IslamicCalendar() {
    HijrahChronology chronology = HijrahChronology.INSTANCE;
    ValueRange years = chronology.range(ChronoField.YEAR);
    firstEpochDay = chronology.date((int) years.getMinimum(), 1, 1).toEpochDay();
    HijrahDate lastYear = chronology.date((int) years.getMaximum(), 1, 1);
    lastEpochDay = lastYear.with(ChronoField.DAY_OF_YEAR, lastYear.lengthOfYear()).toEpochDay();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public CalendarDate fromGregorian(LocalDate date) {
    long day = date.toEpochDay();
    if (day < firstEpochDay || day > lastEpochDay) {
      return null;
    }
    HijrahDate h = HijrahDate.from(date);
    return new CalendarDate(h.get(ChronoField.YEAR), h.get(ChronoField.MONTH_OF_YEAR),
        h.get(ChronoField.DAY_OF_MONTH));
  }
}
