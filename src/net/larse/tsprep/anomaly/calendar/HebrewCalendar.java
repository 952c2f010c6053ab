package net.larse.tsprep.anomaly.calendar;

import java.time.LocalDate;

/**
 * The arithmetic Hebrew calendar. Months are numbered from Nisan (1); Tishri (7) starts the
 * year and Adar II is month 13 of leap years.
 */
public class HebrewCalendar implements CalendarLookup {
  public static final String NAME = "hebrew";

  /** Day number, counted from 0001-01-01 as day 1, of 1 Tishri AM 1. */
  private static final long EPOCH = -1373427;
  /** Day number of 1970-01-01 with the same counting. */
  private static final long UNIX_EPOCH = 719163;
  private static final double MEAN_YEAR = 35975351.0 / 98496;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public CalendarDate fromGregorian(LocalDate date) {
    long fixed = date.toEpochDay() + UNIX_EPOCH;
    int year = (int) Math.floor((fixed - EPOCH) / MEAN_YEAR);
    while (newYear(year + 1) <= fixed) {
      year++;
    }
    int month = fixed < toFixed(year, 1, 1) ? 7 : 1;
    while (fixed > toFixed(year, month, lastDayOfMonth(month, year))) {
      month++;
    }
    int day = (int) (fixed - toFixed(year, month, 1) + 1);
    return new CalendarDate(year, month, day);
  }

  /** The Gregorian date of a Hebrew date. */
  public static LocalDate toGregorian(int year, int month, int day) {
    return LocalDate.ofEpochDay(toFixed(year, month, day) - UNIX_EPOCH);
  }

  static boolean isLeapYear(int year) {
    return Math.floorMod(7L * year + 1, 19) < 7;
  }

  private static long elapsedDays(int year) {
    long months = Math.floorDiv(235L * year - 234, 19);
    long parts = 12084 + 13753 * months;
    long days = 29 * months + Math.floorDiv(parts, 25920);
    // postponement rules keep Rosh Hashanah off Sunday, Wednesday and Friday
    return Math.floorMod(3 * (days + 1), 7) < 3 ? days + 1 : days;
  }

  private static int yearLengthCorrection(int year) {
    long ny0 = elapsedDays(year - 1);
    long ny1 = elapsedDays(year);
    long ny2 = elapsedDays(year + 1);
    if (ny2 - ny1 == 356) {
      return 2;
    } else if (ny1 - ny0 == 382) {
      return 1;
    }
    return 0;
  }

  static long newYear(int year) {
    return EPOCH + elapsedDays(year) + yearLengthCorrection(year);
  }

  static int daysInYear(int year) {
    return (int) (newYear(year + 1) - newYear(year));
  }

  static int lastDayOfMonth(int month, int year) {
    int length = daysInYear(year);
    boolean longMarheshvan = length % 10 == 5;
    boolean shortKislev = length % 10 == 3;
    if (month == 2 || month == 4 || month == 6 || month == 10 || month == 13
        || (month == 12 && !isLeapYear(year))
        || (month == 8 && !longMarheshvan)
        || (month == 9 && shortKislev)) {
      return 29;
    }
    return 30;
  }

  static long toFixed(int year, int month, int day) {
    long fixed = newYear(year) + day - 1;
    int lastMonth = isLeapYear(year) ? 13 : 12;
    if (month < 7) {
      for (int m = 7; m <= lastMonth; m++) {
        fixed += lastDayOfMonth(m, year);
      }
      for (int m = 1; m < month; m++) {
        fixed += lastDayOfMonth(m, year);
      }
    } else {
      for (int m = 7; m < month; m++) {
        fixed += lastDayOfMonth(m, year);
      }
    }
    return fixed;
  }
}
