package net.larse.tsprep.anomaly.calendar;

import java.util.Objects;

/** A date in a non-Gregorian calendar. */
public final class CalendarDate {
  private final int year;
  private final int month;
  private final int day;
  private final boolean leapMonth;

  public CalendarDate(int year, int month, int day, boolean leapMonth) {
    this.year = year;
    this.month = month;
    this.day = day;
    this.leapMonth = leapMonth;
  }

  public CalendarDate(int year, int month, int day) {
    this(year, month, day, false);
  }

  public int year() {
    return year;
  }

  public int month() {
    return month;
  }

  public int day() {
    return day;
  }

  /** Whether the month is an intercalary repeat of the month before it. */
  public boolean leapMonth() {
    return leapMonth;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CalendarDate)) {
      return false;
    }
    CalendarDate other = (CalendarDate) o;
    return year == other.year && month == other.month && day == other.day
        && leapMonth == other.leapMonth;
  }

  @Override
  public int hashCode() {
    return Objects.hash(year, month, day, leapMonth);
  }

  @Override
  public String toString() {
    return year + "-" + month + (leapMonth ? "L" : "") + "-" + day;
  }
}
