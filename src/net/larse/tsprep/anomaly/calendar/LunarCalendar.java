package net.larse.tsprep.anomaly.calendar;

import java.time.LocalDate;

/**
 * The Chinese lunisolar calendar, computed from astronomical new moons and the sun's
 * longitude at a fixed UTC+8 offset. Month 11 holds the winter solstice; in years with
 * thirteen months the first month without a major solar term is the leap month.
 */
public class LunarCalendar implements CalendarLookup {
  public static final String NAME = "lunar";

  private static final double DEG = Math.PI / 180;
  private static final double SYNODIC_MONTH = 29.530588853;
  /** Julian day of the first new moon of 1900. */
  private static final double NEW_MOON_EPOCH = 2415021.076998695;
  private static final long JULIAN_DAY_OF_UNIX_EPOCH = 2440588;

  private final double timeZone;

  public LunarCalendar(double timeZoneHours) {
    this.timeZone = timeZoneHours;
  }

  public LunarCalendar() {
    this(8);
  }

  @Override
  public String name() {
    return NAME;
  }

  /** Julian day (ephemeris time) of the k-th new moon after the one of January 1900. */
  static double newMoon(int k) {
    double t = k / 1236.85;
    double t2 = t * t;
    double t3 = t2 * t;
    double jd = 2415020.75933 + 29.53058868 * k + 0.0001178 * t2 - 0.000000155 * t3;
    jd += 0.00033 * Math.sin((166.56 + 132.87 * t - 0.009173 * t2) * DEG);
    double m = 359.2242 + 29.10535608 * k - 0.0000333 * t2 - 0.00000347 * t3;
    double mpr = 306.0253 + 385.81691806 * k + 0.0107306 * t2 + 0.00001236 * t3;
    double f = 21.2964 + 390.67050646 * k - 0.0016528 * t2 - 0.00000239 * t3;
    double c = (0.1734 - 0.000393 * t) * Math.sin(m * DEG) + 0.0021 * Math.sin(2 * m * DEG)
        - 0.4068 * Math.sin(mpr * DEG) + 0.0161 * Math.sin(2 * mpr * DEG)
        - 0.0004 * Math.sin(3 * mpr * DEG)
        + 0.0104 * Math.sin(2 * f * DEG) - 0.0051 * Math.sin((m + mpr) * DEG)
        - 0.0074 * Math.sin((m - mpr) * DEG) + 0.0004 * Math.sin((2 * f + m) * DEG)
        - 0.0004 * Math.sin((2 * f - m) * DEG) - 0.0006 * Math.sin((2 * f + mpr) * DEG)
        + 0.0010 * Math.sin((2 * f - mpr) * DEG) + 0.0005 * Math.sin((2 * mpr + m) * DEG);
    double deltaT = t < -11
        ? 0.001 + 0.000839 * t + 0.0002261 * t2 - 0.00000845 * t3 - 0.000000081 * t * t3
        : -0.000278 + 0.000265 * t + 0.000262 * t2;
    return jd + c - deltaT;
  }

  /** Apparent longitude of the sun in radians, in [0, 2 pi). */
  static double sunLongitude(double julianDay) {
    double t = (julianDay - 2451545.0) / 36525;
    double t2 = t * t;
    double m = 357.52910 + 35999.05030 * t - 0.0001559 * t2 - 0.00000048 * t * t2;
    double l0 = 280.46645 + 36000.76983 * t + 0.0003032 * t2;
    double dl = (1.914600 - 0.004817 * t - 0.000014 * t2) * Math.sin(m * DEG)
        + (0.019993 - 0.000101 * t) * Math.sin(2 * m * DEG)
        + 0.000290 * Math.sin(3 * m * DEG);
    double l = (l0 + dl) * DEG;
    return l - 2 * Math.PI * Math.floor(l / (2 * Math.PI));
  }

  private long newMoonDay(int k) {
    return (long) Math.floor(newMoon(k) + 0.5 + timeZone / 24);
  }

  /** The 30 degree sector, 0 to 11, the sun is in at the start of the local day. */
  private int sunSector(long julianDayNumber) {
    return (int) Math.floor(sunLongitude(julianDayNumber - 0.5 - timeZone / 24) / Math.PI * 6);
  }

  /** First day of the month holding the winter solstice of the Gregorian year. */
  private long month11(int year) {
    long dec31 = LocalDate.of(year, 12, 31).toEpochDay() + JULIAN_DAY_OF_UNIX_EPOCH;
    int k = (int) Math.floor((dec31 - 2415021) / SYNODIC_MONTH);
    long start = newMoonDay(k);
    if (sunSector(start) >= 9) {
      start = newMoonDay(k - 1);
    }
    return start;
  }

  /** Months after month 11 until the first one without a major solar term. */
  private int leapMonthOffset(long month11) {
    int k = (int) Math.floor((month11 - NEW_MOON_EPOCH) / SYNODIC_MONTH + 0.5);
    int i = 1;
    int arc = sunSector(newMoonDay(k + i));
    int last;
    do {
      last = arc;
      i++;
      arc = sunSector(newMoonDay(k + i));
    } while (arc != last && i < 14);
    return i - 1;
  }

  @Override
  public CalendarDate fromGregorian(LocalDate date) {
    long dayNumber = date.toEpochDay() + JULIAN_DAY_OF_UNIX_EPOCH;
    int k = (int) Math.floor((dayNumber - NEW_MOON_EPOCH) / SYNODIC_MONTH);
    long monthStart = newMoonDay(k + 1);
    if (monthStart > dayNumber) {
      monthStart = newMoonDay(k);
    }
    int year = date.getYear();
    long a11 = month11(year);
    long b11;
    int lunarYear;
    if (a11 >= monthStart) {
      lunarYear = year;
      b11 = a11;
      a11 = month11(year - 1);
    } else {
      lunarYear = year + 1;
      b11 = month11(year + 1);
    }
    int day = (int) (dayNumber - monthStart + 1);
    int diff = (int) Math.floor((monthStart - a11) / 29.0);
    boolean leap = false;
    int month = diff + 11;
    if (b11 - a11 > 365) {
      int leapDiff = leapMonthOffset(a11);
      if (diff >= leapDiff) {
        month = diff + 10;
        leap = diff == leapDiff;
      }
    }
    if (month > 12) {
      month -= 12;
    }
    if (month >= 11 && diff < 4) {
      lunarYear--;
    }
    return new CalendarDate(lunarYear, month, day, leap);
  }
}
