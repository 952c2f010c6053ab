package net.larse.tsprep.anomaly;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A recurring calendar position: a day of a month, an nth weekday of a month, or a day of a
 * lunar, Islamic or Hebrew month. Dates sharing a key are occurrences of the same potential
 * holiday.
 */
public final class HolidayKey implements Comparable<HolidayKey> {
  /** The kinds of recurring position. */
  public enum Kind {
    /** {month, day}. */
    DAY_OF_MONTH("dom"),
    /** {month, week of month from 1, ISO weekday}. */
    WEEKDAY_OF_MONTH("wkdom"),
    /** {month, week counted from the month end from 1, ISO weekday}. */
    WEEKDAY_FROM_END("wkdeom"),
    /** {lunar month, lunar day}. */
    LUNAR("lunar"),
    /** {lunar month, week of lunar month, ISO weekday}. */
    LUNAR_WEEKDAY("lunarwkd"),
    /** {month, day} of the Islamic calendar. */
    ISLAMIC("islamic"),
    /** {month, day} of the Hebrew calendar. */
    HEBREW("hebrew");

    private final String prefix;

    Kind(String prefix) {
      this.prefix = prefix;
    }

    public String prefix() {
      return prefix;
    }
  }

  private final Kind kind;
  private final int month;
  private final int position;
  private final int weekday;

  private HolidayKey(Kind kind, int month, int position, int weekday) {
    this.kind = Preconditions.checkNotNull(kind);
    this.month = month;
    this.position = position;
    this.weekday = weekday;
  }

  public static HolidayKey dayOfMonth(Kind kind, int month, int day) {
    Preconditions.checkArgument(kind == Kind.DAY_OF_MONTH || kind == Kind.LUNAR
        || kind == Kind.ISLAMIC || kind == Kind.HEBREW, "%s is not a day of month kind", kind);
    return new HolidayKey(kind, month, day, 0);
  }

  public static HolidayKey weekdayOfMonth(Kind kind, int month, int week, int weekday) {
    Preconditions.checkArgument(kind == Kind.WEEKDAY_OF_MONTH || kind == Kind.WEEKDAY_FROM_END
        || kind == Kind.LUNAR_WEEKDAY, "%s is not a weekday kind", kind);
    Preconditions.checkArgument(weekday >= 1 && weekday <= 7, "weekday %s", weekday);
    return new HolidayKey(kind, month, week, weekday);
  }

  public Kind kind() {
    return kind;
  }

  public int month() {
    return month;
  }

  /** Day of month, or week of month for the weekday kinds. */
  public int position() {
    return position;
  }

  /** ISO weekday, Monday 1, or 0 for the day of month kinds. */
  public int weekday() {
    return weekday;
  }

  /** A column name, for example {@code dom_12_25} or {@code wkdom_11_4_4}. */
  public String label() {
    StringBuilder sb = new StringBuilder(kind.prefix()).append('_').append(month)
        .append('_').append(position);
    if (weekday > 0) {
      sb.append('_').append(weekday);
    }
    return sb.toString();
  }

  @Override
  public int compareTo(HolidayKey o) {
    int c = kind.compareTo(o.kind);
    if (c == 0) {
      c = Integer.compare(month, o.month);
    }
    if (c == 0) {
      c = Integer.compare(position, o.position);
    }
    return c == 0 ? Integer.compare(weekday, o.weekday) : c;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof HolidayKey)) {
      return false;
    }
    HolidayKey other = (HolidayKey) o;
    return kind == other.kind && month == other.month && position == other.position
        && weekday == other.weekday;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, month, position, weekday);
  }

  @Override
  public String toString() {
    return label();
  }
}
