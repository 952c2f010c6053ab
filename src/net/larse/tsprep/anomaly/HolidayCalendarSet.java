package net.larse.tsprep.anomaly;

import com.google.common.base.Preconditions;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import net.larse.tsprep.anomaly.calendar.CalendarDate;
import net.larse.tsprep.anomaly.calendar.CalendarLookup;
import net.larse.tsprep.anomaly.calendar.HebrewCalendar;
import net.larse.tsprep.anomaly.calendar.IslamicCalendar;
import net.larse.tsprep.anomaly.calendar.LunarCalendar;

/** The enabled holiday key kinds and the calendars they are computed with. */
public final class HolidayCalendarSet {
  private final Set<HolidayKey.Kind> kinds;
  private final CalendarLookup lunar;
  private final CalendarLookup islamic;
  private final CalendarLookup hebrew;

  public HolidayCalendarSet(Set<HolidayKey.Kind> kinds, CalendarLookup lunar,
      CalendarLookup islamic, CalendarLookup hebrew) {
    this.kinds = kinds.isEmpty()
        ? EnumSet.noneOf(HolidayKey.Kind.class)
        : EnumSet.copyOf(kinds);
    this.lunar = Preconditions.checkNotNull(lunar, "lunar");
    this.islamic = Preconditions.checkNotNull(islamic, "islamic");
    this.hebrew = Preconditions.checkNotNull(hebrew, "hebrew");
  }

  /** The enabled kinds with the built-in calendars. */
  public HolidayCalendarSet(Set<HolidayKey.Kind> kinds) {
    this(kinds, new LunarCalendar(), new IslamicCalendar(), new HebrewCalendar());
  }

  public Set<HolidayKey.Kind> kinds() {
    return EnumSet.copyOf(kinds);
  }

  /** Every enabled key the date is an occurrence of. */
  public List<HolidayKey> keys(LocalDate date) {
    List<HolidayKey> out = new ArrayList<>();
    int weekday = date.getDayOfWeek().getValue();
    int month = date.getMonthValue();
    if (kinds.contains(HolidayKey.Kind.DAY_OF_MONTH)) {
      out.add(HolidayKey.dayOfMonth(HolidayKey.Kind.DAY_OF_MONTH, month, date.getDayOfMonth()));
    }
    if (kinds.contains(HolidayKey.Kind.WEEKDAY_OF_MONTH)) {
      out.add(HolidayKey.weekdayOfMonth(HolidayKey.Kind.WEEKDAY_OF_MONTH, month,
          (date.getDayOfMonth() - 1) / 7 + 1, weekday));
    }
    if (kinds.contains(HolidayKey.Kind.WEEKDAY_FROM_END)) {
      int fromEnd = date.lengthOfMonth() - date.getDayOfMonth();
      out.add(HolidayKey.weekdayOfMonth(HolidayKey.Kind.WEEKDAY_FROM_END, month,
          fromEnd / 7 + 1, weekday));
    }
    if (kinds.contains(HolidayKey.Kind.LUNAR) || kinds.contains(HolidayKey.Kind.LUNAR_WEEKDAY)) {
      CalendarDate d = lunar.fromGregorian(date);
      // leap months repeat a month number and hold no fixed holidays
      if (d != null && !d.leapMonth()) {
        if (kinds.contains(HolidayKey.Kind.LUNAR)) {
          out.add(HolidayKey.dayOfMonth(HolidayKey.Kind.LUNAR, d.month(), d.day()));
        }
        if (kinds.contains(HolidayKey.Kind.LUNAR_WEEKDAY)) {
          out.add(HolidayKey.weekdayOfMonth(HolidayKey.Kind.LUNAR_WEEKDAY, d.month(),
              (d.day() - 1) / 7 + 1, weekday));
        }
      }
    }
    if (kinds.contains(HolidayKey.Kind.ISLAMIC)) {
      CalendarDate d = islamic.fromGregorian(date);
      if (d != null) {
        out.add(HolidayKey.dayOfMonth(HolidayKey.Kind.ISLAMIC, d.month(), d.day()));
      }
    }
    if (kinds.contains(HolidayKey.Kind.HEBREW)) {
      CalendarDate d = hebrew.fromGregorian(date);
      if (d != null) {
        out.add(HolidayKey.dayOfMonth(HolidayKey.Kind.HEBREW, d.month(), d.day()));
      }
    }
    return out;
  }
}
