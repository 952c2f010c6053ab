package net.larse.tsprep.anomaly.calendar;

import java.time.LocalDate;

/** Converts Gregorian dates into another calendar. */
public interface CalendarLookup {
  /** Short name used in holiday labels. */
  String name();

  /** The date in this calendar, or null if the calendar does not cover it. */
  CalendarDate fromGregorian(LocalDate date);
}
