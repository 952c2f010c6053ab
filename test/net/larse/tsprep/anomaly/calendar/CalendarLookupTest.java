package net.larse.tsprep.anomaly.calendar;

import java.time.LocalDate;

import org.junit.Test;

import static org.junit.Assert.*;

public class CalendarLookupTest {
  private final HebrewCalendar hebrew = new HebrewCalendar();
  private final LunarCalendar lunar = new LunarCalendar();
  private final IslamicCalendar islamic = new IslamicCalendar();

  @Test
  public void testHebrewNewYearAndPassover() {
    assertEquals(new CalendarDate(5781, 7, 1), hebrew.fromGregorian(LocalDate.of(2020, 9, 19)));
    assertEquals(new CalendarDate(5782, 7, 1), hebrew.fromGregorian(LocalDate.of(2021, 9, 7)));
    // Yom Kippur
    assertEquals(new CalendarDate(5781, 7, 10),
        hebrew.fromGregorian(LocalDate.of(2020, 9, 28)));
    assertEquals(new CalendarDate(5780, 1, 15), hebrew.fromGregorian(LocalDate.of(2020, 4, 9)));
    assertEquals(new CalendarDate(5783, 1, 15), hebrew.fromGregorian(LocalDate.of(2023, 4, 6)));
  }

  @Test
  public void testHebrewLeapYear() {
    // 5784 had Adar II; Purim fell on its 14th
    assertTrue(HebrewCalendar.isLeapYear(5784));
    assertFalse(HebrewCalendar.isLeapYear(5783));
    assertEquals(new CalendarDate(5784, 13, 14),
        hebrew.fromGregorian(LocalDate.of(2024, 3, 24)));
    assertEquals(LocalDate.of(2024, 3, 24), HebrewCalendar.toGregorian(5784, 13, 14));
  }

  @Test
  public void testHebrewRoundTrip() {
    LocalDate d = LocalDate.of(2015, 1, 1);
    for (int i = 0; i < 3000; i += 7) {
      CalendarDate h = hebrew.fromGregorian(d.plusDays(i));
      assertEquals(d.plusDays(i), HebrewCalendar.toGregorian(h.year(), h.month(), h.day()));
    }
  }

  @Test
  public void testHebrewYearLengths() {
    for (int year = 5770; year < 5800; year++) {
      int length = HebrewCalendar.daysInYear(year);
      int base = HebrewCalendar.isLeapYear(year) ? 383 : 353;
      assertTrue(year + ": " + length, length >= base && length <= base + 2);
    }
  }

  @Test
  public void testChineseNewYear() {
    assertEquals(new CalendarDate(2020, 1, 1), lunar.fromGregorian(LocalDate.of(2020, 1, 25)));
    assertEquals(new CalendarDate(2019, 12, 30),
        lunar.fromGregorian(LocalDate.of(2020, 1, 24)));
    assertEquals(new CalendarDate(2021, 1, 1), lunar.fromGregorian(LocalDate.of(2021, 2, 12)));
    assertEquals(new CalendarDate(2023, 1, 1), lunar.fromGregorian(LocalDate.of(2023, 1, 22)));
    assertEquals(new CalendarDate(2024, 1, 1), lunar.fromGregorian(LocalDate.of(2024, 2, 10)));
  }

  @Test
  public void testLunarMidAutumnAndLeapMonths() {
    assertEquals(new CalendarDate(2020, 8, 15), lunar.fromGregorian(LocalDate.of(2020, 10, 1)));
    CalendarDate leapFourth = lunar.fromGregorian(LocalDate.of(2020, 5, 23));
    assertEquals(new CalendarDate(2020, 4, 1, true), leapFourth);
    assertTrue(lunar.fromGregorian(LocalDate.of(2023, 3, 22)).leapMonth());
    assertFalse(lunar.fromGregorian(LocalDate.of(2020, 6, 25)).leapMonth());
  }

  @Test
  public void testIslamicRamadanAndEid() {
    CalendarDate ramadan = islamic.fromGregorian(LocalDate.of(2020, 4, 24));
    assertEquals(new CalendarDate(1441, 9, 1), ramadan);
    assertEquals(new CalendarDate(1441, 10, 1), islamic.fromGregorian(LocalDate.of(2020, 5, 24)));
  }

  @Test
  public void testIslamicOutOfRangeIsNull() {
    assertNull(islamic.fromGregorian(LocalDate.of(1700, 1, 1)));
    assertNull(islamic.fromGregorian(LocalDate.of(2300, 1, 1)));
  }

  @Test
  public void testNames() {
    assertEquals("hebrew", hebrew.name());
    assertEquals("lunar", lunar.name());
    assertEquals("islamic", islamic.name());
  }
}
