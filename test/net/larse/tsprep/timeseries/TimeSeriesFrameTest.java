package net.larse.tsprep.timeseries;

import java.time.LocalDate;
import java.time.LocalDateTime;

import net.larse.tsprep.Frames;
import net.larse.tsprep.exception.NonNumericDataException;
import org.junit.Test;

import static org.junit.Assert.*;

public class TimeSeriesFrameTest {

  @Test
  public void testFromObjectsParsesNumbers() {
    LocalDateTime[] idx = Frames.daily(3);
    TimeSeriesFrame df = TimeSeriesFrame.fromObjects(idx, new String[] {"a", "b"},
        new Object[][] {{1, "2.5"}, {null, " 3 "}, {"nan", true}});
    assertEquals(1.0, df.get(0, 0), 0);
    assertEquals(2.5, df.get(0, 1), 0);
    assertTrue(Double.isNaN(df.get(1, 0)));
    assertEquals(3.0, df.get(1, 1), 0);
    assertTrue(Double.isNaN(df.get(2, 0)));
    assertEquals(1.0, df.get(2, 1), 0);
    assertTrue(df.hasNaN());
  }

  @Test(expected = NonNumericDataException.class)
  public void testFromObjectsRejectsText() {
    TimeSeriesFrame.fromObjects(Frames.daily(1), new String[] {"a"},
        new Object[][] {{"abc"}});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testIndexMustIncrease() {
    LocalDateTime t = LocalDateTime.of(2020, 1, 1, 0, 0);
    new TimeSeriesFrame(new LocalDateTime[] {t, t}, new String[] {"a"},
        new double[][] {{1, 2}});
  }

  @Test
  public void testSliceAndConcat() {
    TimeSeriesFrame df = Frames.seasonal(20, 2, 1);
    TimeSeriesFrame head = df.head(12);
    TimeSeriesFrame tail = df.tail(8);
    assertEquals(12, head.rows());
    assertEquals(df.getIndex(12), tail.getIndex(0));
    TimeSeriesFrame joined = head.concatRows(tail);
    assertEquals(0, Frames.maxAbsDiff(df, joined), 0);
    assertEquals(5, df.indexOf(df.getIndex(5)));
    assertEquals(-1, df.indexOf(LocalDateTime.of(1999, 1, 1, 0, 0)));
  }

  @Test
  public void testFfillBfill() {
    TimeSeriesFrame df = Frames.single(Double.NaN, 1, Double.NaN, 3, Double.NaN);
    assertArrayEquals(new double[] {1, 1, 1, 3, 3}, df.ffillBfill().column(0), 0);
  }

  @Test
  public void testEpochDays() {
    assertEquals(0.0, TimeSeriesFrame.epochDays(LocalDateTime.of(1970, 1, 1, 0, 0)), 0);
    assertEquals(1.5, TimeSeriesFrame.epochDays(LocalDateTime.of(1970, 1, 2, 12, 0)), 1e-12);
    TimeSeriesFrame df = Frames.single(1, 2);
    assertEquals(LocalDate.of(2020, 1, 1).toEpochDay() + TimeSeriesFrame.JULIAN_EPOCH,
        df.julianDates()[0], 1e-9);
  }

  @Test
  public void testPlusMinus() {
    TimeSeriesFrame a = Frames.seasonal(10, 2, 3);
    TimeSeriesFrame b = Frames.seasonal(10, 2, 4);
    assertEquals(0, Frames.maxAbsDiff(a.plus(b).minus(b), a), 1e-12);
  }
}
