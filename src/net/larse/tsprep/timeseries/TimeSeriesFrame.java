package net.larse.tsprep.timeseries;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAmount;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.function.UnaryOperator;

import net.larse.tsprep.exception.NonNumericDataException;
import net.larse.tsprep.helper.ArrayHelper;
import org.apache.commons.lang3.StringUtils;

/**
 * An immutable wide table of time series: one row per timestamp, one column per series.
 *
 * <p>Timestamps are strictly increasing and unique. Values are doubles with NaN marking a
 * missing observation. Data is held column-major, {@code data[column][row]}.
 */
public final class TimeSeriesFrame {
  /** Julian date of the Unix epoch, 1970-01-01T00:00. */
  public static final double JULIAN_EPOCH = 2440587.5;

  private static final double SECONDS_PER_DAY = 86400.0;

  private final LocalDateTime[] index;
  private final String[] columns;
  private final double[][] data;

  /**
   * Creates a frame from column-major data.
   *
   * @param index strictly increasing timestamps
   * @param columns unique series names
   * @param columnData {@code columnData[column][row]}
   */
  public TimeSeriesFrame(LocalDateTime[] index, String[] columns, double[][] columnData) {
    Preconditions.checkNotNull(index, "index");
    Preconditions.checkNotNull(columns, "columns");
    Preconditions.checkArgument(columnData.length == columns.length,
        "%s columns named but %s given", columns.length, columnData.length);
    for (int i = 1; i < index.length; i++) {
      Preconditions.checkArgument(index[i].isAfter(index[i - 1]),
          "index must be strictly increasing, %s follows %s", index[i], index[i - 1]);
    }
    Set<String> seen = new HashSet<>();
    for (String c : columns) {
      Preconditions.checkArgument(seen.add(c), "duplicate column %s", c);
    }
    this.index = index.clone();
    this.columns = columns.clone();
    this.data = new double[columnData.length][];
    for (int j = 0; j < columnData.length; j++) {
      Preconditions.checkArgument(columnData[j].length == index.length,
          "column %s has %s values for %s timestamps", columns[j], columnData[j].length,
          index.length);
      this.data[j] = columnData[j].clone();
    }
  }

  /** Creates a frame from row-major data, {@code rows[row][column]}. */
  public static TimeSeriesFrame fromRows(LocalDateTime[] index, String[] columns,
      double[][] rows) {
    Preconditions.checkArgument(rows.length == index.length, "%s rows for %s timestamps",
        rows.length, index.length);
    double[][] cols = new double[columns.length][index.length];
    for (int i = 0; i < rows.length; i++) {
      Preconditions.checkArgument(rows[i].length == columns.length, "row %s is ragged", i);
      for (int j = 0; j < columns.length; j++) {
        cols[j][i] = rows[i][j];
      }
    }
    return new TimeSeriesFrame(index, columns, cols);
  }

  /**
   * Creates a frame from loosely typed row-major values. Numbers are used as is, strings are
   * parsed, null and blank strings become NaN.
   *
   * @throws NonNumericDataException if any value cannot be read as a number
   */
  public static TimeSeriesFrame fromObjects(LocalDateTime[] index, String[] columns,
      Object[][] rows) {
    double[][] values = new double[rows.length][columns.length];
    for (int i = 0; i < rows.length; i++) {
      for (int j = 0; j < columns.length; j++) {
        values[i][j] = toDouble(rows[i][j], columns[j]);
      }
    }
    return fromRows(index, columns, values);
  }

  private static double toDouble(Object value, String column) {
    if (value == null) {
      return Double.NaN;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Boolean) {
      return ((Boolean) value) ? 1.0 : 0.0;
    }
    String s = StringUtils.trimToEmpty(value.toString());
    if (s.isEmpty() || StringUtils.equalsAnyIgnoreCase(s, "nan", "none", "null")) {
      return Double.NaN;
    }
    Double parsed = Doubles.tryParse(s);
    if (parsed == null) {
      throw new NonNumericDataException(
          "Data cannot be converted to numeric float: '" + s + "' in column " + column);
    }
    return parsed;
  }

  /** Timestamps starting at start, spaced by step. */
  public static LocalDateTime[] range(LocalDateTime start, TemporalAmount step, int periods) {
    LocalDateTime[] out = new LocalDateTime[periods];
    LocalDateTime t = start;
    for (int i = 0; i < periods; i++) {
      out[i] = t;
      t = t.plus(step);
    }
    return out;
  }

  public static LocalDateTime[] dailyIndex(LocalDate start, int periods) {
    return range(start.atStartOfDay(), Duration.ofDays(1), periods);
  }

  public static LocalDateTime[] hourlyIndex(LocalDateTime start, int periods) {
    return range(start, Duration.ofHours(1), periods);
  }

  public int rows() {
    return index.length;
  }

  public int cols() {
    return columns.length;
  }

  public LocalDateTime[] index() {
    return index.clone();
  }

  public LocalDateTime getIndex(int row) {
    return index[row];
  }

  public String[] columns() {
    return columns.clone();
  }

  public String getColumn(int col) {
    return columns[col];
  }

  public int columnIndex(String name) {
    for (int j = 0; j < columns.length; j++) {
      if (columns[j].equals(name)) {
        return j;
      }
    }
    return -1;
  }

  public double get(int row, int col) {
    return data[col][row];
  }

  /** A copy of one column's values. */
  public double[] column(int col) {
    return data[col].clone();
  }

  /** A copy of one row's values. */
  public double[] row(int row) {
    double[] out = new double[columns.length];
    for (int j = 0; j < columns.length; j++) {
      out[j] = data[j][row];
    }
    return out;
  }

  /** A deep copy of the data, {@code [column][row]}. */
  public double[][] columnData() {
    return ArrayHelper.copy(data);
  }

  /** A copy of the data, {@code [row][column]}. */
  public double[][] rowData() {
    double[][] out = new double[index.length][columns.length];
    for (int j = 0; j < columns.length; j++) {
      for (int i = 0; i < index.length; i++) {
        out[i][j] = data[j][i];
      }
    }
    return out;
  }

  /** Same index and columns, new column-major values. */
  public TimeSeriesFrame withData(double[][] columnData) {
    return new TimeSeriesFrame(index, columns, columnData);
  }

  /** Same index and columns, new row-major values. */
  public TimeSeriesFrame withRows(double[][] rows) {
    return fromRows(index, columns, rows);
  }

  public TimeSeriesFrame withColumns(String[] newColumns, double[][] columnData) {
    return new TimeSeriesFrame(index, newColumns, columnData);
  }

  /** Rows from (incl) to (excl). */
  public TimeSeriesFrame sliceRows(int from, int to) {
    Preconditions.checkPositionIndexes(from, to, index.length);
    double[][] cols = new double[columns.length][];
    for (int j = 0; j < columns.length; j++) {
      cols[j] = Arrays.copyOfRange(data[j], from, to);
    }
    return new TimeSeriesFrame(Arrays.copyOfRange(index, from, to), columns, cols);
  }

  /** The last n rows, or all rows if there are fewer. */
  public TimeSeriesFrame tail(int n) {
    int k = Math.max(0, Math.min(n, index.length));
    return sliceRows(index.length - k, index.length);
  }

  /** The first n rows, or all rows if there are fewer. */
  public TimeSeriesFrame head(int n) {
    int k = Math.max(0, Math.min(n, index.length));
    return sliceRows(0, k);
  }

  public boolean hasNaN() {
    for (double[] col : data) {
      if (ArrayHelper.hasNaN(col)) {
        return true;
      }
    }
    return false;
  }

  /** Fractional days since 1970-01-01T00:00 for each timestamp. */
  public double[] epochDays() {
    return epochDays(index);
  }

  /** Julian dates of the timestamps. */
  public double[] julianDates() {
    double[] days = epochDays(index);
    for (int i = 0; i < days.length; i++) {
      days[i] += JULIAN_EPOCH;
    }
    return days;
  }

  public static double epochDays(LocalDateTime t) {
    long seconds = t.toEpochSecond(ZoneOffset.UTC);
    return (seconds + t.getNano() / 1e9) / SECONDS_PER_DAY;
  }

  public static double[] epochDays(LocalDateTime[] index) {
    double[] out = new double[index.length];
    for (int i = 0; i < index.length; i++) {
      out[i] = epochDays(index[i]);
    }
    return out;
  }

  /** Applies op to a copy of each column; op may return a new array of the same length. */
  public TimeSeriesFrame mapColumns(UnaryOperator<double[]> op) {
    double[][] cols = new double[columns.length][];
    for (int j = 0; j < columns.length; j++) {
      cols[j] = op.apply(data[j].clone());
    }
    return withData(cols);
  }

  /** Forward fills, then back fills, every column. */
  public TimeSeriesFrame ffillBfill() {
    return mapColumns(c -> ArrayHelper.bfill(ArrayHelper.ffill(c)));
  }

  /** Element-wise sum with a frame of the same shape; labels are taken from this frame. */
  public TimeSeriesFrame plus(TimeSeriesFrame other) {
    return combine(other, 1);
  }

  /** Element-wise difference with a frame of the same shape. */
  public TimeSeriesFrame minus(TimeSeriesFrame other) {
    return combine(other, -1);
  }

  private TimeSeriesFrame combine(TimeSeriesFrame other, double sign) {
    Preconditions.checkArgument(other.rows() == rows() && other.cols() == cols(),
        "shape mismatch: %s vs %s", this, other);
    double[][] cols = new double[columns.length][index.length];
    for (int j = 0; j < columns.length; j++) {
      for (int i = 0; i < index.length; i++) {
        cols[j][i] = data[j][i] + sign * other.data[j][i];
      }
    }
    return withData(cols);
  }

  /** This frame's rows followed by other's rows, which must be later and share columns. */
  public TimeSeriesFrame concatRows(TimeSeriesFrame other) {
    Preconditions.checkArgument(other.cols() == cols(), "column count mismatch");
    LocalDateTime[] idx = new LocalDateTime[index.length + other.index.length];
    System.arraycopy(index, 0, idx, 0, index.length);
    System.arraycopy(other.index, 0, idx, index.length, other.index.length);
    double[][] cols = new double[columns.length][];
    for (int j = 0; j < columns.length; j++) {
      cols[j] = new double[idx.length];
      System.arraycopy(data[j], 0, cols[j], 0, index.length);
      System.arraycopy(other.data[j], 0, cols[j], index.length, other.index.length);
    }
    return new TimeSeriesFrame(idx, columns, cols);
  }

  /** Position of the timestamp in the index, or -1. */
  public int indexOf(LocalDateTime t) {
    int pos = Arrays.binarySearch(index, t);
    return pos >= 0 ? pos : -1;
  }

  @Override
  public String toString() {
    return "TimeSeriesFrame[" + index.length + " x " + columns.length + ", columns="
        + Arrays.toString(columns)
        + (index.length > 0 ? ", " + index[0] + " .. " + index[index.length - 1] : "") + "]";
  }
}
