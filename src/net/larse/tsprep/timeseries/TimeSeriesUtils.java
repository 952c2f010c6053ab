package net.larse.tsprep.timeseries;

import com.google.common.base.Preconditions;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;

import net.larse.tsprep.helper.ArrayHelper;

/**
 * Implements the STL algorithm in the paper:
 * R.B. Cleveland, W.S.Cleveland, J.E. McRae, and I. Terpenning,
 * STL: A Seasonal-Trend Decomposition Procedure Based on Loess,
 * Journal of Official Statistics, 6, 3-73 (1990).
 *
 * <p>Based on the stl implementation from the R package. Array arguments follow the
 * Fortran conventions of that code: indices in comments are 1-based, the Java arrays are
 * 0-based and offsets select the sub-arrays the Fortran passes by reference.
 *
 * <p>Also holds the classical moving-average decomposition and the period inferred from a
 * timestamp index.
 *
 * @author Zhiqiang Yang, 3/11/2015
 */
public final class TimeSeriesUtils {
  private TimeSeriesUtils() {}

  /**
   * Seasonal-trend decomposition.
   *
   * @param y the series, no missing values
   * @param np period of the seasonal component
   * @param ns span of the seasonal smoother
   * @param nt span of the trend smoother
   * @param nl span of the low-pass smoother
   * @param isdeg local degree for the seasonal smoother
   * @param itdeg local degree for the trend smoother
   * @param ildeg local degree for the low-pass smoother
   * @param nsjump evaluation skip of the seasonal smoother
   * @param ntjump evaluation skip of the trend smoother
   * @param nljump evaluation skip of the low-pass smoother
   * @param ni number of inner iterations
   * @param no number of outer (robust) iterations
   * @param rw output robustness weights
   * @param season output seasonal component
   * @param trend output trend component
   */
  public static void stl(double[] y, int np,
                         int ns, int nt, int nl,
                         int isdeg, int itdeg, int ildeg,
                         int nsjump, int ntjump, int nljump,
                         int ni, int no,
                         double[] rw, double[] season, double[] trend) {
    int n = y.length;
    boolean userw = false;
    Arrays.fill(trend, 0.0);

    // the three spans must be at least three and odd
    int newns = Math.max(3, ns);
    int newnt = Math.max(3, nt);
    int newnl = Math.max(3, nl);
    if (newns % 2 == 0) {
      newns++;
    }
    if (newnt % 2 == 0) {
      newnt++;
    }
    if (newnl % 2 == 0) {
      newnl++;
    }
    // periodicity at least 2
    int newnp = Math.max(2, np);

    double[][] work = new double[5][n + 2 * newnp];
    int k = 0;
    // outer loop -- robustness iterations
    while (true) {
      stlstp(y, n, newnp, newns, newnt, newnl, isdeg, itdeg, ildeg, nsjump, ntjump, nljump,
          ni, userw, rw, season, trend, work);
      k++;
      if (k > no) {
        break;
      }
      for (int i = 0; i < n; i++) {
        work[0][i] = trend[i] + season[i];
      }
      stlrwt(y, n, work[0], rw);
      userw = true;
    }
    // robustness weights when there were no robustness iterations
    if (no <= 0) {
      Arrays.fill(rw, 0, n, 1.0);
    }
  }

  static void stlstp(double[] y, int n, int np, int ns, int nt, int nl,
                     int isdeg, int itdeg, int ildeg,
                     int nsjump, int ntjump, int nljump,
                     int ni, boolean userw, double[] rw,
                     double[] season, double[] trend, double[][] work) {
    for (int j = 0; j < ni; j++) {
      for (int i = 0; i < n; i++) {
        work[0][i] = y[i] - trend[i];
      }
      stlss(work[0], n, np, ns, isdeg, nsjump, userw, rw, work[1], work[2], work[3],
          work[4], season);
      stlfts(work[1], n + 2 * np, np, work[2], work[0]);
      stless(work[2], 0, n, nl, ildeg, nljump, false, work[3], work[0], 0, work[4]);
      for (int i = 0; i < n; i++) {
        season[i] = work[1][np + i] - work[0][i];
      }
      for (int i = 0; i < n; i++) {
        work[0][i] = y[i] - season[i];
      }
      stless(work[0], 0, n, nt, itdeg, ntjump, userw, rw, trend, 0, work[2]);
    }
  }

  /** Bisquare robustness weights from the residuals y - fit. */
  static void stlrwt(double[] y, int n, double[] fit, double[] rw) {
    double[] r = new double[n];
    for (int i = 0; i < n; i++) {
      r[i] = Math.abs(y[i] - fit[i]);
    }
    double[] sorted = r.clone();
    Arrays.sort(sorted);
    int mid1 = n / 2 + 1;
    int mid2 = n - mid1 + 1;
    double cmad = 3.0 * (sorted[mid1 - 1] + sorted[mid2 - 1]);
    double c9 = 0.999 * cmad;
    double c1 = 0.001 * cmad;
    for (int i = 0; i < n; i++) {
      if (r[i] <= c1) {
        rw[i] = 1.0;
      } else if (r[i] <= c9) {
        double u = r[i] / cmad;
        rw[i] = (1 - u * u) * (1 - u * u);
      } else {
        rw[i] = 0.0;
      }
    }
  }

  /**
   * Smooths each cycle-subseries, extending it by one value at both ends. The result in
   * season has n + 2 * np values.
   */
  static void stlss(double[] y, int n, int np, int ns, int isdeg, int nsjump,
                    boolean userw, double[] rw, double[] season,
                    double[] work1, double[] work2, double[] work3, double[] work4) {
    for (int j = 1; j <= np; j++) {
      int k = (n - j) / np + 1;
      for (int i = 1; i <= k; i++) {
        work1[i - 1] = y[(i - 1) * np + j - 1];
      }
      if (userw) {
        for (int i = 1; i <= k; i++) {
          work3[i - 1] = rw[(i - 1) * np + j - 1];
        }
      }
      // Fortran: stless(work1, k, ..., work2(2), work4)
      stless(work1, 0, k, ns, isdeg, nsjump, userw, work3, work2, 1, work4);

      int nright = Math.min(ns, k);
      boolean ok = stlest(work1, k, ns, isdeg, 0.0, work2, 0, 1, nright, work4, userw, work3);
      if (!ok) {
        work2[0] = work2[1];
      }
      int nleft = Math.max(1, k - ns + 1);
      ok = stlest(work1, k, ns, isdeg, k + 1, work2, k + 1, nleft, k, work4, userw, work3);
      if (!ok) {
        work2[k + 1] = work2[k];
      }
      for (int m = 1; m <= k + 2; m++) {
        season[(m - 1) * np + j - 1] = work2[m - 1];
      }
    }
  }

  /** Low-pass filter: moving averages of length np, np and 3. */
  static void stlfts(double[] x, int n, int np, double[] trend, double[] work) {
    stlma(x, n, np, trend);
    stlma(trend, n - np + 1, np, work);
    stlma(work, n - 2 * np + 2, 3, trend);
  }

  static void stlma(double[] x, int n, int len, double[] ave) {
    int newn = n - len + 1;
    double v = 0.0;
    for (int i = 0; i < len; i++) {
      v += x[i];
    }
    ave[0] = v / len;
    if (newn > 1) {
      int k = len;
      int m = 0;
      for (int j = 1; j < newn; j++) {
        v = v - x[m] + x[k];
        ave[j] = v / len;
        k++;
        m++;
      }
    }
  }

  /**
   * Loess smoothing of y[yOff .. yOff+n) evaluated every njump points and linearly
   * interpolated in between. Results go to ys[ysOff ..].
   */
  static void stless(double[] y, int yOff, int n, int len, int ideg, int njump,
                     boolean userw, double[] rw, double[] ys, int ysOff, double[] res) {
    if (n < 2) {
      ys[ysOff] = y[yOff];
      return;
    }
    double[] yy = yOff == 0 ? y : Arrays.copyOfRange(y, yOff, yOff + n);
    int newnj = Math.min(njump, n - 1);
    int nleft = 0;
    int nright = 0;
    if (len >= n) {
      nleft = 1;
      nright = n;
      for (int i = 1; i <= n; i += newnj) {
        if (!stlest(yy, n, len, ideg, i, ys, ysOff + i - 1, nleft, nright, res, userw, rw)) {
          ys[ysOff + i - 1] = yy[i - 1];
        }
      }
    } else if (newnj == 1) {
      int nsh = (len + 1) / 2;
      nleft = 1;
      nright = len;
      for (int i = 1; i <= n; i++) {
        if (i > nsh && nright != n) {
          nleft++;
          nright++;
        }
        if (!stlest(yy, n, len, ideg, i, ys, ysOff + i - 1, nleft, nright, res, userw, rw)) {
          ys[ysOff + i - 1] = yy[i - 1];
        }
      }
    } else {
      int nsh = (len + 1) / 2;
      for (int i = 1; i <= n; i += newnj) {
        if (i < nsh) {
          nleft = 1;
          nright = len;
        } else if (i >= n - nsh + 1) {
          nleft = n - len + 1;
          nright = n;
        } else {
          nleft = i - nsh + 1;
          nright = len + i - nsh;
        }
        if (!stlest(yy, n, len, ideg, i, ys, ysOff + i - 1, nleft, nright, res, userw, rw)) {
          ys[ysOff + i - 1] = yy[i - 1];
        }
      }
    }
    if (newnj != 1) {
      for (int i = 1; i <= n - newnj; i += newnj) {
        double delta = (ys[ysOff + i + newnj - 1] - ys[ysOff + i - 1]) / newnj;
        for (int j = i + 1; j <= i + newnj - 1; j++) {
          ys[ysOff + j - 1] = ys[ysOff + i - 1] + delta * (j - i);
        }
      }
      int k = ((n - 1) / newnj) * newnj + 1;
      if (k != n) {
        if (!stlest(yy, n, len, ideg, n, ys, ysOff + n - 1, nleft, nright, res, userw, rw)) {
          ys[ysOff + n - 1] = yy[n - 1];
        }
        if (k != n - 1) {
          double delta = (ys[ysOff + n - 1] - ys[ysOff + k - 1]) / (n - k);
          for (int j = k + 1; j <= n - 1; j++) {
            ys[ysOff + j - 1] = ys[ysOff + k - 1] + delta * (j - k);
          }
        }
      }
    }
  }

  /**
   * Local weighted fit at xs using the points nleft..nright (1-based).
   *
   * @return false if all weights are zero, in which case ys is left untouched
   */
  static boolean stlest(double[] y, int n, int len, int ideg, double xs, double[] ys,
                        int ysIdx, int nleft, int nright, double[] w, boolean userw,
                        double[] rw) {
    double range = n - 1.0;
    double h = Math.max(xs - nleft, nright - xs);
    if (len > n) {
      h += (len - n) / 2;
    }
    double h9 = 0.999 * h;
    double h1 = 0.001 * h;
    double a = 0.0;
    for (int j = nleft; j <= nright; j++) {
      w[j - 1] = 0.0;
      double r = Math.abs(j - xs);
      if (r <= h9) {
        if (r <= h1) {
          w[j - 1] = 1.0;
        } else {
          double q = r / h;
          q = 1 - q * q * q;
          w[j - 1] = q * q * q;
        }
        if (userw) {
          w[j - 1] = rw[j - 1] * w[j - 1];
        }
        a += w[j - 1];
      }
    }
    if (a <= 0.0) {
      return false;
    }
    for (int j = nleft; j <= nright; j++) {
      w[j - 1] /= a;
    }
    if (h > 0 && ideg > 0) {
      a = 0.0;
      for (int j = nleft; j <= nright; j++) {
        a += w[j - 1] * j;
      }
      double b = xs - a;
      double c = 0.0;
      for (int j = nleft; j <= nright; j++) {
        c += w[j - 1] * (j - a) * (j - a);
      }
      if (Math.sqrt(c) > 0.001 * range) {
        b /= c;
        for (int j = nleft; j <= nright; j++) {
          w[j - 1] = w[j - 1] * (b * (j - a) + 1.0);
        }
      }
    }
    double sum = 0.0;
    for (int j = nleft; j <= nright; j++) {
      sum += w[j - 1] * y[j - 1];
    }
    ys[ysIdx] = sum;
    return true;
  }

  /**
   * Classical additive decomposition: a centered moving average of the period as trend,
   * per-phase means of the detrended series (centered to sum zero) as the seasonal part.
   * Trend and remainder are NaN where the moving average is undefined.
   *
   * @return {trend, seasonal, remainder}
   */
  public static double[][] classicalDecompose(double[] y, int period) {
    int n = y.length;
    Preconditions.checkArgument(period >= 2, "period must be at least 2, got %s", period);
    Preconditions.checkArgument(n >= 2 * period,
        "classical decomposition needs two full cycles, got %s values for period %s", n,
        period);
    double[] filt;
    if (period % 2 == 0) {
      filt = new double[period + 1];
      Arrays.fill(filt, 1.0 / period);
      filt[0] = 0.5 / period;
      filt[period] = 0.5 / period;
    } else {
      filt = new double[period];
      Arrays.fill(filt, 1.0 / period);
    }
    int half = filt.length / 2;
    double[] trend = ArrayHelper.fill(n, Double.NaN);
    for (int t = half; t < n - half; t++) {
      double s = 0;
      for (int k = 0; k < filt.length; k++) {
        s += filt[k] * y[t - half + k];
      }
      trend[t] = s;
    }
    double[] phaseSum = new double[period];
    int[] phaseCount = new int[period];
    for (int t = 0; t < n; t++) {
      if (!Double.isNaN(trend[t])) {
        phaseSum[t % period] += y[t] - trend[t];
        phaseCount[t % period]++;
      }
    }
    double[] phaseMean = new double[period];
    double grand = 0;
    for (int p = 0; p < period; p++) {
      phaseMean[p] = phaseSum[p] / phaseCount[p];
      grand += phaseMean[p];
    }
    grand /= period;
    double[] seasonal = new double[n];
    double[] resid = new double[n];
    for (int t = 0; t < n; t++) {
      seasonal[t] = phaseMean[t % period] - grand;
      resid[t] = y[t] - trend[t] - seasonal[t];
    }
    return new double[][] {trend, seasonal, resid};
  }

  /**
   * The seasonal period implied by the median spacing of the index: 24 for hourly data, 7
   * for daily, 52 for weekly, 12 for monthly, 4 for quarterly and 1 for yearly or coarser.
   */
  public static int inferPeriod(LocalDateTime[] index) {
    if (index.length < 2) {
      return 1;
    }
    double[] gaps = new double[index.length - 1];
    for (int i = 1; i < index.length; i++) {
      gaps[i - 1] = Duration.between(index[i - 1], index[i]).getSeconds() / 86400.0;
    }
    double days = ArrayHelper.nanMedian(gaps);
    if (days < 0.9) {
      return 24;
    } else if (days < 1.5) {
      return 7;
    } else if (days < 8) {
      return 52;
    } else if (days < 32) {
      return 12;
    } else if (days < 93) {
      return 4;
    }
    return 1;
  }

  /** The smallest odd integer not less than x. */
  static int nextOdd(double x) {
    int v = (int) Math.ceil(x);
    return v % 2 == 0 ? v + 1 : v;
  }
}
