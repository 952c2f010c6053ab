package net.larse.tsprep.timeseries;

import java.time.LocalDateTime;

/**
 * Lunar phase arithmetic after Meeus, Astronomical Algorithms, chapter 49.
 *
 * <p>New moon instants are accurate to a few minutes over the modern era, which is enough to
 * place lunar calendar days.
 */
public final class MoonPhase {
  /** Mean length of the synodic month in days. */
  public static final double SYNODIC_MONTH = 29.530588861;

  private static final double NEW_MOON_EPOCH = 2451550.09766;

  private MoonPhase() {}

  /**
   * Illuminated fraction of the lunar disc at the given Julian date, 0 at new moon and 1 at
   * full moon.
   */
  public static double illumination(double julianDate) {
    double k = Math.floor((julianDate - NEW_MOON_EPOCH) / SYNODIC_MONTH);
    double previous = newMoon(k);
    if (previous > julianDate) {
      previous = newMoon(k - 1);
    } else if (newMoon(k + 1) <= julianDate) {
      previous = newMoon(k + 1);
    }
    double age = (julianDate - previous) / SYNODIC_MONTH;
    return (1 - Math.cos(2 * Math.PI * age)) / 2;
  }

  /** Illuminated fraction for each timestamp. */
  public static double[] illumination(LocalDateTime[] index) {
    double[] out = new double[index.length];
    for (int i = 0; i < index.length; i++) {
      out[i] = illumination(TimeSeriesFrame.epochDays(index[i]) + TimeSeriesFrame.JULIAN_EPOCH);
    }
    return out;
  }

  /** Julian date (UT, ignoring delta T) of new moon number k, k = 0 on 2000-01-06. */
  public static double newMoon(double k) {
    double t = k / 1236.85;
    double t2 = t * t;
    double jde = NEW_MOON_EPOCH + SYNODIC_MONTH * k + 0.00015437 * t2
        - 0.000000150 * t2 * t + 0.00000000073 * t2 * t2;
    double e = 1 - 0.002516 * t - 0.0000074 * t2;
    double m = Math.toRadians(2.5534 + 29.10535670 * k - 0.0000014 * t2);
    double mp = Math.toRadians(201.5643 + 385.81693528 * k + 0.0107582 * t2);
    double f = Math.toRadians(160.7108 + 390.67050284 * k - 0.0016118 * t2);
    double omega = Math.toRadians(124.7746 - 1.56375588 * k + 0.0020672 * t2);
    double correction = -0.40720 * Math.sin(mp)
        + 0.17241 * e * Math.sin(m)
        + 0.01608 * Math.sin(2 * mp)
        + 0.01039 * Math.sin(2 * f)
        + 0.00739 * e * Math.sin(mp - m)
        - 0.00514 * e * Math.sin(mp + m)
        + 0.00208 * e * e * Math.sin(2 * m)
        - 0.00111 * Math.sin(mp - 2 * f)
        - 0.00057 * Math.sin(mp + 2 * f)
        + 0.00056 * e * Math.sin(2 * mp + m)
        - 0.00042 * Math.sin(3 * mp)
        + 0.00042 * e * Math.sin(m + 2 * f)
        + 0.00038 * e * Math.sin(m - 2 * f)
        - 0.00024 * e * Math.sin(2 * mp - m)
        - 0.00017 * Math.sin(omega);
    return jde + correction;
  }
}
