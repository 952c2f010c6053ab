package net.larse.tsprep.fill;

import com.google.common.collect.ImmutableList;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.UnivariateRealFunction;
import org.apache.commons.math.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math.analysis.interpolation.UnivariateRealInterpolator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import net.larse.tsprep.exception.TransformException;
import net.larse.tsprep.helper.ArrayHelper;

/**
 * Interpolates interior gaps between observed values, then forward and back fills the ends.
 *
 * <p>Methods: {@code linear} and {@code slinear} (straight lines over row positions),
 * {@code time} (straight lines over timestamps), {@code nearest}, {@code zero} (the previous
 * observation), {@code cubic} and {@code spline} (natural cubic spline). {@code akima} falls
 * back to the cubic spline and {@code pchip} to linear.
 */
public class InterpolationImputer extends Imputer {
  private static final Logger LOG = LogManager.getLogger(InterpolationImputer.class);

  public static final ImmutableList<String> METHODS = ImmutableList.of(
      "linear", "time", "nearest", "zero", "slinear", "cubic", "akima", "pchip", "spline");

  private final String method;

  public InterpolationImputer(String method) {
    if (!METHODS.contains(method)) {
      throw new IllegalArgumentException("Unknown interpolation method " + method);
    }
    this.method = method;
  }

  @Override
  public double[] imputeColumn(double[] values, double[] time) {
    int n = values.length;
    double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = method.equals("time") ? time[i] : i;
    }
    DoubleArrayList knownX = new DoubleArrayList();
    DoubleArrayList knownY = new DoubleArrayList();
    for (int i = 0; i < n; i++) {
      if (!Double.isNaN(values[i])) {
        knownX.add(x[i]);
        knownY.add(values[i]);
      }
    }
    double[] out = values.clone();
    if (knownX.size() < 2) {
      return ArrayHelper.bfill(ArrayHelper.ffill(out));
    }
    double[] kx = knownX.toDoubleArray();
    double[] ky = knownY.toDoubleArray();
    boolean spline = (method.equals("cubic") || method.equals("spline")
        || method.equals("akima")) && kx.length >= 3;
    UnivariateRealFunction splineFunction = spline ? splineOf(kx, ky) : null;
    int first = ArrayHelper.firstFinite(values, 0, n);
    int last = ArrayHelper.lastFinite(values, 0, n);
    for (int i = first + 1; i < last; i++) {
      if (!Double.isNaN(values[i])) {
        continue;
      }
      int hi = ArrayHelper.searchSorted(kx, x[i]);
      int lo = hi - 1;
      switch (method) {
        case "nearest":
          out[i] = x[i] - kx[lo] <= kx[hi] - x[i] ? ky[lo] : ky[hi];
          break;
        case "zero":
          out[i] = ky[lo];
          break;
        default:
          if (splineFunction != null) {
            out[i] = evaluate(splineFunction, x[i]);
          } else {
            double w = (x[i] - kx[lo]) / (kx[hi] - kx[lo]);
            out[i] = ky[lo] + w * (ky[hi] - ky[lo]);
          }
      }
    }
    return ArrayHelper.bfill(ArrayHelper.ffill(out));
  }

  private UnivariateRealFunction splineOf(double[] kx, double[] ky) {
    UnivariateRealInterpolator interpolator = new SplineInterpolator();
    try {
      return interpolator.interpolate(kx, ky);
    } catch (MathException e) {
      LOG.warn("Spline interpolation failed, using linear: {}", e.getMessage());
      return null;
    }
  }

  private static double evaluate(UnivariateRealFunction f, double v) {
    try {
      return f.value(v);
    } catch (MathException e) {
      throw new TransformException("FillNA", "spline evaluation failed at " + v, e);
    }
  }
}
