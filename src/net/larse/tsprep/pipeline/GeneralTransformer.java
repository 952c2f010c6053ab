/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsprep.pipeline;

import com.google.common.base.Preconditions;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import net.larse.tsprep.exception.TransformException;
import net.larse.tsprep.fill.FillNA;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import net.larse.tsprep.transforms.BoundsAwareTransformer;
import net.larse.tsprep.transforms.InverseMode;
import net.larse.tsprep.transforms.ModeAwareTransformer;
import net.larse.tsprep.transforms.Transformer;

/**
 * Runs a {@link TransformConfig}: fills missing values, then fits and applies each step in
 * index order, and inverts the steps in reverse order.
 *
 * <p>Every failure of a step is rethrown as a {@link TransformException} naming the step and
 * the phase ({@code fit}, {@code transform} or {@code inverse}); there is no partial recovery.
 * The fitted transformers belong to this instance and are replaced on every fit.
 *
 * <p>A pipeline is itself a transformer, so configurations nest: Detrend cleaners, the inner
 * pipeline of AnomalyRemoval and the detector of HolidayTransformer are ordinary
 * GeneralTransformers.
 */
public class GeneralTransformer implements BoundsAwareTransformer {
  private static final Logger LOG = LogManager.getLogger(GeneralTransformer.class);

  public static final String NAME = "GeneralTransformer";

  private final TransformConfig config;
  private final TransformContext context;
  private List<Transformer> transformers;
  private LocalDateTime[] trackedIndex;
  private String[] trackedColumns;

  public GeneralTransformer(TransformConfig config, TransformContext context) {
    this.config = Preconditions.checkNotNull(config, "config");
    this.context = Preconditions.checkNotNull(context, "context");
  }

  public GeneralTransformer(TransformConfig config) {
    this(config, TransformContext.DEFAULT);
  }

  @Override
  public String name() {
    return NAME;
  }

  public TransformConfig config() {
    return config;
  }

  /** Fills NaN with the configured method, only when there are any. */
  TimeSeriesFrame fillNa(TimeSeriesFrame df) {
    if (!df.hasNaN()) {
      return df;
    }
    return FillNA.fill(df, config.fillNa(), FillNA.DEFAULT_WINDOW);
  }

  @Override
  public GeneralTransformer fit(TimeSeriesFrame df) {
    fitTransform(df);
    return this;
  }

  @Override
  public TimeSeriesFrame fitTransform(TimeSeriesFrame df) {
    Preconditions.checkNotNull(df, "df");
    df = fillNa(df);
    track(df);
    List<Transformer> fitted = new ArrayList<>();
    for (TransformStep step : config.steps()) {
      try {
        Transformer t = TransformerRegistry.create(step, df, context);
        LOG.debug("Fitting step {} {} on {} rows, {} series", step.index(), step.name(),
            df.rows(), df.cols());
        df = t.fitTransform(df);
        fitted.add(t);
      } catch (RuntimeException e) {
        throw failure(step.name(), "fit", e);
      }
      track(df);
    }
    transformers = fitted;
    return df;
  }

  @Override
  public TimeSeriesFrame transform(TimeSeriesFrame df) {
    checkFitted();
    df = fillNa(df);
    track(df);
    for (int i = 0; i < transformers.size(); i++) {
      String name = config.steps().get(i).name();
      try {
        LOG.debug("Transforming step {} {}", i, name);
        df = transformers.get(i).transform(df);
      } catch (RuntimeException e) {
        throw failure(name, "transform", e);
      }
      track(df);
    }
    return df;
  }

  @Override
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df, InverseMode mode,
      boolean bounds) {
    return inverseTransform(df, mode, false, bounds);
  }

  /**
   * Inverts the steps in reverse order.
   *
   * @param mode whether df continues the fit history or replays it
   * @param fillZero replace values left missing by the inverse with zero
   * @param bounds df holds prediction interval bounds, which alignment steps leave alone
   */
  public TimeSeriesFrame inverseTransform(TimeSeriesFrame df, InverseMode mode,
      boolean fillZero, boolean bounds) {
    checkFitted();
    track(df);
    for (int i = transformers.size() - 1; i >= 0; i--) {
      Transformer t = transformers.get(i);
      String name = config.steps().get(i).name();
      try {
        LOG.debug("Inverting step {} {} ({})", i, name, mode);
        if (t instanceof BoundsAwareTransformer) {
          df = ((BoundsAwareTransformer) t).inverseTransform(df, mode, bounds);
        } else if (t instanceof ModeAwareTransformer) {
          df = ((ModeAwareTransformer) t).inverseTransform(df, mode);
        } else {
          df = t.inverseTransform(df);
        }
      } catch (RuntimeException e) {
        throw failure(name, "inverse", e);
      }
      track(df);
    }
    if (fillZero) {
      df = FillNA.fill(df, "zero");
    }
    return df;
  }

  private void track(TimeSeriesFrame df) {
    trackedIndex = df.index();
    trackedColumns = df.columns();
  }

  private void checkFitted() {
    Preconditions.checkState(transformers != null, "GeneralTransformer has not been fit");
  }

  private static TransformException failure(String name, String phase, RuntimeException e) {
    return new TransformException(name, "Transformer " + name + " failed on " + phase, e);
  }

  /** The fitted transformers in step order. */
  public List<Transformer> transformers() {
    checkFitted();
    return new ArrayList<>(transformers);
  }

  /** Index of the frame most recently produced, after any slicing step. */
  public LocalDateTime[] trackedIndex() {
    return trackedIndex == null ? null : trackedIndex.clone();
  }

  /** Columns of the frame most recently produced, after any decomposition step. */
  public String[] trackedColumns() {
    return trackedColumns == null ? null : trackedColumns.clone();
  }

  @Override
  public String toString() {
    return NAME + " " + config;
  }
}
