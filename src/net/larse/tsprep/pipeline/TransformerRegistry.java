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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Map;
import java.util.Random;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.regression.RegressionModel;
import net.larse.tsprep.timeseries.TimeSeriesFrame;
import net.larse.tsprep.transforms.AbstractTransformer;
import net.larse.tsprep.transforms.AlignLastValue;
import net.larse.tsprep.transforms.AnomalyRemoval;
import net.larse.tsprep.transforms.BTCD;
import net.larse.tsprep.transforms.CenterLastValue;
import net.larse.tsprep.transforms.ClipOutliers;
import net.larse.tsprep.transforms.Cointegration;
import net.larse.tsprep.transforms.CumSumTransformer;
import net.larse.tsprep.transforms.DatepartRegression;
import net.larse.tsprep.transforms.Detrend;
import net.larse.tsprep.transforms.DifferencedTransformer;
import net.larse.tsprep.transforms.Discretize;
import net.larse.tsprep.transforms.EWMAFilter;
import net.larse.tsprep.transforms.EmptyTransformer;
import net.larse.tsprep.transforms.FastICA;
import net.larse.tsprep.transforms.HPFilter;
import net.larse.tsprep.transforms.HolidayTransformer;
import net.larse.tsprep.transforms.IntermittentOccurrence;
import net.larse.tsprep.transforms.KalmanSmoothing;
import net.larse.tsprep.transforms.LocalLinearTrend;
import net.larse.tsprep.transforms.MeanDifference;
import net.larse.tsprep.transforms.PCA;
import net.larse.tsprep.transforms.PctChangeTransformer;
import net.larse.tsprep.transforms.PositiveShift;
import net.larse.tsprep.transforms.RollingMeanTransformer;
import net.larse.tsprep.transforms.Round;
import net.larse.tsprep.transforms.STLFilter;
import net.larse.tsprep.transforms.ScipyFilter;
import net.larse.tsprep.transforms.SeasonalDifference;
import net.larse.tsprep.transforms.SinTrend;
import net.larse.tsprep.transforms.Slice;
import net.larse.tsprep.transforms.SpeedTier;
import net.larse.tsprep.transforms.StatsmodelsFilter;
import net.larse.tsprep.transforms.Transformer;
import net.larse.tsprep.transforms.scalers.MaxAbsScaler;
import net.larse.tsprep.transforms.scalers.MinMaxScaler;
import net.larse.tsprep.transforms.scalers.PowerTransformer;
import net.larse.tsprep.transforms.scalers.QuantileTransformer;
import net.larse.tsprep.transforms.scalers.RobustScaler;
import net.larse.tsprep.transforms.scalers.StandardScaler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Transformers by registered name: how to build default arguments, how to draw random ones
 * and how to create the transformer. Aliases are names bound to preset arguments. Unknown
 * names resolve to {@link EmptyTransformer}.
 */
public final class TransformerRegistry {
  private static final Logger LOG = LogManager.getLogger(TransformerRegistry.class);

  private TransformerRegistry() {}

  /** Creates a transformer from its arguments and the data it is about to be fit on. */
  @FunctionalInterface
  interface Factory<A extends AlgorithmBase.ArgsBase> {
    Transformer create(A args, TimeSeriesFrame df);
  }

  static final class Definition<A extends AlgorithmBase.ArgsBase> {
    private final Supplier<A> defaults;
    private final Factory<A> factory;
    private final BiFunction<SpeedTier, Random, A> generator;

    Definition(Supplier<A> defaults, Factory<A> factory,
        BiFunction<SpeedTier, Random, A> generator) {
      this.defaults = defaults;
      this.factory = factory;
      this.generator = generator;
    }

    A defaults() {
      return defaults.get();
    }

    A random(SpeedTier tier, Random random) {
      return generator == null ? defaults.get() : generator.apply(tier, random);
    }

    @SuppressWarnings("unchecked")
    Transformer create(AlgorithmBase.ArgsBase args, TimeSeriesFrame df) {
      A sample = defaults.get();
      Preconditions.checkArgument(sample.getClass().isInstance(args),
          "expected %s arguments, got %s", sample.getClass().getSimpleName(),
          args.getClass().getSimpleName());
      return factory.create((A) args, df);
    }
  }

  private static <A extends AlgorithmBase.ArgsBase> Definition<A> define(Supplier<A> defaults,
      Factory<A> factory, BiFunction<SpeedTier, Random, A> generator) {
    return new Definition<>(defaults, factory, generator);
  }

  private static Definition<AbstractTransformer.NoArgs> plain(Supplier<Transformer> create) {
    return define(AbstractTransformer.NoArgs::new, (a, df) -> create.get(), null);
  }

  private static final Definition<AbstractTransformer.NoArgs> EMPTY =
      plain(EmptyTransformer::new);

  private static final ImmutableMap<String, Definition<?>> DEFINITIONS =
      ImmutableMap.<String, Definition<?>>builder()
          .put(EmptyTransformer.NAME, EMPTY)
          .put("None", EMPTY)
          .put(MinMaxScaler.NAME, plain(MinMaxScaler::new))
          .put(MaxAbsScaler.NAME, plain(MaxAbsScaler::new))
          .put(StandardScaler.NAME, plain(StandardScaler::new))
          .put(RobustScaler.NAME, plain(RobustScaler::new))
          .put(PowerTransformer.NAME, plain(PowerTransformer::new))
          .put(QuantileTransformer.NAME, define(QuantileTransformer.Args::new,
              (a, df) -> new QuantileTransformer(a), QuantileTransformer::newParams))
          .put(PCA.NAME, define(PCA.Args::new, (a, df) -> new PCA(a), PCA::newParams))
          .put(FastICA.NAME,
              define(FastICA.Args::new, (a, df) -> new FastICA(a), FastICA::newParams))
          .put(Detrend.NAME,
              define(Detrend.Args::new, (a, df) -> new Detrend(a), Detrend::newParams))
          .put(RollingMeanTransformer.NAME, define(RollingMeanTransformer.Args::new,
              (a, df) -> new RollingMeanTransformer(a), RollingMeanTransformer::newParams))
          .put("RollingMean", define(RollingMeanTransformer.Args::new,
              (a, df) -> new RollingMeanTransformer(a), null))
          .put("RollingMean10", define(() -> rollingMean(10, false),
              (a, df) -> new RollingMeanTransformer(a), null))
          .put("FixedRollingMean", define(() -> rollingMean(10, true),
              (a, df) -> new RollingMeanTransformer(a), null))
          .put("RollingMean100thN", define(RollingMeanTransformer.Args::new,
              (a, df) -> new RollingMeanTransformer(rowShare(a, df, 100)), null))
          .put("RollingMean10thN", define(RollingMeanTransformer.Args::new,
              (a, df) -> new RollingMeanTransformer(rowShare(a, df, 10)), null))
          .put(DifferencedTransformer.NAME, plain(DifferencedTransformer::new))
          .put(SinTrend.NAME,
              define(SinTrend.Args::new, (a, df) -> new SinTrend(a), SinTrend::newParams))
          .put("SineTrend",
              define(SinTrend.Args::new, (a, df) -> new SinTrend(a), SinTrend::newParams))
          .put(PctChangeTransformer.NAME, plain(PctChangeTransformer::new))
          .put(CumSumTransformer.NAME, plain(CumSumTransformer::new))
          .put(PositiveShift.NAME, define(PositiveShift.Args::new,
              (a, df) -> new PositiveShift(a), PositiveShift::newParams))
          .put("Log", define(TransformerRegistry::logShift,
              (a, df) -> new PositiveShift(a), null))
          .put(IntermittentOccurrence.NAME, define(IntermittentOccurrence.Args::new,
              (a, df) -> new IntermittentOccurrence(a), IntermittentOccurrence::newParams))
          .put(SeasonalDifference.NAME, define(SeasonalDifference.Args::new,
              (a, df) -> new SeasonalDifference(a), SeasonalDifference::newParams))
          .put("SeasonalDifferenceMean", define(() -> seasonalDifference(7, "Mean"),
              (a, df) -> new SeasonalDifference(a), null))
          .put("SeasonalDifference7", define(() -> seasonalDifference(7, "LastValue"),
              (a, df) -> new SeasonalDifference(a), null))
          .put("SeasonalDifference12", define(() -> seasonalDifference(12, "Mean"),
              (a, df) -> new SeasonalDifference(a), null))
          .put("SeasonalDifference28", define(() -> seasonalDifference(28, "Mean"),
              (a, df) -> new SeasonalDifference(a), null))
          .put(StatsmodelsFilter.NAME, define(StatsmodelsFilter.Args::new,
              (a, df) -> new StatsmodelsFilter(a), null))
          .put("bkfilter", define(() -> StatsmodelsFilter.of("bkfilter"),
              (a, df) -> new StatsmodelsFilter(a), null))
          .put("cffilter", define(() -> StatsmodelsFilter.of("cffilter"),
              (a, df) -> new StatsmodelsFilter(a), null))
          .put("convolution_filter", define(() -> StatsmodelsFilter.of("convolution_filter"),
              (a, df) -> new StatsmodelsFilter(a), null))
          .put(HPFilter.NAME,
              define(HPFilter.Args::new, (a, df) -> new HPFilter(a), HPFilter::newParams))
          .put(DatepartRegression.NAME, define(DatepartRegression.Args::new,
              (a, df) -> new DatepartRegression(a), DatepartRegression::newParams))
          .put("DatepartRegressionTransformer", define(DatepartRegression.Args::new,
              (a, df) -> new DatepartRegression(a), DatepartRegression::newParams))
          .put("DatepartRegressionLtd", define(
              () -> datepart(new RegressionModel("DecisionTree",
                  ImmutableMap.of("max_depth", 4, "min_samples_split", 2)), "recurring"),
              (a, df) -> new DatepartRegression(a), null))
          .put("DatepartRegressionElasticNet", define(
              () -> datepart(RegressionModel.of("ElasticNet"), "expanded"),
              (a, df) -> new DatepartRegression(a), null))
          .put("DatepartRegressionRandForest", define(
              () -> datepart(RegressionModel.of("RandomForest"), "expanded"),
              (a, df) -> new DatepartRegression(a), null))
          .put(ClipOutliers.NAME, define(ClipOutliers.Args::new,
              (a, df) -> new ClipOutliers(a), ClipOutliers::newParams))
          .put(Discretize.NAME, define(Discretize.Args::new,
              (a, df) -> new Discretize(a), Discretize::newParams))
          .put(CenterLastValue.NAME, define(CenterLastValue.Args::new,
              (a, df) -> new CenterLastValue(a), CenterLastValue::newParams))
          .put(Round.NAME, define(Round.Args::new, (a, df) -> new Round(a), Round::newParams))
          .put(Slice.NAME, define(Slice.Args::new, (a, df) -> new Slice(a), Slice::newParams))
          .put(ScipyFilter.NAME, define(ScipyFilter.Args::new,
              (a, df) -> new ScipyFilter(a), ScipyFilter::newParams))
          .put(STLFilter.NAME,
              define(STLFilter.Args::new, (a, df) -> new STLFilter(a), STLFilter::newParams))
          .put(EWMAFilter.NAME, define(EWMAFilter.Args::new,
              (a, df) -> new EWMAFilter(a), EWMAFilter::newParams))
          .put(MeanDifference.NAME, plain(MeanDifference::new))
          .put(BTCD.NAME, define(BTCD.Args::new, (a, df) -> new BTCD(a), BTCD::newParams))
          .put(Cointegration.NAME, define(Cointegration.Args::new,
              (a, df) -> new Cointegration(a), Cointegration::newParams))
          .put(AlignLastValue.NAME, define(AlignLastValue.Args::new,
              (a, df) -> new AlignLastValue(a), AlignLastValue::newParams))
          .put(AnomalyRemoval.NAME, define(AnomalyRemoval.Args::new,
              (a, df) -> new AnomalyRemoval(a), AnomalyRemoval::newParams))
          .put(HolidayTransformer.NAME, define(HolidayTransformer.Args::new,
              (a, df) -> new HolidayTransformer(a), HolidayTransformer::newParams))
          .put(LocalLinearTrend.NAME, define(LocalLinearTrend.Args::new,
              (a, df) -> new LocalLinearTrend(a), LocalLinearTrend::newParams))
          .put(KalmanSmoothing.NAME, define(KalmanSmoothing.Args::new,
              (a, df) -> new KalmanSmoothing(a), KalmanSmoothing::newParams))
          .build();

  private static RollingMeanTransformer.Args rollingMean(int window, boolean fixed) {
    RollingMeanTransformer.Args a = new RollingMeanTransformer.Args();
    a.window = window;
    a.fixed = fixed;
    return a;
  }

  /** A window of one n-th of the rows, at least 2. */
  private static RollingMeanTransformer.Args rowShare(RollingMeanTransformer.Args a,
      TimeSeriesFrame df, int n) {
    a.window = Math.max(2, df.rows() / n);
    return a;
  }

  private static PositiveShift.Args logShift() {
    PositiveShift.Args a = new PositiveShift.Args();
    a.log = true;
    return a;
  }

  private static SeasonalDifference.Args seasonalDifference(int lag, String method) {
    SeasonalDifference.Args a = new SeasonalDifference.Args();
    a.lag1 = lag;
    a.method = method;
    return a;
  }

  private static DatepartRegression.Args datepart(RegressionModel model, String method) {
    DatepartRegression.Args a = new DatepartRegression.Args();
    a.regressionModel = model;
    a.datepartMethod = method;
    return a;
  }

  private static Definition<?> lookup(String name) {
    Definition<?> d = name == null ? EMPTY : DEFINITIONS.get(name);
    if (d == null) {
      LOG.info("Transformer {} not known, using {}", name, EmptyTransformer.NAME);
      return EMPTY;
    }
    return d;
  }

  public static boolean contains(String name) {
    return DEFINITIONS.containsKey(name);
  }

  public static ImmutableSet<String> names() {
    return DEFINITIONS.keySet();
  }

  /**
   * Arguments for the named transformer: its defaults with params applied. Params of unknown
   * names are ignored along with the name.
   */
  public static AlgorithmBase.ArgsBase args(String name, Map<String, ?> params) {
    AlgorithmBase.ArgsBase a = lookup(name).defaults();
    if (contains(name) && params != null && !params.isEmpty()) {
      a.setAll(params);
    }
    return a;
  }

  /** Random arguments for the named transformer. */
  public static AlgorithmBase.ArgsBase newParams(String name, SpeedTier tier, Random random) {
    return lookup(name).random(tier, random);
  }

  /**
   * Creates the transformer of a step for the given data. The context's seed and thread
   * count replace the step's own where its arguments have them.
   */
  public static Transformer create(TransformStep step, TimeSeriesFrame df,
      TransformContext context) {
    AlgorithmBase.ArgsBase a = step.args().copy();
    Map<String, Object> fields = a.toMap();
    if (fields.containsKey("randomSeed")) {
      a.set("randomSeed", context.randomSeed());
    }
    if (fields.containsKey("nJobs")) {
      a.set("nJobs", context.nJobs());
    }
    return lookup(step.name()).create(a, df);
  }
}
