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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import net.larse.tsprep.helper.AlgorithmBase;
import net.larse.tsprep.helper.WeightedChoice;
import net.larse.tsprep.transforms.AnomalyRemoval;
import net.larse.tsprep.transforms.ClipOutliers;
import net.larse.tsprep.transforms.Discretize;
import net.larse.tsprep.transforms.EWMAFilter;
import net.larse.tsprep.transforms.ScipyFilter;
import net.larse.tsprep.transforms.SpeedTier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Draws random pipeline configurations from a weighted transformer catalog.
 *
 * <pre>
 * TransformConfig config = new RandomTransform()
 *     .catalog("fast")
 *     .maxDepth(3)
 *     .generate(new Random(7));
 * </pre>
 *
 * <p>Unless set explicitly, the parameter tier follows the catalog: parameters are fast
 * when the catalog lacks {@code BTCD} and superfast when it lacks all of
 * {@code DatepartRegression}, {@code ScipyFilter} and {@code QuantileTransformer}.
 */
public final class RandomTransform {
  private static final Logger LOG = LogManager.getLogger(RandomTransform.class);

  private static final ImmutableList<String> SLOW_FLAGS = ImmutableList.of("BTCD");
  private static final ImmutableList<String> SUPERFAST_BLOCKERS =
      ImmutableList.of("DatepartRegression", "ScipyFilter", "QuantileTransformer");

  /** Chance that a depth-1 pipeline becomes a no-op. */
  static final double NONE_PROBABILITY = 0.1;

  private Map<String, Double> catalog = TransformerCatalog.ALL;
  private int maxDepth = 4;
  private int minDepth = 1;
  private Map<String, Double> naProbs = TransformerCatalog.NA_PROBS;
  private Boolean fastParams = null;
  private Boolean superfastParams = null;
  private boolean traditionalOrder = false;
  private boolean allowNone = true;
  private boolean noNanFill = false;

  public RandomTransform catalog(Map<String, Double> catalog) {
    Preconditions.checkArgument(catalog != null && !catalog.isEmpty(), "empty catalog");
    this.catalog = catalog;
    return this;
  }

  /** A catalog alias, see {@link TransformerCatalog#resolve(String)}. */
  public RandomTransform catalog(String alias) {
    return catalog(TransformerCatalog.resolve(alias));
  }

  /** Equal weights over the given names. */
  public RandomTransform catalog(List<String> names) {
    return catalog(TransformerCatalog.uniform(names));
  }

  public RandomTransform maxDepth(int maxDepth) {
    this.maxDepth = maxDepth;
    return this;
  }

  public RandomTransform minDepth(int minDepth) {
    this.minDepth = minDepth;
    return this;
  }

  public RandomTransform naProbs(Map<String, Double> naProbs) {
    this.naProbs = Preconditions.checkNotNull(naProbs, "naProbs");
    return this;
  }

  /** Forces the fast tier on or off, null to derive it from the catalog. */
  public RandomTransform fastParams(Boolean fastParams) {
    this.fastParams = fastParams;
    return this;
  }

  /** Forces the superfast tier on or off, null to derive it from the catalog. */
  public RandomTransform superfastParams(Boolean superfastParams) {
    this.superfastParams = superfastParams;
    return this;
  }

  /** Orders steps as clip, detrend, a free pick, then alignment. */
  public RandomTransform traditionalOrder(boolean traditionalOrder) {
    this.traditionalOrder = traditionalOrder;
    return this;
  }

  public RandomTransform allowNone(boolean allowNone) {
    this.allowNone = allowNone;
    return this;
  }

  public RandomTransform noNanFill(boolean noNanFill) {
    this.noNanFill = noNanFill;
    return this;
  }

  /** The parameter tier used for the current settings. */
  public SpeedTier tier() {
    boolean fast = fastParams != null
        ? fastParams
        : SLOW_FLAGS.stream().noneMatch(catalog::containsKey);
    boolean superfast = superfastParams != null
        ? superfastParams
        : SUPERFAST_BLOCKERS.stream().noneMatch(catalog::containsKey);
    if (superfast) {
      return SpeedTier.SUPERFAST;
    }
    return fast ? SpeedTier.FAST : SpeedTier.ALL;
  }

  public TransformConfig generate(Random random) {
    SpeedTier tier = tier();
    String fillNa = noNanFill ? null : chooseFill(tier, random);

    int low = maxDepth <= 0 ? 0 : minDepth;
    int high = Math.max(0, maxDepth);
    int depth = WeightedChoice.randint(random, low, high);
    if (depth == 1 && allowNone && random.nextDouble() < NONE_PROBABILITY) {
      return new TransformConfig(fillNa, ImmutableList.of(TransformStep.of(0, "None")));
    }

    List<String> names = new ArrayList<>(catalog.keySet());
    double[] weights = names.stream().mapToDouble(catalog::get).toArray();
    List<String> chosen;
    if (traditionalOrder) {
      List<String> randos = WeightedChoice.choices(random, names, weights, 4);
      String clip = catalog.containsKey(ClipOutliers.NAME) ? ClipOutliers.NAME : randos.get(0);
      String detrend = catalog.containsKey("Detrend") ? "Detrend" : randos.get(1);
      String align = catalog.containsKey("AlignLastValue") ? "AlignLastValue" : randos.get(2);
      chosen = ImmutableList.of(clip, detrend, randos.get(3), align)
          .subList(0, Math.min(4, depth));
    } else {
      chosen = WeightedChoice.choices(random, names, weights, depth);
    }

    List<TransformStep> steps = new ArrayList<>();
    for (int i = 0; i < chosen.size(); i++) {
      String name = chosen.get(i);
      steps.add(new TransformStep(i, name, TransformerRegistry.newParams(name, tier, random)));
    }
    TransformConfig config = new TransformConfig(fillNa, steps);
    LOG.debug("Drew {} at tier {}", config, tier);
    return config;
  }

  private String chooseFill(SpeedTier tier, Random random) {
    Map<String, Double> fills = naProbs;
    Map<String, Double> interpolation = TransformerCatalog.INTERPOLATION;
    if (tier.isFast()) {
      fills = TransformerCatalog.without(fills, "IterativeImputer",
          "IterativeImputerExtraTrees");
      interpolation = TransformerCatalog.without(interpolation, "spline");
    }
    if (tier == SpeedTier.SUPERFAST) {
      fills = TransformerCatalog.without(fills, "KNNImputer");
    }
    String fill = WeightedChoice.choose(random, fills);
    if (fill.equals("interpolate")) {
      fill = WeightedChoice.choose(random, interpolation);
    }
    return fill.equals("None") ? null : fill;
  }

  /**
   * A random configuration that cleans data without shifting its level, or null for none.
   * Used for the inner pipelines of regression based transformers.
   */
  public static TransformConfig randomCleaners(Random random) {
    int pick = WeightedChoice.chooseIndex(random,
        new double[] {0.8, 0.1, 0.1, 0.1, 0.1, 0.1, 0.05, 0.05, 0.05});
    switch (pick) {
      case 0:
        return null;
      case 1:
        return new RandomTransform().catalog(TransformerCatalog.FAST).maxDepth(2)
            .generate(random);
      case 2:
        return single(EWMAFilter.NAME, ImmutableMap.of("span", 7));
      case 3:
        return single(EWMAFilter.NAME, ImmutableMap.of("span", 2));
      case 4:
        return single(ScipyFilter.NAME, ImmutableMap.of("method", "savgol_filter",
            "window_length", 31, "polyorder", 3, "deriv", 0, "mode", "interp"));
      case 5:
        return single(ClipOutliers.NAME,
            ImmutableMap.of("method", "clip", "std_threshold", 3));
      case 6:
        return single("bkfilter", ImmutableMap.of());
      case 7:
        return single(Discretize.NAME,
            ImmutableMap.of("discretization", "center", "n_bins", 20));
      default:
        return single(AnomalyRemoval.NAME, ImmutableMap.of("method", "zscore",
            "transform_dict", AnomalyRemoval.defaultTransform(),
            "method_params", ImmutableMap.of("distribution", "uniform", "alpha", 0.05)));
    }
  }

  private static TransformConfig single(String name, Map<String, ?> params) {
    AlgorithmBase.ArgsBase args = TransformerRegistry.args(name, params);
    return new TransformConfig(null, ImmutableList.of(new TransformStep(0, name, args)));
  }
}
