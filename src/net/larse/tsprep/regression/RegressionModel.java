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
package net.larse.tsprep.regression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

import net.larse.tsprep.helper.WeightedChoice;

/**
 * A regression model choice: a model name and its parameters, convertible to and from the
 * {@code {"model": ..., "model_params": {...}}} map form.
 */
public final class RegressionModel {
  /** Model weights when speed matters. */
  public static final ImmutableMap<String, Double> FAST_MODELS =
      ImmutableMap.of("ElasticNet", 0.5, "DecisionTree", 0.5);

  /** Model weights used by datepart regressions outside the fast tier. */
  public static final ImmutableMap<String, Double> DATEPART_MODELS = ImmutableMap.of(
      "ElasticNet", 0.25,
      "DecisionTree", 0.25,
      "KNN", 0.1,
      "RandomForest", 0.2,
      "ExtraTrees", 0.25);

  private final String model;
  private final Map<String, Object> params;

  public RegressionModel(String model, Map<String, ?> params) {
    this.model = Preconditions.checkNotNull(model, "model");
    this.params = params == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  public static RegressionModel of(String model) {
    return new RegressionModel(model, null);
  }

  /** Reads the {@code {"model": ..., "model_params": {...}}} form. */
  @SuppressWarnings("unchecked")
  public static RegressionModel fromMap(Map<String, ?> map) {
    Object name = map.get("model");
    Preconditions.checkArgument(name != null, "regression model map needs a 'model' entry");
    Object params = map.get("model_params");
    Preconditions.checkArgument(params == null || params instanceof Map,
        "model_params must be a map");
    return new RegressionModel(name.toString(), (Map<String, ?>) params);
  }

  public Map<String, Object> toMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("model", model);
    out.put("model_params", params);
    return out;
  }

  public String model() {
    return model;
  }

  public Map<String, Object> params() {
    return params;
  }

  /** Builds the regressor, seeding any randomness with seed. */
  public Regressor create(long seed) {
    switch (model) {
      case "Linear":
      case "LinearRegression":
        return new LinearRegression(bool("fit_intercept", true));
      case "Ridge":
      case "FastRidge":
        return new RidgeRegression(num("alpha", model.equals("FastRidge") ? 1e-9 : 1.0),
            bool("fit_intercept", true));
      case "ElasticNet":
        return new ElasticNetRegression(num("alpha", 1.0), num("l1_ratio", 0.5),
            bool("fit_intercept", true), "random".equals(params.get("selection")),
            (int) num("max_iter", 1000), 1e-4, new Random(seed));
      case "DecisionTree":
        return new DecisionTreeRegressor(optInt("max_depth"), num("min_samples_split", 2),
            (int) num("min_samples_leaf", 1), 0, false, new Random(seed));
      case "RandomForest":
        return new TreeEnsembleRegressor((int) num("n_estimators", 100), false,
            optInt("max_depth"), (int) num("min_samples_leaf", 1), 1.0, seed);
      case "ExtraTrees":
        return new TreeEnsembleRegressor((int) num("n_estimators", 100), true,
            optInt("max_depth"), (int) num("min_samples_leaf", 1), 1.0, seed);
      case "KNN":
        return new KNeighborsRegressor((int) num("n_neighbors", 5),
            "distance".equals(params.get("weights")));
      case "Poisson":
        return new GeneralizedLinearRegression(GeneralizedLinearRegression.Family.POISSON);
      case "Gamma":
        return new GeneralizedLinearRegression(GeneralizedLinearRegression.Family.GAMMA);
      case "Tweedie":
        return new GeneralizedLinearRegression(GeneralizedLinearRegression.Family.TWEEDIE);
      case "Robust":
        return new RobustLinearRegression();
      default:
        throw new IllegalArgumentException("Unknown regression model " + model);
    }
  }

  /** Draws a model from the weighted catalog and random parameters for it. */
  public static RegressionModel random(Map<String, Double> models, Random random) {
    return randomParams(WeightedChoice.choose(random, models), random);
  }

  /** Random parameters for the named model. */
  public static RegressionModel randomParams(String model, Random random) {
    Map<String, Object> p = new LinkedHashMap<>();
    switch (model) {
      case "ElasticNet":
        p.put("l1_ratio", WeightedChoice.choose(random, ImmutableList.of(0.5, 0.1, 0.9),
            0.7, 0.2, 0.1));
        p.put("fit_intercept", WeightedChoice.choose(random, ImmutableList.of(true, false),
            0.9, 0.1));
        p.put("selection", WeightedChoice.choose(random, ImmutableList.of("cyclic", "random"),
            0.8, 0.2));
        break;
      case "DecisionTree":
        p.put("max_depth", WeightedChoice.choose(random, Arrays.asList(null, 3, 9),
            0.4, 0.3, 0.3));
        p.put("min_samples_split", WeightedChoice.choose(random,
            ImmutableList.<Number>of(2, 4, 0.05), 0.4, 0.3, 0.3));
        break;
      case "KNN":
        p.put("n_neighbors", WeightedChoice.choose(random, ImmutableList.of(3, 5, 10, 14),
            0.2, 0.5, 0.2, 0.2));
        p.put("weights", WeightedChoice.uniform(random, "uniform", "distance"));
        break;
      case "RandomForest":
      case "ExtraTrees":
        p.put("n_estimators", WeightedChoice.choose(random, ImmutableList.of(100, 30, 300),
            0.6, 0.3, 0.1));
        p.put("min_samples_leaf", WeightedChoice.choose(random, ImmutableList.of(1, 2, 4),
            0.6, 0.2, 0.2));
        p.put("max_depth", WeightedChoice.choose(random, Arrays.asList(null, 5, 10),
            0.8, 0.1, 0.1));
        break;
      case "Ridge":
        p.put("alpha", WeightedChoice.uniform(random, 0.1, 1.0, 10.0));
        break;
      default:
        break;
    }
    return new RegressionModel(model, p);
  }

  private double num(String key, double fallback) {
    Object v = params.get(key);
    if (v == null) {
      return fallback;
    }
    return v instanceof Number ? ((Number) v).doubleValue() : Double.parseDouble(v.toString());
  }

  private Integer optInt(String key) {
    Object v = params.get(key);
    if (v == null || "None".equals(v)) {
      return null;
    }
    return v instanceof Number ? ((Number) v).intValue() : Integer.valueOf(v.toString());
  }

  private boolean bool(String key, boolean fallback) {
    Object v = params.get(key);
    if (v == null) {
      return fallback;
    }
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof RegressionModel)) {
      return false;
    }
    RegressionModel other = (RegressionModel) o;
    return model.equals(other.model) && params.equals(other.params);
  }

  @Override
  public int hashCode() {
    return Objects.hash(model, params);
  }

  @Override
  public String toString() {
    return model + params;
  }
}
