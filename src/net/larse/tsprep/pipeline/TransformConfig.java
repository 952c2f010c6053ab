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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A pipeline configuration: the NaN fill method and the ordered transformation steps.
 *
 * <p>The map form mirrors the key/value configuration used by callers:
 * <pre>
 * {"fillna": "ffill",
 *  "transformations": {0: "Detrend", 1: "SeasonalDifference"},
 *  "transformation_params": {0: {"model": "GLS"}, 1: {"lag_1": 7}}}
 * </pre>
 * Keys of the inner maps are step indexes, as numbers or numeric strings.
 */
public final class TransformConfig {
  private final String fillNa;
  private final ImmutableList<TransformStep> steps;

  public TransformConfig(String fillNa, List<TransformStep> steps) {
    this.fillNa = fillNa;
    List<TransformStep> sorted = new ArrayList<>(steps);
    sorted.sort(Comparator.comparingInt(TransformStep::index));
    Set<Integer> seen = new HashSet<>();
    for (TransformStep step : sorted) {
      Preconditions.checkArgument(seen.add(step.index()), "duplicate step index %s",
          step.index());
    }
    this.steps = ImmutableList.copyOf(sorted);
  }

  /** Steps with default arguments, indexed in the given order. */
  public static TransformConfig of(String fillNa, String... names) {
    List<TransformStep> steps = new ArrayList<>();
    for (int i = 0; i < names.length; i++) {
      steps.add(TransformStep.of(i, names[i]));
    }
    return new TransformConfig(fillNa, steps);
  }

  public static TransformConfig fromMap(Map<String, ?> map) {
    Preconditions.checkNotNull(map, "map");
    Object fill = map.get("fillna");
    Map<?, ?> names = asMap(map.get("transformations"), "transformations");
    Map<?, ?> params = asMap(map.get("transformation_params"), "transformation_params");
    Map<Integer, Map<String, ?>> paramsByIndex = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : params.entrySet()) {
      paramsByIndex.put(toIndex(e.getKey()), stringKeys(e.getValue()));
    }
    List<TransformStep> steps = new ArrayList<>();
    for (Map.Entry<?, ?> e : names.entrySet()) {
      int index = toIndex(e.getKey());
      String name = e.getValue() == null ? "None" : e.getValue().toString();
      steps.add(new TransformStep(index, name,
          TransformerRegistry.args(name, paramsByIndex.get(index))));
    }
    return new TransformConfig(fill == null ? null : fill.toString(), steps);
  }

  public Map<String, Object> toMap() {
    Map<Integer, String> names = new LinkedHashMap<>();
    Map<Integer, Map<String, Object>> params = new LinkedHashMap<>();
    for (TransformStep step : steps) {
      names.put(step.index(), step.name());
      params.put(step.index(), step.args().toMap());
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("fillna", fillNa);
    out.put("transformations", names);
    out.put("transformation_params", params);
    return out;
  }

  private static Map<?, ?> asMap(Object value, String key) {
    if (value == null) {
      return new LinkedHashMap<>();
    }
    Preconditions.checkArgument(value instanceof Map, "%s must be a map", key);
    return (Map<?, ?>) value;
  }

  private static Map<String, ?> stringKeys(Object value) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : asMap(value, "transformation params").entrySet()) {
      out.put(e.getKey().toString(), e.getValue());
    }
    return out;
  }

  private static int toIndex(Object key) {
    if (key instanceof Number) {
      return ((Number) key).intValue();
    }
    return Integer.parseInt(key.toString().trim());
  }

  /** The NaN fill method, null for none. */
  public String fillNa() {
    return fillNa;
  }

  public ImmutableList<TransformStep> steps() {
    return steps;
  }

  public boolean isEmpty() {
    return steps.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransformConfig)) {
      return false;
    }
    TransformConfig other = (TransformConfig) o;
    return Objects.equal(fillNa, other.fillNa) && steps.equals(other.steps);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(fillNa, steps);
  }

  @Override
  public String toString() {
    return "TransformConfig{fillna=" + fillNa + ", steps=" + steps + "}";
  }
}
