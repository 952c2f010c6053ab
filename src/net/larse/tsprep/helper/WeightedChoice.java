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
package net.larse.tsprep.helper;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Weighted random draws used by the parameter generators. Weights need not sum to one.
 */
public final class WeightedChoice {
  private WeightedChoice() {}

  /** Draws one of values with probability proportional to its weight. */
  public static <T> T choose(Random random, List<T> values, double... weights) {
    Preconditions.checkArgument(values.size() == weights.length,
        "%s values but %s weights", values.size(), weights.length);
    return values.get(chooseIndex(random, weights));
  }

  /** Draws a key of the map with probability proportional to its value. */
  public static <T> T choose(Random random, Map<T, Double> weighted) {
    List<T> keys = new ArrayList<>(weighted.keySet());
    double[] weights = new double[keys.size()];
    for (int i = 0; i < weights.length; i++) {
      weights[i] = weighted.get(keys.get(i));
    }
    return keys.get(chooseIndex(random, weights));
  }

  @SafeVarargs
  public static <T> T uniform(Random random, T... values) {
    return values[random.nextInt(values.length)];
  }

  /** Draws k values with replacement. */
  public static <T> List<T> choices(Random random, List<T> values, double[] weights, int k) {
    List<T> out = new ArrayList<>(k);
    for (int i = 0; i < k; i++) {
      out.add(choose(random, values, weights));
    }
    return out;
  }

  public static int chooseIndex(Random random, double[] weights) {
    double total = Arrays.stream(weights).sum();
    Preconditions.checkArgument(total > 0, "weights must sum to a positive value");
    double u = random.nextDouble() * total;
    double acc = 0;
    for (int i = 0; i < weights.length; i++) {
      acc += weights[i];
      if (u < acc) {
        return i;
      }
    }
    return weights.length - 1;
  }

  /** Uniform integer in [low, high], both inclusive. */
  public static int randint(Random random, int low, int high) {
    return low + random.nextInt(high - low + 1);
  }
}
