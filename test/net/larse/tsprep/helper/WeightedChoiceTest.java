package net.larse.tsprep.helper;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Random;

import org.junit.Test;

import static org.junit.Assert.*;

public class WeightedChoiceTest {

  @Test
  public void testFrequenciesFollowWeights() {
    Random random = new Random(42);
    int a = 0;
    int n = 20000;
    for (int i = 0; i < n; i++) {
      if (WeightedChoice.choose(random, ImmutableList.of("a", "b"), 3, 1).equals("a")) {
        a++;
      }
    }
    assertEquals(0.75, a / (double) n, 0.02);
  }

  @Test
  public void testZeroWeightNeverDrawn() {
    Random random = new Random(1);
    for (int i = 0; i < 1000; i++) {
      assertNotEquals("never",
          WeightedChoice.choose(random, ImmutableMap.of("never", 0.0, "always", 1.0)));
    }
  }

  @Test
  public void testRandintInclusive() {
    Random random = new Random(3);
    boolean low = false;
    boolean high = false;
    for (int i = 0; i < 1000; i++) {
      int v = WeightedChoice.randint(random, 2, 4);
      assertTrue(v >= 2 && v <= 4);
      low |= v == 2;
      high |= v == 4;
    }
    assertTrue(low && high);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMismatchedWeights() {
    WeightedChoice.choose(new Random(), ImmutableList.of("a", "b"), 1);
  }
}
