package net.larse.tsprep.helper;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

import org.junit.Test;

import static org.junit.Assert.*;

public class AlgorithmBaseTest {

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "A lag.")
    @Optional
    public int lag1 = 7;

    @Doc(help = "A weight.")
    @Optional
    public Double weight = null;

    @Doc(help = "A name.")
    @Required
    public String method = "mean";

    @Doc(help = "Coefficients.")
    @Optional
    public double[] coefficients = null;

    @Doc(help = "Free form options.")
    @Optional
    public Map<String, Object> options = null;

    @Override
    protected void checkValues() {
      if (lag1 < 1) {
        throw new IllegalArgumentException("lag1 must be positive");
      }
    }
  }

  @Test
  public void testSnakeCaseAndCoercion() {
    Args a = new Args();
    a.set("lag_1", 12.0);
    a.set("weight", "0.5");
    a.set("coefficients", ImmutableList.of(1, 2.5));
    a.set("options", ImmutableMap.of("k", 1));
    assertEquals(12, a.lag1);
    assertEquals(0.5, a.weight, 0);
    assertArrayEquals(new double[] {1, 2.5}, a.coefficients, 0);
    assertEquals(1, a.options.get("k"));
  }

  @Test
  public void testToMapInDeclarationOrder() {
    Map<String, Object> map = new Args().toMap();
    assertEquals(ImmutableList.of("lag1", "weight", "method", "coefficients", "options"),
        ImmutableList.copyOf(map.keySet()));
    assertEquals(7, map.get("lag1"));
  }

  @Test
  public void testFromMapAndCopy() {
    Args a = AlgorithmBase.ArgsBase.fromMap(Args.class, ImmutableMap.of("method", "median"));
    Args b = a.copy();
    b.method = "max";
    assertEquals("median", a.method);
    assertEquals(a.lag1, b.lag1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownArgument() {
    new Args().set("nope", 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingRequired() {
    Args a = new Args();
    a.method = null;
    a.validate();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckValues() {
    Args a = new Args();
    a.lag1 = 0;
    a.validate();
  }
}
