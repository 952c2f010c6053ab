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

import com.google.common.base.CaseFormat;
import com.google.common.base.Preconditions;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base types shared by the configurable algorithms of this library.
 *
 * <p>Every algorithm declares its parameters as a nested {@code Args} class
 * extending {@link ArgsBase}. Each field is one parameter, documented with
 * {@link ArgsBase.Doc} and marked {@link ArgsBase.Required} or
 * {@link ArgsBase.Optional}. The base class gives reflective access to those
 * fields so arguments can be built from, and exported to, plain key/value
 * maps.
 */
public final class AlgorithmBase {
  private AlgorithmBase() {}

  /** Base class for algorithm arguments. */
  public abstract static class ArgsBase {
    /** Help text of an argument. */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Doc {
      String help();
    }

    /** The argument must be set to a non-null value. */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Required {}

    /** The argument has a usable default. */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Optional {}

    /**
     * Checks that every required argument is set, then runs the
     * argument-specific checks of {@link #checkValues()}.
     *
     * @throws IllegalArgumentException if an argument is missing or invalid
     */
    public final void validate() {
      for (Field field : argFields(getClass())) {
        if (field.isAnnotationPresent(Required.class)) {
          Preconditions.checkArgument(read(field) != null,
              "Missing required argument %s of %s", field.getName(),
              getClass().getName());
        }
      }
      checkValues();
    }

    /** Argument-specific consistency checks, run by {@link #validate()}. */
    protected void checkValues() {}

    /** Returns the arguments, by field name, in declaration order. */
    public Map<String, Object> toMap() {
      Map<String, Object> map = new LinkedHashMap<>();
      for (Field field : argFields(getClass())) {
        map.put(field.getName(), read(field));
      }
      return Collections.unmodifiableMap(map);
    }

    /**
     * Sets one argument. Names may be given in camelCase or snake_case.
     * Numbers are narrowed to the field type and strings are parsed for
     * numeric, boolean and enum fields.
     */
    public ArgsBase set(String name, Object value) {
      Field field = findField(getClass(), name);
      Preconditions.checkArgument(field != null, "Unknown argument %s for %s", name,
          getClass().getSimpleName());
      try {
        field.set(this, coerce(field.getType(), value));
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("Cannot set argument " + name, e);
      }
      return this;
    }

    /** Sets every entry of the map. */
    public ArgsBase setAll(Map<String, ?> values) {
      for (Map.Entry<String, ?> entry : values.entrySet()) {
        set(entry.getKey(), entry.getValue());
      }
      return this;
    }

    /** Returns a shallow copy of these arguments. */
    @SuppressWarnings("unchecked")
    public <T extends ArgsBase> T copy() {
      T copy = (T) newInstance(getClass());
      for (Field field : argFields(getClass())) {
        try {
          field.set(copy, field.get(this));
        } catch (IllegalAccessException e) {
          throw new IllegalStateException(e);
        }
      }
      return copy;
    }

    /** Creates arguments of the given class from a key/value map. */
    public static <T extends ArgsBase> T fromMap(Class<T> type, Map<String, ?> values) {
      T args = newInstance(type);
      if (values != null) {
        args.setAll(values);
      }
      return args;
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + toMap();
    }

    private Object read(Field field) {
      try {
        return field.get(this);
      } catch (IllegalAccessException e) {
        throw new IllegalStateException(e);
      }
    }

    private static <T> T newInstance(Class<T> type) {
      try {
        Constructor<T> ctor = type.getDeclaredConstructor();
        ctor.setAccessible(true);
        return ctor.newInstance();
      } catch (ReflectiveOperationException e) {
        throw new IllegalArgumentException(
            "Arguments class needs a no-arg constructor: " + type.getName(), e);
      }
    }

    private static List<Field> argFields(Class<?> type) {
      List<Field> fields = new ArrayList<>();
      for (Class<?> c = type; c != null && c != ArgsBase.class; c = c.getSuperclass()) {
        List<Field> own = new ArrayList<>();
        for (Field field : c.getDeclaredFields()) {
          int mod = field.getModifiers();
          if (Modifier.isStatic(mod) || field.isSynthetic()) {
            continue;
          }
          field.setAccessible(true);
          own.add(field);
        }
        fields.addAll(0, own);
      }
      return fields;
    }

    private static Field findField(Class<?> type, String name) {
      String camel = name.indexOf('_') >= 0
          ? CaseFormat.LOWER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name)
          : name;
      for (Field field : argFields(type)) {
        if (field.getName().equals(camel) || field.getName().equals(name)) {
          return field;
        }
      }
      return null;
    }

    /** The public static {@code fromMap(Map)} factory of type, if it has one. */
    private static Method findFromMap(Class<?> type) {
      try {
        Method m = type.getMethod("fromMap", Map.class);
        return Modifier.isStatic(m.getModifiers()) ? m : null;
      } catch (NoSuchMethodException e) {
        return null;
      }
    }

    private static Object toArray(Class<?> type, List<?> values) {
      if (type == double[].class) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
          out[i] = ((Number) values.get(i)).doubleValue();
        }
        return out;
      }
      double[][] out = new double[values.size()][];
      for (int i = 0; i < out.length; i++) {
        Object row = values.get(i);
        out[i] = row instanceof double[]
            ? ((double[]) row).clone()
            : (double[]) toArray(double[].class, (List<?>) row);
      }
      return out;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object coerce(Class<?> type, Object value) {
      if (value == null) {
        Preconditions.checkArgument(!type.isPrimitive(), "Null for primitive argument");
        return null;
      }
      if (type.isInstance(value)) {
        return value;
      }
      if (value instanceof Number) {
        Number n = (Number) value;
        if (type == int.class || type == Integer.class) {
          return n.intValue();
        } else if (type == double.class || type == Double.class) {
          return n.doubleValue();
        } else if (type == long.class || type == Long.class) {
          return n.longValue();
        } else if (type == String.class) {
          return value.toString();
        }
      }
      if (value instanceof String) {
        String s = ((String) value).trim();
        if (type == int.class || type == Integer.class) {
          return Integer.parseInt(s);
        } else if (type == double.class || type == Double.class) {
          return Double.parseDouble(s);
        } else if (type == long.class || type == Long.class) {
          return Long.parseLong(s);
        } else if (type == boolean.class || type == Boolean.class) {
          return Boolean.parseBoolean(s);
        } else if (type.isEnum()) {
          for (Object constant : type.getEnumConstants()) {
            Enum<?> e = (Enum<?>) constant;
            if (e.name().equalsIgnoreCase(s) || e.toString().equalsIgnoreCase(s)) {
              return e;
            }
          }
          return Enum.valueOf((Class<Enum>) type, s);
        }
      }
      if (value instanceof Map) {
        Method factory = findFromMap(type);
        if (factory != null) {
          try {
            return factory.invoke(null, value);
          } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException(
                "Cannot build " + type.getSimpleName() + " from " + value, e);
          }
        }
      }
      if (value instanceof List && (type == double[].class || type == double[][].class)) {
        return toArray(type, (List<?>) value);
      }
      if (value instanceof Boolean && type == boolean.class) {
        return value;
      }
      if ((value instanceof Integer && type == int.class)
          || (value instanceof Double && type == double.class)) {
        return value;
      }
      throw new IllegalArgumentException(
          "Cannot convert " + value + " to " + type.getSimpleName());
    }
  }
}
