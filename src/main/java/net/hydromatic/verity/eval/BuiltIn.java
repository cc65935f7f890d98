/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.verity.eval;

import static net.hydromatic.verity.eval.EvalException.Kind.OVERFLOW_ERROR;
import static net.hydromatic.verity.eval.EvalException.Kind.TYPE_ERROR;
import static net.hydromatic.verity.eval.EvalException.Kind.VALUE_ERROR;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import net.hydromatic.verity.ast.Op;
import net.hydromatic.verity.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in functions.
 *
 * <p>A name in a condition that is not bound in the environment is looked
 * up here. Each function checks the number of its arguments and the names
 * of its keyword arguments before it is called.
 */
public enum BuiltIn implements Applicable {
  ABS("abs", 1, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      final Object x = args.get(0);
      if (Values.isIntegral(x)) {
        final long v = Values.toLong(pos, x);
        if (v == Long.MIN_VALUE) {
          throw new EvalException(OVERFLOW_ERROR, "integer overflow", pos);
        }
        return Math.abs(v);
      }
      if (x instanceof Number) {
        return Math.abs(Values.toDouble(x));
      }
      throw new EvalException(TYPE_ERROR,
          "bad operand type for abs(): '" + Values.typeName(x) + "'", pos);
    }
  },

  ALL("all", 1, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      final Iterator<Object> iterator = Values.iterate(pos, args.get(0));
      while (iterator.hasNext()) {
        if (!Values.truth(iterator.next())) {
          return false;
        }
      }
      return true;
    }
  },

  ANY("any", 1, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      final Iterator<Object> iterator = Values.iterate(pos, args.get(0));
      while (iterator.hasNext()) {
        if (Values.truth(iterator.next())) {
          return true;
        }
      }
      return false;
    }
  },

  BOOL("bool", 0, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      return !args.isEmpty() && Values.truth(args.get(0));
    }
  },

  ENUMERATE("enumerate", 1, 2, "start") {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      final Iterator<Object> iterator = Values.iterate(pos, args.get(0));
      final Object start = arg(args, 1, keywords, "start", 0L);
      final long first = Values.toLong(pos, requireIntegral(pos, start));
      return new Generator(
          new Iterator<Object>() {
            long i = first;

            @Override public boolean hasNext() {
              return iterator.hasNext();
            }

            @Override public Object next() {
              final Object element = iterator.next();
              return Tuple.of(i++, element);
            }
          });
    }
  },

  FLOAT("float", 0, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      if (args.isEmpty()) {
        return 0D;
      }
      final Object x = args.get(0);
      if (Values.isNumeric(x)) {
        return Values.toDouble(x);
      }
      if (x instanceof String) {
        final String s = ((String) x).trim().toLowerCase(Locale.ROOT);
        switch (s) {
          case "inf":
          case "+inf":
          case "infinity":
          case "+infinity":
            return Double.POSITIVE_INFINITY;
          case "-inf":
          case "-infinity":
            return Double.NEGATIVE_INFINITY;
          case "nan":
          case "+nan":
          case "-nan":
            return Double.NaN;
          default:
            try {
              if (!s.isEmpty() && Character.isLetter(s.charAt(s.length() - 1))
                  || s.startsWith("0x")) {
                // Java accepts "1d" and "0x1p3"; Python does not
                throw new NumberFormatException(s);
              }
              return Double.parseDouble(s.replace("_", ""));
            } catch (NumberFormatException e) {
              throw new EvalException(VALUE_ERROR,
                  "could not convert string to float: "
                      + Printer.UNLIMITED.repr(x), pos);
            }
        }
      }
      throw new EvalException(TYPE_ERROR,
          "float() argument must be a string or a number, not '"
              + Values.typeName(x) + "'", pos);
    }
  },

  INT("int", 0, 2, "base") {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      if (args.isEmpty()) {
        return 0L;
      }
      final Object x = args.get(0);
      final Object base = arg(args, 1, keywords, "base", null);
      if (base != null || x instanceof String) {
        if (!(x instanceof String)) {
          throw new EvalException(TYPE_ERROR,
              "int() can't convert non-string with explicit base", pos);
        }
        final int radix = base == null
            ? 10
            : (int) Values.toLong(pos, requireIntegral(pos, base));
        final String s = ((String) x).trim().replace("_", "");
        try {
          return Long.parseLong(s, radix);
        } catch (NumberFormatException e) {
          throw new EvalException(VALUE_ERROR,
              "invalid literal for int() with base " + radix + ": "
                  + Printer.UNLIMITED.repr(x), pos);
        }
      }
      if (Values.isIntegral(x)) {
        return Values.toLong(pos, x);
      }
      if (x instanceof Number) {
        return toLongExact(pos, Values.toDouble(x));
      }
      throw new EvalException(TYPE_ERROR,
          "int() argument must be a string or a number, not '"
              + Values.typeName(x) + "'", pos);
    }
  },

  LEN("len", 1, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      return Values.len(pos, args.get(0));
    }
  },

  LIST("list", 0, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      return args.isEmpty()
          ? new ArrayList<>()
          : Values.toList(pos, args.get(0));
    }
  },

  MAX("max", 1, -1, "key", "default") {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      return minMax(pos, args, keywords, 1);
    }
  },

  MIN("min", 1, -1, "key", "default") {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      return minMax(pos, args, keywords, -1);
    }
  },

  RANGE("range", 1, 3) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      final List<Long> longs = new ArrayList<>();
      for (Object arg : args) {
        longs.add(Values.toLong(pos, requireIntegral(pos, arg)));
      }
      switch (longs.size()) {
        case 1:
          return new Range(0, longs.get(0), 1);
        case 2:
          return new Range(longs.get(0), longs.get(1), 1);
        default:
          if (longs.get(2) == 0) {
            throw new EvalException(VALUE_ERROR,
                "range() arg 3 must not be zero", pos);
          }
          return new Range(longs.get(0), longs.get(1), longs.get(2));
      }
    }
  },

  REPR("repr", 1, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      return Printer.UNLIMITED.repr(args.get(0));
    }
  },

  REVERSED("reversed", 1, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      final Object x = args.get(0);
      if (!(x instanceof List || x instanceof String || x instanceof Map)) {
        throw new EvalException(TYPE_ERROR,
            "'" + Values.typeName(x) + "' object is not reversible", pos);
      }
      final List<Object> list = Values.toList(pos, x);
      return new Generator(Lists.reverse(list).iterator());
    }
  },

  ROUND("round", 1, 2, "ndigits") {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      final Object x = args.get(0);
      final Object ndigits = Nil.of(arg(args, 1, keywords, "ndigits", null));
      if (!Values.isNumeric(x)) {
        throw new EvalException(TYPE_ERROR,
            "type " + Values.typeName(x) + " doesn't define __round__ method",
            pos);
      }
      if (ndigits == Nil.INSTANCE) {
        if (Values.isIntegral(x)) {
          return Values.toLong(pos, x);
        }
        return toLongExact(pos, Math.rint(Values.toDouble(x)));
      }
      final int n = (int) Values.toLong(pos, requireIntegral(pos, ndigits));
      if (Values.isIntegral(x)) {
        return BigDecimal.valueOf(Values.toLong(pos, x))
            .setScale(n, RoundingMode.HALF_EVEN)
            .longValue();
      }
      final double d = Values.toDouble(x);
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return d;
      }
      return new BigDecimal(d).setScale(n, RoundingMode.HALF_EVEN)
          .doubleValue();
    }
  },

  SET("set", 0, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      final Set<Object> set = new LinkedHashSet<>();
      if (!args.isEmpty()) {
        Values.iterate(pos, args.get(0))
            .forEachRemaining(e -> Values.addDistinct(set, e));
      }
      return set;
    }
  },

  SORTED("sorted", 1, 1, "key", "reverse") {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      final List<Object> list = Values.toList(pos, args.get(0));
      final Object key = Nil.of(keywords.get("key"));
      final boolean reverse =
          Values.truth(Nil.of(keywords.getOrDefault("reverse", false)));
      Comparator<Object> comparator = comparator(pos, key);
      if (reverse) {
        comparator = comparator.reversed();
      }
      list.sort(comparator);
      return list;
    }
  },

  STR("str", 0, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      return args.isEmpty() ? "" : Printer.UNLIMITED.str(args.get(0));
    }
  },

  SUM("sum", 1, 2, "start") {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      Object total = arg(args, 1, keywords, "start", 0L);
      if (total instanceof String) {
        throw new EvalException(TYPE_ERROR,
            "sum() can't sum strings [use ''.join(seq) instead]", pos);
      }
      final Iterator<Object> iterator = Values.iterate(pos, args.get(0));
      while (iterator.hasNext()) {
        total = Values.binary(pos, Op.PLUS, total,
            iterator.next());
      }
      return total;
    }
  },

  TUPLE("tuple", 0, 1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      return args.isEmpty()
          ? Tuple.EMPTY
          : Tuple.copyOf(Values.toList(pos, args.get(0)));
    }
  },

  ZIP("zip", 0, -1) {
    @Override Object call(Pos pos, List<Object> args,
        Map<String, Object> keywords) {
      final List<Iterator<Object>> iterators = new ArrayList<>();
      for (Object arg : args) {
        iterators.add(Values.iterate(pos, arg));
      }
      return new Generator(
          new Iterator<Object>() {
            @Override public boolean hasNext() {
              return !iterators.isEmpty()
                  && iterators.stream().allMatch(Iterator::hasNext);
            }

            @Override public Object next() {
              if (!hasNext()) {
                throw new NoSuchElementException();
              }
              final List<Object> elements = new ArrayList<>();
              iterators.forEach(iterator -> elements.add(iterator.next()));
              return Tuple.copyOf(elements);
            }
          });
    }
  };

  /** Name of the function, for example "len". */
  public final String pythonName;
  private final int minArgs;
  /** Maximum number of positional arguments, or -1 if unlimited. */
  private final int maxArgs;
  private final ImmutableSet<String> keywordNames;

  /** Map of all built-in functions, keyed by {@link #pythonName}. */
  public static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.pythonName, builtIn);
    }
    BY_NAME = b.build();
  }

  BuiltIn(String pythonName, int minArgs, int maxArgs,
      String... keywordNames) {
    this.pythonName = pythonName;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.keywordNames = ImmutableSet.copyOf(keywordNames);
  }

  /** Looks up a built-in function by name; returns null if not found. */
  public static @Nullable BuiltIn lookup(String name) {
    return BY_NAME.get(name);
  }

  @Override public final Object apply(Pos pos, List<Object> args,
      Map<String, Object> keywords) {
    if (args.size() < minArgs) {
      throw new EvalException(TYPE_ERROR,
          pythonName + "() expected at least " + minArgs + " argument"
              + (minArgs == 1 ? "" : "s") + ", got " + args.size(), pos);
    }
    if (maxArgs >= 0 && args.size() > maxArgs) {
      throw new EvalException(TYPE_ERROR,
          pythonName + "() expected at most " + maxArgs + " argument"
              + (maxArgs == 1 ? "" : "s") + ", got " + args.size(), pos);
    }
    for (String name : keywords.keySet()) {
      if (!keywordNames.contains(name)) {
        throw new EvalException(TYPE_ERROR,
            pythonName + "() got an unexpected keyword argument '" + name
                + "'", pos);
      }
    }
    return call(pos, args, keywords);
  }

  /** Calls the function, after its arguments have been checked. */
  abstract Object call(Pos pos, List<Object> args,
      Map<String, Object> keywords);

  /** Returns an argument that may be passed by position or keyword. */
  private static @Nullable Object arg(List<Object> args, int ordinal,
      Map<String, Object> keywords, String name,
      @Nullable Object defaultValue) {
    if (args.size() > ordinal) {
      return args.get(ordinal);
    }
    return keywords.getOrDefault(name, defaultValue);
  }

  private static Object requireIntegral(Pos pos, @Nullable Object o) {
    final Object value = Nil.of(o);
    if (!Values.isIntegral(value)) {
      throw new EvalException(TYPE_ERROR,
          "'" + Values.typeName(value)
              + "' object cannot be interpreted as an integer", pos);
    }
    return value;
  }

  private static long toLongExact(Pos pos, double d) {
    if (Double.isNaN(d)) {
      throw new EvalException(VALUE_ERROR,
          "cannot convert float NaN to integer", pos);
    }
    if (Double.isInfinite(d)
        || d >= 0x1p63
        || d < -0x1p63) {
      throw new EvalException(OVERFLOW_ERROR,
          "cannot convert float " + Printer.floatToString(d)
              + " to integer", pos);
    }
    return (long) d;
  }

  /** Returns a comparator that orders values, optionally by a key
   * function. */
  private static Comparator<Object> comparator(Pos pos, Object key) {
    if (key == Nil.INSTANCE) {
      return (a, b) -> Values.compare(pos, "<", a, b);
    }
    return (a, b) ->
        Values.compare(pos, "<",
            Values.call(pos, key, ImmutableList.of(a), ImmutableMap.of()),
            Values.call(pos, key, ImmutableList.of(b), ImmutableMap.of()));
  }

  /** Implements "min" ({@code sign} = -1) and "max" ({@code sign} = 1). */
  private static Object minMax(Pos pos, List<Object> args,
      Map<String, Object> keywords, int sign) {
    final String name = sign > 0 ? "max" : "min";
    final Iterator<Object> iterator;
    if (args.size() == 1) {
      iterator = Values.iterate(pos, args.get(0));
    } else {
      if (keywords.containsKey("default")) {
        throw new EvalException(TYPE_ERROR,
            "Cannot specify a default for " + name
                + "() with multiple positional arguments", pos);
      }
      iterator = args.iterator();
    }
    final Comparator<Object> comparator =
        comparator(pos, Nil.of(keywords.get("key")));
    if (!iterator.hasNext()) {
      if (keywords.containsKey("default")) {
        return Nil.of(keywords.get("default"));
      }
      throw new EvalException(VALUE_ERROR,
          name + "() arg is an empty sequence", pos);
    }
    Object best = iterator.next();
    while (iterator.hasNext()) {
      final Object o = iterator.next();
      // The first of several equal values wins
      if (comparator.compare(o, best) * sign > 0) {
        best = o;
      }
    }
    return best;
  }
}

// End BuiltIn.java
