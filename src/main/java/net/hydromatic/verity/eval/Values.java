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

import static net.hydromatic.verity.eval.EvalException.Kind.INDEX_ERROR;
import static net.hydromatic.verity.eval.EvalException.Kind.KEY_ERROR;
import static net.hydromatic.verity.eval.EvalException.Kind.OVERFLOW_ERROR;
import static net.hydromatic.verity.eval.EvalException.Kind.TYPE_ERROR;
import static net.hydromatic.verity.eval.EvalException.Kind.VALUE_ERROR;
import static net.hydromatic.verity.eval.EvalException.Kind.ZERO_DIVISION_ERROR;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.primitives.Booleans;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Chars;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Floats;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import com.google.common.primitives.Shorts;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntConsumer;
import java.util.function.LongSupplier;
import net.hydromatic.verity.ast.Op;
import net.hydromatic.verity.ast.Pos;
import net.hydromatic.verity.util.CodePointComparator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operations on values.
 *
 * <p>Values are Java objects: {@link Boolean}, integral numbers
 * ({@link Long}, {@link Integer}, {@link Short}, {@link Byte}), other
 * numbers (treated as floating point), {@link String}, {@link List},
 * {@link Tuple}, {@link Set}, {@link Map}, {@link Generator}, {@link Slice},
 * {@link Nil}, {@link Applicable}, and any other object supplied by the
 * caller. Integer arithmetic is performed on {@code long} values and throws
 * "OverflowError" rather than wrapping.
 */
public class Values {
  private Values() {}

  /** Converts an object supplied by the caller, or returned by a host
   * method, to a value.
   *
   * <p>Java {@code null} becomes {@link Nil#INSTANCE}, a {@link Character}
   * becomes a one-character {@link String}, and an array of primitives
   * becomes an immutable list. */
  public static Object ofHost(@Nullable Object o) {
    if (o instanceof Character) {
      return o.toString();
    }
    if (o != null
        && o.getClass().isArray()
        && o.getClass().getComponentType().isPrimitive()) {
      return ImmutableList.copyOf(arrayAsList(o));
    }
    return Nil.of(o);
  }

  /** Returns a list view of an array, boxing its elements if the array is of
   * primitives. The elements of a {@code char} array are strings. */
  static List<?> arrayAsList(Object array) {
    if (array instanceof Object[]) {
      return Arrays.asList((Object[]) array);
    } else if (array instanceof int[]) {
      return Ints.asList((int[]) array);
    } else if (array instanceof long[]) {
      return Longs.asList((long[]) array);
    } else if (array instanceof double[]) {
      return Doubles.asList((double[]) array);
    } else if (array instanceof float[]) {
      return Floats.asList((float[]) array);
    } else if (array instanceof short[]) {
      return Shorts.asList((short[]) array);
    } else if (array instanceof byte[]) {
      return Bytes.asList((byte[]) array);
    } else if (array instanceof boolean[]) {
      return Booleans.asList((boolean[]) array);
    } else if (array instanceof char[]) {
      return Lists.transform(Chars.asList((char[]) array), Object::toString);
    } else {
      throw new IllegalArgumentException("not an array: " + array);
    }
  }

  /** Returns whether a value is an integer; booleans are integers. */
  public static boolean isIntegral(Object o) {
    return o instanceof Long
        || o instanceof Integer
        || o instanceof Short
        || o instanceof Byte
        || o instanceof Boolean;
  }

  /** Returns whether a value is a number; booleans are numbers. */
  public static boolean isNumeric(Object o) {
    return o instanceof Number || o instanceof Boolean;
  }

  /** Converts an integral value to {@code long}. */
  static long toLong(Pos pos, Object o) {
    if (o instanceof Boolean) {
      return (Boolean) o ? 1L : 0L;
    }
    if (o instanceof Number) {
      return ((Number) o).longValue();
    }
    throw new EvalException(TYPE_ERROR,
        "'" + typeName(o) + "' object cannot be interpreted as an integer",
        pos);
  }

  /** Converts a numeric value to {@code double}. */
  static double toDouble(Object o) {
    if (o instanceof Boolean) {
      return (Boolean) o ? 1D : 0D;
    }
    return ((Number) o).doubleValue();
  }

  /** Returns the name of the type of a value, as it appears in error
   * messages. */
  public static String typeName(Object o) {
    if (o instanceof Boolean) {
      return "bool";
    } else if (isIntegral(o)) {
      return "int";
    } else if (o instanceof Number) {
      return "float";
    } else if (o instanceof String) {
      return "str";
    } else if (o instanceof Range) {
      return "range";
    } else if (o instanceof Tuple) {
      return "tuple";
    } else if (o instanceof List) {
      return "list";
    } else if (o instanceof Set) {
      return "set";
    } else if (o instanceof Map) {
      return "dict";
    } else if (o instanceof Nil) {
      return "NoneType";
    } else if (o instanceof Generator) {
      return "generator";
    } else if (o instanceof Slice) {
      return "slice";
    } else if (o instanceof BuiltIn) {
      return "builtin_function_or_method";
    } else if (o instanceof Closure) {
      return "function";
    } else if (o instanceof Members.BoundMethod) {
      return "method";
    } else if (o instanceof Class) {
      return "type";
    } else {
      return o.getClass().getSimpleName();
    }
  }

  /** Returns whether a value is true, per Python's rules of truthiness. */
  public static boolean truth(Object o) {
    if (o instanceof Boolean) {
      return (Boolean) o;
    } else if (o instanceof Nil) {
      return false;
    } else if (isIntegral(o)) {
      return ((Number) o).longValue() != 0L;
    } else if (o instanceof Number) {
      return ((Number) o).doubleValue() != 0D;
    } else if (o instanceof String) {
      return !((String) o).isEmpty();
    } else if (o instanceof Collection) {
      return !((Collection<?>) o).isEmpty();
    } else if (o instanceof Map) {
      return !((Map<?, ?>) o).isEmpty();
    } else {
      return true;
    }
  }

  /** Returns whether two values are equal, per the "==" operator. */
  public static boolean equal(Object a, Object b) {
    if (a == b) {
      return true;
    }
    if (isNumeric(a) && isNumeric(b)) {
      if (isIntegral(a) && isIntegral(b)) {
        return toLong(Pos.ZERO, a) == toLong(Pos.ZERO, b);
      }
      return toDouble(a) == toDouble(b);
    }
    if (a instanceof Tuple || b instanceof Tuple) {
      return a instanceof Tuple
          && b instanceof Tuple
          && listEqual((List<?>) a, (List<?>) b);
    }
    if (a instanceof Range || b instanceof Range) {
      return a instanceof Range
          && b instanceof Range
          && listEqual((List<?>) a, (List<?>) b);
    }
    if (a instanceof List && b instanceof List) {
      return listEqual((List<?>) a, (List<?>) b);
    }
    if (a instanceof Set && b instanceof Set) {
      final Set<?> setA = (Set<?>) a;
      final Set<?> setB = (Set<?>) b;
      return setA.size() == setB.size() && containsAll(setB, setA);
    }
    if (a instanceof Map && b instanceof Map) {
      final Map<?, ?> mapA = (Map<?, ?>) a;
      final Map<?, ?> mapB = (Map<?, ?>) b;
      if (mapA.size() != mapB.size()) {
        return false;
      }
      for (Map.Entry<?, ?> entry : mapA.entrySet()) {
        final Object value = lookup(mapB, entry.getKey());
        if (value == null || !equal(Nil.of(entry.getValue()), value)) {
          return false;
        }
      }
      return true;
    }
    return a.equals(b);
  }

  private static boolean listEqual(List<?> a, List<?> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!equal(Nil.of(a.get(i)), Nil.of(b.get(i)))) {
        return false;
      }
    }
    return true;
  }

  private static boolean containsAll(Collection<?> c, Collection<?> elements) {
    for (Object e : elements) {
      if (!containsValue(c, Nil.of(e))) {
        return false;
      }
    }
    return true;
  }

  static boolean containsValue(Collection<?> c, Object x) {
    for (Object e : c) {
      if (equal(Nil.of(e), x)) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether two values are the same object, per the "is"
   * operator. */
  public static boolean identical(Object a, Object b) {
    return a == b
        || a instanceof Boolean && a.equals(b);
  }

  /** Looks up a key in a map, using "==" semantics; returns null if the key
   * is not present. */
  static @Nullable Object lookup(Map<?, ?> map, Object key) {
    if (map.containsKey(key)) {
      return Nil.of(map.get(key));
    }
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (equal(Nil.of(entry.getKey()), key)) {
        return Nil.of(entry.getValue());
      }
    }
    return null;
  }

  /**
   * Compares two values for ordering.
   *
   * @param symbol Operator symbol, for the error message if the values
   *   cannot be compared
   */
  public static int compare(Pos pos, String symbol, Object a, Object b) {
    if (isNumeric(a) && isNumeric(b)) {
      if (isIntegral(a) && isIntegral(b)) {
        return Long.compare(toLong(pos, a), toLong(pos, b));
      }
      return Double.compare(toDouble(a), toDouble(b));
    }
    if (a instanceof String && b instanceof String) {
      return CodePointComparator.INSTANCE.compare((String) a, (String) b);
    }
    if (a instanceof List
        && b instanceof List
        && (a instanceof Tuple) == (b instanceof Tuple)) {
      final List<?> listA = (List<?>) a;
      final List<?> listB = (List<?>) b;
      for (int i = 0; i < listA.size() && i < listB.size(); i++) {
        final Object eA = Nil.of(listA.get(i));
        final Object eB = Nil.of(listB.get(i));
        if (!equal(eA, eB)) {
          return compare(pos, symbol, eA, eB);
        }
      }
      return Integer.compare(listA.size(), listB.size());
    }
    if (a instanceof Comparable
        && !(a instanceof Nil)
        && a.getClass() == b.getClass()) {
      @SuppressWarnings("unchecked")
      final Comparable<Object> comparable = (Comparable<Object>) a;
      return comparable.compareTo(b);
    }
    throw new EvalException(TYPE_ERROR,
        "'" + symbol + "' not supported between instances of '"
            + typeName(a) + "' and '" + typeName(b) + "'", pos);
  }

  /** Applies a comparison operator, such as {@link Op#LT} or
   * {@link Op#IN}. */
  public static boolean compareOp(Pos pos, Op op, Object a, Object b) {
    switch (op) {
      case EQ:
        return equal(a, b);
      case NE:
        return !equal(a, b);
      case IS:
        return identical(a, b);
      case IS_NOT:
        return !identical(a, b);
      case IN:
        return contains(pos, b, a);
      case NOT_IN:
        return !contains(pos, b, a);
      default:
        break;
    }
    final String symbol = requireSymbol(op);
    if (a instanceof Set && b instanceof Set) {
      // Sets are ordered by inclusion
      final Set<?> setA = (Set<?>) a;
      final Set<?> setB = (Set<?>) b;
      switch (op) {
        case LT:
          return setA.size() < setB.size() && containsAll(setB, setA);
        case LE:
          return containsAll(setB, setA);
        case GT:
          return setA.size() > setB.size() && containsAll(setA, setB);
        case GE:
          return containsAll(setA, setB);
        default:
          throw new AssertionError(op);
      }
    }
    final int c = compare(pos, symbol, a, b);
    switch (op) {
      case LT:
        return c < 0;
      case LE:
        return c <= 0;
      case GT:
        return c > 0;
      case GE:
        return c >= 0;
      default:
        throw new AssertionError(op);
    }
  }

  private static String requireSymbol(Op op) {
    if (op.symbol == null) {
      throw new AssertionError(op);
    }
    return op.symbol;
  }

  /** Returns whether a container contains a value, per the "in"
   * operator. */
  public static boolean contains(Pos pos, Object container, Object x) {
    if (container instanceof String) {
      if (!(x instanceof String)) {
        throw new EvalException(TYPE_ERROR,
            "'in <string>' requires string as left operand, not "
                + typeName(x), pos);
      }
      return ((String) container).contains((String) x);
    }
    if (container instanceof Map) {
      return lookup((Map<?, ?>) container, x) != null;
    }
    if (container instanceof Collection) {
      return containsValue((Collection<?>) container, x);
    }
    if (container instanceof Iterable || container instanceof Object[]) {
      final Iterator<Object> iterator = iterate(pos, container);
      while (iterator.hasNext()) {
        if (equal(iterator.next(), x)) {
          return true;
        }
      }
      return false;
    }
    throw new EvalException(TYPE_ERROR,
        "argument of type '" + typeName(container) + "' is not iterable",
        pos);
  }

  /** Returns an iterator over the elements of an iterable value. Strings
   * yield one-character strings; dicts yield their keys. Null elements are
   * converted to None. */
  @SuppressWarnings("unchecked")
  public static Iterator<Object> iterate(Pos pos, Object o) {
    final Iterator<?> iterator;
    if (o instanceof String) {
      iterator =
          ((String) o).codePoints()
              .mapToObj(Character::toString)
              .iterator();
    } else if (o instanceof Map) {
      iterator = ((Map<?, ?>) o).keySet().iterator();
    } else if (o instanceof Generator) {
      return ((Generator) o).iterator();
    } else if (o instanceof Iterable) {
      iterator = ((Iterable<?>) o).iterator();
    } else if (o instanceof Object[]) {
      iterator = Arrays.asList((Object[]) o).iterator();
    } else {
      throw new EvalException(TYPE_ERROR,
          "'" + typeName(o) + "' object is not iterable", pos);
    }
    return new Iterator<Object>() {
      @Override public boolean hasNext() {
        return iterator.hasNext();
      }

      @Override public Object next() {
        return Nil.of(iterator.next());
      }
    };
  }

  /** Copies the elements of an iterable value into a new list. */
  public static List<Object> toList(Pos pos, Object o) {
    final List<Object> list = new ArrayList<>();
    iterate(pos, o).forEachRemaining(list::add);
    return list;
  }

  /** Adds a value to a set, unless the set already contains an equal
   * value; so that, for example, a set cannot contain both 1 and 1.0. */
  static void addDistinct(Set<Object> set, Object e) {
    if (!containsValue(set, e)) {
      set.add(e);
    }
  }

  /** Puts an entry into a map. If the map already has a key equal to
   * {@code key}, such as 1 for {@code True}, that key keeps its place and
   * receives the new value. */
  static void putDistinct(Map<Object, Object> map, Object key, Object value) {
    if (!map.containsKey(key)) {
      for (Object k : map.keySet()) {
        if (equal(k, key)) {
          map.put(k, value);
          return;
        }
      }
    }
    map.put(key, value);
  }

  /** Calls a function value. Throws "TypeError" if the value is not
   * callable. */
  public static Object call(Pos pos, Object fn, List<Object> args,
      Map<String, Object> keywords) {
    if (!(fn instanceof Applicable)) {
      throw new EvalException(TYPE_ERROR,
          "'" + typeName(fn) + "' object is not callable", pos);
    }
    return Nil.of(((Applicable) fn).apply(pos, args, keywords));
  }

  /** Returns whether a value is a function or a class, and therefore has no
   * useful representation in a diagnostic. */
  public static boolean isFunctionOrClass(Object o) {
    return o instanceof Applicable || o instanceof Class;
  }

  /** Returns the length of a value, per the "len" function. */
  public static long len(Pos pos, Object o) {
    if (o instanceof String) {
      final String s = (String) o;
      return s.codePointCount(0, s.length());
    } else if (o instanceof Collection) {
      return ((Collection<?>) o).size();
    } else if (o instanceof Map) {
      return ((Map<?, ?>) o).size();
    } else if (o instanceof Object[]) {
      return ((Object[]) o).length;
    }
    throw new EvalException(TYPE_ERROR,
        "object of type '" + typeName(o) + "' has no len()", pos);
  }

  /** Evaluates a subscript, "container[index]". */
  public static Object getItem(Pos pos, Object container, Object index) {
    if (container instanceof Map) {
      final Object value = lookup((Map<?, ?>) container, index);
      if (value == null) {
        throw new EvalException(KEY_ERROR, Printer.UNLIMITED.repr(index),
            pos);
      }
      return value;
    }
    if (container instanceof String) {
      final int[] codePoints = ((String) container).codePoints().toArray();
      if (index instanceof Slice) {
        final StringBuilder b = new StringBuilder();
        forEachSliceIndex(pos, (Slice) index, codePoints.length,
            i -> b.appendCodePoint(codePoints[i]));
        return b.toString();
      }
      final int i = index(pos, "string", index, codePoints.length);
      return Character.toString(codePoints[i]);
    }
    if (container instanceof List) {
      final List<?> list = (List<?>) container;
      final String typeName = typeName(container);
      if (index instanceof Slice) {
        final List<Object> result = new ArrayList<>();
        forEachSliceIndex(pos, (Slice) index, list.size(),
            i -> result.add(Nil.of(list.get(i))));
        return container instanceof Tuple ? Tuple.copyOf(result) : result;
      }
      final int i = index(pos, typeName, index, list.size());
      return Nil.of(list.get(i));
    }
    if (container instanceof Object[]) {
      return getItem(pos, Arrays.asList((Object[]) container), index);
    }
    throw new EvalException(TYPE_ERROR,
        "'" + typeName(container) + "' object is not subscriptable", pos);
  }

  /** Converts a subscript into an index into a sequence, counting negative
   * indexes from the end. */
  private static int index(Pos pos, String typeName, Object index,
      int size) {
    if (!isIntegral(index)) {
      throw new EvalException(TYPE_ERROR,
          typeName + " indices must be integers or slices, not "
              + typeName(index), pos);
    }
    long i = toLong(pos, index);
    if (i < 0) {
      i += size;
    }
    if (i < 0 || i >= size) {
      throw new EvalException(INDEX_ERROR, typeName + " index out of range",
          pos);
    }
    return (int) i;
  }

  private static void forEachSliceIndex(Pos pos, Slice slice, int size,
      IntConsumer consumer) {
    final int[] indices = slice.indices(pos, size);
    final int start = indices[0];
    final int stop = indices[1];
    final int step = indices[2];
    if (step > 0) {
      for (int i = start; i < stop; i += step) {
        consumer.accept(i);
      }
    } else {
      for (int i = start; i > stop; i += step) {
        consumer.accept(i);
      }
    }
  }

  /** Applies a prefix operator: "-", "+" or "~". */
  public static Object unary(Pos pos, Op op, Object a) {
    if (isIntegral(a)) {
      final long v = toLong(pos, a);
      switch (op) {
        case NEGATE:
          return checked(pos, () -> Math.negateExact(v));
        case POSITIVE:
          return v;
        case INVERT:
          return ~v;
        default:
          throw new AssertionError(op);
      }
    }
    if (a instanceof Number) {
      final double v = toDouble(a);
      switch (op) {
        case NEGATE:
          return -v;
        case POSITIVE:
          return v;
        default:
          break;
      }
    }
    throw new EvalException(TYPE_ERROR,
        "bad operand type for unary " + requireSymbol(op) + ": '"
            + typeName(a) + "'", pos);
  }

  /** Applies an arithmetic or bitwise binary operator. */
  public static Object binary(Pos pos, Op op, Object a, Object b) {
    if (isNumeric(a) && isNumeric(b)) {
      if (isIntegral(a) && isIntegral(b)) {
        if (a instanceof Boolean && b instanceof Boolean) {
          switch (op) {
            case BIT_AND:
              return (Boolean) a & (Boolean) b;
            case BIT_OR:
              return (Boolean) a | (Boolean) b;
            case BIT_XOR:
              return (Boolean) a ^ (Boolean) b;
            default:
              break;
          }
        }
        return integerOp(pos, op, toLong(pos, a), toLong(pos, b));
      }
      if (op == Op.TIMES
          || op == Op.PLUS
          || op == Op.MINUS
          || op == Op.DIVIDE
          || op == Op.FLOOR_DIVIDE
          || op == Op.MOD
          || op == Op.POWER) {
        return floatOp(pos, op, toDouble(a), toDouble(b));
      }
    }
    switch (op) {
      case PLUS:
        if (a instanceof String && b instanceof String) {
          return (String) a + b;
        }
        if (a instanceof List
            && b instanceof List
            && (a instanceof Tuple) == (b instanceof Tuple)) {
          final List<Object> list = new ArrayList<>((List<?>) a);
          list.addAll((List<?>) b);
          return a instanceof Tuple ? Tuple.copyOf(list) : list;
        }
        break;
      case TIMES:
        if (isIntegral(b) && (a instanceof String || a instanceof List)) {
          return repeat(pos, a, toLong(pos, b));
        }
        if (isIntegral(a) && (b instanceof String || b instanceof List)) {
          return repeat(pos, b, toLong(pos, a));
        }
        break;
      case MINUS:
      case BIT_AND:
      case BIT_OR:
      case BIT_XOR:
        if (a instanceof Set && b instanceof Set) {
          return setOp(op, (Set<?>) a, (Set<?>) b);
        }
        if (op == Op.BIT_OR && a instanceof Map && b instanceof Map) {
          final Map<Object, Object> map = new LinkedHashMap<>((Map<?, ?>) a);
          map.putAll((Map<?, ?>) b);
          return map;
        }
        break;
      default:
        break;
    }
    throw new EvalException(TYPE_ERROR,
        "unsupported operand type(s) for " + requireSymbol(op) + ": '"
            + typeName(a) + "' and '" + typeName(b) + "'", pos);
  }

  private static Object integerOp(Pos pos, Op op, long a, long b) {
    switch (op) {
      case PLUS:
        return checked(pos, () -> Math.addExact(a, b));
      case MINUS:
        return checked(pos, () -> Math.subtractExact(a, b));
      case TIMES:
        return checked(pos, () -> Math.multiplyExact(a, b));
      case DIVIDE:
        if (b == 0) {
          throw new EvalException(ZERO_DIVISION_ERROR, "division by zero",
              pos);
        }
        return (double) a / (double) b;
      case FLOOR_DIVIDE:
        if (b == 0) {
          throw new EvalException(ZERO_DIVISION_ERROR,
              "integer division or modulo by zero", pos);
        }
        if (a == Long.MIN_VALUE && b == -1) {
          throw overflow(pos);
        }
        return Math.floorDiv(a, b);
      case MOD:
        if (b == 0) {
          throw new EvalException(ZERO_DIVISION_ERROR,
              "integer modulo by zero", pos);
        }
        return Math.floorMod(a, b);
      case POWER:
        if (b < 0) {
          return floatOp(pos, op, a, b);
        }
        return checked(pos, () -> power(a, b));
      case LSHIFT:
        if (b < 0) {
          throw new EvalException(VALUE_ERROR, "negative shift count", pos);
        }
        if (a == 0) {
          return 0L;
        }
        if (b >= 63 || (a << b) >> b != a) {
          throw overflow(pos);
        }
        return a << b;
      case RSHIFT:
        if (b < 0) {
          throw new EvalException(VALUE_ERROR, "negative shift count", pos);
        }
        return a >> Math.min(b, 63);
      case BIT_AND:
        return a & b;
      case BIT_OR:
        return a | b;
      case BIT_XOR:
        return a ^ b;
      default:
        throw new AssertionError(op);
    }
  }

  /** Computes {@code a} to the power {@code b}, by repeated squaring;
   * throws {@link ArithmeticException} on overflow. */
  private static long power(long a, long b) {
    long result = 1;
    long base = a;
    for (long e = b; e > 0; e >>= 1) {
      if ((e & 1) == 1) {
        result = Math.multiplyExact(result, base);
      }
      if (e > 1) {
        base = Math.multiplyExact(base, base);
      }
    }
    return result;
  }

  private static Object floatOp(Pos pos, Op op, double a, double b) {
    switch (op) {
      case PLUS:
        return a + b;
      case MINUS:
        return a - b;
      case TIMES:
        return a * b;
      case DIVIDE:
        if (b == 0D) {
          throw new EvalException(ZERO_DIVISION_ERROR, "float division by zero",
              pos);
        }
        return a / b;
      case FLOOR_DIVIDE:
        if (b == 0D) {
          throw new EvalException(ZERO_DIVISION_ERROR,
              "float floor division by zero", pos);
        }
        return Math.floor(a / b);
      case MOD:
        if (b == 0D) {
          throw new EvalException(ZERO_DIVISION_ERROR, "float modulo", pos);
        }
        double r = a % b;
        if (r != 0D && (r < 0D) != (b < 0D)) {
          r += b;
        }
        return r;
      case POWER:
        if (a == 0D && b < 0D) {
          throw new EvalException(ZERO_DIVISION_ERROR,
              "0.0 cannot be raised to a negative power", pos);
        }
        return Math.pow(a, b);
      default:
        throw new AssertionError(op);
    }
  }

  private static Object repeat(Pos pos, Object sequence, long n) {
    if (sequence instanceof String) {
      final String s = (String) sequence;
      return n <= 0 ? "" : s.repeat(Math.toIntExact(n));
    }
    final List<?> list = (List<?>) sequence;
    final List<Object> result = new ArrayList<>();
    for (long i = 0; i < n; i++) {
      result.addAll(list);
    }
    return sequence instanceof Tuple ? Tuple.copyOf(result) : result;
  }

  private static Set<Object> setOp(Op op, Set<?> a, Set<?> b) {
    final Set<Object> result = new LinkedHashSet<>();
    switch (op) {
      case MINUS:
        a.stream().filter(e -> !containsValue(b, Nil.of(e)))
            .forEach(result::add);
        return result;
      case BIT_AND:
        a.stream().filter(e -> containsValue(b, Nil.of(e)))
            .forEach(result::add);
        return result;
      case BIT_OR:
        result.addAll(a);
        b.stream().filter(e -> !containsValue(a, Nil.of(e)))
            .forEach(result::add);
        return result;
      case BIT_XOR:
        a.stream().filter(e -> !containsValue(b, Nil.of(e)))
            .forEach(result::add);
        b.stream().filter(e -> !containsValue(a, Nil.of(e)))
            .forEach(result::add);
        return result;
      default:
        throw new AssertionError(op);
    }
  }

  /** Evaluates a long-valued computation, converting
   * {@link ArithmeticException} to "OverflowError". */
  private static Object checked(Pos pos, LongSupplier f) {
    try {
      return f.getAsLong();
    } catch (ArithmeticException e) {
      throw overflow(pos);
    }
  }

  private static EvalException overflow(Pos pos) {
    return new EvalException(OVERFLOW_ERROR, "integer overflow", pos);
  }
}

// End Values.java
