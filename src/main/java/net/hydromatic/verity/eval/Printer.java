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

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prints values.
 *
 * <p>The notation is that of Python's {@code repr}: strings are quoted,
 * collections are bracketed, booleans are "True" and "False", and so forth.
 * It is used for the values in diagnostics and for literals when an
 * expression is unparsed.
 *
 * <p>Large values are abbreviated according to three limits (a negative
 * limit means unlimited):
 *
 * <ul>
 *   <li>{@link Prop#PRINT_LENGTH}: the number of elements of a collection
 *       that are printed before "...";
 *   <li>{@link Prop#PRINT_DEPTH}: the depth of nesting at which a
 *       collection's contents are replaced by "...";
 *   <li>{@link Prop#STRING_DEPTH}: the number of characters of a string that
 *       are printed before "...".
 * </ul>
 */
public class Printer {
  /** Printer that never abbreviates. */
  public static final Printer UNLIMITED = new Printer(-1, -1, -1);

  private final int printLength;
  private final int printDepth;
  private final int stringDepth;

  /** Creates a Printer. */
  public Printer(int printLength, int printDepth, int stringDepth) {
    this.printLength = printLength;
    this.printDepth = printDepth;
    this.stringDepth = stringDepth;
  }

  /** Creates a Printer whose limits are taken from properties. */
  public static Printer of(Map<Prop, Object> map) {
    return new Printer(Prop.PRINT_LENGTH.intValue(map),
        Prop.PRINT_DEPTH.intValue(map),
        Prop.STRING_DEPTH.intValue(map));
  }

  /** Converts a value to a string. */
  public String repr(Object value) {
    return repr(new StringBuilder(), value).toString();
  }

  /** Prints a value to a buffer. */
  public StringBuilder repr(StringBuilder buf, Object value) {
    return repr(buf, 0, value);
  }

  /** Converts a value to a string, per Python's {@code str}; the same as
   * {@link #repr(Object)} except that strings are not quoted. */
  public String str(Object value) {
    return value instanceof String ? (String) value : repr(value);
  }

  private StringBuilder repr(StringBuilder buf, int depth, Object value) {
    if (value == null || value instanceof Nil) {
      return buf.append("None");
    }
    if (value instanceof Boolean) {
      return buf.append((Boolean) value ? "True" : "False");
    }
    if (Values.isIntegral(value)) {
      return buf.append(((Number) value).longValue());
    }
    if (value instanceof Double || value instanceof Float) {
      return buf.append(floatToString(((Number) value).doubleValue()));
    }
    if (value instanceof String) {
      return stringToString(buf, (String) value);
    }
    if (value instanceof Range) {
      final Range range = (Range) value;
      buf.append("range(").append(range.start).append(", ").append(range.stop);
      if (range.step != 1) {
        buf.append(", ").append(range.step);
      }
      return buf.append(")");
    }
    if (value instanceof Tuple) {
      final List<?> list = (List<?>) value;
      return elements(buf, depth, list, "(", list.size() == 1 ? ",)" : ")");
    }
    if (value instanceof List) {
      return elements(buf, depth, (List<?>) value, "[", "]");
    }
    if (value.getClass().isArray()) {
      return elements(buf, depth, Values.arrayAsList(value), "[", "]");
    }
    if (value instanceof Set) {
      final Set<?> set = (Set<?>) value;
      if (set.isEmpty()) {
        return buf.append("set()");
      }
      return elements(buf, depth, set, "{", "}");
    }
    if (value instanceof Map) {
      return entries(buf, depth, (Map<?, ?>) value);
    }
    if (value instanceof Slice) {
      final Slice slice = (Slice) value;
      buf.append("slice(");
      repr(buf, depth, slice.start).append(", ");
      repr(buf, depth, slice.stop).append(", ");
      return repr(buf, depth, slice.step).append(")");
    }
    if (value instanceof BuiltIn) {
      return buf.append("<built-in function ")
          .append(((BuiltIn) value).pythonName)
          .append(">");
    }
    if (value instanceof Closure) {
      return buf.append("<lambda>");
    }
    if (value instanceof Members.BoundMethod) {
      final Members.BoundMethod method = (Members.BoundMethod) value;
      buf.append("<bound method ")
          .append(method.receiver.getClass().getSimpleName())
          .append('.')
          .append(method.name)
          .append(" of ");
      return repr(buf, depth + 1, method.receiver).append(">");
    }
    if (value instanceof Class) {
      return buf.append("<class '")
          .append(((Class<?>) value).getSimpleName())
          .append("'>");
    }
    return buf.append(value);
  }

  private StringBuilder elements(StringBuilder buf, int depth,
      Collection<?> elements, String open, String close) {
    buf.append(open);
    if (printDepth >= 0 && depth >= printDepth && !elements.isEmpty()) {
      return buf.append("...").append(close.endsWith(",)") ? ")" : close);
    }
    int i = 0;
    for (Object element : elements) {
      if (i > 0) {
        buf.append(", ");
      }
      if (printLength >= 0 && i >= printLength) {
        buf.append("...");
        break;
      }
      repr(buf, depth + 1, element);
      ++i;
    }
    return buf.append(close);
  }

  private StringBuilder entries(StringBuilder buf, int depth, Map<?, ?> map) {
    buf.append("{");
    if (printDepth >= 0 && depth >= printDepth && !map.isEmpty()) {
      return buf.append("...}");
    }
    int i = 0;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (i > 0) {
        buf.append(", ");
      }
      if (printLength >= 0 && i >= printLength) {
        buf.append("...");
        break;
      }
      repr(buf, depth + 1, entry.getKey()).append(": ");
      repr(buf, depth + 1, entry.getValue());
      ++i;
    }
    return buf.append("}");
  }

  /** Appends a string literal, quoted and escaped. Uses single quotes unless
   * the string contains a single quote and no double quotes. */
  private StringBuilder stringToString(StringBuilder buf, String s) {
    final char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0
        ? '"' : '\'';
    buf.append(quote);
    int n = 0;
    for (int i = 0; i < s.length(); ) {
      if (stringDepth >= 0 && n >= stringDepth) {
        buf.append("...");
        break;
      }
      final int c = s.codePointAt(i);
      i += Character.charCount(c);
      ++n;
      switch (c) {
        case '\\':
          buf.append("\\\\");
          break;
        case '\n':
          buf.append("\\n");
          break;
        case '\r':
          buf.append("\\r");
          break;
        case '\t':
          buf.append("\\t");
          break;
        default:
          if (c == quote) {
            buf.append('\\').append(quote);
          } else if (c < 0x20 || c == 0x7f) {
            buf.append(String.format("\\x%02x", c));
          } else {
            buf.appendCodePoint(c);
          }
      }
    }
    return buf.append(quote);
  }

  /**
   * Converts a floating-point value to a string, in the shortest form that
   * identifies it, as Python does.
   *
   * <p>For example, 1.0 becomes "1.0", 1e16 becomes "1e+16", 1.5e-5 becomes
   * "1.5e-05", and infinity becomes "inf".
   */
  static String floatToString(double d) {
    if (Double.isNaN(d)) {
      return "nan";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "inf" : "-inf";
    }
    if (d == 0D) {
      return 1D / d < 0 ? "-0.0" : "0.0";
    }
    final BigDecimal bd =
        new BigDecimal(Double.toString(d)).stripTrailingZeros();
    final String digits = bd.unscaledValue().abs().toString();
    final int exponent = digits.length() - 1 - bd.scale();
    final String sign = d < 0 ? "-" : "";
    if (exponent >= -4 && exponent < 16) {
      final String plain = bd.abs().toPlainString();
      return sign + (plain.indexOf('.') >= 0 ? plain : plain + ".0");
    }
    final StringBuilder b = new StringBuilder(sign).append(digits.charAt(0));
    if (digits.length() > 1) {
      b.append('.').append(digits, 1, digits.length());
    }
    b.append('e').append(exponent < 0 ? '-' : '+');
    final int absExponent = Math.abs(exponent);
    if (absExponent < 10) {
      b.append('0');
    }
    return b.append(absExponent).toString();
  }
}

// End Printer.java
