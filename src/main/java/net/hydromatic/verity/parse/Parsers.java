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
package net.hydromatic.verity.parse;

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Given quoted string {@code 'abc'} or {@code "abc"} returns {@code abc};
   * {@code '\t'} returns the tab character; {@code '\x41'} returns "A";
   * {@code '\101'} returns "A".
   *
   * <p>Unrecognized escapes, such as {@code '\d'}, are left as they are,
   * backslash included.
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    final char quote = s.charAt(0);
    checkArgument(quote == '\'' || quote == '"');
    checkArgument(s.charAt(s.length() - 1) == quote);
    s = s.substring(1, s.length() - 1);
    if (!s.contains("\\")) {
      // There are no escaped characters. Take the quick route.
      return s;
    }
    final StringParser p = new StringParser(s);
    final StringBuilder b = new StringBuilder();
    while (p.i < p.s.length()) {
      p.parseChar(b);
    }
    return b.toString();
  }

  /** Returns whether a character may start an identifier. */
  static boolean isIdentifierStart(char c) {
    return c == '_' || Character.isLetter(c);
  }

  /** Returns whether a character may occur within an identifier. */
  static boolean isIdentifierPart(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }

  /** Parses the characters of a string literal. */
  static class StringParser {
    final String s;
    int i = 0;

    StringParser(String s) {
      this.s = s;
    }

    /**
     * Parses a single character or escape sequence in a string literal, and
     * appends it to a builder. Advances {@code i} to the next character in
     * the string.
     */
    void parseChar(StringBuilder b) {
      final char c = s.charAt(i++);
      if (c != '\\') {
        b.append(c);
        return;
      }
      if (i >= s.length()) {
        throw new IllegalArgumentException(
            "illegal escape; no character after \\");
      }
      final char c2 = s.charAt(i++);
      switch (c2) {
        case '\'':
        case '"':
        case '\\':
          // Escaped quote or backslash
          b.append(c2);
          return;

        case '\n':
          // Line continuation
          return;

        case 'a':
          b.append('\u0007');
          return;

        case 'b':
          b.append('\b');
          return;

        case 't':
          b.append('\t');
          return;

        case 'n':
          b.append('\n');
          return;

        case 'v':
          b.append('\u000B');
          return;

        case 'f':
          b.append('\f');
          return;

        case 'r':
          b.append('\r');
          return;

        case '0':
        case '1':
        case '2':
        case '3':
        case '4':
        case '5':
        case '6':
        case '7':
          // Up to three octal digits
          int octal = c2 - '0';
          for (int k = 0; k < 2 && i < s.length(); k++) {
            final char c3 = s.charAt(i);
            if (c3 < '0' || c3 > '7') {
              break;
            }
            octal = octal * 8 + (c3 - '0');
            ++i;
          }
          b.append((char) octal);
          return;

        case 'x':
          b.appendCodePoint(hex(2));
          return;

        case 'u':
          b.appendCodePoint(hex(4));
          return;

        case 'U':
          b.appendCodePoint(hex(8));
          return;

        default:
          b.append(c).append(c2);
      }
    }

    /** Parses a fixed number of hexadecimal digits. */
    private int hex(int digitCount) {
      if (i + digitCount > s.length()) {
        throw new IllegalArgumentException(
            "illegal escape; too few hexadecimal digits");
      }
      int v = 0;
      for (int k = 0; k < digitCount; k++) {
        final int d = Character.digit(s.charAt(i++), 16);
        if (d < 0) {
          throw new IllegalArgumentException(
              "illegal escape; invalid hexadecimal digit");
        }
        v = v * 16 + d;
      }
      if (!Character.isValidCodePoint(v)) {
        throw new IllegalArgumentException(
            "illegal escape; invalid code point");
      }
      return v;
    }
  }
}

// End Parsers.java
