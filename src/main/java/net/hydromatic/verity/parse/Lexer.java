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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;

/**
 * Splits the text of a condition into tokens.
 *
 * <p>Whitespace, including newlines, separates tokens and is otherwise
 * ignored; there are no comments.
 */
class Lexer {
  /** Words that cannot be used as names. */
  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of("and", "else", "for", "if", "in", "is", "lambda",
          "not", "or", "True", "False", "None");

  /** Symbols, longest first, so that "**" is preferred to "*". */
  private static final ImmutableList<String> SYMBOLS =
      ImmutableList.of("**", "//", "<<", ">>", "<=", ">=", "==", "!=",
          "+", "-", "*", "/", "%", "~", "&", "|", "^", "<", ">",
          "(", ")", "[", "]", "{", "}", ",", ":", ".", "=");

  private final Source source;
  private final String text;
  private int i = 0;

  Lexer(Source source) {
    this.source = requireNonNull(source);
    this.text = source.text;
  }

  /** Converts the whole text into a list of tokens, ending with
   * {@link Kind#EOF}. */
  List<Token> tokenize() {
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    for (;;) {
      final Token token = next();
      tokens.add(token);
      if (token.kind == Kind.EOF) {
        return tokens.build();
      }
    }
  }

  private Token next() {
    skipWhitespace();
    final int start = i;
    if (i >= text.length()) {
      return new Token(Kind.EOF, "", start, start);
    }
    final char c = text.charAt(i);
    if (Parsers.isIdentifierStart(c)) {
      while (i < text.length() && Parsers.isIdentifierPart(text.charAt(i))) {
        ++i;
      }
      final String word = text.substring(start, i);
      return new Token(KEYWORDS.contains(word) ? Kind.KEYWORD : Kind.NAME,
          word, start, i);
    }
    if (isDigit(c) || c == '.' && isDigit(peekChar(1))) {
      return number(start);
    }
    if (c == '\'' || c == '"') {
      return string(start, c);
    }
    for (String symbol : SYMBOLS) {
      if (text.startsWith(symbol, i)) {
        i += symbol.length();
        return new Token(Kind.SYMBOL, symbol, start, i);
      }
    }
    throw new ConditionParseException("unexpected character '" + c + "'",
        source.pos(start, start + 1));
  }

  /** Skips spaces, newlines, and line continuations (a backslash at the
   * end of a line). */
  private void skipWhitespace() {
    for (;;) {
      if (i < text.length() && Character.isWhitespace(text.charAt(i))) {
        ++i;
      } else if (text.startsWith("\\\n", i)) {
        i += 2;
      } else if (text.startsWith("\\\r\n", i)) {
        i += 3;
      } else {
        return;
      }
    }
  }

  private char peekChar(int ahead) {
    return i + ahead < text.length() ? text.charAt(i + ahead) : 0;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  /** Reads an integer or real literal. */
  private Token number(int start) {
    if (text.charAt(i) == '0' && "xXoObB".indexOf(peekChar(1)) >= 0) {
      final int radix;
      switch (Character.toLowerCase(peekChar(1))) {
        case 'x':
          radix = 16;
          break;
        case 'o':
          radix = 8;
          break;
        default:
          radix = 2;
      }
      i += 2;
      while (i < text.length()
          && Character.digit(text.charAt(i), radix) >= 0) {
        ++i;
      }
      return new Token(Kind.INT, text.substring(start, i), start, i, radix);
    }
    boolean real = false;
    while (i < text.length() && isDigit(text.charAt(i))) {
      ++i;
    }
    if (i < text.length() && text.charAt(i) == '.') {
      real = true;
      ++i;
      while (i < text.length() && isDigit(text.charAt(i))) {
        ++i;
      }
    }
    if (i < text.length() && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
      final int mark = i;
      ++i;
      if (i < text.length()
          && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
        ++i;
      }
      if (i < text.length() && isDigit(text.charAt(i))) {
        real = true;
        while (i < text.length() && isDigit(text.charAt(i))) {
          ++i;
        }
      } else {
        i = mark;
      }
    }
    return new Token(real ? Kind.REAL : Kind.INT, text.substring(start, i),
        start, i);
  }

  /** Reads a string literal, including its quotes. */
  private Token string(int start, char quote) {
    ++i;
    while (i < text.length()) {
      final char c = text.charAt(i++);
      if (c == '\\') {
        ++i;
      } else if (c == quote) {
        return new Token(Kind.STRING, text.substring(start, i), start, i);
      } else if (c == '\n') {
        break;
      }
    }
    throw new ConditionParseException("unterminated string literal",
        source.pos(start, Math.min(i, text.length())));
  }

  /** Kind of token. */
  enum Kind {
    NAME, KEYWORD, INT, REAL, STRING, SYMBOL, EOF
  }

  /** Token. */
  static class Token {
    final Kind kind;
    final String text;
    /** Offset of the first character. */
    final int start;
    /** Offset just after the last character. */
    final int end;
    /** Radix, for {@link Kind#INT} tokens. */
    final int radix;

    Token(Kind kind, String text, int start, int end) {
      this(kind, text, start, end, 10);
    }

    Token(Kind kind, String text, int start, int end, int radix) {
      this.kind = kind;
      this.text = text;
      this.start = start;
      this.end = end;
      this.radix = radix;
    }

    /** Returns whether this token is a given symbol or keyword. */
    boolean is(String s) {
      return (kind == Kind.SYMBOL || kind == Kind.KEYWORD) && text.equals(s);
    }

    @Override public String toString() {
      return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
  }
}

// End Lexer.java
