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
package net.hydromatic.verity.ast;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  REAL_LITERAL(true),
  STRING_LITERAL(true),
  NONE_LITERAL(true),

  // patterns (targets of comprehension clauses, lambda parameters)
  ID_PAT(true),
  TUPLE_PAT(true),

  // miscellaneous
  COMP_FOR(" for "),
  KEYWORD("="),
  SLICE(":"),

  // displays
  TUPLE(true),
  LIST(true),
  SET(true),
  DICT(true),

  // comprehensions
  LIST_COMP(true),
  SET_COMP(true),
  DICT_COMP(true),
  GENERATOR(true),

  // postfix operators
  ATTRIBUTE(".", 15),
  SUBSCRIPT("[", 15),
  CALL("(", 15),

  POWER(" ** ", 14, false),
  NEGATE("-", 13, false),
  POSITIVE("+", 13, false),
  INVERT("~", 13, false),
  TIMES(" * ", 12),
  DIVIDE(" / ", 12),
  FLOOR_DIVIDE(" // ", 12),
  MOD(" % ", 12),
  PLUS(" + ", 11),
  MINUS(" - ", 11),
  LSHIFT(" << ", 10),
  RSHIFT(" >> ", 10),
  BIT_AND(" & ", 9),
  BIT_XOR(" ^ ", 8),
  BIT_OR(" | ", 7),

  /** Chained comparison; its operators are the following constants. */
  COMPARE(" ", 6),
  LT(" < ", 6),
  LE(" <= ", 6),
  GT(" > ", 6),
  GE(" >= ", 6),
  EQ(" == ", 6),
  NE(" != ", 6),
  IN(" in ", 6),
  NOT_IN(" not in ", 6),
  IS(" is ", 6),
  IS_NOT(" is not ", 6),

  NOT("not ", 5, false),
  AND(" and ", 4),
  OR(" or ", 3),
  IF(" if ", 2, false),
  LAMBDA("lambda ", 1, false);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  /** Operator symbol, e.g. "+", "not in"; null for atoms. */
  public final @Nullable String symbol;

  /**
   * Binary and comparison operators, keyed by symbol. The parser looks up
   * operators here, then checks their {@link #precedence()}.
   */
  public static final ImmutableMap<String, Op> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.symbol != null
          && op.padded.startsWith(" ")
          && op.padded.endsWith(" ")
          && op != COMPARE
          && op != COMP_FOR) {
        b.put(op.symbol, op);
      }
    }
    BY_SYMBOL = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.symbol = padded == null || padded.trim().isEmpty()
        ? null
        : padded.trim();
  }

  /** Returns the precedence level; higher binds tighter. */
  public int precedence() {
    return Math.min(left, right) / 2;
  }

  /** Returns whether this is one of the operators of a chained comparison. */
  public boolean isComparison() {
    return precedence() == COMPARE.precedence() && this != COMPARE;
  }

  /** Returns whether this is a comprehension (or generator expression). */
  public boolean isComprehension() {
    return this == LIST_COMP
        || this == SET_COMP
        || this == DICT_COMP
        || this == GENERATOR;
  }
}

// End Op.java
