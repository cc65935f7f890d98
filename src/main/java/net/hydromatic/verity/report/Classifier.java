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
package net.hydromatic.verity.report;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.Map;
import net.hydromatic.verity.ast.Op;

/** Assigns each kind of expression node to a {@link Category}. */
public abstract class Classifier {
  private static final ImmutableMap<Op, Category> CATEGORIES;

  static {
    final Map<Op, Category> map = new EnumMap<>(Op.class);
    put(map, Category.LITERAL, Op.BOOL_LITERAL, Op.INT_LITERAL,
        Op.REAL_LITERAL, Op.STRING_LITERAL, Op.NONE_LITERAL);
    put(map, Category.LEAF, Op.ID);
    put(map, Category.TRANSPARENT, Op.NOT, Op.NEGATE, Op.POSITIVE, Op.INVERT,
        Op.POWER, Op.TIMES, Op.DIVIDE, Op.FLOOR_DIVIDE, Op.MOD, Op.PLUS,
        Op.MINUS, Op.LSHIFT, Op.RSHIFT, Op.BIT_AND, Op.BIT_XOR, Op.BIT_OR,
        Op.AND, Op.OR, Op.COMPARE, Op.IF, Op.TUPLE, Op.LIST, Op.SET, Op.DICT,
        Op.SUBSCRIPT, Op.SLICE);
    put(map, Category.REPORTABLE, Op.ATTRIBUTE, Op.CALL);
    put(map, Category.OPAQUE, Op.LIST_COMP, Op.SET_COMP, Op.DICT_COMP,
        Op.GENERATOR, Op.LAMBDA);
    CATEGORIES = Maps.immutableEnumMap(map);
  }

  private Classifier() {}

  private static void put(Map<Op, Category> map, Category category,
      Op... ops) {
    for (Op op : ops) {
      final Category previous = map.put(op, category);
      if (previous != null) {
        throw new AssertionError("duplicate " + op);
      }
    }
  }

  /** Returns the category of a kind of expression.
   *
   * @throws IllegalArgumentException if {@code op} is not a kind of
   * expression; for example, {@link Op#LT} is an operator within a
   * {@link Op#COMPARE} expression
   */
  public static Category classify(Op op) {
    final Category category = CATEGORIES.get(op);
    checkArgument(category != null, "not an expression: %s", op);
    return category;
  }

  /** Returns the kinds of expression, and their categories. */
  public static ImmutableMap<Op, Category> categories() {
    return CATEGORIES;
  }
}

// End Classifier.java
