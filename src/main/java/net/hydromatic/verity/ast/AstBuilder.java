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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.verity.eval.Nil;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a call to a prefix operator. */
  public Ast.PrefixCall prefixCall(Pos p, Op op, Ast.Exp a) {
    return new Ast.PrefixCall(p, op, a);
  }

  /** Creates a call to a binary operator: arithmetic, bitwise, "and" or
   * "or". */
  public Ast.InfixCall infixCall(Pos p, Op op, Ast.Exp a0, Ast.Exp a1) {
    checkArgument(!op.isComparison(), "use compare for %s", op);
    return new Ast.InfixCall(p, op, a0, a1);
  }

  public Ast.Exp and(Pos p, Ast.Exp a0, Ast.Exp a1) {
    return infixCall(p, Op.AND, a0, a1);
  }

  public Ast.Exp or(Pos p, Ast.Exp a0, Ast.Exp a1) {
    return infixCall(p, Op.OR, a0, a1);
  }

  public Ast.Exp not(Pos p, Ast.Exp a) {
    return prefixCall(p, Op.NOT, a);
  }

  /** Creates a chained comparison. */
  public Ast.Compare compare(Pos p, List<Ast.Exp> args, List<Op> ops) {
    return new Ast.Compare(p, ImmutableList.copyOf(args),
        ImmutableList.copyOf(ops));
  }

  /** Creates a comparison with a single operator. */
  public Ast.Compare compare(Pos p, Op op, Ast.Exp a0, Ast.Exp a1) {
    return compare(p, ImmutableList.of(a0, a1), ImmutableList.of(op));
  }

  // literals

  public Ast.Literal boolLiteral(Pos p, boolean b) {
    return new Ast.Literal(p, Op.BOOL_LITERAL, b);
  }

  public Ast.Literal intLiteral(Pos pos, long value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  public Ast.Literal realLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.REAL_LITERAL, value);
  }

  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  public Ast.Literal noneLiteral(Pos pos) {
    return new Ast.Literal(pos, Op.NONE_LITERAL, Nil.INSTANCE);
  }

  // identifiers and patterns

  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  public Ast.IdPat idPat(Pos pos, String name) {
    return new Ast.IdPat(pos, name);
  }

  public Ast.TuplePat tuplePat(Pos pos, Iterable<? extends Ast.Pat> args) {
    return new Ast.TuplePat(pos, ImmutableList.copyOf(args));
  }

  // postfix

  public Ast.Attribute attribute(Pos pos, Ast.Exp exp, String name) {
    return new Ast.Attribute(pos, exp, name);
  }

  public Ast.Subscript subscript(Pos pos, Ast.Exp exp, Ast.Exp index) {
    return new Ast.Subscript(pos, exp, index);
  }

  public Ast.Slice slice(Pos pos, Ast.@Nullable Exp lower,
      Ast.@Nullable Exp upper, Ast.@Nullable Exp step) {
    return new Ast.Slice(pos, lower, upper, step);
  }

  public Ast.Keyword keyword(Pos pos, String name, Ast.Exp exp) {
    return new Ast.Keyword(pos, name, exp);
  }

  public Ast.Call call(Pos pos, Ast.Exp fn, Iterable<? extends Ast.Exp> args,
      Iterable<Ast.Keyword> keywords) {
    return new Ast.Call(pos, fn, ImmutableList.copyOf(args),
        ImmutableList.copyOf(keywords));
  }

  /** Creates a call with positional arguments only. */
  public Ast.Call call(Pos pos, Ast.Exp fn, Ast.Exp... args) {
    return call(pos, fn, ImmutableList.copyOf(args), ImmutableList.of());
  }

  // compound

  public Ast.If ifThenElse(Pos pos, Ast.Exp condition, Ast.Exp ifTrue,
      Ast.Exp ifFalse) {
    return new Ast.If(pos, condition, ifTrue, ifFalse);
  }

  public Ast.Tuple tuple(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.Tuple(pos, args);
  }

  public Ast.ListExp list(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.ListExp(pos, args);
  }

  public Ast.SetExp set(Pos pos, Iterable<? extends Ast.Exp> args) {
    return new Ast.SetExp(pos, args);
  }

  public Ast.DictExp dict(Pos pos, Iterable<? extends Ast.Exp> keys,
      Iterable<? extends Ast.Exp> values) {
    return new Ast.DictExp(pos, keys, values);
  }

  public Ast.CompFor compFor(Pos pos, Ast.Pat pat, Ast.Exp iterable,
      Iterable<? extends Ast.Exp> conditions) {
    return new Ast.CompFor(pos, pat, iterable,
        ImmutableList.copyOf(conditions));
  }

  /** Creates a comprehension; {@code op} is one of
   * {@link Op#LIST_COMP}, {@link Op#SET_COMP}, {@link Op#DICT_COMP},
   * {@link Op#GENERATOR}. */
  public Ast.Comprehension comprehension(Pos pos, Op op, Ast.Exp element,
      Ast.@Nullable Exp value, Iterable<Ast.CompFor> fors) {
    return new Ast.Comprehension(pos, op, element, value,
        ImmutableList.copyOf(fors));
  }

  public Ast.Lambda lambda(Pos pos, Iterable<Ast.IdPat> params,
      Ast.Exp body) {
    return new Ast.Lambda(pos, ImmutableList.copyOf(params), body);
  }
}

// End AstBuilder.java
