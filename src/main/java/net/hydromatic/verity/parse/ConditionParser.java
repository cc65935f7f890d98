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
import static net.hydromatic.verity.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import net.hydromatic.verity.ast.Ast;
import net.hydromatic.verity.ast.Op;
import net.hydromatic.verity.ast.Pos;
import net.hydromatic.verity.parse.Lexer.Kind;
import net.hydromatic.verity.parse.Lexer.Token;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recursive-descent parser for conditions.
 *
 * <p>Each production is a method, documented with the rule it implements.
 * Every node is created with the position of the tokens it was parsed from;
 * a parenthesized expression has the position of its contents, but an
 * expression that contains one has a position that includes the
 * parentheses.
 */
public class ConditionParser {
  private final Source source;
  private final List<Token> tokens;
  /** Index of the next token to be consumed. */
  private int index = 0;

  /** Creates a ConditionParser. */
  public ConditionParser(Source source) {
    this.source = requireNonNull(source);
    this.tokens = new Lexer(source).tokenize();
  }

  /** Parses a complete condition. */
  public Ast.Exp parseCondition() {
    final Ast.Exp exp = expression();
    if (peek().kind != Kind.EOF) {
      throw error("unexpected " + peek());
    }
    return exp;
  }

  /** Returns the position of the most recently consumed token. */
  public Pos pos() {
    return pos(tokens.get(Math.max(index - 1, 0)));
  }

  private Pos pos(Token token) {
    return source.pos(token.start, token.end);
  }

  /** Creates a Span that starts at the next token. */
  private Span span() {
    return Span.of(pos(peek()));
  }

  private Token peek() {
    return peek(0);
  }

  private Token peek(int ahead) {
    return tokens.get(Math.min(index + ahead, tokens.size() - 1));
  }

  private Token next() {
    final Token token = peek();
    if (token.kind != Kind.EOF) {
      ++index;
    }
    return token;
  }

  private boolean tryConsume(String s) {
    if (peek().is(s)) {
      ++index;
      return true;
    }
    return false;
  }

  private void expect(String s) {
    if (!tryConsume(s)) {
      throw error("expected '" + s + "' but found " + peek());
    }
  }

  private String expectName() {
    if (peek().kind != Kind.NAME) {
      throw error("expected name but found " + peek());
    }
    return next().text;
  }

  private ConditionParseException error(String message) {
    return new ConditionParseException(message, pos(peek()));
  }

  // Expression -> Lambda | OrTest ['if' OrTest 'else' Expression]
  private Ast.Exp expression() {
    if (peek().is("lambda")) {
      return lambda();
    }
    final Span s = span();
    final Ast.Exp e = orTest();
    if (!tryConsume("if")) {
      return e;
    }
    final Ast.Exp condition = orTest();
    expect("else");
    final Ast.Exp ifFalse = expression();
    return ast.ifThenElse(s.end(this), condition, e, ifFalse);
  }

  // Lambda -> 'lambda' [Name (',' Name)*] ':' Expression
  private Ast.Exp lambda() {
    final Span s = span();
    expect("lambda");
    final List<Ast.IdPat> params = new ArrayList<>();
    if (!peek().is(":")) {
      do {
        final Pos p = pos(peek());
        params.add(ast.idPat(p, expectName()));
      } while (tryConsume(","));
    }
    expect(":");
    final Ast.Exp body = expression();
    return ast.lambda(s.end(this), params, body);
  }

  // OrTest -> AndTest ('or' AndTest)*
  private Ast.Exp orTest() {
    final Span s = span();
    Ast.Exp e = andTest();
    while (tryConsume("or")) {
      final Ast.Exp e2 = andTest();
      e = ast.or(s.end(this), e, e2);
    }
    return e;
  }

  // AndTest -> NotTest ('and' NotTest)*
  private Ast.Exp andTest() {
    final Span s = span();
    Ast.Exp e = notTest();
    while (tryConsume("and")) {
      final Ast.Exp e2 = notTest();
      e = ast.and(s.end(this), e, e2);
    }
    return e;
  }

  // NotTest -> 'not' NotTest | Comparison
  private Ast.Exp notTest() {
    if (!peek().is("not")) {
      return comparison();
    }
    final Span s = span();
    next();
    final Ast.Exp e = notTest();
    return ast.not(s.end(this), e);
  }

  // Comparison -> BitOr (CompOp BitOr)*
  private Ast.Exp comparison() {
    final Span s = span();
    final Ast.Exp first = bitOr();
    final List<Ast.Exp> args = new ArrayList<>();
    final List<Op> ops = new ArrayList<>();
    args.add(first);
    for (;;) {
      final Op op = compOp();
      if (op == null) {
        break;
      }
      ops.add(op);
      args.add(bitOr());
    }
    if (ops.isEmpty()) {
      return first;
    }
    return ast.compare(s.end(this), args, ops);
  }

  // CompOp -> '<' | '>' | '==' | '>=' | '<=' | '!=' | 'in' | 'not' 'in'
  //   | 'is' | 'is' 'not'
  private @Nullable Op compOp() {
    final Token token = peek();
    switch (token.kind) {
      case SYMBOL:
        final Op op = Op.BY_SYMBOL.get(token.text);
        if (op != null && op.isComparison()) {
          next();
          return op;
        }
        return null;
      case KEYWORD:
        if (token.is("in")) {
          next();
          return Op.IN;
        }
        if (token.is("not") && peek(1).is("in")) {
          next();
          next();
          return Op.NOT_IN;
        }
        if (token.is("is")) {
          next();
          return tryConsume("not") ? Op.IS_NOT : Op.IS;
        }
        return null;
      default:
        return null;
    }
  }

  // BitOr -> BitXor ('|' BitXor)*
  private Ast.Exp bitOr() {
    return leftAssociative(this::bitXor, "|");
  }

  // BitXor -> BitAnd ('^' BitAnd)*
  private Ast.Exp bitXor() {
    return leftAssociative(this::bitAnd, "^");
  }

  // BitAnd -> Shift ('&' Shift)*
  private Ast.Exp bitAnd() {
    return leftAssociative(this::shift, "&");
  }

  // Shift -> Arith (('<<' | '>>') Arith)*
  private Ast.Exp shift() {
    return leftAssociative(this::arith, "<<", ">>");
  }

  // Arith -> Term (('+' | '-') Term)*
  private Ast.Exp arith() {
    return leftAssociative(this::term, "+", "-");
  }

  // Term -> Factor (('*' | '/' | '//' | '%') Factor)*
  private Ast.Exp term() {
    return leftAssociative(this::factor, "*", "/", "//", "%");
  }

  /** Parses a sequence of operands separated by left-associative binary
   * operators of the same precedence. */
  private Ast.Exp leftAssociative(Supplier<Ast.Exp> operand,
      String... symbols) {
    final Span s = span();
    Ast.Exp e = operand.get();
    for (;;) {
      final Token token = peek();
      final Op op = binaryOp(token, symbols);
      if (op == null) {
        return e;
      }
      next();
      final Ast.Exp e2 = operand.get();
      e = ast.infixCall(s.end(this), op, e, e2);
    }
  }

  private static @Nullable Op binaryOp(Token token, String... symbols) {
    if (token.kind == Kind.SYMBOL) {
      for (String symbol : symbols) {
        if (token.text.equals(symbol)) {
          return Op.BY_SYMBOL.get(symbol);
        }
      }
    }
    return null;
  }

  // Factor -> ('+' | '-' | '~') Factor | Power
  private Ast.Exp factor() {
    final Op op;
    if (peek().is("-")) {
      op = Op.NEGATE;
    } else if (peek().is("+")) {
      op = Op.POSITIVE;
    } else if (peek().is("~")) {
      op = Op.INVERT;
    } else {
      return power();
    }
    final Span s = span();
    next();
    final Ast.Exp e = factor();
    return ast.prefixCall(s.end(this), op, e);
  }

  // Power -> Primary ['**' Factor]
  private Ast.Exp power() {
    final Span s = span();
    final Ast.Exp e = primary();
    if (!tryConsume("**")) {
      return e;
    }
    final Ast.Exp e2 = factor();
    return ast.infixCall(s.end(this), Op.POWER, e, e2);
  }

  // Primary -> Atom ('.' Name | '(' Args ')' | '[' Subscripts ']')*
  private Ast.Exp primary() {
    final Span s = span();
    Ast.Exp e = atom();
    for (;;) {
      if (tryConsume(".")) {
        final String name = expectName();
        e = ast.attribute(s.end(this), e, name);
      } else if (tryConsume("(")) {
        e = callArgs(s, e);
      } else if (tryConsume("[")) {
        final Ast.Exp index = subscripts();
        expect("]");
        e = ast.subscript(s.end(this), e, index);
      } else {
        return e;
      }
    }
  }

  // Args -> [Arg (',' Arg)* [',']] | Expression CompFor+
  // Arg -> Expression | Name '=' Expression
  private Ast.Exp callArgs(Span s, Ast.Exp fn) {
    final List<Ast.Exp> args = new ArrayList<>();
    final List<Ast.Keyword> keywords = new ArrayList<>();
    while (!peek().is(")")) {
      final Span argSpan = span();
      if (peek().kind == Kind.NAME && peek(1).is("=")) {
        final String name = next().text;
        next();
        final Ast.Exp e = expression();
        keywords.add(ast.keyword(argSpan.end(this), name, e));
      } else {
        if (!keywords.isEmpty()) {
          throw error("positional argument follows keyword argument");
        }
        final Ast.Exp e = expression();
        if (peek().is("for")) {
          final List<Ast.CompFor> fors = compFors();
          if (!args.isEmpty() || !peek().is(")")) {
            throw error("generator expression must be parenthesized");
          }
          args.add(
              ast.comprehension(argSpan.end(this), Op.GENERATOR, e, null,
                  fors));
        } else {
          args.add(e);
        }
      }
      if (!tryConsume(",")) {
        break;
      }
    }
    expect(")");
    return ast.call(s.end(this), fn, args, keywords);
  }

  // Subscripts -> Subscript (',' Subscript)* [',']
  private Ast.Exp subscripts() {
    final Span s = span();
    final Ast.Exp first = subscript();
    if (!peek().is(",")) {
      return first;
    }
    final List<Ast.Exp> items = new ArrayList<>();
    items.add(first);
    while (tryConsume(",")) {
      if (peek().is("]")) {
        break;
      }
      items.add(subscript());
    }
    return ast.tuple(s.end(this), items);
  }

  // Subscript -> Expression | [Expression] ':' [Expression] [':' [Expression]]
  private Ast.Exp subscript() {
    final Span s = span();
    Ast.@Nullable Exp lower = null;
    if (!peek().is(":")) {
      lower = expression();
      if (!peek().is(":")) {
        return lower;
      }
    }
    expect(":");
    Ast.@Nullable Exp upper = null;
    if (!endOfSlicePart()) {
      upper = expression();
    }
    Ast.@Nullable Exp step = null;
    if (tryConsume(":") && !endOfSlicePart()) {
      step = expression();
    }
    return ast.slice(s.end(this), lower, upper, step);
  }

  private boolean endOfSlicePart() {
    return peek().is(":") || peek().is("]") || peek().is(",");
  }

  // Atom -> Name | Number | String+ | 'True' | 'False' | 'None'
  //   | '(' ... ')' | '[' ... ']' | '{' ... '}'
  private Ast.Exp atom() {
    final Token token = peek();
    switch (token.kind) {
      case NAME:
        next();
        return ast.id(pos(token), token.text);
      case INT:
        next();
        return ast.intLiteral(pos(token), parseInt(token));
      case REAL:
        next();
        return ast.realLiteral(pos(token), Double.parseDouble(token.text));
      case STRING:
        return strings();
      case KEYWORD:
        if (token.is("True") || token.is("False")) {
          next();
          return ast.boolLiteral(pos(token), token.is("True"));
        }
        if (token.is("None")) {
          next();
          return ast.noneLiteral(pos(token));
        }
        break;
      case SYMBOL:
        if (token.is("(")) {
          return parenthesized();
        }
        if (token.is("[")) {
          return list();
        }
        if (token.is("{")) {
          return braces();
        }
        break;
      default:
        break;
    }
    throw error("unexpected " + token);
  }

  private long parseInt(Token token) {
    final String digits =
        token.radix == 10 ? token.text : token.text.substring(2);
    try {
      return Long.parseLong(digits, token.radix);
    } catch (NumberFormatException e) {
      throw new ConditionParseException("invalid integer literal "
          + token.text, pos(token));
    }
  }

  /** Parses one or more adjacent string literals, which are
   * concatenated. */
  private Ast.Exp strings() {
    final Span s = span();
    final StringBuilder b = new StringBuilder();
    while (peek().kind == Kind.STRING) {
      final Token token = next();
      try {
        b.append(Parsers.unquoteString(token.text));
      } catch (IllegalArgumentException e) {
        throw new ConditionParseException(e.getMessage(), pos(token));
      }
    }
    return ast.stringLiteral(s.end(this), b.toString());
  }

  // Parenthesized -> '(' ')' | '(' Expression ')'
  //   | '(' Expression CompFor+ ')'
  //   | '(' Expression ',' [Expression (',' Expression)* [',']] ')'
  private Ast.Exp parenthesized() {
    final Span s = span();
    expect("(");
    if (tryConsume(")")) {
      return ast.tuple(s.end(this), ImmutableList.of());
    }
    final Ast.Exp first = expression();
    if (peek().is("for")) {
      final List<Ast.CompFor> fors = compFors();
      expect(")");
      return ast.comprehension(s.end(this), Op.GENERATOR, first, null, fors);
    }
    if (tryConsume(")")) {
      return first;
    }
    final List<Ast.Exp> items = new ArrayList<>();
    items.add(first);
    expect(",");
    while (!peek().is(")")) {
      items.add(expression());
      if (!tryConsume(",")) {
        break;
      }
    }
    expect(")");
    return ast.tuple(s.end(this), items);
  }

  // List -> '[' [Expression (',' Expression)* [',']] ']'
  //   | '[' Expression CompFor+ ']'
  private Ast.Exp list() {
    final Span s = span();
    expect("[");
    if (tryConsume("]")) {
      return ast.list(s.end(this), ImmutableList.of());
    }
    final Ast.Exp first = expression();
    if (peek().is("for")) {
      final List<Ast.CompFor> fors = compFors();
      expect("]");
      return ast.comprehension(s.end(this), Op.LIST_COMP, first, null, fors);
    }
    final List<Ast.Exp> items = new ArrayList<>();
    items.add(first);
    while (tryConsume(",")) {
      if (peek().is("]")) {
        break;
      }
      items.add(expression());
    }
    expect("]");
    return ast.list(s.end(this), items);
  }

  // Braces -> '{' '}'
  //   | '{' Expression ':' Expression (',' Expression ':' Expression)* '}'
  //   | '{' Expression ':' Expression CompFor+ '}'
  //   | '{' Expression (',' Expression)* '}'
  //   | '{' Expression CompFor+ '}'
  private Ast.Exp braces() {
    final Span s = span();
    expect("{");
    if (tryConsume("}")) {
      return ast.dict(s.end(this), ImmutableList.of(), ImmutableList.of());
    }
    final Ast.Exp first = expression();
    if (tryConsume(":")) {
      final Ast.Exp firstValue = expression();
      if (peek().is("for")) {
        final List<Ast.CompFor> fors = compFors();
        expect("}");
        return ast.comprehension(s.end(this), Op.DICT_COMP, first,
            firstValue, fors);
      }
      final List<Ast.Exp> keys = new ArrayList<>();
      final List<Ast.Exp> values = new ArrayList<>();
      keys.add(first);
      values.add(firstValue);
      while (tryConsume(",")) {
        if (peek().is("}")) {
          break;
        }
        keys.add(expression());
        expect(":");
        values.add(expression());
      }
      expect("}");
      return ast.dict(s.end(this), keys, values);
    }
    if (peek().is("for")) {
      final List<Ast.CompFor> fors = compFors();
      expect("}");
      return ast.comprehension(s.end(this), Op.SET_COMP, first, null, fors);
    }
    final List<Ast.Exp> items = new ArrayList<>();
    items.add(first);
    while (tryConsume(",")) {
      if (peek().is("}")) {
        break;
      }
      items.add(expression());
    }
    expect("}");
    return ast.set(s.end(this), items);
  }

  // CompFor -> 'for' Targets 'in' OrTest ('if' OrTest)*
  private List<Ast.CompFor> compFors() {
    final List<Ast.CompFor> fors = new ArrayList<>();
    while (peek().is("for")) {
      final Span s = span();
      expect("for");
      final Ast.Pat pat = targets();
      expect("in");
      final Ast.Exp iterable = orTest();
      final List<Ast.Exp> conditions = new ArrayList<>();
      while (tryConsume("if")) {
        conditions.add(orTest());
      }
      fors.add(ast.compFor(s.end(this), pat, iterable, conditions));
    }
    return fors;
  }

  // Targets -> Target (',' Target)* [',']
  private Ast.Pat targets() {
    final Span s = span();
    final Ast.Pat first = target();
    if (!peek().is(",")) {
      return first;
    }
    final List<Ast.Pat> items = new ArrayList<>();
    items.add(first);
    while (tryConsume(",")) {
      if (peek().is("in")) {
        break;
      }
      items.add(target());
    }
    return ast.tuplePat(s.end(this), items);
  }

  // Target -> Name | '(' Targets ')' | '[' Targets ']'
  private Ast.Pat target() {
    final Span s = span();
    final String close;
    if (tryConsume("(")) {
      close = ")";
    } else if (tryConsume("[")) {
      close = "]";
    } else {
      final Pos p = pos(peek());
      return ast.idPat(p, expectName());
    }
    final List<Ast.Pat> items = new ArrayList<>();
    boolean comma = false;
    while (!peek().is(close)) {
      items.add(target());
      if (!tryConsume(",")) {
        break;
      }
      comma = true;
    }
    expect(close);
    if (items.size() == 1 && !comma && close.equals(")")) {
      return items.get(0);
    }
    return ast.tuplePat(s.end(this), items);
  }
}

// End ConditionParser.java
