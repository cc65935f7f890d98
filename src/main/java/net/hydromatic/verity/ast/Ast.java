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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  private static <E> void forEachIndexed(
      List<? extends E> list, ObjIntConsumer<E> action) {
    for (int i = 0; i < list.size(); i++) {
      action.accept(list.get(i), i);
    }
  }

  /**
   * Base class for a pattern.
   *
   * <p>Patterns occur as the targets of comprehension clauses, for example
   * "x" in "[x + 1 for x in xs]" is an {@link IdPat} and "k, v" in "[k for k,
   * v in pairs]" is a {@link TuplePat}; and as the parameters of a lambda.
   */
  public abstract static class Pat extends AstNode {
    Pat(Pos pos, Op op) {
      super(pos, op);
    }

    /** Calls an action for each name bound by this pattern. */
    public abstract void forEachName(Consumer<String> action);
  }

  /** Named pattern, the pattern analog of the {@link Id} expression. */
  public static class IdPat extends Pat {
    public final String name;

    IdPat(Pos pos, String name) {
      super(pos, Op.ID_PAT);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IdPat
          && this.name.equals(((IdPat) o).name);
    }

    @Override public void forEachName(Consumer<String> action) {
      action.accept(name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /**
   * Tuple pattern, the pattern analog of the {@link Tuple} expression.
   *
   * <p>For example, "k, v" in "{k: v for k, v in pairs}".
   */
  public static class TuplePat extends Pat {
    public final List<Pat> args;

    TuplePat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.TUPLE_PAT);
      this.args = requireNonNull(args);
    }

    @Override public void forEachName(Consumer<String> action) {
      args.forEach(arg -> arg.forEachName(action));
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      // Top-level tuple patterns are written without parentheses, as in
      // "for k, v in pairs"; nested ones need them.
      final boolean nested = left > 0 || right > 0;
      w.append(nested ? "(" : "");
      forEachIndexed(args, (arg, i) ->
          w.append(i == 0 ? "" : ", ").append(arg, 1, 1));
      if (args.size() == 1) {
        w.append(",");
      }
      return w.append(nested ? ")" : "");
    }
  }

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    /** Calls an action for each direct child expression. */
    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }
  }

  /** Parse tree node of an identifier. */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /**
   * Parse tree node of a literal (constant).
   *
   * <p>The value is a {@link Boolean}, {@link Long}, {@link Double},
   * {@link String} or {@link net.hydromatic.verity.eval.Nil}.
   */
  public static class Literal extends Exp {
    public final Object value;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, Object value) {
      super(pos, op);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.value.equals(((Literal) o).value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }
  }

  /** Attribute access, for example "a.y". */
  public static class Attribute extends Exp {
    public final Exp exp;
    public final String name;

    Attribute(Pos pos, Exp exp, String name) {
      super(pos, Op.ATTRIBUTE);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(exp, 0);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(exp, left, op.left).append(".").id(name);
    }
  }

  /** Subscript, for example "lst[1]", "m['k']" or "lst[1:2]". */
  public static class Subscript extends Exp {
    public final Exp exp;
    /** Index; a {@link Slice}, a {@link Tuple} (possibly containing slices),
     * or any other expression. */
    public final Exp index;

    Subscript(Pos pos, Exp exp, Exp index) {
      super(pos, Op.SUBSCRIPT);
      this.exp = requireNonNull(exp);
      this.index = requireNonNull(index);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(exp, 0);
      action.accept(index, 1);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append(exp, left, op.left).append("[");
      if (index instanceof Tuple && !((Tuple) index).args.isEmpty()) {
        w.list(((Tuple) index).args);
      } else {
        w.append(index, 0, 0);
      }
      return w.append("]");
    }
  }

  /** Slice within a subscript, for example "1:2" in "lst[1:2]". Each of its
   * three bounds is optional. */
  public static class Slice extends Exp {
    public final @Nullable Exp lower;
    public final @Nullable Exp upper;
    public final @Nullable Exp step;

    Slice(Pos pos, @Nullable Exp lower, @Nullable Exp upper,
        @Nullable Exp step) {
      super(pos, Op.SLICE);
      this.lower = lower;
      this.upper = upper;
      this.step = step;
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      int i = 0;
      if (lower != null) {
        action.accept(lower, i++);
      }
      if (upper != null) {
        action.accept(upper, i++);
      }
      if (step != null) {
        action.accept(step, i);
      }
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (lower != null) {
        w.append(lower, 0, 0);
      }
      w.append(":");
      if (upper != null) {
        w.append(upper, 0, 0);
      }
      if (step != null) {
        w.append(":").append(step, 0, 0);
      }
      return w;
    }
  }

  /** Keyword argument of a call, for example "x=0" in "c(x=0)". */
  public static class Keyword extends AstNode {
    public final String name;
    public final Exp exp;

    Keyword(Pos pos, String name, Exp exp) {
      super(pos, Op.KEYWORD);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name).append("=").append(exp, 0, 0);
    }
  }

  /** Call to a function, for example "f(x, y)" or "b.c(x=0)". */
  public static class Call extends Exp {
    public final Exp fn;
    public final List<Exp> args;
    public final List<Keyword> keywords;

    Call(Pos pos, Exp fn, ImmutableList<Exp> args,
        ImmutableList<Keyword> keywords) {
      super(pos, Op.CALL);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
      this.keywords = requireNonNull(keywords);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(fn, 0);
      forEachIndexed(args, (arg, i) -> action.accept(arg, i + 1));
      forEachIndexed(keywords,
          (keyword, i) -> action.accept(keyword.exp, i + 1 + args.size()));
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append(fn, left, op.left).append("(");
      if (args.size() == 1
          && keywords.isEmpty()
          && args.get(0).op == Op.GENERATOR) {
        // A generator that is the sole argument needs no parentheses of its
        // own: "all(x > 0 for x in xs)"
        ((Comprehension) args.get(0)).unparseBody(w);
      } else {
        w.list(args);
        forEachIndexed(keywords, (keyword, i) ->
            w.append(i > 0 || !args.isEmpty() ? ", " : "")
                .append(keyword, 0, 0));
      }
      return w.append(")");
    }
  }

  /** Call to a prefix operator: "not", "-", "+", "~". */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a, 0);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /** Call to an infix operator; arithmetic, bitwise, "and", "or". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a0, 0);
      action.accept(a1, 1);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /**
   * Chain of comparisons, for example "0 &lt; x &lt;= 10".
   *
   * <p>There is one more argument than there are operators; the chain is true
   * if every adjacent pair of arguments satisfies its operator.
   */
  public static class Compare extends Exp {
    public final List<Exp> args;
    public final List<Op> ops;

    Compare(Pos pos, ImmutableList<Exp> args, ImmutableList<Op> ops) {
      super(pos, Op.COMPARE);
      this.args = requireNonNull(args);
      this.ops = requireNonNull(ops);
      checkArgument(args.size() == ops.size() + 1);
      checkArgument(ops.stream().allMatch(Op::isComparison));
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(args, action);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      forEachIndexed(args, (arg, i) -> {
        if (i > 0) {
          w.append(ops.get(i - 1).padded);
        }
        w.append(arg, op.right, op.right);
      });
      return w;
    }
  }

  /** Conditional expression, "a if c else b". */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    /** {@inheritDoc}
     *
     * <p>Arguments are visited in source order: the value if true, the
     * condition, the value if false. */
    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(ifTrue, 0);
      action.accept(condition, 1);
      action.accept(ifFalse, 2);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(ifTrue, left, op.left)
          .append(" if ").append(condition, op.left, op.left)
          .append(" else ").append(ifFalse, op.right, right);
    }
  }

  /** Tuple display, for example "(1, x)" or "()". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Pos pos, Iterable<? extends Exp> args) {
      super(pos, Op.TUPLE);
      this.args = ImmutableList.copyOf(args);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(args, action);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("(").list(args);
      return w.append(args.size() == 1 ? ",)" : ")");
    }
  }

  /** List display, for example "[1, x]". */
  public static class ListExp extends Exp {
    public final List<Exp> args;

    ListExp(Pos pos, Iterable<? extends Exp> args) {
      super(pos, Op.LIST);
      this.args = ImmutableList.copyOf(args);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(args, action);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").list(args).append("]");
    }
  }

  /** Set display, for example "{1, x}". */
  public static class SetExp extends Exp {
    public final List<Exp> args;

    SetExp(Pos pos, Iterable<? extends Exp> args) {
      super(pos, Op.SET);
      this.args = ImmutableList.copyOf(args);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(args, action);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (args.isEmpty()) {
        return w.append("set()");
      }
      return w.append("{").list(args).append("}");
    }
  }

  /** Dictionary display, for example "{y: 3, x: 8}". */
  public static class DictExp extends Exp {
    public final List<Exp> keys;
    public final List<Exp> values;

    DictExp(Pos pos, Iterable<? extends Exp> keys,
        Iterable<? extends Exp> values) {
      super(pos, Op.DICT);
      this.keys = ImmutableList.copyOf(keys);
      this.values = ImmutableList.copyOf(values);
      checkArgument(this.keys.size() == this.values.size());
    }

    /** {@inheritDoc}
     *
     * <p>Keys and values are interleaved, in source order. */
    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      for (int i = 0; i < keys.size(); i++) {
        action.accept(keys.get(i), i * 2);
        action.accept(values.get(i), i * 2 + 1);
      }
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      for (int i = 0; i < keys.size(); i++) {
        w.append(i > 0 ? ", " : "")
            .append(keys.get(i), 0, 0)
            .append(": ")
            .append(values.get(i), 0, 0);
      }
      return w.append("}");
    }
  }

  /**
   * One "for" clause of a comprehension, with its "if" filters.
   *
   * <p>For example, "for item in lst if item % x == 0".
   */
  public static class CompFor extends AstNode {
    public final Pat pat;
    public final Exp iterable;
    public final List<Exp> conditions;

    CompFor(Pos pos, Pat pat, Exp iterable, ImmutableList<Exp> conditions) {
      super(pos, Op.COMP_FOR);
      this.pat = requireNonNull(pat);
      this.iterable = requireNonNull(iterable);
      this.conditions = requireNonNull(conditions);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("for ").append(pat, 0, 0)
          .append(" in ").append(iterable, Op.OR.left, 0);
      conditions.forEach(condition ->
          w.append(" if ").append(condition, Op.OR.left, 0));
      return w;
    }
  }

  /**
   * List, set or dictionary comprehension, or generator expression.
   *
   * <p>For example, "[item &lt; x for item in lst if item % x == 0]". The
   * {@link #value} is present only in a dictionary comprehension, whose
   * {@link #element} is the key.
   */
  public static class Comprehension extends Exp {
    public final Exp element;
    public final @Nullable Exp value;
    public final List<CompFor> fors;

    Comprehension(Pos pos, Op op, Exp element, @Nullable Exp value,
        ImmutableList<CompFor> fors) {
      super(pos, op);
      this.element = requireNonNull(element);
      this.value = value;
      this.fors = requireNonNull(fors);
      checkArgument(op.isComprehension());
      checkArgument((op == Op.DICT_COMP) == (value != null));
      checkArgument(!fors.isEmpty());
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      int i = 0;
      action.accept(element, i++);
      if (value != null) {
        action.accept(value, i++);
      }
      for (CompFor compFor : fors) {
        action.accept(compFor.iterable, i++);
        for (Exp condition : compFor.conditions) {
          action.accept(condition, i++);
        }
      }
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case LIST_COMP:
          return unparseBody(w.append("[")).append("]");
        case GENERATOR:
          return unparseBody(w.append("(")).append(")");
        default:
          return unparseBody(w.append("{")).append("}");
      }
    }

    /** Writes the element and the clauses, without brackets. */
    AstWriter unparseBody(AstWriter w) {
      w.append(element, 0, 0);
      if (value != null) {
        w.append(": ").append(value, 0, 0);
      }
      fors.forEach(compFor -> w.append(" ").append(compFor, 0, 0));
      return w;
    }
  }

  /** Lambda, for example "lambda y: y + 4". */
  public static class Lambda extends Exp {
    public final List<IdPat> params;
    public final Exp body;

    Lambda(Pos pos, ImmutableList<IdPat> params, Exp body) {
      super(pos, Op.LAMBDA);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    @Override public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(body, 0);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("lambda");
      forEachIndexed(params, (param, i) ->
          w.append(i == 0 ? " " : ", ").append(param, 0, 0));
      return w.append(": ").append(body, 0, right);
    }
  }
}

// End Ast.java
