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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.verity.eval.EvalException.Kind.NAME_ERROR;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.verity.ast.Ast;
import net.hydromatic.verity.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates expressions in an environment.
 *
 * <p>There is one method per kind of node, and {@link #eval} dispatches on
 * the node's {@link Op}.
 *
 * <p>A memoizing evaluator, created by {@link #memoizing(EvalEnv)},
 * remembers the value of each node that it evaluates in its root
 * environment, so that a node is evaluated at most once, however many times
 * it is asked for. Nodes evaluated inside a comprehension or lambda, in an
 * environment derived from the root, are not remembered. A memoizing
 * evaluator is not thread-safe.
 */
public class Evaluator {
  private final @Nullable EvalEnv rootEnv;
  private final Map<Ast.Exp, Object> values = new IdentityHashMap<>();

  private Evaluator(@Nullable EvalEnv rootEnv) {
    this.rootEnv = rootEnv;
  }

  /** Creates an evaluator that does not remember values. */
  public static Evaluator create() {
    return new Evaluator(null);
  }

  /** Creates an evaluator that remembers the value of each node evaluated
   * in the given environment. */
  public static Evaluator memoizing(EvalEnv rootEnv) {
    return new Evaluator(requireNonNull(rootEnv));
  }

  /** Returns the value of an expression that has been evaluated in the root
   * environment of this memoizing evaluator, or null if it has not been
   * evaluated (for example, the right operand of an "or" whose left operand
   * was true). */
  public @Nullable Object valueOf(Ast.Exp exp) {
    return values.get(exp);
  }

  /** Evaluates an expression. */
  public Object eval(EvalEnv env, Ast.Exp exp) {
    if (env != rootEnv) {
      return eval2(env, exp);
    }
    final Object value = values.get(exp);
    if (value != null) {
      return value;
    }
    final Object value2 = eval2(env, exp);
    values.put(exp, value2);
    return value2;
  }

  /** Evaluates an expression that is about to be called as a function.
   *
   * <p>If the expression is an attribute, such as "a.is_empty" in
   * "a.is_empty()", the result is a {@link Members.BoundMethod}, whereas
   * {@link #eval} would call the zero-argument method. */
  public Object evalCallee(EvalEnv env, Ast.Exp fn) {
    if (fn.op != Op.ATTRIBUTE) {
      return eval(env, fn);
    }
    if (env != rootEnv) {
      return method(env, (Ast.Attribute) fn);
    }
    final Object value = values.get(fn);
    if (value != null) {
      return value;
    }
    final Object value2 = method(env, (Ast.Attribute) fn);
    values.put(fn, value2);
    return value2;
  }

  private Object eval2(EvalEnv env, Ast.Exp exp) {
    switch (exp.op) {
      case BOOL_LITERAL:
      case INT_LITERAL:
      case REAL_LITERAL:
      case STRING_LITERAL:
      case NONE_LITERAL:
        return ((Ast.Literal) exp).value;
      case ID:
        return id(env, (Ast.Id) exp);
      case ATTRIBUTE:
        return attribute(env, (Ast.Attribute) exp);
      case SUBSCRIPT:
        return subscript(env, (Ast.Subscript) exp);
      case SLICE:
        return slice(env, (Ast.Slice) exp);
      case CALL:
        return call(env, (Ast.Call) exp);
      case NOT:
        return !Values.truth(eval(env, ((Ast.PrefixCall) exp).a));
      case NEGATE:
      case POSITIVE:
      case INVERT:
        return Values.unary(exp.pos, exp.op,
            eval(env, ((Ast.PrefixCall) exp).a));
      case AND:
      case OR:
        return andOr(env, (Ast.InfixCall) exp);
      case POWER:
      case TIMES:
      case DIVIDE:
      case FLOOR_DIVIDE:
      case MOD:
      case PLUS:
      case MINUS:
      case LSHIFT:
      case RSHIFT:
      case BIT_AND:
      case BIT_XOR:
      case BIT_OR:
        return infix(env, (Ast.InfixCall) exp);
      case COMPARE:
        return compare(env, (Ast.Compare) exp);
      case IF:
        return ifThenElse(env, (Ast.If) exp);
      case TUPLE:
        return Tuple.copyOf(evalList(env, ((Ast.Tuple) exp).args));
      case LIST:
        return evalList(env, ((Ast.ListExp) exp).args);
      case SET:
        return set(env, ((Ast.SetExp) exp).args);
      case DICT:
        return dict(env, (Ast.DictExp) exp);
      case LIST_COMP:
      case SET_COMP:
      case DICT_COMP:
      case GENERATOR:
        return comprehension(env, (Ast.Comprehension) exp);
      case LAMBDA:
        return new Closure((Ast.Lambda) exp, env, this);
      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }

  private Object id(EvalEnv env, Ast.Id id) {
    final Object value = env.getOpt(id.name);
    if (value != null) {
      return value;
    }
    final BuiltIn builtIn = BuiltIn.lookup(id.name);
    if (builtIn != null) {
      return builtIn;
    }
    throw new EvalException(NAME_ERROR,
        "name '" + id.name + "' is not defined", id.pos);
  }

  private Object attribute(EvalEnv env, Ast.Attribute attribute) {
    final Object o = eval(env, attribute.exp);
    return Members.getAttribute(attribute.pos, o, attribute.name);
  }

  private Object method(EvalEnv env, Ast.Attribute attribute) {
    final Object o = eval(env, attribute.exp);
    return Members.getMethod(attribute.pos, o, attribute.name);
  }

  private Object subscript(EvalEnv env, Ast.Subscript subscript) {
    final Object container = eval(env, subscript.exp);
    final Object index = eval(env, subscript.index);
    return Values.getItem(subscript.pos, container, index);
  }

  private Object slice(EvalEnv env, Ast.Slice slice) {
    return new Slice(evalOpt(env, slice.lower), evalOpt(env, slice.upper),
        evalOpt(env, slice.step));
  }

  private Object evalOpt(EvalEnv env, Ast.@Nullable Exp exp) {
    return exp == null ? Nil.INSTANCE : eval(env, exp);
  }

  private Object call(EvalEnv env, Ast.Call call) {
    final Object fn = evalCallee(env, call.fn);
    final List<Object> args = evalList(env, call.args);
    final Map<String, Object> keywords;
    if (call.keywords.isEmpty()) {
      keywords = ImmutableMap.of();
    } else {
      keywords = new LinkedHashMap<>();
      for (Ast.Keyword keyword : call.keywords) {
        keywords.put(keyword.name, eval(env, keyword.exp));
      }
    }
    return Values.call(call.pos, fn, args, keywords);
  }

  private Object andOr(EvalEnv env, Ast.InfixCall call) {
    final Object a0 = eval(env, call.a0);
    if (Values.truth(a0) == (call.op == Op.OR)) {
      return a0;
    }
    return eval(env, call.a1);
  }

  private Object infix(EvalEnv env, Ast.InfixCall call) {
    final Object a0 = eval(env, call.a0);
    final Object a1 = eval(env, call.a1);
    return Values.binary(call.pos, call.op, a0, a1);
  }

  /** Evaluates a chain of comparisons, such as "a < b <= c". Each operand
   * is evaluated at most once, and evaluation stops at the first comparison
   * that is false. */
  private Object compare(EvalEnv env, Ast.Compare compare) {
    Object left = eval(env, compare.args.get(0));
    for (int i = 0; i < compare.ops.size(); i++) {
      final Object right = eval(env, compare.args.get(i + 1));
      if (!Values.compareOp(compare.pos, compare.ops.get(i), left, right)) {
        return false;
      }
      left = right;
    }
    return true;
  }

  private Object ifThenElse(EvalEnv env, Ast.If exp) {
    return Values.truth(eval(env, exp.condition))
        ? eval(env, exp.ifTrue)
        : eval(env, exp.ifFalse);
  }

  private List<Object> evalList(EvalEnv env, List<Ast.Exp> exps) {
    final List<Object> list = new ArrayList<>(exps.size());
    for (Ast.Exp exp : exps) {
      list.add(eval(env, exp));
    }
    return list;
  }

  private Set<Object> set(EvalEnv env, List<Ast.Exp> exps) {
    final Set<Object> set = new LinkedHashSet<>();
    for (Ast.Exp exp : exps) {
      Values.addDistinct(set, eval(env, exp));
    }
    return set;
  }

  private Map<Object, Object> dict(EvalEnv env, Ast.DictExp dict) {
    final Map<Object, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < dict.keys.size(); i++) {
      final Object key = eval(env, dict.keys.get(i));
      Values.putDistinct(map, key, eval(env, dict.values.get(i)));
    }
    return map;
  }

  private Object comprehension(EvalEnv env, Ast.Comprehension comprehension) {
    final Iterator<EvalEnv> envs = new BindingIterator(env, comprehension.fors);
    switch (comprehension.op) {
      case GENERATOR:
        return new Generator(
            Iterators.transform(envs, e -> eval(e, comprehension.element)));
      case LIST_COMP:
        final List<Object> list = new ArrayList<>();
        envs.forEachRemaining(e -> list.add(eval(e, comprehension.element)));
        return list;
      case SET_COMP:
        final Set<Object> set = new LinkedHashSet<>();
        envs.forEachRemaining(e ->
            Values.addDistinct(set, eval(e, comprehension.element)));
        return set;
      case DICT_COMP:
        final Ast.Exp valueExp = requireNonNull(comprehension.value);
        final Map<Object, Object> map = new LinkedHashMap<>();
        envs.forEachRemaining(e ->
            Values.putDistinct(map, eval(e, comprehension.element),
                eval(e, valueExp)));
        return map;
      default:
        throw new AssertionError("unknown comprehension " + comprehension.op);
    }
  }

  /** Iterates over the environments produced by the "for" and "if" clauses
   * of a comprehension.
   *
   * <p>Each clause binds its target in a {@link MutableEvalEnv} that is
   * re-assigned for each element, so an environment returned by
   * {@link #next()} is valid only until the following call. The iterable of
   * the first clause is evaluated when the iterator is created; the other
   * iterables are evaluated once per element of the enclosing clause. */
  private class BindingIterator extends AbstractIterator<EvalEnv> {
    private final List<Ast.CompFor> fors;
    private final Deque<Iterator<Object>> iterators = new ArrayDeque<>();
    private final Deque<MutableEvalEnv> envs = new ArrayDeque<>();

    BindingIterator(EvalEnv env, List<Ast.CompFor> fors) {
      this.fors = fors;
      push(env);
    }

    private void push(EvalEnv env) {
      final Ast.CompFor compFor = fors.get(iterators.size());
      final Object iterable = eval(env, compFor.iterable);
      iterators.push(Values.iterate(compFor.iterable.pos, iterable));
      envs.push(env.bindMutablePat(compFor.pat));
    }

    @Override protected EvalEnv computeNext() {
      while (!iterators.isEmpty()) {
        final Iterator<Object> iterator = iterators.peek();
        final MutableEvalEnv env = envs.peek();
        if (!iterator.hasNext()) {
          iterators.pop();
          envs.pop();
          continue;
        }
        env.set(iterator.next());
        final Ast.CompFor compFor = fors.get(iterators.size() - 1);
        if (!accept(env, compFor.conditions)) {
          continue;
        }
        if (iterators.size() < fors.size()) {
          push(env);
          continue;
        }
        return env;
      }
      return endOfData();
    }

    private boolean accept(EvalEnv env, List<Ast.Exp> conditions) {
      for (Ast.Exp condition : conditions) {
        if (!Values.truth(eval(env, condition))) {
          return false;
        }
      }
      return true;
    }
  }
}

// End Evaluator.java
