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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.verity.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link EvalEnv}. */
public class EvalEnvs {
  /** Environment with no bindings. */
  public static final EvalEnv EMPTY = copyOf(ImmutableMap.of());

  /**
   * Creates an evaluation environment with the given (name, value) map.
   *
   * <p>The map is copied; later changes to it are not seen by the
   * environment. Values are converted as by {@link Values#ofHost}; for
   * example, null values are bound as {@link Nil#INSTANCE}.
   */
  public static EvalEnv copyOf(Map<String, ?> valueMap) {
    final ImmutableMap.Builder<String, Object> b = ImmutableMap.builder();
    valueMap.forEach((name, value) -> b.put(name, Values.ofHost(value)));
    return new MapEvalEnv(b.build());
  }

  private EvalEnvs() {}

  /** Evaluation environment that reads from a map. */
  static class MapEvalEnv implements EvalEnv {
    final ImmutableMap<String, Object> valueMap;

    MapEvalEnv(ImmutableMap<String, Object> valueMap) {
      this.valueMap = requireNonNull(valueMap);
    }

    @Override public String toString() {
      return valueMap.toString();
    }

    @Override public @Nullable Object getOpt(String name) {
      return valueMap.get(name);
    }

    @Override public void visit(BiConsumer<String, Object> consumer) {
      valueMap.forEach(consumer);
    }
  }

  /** Evaluation environment that inherits from a parent environment and adds
   * one binding. */
  static class SubEvalEnv implements EvalEnv {
    protected final EvalEnv parentEnv;
    protected final String name;
    protected Object value;

    SubEvalEnv(EvalEnv parentEnv, String name, Object value) {
      this.parentEnv = requireNonNull(parentEnv);
      this.name = requireNonNull(name);
      this.value = value;
    }

    @Override public void visit(BiConsumer<String, Object> consumer) {
      consumer.accept(name, value);
      parentEnv.visit(consumer);
    }

    @Override public @Nullable Object getOpt(String name) {
      for (SubEvalEnv e = this;;) {
        if (name.equals(e.name)) {
          return e.value;
        }
        if (e.parentEnv instanceof SubEvalEnv) {
          e = (SubEvalEnv) e.parentEnv;
        } else {
          return e.parentEnv.getOpt(name);
        }
      }
    }
  }

  /** Similar to {@link SubEvalEnv} but mutable. */
  static class MutableSubEvalEnv extends SubEvalEnv implements MutableEvalEnv {
    MutableSubEvalEnv(EvalEnv parentEnv, String name) {
      super(parentEnv, name, Nil.INSTANCE);
    }

    @Override public void set(Object value) {
      this.value = value;
    }
  }

  /** Evaluation environment that binds several names, the names in a tuple
   * pattern such as "k, v" or "i, (a, b)". */
  static class MutablePatSubEvalEnv implements MutableEvalEnv {
    private final EvalEnv parentEnv;
    private final Ast.Pat pat;
    private final ImmutableList<String> names;
    private final Object[] values;
    private int slot;

    MutablePatSubEvalEnv(EvalEnv parentEnv, Ast.Pat pat, List<String> names) {
      this.parentEnv = requireNonNull(parentEnv);
      this.pat = requireNonNull(pat);
      this.names = ImmutableList.copyOf(names);
      this.values = new Object[names.size()];
    }

    @Override public void visit(BiConsumer<String, Object> consumer) {
      // Later names obscure earlier ones, as in "for x, x in pairs"
      for (int i = names.size() - 1; i >= 0; i--) {
        consumer.accept(names.get(i), values[i]);
      }
      parentEnv.visit(consumer);
    }

    @Override public @Nullable Object getOpt(String name) {
      final int i = names.lastIndexOf(name);
      if (i >= 0) {
        return values[i];
      }
      return parentEnv.getOpt(name);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Unpacks the value into the names of the pattern. Throws
     * {@link EvalException} if the value is not iterable or has the wrong
     * number of elements.
     */
    @Override public void set(Object value) {
      slot = 0;
      bindRecurse(pat, value);
    }

    private void bindRecurse(Ast.Pat pat, Object value) {
      switch (pat.op) {
        case ID_PAT:
          values[slot++] = value;
          return;

        case TUPLE_PAT:
          final Ast.TuplePat tuplePat = (Ast.TuplePat) pat;
          final List<Object> list = new ArrayList<>();
          final Iterator<Object> iterator = Values.iterate(pat.pos, value);
          while (iterator.hasNext()) {
            list.add(iterator.next());
            if (list.size() > tuplePat.args.size()) {
              throw new EvalException(EvalException.Kind.VALUE_ERROR,
                  "too many values to unpack (expected "
                      + tuplePat.args.size() + ")", pat.pos);
            }
          }
          if (list.size() < tuplePat.args.size()) {
            throw new EvalException(EvalException.Kind.VALUE_ERROR,
                "not enough values to unpack (expected "
                    + tuplePat.args.size() + ", got " + list.size() + ")",
                pat.pos);
          }
          for (int i = 0; i < list.size(); i++) {
            bindRecurse(tuplePat.args.get(i), list.get(i));
          }
          return;

        default:
          throw new AssertionError("unexpected pattern " + pat);
      }
    }
  }
}

// End EvalEnvs.java
