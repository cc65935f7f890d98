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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import net.hydromatic.verity.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>Maps names to values. An environment is immutable, except for the slots
 * of a {@link MutableEvalEnv}; binding a name creates a child environment
 * and leaves the parent unchanged.
 */
public interface EvalEnv {

  /** Returns the binding of {@code name} if bound, null if not. */
  @Nullable Object getOpt(String name);

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding (name, value).
   */
  default EvalEnv bind(String name, Object value) {
    return new EvalEnvs.SubEvalEnv(this, name, Nil.of(value));
  }

  /**
   * Creates an evaluation environment that has the same content as this one,
   * plus a mutable slot.
   */
  default MutableEvalEnv bindMutable(String name) {
    return new EvalEnvs.MutableSubEvalEnv(this, name);
  }

  /**
   * Creates an evaluation environment that has the same content as this one,
   * plus mutable slots for each name in a pattern.
   */
  default MutableEvalEnv bindMutablePat(Ast.Pat pat) {
    if (pat instanceof Ast.IdPat) {
      // Pattern is simple; use a simple implementation.
      return bindMutable(((Ast.IdPat) pat).name);
    }
    final List<String> names = new ArrayList<>();
    pat.forEachName(names::add);
    return new EvalEnvs.MutablePatSubEvalEnv(this, pat, names);
  }

  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name are
   * visited, but after the more obscuring bindings.
   */
  void visit(BiConsumer<String, Object> consumer);

  /** Returns a map of the values and bindings. */
  default Map<String, Object> valueMap() {
    final Map<String, Object> valueMap = new HashMap<>();
    visit(valueMap::putIfAbsent);
    return valueMap;
  }
}

// End EvalEnv.java
