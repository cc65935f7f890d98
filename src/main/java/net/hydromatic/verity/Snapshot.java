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
package net.hydromatic.verity;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.Iterables;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.verity.ast.Ast;
import net.hydromatic.verity.ast.Visitor;
import net.hydromatic.verity.eval.BuiltIn;

/**
 * Value captured before a method is called, so that a postcondition can
 * compare it with the state after the call.
 *
 * <p>A postcondition refers to the captured value as {@code OLD.name}. For
 * example, given the snapshot {@code Snapshot.of("lst[:]")} (whose name is
 * "lst"), the postcondition {@code len(OLD.lst) + 1 == len(lst)} checks that
 * a method appended one element to a list.
 *
 * @see Contract#withSnapshot(Snapshot)
 * @see Contract#capture(Map)
 */
public class Snapshot {
  public final String name;
  /** Expression that computes the value; usually it copies a variable. */
  public final Condition capture;

  private Snapshot(String name, Condition capture) {
    this.name = requireNonNull(name);
    this.capture = requireNonNull(capture);
  }

  /** Creates a snapshot whose name is the only variable that its capture
   * expression refers to.
   *
   * @throws IllegalArgumentException if the expression refers to no
   * variables or to more than one */
  public static Snapshot of(String captureText) {
    final Condition capture = Condition.parse(captureText);
    return new Snapshot(variableName(capture), capture);
  }

  /** Creates a named snapshot. */
  public static Snapshot of(String name, String captureText) {
    return new Snapshot(name, Condition.parse(captureText));
  }

  @Override public String toString() {
    return "OLD." + name + " = " + capture;
  }

  /** Evaluates the capture expression. */
  Object capture(Map<String, ?> bindings) {
    return capture.evaluate(bindings);
  }

  private static String variableName(Condition capture) {
    final Set<String> names = new LinkedHashSet<>();
    final Set<String> boundNames = new HashSet<>();
    capture.exp.accept(new Visitor() {
      @Override protected void visit(Ast.Id id) {
        names.add(id.name);
      }

      @Override protected void visit(Ast.IdPat idPat) {
        boundNames.add(idPat.name);
      }
    });
    names.removeAll(boundNames);
    names.removeIf(name -> BuiltIn.lookup(name) != null);
    if (names.size() != 1) {
      throw new IllegalArgumentException("snapshot of '" + capture
          + "' must be given a name, because it refers to "
          + (names.isEmpty() ? "no variables" : "variables " + names));
    }
    return Iterables.getOnlyElement(names);
  }
}

// End Snapshot.java
