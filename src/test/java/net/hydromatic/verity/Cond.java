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

import static net.hydromatic.verity.Matchers.isAst;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import net.hydromatic.verity.ast.Ast;
import net.hydromatic.verity.ast.Pos;
import net.hydromatic.verity.eval.Prop;
import net.hydromatic.verity.parse.ConditionParseException;
import net.hydromatic.verity.report.Diagnostic;
import net.hydromatic.verity.report.ReportEntry;
import net.hydromatic.verity.report.Tracer;
import net.hydromatic.verity.report.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Cond {
  private final String text;
  private final @Nullable Pos pos;
  private final Map<String, @Nullable Object> bindings;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;

  Cond(String text, @Nullable Pos pos, Map<String, @Nullable Object> bindings,
      Map<Prop, Object> propMap, Tracer tracer) {
    this.text = text;
    this.pos = pos;
    this.bindings =
        Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = tracer;
  }

  /** Creates a {@code Cond}. */
  static Cond cond(String text) {
    return new Cond(text, null, ImmutableMap.of(), ImmutableMap.of(),
        Tracers.empty());
  }

  /** Creates a {@code Cond} containing an error position delimited by
   * '$'. */
  static Cond condE(String text) {
    final Entry<String, Pos> pair = Pos.split(text, '$', "");
    return new Cond(pair.getKey(), pair.getValue(), ImmutableMap.of(),
        ImmutableMap.of(), Tracers.empty());
  }

  /** Returns a copy with a variable bound to a value. */
  Cond with(String name, @Nullable Object value) {
    final Map<String, @Nullable Object> map = new LinkedHashMap<>(bindings);
    map.put(name, value);
    return new Cond(text, pos, map, propMap, tracer);
  }

  Cond with(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    map.put(prop, value);
    return new Cond(text, pos, bindings, map, tracer);
  }

  Cond withTracer(Tracer tracer) {
    return new Cond(text, pos, bindings, propMap, tracer);
  }

  Condition condition() {
    return Condition.parse(text);
  }

  /** Checks that the condition parses, and unparses to the given string. */
  Cond assertParse(String expected) {
    assertThat(condition().exp, isAst(Ast.Exp.class, expected));
    return this;
  }

  /** Checks that the condition parses, and unparses to the same text. */
  Cond assertParseSame() {
    return assertParse(text);
  }

  /** Checks that parsing throws an exception at the position marked by
   * '$'. */
  Cond assertParseThrows(String message) {
    if (pos == null) {
      throw new IllegalStateException("no position; use condE");
    }
    return assertParseThrows(
        Matchers.throwsA(ConditionParseException.class, message, pos));
  }

  Cond assertParseThrows(Matcher<Throwable> matcher) {
    try {
      final Condition condition = condition();
      fail("expected error, got " + condition.exp);
    } catch (RuntimeException e) {
      assertThat(e, matcher);
    }
    return this;
  }

  Cond assertEval(Matcher<Object> matcher) {
    assertThat(condition().evaluate(bindings), matcher);
    return this;
  }

  Cond assertEvalThrows(Matcher<Throwable> matcher) {
    try {
      final Object o = condition().evaluate(bindings);
      fail("expected error, got " + o);
    } catch (RuntimeException e) {
      assertThat(e, matcher);
    }
    return this;
  }

  Cond assertTest(boolean expected) {
    assertThat(condition().test(bindings), is(expected));
    return this;
  }

  Diagnostic diagnose(@Nullable String description) {
    return condition().diagnose(bindings, description, propMap, tracer);
  }

  /** Checks the diagnostic message. */
  Cond assertDiagnostic(String expected) {
    return assertDiagnostic(null, expected);
  }

  Cond assertDiagnostic(@Nullable String description, String expected) {
    assertThat(diagnose(description).message, is(expected));
    return this;
  }

  /** Checks the labels of the diagnostic's entries, in sorted order. */
  Cond assertLabels(String... expected) {
    final List<String> labels = new ArrayList<>();
    for (ReportEntry entry : diagnose(null).entries) {
      labels.add(entry.label);
    }
    assertThat(labels, is(List.of(expected)));
    return this;
  }

  /** Checks that explaining the condition throws an exception at the
   * position marked by '$'. */
  <T extends Throwable> Cond assertDiagnosticThrows(Class<T> clazz,
      String message) {
    if (pos == null) {
      throw new IllegalStateException("no position; use condE");
    }
    return assertDiagnosticThrows(Matchers.throwsA(clazz, message, pos));
  }

  Cond assertDiagnosticThrows(Matcher<Throwable> matcher) {
    try {
      final Diagnostic diagnostic = diagnose(null);
      fail("expected error, got " + diagnostic);
    } catch (RuntimeException e) {
      assertThat(e, matcher);
    }
    return this;
  }
}

// End Cond.java
