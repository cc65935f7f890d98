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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.verity.ast.Ast;
import net.hydromatic.verity.eval.EvalEnv;
import net.hydromatic.verity.eval.EvalEnvs;
import net.hydromatic.verity.eval.Evaluator;
import net.hydromatic.verity.eval.Printer;
import net.hydromatic.verity.eval.Prop;
import net.hydromatic.verity.eval.Values;
import net.hydromatic.verity.parse.ConditionParser;
import net.hydromatic.verity.parse.Source;
import net.hydromatic.verity.report.Collector;
import net.hydromatic.verity.report.Diagnostic;
import net.hydromatic.verity.report.Formatter;
import net.hydromatic.verity.report.ReportEntry;
import net.hydromatic.verity.report.SourceRenderer;
import net.hydromatic.verity.report.Tracer;
import net.hydromatic.verity.report.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A boolean expression, parsed once and evaluated many times.
 *
 * <p>A condition is immutable, and may be tested and diagnosed by several
 * threads at the same time.
 */
public class Condition {
  /** Source of the condition; null if the condition was built from an
   * expression, rather than parsed. */
  public final @Nullable Source source;
  public final Ast.Exp exp;
  private final SourceRenderer renderer;

  private Condition(@Nullable Source source, Ast.Exp exp) {
    this.source = source;
    this.exp = requireNonNull(exp);
    this.renderer = new SourceRenderer(source);
  }

  /** Parses a condition.
   *
   * @throws net.hydromatic.verity.parse.ConditionParseException if the text
   * is not a valid expression */
  public static Condition parse(String text) {
    return parse(Source.of(text));
  }

  /** Parses a condition that is located in a file. Positions in error
   * messages start at the given line. */
  public static Condition parse(String text, String file, int firstLine) {
    return parse(Source.of(text, file, firstLine));
  }

  private static Condition parse(Source source) {
    final Ast.Exp exp = new ConditionParser(source).parseCondition();
    return new Condition(source, exp);
  }

  /** Creates a condition from an expression that has no source text. Its
   * diagnostics contain the unparsed expression. */
  public static Condition of(Ast.Exp exp) {
    return new Condition(null, exp);
  }

  /** Returns the text of the condition, as written. */
  public String text() {
    return renderer.render(exp);
  }

  @Override public String toString() {
    return text();
  }

  /** Evaluates the condition. */
  public Object evaluate(Map<String, ?> bindings) {
    final EvalEnv env = EvalEnvs.copyOf(bindings);
    return Evaluator.create().eval(env, exp);
  }

  /** Evaluates the condition, and returns whether its value is true. */
  public boolean test(Map<String, ?> bindings) {
    return Values.truth(evaluate(bindings));
  }

  /** Explains the value of the condition, using default properties. */
  public Diagnostic diagnose(Map<String, ?> bindings,
      @Nullable String description) {
    return diagnose(bindings, description, ImmutableMap.of(),
        Tracers.empty());
  }

  /** Explains the value of the condition: evaluates it, and formats the
   * values of its sub-expressions.
   *
   * @param bindings Values of variables
   * @param description Description to follow the condition text, or null
   * @param props Properties; those that control printing are used
   * @param tracer Tracer
   *
   * @throws net.hydromatic.verity.report.UnsupportedExpressionException if
   * the condition contains a lambda
   * @throws net.hydromatic.verity.eval.EvalException if a sub-expression
   * cannot be evaluated
   */
  public Diagnostic diagnose(Map<String, ?> bindings,
      @Nullable String description, Map<Prop, Object> props, Tracer tracer) {
    final EvalEnv env = EvalEnvs.copyOf(bindings);
    final List<ReportEntry> entries =
        new Collector(renderer, tracer).collect(exp, env);
    final Diagnostic diagnostic =
        new Formatter(Printer.of(props)).format(text(), description, entries);
    tracer.onDiagnostic(diagnostic);
    return diagnostic;
  }
}

// End Condition.java
