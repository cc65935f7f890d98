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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.verity.ast.Ast;
import net.hydromatic.verity.ast.Visitor;
import net.hydromatic.verity.eval.EvalEnv;
import net.hydromatic.verity.eval.Evaluator;
import net.hydromatic.verity.eval.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the values of the sub-expressions of a condition that should
 * appear in a diagnostic.
 *
 * <p>The collector evaluates the condition once, using a memoizing
 * {@link Evaluator}, then walks the tree depth-first, guided by the
 * {@link Classifier}. A sub-expression that was not evaluated, such as the
 * right operand of an "and" whose left operand was false, is not reported.
 *
 * <p>Entries are keyed by label (the source text of the sub-expression). The
 * first node with a given label wins; the collector does not search again
 * below a node whose label has already been collected.
 *
 * <p>A collector is immutable and may be shared between threads; each call
 * to {@link #collect} uses its own evaluator.
 */
public class Collector {
  private static final Logger LOG = LoggerFactory.getLogger(Collector.class);

  private final SourceRenderer renderer;
  private final Tracer tracer;

  public Collector(SourceRenderer renderer, Tracer tracer) {
    this.renderer = requireNonNull(renderer);
    this.tracer = requireNonNull(tracer);
  }

  /** Throws {@link UnsupportedExpressionException} if an expression contains
   * a lambda. */
  public static void checkSupported(Ast.Exp exp) {
    exp.accept(new Visitor() {
      @Override protected void visit(Ast.Lambda lambda) {
        throw new UnsupportedExpressionException(
            "lambda cannot be represented in a diagnostic", lambda.pos);
      }
    });
  }

  /** Evaluates a condition in an environment, and returns the values of its
   * reportable sub-expressions, in the order they were found. */
  public List<ReportEntry> collect(Ast.Exp root, EvalEnv env) {
    checkSupported(root);
    final Evaluator evaluator = Evaluator.memoizing(env);
    evaluator.eval(env, root);
    final Run run = new Run(evaluator);
    run.visit(root);
    return ImmutableList.copyOf(run.entries.values());
  }

  /** State of one call to {@link #collect}. */
  private class Run {
    final Evaluator evaluator;
    final Map<String, ReportEntry> entries = new LinkedHashMap<>();

    Run(Evaluator evaluator) {
      this.evaluator = evaluator;
    }

    void visit(Ast.Exp exp) {
      switch (Classifier.classify(exp.op)) {
        case LITERAL:
          break;
        case LEAF:
        case OPAQUE:
          report(exp);
          break;
        case TRANSPARENT:
          exp.forEachArg((arg, i) -> visit(arg));
          break;
        case REPORTABLE:
          if (report(exp)) {
            exp.forEachArg((arg, i) -> {
              if (!arg.op.isComprehension()) {
                visit(arg);
              }
            });
          }
          break;
        default:
          throw new AssertionError(exp.op);
      }
    }

    /** Records the value of a node, and returns whether the nodes below it
     * should be searched. */
    private boolean report(Ast.Exp exp) {
      final Object value = evaluator.valueOf(exp);
      if (value == null) {
        // Not evaluated. Nothing below was evaluated either.
        return false;
      }
      final String label = renderer.render(exp);
      if (entries.containsKey(label)) {
        return false;
      }
      if (Values.isFunctionOrClass(value)) {
        return true;
      }
      final ReportEntry entry = new ReportEntry(label, value, exp.pos);
      entries.put(label, entry);
      LOG.trace("collected {}", entry);
      tracer.onEntry(entry);
      return true;
    }
  }
}

// End Collector.java
