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

import static net.hydromatic.verity.Cond.cond;
import static net.hydromatic.verity.Cond.condE;
import static net.hydromatic.verity.Matchers.throwsA;
import static net.hydromatic.verity.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableMap;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.verity.EvaluatorTest.A;
import net.hydromatic.verity.EvaluatorTest.Counter;
import net.hydromatic.verity.ast.Ast;
import net.hydromatic.verity.ast.Op;
import net.hydromatic.verity.ast.Pos;
import net.hydromatic.verity.eval.EvalException;
import net.hydromatic.verity.eval.Prop;
import net.hydromatic.verity.eval.Tuple;
import net.hydromatic.verity.report.Diagnostic;
import net.hydromatic.verity.report.ReportEntry;
import net.hydromatic.verity.report.Tracers;
import net.hydromatic.verity.report.UnsupportedExpressionException;
import org.junit.jupiter.api.Test;

/** Tests the diagnostics that explain the value of a condition. */
public class RepresentTest {
  @Test void testSimple() {
    cond("x < 5").with("x", 100).assertDiagnostic("x < 5: x was 100");
  }

  @Test void testAttribute() {
    cond("x > a.y").with("x", 1).with("a", new A())
        .assertDiagnostic("x > a.y:\n"
            + "a was A()\n"
            + "a.y was 3\n"
            + "x was 1");
  }

  /** The subscript is not reported, but the names inside it are. */
  @Test void testSubscript() {
    cond("x > lst[1]").with("x", 1).with("lst", Arrays.asList(1, 2, 3))
        .assertDiagnostic("x > lst[1]:\n"
            + "lst was [1, 2, 3]\n"
            + "x was 1");
    cond("lst[i] > 2").with("i", 0).with("lst", Arrays.asList(1, 2, 3))
        .assertDiagnostic("lst[i] > 2:\n"
            + "i was 0\n"
            + "lst was [1, 2, 3]");
  }

  /** Inside a generator, neither the iteration variable nor the collection
   * is reported. */
  @Test void testGeneratorArgument() {
    final List<Object> result =
        Arrays.asList(Arrays.asList("a", Paths.get("/file1")),
            Arrays.asList("b", Paths.get("file2")));
    cond("all(r[1].is_absolute() for r in result)")
        .with("result", result)
        .assertDiagnostic("all(r[1].is_absolute() for r in result): "
            + "all(r[1].is_absolute() for r in result) was False");
    cond("any(x > 2 for x in lst)").with("lst", Arrays.asList(1, 2))
        .assertDiagnostic("any(x > 2 for x in lst): "
            + "any(x > 2 for x in lst) was False");
  }

  @Test void testLambda() {
    condE("sorted(xs, key=$lambda x: -x$) == xs")
        .with("xs", Arrays.asList(1, 2))
        .assertDiagnosticThrows(UnsupportedExpressionException.class,
            "lambda cannot be represented in a diagnostic");
    condE("[f for f in [$lambda: 1$]]")
        .assertDiagnosticThrows(UnsupportedExpressionException.class,
            "lambda cannot be represented in a diagnostic");
  }

  @Test void testComprehension() {
    cond("[item < x for item in lst if item % x == 0] == []")
        .with("x", 2).with("lst", Arrays.asList(1, 2, 3))
        .assertDiagnostic("[item < x for item in lst if item % x == 0] == []: "
            + "[item < x for item in lst if item % x == 0] was [False]");
    cond("[y for y in lst if y > x]")
        .with("x", 1).with("lst", Arrays.asList(1, 2, 3))
        .assertDiagnostic("[y for y in lst if y > x]: "
            + "[y for y in lst if y > x] was [2, 3]");
    cond("len({k for k in d}) > n")
        .with("d", ImmutableMap.of("a", 1)).with("n", 1)
        .assertLabels("len({k for k in d})", "n");
  }

  /** An expression that has no names, attributes or calls has no
   * entries. */
  @Test void testNoEntries() {
    cond("1 > 2").assertDiagnostic("1 > 2");
    cond("1 + 2 > [3, 4][0] * 2").assertDiagnostic("1 + 2 > [3, 4][0] * 2");
    cond("1 > 2").assertDiagnostic("never", "1 > 2: never");
  }

  @Test void testDescription() {
    cond("x < 5").with("x", 100)
        .assertDiagnostic("x must be small",
            "x < 5: x must be small: x was 100");
    cond("x < y").with("x", 3).with("y", 2)
        .assertDiagnostic("ascending", "x < y: ascending:\n"
            + "x was 3\n"
            + "y was 2");
  }

  /** Entries are sorted by label, comparing code points; upper-case letters
   * precede lower-case. */
  @Test void testSort() {
    cond("B < a").with("a", 1).with("B", 2)
        .assertDiagnostic("B < a:\n"
            + "B was 2\n"
            + "a was 1");
    cond("abs(a.y) > 5").with("a", new A())
        .assertDiagnostic("abs(a.y) > 5:\n"
            + "a was A()\n"
            + "a.y was 3\n"
            + "abs(a.y) was 3");
    cond("z > 0 and y > 0 and x > 0")
        .with("x", 1).with("y", 2).with("z", 3)
        .assertLabels("x", "y", "z");
  }

  /** A label that occurs more than once is reported once. */
  @Test void testDuplicate() {
    cond("len(s) > 3 or len(s) < 1").with("s", "ab")
        .assertDiagnostic("len(s) > 3 or len(s) < 1:\n"
            + "len(s) was 2\n"
            + "s was 'ab'");
    cond("a.y < 1 or a.y > 5").with("a", new A())
        .assertDiagnostic("a.y < 1 or a.y > 5:\n"
            + "a was A()\n"
            + "a.y was 3");
    cond("x < 0 or x > 5 or x == 3").with("x", 4)
        .assertDiagnostic("x < 0 or x > 5 or x == 3: x was 4");
  }

  /** Operands that were not evaluated are not reported. */
  @Test void testShortCircuit() {
    cond("x is not None and x.y > 0").with("x", null)
        .assertDiagnostic("x is not None and x.y > 0: x was None");
    cond("(x if flag else y) > 0")
        .with("flag", false).with("x", 1).with("y", -1)
        .assertDiagnostic("(x if flag else y) > 0:\n"
            + "flag was False\n"
            + "y was -1");
    cond("x > 1 > y").with("x", 0).with("y", 5)
        .assertDiagnostic("x > 1 > y: x was 0");
  }

  @Test void testMethodCall() {
    cond("s.starts_with('a')").with("s", "b")
        .assertDiagnostic("s.starts_with('a'):\n"
            + "s was 'b'\n"
            + "s.starts_with('a') was False");
    cond("p.x > p.y").with("p", new EvaluatorTest.Point(1, 2))
        .assertLabels("p", "p.x", "p.y");
  }

  /** Each sub-expression is evaluated once, even if it is reported and its
   * parent is reported. */
  @Test void testEvaluatedOnce() {
    final Counter counter = new Counter();
    cond("c.tick() > 100").with("c", counter)
        .assertDiagnostic("c.tick() > 100:\n"
            + "c was Counter()\n"
            + "c.tick() was 1");
    assertThat(counter.count, is(1));
  }

  @Test void testNot() {
    cond("not x").with("x", true).assertDiagnostic("not x: x was True");
    cond("not (x or y)").with("x", 0).with("y", "a")
        .assertDiagnostic("not (x or y):\n"
            + "x was 0\n"
            + "y was 'a'");
  }

  @Test void testValues() {
    cond("x < 0.5").with("x", 1.5).assertDiagnostic("x < 0.5: x was 1.5");
    cond("s == 'abc'").with("s", "it's")
        .assertDiagnostic("s == 'abc': s was \"it's\"");
    cond("t[0] == 1").with("t", Tuple.of(2L, "a"))
        .assertDiagnostic("t[0] == 1: t was (2, 'a')");
    cond("'j' in d").with("d", ImmutableMap.of("k", 1))
        .assertDiagnostic("'j' in d: d was {'k': 1}");
    cond("len(x) == 1").with("x", Arrays.asList())
        .assertDiagnostic("len(x) == 1:\n"
            + "len(x) was 0\n"
            + "x was []");
  }

  /** Values of host types print as the corresponding values of the
   * language, and the same in every run. */
  @Test void testHostValues() {
    cond("x == []").with("x", new int[] {1, 2})
        .assertDiagnostic("x == []: x was [1, 2]");
    cond("x == 'd'").with("x", 'c')
        .assertDiagnostic("x == 'd': x was 'c'");
    cond("len(cs) == 0").with("cs", new char[] {'a', 'b'})
        .assertDiagnostic("len(cs) == 0:\n"
            + "cs was ['a', 'b']\n"
            + "len(cs) was 2");
  }

  @Test void testPrintLimits() {
    cond("len(lst) < 2").with("lst", Arrays.asList(1, 2, 3))
        .with(Prop.PRINT_LENGTH, 2)
        .assertDiagnostic("len(lst) < 2:\n"
            + "len(lst) was 3\n"
            + "lst was [1, 2, ...]");
    cond("s == ''").with("s", "abcdef")
        .with(Prop.STRING_DEPTH, 3)
        .assertDiagnostic("s == '': s was 'abc...'");
    cond("x == []").with("x", Arrays.asList(Arrays.asList(1), 2))
        .with(Prop.PRINT_DEPTH, 1)
        .assertDiagnostic("x == []: x was [[...], 2]");
  }

  /** Labels are the source text as written, including its spacing. */
  @Test void testSourceText() {
    cond("x  <   5").with("x", 100).assertDiagnostic("x  <   5: x was 100");
    cond("len( s ) > 5").with("s", "ab")
        .assertLabels("len( s )", "s");
  }

  /** If the condition spans several lines, each entry is on its own line,
   * even if there is only one. */
  @Test void testMultiLine() {
    cond("x < 0 and\n  x > 5").with("x", 10)
        .assertDiagnostic("x < 0 and\n  x > 5:\n"
            + "x was 10");
    cond("x < 0 or\ny < 0").with("x", 1).with("y", 1)
        .assertDiagnostic("x < 0 or\ny < 0:\n"
            + "x was 1\n"
            + "y was 1");
  }

  /** Errors in sub-expressions propagate. */
  @Test void testError() {
    cond("a.z > 0").with("a", new A())
        .assertDiagnosticThrows(
            throwsA(EvalException.class,
                is("AttributeError: 'A' object has no attribute 'z'")));
    cond("y > 0")
        .assertDiagnosticThrows(
            throwsA(EvalException.class,
                is("NameError: name 'y' is not defined")));
  }

  /** A condition that was built, not parsed, has no source text; labels are
   * the unparsed expressions. */
  @Test void testNoSource() {
    final Pos pos = Pos.ZERO;
    final Ast.Exp exp =
        ast.compare(pos, Op.LT, ast.id(pos, "x"), ast.intLiteral(pos, 5));
    final Condition condition = Condition.of(exp);
    assertThat(condition.text(), is("x < 5"));
    final Diagnostic diagnostic =
        condition.diagnose(ImmutableMap.of("x", 100), null);
    assertThat(diagnostic.message, is("x < 5: x was 100"));
  }

  @Test void testTracer() {
    final List<String> labels = new ArrayList<>();
    final List<Diagnostic> diagnostics = new ArrayList<>();
    final Cond cond = cond("b > a.y").with("a", new A()).with("b", 1)
        .withTracer(
            Tracers.withOnDiagnostic(
                Tracers.withOnEntry(Tracers.empty(),
                    entry -> labels.add(entry.label)),
                diagnostics::add));
    final Diagnostic diagnostic = cond.diagnose(null);

    // Entries are traced in the order they were found, and sorted in the
    // diagnostic.
    assertThat(labels, is(Arrays.asList("b", "a.y", "a")));
    assertThat(diagnostics.size(), is(1));
    assertThat(diagnostics.get(0), sameInstance(diagnostic));
    final List<String> sortedLabels = new ArrayList<>();
    for (ReportEntry entry : diagnostic.entries) {
      sortedLabels.add(entry.label);
    }
    assertThat(sortedLabels, is(Arrays.asList("a", "a.y", "b")));
  }

  /** Explaining the same condition twice gives the same result. */
  @Test void testIdempotent() {
    final Cond cond = cond("len(s) > n or s[0] == 'x'")
        .with("s", "abc").with("n", 5);
    final Diagnostic d1 = cond.diagnose(null);
    final Diagnostic d2 = cond.diagnose(null);
    assertThat(d1.message, is(d2.message));
    assertThat(d1, is(d2));
  }
}

// End RepresentTest.java
