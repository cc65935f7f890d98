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
import static net.hydromatic.verity.Matchers.list;
import static net.hydromatic.verity.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import net.hydromatic.verity.eval.Dynamic;
import net.hydromatic.verity.eval.EvalException;
import net.hydromatic.verity.eval.Generator;
import net.hydromatic.verity.eval.Nil;
import net.hydromatic.verity.eval.Tuple;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests evaluation of conditions. */
public class EvaluatorTest {
  @Test void testArithmetic() {
    cond("1 + 2 * 3").assertEval(is(7L));
    cond("(1 + 2) * 3").assertEval(is(9L));
    cond("7 // 2").assertEval(is(3L));
    cond("-7 // 2").assertEval(is(-4L));
    cond("7 % -3").assertEval(is(-2L));
    cond("-7 % 3").assertEval(is(2L));
    cond("2 ** 10").assertEval(is(1024L));
    cond("2 ** -1").assertEval(is(0.5));
    cond("1 / 2").assertEval(is(0.5));
    cond("1 + 0.5").assertEval(is(1.5));
    cond("-x").with("x", 5).assertEval(is(-5L));
    cond("~5").assertEval(is(-6L));
    cond("1 << 4 | 1").assertEval(is(17L));
    cond("6 & 3 ^ 1").assertEval(is(3L));
    cond("True + True").assertEval(is(2L));
    cond("'ab' + 'c'").assertEval(is("abc"));
    cond("'ab' * 2").assertEval(is("abab"));
    cond("[1] + [2]").assertEval(is(list(1L, 2L)));
    cond("(1,) + (2,)").assertEval(is(Tuple.of(1L, 2L)));
  }

  @Test void testArithmeticErrors() {
    cond("1 / 0")
        .assertEvalThrows(throwsA("ZeroDivisionError: division by zero"));
    cond("1 // 0")
        .assertEvalThrows(
            throwsA("ZeroDivisionError: integer division or modulo by zero"));
    cond("1 % 0")
        .assertEvalThrows(throwsA("ZeroDivisionError: integer modulo by zero"));
    cond("9223372036854775807 + 1")
        .assertEvalThrows(throwsA("OverflowError: integer overflow"));
    cond("1 + 'a'")
        .assertEvalThrows(
            throwsA("TypeError: unsupported operand type(s) for +: "
                + "'int' and 'str'"));
  }

  @Test void testComparison() {
    cond("1 < 2 < 3").assertEval(is(true));
    cond("1 < 3 < 2").assertEval(is(false));
    cond("1 == 1.0").assertEval(is(true));
    cond("x == 1").with("x", 1).assertEval(is(true));
    cond("'a' < 'b'").assertEval(is(true));
    cond("[1, 2] < [1, 3]").assertEval(is(true));
    cond("(1, 2) == [1, 2]").assertEval(is(false));
    cond("range(3) == [0, 1, 2]").assertEval(is(false));
    cond("[0, 1, 2] != range(3)").assertEval(is(true));
    cond("range(3) == range(0, 3, 1)").assertEval(is(true));
    cond("range(0) == range(2, 2)").assertEval(is(true));
    cond("list(range(3)) == [0, 1, 2]").assertEval(is(true));
    cond("{1, 2} < {1, 2, 3}").assertEval(is(true));
    cond("'b' in 'abc'").assertEval(is(true));
    cond("3 not in [1, 2]").assertEval(is(true));
    cond("'k' in {'k': 1}").assertEval(is(true));
    cond("x is None").with("x", null).assertEval(is(true));
    cond("x is not None").with("x", 1).assertEval(is(true));
    cond("1 < 'a'")
        .assertEvalThrows(
            throwsA("TypeError: '<' not supported between instances of "
                + "'int' and 'str'"));
  }

  /** Tests that a chained comparison evaluates each operand at most once,
   * and stops at the first comparison that is false. */
  @Test void testComparisonShortCircuit() {
    cond("2 < 1 < 1 / 0").assertEval(is(false));
    final Counter counter = new Counter();
    cond("0 < c.tick() < 2").with("c", counter).assertEval(is(true));
    assertThat(counter.count, is(1));
  }

  @Test void testBoolean() {
    cond("not 0").assertEval(is(true));
    cond("not []").assertEval(is(true));
    cond("not 'a'").assertEval(is(false));
    cond("0 or 'default'").assertEval(is("default"));
    cond("1 and 2").assertEval(is(2L));
    cond("[] and 1 / 0").assertEval(is(list()));
    cond("1 or 1 / 0").assertEval(is(1L));
    cond("x if x > 0 else -x").with("x", -5).assertEval(is(5L));
    cond("'yes' if [] else 'no'").assertEval(is("no"));
  }

  @Test void testNames() {
    cond("x").with("x", "abc").assertEval(is("abc"));
    cond("len").with("len", 3).assertEval(is(3));
    cond("y")
        .assertEvalThrows(throwsA("NameError: name 'y' is not defined"));
    cond("y")
        .assertEvalThrows(
            throwsA(EvalException.class,
                is("NameError: name 'y' is not defined")));
  }

  @Test void testSubscript() {
    final List<Integer> lst = Arrays.asList(1, 2, 3);
    cond("lst[0]").with("lst", lst).assertEval(is(1));
    cond("lst[-1]").with("lst", lst).assertEval(is(3));
    cond("lst[1:]").with("lst", lst).assertEval(is(list(2, 3)));
    cond("lst[::-1]").with("lst", lst).assertEval(is(list(3, 2, 1)));
    cond("lst[::2]").with("lst", lst).assertEval(is(list(1, 3)));
    cond("'hello'[1:3]").assertEval(is("el"));
    cond("'hello'[-1]").assertEval(is("o"));
    cond("(1, 2, 3)[1:]").assertEval(is(Tuple.of(2L, 3L)));
    cond("m['k']").with("m", ImmutableMap.of("k", 5)).assertEval(is(5));
    cond("m[1]").with("m", ImmutableMap.of(1, "a")).assertEval(is("a"));
    cond("lst[3]").with("lst", lst)
        .assertEvalThrows(throwsA("IndexError: list index out of range"));
    cond("{'a': 1}['b']").assertEvalThrows(throwsA("KeyError: 'b'"));
    cond("lst['a']").with("lst", lst)
        .assertEvalThrows(
            throwsA("TypeError: list indices must be integers or slices, "
                + "not str"));
    cond("lst[::0]").with("lst", lst)
        .assertEvalThrows(throwsA("ValueError: slice step cannot be zero"));
    cond("5[0]")
        .assertEvalThrows(
            throwsA("TypeError: 'int' object is not subscriptable"));
  }

  @Test void testDisplays() {
    cond("[1, 'a', None]").assertEval(is(list(1L, "a", Nil.INSTANCE)));
    cond("(1, 2)").assertEval(is(Tuple.of(1L, 2L)));
    cond("()").assertEval(is(Tuple.EMPTY));
    cond("{1, 2, 1}")
        .assertEval(is(new LinkedHashSet<>(Arrays.asList(1L, 2L))));
    cond("{'a': 1, 'b': 2}")
        .assertEval(is(ImmutableMap.of("a", 1L, "b", 2L)));

    // Equal keys are merged; the first key is kept, with the last value
    cond("{1: 'a', True: 'b'}").assertEval(is(ImmutableMap.of(1L, "b")));
    cond("{1.0: 'a', 1: 'b', 2: 'c'}")
        .assertEval(is(ImmutableMap.of(1.0D, "b", 2L, "c")));
    cond("len({k % 2: k for k in [1, 2, 3, 4.0]})").assertEval(is(2L));
    cond("{k % 2: k for k in [1, 2, 3, 4.0]}")
        .assertEval(is(ImmutableMap.of(1L, 3L, 0L, 4.0D)));
  }

  @Test void testComprehensions() {
    cond("[x * 2 for x in range(3)]").assertEval(is(list(0L, 2L, 4L)));
    cond("[x for x in xs if x % 2 == 1]")
        .with("xs", Arrays.asList(1, 2, 3))
        .assertEval(is(list(1, 3)));
    cond("[(x, y) for x in 'ab' for y in range(1 if x == 'a' else 0, 2)]")
        .assertEval(
            is(list(Tuple.of("a", 1L), Tuple.of("b", 0L),
                Tuple.of("b", 1L))));
    cond("{x % 3 for x in range(10)}")
        .assertEval(is(new LinkedHashSet<>(Arrays.asList(0L, 1L, 2L))));
    cond("{k: v for k, v in zip('ab', [1, 2])}")
        .assertEval(is(ImmutableMap.of("a", 1L, "b", 2L)));
    cond("[i + j for (i, j) in [(1, 2), (3, 4)]]")
        .assertEval(is(list(3L, 7L)));
    cond("sum(x for x in [1, 2, 3])").assertEval(is(6L));
    cond("x").with("x", 7).assertEval(is(7));
    // Loop variables do not leak out of a comprehension
    cond("[x for x in [1, 2]] == [1, 2] and x == 7")
        .with("x", 7).assertEval(is(true));
    cond("[a for a, b in [(1, 2, 3)]]")
        .assertEvalThrows(
            throwsA("ValueError: too many values to unpack (expected 2)"));
  }

  /** Tests that a generator is lazy, so that "all" and "any" can stop
   * early. */
  @Test void testGeneratorIsLazy() {
    cond("any(1 / x > 0 for x in [1, 0])").assertEval(is(true));
    cond("all(1 / x < 0 for x in [1, 0])").assertEval(is(false));
    cond("(x for x in [])")
        .assertEval(instanceOf(Generator.class));
  }

  @Test void testLambda() {
    cond("(lambda x, y: x + y)(1, 2)").assertEval(is(3L));
    cond("(lambda x, y=0: x)(1)")
        .assertParseThrows(throwsA("expected ':' but found '='"));
    cond("(lambda x: x + n)(1)").with("n", 10).assertEval(is(11L));
    cond("sorted([3, 1, 2], key=lambda x: -x)")
        .assertEval(is(list(3L, 2L, 1L)));
    cond("(lambda x: x)(1, 2)")
        .assertEvalThrows(
            throwsA("TypeError: <lambda>() takes 1 positional arguments but 2 "
                + "were given"));
  }

  @Test void testBuiltIns() {
    cond("abs(-3)").assertEval(is(3L));
    cond("all([])").assertEval(is(true));
    cond("any([0, None, ''])").assertEval(is(false));
    cond("bool([0])").assertEval(is(true));
    cond("len('abc')").assertEval(is(3L));
    cond("len({'a': 1})").assertEval(is(1L));
    cond("list('ab')").assertEval(is(list("a", "b")));
    cond("max([1, 5, 3])").assertEval(is(5L));
    cond("max(1, 5, 3)").assertEval(is(5L));
    cond("min(['bb', 'a', 'ccc'], key=len)").assertEval(is("a"));
    cond("max([], default=0)").assertEval(is(0L));
    cond("list(range(1, 10, 3))").assertEval(is(list(1L, 4L, 7L)));
    cond("repr('a')").assertEval(is("'a'"));
    cond("list(reversed([1, 2, 3]))").assertEval(is(list(3L, 2L, 1L)));
    cond("sorted([3, 1, 2], reverse=True)").assertEval(is(list(3L, 2L, 1L)));
    cond("str(12)").assertEval(is("12"));
    cond("sum([1, 2, 3], 10)").assertEval(is(16L));
    cond("tuple([1, 2])").assertEval(is(Tuple.of(1L, 2L)));
    cond("list(enumerate('ab', start=1))")
        .assertEval(is(list(Tuple.of(1L, "a"), Tuple.of(2L, "b"))));
    cond("int('42')").assertEval(is(42L));
    cond("int('ff', 16)").assertEval(is(255L));
    cond("float(1)").assertEval(is(1.0));
    cond("len(1, 2)")
        .assertEvalThrows(
            throwsA("TypeError: len() expected at most 1 argument, got 2"));
    cond("len(x=1)")
        .assertEvalThrows(
            throwsA("TypeError: len() expected at least 1 argument, got 0"));
    cond("5(1)")
        .assertEvalThrows(throwsA("TypeError: 'int' object is not callable"));
  }

  @Test void testHostObjects() {
    final A a = new A();
    cond("a.y").with("a", a).assertEval(is(3));
    cond("a.z")
        .with("a", a)
        .assertEvalThrows(
            throwsA("AttributeError: 'A' object has no attribute 'z'"));
    cond("p.x + p.y").with("p", new Point(1, 2)).assertEval(is(3L));
    cond("b.name").with("b", new Bean("fred", true)).assertEval(is("fred"));
    cond("b.active").with("b", new Bean("fred", true)).assertEval(is(true));
    cond("b.is_active").with("b", new Bean("fred", false))
        .assertEval(is(false));
    cond("b.greet('hello')").with("b", new Bean("fred", true))
        .assertEval(is("hello, fred"));
    cond("b.greet('hello', 2)").with("b", new Bean("fred", true))
        .assertEval(is("hello, fred, fred"));
    cond("s.starts_with('a')").with("s", "abc").assertEval(is(true));
    cond("s.to_upper_case()").with("s", "abc").assertEval(is("ABC"));
    cond("lst.size()").with("lst", Arrays.asList(1, 2)).assertEval(is(2));
    cond("p.is_absolute()").with("p", Paths.get("file2"))
        .assertEval(is(false));
    cond("d.color").with("d", new Dyn()).assertEval(is("red"));
    cond("d.size")
        .with("d", new Dyn())
        .assertEvalThrows(
            throwsA("AttributeError: 'Dyn' object has no attribute 'size'"));
    cond("b.fail()").with("b", new Bean("fred", true))
        .assertEvalThrows(throwsA(IllegalStateException.class, is("boom")));
    cond("b.io()").with("b", new Bean("fred", true))
        .assertEvalThrows(throwsA("Exception: java.io.IOException: disk"));
  }

  /** Characters and arrays of primitives are converted when they are
   * bound, and when a host method returns them. */
  @Test void testHostValues() {
    cond("x == y").with("x", 'c').with("y", "c").assertEval(is(true));
    cond("x + 'd'").with("x", 'c').assertEval(is("cd"));
    cond("s.char_at(1) == 'b'").with("s", "abc").assertEval(is(true));
    cond("len(a)").with("a", new int[] {1, 2, 3}).assertEval(is(3L));
    cond("a[-1]").with("a", new long[] {4L, 5L}).assertEval(is(5L));
    cond("a == [1, 2]").with("a", new int[] {1, 2}).assertEval(is(true));
    cond("sum(a)").with("a", new double[] {1.5D, 2D}).assertEval(is(3.5D));
    cond("'b' in a").with("a", new char[] {'a', 'b'}).assertEval(is(true));
    cond("all(a)").with("a", new boolean[] {true, false})
        .assertEval(is(false));
    cond("b.codes").with("b", new Bean("fred", true))
        .assertEval(is(list(1, 2)));
  }

  /** Object with a public field, as in the examples of diagnostics. */
  public static class A {
    public final int y = 3;

    @Override public String toString() {
      return "A()";
    }
  }

  /** Object with accessor methods, in the style of a record. */
  public static class Point {
    private final int x;
    private final int y;

    public Point(int x, int y) {
      this.x = x;
      this.y = y;
    }

    public int x() {
      return x;
    }

    public int y() {
      return y;
    }
  }

  /** Object with bean getters and other methods. */
  public static class Bean {
    private final String name;
    private final boolean active;

    public Bean(String name, boolean active) {
      this.name = name;
      this.active = active;
    }

    public String getName() {
      return name;
    }

    public boolean isActive() {
      return active;
    }

    public int[] getCodes() {
      return new int[] {1, 2};
    }

    public String greet(String greeting) {
      return greeting + ", " + name;
    }

    public String greet(String greeting, int times) {
      final StringBuilder b = new StringBuilder(greeting);
      for (int i = 0; i < times; i++) {
        b.append(", ").append(name);
      }
      return b.toString();
    }

    public String fail() {
      throw new IllegalStateException("boom");
    }

    public String io() throws IOException {
      throw new IOException("disk");
    }
  }

  /** Object that resolves its own attributes. */
  public static class Dyn implements Dynamic {
    private final Map<String, Object> map = ImmutableMap.of("color", "red");

    @Override public @Nullable Object getAttribute(String name) {
      return map.get(name);
    }
  }

  /** Object with a method that has a side effect. */
  public static class Counter {
    int count;

    public int tick() {
      return ++count;
    }

    @Override public String toString() {
      return "Counter()";
    }
  }
}

// End EvaluatorTest.java
