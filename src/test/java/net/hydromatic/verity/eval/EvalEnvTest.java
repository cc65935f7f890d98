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

import static net.hydromatic.verity.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.verity.ast.Ast;
import net.hydromatic.verity.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests {@link EvalEnv} and {@link EvalEnvs}. */
public class EvalEnvTest {
  @Test void testBind() {
    final Map<String, Object> map = new HashMap<>();
    map.put("x", 1);
    map.put("n", null);
    final EvalEnv env = EvalEnvs.copyOf(map);
    assertThat(env.getOpt("x"), is(1));
    assertThat(env.getOpt("n"), is(Nil.INSTANCE));
    assertThat(env.getOpt("y"), nullValue());

    // Binding creates a child; the parent is unchanged
    final EvalEnv env2 = env.bind("x", "a").bind("y", null);
    assertThat(env2.getOpt("x"), is("a"));
    assertThat(env2.getOpt("y"), is(Nil.INSTANCE));
    assertThat(env.getOpt("x"), is(1));
    assertThat(env2.valueMap(),
        is(ImmutableMap.of("x", "a", "y", Nil.INSTANCE, "n", Nil.INSTANCE)));
    assertThat(EvalEnvs.EMPTY.valueMap().isEmpty(), is(true));
  }

  @Test void testMutable() {
    final MutableEvalEnv env = EvalEnvs.EMPTY.bind("z", 0).bindMutable("x");
    env.set(5);
    assertThat(env.getOpt("x"), is(5));
    env.set(6);
    assertThat(env.getOpt("x"), is(6));
    assertThat(env.getOpt("z"), is(0));
  }

  /** Binds the pattern "k, (a, b)". */
  @Test void testMutablePat() {
    final Pos pos = Pos.ZERO;
    final Ast.Pat pat =
        ast.tuplePat(pos,
            ImmutableList.of(ast.idPat(pos, "k"),
                ast.tuplePat(pos,
                    ImmutableList.of(ast.idPat(pos, "a"),
                        ast.idPat(pos, "b")))));
    final MutableEvalEnv env =
        EvalEnvs.copyOf(ImmutableMap.of("a", "outer")).bindMutablePat(pat);
    env.set(Tuple.of("key", Arrays.asList(1, 2)));
    assertThat(env.getOpt("k"), is("key"));
    assertThat(env.getOpt("a"), is(1));
    assertThat(env.getOpt("b"), is(2));
    assertThat(env.valueMap(), is(ImmutableMap.of("k", "key", "a", 1, "b", 2)));

    final EvalException e =
        assertThrows(EvalException.class,
            () -> env.set(Tuple.of("key", Arrays.asList(1, 2, 3))));
    assertThat(e.getMessage(),
        is("ValueError: too many values to unpack (expected 2)"));
    final EvalException e2 =
        assertThrows(EvalException.class, () -> env.set(Tuple.of("key")));
    assertThat(e2.getMessage(),
        is("ValueError: not enough values to unpack (expected 2, got 1)"));
  }
}

// End EvalEnvTest.java
