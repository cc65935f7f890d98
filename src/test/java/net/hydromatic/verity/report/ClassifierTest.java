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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.EnumSet;
import java.util.Set;
import net.hydromatic.verity.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests {@link Classifier}. */
public class ClassifierTest {
  @Test void testClassify() {
    assertThat(Classifier.classify(Op.INT_LITERAL), is(Category.LITERAL));
    assertThat(Classifier.classify(Op.NONE_LITERAL), is(Category.LITERAL));
    assertThat(Classifier.classify(Op.ID), is(Category.LEAF));
    assertThat(Classifier.classify(Op.ATTRIBUTE), is(Category.REPORTABLE));
    assertThat(Classifier.classify(Op.CALL), is(Category.REPORTABLE));
    assertThat(Classifier.classify(Op.SUBSCRIPT), is(Category.TRANSPARENT));
    assertThat(Classifier.classify(Op.COMPARE), is(Category.TRANSPARENT));
    assertThat(Classifier.classify(Op.AND), is(Category.TRANSPARENT));
    assertThat(Classifier.classify(Op.LIST), is(Category.TRANSPARENT));
    assertThat(Classifier.classify(Op.LIST_COMP), is(Category.OPAQUE));
    assertThat(Classifier.classify(Op.GENERATOR), is(Category.OPAQUE));
    assertThat(Classifier.classify(Op.LAMBDA), is(Category.OPAQUE));
  }

  /** Every kind of expression has a category; operators and patterns, which
   * occur only inside expressions, do not. */
  @Test void testComplete() {
    final Set<Op> notExpressions =
        ImmutableSet.<Op>builder()
            .add(Op.ID_PAT, Op.TUPLE_PAT, Op.COMP_FOR, Op.KEYWORD)
            .addAll(EnumSet.range(Op.LT, Op.IS_NOT))
            .build();
    for (Op op : Op.values()) {
      if (notExpressions.contains(op)) {
        final IllegalArgumentException e =
            assertThrows(IllegalArgumentException.class,
                () -> Classifier.classify(op));
        assertThat(e.getMessage(), is("not an expression: " + op));
      } else {
        assertThat(Classifier.categories().containsKey(op), is(true));
      }
    }
    assertThat(Classifier.categories().size(),
        is(Op.values().length - notExpressions.size()));
    assertThat(ImmutableList.copyOf(Category.values()).size(), is(5));
  }
}

// End ClassifierTest.java
