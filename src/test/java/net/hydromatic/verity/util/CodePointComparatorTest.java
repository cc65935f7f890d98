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
package net.hydromatic.verity.util;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests {@link CodePointComparator}. */
public class CodePointComparatorTest {
  @Test void testCompare() {
    final CodePointComparator c = CodePointComparator.INSTANCE;
    assertThat(c.compare("a", "a"), is(0));
    assertThat(c.compare("a", "b") < 0, is(true));
    assertThat(c.compare("B", "a") < 0, is(true));
    assertThat(c.compare("a", "a.y") < 0, is(true));
    assertThat(c.compare("a.y", "a") > 0, is(true));
    assertThat(c.compare("", "") == 0, is(true));
  }

  /** Differs from {@link String#compareTo} for supplementary characters. */
  @Test void testSupplementary() {
    final String smiley = new String(Character.toChars(0x1F600));
    final String fullWidthA = "Ａ";
    assertThat(smiley.compareTo(fullWidthA) < 0, is(true));
    assertThat(CodePointComparator.INSTANCE.compare(smiley, fullWidthA) > 0,
        is(true));

    final List<String> sorted =
        Ordering.from(CodePointComparator.INSTANCE)
            .sortedCopy(Arrays.asList(smiley, "z", fullWidthA, "Z"));
    assertThat(sorted, is(Arrays.asList("Z", "z", fullWidthA, smiley)));
  }
}

// End CodePointComparatorTest.java
