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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.verity.ast.Pos;
import net.hydromatic.verity.eval.Printer;
import net.hydromatic.verity.eval.Tuple;
import org.junit.jupiter.api.Test;

/** Tests {@link Formatter}. */
public class FormatterTest {
  private static final Formatter FORMATTER =
      new Formatter(Printer.UNLIMITED);

  private static ReportEntry entry(String label, Object value) {
    return new ReportEntry(label, value, Pos.ZERO);
  }

  @Test void testNoEntries() {
    final Diagnostic d = FORMATTER.format("1 > 2", null, ImmutableList.of());
    assertThat(d.message, is("1 > 2"));
    assertThat(d.toString(), is("1 > 2"));
    assertThat(d.entries.isEmpty(), is(true));
    assertThat(FORMATTER.format("1 > 2", "impossible", ImmutableList.of())
            .message,
        is("1 > 2: impossible"));
  }

  @Test void testOneEntry() {
    final List<ReportEntry> entries = ImmutableList.of(entry("x", 100L));
    assertThat(FORMATTER.format("x < 5", null, entries).message,
        is("x < 5: x was 100"));
    assertThat(FORMATTER.format("x < 5", "small", entries).message,
        is("x < 5: small: x was 100"));
    assertThat(FORMATTER.format("x < 5\n  and True", null, entries).message,
        is("x < 5\n  and True:\nx was 100"));
  }

  @Test void testSeveralEntries() {
    final List<ReportEntry> entries =
        ImmutableList.of(entry("y", "b"), entry("x", Tuple.of(1L, 2L)),
            entry("a.b", Arrays.asList(1)));
    final Diagnostic d = FORMATTER.format("x > y", "desc", entries);
    assertThat(d.message,
        is("x > y: desc:\n"
            + "a.b was [1]\n"
            + "x was (1, 2)\n"
            + "y was 'b'"));
    assertThat(d.conditionText, is("x > y"));
    assertThat(d.description, is("desc"));
    assertThat(d.entries.get(0).label, is("a.b"));
    assertThat(d.entries.get(2).label, is("y"));
  }

  /** Labels are compared by code point, not by UTF-16 char; a supplementary
   * character sorts after U+FF21. */
  @Test void testSortByCodePoint() {
    final String smiley = new String(Character.toChars(0x1F600));
    final List<ReportEntry> entries =
        ImmutableList.of(entry(smiley, 1L), entry("\uFF21", 2L),
            entry("Z", 3L), entry("a", 4L));
    assertThat(FORMATTER.format("c", null, entries).message,
        is("c:\n"
            + "Z was 3\n"
            + "a was 4\n"
            + "\uFF21 was 2\n"
            + smiley + " was 1"));
  }

  @Test void testPrinter() {
    final Formatter formatter = new Formatter(new Printer(1, -1, -1));
    assertThat(
        formatter.format("len(x) == 0", null,
            ImmutableList.of(entry("x", Arrays.asList(1, 2)))).message,
        is("len(x) == 0: x was [1, ...]"));
  }
}

// End FormatterTest.java
