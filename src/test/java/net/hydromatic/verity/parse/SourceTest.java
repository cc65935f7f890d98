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
package net.hydromatic.verity.parse;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.verity.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests {@link Source} and {@link Parsers}. */
public class SourceTest {
  @Test void testPos() {
    final Source source = Source.of("x < 5 and\n  y > 2");
    final Pos pos = source.pos(0, 1);
    assertThat(pos.toString(), is("1.1"));
    assertThat(source.text(pos), is("x"));
    final Pos pos2 = source.pos(4, 17);
    assertThat(pos2.toString(), is("1.5-2.8"));
    assertThat(source.text(pos2), is("5 and\n  y > 2"));
  }

  /** Positions in a file start at the line where the condition was
   * declared. */
  @Test void testFile() {
    final Source source = Source.of("a.b\n  or c", "Foo.java", 10);
    final Pos pos = source.pos(9, 10);
    assertThat(pos.toString(), is("Foo.java:11.6"));
    assertThat(source.text(pos), is("c"));
    assertThat(source.text(source.pos(0, 3)), is("a.b"));
  }

  @Test void testTextUnavailable() {
    final Source source = Source.of("x < 5", "Foo.java", 1);
    assertThat(source.text(Pos.ZERO), nullValue());
    assertThat(source.text(new Pos("Bar.java", 1, 1, 1, 2)), nullValue());
    assertThat(source.text(new Pos("Foo.java", 3, 1, 3, 2)), nullValue());
    assertThat(source.text(new Pos("Foo.java", 1, 1, 1, 20)), nullValue());
  }

  @Test void testUnquoteString() {
    assertThat(Parsers.unquoteString("'abc'"), is("abc"));
    assertThat(Parsers.unquoteString("\"it's\""), is("it's"));
    assertThat(Parsers.unquoteString("''"), is(""));
    assertThat(Parsers.unquoteString("'a\\tb'"), is("a\tb"));
    assertThat(Parsers.unquoteString("'\\x41\\101'"), is("AA"));
    assertThat(Parsers.unquoteString("'\\'\\\\'"), is("'\\"));
    assertThat(Parsers.unquoteString("'\\d'"), is("\\d"));
    assertThrows(IllegalArgumentException.class,
        () -> Parsers.unquoteString("'abc\""));
  }
}

// End SourceTest.java
