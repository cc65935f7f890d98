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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("printLength"), is(Prop.PRINT_LENGTH));
    assertThat(Prop.lookup("PRINT_LENGTH"), is(Prop.PRINT_LENGTH));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("printWidth"));
    assertThat(e.getMessage(), is("property printWidth not found"));
    assertThat(Prop.BY_NAME.size(), is(Prop.values().length * 2));
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThat(Prop.ENABLED.booleanValue(map), is(true));
    assertThat(Prop.PRINT_DEPTH.intValue(map), is(6));
    assertThat(Prop.PRINT_LENGTH.intValue(map), is(50));
    assertThat(Prop.STRING_DEPTH.intValue(map), is(256));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.PRINT_LENGTH.set(map, 10);
    assertThat(Prop.PRINT_LENGTH.intValue(map), is(10));
    assertThat(Prop.PRINT_DEPTH.intValue(map), is(6));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.PRINT_LENGTH.set(map, "10"));
    assertThat(e.getMessage(),
        is("value for property printLength must have type Integer"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.ENABLED.set(map, null));
    assertThat(e2.getMessage(), is("property enabled is required"));
    final IllegalArgumentException e3 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.PRINT_LENGTH.booleanValue(map));
    assertThat(e3.getMessage(),
        is("invalid type class java.lang.Integer for property printLength"));
  }

  /** Values from a configuration file are strings. */
  @Test void testSetLenient() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.PRINT_DEPTH.setLenient(map, " 3 ");
    assertThat(Prop.PRINT_DEPTH.intValue(map), is(3));
    Prop.ENABLED.setLenient(map, "FALSE");
    assertThat(Prop.ENABLED.booleanValue(map), is(false));
    Prop.ENABLED.setLenient(map, true);
    assertThat(Prop.ENABLED.booleanValue(map), is(true));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.PRINT_DEPTH.setLenient(map, "deep"));
    assertThat(e.getMessage(),
        is("value for property printDepth must be an integer: deep"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.ENABLED.setLenient(map, "yes"));
    assertThat(e2.getMessage(),
        is("value for property enabled must be true or false: yes"));
  }
}

// End PropTest.java
