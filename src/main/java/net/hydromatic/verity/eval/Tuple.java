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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.AbstractList;
import java.util.List;

/**
 * Tuple value.
 *
 * <p>An immutable list that is not equal to a list with the same elements,
 * so that {@code (1, 2) == [1, 2]} is false.
 */
public class Tuple extends AbstractList<Object> {
  public static final Tuple EMPTY = new Tuple(ImmutableList.of());

  private final ImmutableList<Object> list;

  private Tuple(ImmutableList<Object> list) {
    this.list = requireNonNull(list);
  }

  /** Creates a tuple. */
  public static Tuple of(Object... elements) {
    return copyOf(ImmutableList.copyOf(elements));
  }

  /** Creates a tuple with the contents of a list. */
  public static Tuple copyOf(List<?> elements) {
    return elements.isEmpty()
        ? EMPTY
        : new Tuple(ImmutableList.copyOf(elements));
  }

  @Override public Object get(int index) {
    return list.get(index);
  }

  @Override public int size() {
    return list.size();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Tuple
        && list.equals(((Tuple) o).list);
  }

  @Override public int hashCode() {
    return list.hashCode();
  }

  @Override public String toString() {
    return Printer.UNLIMITED.repr(this);
  }
}

// End Tuple.java
