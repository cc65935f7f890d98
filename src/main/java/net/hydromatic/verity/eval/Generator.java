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

import java.util.Iterator;

/**
 * Value of a generator expression.
 *
 * <p>Elements are computed lazily, one at a time, as the generator is
 * consumed. As in Python, a generator can be consumed only once; every call
 * to {@link #iterator()} returns the same iterator.
 */
public class Generator implements Iterable<Object> {
  private final Iterator<Object> iterator;

  Generator(Iterator<Object> iterator) {
    this.iterator = requireNonNull(iterator);
  }

  @Override public Iterator<Object> iterator() {
    return iterator;
  }

  @Override public String toString() {
    return "<generator object <genexpr>>";
  }
}

// End Generator.java
