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

import java.util.AbstractList;

/**
 * Value of the "range" built-in function; an immutable sequence of
 * integers whose elements are computed on demand.
 */
public class Range extends AbstractList<Object> {
  final long start;
  final long stop;
  final long step;
  private final int size;

  Range(long start, long stop, long step) {
    this.start = start;
    this.stop = stop;
    this.step = step;
    final long n;
    if (step > 0) {
      n = start < stop ? (stop - start - 1) / step + 1 : 0;
    } else {
      n = start > stop ? (start - stop - 1) / -step + 1 : 0;
    }
    this.size = (int) Math.min(n, Integer.MAX_VALUE);
  }

  @Override public Object get(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("index " + index);
    }
    return start + index * step;
  }

  @Override public int size() {
    return size;
  }

  @Override public String toString() {
    return Printer.UNLIMITED.repr(this);
  }
}

// End Range.java
