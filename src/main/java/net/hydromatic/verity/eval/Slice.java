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

import java.util.Objects;
import net.hydromatic.verity.ast.Pos;

/**
 * Slice value, the result of evaluating "1:5:2" within a subscript.
 *
 * <p>Each of the bounds is either an integer or {@link Nil#INSTANCE}.
 */
public class Slice {
  public final Object start;
  public final Object stop;
  public final Object step;

  Slice(Object start, Object stop, Object step) {
    this.start = requireNonNull(start);
    this.stop = requireNonNull(stop);
    this.step = requireNonNull(step);
  }

  @Override public int hashCode() {
    return Objects.hash(start, stop, step);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Slice
        && start.equals(((Slice) o).start)
        && stop.equals(((Slice) o).stop)
        && step.equals(((Slice) o).step);
  }

  @Override public String toString() {
    return Printer.UNLIMITED.repr(this);
  }

  /**
   * Computes the start, stop and step of this slice applied to a sequence of
   * a given length.
   *
   * <p>Negative bounds count from the end of the sequence, and bounds are
   * clipped to the sequence, so that the result is always valid.
   */
  int[] indices(Pos pos, int length) {
    final int step = this.step == Nil.INSTANCE ? 1 : bound(pos, this.step);
    if (step == 0) {
      throw new EvalException(EvalException.Kind.VALUE_ERROR,
          "slice step cannot be zero", pos);
    }
    final int lower = step < 0 ? -1 : 0;
    final int upper = step < 0 ? length - 1 : length;
    final int start = this.start == Nil.INSTANCE
        ? (step < 0 ? upper : lower)
        : clip(bound(pos, this.start), length, lower, upper);
    final int stop = this.stop == Nil.INSTANCE
        ? (step < 0 ? lower : upper)
        : clip(bound(pos, this.stop), length, lower, upper);
    return new int[] {start, stop, step};
  }

  private static int bound(Pos pos, Object o) {
    if (!Values.isIntegral(o)) {
      throw new EvalException(EvalException.Kind.TYPE_ERROR,
          "slice indices must be integers or None", pos);
    }
    final long v = Values.toLong(pos, o);
    return (int) Math.max(Integer.MIN_VALUE + 1,
        Math.min(Integer.MAX_VALUE, v));
  }

  private static int clip(int i, int length, int lower, int upper) {
    if (i < 0) {
      i += length;
      return Math.max(i, lower);
    }
    return Math.min(i, upper);
  }
}

// End Slice.java
