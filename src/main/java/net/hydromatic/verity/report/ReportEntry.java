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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.verity.ast.Pos;
import net.hydromatic.verity.eval.Printer;

/** The value of one sub-expression of a failed condition, labeled with the
 * source text of that sub-expression. */
public class ReportEntry {
  /** Source text of the sub-expression, for example "a.y". */
  public final String label;
  /** Value of the sub-expression; {@code Nil.INSTANCE} for None. */
  public final Object value;
  /** Position of the first node that has this label. */
  public final Pos pos;

  public ReportEntry(String label, Object value, Pos pos) {
    this.label = requireNonNull(label);
    this.value = requireNonNull(value);
    this.pos = requireNonNull(pos);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder(), Printer.UNLIMITED).toString();
  }

  @Override public int hashCode() {
    return Objects.hash(label, value);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof ReportEntry
        && label.equals(((ReportEntry) o).label)
        && value.equals(((ReportEntry) o).value);
  }

  /** Appends "label was value" to a buffer. */
  public StringBuilder describeTo(StringBuilder buf, Printer printer) {
    buf.append(label).append(" was ");
    return printer.repr(buf, value);
  }
}

// End ReportEntry.java
