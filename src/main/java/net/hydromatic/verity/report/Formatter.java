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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.List;
import net.hydromatic.verity.eval.Printer;
import net.hydromatic.verity.util.CodePointComparator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Converts a condition and the values of its sub-expressions into a
 * {@link Diagnostic}.
 *
 * <p>Entries are sorted by label, comparing code points, so that the message
 * does not depend on the order in which sub-expressions were visited. The
 * message has one of three layouts:
 *
 * <ul>
 *   <li>no entries: {@code condition[: description]};
 *   <li>one entry, and the condition fits on one line:
 *       {@code condition[: description]: label was value};
 *   <li>otherwise: {@code condition[: description]:} followed by one line
 *       {@code label was value} per entry.
 * </ul>
 */
public class Formatter {
  private static final Ordering<ReportEntry> ORDERING =
      Ordering.from(CodePointComparator.INSTANCE)
          .onResultOf(entry -> requireNonNull(entry).label);

  private final Printer printer;

  public Formatter(Printer printer) {
    this.printer = requireNonNull(printer);
  }

  /** Formats a diagnostic. */
  public Diagnostic format(String conditionText, @Nullable String description,
      List<ReportEntry> entries) {
    final ImmutableList<ReportEntry> sortedEntries =
        ORDERING.immutableSortedCopy(entries);
    final StringBuilder buf = new StringBuilder(conditionText);
    if (description != null) {
      buf.append(": ").append(description);
    }
    if (sortedEntries.size() == 1 && conditionText.indexOf('\n') < 0) {
      buf.append(": ");
      sortedEntries.get(0).describeTo(buf, printer);
    } else if (!sortedEntries.isEmpty()) {
      buf.append(':');
      for (ReportEntry entry : sortedEntries) {
        buf.append('\n');
        entry.describeTo(buf, printer);
      }
    }
    return new Diagnostic(conditionText, description, sortedEntries,
        buf.toString());
  }
}

// End Formatter.java
