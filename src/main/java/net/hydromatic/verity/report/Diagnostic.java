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
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Explanation of why a condition was false: the text of the condition,
 * and the values of its sub-expressions.
 *
 * @see Formatter */
public class Diagnostic {
  /** Source text of the condition. */
  public final String conditionText;
  public final @Nullable String description;
  /** Entries, sorted by label. */
  public final ImmutableList<ReportEntry> entries;
  /** The formatted message, for example "x &lt; 5: x was 100". */
  public final String message;

  Diagnostic(String conditionText, @Nullable String description,
      List<ReportEntry> entries, String message) {
    this.conditionText = requireNonNull(conditionText);
    this.description = description;
    this.entries = ImmutableList.copyOf(entries);
    this.message = requireNonNull(message);
  }

  @Override public String toString() {
    return message;
  }

  @Override public int hashCode() {
    return message.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Diagnostic
        && message.equals(((Diagnostic) o).message)
        && entries.equals(((Diagnostic) o).entries);
  }
}

// End Diagnostic.java
