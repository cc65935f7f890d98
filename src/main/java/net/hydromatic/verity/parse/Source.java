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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.verity.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Text of a condition, with the file and line it came from.
 *
 * <p>Converts between offsets into the text and {@link Pos} values, so that
 * the exact text of any parsed node can be recovered.
 */
public class Source {
  public final String text;
  public final String file;
  /** Line number of the first line of {@link #text}; usually 1. */
  public final int firstLine;

  private Source(String text, String file, int firstLine) {
    this.text = requireNonNull(text);
    this.file = requireNonNull(file);
    this.firstLine = firstLine;
    checkArgument(firstLine >= 1, "firstLine must be positive: %s",
        firstLine);
  }

  /** Creates a Source with no file name. */
  public static Source of(String text) {
    return new Source(text, "", 1);
  }

  /** Creates a Source that starts at a given line of a given file. */
  public static Source of(String text, String file, int firstLine) {
    return new Source(text, file, firstLine);
  }

  /** Returns the position spanning two offsets; {@code end} is exclusive. */
  public Pos pos(int start, int end) {
    final Pos p = Pos.of(text, file, start, end);
    if (firstLine == 1) {
      return p;
    }
    return new Pos(file, p.startLine + firstLine - 1, p.startColumn,
        p.endLine + firstLine - 1, p.endColumn);
  }

  /**
   * Returns the text covered by a position, or null if the position does not
   * lie within this source.
   */
  public @Nullable String text(Pos pos) {
    if (!pos.isKnown() || !pos.file.equals(file)) {
      return null;
    }
    final int start = offset(pos.startLine, pos.startColumn);
    final int end = offset(pos.endLine, pos.endColumn);
    if (start < 0 || end < start) {
      return null;
    }
    return text.substring(start, end);
  }

  /** Returns the offset of a line and column, or -1 if out of range. */
  private int offset(int line, int column) {
    int remaining = line - firstLine;
    if (remaining < 0 || column < 1) {
      return -1;
    }
    int lineStart = 0;
    while (remaining > 0) {
      final int i = text.indexOf('\n', lineStart);
      if (i < 0) {
        return -1;
      }
      lineStart = i + 1;
      --remaining;
    }
    final int lineEnd = text.indexOf('\n', lineStart);
    final int offset = lineStart + column - 1;
    if (offset > (lineEnd < 0 ? text.length() : lineEnd)) {
      return -1;
    }
    return offset;
  }

  @Override public String toString() {
    return text;
  }
}

// End Source.java
