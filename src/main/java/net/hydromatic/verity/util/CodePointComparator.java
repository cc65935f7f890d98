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
package net.hydromatic.verity.util;

import java.util.Comparator;

/**
 * Comparator that orders strings by their Unicode code points.
 *
 * <p>{@link String#compareTo(String)} compares UTF-16 code units, and
 * therefore orders a supplementary character (such as an emoji) before a
 * character in the range U+E000 to U+FFFF; this comparator does not. The
 * order does not depend on locale.
 *
 * <p>It is immutable and thread-safe.
 */
public enum CodePointComparator implements Comparator<String> {
  INSTANCE;

  @Override public int compare(String o1, String o2) {
    int i1 = 0;
    int i2 = 0;
    while (i1 < o1.length() && i2 < o2.length()) {
      final int c1 = o1.codePointAt(i1);
      final int c2 = o2.codePointAt(i2);
      if (c1 != c2) {
        return Integer.compare(c1, c2);
      }
      i1 += Character.charCount(c1);
      i2 += Character.charCount(c2);
    }
    if (i1 < o1.length()) {
      return 1;
    }
    if (i2 < o2.length()) {
      return -1;
    }
    return 0;
  }
}

// End CodePointComparator.java
