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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The "None" value.
 *
 * <p>Collections and environments cannot hold Java {@code null}, so a
 * {@code null} supplied by the caller is converted to this value when it is
 * bound.
 */
public class Nil implements Comparable<Nil> {
  public static final Nil INSTANCE = new Nil();

  private Nil() {}

  /** Converts Java {@code null} to {@link #INSTANCE}. */
  public static Object of(@Nullable Object o) {
    return o == null ? INSTANCE : o;
  }

  @Override public String toString() {
    return "None";
  }

  @Override public int compareTo(Nil o) {
    return 0;
  }
}

// End Nil.java
