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
package net.hydromatic.verity;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.verity.eval.Dynamic;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Values captured by the snapshots of a contract before a method call.
 *
 * <p>{@link Contract#checkResult(java.util.Map, Object, OldValues)} binds
 * it to the name {@code OLD}, and a postcondition reads a value as
 * {@code OLD.name}.
 */
public final class OldValues implements Dynamic {
  static final OldValues EMPTY = new OldValues(ImmutableMap.of());

  private final ImmutableMap<String, Object> values;

  OldValues(ImmutableMap<String, Object> values) {
    this.values = values;
  }

  /** Returns the names of the captured values, in the order that the
   * snapshots were added to the contract. */
  public Iterable<String> names() {
    return values.keySet();
  }

  @Override public @Nullable Object getAttribute(String name) {
    return values.get(name);
  }

  @Override public String noAttributeMessage(String name) {
    return "The snapshot with the name '" + name
        + "' is not available in the OLD of a postcondition."
        + " Have you added a corresponding snapshot to the contract?";
  }

  @Override public String toString() {
    return "a bunch of OLD values";
  }
}

// End OldValues.java
