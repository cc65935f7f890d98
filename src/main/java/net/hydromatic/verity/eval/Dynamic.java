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
 * Host object that resolves its own attributes.
 *
 * <p>If a value bound in a condition's environment implements this
 * interface, attribute access such as {@code a.y} calls
 * {@link #getAttribute(String)} before trying reflection.
 */
public interface Dynamic {
  /**
   * Returns the value of an attribute, or null if this object has no such
   * attribute. An attribute whose value is None should return
   * {@link Nil#INSTANCE}.
   */
  @Nullable Object getAttribute(String name);

  /** Returns the message of the "AttributeError" thrown when this object
   * has no attribute called {@code name}. */
  default String noAttributeMessage(String name) {
    return "'" + Values.typeName(this) + "' object has no attribute '"
        + name + "'";
  }
}

// End Dynamic.java
