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

/** How a kind of node takes part in a diagnostic.
 *
 * @see Classifier */
public enum Category {
  /** A constant, such as {@code 5} or {@code 'abc'}. Never reported, and has
   * no children. */
  LITERAL,

  /** A name, such as {@code x}. Reports its value. */
  LEAF,

  /** An operator or display, such as {@code x < 5} or {@code lst[1]}. Not
   * reported, but its operands are searched for reportable nodes. */
  TRANSPARENT,

  /** An attribute or call, such as {@code a.y} or {@code f(x)}. Reports its
   * value, and its operands are searched too, except operands that are
   * comprehensions. */
  REPORTABLE,

  /** A comprehension or lambda. Reports its value as a whole; the names it
   * binds and the expressions that use them are never searched. */
  OPAQUE
}

// End Category.java
