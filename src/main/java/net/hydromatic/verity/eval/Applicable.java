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

import java.util.List;
import java.util.Map;
import net.hydromatic.verity.ast.Pos;

/**
 * A value that can be called.
 *
 * <p>Built-in functions ({@link BuiltIn}), lambdas ({@link Closure}) and
 * methods of host objects ({@link Members.BoundMethod}) are applicable.
 */
public interface Applicable {
  /**
   * Calls this function.
   *
   * @param pos Position of the call, for error messages
   * @param args Positional arguments
   * @param keywords Keyword arguments
   */
  Object apply(Pos pos, List<Object> args, Map<String, Object> keywords);
}

// End Applicable.java
