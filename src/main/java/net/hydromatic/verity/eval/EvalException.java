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

import static java.util.Objects.requireNonNull;

import net.hydromatic.verity.ast.Pos;
import net.hydromatic.verity.util.VerityException;

/**
 * Exception thrown while evaluating a condition.
 *
 * <p>Each exception has a {@link Kind}, corresponding to one of the
 * exception classes of the expression language, such as "NameError".
 */
public class EvalException extends RuntimeException
    implements VerityException {
  public final Kind kind;
  private final Pos pos;

  /** Creates an EvalException. */
  public EvalException(Kind kind, String message, Pos pos) {
    super(kind.pythonName + ": " + message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  /** Creates an EvalException that wraps a checked exception thrown by a
   * host method. */
  public EvalException(Exception cause, Pos pos) {
    super(Kind.EXCEPTION.pythonName + ": " + cause, cause);
    this.kind = Kind.EXCEPTION;
    this.pos = requireNonNull(pos);
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(": ").append(getMessage());
  }

  /** Kinds of evaluation error. */
  public enum Kind {
    NAME_ERROR("NameError"),
    ATTRIBUTE_ERROR("AttributeError"),
    INDEX_ERROR("IndexError"),
    KEY_ERROR("KeyError"),
    TYPE_ERROR("TypeError"),
    VALUE_ERROR("ValueError"),
    ZERO_DIVISION_ERROR("ZeroDivisionError"),
    OVERFLOW_ERROR("OverflowError"),
    /** A checked exception thrown by a host method. */
    EXCEPTION("Exception");

    public final String pythonName;

    Kind(String pythonName) {
      this.pythonName = pythonName;
    }
  }
}

// End EvalException.java
