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
package net.hydromatic.verity.ast;

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.Attribute attribute) {
    attribute.exp.accept(this);
  }

  protected void visit(Ast.Subscript subscript) {
    subscript.exp.accept(this);
    subscript.index.accept(this);
  }

  protected void visit(Ast.Slice slice) {
    slice.forEachArg((arg, i) -> arg.accept(this));
  }

  protected void visit(Ast.If anIf) {
    anIf.ifTrue.accept(this);
    anIf.condition.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Ast.Lambda lambda) {
    lambda.params.forEach(this::accept);
    lambda.body.accept(this);
  }

  // calls

  protected void visit(Ast.Call call) {
    call.fn.accept(this);
    call.args.forEach(this::accept);
    call.keywords.forEach(this::accept);
  }

  protected void visit(Ast.Keyword keyword) {
    keyword.exp.accept(this);
  }

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.PrefixCall prefixCall) {
    prefixCall.a.accept(this);
  }

  protected void visit(Ast.Compare compare) {
    compare.args.forEach(this::accept);
  }

  // displays

  protected void visit(Ast.Tuple tuple) {
    tuple.args.forEach(this::accept);
  }

  protected void visit(Ast.ListExp list) {
    list.args.forEach(this::accept);
  }

  protected void visit(Ast.SetExp set) {
    set.args.forEach(this::accept);
  }

  protected void visit(Ast.DictExp dict) {
    dict.forEachArg((arg, i) -> arg.accept(this));
  }

  // comprehensions

  protected void visit(Ast.Comprehension comprehension) {
    comprehension.element.accept(this);
    if (comprehension.value != null) {
      comprehension.value.accept(this);
    }
    comprehension.fors.forEach(this::accept);
  }

  protected void visit(Ast.CompFor compFor) {
    compFor.pat.accept(this);
    compFor.iterable.accept(this);
    compFor.conditions.forEach(this::accept);
  }

  // patterns

  protected void visit(Ast.IdPat idPat) {}

  protected void visit(Ast.TuplePat tuplePat) {
    tuplePat.args.forEach(this::accept);
  }
}

// End Visitor.java
