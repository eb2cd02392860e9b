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
package net.hydromatic.comprehend.ast;

/**
 * Visits syntax trees.
 *
 * <p>Each method visits the children of its node. Override a method to do
 * something on a particular kind of node; call {@code super} to keep visiting
 * its children.
 */
public class Visitor {
  public void visit(Ast.IdPat idPat) {}

  public void visit(Ast.WildcardPat wildcardPat) {}

  public void visit(Ast.TuplePat tuplePat) {
    tuplePat.args.forEach(arg -> arg.accept(this));
  }

  public void visit(Ast.TypePat typePat) {}

  public void visit(Ast.VarPat varPat) {}

  public void visit(Ast.Id id) {}

  public void visit(Ast.Literal literal) {}

  public void visit(Ast.Tuple tuple) {
    tuple.args.forEach(arg -> arg.accept(this));
  }

  public void visit(Ast.ListExp list) {
    list.args.forEach(arg -> arg.accept(this));
  }

  public void visit(Ast.Field field) {
    field.exp.accept(this);
  }

  public void visit(Ast.Call call) {
    call.args.forEach(arg -> arg.accept(this));
  }

  public void visit(Ast.If if_) {
    if_.condition.accept(this);
    if_.ifTrue.accept(this);
    if_.ifFalse.accept(this);
  }

  public void visit(Ast.Is is) {
    is.exp.accept(this);
    is.pat.accept(this);
  }

  public void visit(Ast.TryParse tryParse) {
    tryParse.exp.accept(this);
  }
}

// End Visitor.java
