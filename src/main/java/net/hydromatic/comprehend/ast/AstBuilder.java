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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.comprehend.eval.Unit;
import net.hydromatic.comprehend.type.ListType;
import net.hydromatic.comprehend.type.PrimitiveType;
import net.hydromatic.comprehend.type.TupleType;
import net.hydromatic.comprehend.type.Type;
import net.hydromatic.comprehend.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds expressions and patterns. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  private final Ast.Literal trueLiteral =
      new Ast.Literal(Op.BOOL_LITERAL, PrimitiveType.BOOL, true);

  private final Ast.Literal falseLiteral =
      new Ast.Literal(Op.BOOL_LITERAL, PrimitiveType.BOOL, false);

  /** Creates a reference to a variable. */
  public Ast.Id id(String name, Type type) {
    return new Ast.Id(type, name);
  }

  /** Creates a {@code boolean} literal. */
  public Ast.Literal boolLiteral(boolean b) {
    return b ? trueLiteral : falseLiteral;
  }

  /** Creates an {@code int} literal. */
  public Ast.Literal intLiteral(int value) {
    return new Ast.Literal(Op.INT_LITERAL, PrimitiveType.INT, value);
  }

  /** Creates a {@code real} literal. */
  public Ast.Literal realLiteral(double value) {
    return new Ast.Literal(Op.REAL_LITERAL, PrimitiveType.REAL, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(String value) {
    return new Ast.Literal(Op.STRING_LITERAL, PrimitiveType.STRING, value);
  }

  /** Creates a unit literal. */
  public Ast.Literal unitLiteral() {
    return new Ast.Literal(Op.UNIT_LITERAL, PrimitiveType.UNIT, Unit.INSTANCE);
  }

  /** Creates a tuple. */
  public Ast.Tuple tuple(TypeSystem typeSystem, Ast.Exp... args) {
    return tuple(typeSystem, ImmutableList.copyOf(args));
  }

  /** Creates a tuple. */
  public Ast.Tuple tuple(TypeSystem typeSystem, List<? extends Ast.Exp> args) {
    final ImmutableList<Ast.Exp> argList = ImmutableList.copyOf(args);
    final ImmutableList.Builder<Type> argTypes = ImmutableList.builder();
    argList.forEach(arg -> argTypes.add(arg.type));
    return new Ast.Tuple(typeSystem.tupleType(argTypes.build()), argList);
  }

  /** Creates a list. */
  public Ast.ListExp list(
      TypeSystem typeSystem, Type elementType, Ast.Exp... args) {
    return new Ast.ListExp(
        typeSystem.listType(elementType), ImmutableList.copyOf(args));
  }

  /** Creates an expression that extracts the {@code i}th component. */
  public Ast.Field field(Ast.Exp exp, int i) {
    checkArgument(exp.type instanceof TupleType, "not a tuple: %s", exp);
    final TupleType tupleType = (TupleType) exp.type;
    return new Ast.Field(tupleType.argType(i), exp, i);
  }

  /** Creates a call to a binary operator. */
  public Ast.Call call(Op op, Ast.Exp a0, Ast.Exp a1) {
    final Type type;
    switch (op) {
    case ANDALSO:
    case ORELSE:
    case LE:
    case LT:
    case GE:
    case GT:
    case EQ:
    case NE:
      type = PrimitiveType.BOOL;
      break;
    case CARET:
      type = PrimitiveType.STRING;
      break;
    case PLUS:
    case MINUS:
    case TIMES:
    case DIVIDE:
      type = a0.type;
      break;
    default:
      throw new IllegalArgumentException("not a binary operator: " + op);
    }
    return new Ast.Call(op, type, ImmutableList.of(a0, a1));
  }

  public Ast.Call plus(Ast.Exp a0, Ast.Exp a1) {
    return call(Op.PLUS, a0, a1);
  }

  public Ast.Call minus(Ast.Exp a0, Ast.Exp a1) {
    return call(Op.MINUS, a0, a1);
  }

  public Ast.Call times(Ast.Exp a0, Ast.Exp a1) {
    return call(Op.TIMES, a0, a1);
  }

  public Ast.Call lessThan(Ast.Exp a0, Ast.Exp a1) {
    return call(Op.LT, a0, a1);
  }

  public Ast.Call greaterThan(Ast.Exp a0, Ast.Exp a1) {
    return call(Op.GT, a0, a1);
  }

  public Ast.Call equal(Ast.Exp a0, Ast.Exp a1) {
    return call(Op.EQ, a0, a1);
  }

  public Ast.Call andAlso(Ast.Exp a0, Ast.Exp a1) {
    return call(Op.ANDALSO, a0, a1);
  }

  public Ast.Call orElse(Ast.Exp a0, Ast.Exp a1) {
    return call(Op.ORELSE, a0, a1);
  }

  /** Creates a call to "not". */
  public Ast.Call not(Ast.Exp a0) {
    return new Ast.Call(Op.NOT, PrimitiveType.BOOL, ImmutableList.of(a0));
  }

  /** Creates a conditional expression. */
  public Ast.If if_(Ast.Exp condition, Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return new Ast.If(ifTrue.type, condition, ifTrue, ifFalse);
  }

  /** Creates a type test that binds a variable, "e is int i". */
  public Ast.Is isType(Ast.Exp exp, Type type, @Nullable String name) {
    return new Ast.Is(exp, new Ast.TypePat(type, name));
  }

  /** Creates a type test that binds nothing, "e is int". */
  public Ast.Is isType(Ast.Exp exp, Type type) {
    return isType(exp, type, null);
  }

  /** Creates an irrefutable test, "e is var x". */
  public Ast.Is isVar(Ast.Exp exp, String name) {
    return new Ast.Is(exp, new Ast.VarPat(exp.type, name));
  }

  /** Creates a call to a try-parse function, "int.tryParse(s, out i)". */
  public Ast.TryParse tryParse(
      PrimitiveType targetType, Ast.Exp exp, String name) {
    return new Ast.TryParse(targetType, exp, name);
  }

  /** Creates a named pattern. */
  public Ast.IdPat idPat(String name, Type type) {
    return new Ast.IdPat(type, name);
  }

  /** Creates a wildcard pattern. */
  public Ast.WildcardPat wildcardPat(Type type) {
    return new Ast.WildcardPat(type);
  }

  /** Creates a tuple pattern. */
  public Ast.TuplePat tuplePat(TypeSystem typeSystem, Ast.Pat... args) {
    return tuplePat(typeSystem, ImmutableList.copyOf(args));
  }

  /** Creates a tuple pattern. */
  public Ast.TuplePat tuplePat(
      TypeSystem typeSystem, List<? extends Ast.Pat> args) {
    final ImmutableList<Ast.Pat> argList = ImmutableList.copyOf(args);
    final ImmutableList.Builder<Type> argTypes = ImmutableList.builder();
    argList.forEach(arg -> argTypes.add(arg.type));
    return new Ast.TuplePat(typeSystem.tupleType(argTypes.build()), argList);
  }

  /** Returns the element type of a list type. */
  public Type elementType(Ast.Exp exp) {
    checkArgument(exp.type instanceof ListType, "not a list: %s", exp);
    return ((ListType) exp.type).elementType;
  }
}

// End AstBuilder.java
