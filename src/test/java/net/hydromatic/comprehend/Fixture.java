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
package net.hydromatic.comprehend;

import static net.hydromatic.comprehend.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.ChainBuilder;
import net.hydromatic.comprehend.compile.ChainCompiler;
import net.hydromatic.comprehend.compile.Prop;
import net.hydromatic.comprehend.compile.RestrictionPolicy;
import net.hydromatic.comprehend.compile.Tracer;
import net.hydromatic.comprehend.compile.Tracers;
import net.hydromatic.comprehend.type.ListType;
import net.hydromatic.comprehend.type.PrimitiveType;
import net.hydromatic.comprehend.type.TupleType;
import net.hydromatic.comprehend.type.TypeSystem;

/** Types, expressions and builders shared by tests. */
public class Fixture {
  public final TypeSystem typeSystem = new TypeSystem();

  public final PrimitiveType intType = PrimitiveType.INT;
  public final PrimitiveType stringType = PrimitiveType.STRING;
  public final PrimitiveType objType = PrimitiveType.OBJ;
  public final ListType intListType = typeSystem.listType(intType);
  public final ListType objListType = typeSystem.listType(objType);
  public final TupleType intPairType = typeSystem.tupleType(intType, intType);

  /** "objs", an outer variable of type "obj list". */
  public final Ast.Id objs = ast.id("objs", objListType);

  /** "o", a variable of type "obj". */
  public final Ast.Id o = ast.id("o", objType);
  public final Ast.Id s = ast.id("s", stringType);
  public final Ast.Id i = ast.id("i", intType);
  public final Ast.Id x = ast.id("x", intType);
  public final Ast.Id y = ast.id("y", intType);

  public Ast.Literal intLiteral(int value) {
    return ast.intLiteral(value);
  }

  public Ast.Literal stringLiteral(String value) {
    return ast.stringLiteral(value);
  }

  /** Creates a list of string literals. */
  public Ast.ListExp strings(String... values) {
    final List<Ast.Exp> exps = new ArrayList<>();
    for (String value : values) {
      exps.add(ast.stringLiteral(value));
    }
    return ast.list(typeSystem, stringType, exps.toArray(new Ast.Exp[0]));
  }

  /** Creates a list of int literals. */
  public Ast.ListExp ints(int... values) {
    final List<Ast.Exp> exps = new ArrayList<>();
    for (int value : values) {
      exps.add(ast.intLiteral(value));
    }
    return ast.list(typeSystem, intType, exps.toArray(new Ast.Exp[0]));
  }

  /** Creates a list of pairs of int literals. */
  public Ast.ListExp intPairs(int... values) {
    final List<Ast.Exp> exps = new ArrayList<>();
    for (int k = 0; k < values.length; k += 2) {
      exps.add(
          ast.tuple(
              typeSystem,
              ast.intLiteral(values[k]),
              ast.intLiteral(values[k + 1])));
    }
    return ast.list(typeSystem, intPairType, exps.toArray(new Ast.Exp[0]));
  }

  public ChainBuilder builder() {
    return new ChainBuilder(typeSystem);
  }

  /** Returns properties with a given restriction policy. */
  public static Map<Prop, Object> props(RestrictionPolicy policy) {
    return ImmutableMap.of(Prop.RESTRICTION_POLICY, policy);
  }

  public ChainCompiler compiler(RestrictionPolicy policy) {
    return compiler(policy, Tracers.empty());
  }

  public ChainCompiler compiler(RestrictionPolicy policy, Tracer tracer) {
    return new ChainCompiler(props(policy), tracer);
  }
}

// End Fixture.java
