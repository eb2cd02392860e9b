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
package net.hydromatic.comprehend.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.comprehend.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Predicate;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.Clause;
import net.hydromatic.comprehend.ast.VariableBinding;
import net.hydromatic.comprehend.type.TupleType;
import net.hydromatic.comprehend.type.Type;
import net.hydromatic.comprehend.util.Static;

/**
 * Expands the binding pattern of a "from" or "let" clause into one
 * extraction per live variable.
 *
 * <p>All extractions read the same binder, so the translator can bind every
 * variable of the pattern in a single stage. The pattern is checked against
 * the type of the value even if none of its variables are live.
 */
public class DeconstructionExpander {
  private final Clause clause;
  private final Predicate<VariableBinding> live;
  private final ImmutableList.Builder<Extraction> extractions =
      ImmutableList.builder();

  private DeconstructionExpander(
      Clause clause, Predicate<VariableBinding> live) {
    this.clause = requireNonNull(clause);
    this.live = requireNonNull(live);
  }

  /**
   * Expands the pattern of a clause.
   *
   * @param clause Clause whose pattern to expand
   * @param type Type of each value bound to the pattern
   * @param binder Name of the variable that holds the value
   * @param live Whether a variable is read after the clause
   * @throws CompileException of kind {@code ARITY_MISMATCH} if a tuple
   *     pattern does not match the shape of the value
   */
  public static ImmutableList<Extraction> expand(
      Clause clause,
      Type type,
      String binder,
      Predicate<VariableBinding> live) {
    final DeconstructionExpander expander =
        new DeconstructionExpander(clause, live);
    expander.expand(
        requireNonNull(clause.pat), type, ast.id(binder, type),
        ImmutableList.of());
    return expander.extractions.build();
  }

  private void expand(
      Ast.Pat pat, Type type, Ast.Exp exp, List<Integer> path) {
    switch (pat.op) {
    case ID_PAT:
      final VariableBinding binding = binding(((Ast.IdPat) pat).name);
      if (live.test(binding)) {
        extractions.add(
            new Extraction(binding, ImmutableList.copyOf(path), exp));
      }
      return;

    case WILDCARD_PAT:
      return;

    case TUPLE_PAT:
      final Ast.TuplePat tuplePat = (Ast.TuplePat) pat;
      if (!(type instanceof TupleType)) {
        throw arityMismatch(
            "pattern " + pat + " has arity " + tuplePat.arity()
                + " but value has type " + type.moniker());
      }
      final TupleType tupleType = (TupleType) type;
      if (tupleType.arity() != tuplePat.arity()) {
        throw arityMismatch(
            "pattern " + pat + " has arity " + tuplePat.arity()
                + " but value has arity " + tupleType.arity());
      }
      for (int i = 0; i < tuplePat.arity(); i++) {
        expand(
            tuplePat.args.get(i),
            tupleType.argType(i),
            ast.field(exp, i),
            Static.append(path, i));
      }
      return;

    default:
      throw new AssertionError("not a binding pattern: " + pat);
    }
  }

  private VariableBinding binding(String name) {
    for (VariableBinding binding : clause.rangeVariables()) {
      if (binding.name.equals(name)) {
        return binding;
      }
    }
    throw new AssertionError("no binding for " + name + " in " + clause);
  }

  private CompileException arityMismatch(String message) {
    return CompileException.of(
        CompileException.Kind.ARITY_MISMATCH, clause, null, message);
  }
}

// End DeconstructionExpander.java
