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

import static com.google.common.base.Verify.verify;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.comprehend.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.Clause;
import net.hydromatic.comprehend.ast.Op;
import net.hydromatic.comprehend.ast.VariableBinding;

/**
 * Translates the clauses of a chain into combinators.
 *
 * <p>Each clause becomes one or more stages, in clause order:
 *
 * <ul>
 *   <li>"from p in e" becomes a flat-map over {@code e};
 *   <li>"let p = e" becomes a map;
 *   <li>"where c" and "takeWhile c" become a filter (or take-while) on
 *       {@code c}, unless pattern variables bound by {@code c} are read by
 *       later clauses; then they become a map that evaluates {@code c} and
 *       builds the new carrier or a failure, a filter (or take-while) that
 *       rejects failures, and, if the carrier is tagged, a map that removes
 *       the tag;
 *   <li>"skipWhile c" becomes a skip-while on {@code c};
 *   <li>"select e" becomes a map that computes {@code e};
 *   <li>an already-lowered clause contributes its combinators unchanged.
 * </ul>
 *
 * <p>Stages that do not allocate pass their input through, so the physical
 * carrier between two stages may hold fields that the logical carrier in the
 * plan has already dropped. The next allocating stage drops them.
 */
public class Translator {
  private final FlowFacts facts;
  private final CarrierPlan plan;
  private final boolean validate;

  private Translator(FlowFacts facts, CarrierPlan plan, boolean validate) {
    this.facts = requireNonNull(facts);
    this.plan = requireNonNull(plan);
    this.validate = validate;
  }

  /**
   * Translates a chain.
   *
   * @param facts Flow facts of the chain
   * @param plan Carriers between its clauses
   * @param validate Whether to check that each physical carrier holds the
   *     fields of the corresponding logical carrier
   *
   * @throws CompileException of kind {@code UNASSIGNED_VARIABLE_USE} if a
   *     clause reads a variable that is not in its incoming carrier
   */
  public static ImmutableList<Combinator> translate(
      FlowFacts facts, CarrierPlan plan, boolean validate) {
    return new Translator(facts, plan, validate).translate();
  }

  private ImmutableList<Combinator> translate() {
    final ImmutableList.Builder<Combinator> combinators =
        ImmutableList.builder();
    Carrier physical = Carrier.EMPTY;
    for (Clause clause : facts.chain.clauses) {
      final int i = clause.index;
      final Carrier logical = plan.input(i);
      checkReferences(clause, logical);
      if (validate) {
        verify(
            physical.fields.containsAll(logical.fields),
            "physical carrier %s does not cover %s at clause %s",
            physical,
            logical,
            i);
      }

      final Carrier output = plan.output(i);
      final CarrierSpec spec = plan.spec(i);
      switch (clause.op) {
      case FROM:
        combinators.add(
            Combinator.flatMap(
                i,
                physical,
                output,
                clause.exp,
                requireNonNull(spec.binder),
                fieldExps(spec, output)));
        physical = output;
        break;

      case LET:
        combinators.add(
            Combinator.bind(
                i,
                physical,
                output,
                clause.exp,
                requireNonNull(spec.binder),
                fieldExps(spec, output)));
        physical = output;
        break;

      case WHERE:
      case TAKE_WHILE:
        final Combinator.Kind kind =
            clause.op == Op.WHERE
                ? Combinator.Kind.FILTER
                : Combinator.Kind.TAKE_WHILE;
        if (output.representation == Carrier.Representation.PLAIN) {
          combinators.add(Combinator.test(kind, i, physical, clause.exp));
          break;
        }
        combinators.add(
            Combinator.guard(
                i, physical, output, clause.exp, fieldExps(spec, output)));
        combinators.add(Combinator.rejectFailure(kind, i, output));
        if (output.representation == Carrier.Representation.TAGGED) {
          combinators.add(Combinator.unwrap(i, output));
          physical = output.plain();
        } else {
          physical = output;
        }
        break;

      case SKIP_WHILE:
        combinators.add(
            Combinator.test(
                Combinator.Kind.SKIP_WHILE, i, physical, clause.exp));
        break;

      case SELECT:
        combinators.add(Combinator.project(i, physical, clause.exp));
        physical = output;
        break;

      case COMBINATORS:
        combinators.addAll(clause.combinators);
        physical = output;
        break;

      default:
        throw new AssertionError("unknown clause " + clause.op);
      }
    }
    return combinators.build();
  }

  /**
   * Checks that every variable that a clause reads, other than its own
   * pattern variables and outer variables, is in the incoming carrier.
   */
  private void checkReferences(Clause clause, Carrier carrier) {
    for (FlowFacts.Reference reference : facts.references(clause.index)) {
      final VariableBinding binding = reference.binding;
      if (binding != null
          && binding.clauseIndex < clause.index
          && !carrier.contains(binding)) {
        throw CompileException.of(
            CompileException.Kind.UNASSIGNED_VARIABLE_USE,
            clause,
            binding.name,
            "variable '" + binding.name + "' is not definitely assigned in "
                + "clause " + clause.index);
      }
    }
  }

  /**
   * Returns an expression for each field of a carrier. A variable introduced
   * by the clause's binding pattern is extracted from the binder; any other
   * variable is read by name.
   */
  private static ImmutableList<Ast.Exp> fieldExps(
      CarrierSpec spec, Carrier carrier) {
    final ImmutableList.Builder<Ast.Exp> exps = ImmutableList.builder();
    fields:
    for (VariableBinding field : carrier.fields) {
      for (Extraction extraction : spec.extractions) {
        if (extraction.binding.equals(field)) {
          exps.add(extraction.exp);
          continue fields;
        }
      }
      exps.add(ast.id(field.name, field.type));
    }
    return exps.build();
  }
}

// End Translator.java
