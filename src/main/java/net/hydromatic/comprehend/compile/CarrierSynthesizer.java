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
import static net.hydromatic.comprehend.util.Static.last;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.Clause;
import net.hydromatic.comprehend.ast.ClauseChain;
import net.hydromatic.comprehend.ast.Op;
import net.hydromatic.comprehend.ast.VariableBinding;
import net.hydromatic.comprehend.type.ListType;
import net.hydromatic.comprehend.type.Type;

/**
 * Decides the shape of the value that flows out of each clause.
 *
 * <p>The carrier out of clause {@code i} holds each variable that is
 * definitely assigned after {@code i} and is read by a later clause, in the
 * order the variables were introduced. A variable that is read for the last
 * time by clause {@code i} is dropped from the carrier out of {@code i}.
 *
 * <p>If a clause gates continuation and its own pattern variables are in the
 * carrier, the stage that evaluates it must also signal failure. If no
 * successful payload can be null, failure is signaled by null ({@link
 * Carrier.Representation#ELIDED}); otherwise each value is tagged ({@link
 * Carrier.Representation#TAGGED}).
 */
public class CarrierSynthesizer {
  private final FlowFacts facts;
  private final NameGenerator nameGenerator = new NameGenerator();
  private final Map<VariableBinding, Integer> lastUses = new HashMap<>();

  private CarrierSynthesizer(FlowFacts facts) {
    this.facts = requireNonNull(facts);
  }

  /**
   * Computes the carriers of a chain.
   *
   * @throws CompileException of kind {@code ARITY_MISMATCH} if a
   *     deconstruction pattern does not match its value
   */
  public static CarrierPlan synthesize(FlowFacts facts) {
    return new CarrierSynthesizer(facts).synthesize();
  }

  private CarrierPlan synthesize() {
    final ClauseChain chain = facts.chain;
    final List<VariableBinding> bindings = facts.bindings();
    bindings.forEach(b -> lastUses.put(b, facts.lastUse(b)));

    final ImmutableList.Builder<CarrierSpec> specs = ImmutableList.builder();
    for (Clause clause : chain.clauses) {
      final int i = clause.index;
      switch (clause.op) {
      case SELECT:
        specs.add(
            new CarrierSpec(
                i, Carrier.value(clause.exp.type), null, ImmutableList.of()));
        continue;

      case COMBINATORS:
        final Carrier output =
            clause.combinators.isEmpty()
                ? Carrier.EMPTY
                : last(clause.combinators).output;
        specs.add(new CarrierSpec(i, output, null, ImmutableList.of()));
        continue;

      default:
        break;
      }

      final ImmutableList.Builder<VariableBinding> fields =
          ImmutableList.builder();
      for (VariableBinding binding : bindings) {
        if (binding.clauseIndex <= i
            && facts.fact(i + 1, binding) == FlowFact.DEFINITELY_ASSIGNED
            && requireNonNull(lastUses.get(binding)) > i) {
          fields.add(binding);
        }
      }
      final Carrier plain = Carrier.of(fields.build());
      final Carrier carrier =
          plain.fields.stream().anyMatch(b -> ownPattern(clause, b))
              ? Carrier.of(
                  plain.fields,
                  plain.isPayloadNullable()
                      ? Carrier.Representation.TAGGED
                      : Carrier.Representation.ELIDED)
              : plain;

      if (clause.op == Op.FROM || clause.op == Op.LET) {
        final Ast.Pat pat = requireNonNull(clause.pat);
        if (pat instanceof Ast.IdPat) {
          specs.add(
              new CarrierSpec(
                  i, carrier, ((Ast.IdPat) pat).name, ImmutableList.of()));
        } else {
          final String binder = nameGenerator.get();
          final ImmutableList<Extraction> extractions =
              DeconstructionExpander.expand(
                  clause, valueType(clause), binder, carrier::contains);
          specs.add(new CarrierSpec(i, carrier, binder, extractions));
        }
      } else {
        specs.add(new CarrierSpec(i, carrier, null, ImmutableList.of()));
      }
    }
    return new CarrierPlan(specs.build());
  }

  /** Returns whether a binding is a pattern variable of a given clause. */
  private static boolean ownPattern(Clause clause, VariableBinding binding) {
    return binding.isPattern() && binding.clauseIndex == clause.index;
  }

  /** Returns the type of each value bound by a "from" or "let" clause. */
  private static Type valueType(Clause clause) {
    return clause.op == Op.FROM
        ? ((ListType) clause.exp.type).elementType
        : clause.exp.type;
  }
}

// End CarrierSynthesizer.java
