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

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.comprehend.ast.Clause;
import net.hydromatic.comprehend.ast.ClauseChain;
import net.hydromatic.comprehend.ast.VariableBinding;

/**
 * Rejects chains that use pattern variables in ways the current {@link
 * RestrictionPolicy} does not allow.
 *
 * <p>Whatever the policy, a pattern variable may not have the name of a range
 * variable that is still live: one introduced by the same clause, or read by
 * this or a later clause. Binding it would assign to the range variable,
 * which is read-only outside its introducing clause. Once the range variable
 * is dead, its name is free.
 */
public class ScopeGuard {
  private final RestrictionPolicy policy;

  public ScopeGuard(RestrictionPolicy policy) {
    this.policy = requireNonNull(policy);
  }

  /**
   * Checks a chain.
   *
   * @throws CompileException of kind {@code PATTERN_VARIABLE_SCOPE_VIOLATION}
   *     if the chain breaks the policy
   */
  public void check(FlowFacts facts) {
    final ClauseChain chain = facts.chain;
    final Map<String, VariableBinding> rangeVariables = new HashMap<>();
    final Map<String, VariableBinding> patternVariables = new HashMap<>();
    for (Clause clause : chain.clauses) {
      clause.rangeVariables().forEach(b -> rangeVariables.put(b.name, b));

      for (VariableBinding binding : facts.patternVariables(clause.index)) {
        final VariableBinding range = rangeVariables.get(binding.name);
        if (range != null && isLive(facts, range, clause.index)) {
          throw violation(
              clause,
              binding,
              "pattern variable '" + binding.name
                  + "' would assign range variable '" + range.name
                  + "' of clause " + range.clauseIndex);
        }
        final VariableBinding previous =
            patternVariables.put(binding.name, binding);
        if (previous != null
            && policy == RestrictionPolicy.REQUIRE_GLOBAL_NAME_UNIQUENESS) {
          throw violation(
              clause,
              binding,
              "pattern variable '" + binding.name
                  + "' is already introduced by clause "
                  + previous.clauseIndex);
        }
      }

      if (policy == RestrictionPolicy.DISALLOW_PATTERN_VARIABLES_IN_CLAUSES) {
        for (FlowFacts.Reference reference : facts.references(clause.index)) {
          final VariableBinding binding = reference.binding;
          if (binding != null
              && binding.isPattern()
              && binding.clauseIndex < clause.index) {
            throw violation(
                clause,
                binding,
                "pattern variable '" + binding.name
                    + "' of clause " + binding.clauseIndex
                    + " cannot be used in a later clause");
          }
        }
      }
    }
  }

  /**
   * Returns whether a range variable is live at a clause that introduces a
   * pattern variable of the same name.
   *
   * <p>An implicit "select" returns the range variables in scope, so if it
   * reads the name, it reads the range variable, even though the name now
   * resolves to the pattern variable.
   */
  private static boolean isLive(
      FlowFacts facts, VariableBinding range, int clauseIndex) {
    if (range.clauseIndex == clauseIndex
        || facts.lastUse(range) >= clauseIndex) {
      return true;
    }
    final Clause last = facts.chain.last();
    if (last.implicit && last.index > clauseIndex) {
      for (FlowFacts.Reference reference : facts.references(last.index)) {
        if (reference.name.equals(range.name)
            && reference.binding != null
            && reference.binding.clauseIndex <= clauseIndex) {
          return true;
        }
      }
    }
    return false;
  }

  private static CompileException violation(
      Clause clause, VariableBinding binding, String message) {
    return CompileException.of(
        CompileException.Kind.PATTERN_VARIABLE_SCOPE_VIOLATION,
        clause,
        binding.name,
        message);
  }
}

// End ScopeGuard.java
