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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import net.hydromatic.comprehend.ast.ClauseChain;
import net.hydromatic.comprehend.ast.VariableBinding;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of {@link FlowAnalyzer#analyze}.
 *
 * <p>Holds, for each clause of a chain, its unified pattern variables, the
 * subset of them that are definitely assigned when the clause's expression is
 * true, and the resolved variable references in the clause. From these it
 * derives the {@link FlowFact} of any (clause, variable) pair.
 *
 * <p>Valid only for the chain it was computed from.
 */
public class FlowFacts {
  public final ClauseChain chain;
  private final ImmutableList<ImmutableList<VariableBinding>> patternVariables;
  private final ImmutableList<ImmutableSet<VariableBinding>> assignedWhenTrue;
  private final ImmutableList<ImmutableList<Reference>> references;

  FlowFacts(
      ClauseChain chain,
      ImmutableList<ImmutableList<VariableBinding>> patternVariables,
      ImmutableList<ImmutableSet<VariableBinding>> assignedWhenTrue,
      ImmutableList<ImmutableList<Reference>> references) {
    this.chain = requireNonNull(chain);
    this.patternVariables = requireNonNull(patternVariables);
    this.assignedWhenTrue = requireNonNull(assignedWhenTrue);
    this.references = requireNonNull(references);
  }

  /** Returns the pattern variables introduced by a clause, unified. */
  public ImmutableList<VariableBinding> patternVariables(int clauseIndex) {
    return patternVariables.get(clauseIndex);
  }

  /**
   * Returns the variables introduced by a clause: its range variables followed
   * by its unified pattern variables.
   */
  public ImmutableList<VariableBinding> bindings(int clauseIndex) {
    return ImmutableList.<VariableBinding>builder()
        .addAll(chain.get(clauseIndex).rangeVariables())
        .addAll(patternVariables.get(clauseIndex))
        .build();
  }

  /** Returns the variables introduced by all clauses, in order. */
  public ImmutableList<VariableBinding> bindings() {
    final ImmutableList.Builder<VariableBinding> b = ImmutableList.builder();
    for (int i = 0; i < chain.size(); i++) {
      b.addAll(bindings(i));
    }
    return b.build();
  }

  /** Returns the variable references in a clause, in source order. */
  public ImmutableList<Reference> references(int clauseIndex) {
    return references.get(clauseIndex);
  }

  /**
   * Returns whether a pattern variable is assigned in every clause after the
   * one that introduces it.
   *
   * <p>True only if the introducing clause gates continuation (see {@link
   * net.hydromatic.comprehend.ast.Op#gatesContinuation()}) and the variable is
   * definitely assigned when the clause's expression is true.
   */
  public boolean propagates(VariableBinding binding) {
    return binding.isPattern()
        && chain.get(binding.clauseIndex).op.gatesContinuation()
        && assignedWhenTrue.get(binding.clauseIndex).contains(binding);
  }

  /** Returns the definite-assignment state of a variable at a clause. */
  public FlowFact fact(int clauseIndex, VariableBinding binding) {
    if (clauseIndex < binding.clauseIndex) {
      return FlowFact.UNASSIGNED;
    }
    if (clauseIndex == binding.clauseIndex) {
      // A range variable is not visible in its own clause's expression.
      return binding.isPattern()
              && assignedWhenTrue.get(clauseIndex).contains(binding)
          ? FlowFact.DEFINITELY_ASSIGNED_IF_TRUE
          : FlowFact.UNASSIGNED;
    }
    if (!binding.isPattern()) {
      return FlowFact.DEFINITELY_ASSIGNED;
    }
    return propagates(binding)
        ? FlowFact.DEFINITELY_ASSIGNED
        : FlowFact.UNASSIGNED;
  }

  /**
   * Returns the index of the last clause that reads a variable, or -1 if no
   * clause reads it.
   */
  public int lastUse(VariableBinding binding) {
    for (int i = chain.size() - 1; i >= binding.clauseIndex; i--) {
      for (Reference reference : references.get(i)) {
        if (binding.equals(reference.binding)) {
          return i;
        }
      }
    }
    return -1;
  }

  /**
   * Use of a name in a clause.
   *
   * <p>If {@link #binding} is null, the name is not bound by any clause of the
   * chain; it refers to a variable in the enclosing environment.
   */
  public static class Reference {
    public final String name;
    public final @Nullable VariableBinding binding;
    public final int clauseIndex;

    Reference(String name, @Nullable VariableBinding binding, int clauseIndex) {
      this.name = requireNonNull(name);
      this.binding = binding;
      this.clauseIndex = clauseIndex;
    }

    /** Whether this is a reference to a variable outside the chain. */
    public boolean isOuter() {
      return binding == null;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, binding, clauseIndex);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Reference
              && name.equals(((Reference) o).name)
              && Objects.equals(binding, ((Reference) o).binding)
              && clauseIndex == ((Reference) o).clauseIndex;
    }

    @Override
    public String toString() {
      return binding == null
          ? name + " (outer)"
          : name + " (clause " + binding.clauseIndex + ")";
    }
  }
}

// End FlowFacts.java
