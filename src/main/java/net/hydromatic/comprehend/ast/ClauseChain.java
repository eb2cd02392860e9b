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

import static net.hydromatic.comprehend.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.comprehend.compile.Combinator;

/**
 * An ordered sequence of clauses that are translated together.
 *
 * <p>Create one using {@link ChainBuilder}, or {@link #lowered(List)} for a
 * chain that has already been translated.
 */
public class ClauseChain {
  public final ImmutableList<Clause> clauses;

  ClauseChain(ImmutableList<Clause> clauses) {
    this.clauses = clauses;
  }

  /**
   * Creates a degenerate chain of one clause that holds combinators already
   * produced by the translator.
   *
   * <p>Such a chain introduces no variables, so compiling it returns the same
   * combinators.
   */
  public static ClauseChain lowered(List<Combinator> combinators) {
    final Clause clause =
        new Clause(
            Pos.ZERO,
            Op.COMBINATORS,
            0,
            ast.unitLiteral(),
            null,
            ImmutableList.of(),
            ImmutableList.copyOf(combinators),
            false);
    return new ClauseChain(ImmutableList.of(clause));
  }

  public int size() {
    return clauses.size();
  }

  public Clause get(int i) {
    return clauses.get(i);
  }

  public Clause last() {
    return clauses.get(clauses.size() - 1);
  }

  /** Returns whether this chain holds already-lowered combinators. */
  public boolean isLowered() {
    return clauses.size() == 1 && clauses.get(0).op == Op.COMBINATORS;
  }

  /** Returns the variables introduced by all clauses, in order. */
  public ImmutableList<VariableBinding> introduces() {
    final ImmutableList.Builder<VariableBinding> b = ImmutableList.builder();
    clauses.forEach(clause -> b.addAll(clause.introduces));
    return b.build();
  }

  @Override
  public String toString() {
    return clauses.stream()
        .filter(clause -> !clause.implicit)
        .map(Clause::toString)
        .collect(Collectors.joining(" "));
  }
}

// End ClauseChain.java
