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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.comprehend.compile.Combinator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A clause in a chain, such as "from s in list" or "where i > 0".
 *
 * <p>{@link #introduces} holds the variables the clause introduces, in source
 * order: the range variables of its binding pattern, if it is a "from" or
 * "let", followed by the pattern variables bound in its expression. A pattern
 * variable that is bound in several places with different types appears once
 * per type; the flow analyzer decides whether they unify.
 *
 * <p>Immutable.
 */
public class Clause extends AstNode {
  /** Position of this clause in its chain, starting at 0. */
  public final int index;

  public final Ast.Exp exp;

  /** Binding pattern of a "from" or "let" clause; null for other kinds. */
  public final Ast.@Nullable Pat pat;

  public final ImmutableList<VariableBinding> introduces;

  /** Lowered combinators; non-empty only if the kind is COMBINATORS. */
  public final ImmutableList<Combinator> combinators;

  /** Whether the clause was added by {@link ChainBuilder#build()}. */
  public final boolean implicit;

  Clause(
      Pos pos,
      Op op,
      int index,
      Ast.Exp exp,
      Ast.@Nullable Pat pat,
      ImmutableList<VariableBinding> introduces,
      ImmutableList<Combinator> combinators,
      boolean implicit) {
    super(pos, op);
    this.index = index;
    this.exp = requireNonNull(exp);
    this.pat = pat;
    this.introduces = requireNonNull(introduces);
    this.combinators = requireNonNull(combinators);
    this.implicit = implicit;
    checkArgument(op.isClause(), "not a clause: %s", op);
    checkArgument(
        (pat != null) == (op == Op.FROM || op == Op.LET),
        "pattern is required for 'from' and 'let', and only for them");
  }

  /** Returns the variables introduced by the clause's binding pattern. */
  public ImmutableList<VariableBinding> rangeVariables() {
    final ImmutableList.Builder<VariableBinding> b = ImmutableList.builder();
    introduces.forEach(
        binding -> {
          if (!binding.isPattern()) {
            b.add(binding);
          }
        });
    return b.build();
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    switch (op) {
    case FROM:
      return w.append(op.padded)
          .append(requireNonNull(pat), 0, 0)
          .append(" in ")
          .append(exp, 0, 0);
    case LET:
      return w.append(op.padded)
          .append(requireNonNull(pat), 0, 0)
          .append(" = ")
          .append(exp, 0, 0);
    case COMBINATORS:
      w.append(op.padded).append("[");
      for (int i = 0; i < combinators.size(); i++) {
        w.append(i > 0 ? "; " : "").append(combinators.get(i).toString());
      }
      return w.append("]");
    default:
      return w.append(op.padded).append(exp, 0, 0);
    }
  }

  @Override
  public void accept(Visitor visitor) {
    if (pat != null) {
      pat.accept(visitor);
    }
    exp.accept(visitor);
  }
}

// End Clause.java
