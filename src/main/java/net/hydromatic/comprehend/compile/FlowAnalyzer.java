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
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.Clause;
import net.hydromatic.comprehend.ast.ClauseChain;
import net.hydromatic.comprehend.ast.VariableBinding;

/**
 * Computes definite-assignment facts for the variables of a chain.
 *
 * <p>Within a clause, the analyzer tracks two sets of pattern variables: those
 * assigned if the expression evaluated so far is true, and those assigned if
 * it is false. "andalso" evaluates its right operand only when the left is
 * true; "orelse" only when it is false; "not" swaps the sets; "if" intersects
 * its branches. A reference to one of the clause's own pattern variables is
 * valid only where the variable is in the set that applies.
 *
 * <p>Across clauses, a reference resolves to the clause's own pattern
 * variable of that name, if there is one, or else to the most recent variable
 * of that name introduced by an earlier clause. A name that is introduced only
 * by the same or a later clause is an error; a name introduced by no clause is
 * a reference to the enclosing environment.
 */
public class FlowAnalyzer {
  private final ClauseChain chain;

  /** Names introduced anywhere in the chain. */
  private final Set<String> chainNames = new HashSet<>();

  /** Most recent binding of each name, by clauses analyzed so far. */
  private final Map<String, VariableBinding> scope = new HashMap<>();

  private FlowAnalyzer(ClauseChain chain) {
    this.chain = requireNonNull(chain);
    for (Clause clause : chain.clauses) {
      clause.introduces.forEach(binding -> chainNames.add(binding.name));
    }
  }

  /**
   * Analyzes a chain.
   *
   * @throws CompileException if a pattern variable is bound with different
   *     types in one clause ({@code AMBIGUOUS_PATTERN_VARIABLE}) or if a
   *     variable is used where it is not definitely assigned ({@code
   *     UNASSIGNED_VARIABLE_USE})
   */
  public static FlowFacts analyze(ClauseChain chain) {
    return new FlowAnalyzer(chain).analyze();
  }

  private FlowFacts analyze() {
    final ImmutableList.Builder<ImmutableList<VariableBinding>> patterns =
        ImmutableList.builder();
    final ImmutableList.Builder<ImmutableSet<VariableBinding>> whenTrue =
        ImmutableList.builder();
    final ImmutableList.Builder<ImmutableList<FlowFacts.Reference>>
        references = ImmutableList.builder();
    for (Clause clause : chain.clauses) {
      final Map<String, VariableBinding> own = unify(clause);
      final ClauseAnalysis analysis = new ClauseAnalysis(clause, own);
      final State state = analysis.flow(clause.exp, ImmutableSet.of());

      final ImmutableSet.Builder<VariableBinding> assigned =
          ImmutableSet.builder();
      state.whenTrue.forEach(
          name -> assigned.add(requireNonNull(own.get(name))));
      patterns.add(ImmutableList.copyOf(own.values()));
      whenTrue.add(assigned.build());
      references.add(ImmutableList.copyOf(analysis.references));

      clause.rangeVariables().forEach(b -> scope.put(b.name, b));
      own.values().forEach(b -> scope.put(b.name, b));
    }
    return new FlowFacts(
        chain, patterns.build(), whenTrue.build(), references.build());
  }

  /**
   * Merges the occurrences of each pattern variable in a clause. Occurrences
   * must agree on type; the result is nullable if any occurrence is.
   */
  private static Map<String, VariableBinding> unify(Clause clause) {
    final Map<String, VariableBinding> map = new LinkedHashMap<>();
    for (VariableBinding binding : clause.introduces) {
      if (!binding.isPattern()) {
        continue;
      }
      final VariableBinding existing = map.get(binding.name);
      if (existing == null) {
        map.put(binding.name, binding);
      } else if (existing.type.equals(binding.type)) {
        map.put(binding.name, existing.unify(binding));
      } else {
        throw CompileException.of(
            CompileException.Kind.AMBIGUOUS_PATTERN_VARIABLE,
            clause,
            binding.name,
            "pattern variable '" + binding.name + "' has type "
                + existing.type.moniker() + " in one branch and "
                + binding.type.moniker() + " in another");
      }
    }
    return map;
  }

  /** Names assigned when an expression is true, and when it is false. */
  private static class State {
    final ImmutableSet<String> whenTrue;
    final ImmutableSet<String> whenFalse;

    State(ImmutableSet<String> whenTrue, ImmutableSet<String> whenFalse) {
      this.whenTrue = whenTrue;
      this.whenFalse = whenFalse;
    }

    /** State of an expression whose value does not affect assignment. */
    static State of(ImmutableSet<String> assigned) {
      return new State(assigned, assigned);
    }

    /** Names assigned after the expression, whatever its value. */
    ImmutableSet<String> after() {
      return Sets.intersection(whenTrue, whenFalse).immutableCopy();
    }

    @Override
    public String toString() {
      return "true: " + whenTrue + ", false: " + whenFalse;
    }
  }

  /** Analysis of the expression of one clause. */
  private class ClauseAnalysis {
    final Clause clause;
    final Map<String, VariableBinding> own;
    final List<FlowFacts.Reference> references = new ArrayList<>();

    ClauseAnalysis(Clause clause, Map<String, VariableBinding> own) {
      this.clause = clause;
      this.own = own;
    }

    State flow(Ast.Exp exp, ImmutableSet<String> assigned) {
      State state;
      switch (exp.op) {
      case ID:
        reference((Ast.Id) exp, assigned);
        return State.of(assigned);

      case BOOL_LITERAL:
      case INT_LITERAL:
      case REAL_LITERAL:
      case STRING_LITERAL:
      case UNIT_LITERAL:
        return State.of(assigned);

      case IS:
        final Ast.Is is = (Ast.Is) exp;
        state = flow(is.exp, assigned);
        final String name = is.boundName();
        return name == null
            ? State.of(state.after())
            : new State(plus(state.after(), name), state.after());

      case TRY_PARSE:
        final Ast.TryParse tryParse = (Ast.TryParse) exp;
        state = flow(tryParse.exp, assigned);
        return new State(plus(state.after(), tryParse.name), state.after());

      case NOT:
        state = flow(((Ast.Call) exp).arg(0), assigned);
        return new State(state.whenFalse, state.whenTrue);

      case ANDALSO:
        final State a = flow(((Ast.Call) exp).arg(0), assigned);
        final State b = flow(((Ast.Call) exp).arg(1), a.whenTrue);
        return new State(b.whenTrue, intersect(a.whenFalse, b.whenFalse));

      case ORELSE:
        final State c = flow(((Ast.Call) exp).arg(0), assigned);
        final State d = flow(((Ast.Call) exp).arg(1), c.whenFalse);
        return new State(intersect(c.whenTrue, d.whenTrue), d.whenFalse);

      case IF:
        final Ast.If if_ = (Ast.If) exp;
        final State condition = flow(if_.condition, assigned);
        final State ifTrue = flow(if_.ifTrue, condition.whenTrue);
        final State ifFalse = flow(if_.ifFalse, condition.whenFalse);
        return new State(
            intersect(ifTrue.whenTrue, ifFalse.whenTrue),
            intersect(ifTrue.whenFalse, ifFalse.whenFalse));

      case FIELD:
        return State.of(flow(((Ast.Field) exp).exp, assigned).after());

      case TUPLE:
        return sequence(((Ast.Tuple) exp).args, assigned);

      case LIST:
        return sequence(((Ast.ListExp) exp).args, assigned);

      default:
        if (exp instanceof Ast.Call) {
          return sequence(((Ast.Call) exp).args, assigned);
        }
        throw new AssertionError("unknown expression " + exp.op);
      }
    }

    /** Analyzes expressions that are evaluated one after another. */
    private State sequence(List<Ast.Exp> exps, ImmutableSet<String> assigned) {
      ImmutableSet<String> after = assigned;
      for (Ast.Exp exp : exps) {
        after = flow(exp, after).after();
      }
      return State.of(after);
    }

    private void reference(Ast.Id id, ImmutableSet<String> assigned) {
      final VariableBinding ownBinding = own.get(id.name);
      if (ownBinding != null) {
        if (!assigned.contains(id.name)) {
          throw CompileException.of(
              CompileException.Kind.UNASSIGNED_VARIABLE_USE,
              clause,
              id.name,
              "variable '" + id.name + "' is not definitely assigned");
        }
        references.add(
            new FlowFacts.Reference(id.name, ownBinding, clause.index));
        return;
      }
      final VariableBinding binding = scope.get(id.name);
      if (binding != null) {
        references.add(new FlowFacts.Reference(id.name, binding, clause.index));
        return;
      }
      if (chainNames.contains(id.name)) {
        throw CompileException.of(
            CompileException.Kind.UNASSIGNED_VARIABLE_USE,
            clause,
            id.name,
            "variable '" + id.name + "' is used before it is introduced");
      }
      references.add(new FlowFacts.Reference(id.name, null, clause.index));
    }
  }

  private static ImmutableSet<String> plus(Set<String> set, String name) {
    return ImmutableSet.<String>builder().addAll(set).add(name).build();
  }

  private static ImmutableSet<String> intersect(
      Set<String> set0, Set<String> set1) {
    return Sets.intersection(set0, set1).immutableCopy();
  }
}

// End FlowAnalyzer.java
