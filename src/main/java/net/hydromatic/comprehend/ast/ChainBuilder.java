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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.comprehend.ast.AstBuilder.ast;
import static net.hydromatic.comprehend.util.Static.last;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.comprehend.compile.CompileException;
import net.hydromatic.comprehend.type.ListType;
import net.hydromatic.comprehend.type.PrimitiveType;
import net.hydromatic.comprehend.type.Type;
import net.hydromatic.comprehend.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds a {@link ClauseChain}.
 *
 * <p>Clauses are recorded in the order they are added; {@link #build()}
 * checks that the order is valid and computes, for each clause, the variables
 * it introduces. If the last clause is not a "select", {@code build} adds one
 * that returns the range variables in scope: the variable itself if there is
 * one, a tuple if there are several. A range variable may reuse the name of an
 * earlier one; later clauses see only the most recent.
 */
public class ChainBuilder {
  private final TypeSystem typeSystem;
  private final List<Step> steps = new ArrayList<>();
  private Pos pos = Pos.ZERO;

  public ChainBuilder(TypeSystem typeSystem) {
    this.typeSystem = requireNonNull(typeSystem);
  }

  /** Resets state as if this {@code ChainBuilder} had just been created. */
  public void clear() {
    steps.clear();
    pos = Pos.ZERO;
  }

  @Override
  public String toString() {
    return steps.toString();
  }

  /** Sets the position of the next clause to be added. */
  @CanIgnoreReturnValue
  public ChainBuilder at(Pos pos) {
    this.pos = requireNonNull(pos);
    return this;
  }

  @CanIgnoreReturnValue
  private ChainBuilder addStep(Op op, Ast.Exp exp, Ast.@Nullable Pat pat) {
    steps.add(new Step(pos, op, requireNonNull(exp), pat));
    pos = Pos.ZERO;
    return this;
  }

  /** Adds a generator, "from pat in exp". */
  @CanIgnoreReturnValue
  public ChainBuilder from(Ast.Pat pat, Ast.Exp exp) {
    return addStep(Op.FROM, exp, requireNonNull(pat));
  }

  /** Adds a generator with a named pattern, "from name in exp". */
  @CanIgnoreReturnValue
  public ChainBuilder from(String name, Ast.Exp exp) {
    final Type elementType =
        exp.type instanceof ListType
            ? ((ListType) exp.type).elementType
            : PrimitiveType.OBJ;
    return from(ast.idPat(name, elementType), exp);
  }

  /** Adds a binding, "let pat = exp". */
  @CanIgnoreReturnValue
  public ChainBuilder let(Ast.Pat pat, Ast.Exp exp) {
    return addStep(Op.LET, exp, requireNonNull(pat));
  }

  /** Adds a binding with a named pattern, "let name = exp". */
  @CanIgnoreReturnValue
  public ChainBuilder let(String name, Ast.Exp exp) {
    return let(ast.idPat(name, exp.type), exp);
  }

  /** Adds a filter, "where condition". */
  @CanIgnoreReturnValue
  public ChainBuilder where(Ast.Exp condition) {
    return addStep(Op.WHERE, condition, null);
  }

  /** Adds "takeWhile condition". */
  @CanIgnoreReturnValue
  public ChainBuilder takeWhile(Ast.Exp condition) {
    return addStep(Op.TAKE_WHILE, condition, null);
  }

  /** Adds "skipWhile condition". */
  @CanIgnoreReturnValue
  public ChainBuilder skipWhile(Ast.Exp condition) {
    return addStep(Op.SKIP_WHILE, condition, null);
  }

  /** Adds a projection, "select exp". */
  @CanIgnoreReturnValue
  public ChainBuilder select(Ast.Exp exp) {
    return addStep(Op.SELECT, exp, null);
  }

  /**
   * Builds the chain.
   *
   * @throws CompileException if the clauses are not in a valid order, or if a
   *     binding pattern contains the same name twice
   */
  public ClauseChain build() {
    if (steps.isEmpty()) {
      throw new CompileException(
          CompileException.Kind.MALFORMED_CHAIN,
          "chain is empty",
          -1,
          null,
          Pos.ZERO);
    }
    final ImmutableList.Builder<Clause> clauses = ImmutableList.builder();
    final Map<String, VariableBinding> rangeVariables = new LinkedHashMap<>();
    for (int i = 0; i < steps.size(); i++) {
      final Step step = steps.get(i);
      if (i == 0 && step.op != Op.FROM) {
        throw malformed(
            step,
            i,
            "chain must start with 'from', not '" + name(step.op) + "'");
      }
      if (step.op == Op.SELECT && i < steps.size() - 1) {
        throw malformed(step, i, "'select' must be the last clause");
      }
      if (step.op == Op.FROM && !(step.exp.type instanceof ListType)) {
        throw malformed(
            step,
            i,
            "source of 'from' must be a list, but has type "
                + step.exp.type.moniker());
      }
      final ImmutableList.Builder<VariableBinding> introduces =
          ImmutableList.builder();
      final List<VariableBinding> newRangeVariables = new ArrayList<>();
      if (step.pat != null) {
        for (Ast.IdPat idPat : idPats(step.pat)) {
          if (newRangeVariables.stream()
              .anyMatch(b -> b.name.equals(idPat.name))) {
            throw new CompileException(
                CompileException.Kind.DUPLICATE_VARIABLE,
                "variable '" + idPat.name + "' occurs twice in pattern",
                i,
                idPat.name,
                step.pos);
          }
          newRangeVariables.add(
              VariableBinding.range(idPat.name, idPat.type, i));
        }
      }
      introduces.addAll(newRangeVariables);
      introduces.addAll(patternVariables(step.exp, i));
      clauses.add(
          new Clause(
              step.pos,
              step.op,
              i,
              step.exp,
              step.pat,
              introduces.build(),
              ImmutableList.of(),
              false));
      // A name that is reintroduced shadows its earlier binding.
      newRangeVariables.forEach(
          b -> {
            rangeVariables.remove(b.name);
            rangeVariables.put(b.name, b);
          });
    }

    if (last(steps).op != Op.SELECT) {
      final List<Ast.Exp> ids = new ArrayList<>();
      rangeVariables.values().forEach(b -> ids.add(ast.id(b.name, b.type)));
      final Ast.Exp exp =
          ids.isEmpty()
              ? ast.unitLiteral()
              : ids.size() == 1 ? ids.get(0) : ast.tuple(typeSystem, ids);
      clauses.add(
          new Clause(
              Pos.ZERO,
              Op.SELECT,
              steps.size(),
              exp,
              null,
              patternVariables(exp, steps.size()),
              ImmutableList.of(),
              true));
    }
    return new ClauseChain(clauses.build());
  }

  private static CompileException malformed(Step step, int i, String message) {
    return new CompileException(
        CompileException.Kind.MALFORMED_CHAIN, message, i, null, step.pos);
  }

  private static String name(Op op) {
    return op.padded.trim();
  }

  /** Returns the named patterns in a binding pattern, in order. */
  private static List<Ast.IdPat> idPats(Ast.Pat pat) {
    final List<Ast.IdPat> idPats = new ArrayList<>();
    pat.accept(
        new Visitor() {
          @Override
          public void visit(Ast.IdPat idPat) {
            idPats.add(idPat);
          }
        });
    return idPats;
  }

  /**
   * Returns one binding per pattern-variable occurrence in an expression, in
   * source order. A name that occurs more than once with the same type and
   * nullability is returned once.
   */
  static ImmutableList<VariableBinding> patternVariables(
      Ast.Exp exp, int clauseIndex) {
    final List<VariableBinding> bindings = new ArrayList<>();
    final Set<List<Object>> seen = new HashSet<>();
    exp.accept(
        new Visitor() {
          @Override
          public void visit(Ast.Is is) {
            super.visit(is);
            final String name = is.boundName();
            if (name != null) {
              add(
                  VariableBinding.pattern(
                      name, is.pat.type, clauseIndex, is.boundNullable()));
            }
          }

          @Override
          public void visit(Ast.TryParse tryParse) {
            super.visit(tryParse);
            add(
                VariableBinding.pattern(
                    tryParse.name, tryParse.targetType, clauseIndex, false));
          }

          private void add(VariableBinding binding) {
            final List<Object> key =
                ImmutableList.of(binding.name, binding.type, binding.nullable);
            if (seen.add(key)) {
              bindings.add(binding);
            }
          }
        });
    return ImmutableList.copyOf(bindings);
  }

  /** A clause that has been added but not yet built. */
  private static class Step {
    final Pos pos;
    final Op op;
    final Ast.Exp exp;
    final Ast.@Nullable Pat pat;

    Step(Pos pos, Op op, Ast.Exp exp, Ast.@Nullable Pat pat) {
      this.pos = pos;
      this.op = op;
      this.exp = exp;
      this.pat = pat;
    }

    @Override
    public String toString() {
      return op.padded + (pat == null ? "" : pat + " ") + exp;
    }
  }
}

// End ChainBuilder.java
