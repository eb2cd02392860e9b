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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.VariableBinding;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One stage of a lowered chain: a call to map, filter, flat-map, take-while
 * or skip-while.
 *
 * <p>{@link #input} and {@link #output} are the physical carriers into and out
 * of the stage. A stage that allocates a new carrier evaluates {@link
 * #fieldExps} to compute its fields; for {@link Role#PROJECT}, the single
 * expression is the selected value.
 *
 * <p>Immutable.
 */
public class Combinator {
  public final Kind kind;
  public final Role role;
  public final int clauseIndex;
  public final Carrier input;
  public final Carrier output;

  /** Expression evaluated once per input: the collection of a flat-map, or
   * the value of a "let". */
  public final Ast.@Nullable Exp source;

  /** Name to which each value of {@link #source} is bound. */
  public final @Nullable String binder;

  /** Condition of a guard or test. */
  public final Ast.@Nullable Exp condition;

  /** Expressions for the fields of {@link #output}, in order. */
  public final ImmutableList<Ast.Exp> fieldExps;

  private Combinator(
      Kind kind,
      Role role,
      int clauseIndex,
      Carrier input,
      Carrier output,
      Ast.@Nullable Exp source,
      @Nullable String binder,
      Ast.@Nullable Exp condition,
      ImmutableList<Ast.Exp> fieldExps) {
    this.kind = requireNonNull(kind);
    this.role = requireNonNull(role);
    this.clauseIndex = clauseIndex;
    this.input = requireNonNull(input);
    this.output = requireNonNull(output);
    this.source = source;
    this.binder = binder;
    this.condition = condition;
    this.fieldExps = requireNonNull(fieldExps);
    checkArgument((source == null) == (binder == null),
        "source and binder must be both present or both absent");
  }

  /** Creates a flat-map that binds each element of a collection. */
  static Combinator flatMap(int clauseIndex, Carrier input, Carrier output,
      Ast.Exp source, String binder, ImmutableList<Ast.Exp> fieldExps) {
    return new Combinator(Kind.FLAT_MAP, Role.BIND, clauseIndex, input,
        output, requireNonNull(source), requireNonNull(binder), null,
        fieldExps);
  }

  /** Creates a map that binds the value of an expression. */
  static Combinator bind(int clauseIndex, Carrier input, Carrier output,
      Ast.Exp source, String binder, ImmutableList<Ast.Exp> fieldExps) {
    return new Combinator(Kind.MAP, Role.BIND, clauseIndex, input, output,
        requireNonNull(source), requireNonNull(binder), null, fieldExps);
  }

  /** Creates a map that evaluates a condition and, if it is true, builds a
   * payload; otherwise emits a failure. */
  static Combinator guard(int clauseIndex, Carrier input, Carrier output,
      Ast.Exp condition, ImmutableList<Ast.Exp> fieldExps) {
    return new Combinator(Kind.MAP, Role.GUARD, clauseIndex, input, output,
        null, null, requireNonNull(condition), fieldExps);
  }

  /** Creates a filter, take-while or skip-while on a condition. */
  static Combinator test(Kind kind, int clauseIndex, Carrier carrier,
      Ast.Exp condition) {
    checkArgument(kind == Kind.FILTER
        || kind == Kind.TAKE_WHILE
        || kind == Kind.SKIP_WHILE);
    return new Combinator(kind, Role.TEST, clauseIndex, carrier, carrier,
        null, null, requireNonNull(condition), ImmutableList.of());
  }

  /** Creates a filter or take-while that stops at failures. */
  static Combinator rejectFailure(Kind kind, int clauseIndex,
      Carrier carrier) {
    checkArgument(kind == Kind.FILTER || kind == Kind.TAKE_WHILE);
    checkArgument(carrier.representation != Carrier.Representation.PLAIN);
    return new Combinator(kind, Role.REJECT_FAILURE, clauseIndex, carrier,
        carrier, null, null, null, ImmutableList.of());
  }

  /** Creates a map that removes the tag from a successful value. */
  static Combinator unwrap(int clauseIndex, Carrier input) {
    checkArgument(input.representation == Carrier.Representation.TAGGED);
    return new Combinator(Kind.MAP, Role.UNWRAP, clauseIndex, input,
        input.plain(), null, null, null, ImmutableList.of());
  }

  /** Creates a map that computes the selected value. */
  static Combinator project(int clauseIndex, Carrier input, Ast.Exp exp) {
    return new Combinator(Kind.MAP, Role.PROJECT, clauseIndex, input,
        Carrier.value(exp.type), null, null, null, ImmutableList.of(exp));
  }

  /** Whether this stage creates a new carrier from its input. */
  public boolean allocates() {
    return role == Role.BIND || role == Role.GUARD || role == Role.PROJECT;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, role, clauseIndex, input, output, source,
        binder, condition, fieldExps);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Combinator
            && kind == ((Combinator) o).kind
            && role == ((Combinator) o).role
            && clauseIndex == ((Combinator) o).clauseIndex
            && input.equals(((Combinator) o).input)
            && output.equals(((Combinator) o).output)
            && Objects.equals(source, ((Combinator) o).source)
            && Objects.equals(binder, ((Combinator) o).binder)
            && Objects.equals(condition, ((Combinator) o).condition)
            && fieldExps.equals(((Combinator) o).fieldExps);
  }

  /**
   * Returns a description such as
   * "map {s} -> {i}?: if int.tryParse(s, out i) yield {i}".
   */
  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder()
        .append(kind.moniker).append(' ')
        .append(input).append(" -> ").append(output).append(": ");
    switch (role) {
    case BIND:
      b.append(binder)
          .append(kind == Kind.FLAT_MAP ? " in " : " = ")
          .append(source);
      return appendYield(b.append(' ')).toString();
    case GUARD:
      b.append("if ").append(condition);
      return appendYield(b.append(' ')).toString();
    case TEST:
      return b.append(condition).toString();
    case REJECT_FAILURE:
      return b.append("succeeded").toString();
    case UNWRAP:
      return b.append("unwrap").toString();
    case PROJECT:
      return b.append("yield ").append(fieldExps.get(0)).toString();
    default:
      throw new AssertionError(role);
    }
  }

  /** Appends "yield {x, y = e}", omitting "= e" where e is just the name. */
  private StringBuilder appendYield(StringBuilder b) {
    b.append("yield {");
    for (int i = 0; i < fieldExps.size(); i++) {
      final VariableBinding field = output.fields.get(i);
      final Ast.Exp exp = fieldExps.get(i);
      b.append(i > 0 ? ", " : "").append(field.name);
      if (!(exp instanceof Ast.Id && ((Ast.Id) exp).name.equals(field.name))) {
        b.append(" = ").append(exp);
      }
    }
    return b.append("}");
  }

  /** Which combinator. */
  public enum Kind {
    MAP("map"),
    FILTER("filter"),
    FLAT_MAP("flatMap"),
    TAKE_WHILE("takeWhile"),
    SKIP_WHILE("skipWhile");

    public final String moniker;

    Kind(String moniker) {
      this.moniker = moniker;
    }
  }

  /** What a combinator does with its carrier. */
  public enum Role {
    /** Binds a value (or each element of a collection) and extends the
     * carrier. */
    BIND,
    /** Evaluates a condition that binds pattern variables; emits the new
     * carrier on success, a failure otherwise. */
    GUARD,
    /** Computes the selected value. */
    PROJECT,
    /** Removes the tag from a successful tagged value. */
    UNWRAP,
    /** Tests a condition; passes its input through. */
    TEST,
    /** Drops, or stops at, failures; passes its input through. */
    REJECT_FAILURE
  }
}

// End Combinator.java
