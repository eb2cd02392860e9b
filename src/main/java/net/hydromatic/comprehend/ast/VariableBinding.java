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

import java.util.Objects;
import net.hydromatic.comprehend.type.Type;

/**
 * A variable introduced by a clause.
 *
 * <p>A {@link Origin#RANGE_VARIABLE range variable} is introduced by the
 * binding pattern of a "from" or "let" clause, and is in scope for the rest of
 * the chain. A {@link Origin#PATTERN_VARIABLE pattern variable} is introduced
 * by a refutable pattern test inside a clause's expression ("o is int i",
 * "int.tryParse(s, out i)"); it is assigned only if the test succeeds, so its
 * definite-assignment condition is "the introducing expression evaluated to
 * true".
 *
 * <p>Two bindings are equal if they have the same name, type, origin and
 * introducing clause. Occurrences of the same pattern variable in sibling
 * branches of one clause are therefore equal.
 */
public class VariableBinding {
  public final String name;
  public final Type type;
  public final Origin origin;
  public final int clauseIndex;

  /** Whether a value bound to this variable may be null. */
  public final boolean nullable;

  private VariableBinding(
      String name,
      Type type,
      Origin origin,
      int clauseIndex,
      boolean nullable) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
    this.origin = requireNonNull(origin);
    this.clauseIndex = clauseIndex;
    this.nullable = nullable;
  }

  /** Creates a range variable. */
  public static VariableBinding range(String name, Type type, int clauseIndex) {
    return new VariableBinding(
        name, type, Origin.RANGE_VARIABLE, clauseIndex, type.isNullable());
  }

  /** Creates a pattern variable. */
  public static VariableBinding pattern(
      String name, Type type, int clauseIndex, boolean nullable) {
    return new VariableBinding(
        name, type, Origin.PATTERN_VARIABLE, clauseIndex, nullable);
  }

  /** Returns whether this is a pattern variable. */
  public boolean isPattern() {
    return origin == Origin.PATTERN_VARIABLE;
  }

  /**
   * Returns a copy of this binding that may be null if either this or another
   * occurrence may be null.
   */
  public VariableBinding unify(VariableBinding other) {
    return nullable || !other.nullable
        ? this
        : new VariableBinding(name, type, origin, clauseIndex, true);
  }

  /**
   * Returns the mutability of this binding as seen from a given clause.
   *
   * <p>A pattern variable may be assigned more than once within its
   * introducing clause, as "i" is in "o is int i orelse int.tryParse(s, out
   * i)"; everywhere else, and for range variables everywhere, it is
   * read-only.
   */
  public Mutability mutabilityIn(int clauseIndex) {
    return isPattern() && clauseIndex == this.clauseIndex
        ? Mutability.MUTABLE_WITHIN_INTRODUCING_CLAUSE
        : Mutability.IMMUTABLE_THEREAFTER;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, origin, clauseIndex);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof VariableBinding
            && name.equals(((VariableBinding) o).name)
            && type.equals(((VariableBinding) o).type)
            && origin == ((VariableBinding) o).origin
            && clauseIndex == ((VariableBinding) o).clauseIndex;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Where a variable comes from. */
  public enum Origin {
    RANGE_VARIABLE,
    PATTERN_VARIABLE
  }

  /** Whether a variable may be assigned. */
  public enum Mutability {
    MUTABLE_WITHIN_INTRODUCING_CLAUSE,
    IMMUTABLE_THEREAFTER
  }
}

// End VariableBinding.java
