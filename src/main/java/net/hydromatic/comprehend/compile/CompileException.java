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

import net.hydromatic.comprehend.ast.Clause;
import net.hydromatic.comprehend.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An error occurred while lowering a clause chain.
 *
 * <p>Every error is terminal for the chain being compiled: no combinators are
 * produced for it. Other chains are unaffected; see {@link
 * ChainCompiler#compileAll}.
 */
public class CompileException extends RuntimeException {
  private final Kind kind;
  private final int clauseIndex;
  private final @Nullable String variable;
  private final Pos pos;

  public CompileException(
      Kind kind,
      String message,
      int clauseIndex,
      @Nullable String variable,
      Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.clauseIndex = clauseIndex;
    this.variable = variable;
    this.pos = requireNonNull(pos);
  }

  /** Creates an exception located at a clause. */
  public static CompileException of(
      Kind kind, Clause clause, @Nullable String variable, String message) {
    return new CompileException(
        kind, message, clause.index, variable, clause.pos);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  /** Returns the kind of error. */
  public Kind kind() {
    return kind;
  }

  /** Returns the index of the offending clause, or -1 if there is none. */
  public int clauseIndex() {
    return clauseIndex;
  }

  /** Returns the name of the offending variable, or null. */
  public @Nullable String variable() {
    return variable;
  }

  public Pos pos() {
    return pos;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    pos.describeTo(buf).append(" Error: ").append(kind).append(": ");
    if (clauseIndex >= 0) {
      buf.append("clause ").append(clauseIndex).append(": ");
    }
    return buf.append(getMessage());
  }

  /** Kinds of error. */
  public enum Kind {
    /** Clause kind in a position the chain grammar forbids. */
    MALFORMED_CHAIN,
    /** Incompatible bindings of one name within a clause. */
    AMBIGUOUS_PATTERN_VARIABLE,
    /** Pattern variable use forbidden by the restriction policy. */
    PATTERN_VARIABLE_SCOPE_VIOLATION,
    /** Deconstruction pattern arity differs from the value's arity. */
    ARITY_MISMATCH,
    /** Use of a variable that is not definitely assigned. */
    UNASSIGNED_VARIABLE_USE,
    /** Range variable introduced twice. */
    DUPLICATE_VARIABLE
  }
}

// End CompileException.java
