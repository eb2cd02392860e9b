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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  REAL_LITERAL(true),
  STRING_LITERAL(true),
  UNIT_LITERAL(true),

  // binding patterns, used in "from" and "let"
  ID_PAT(true),
  WILDCARD_PAT(true),
  TUPLE_PAT(true),

  // refutable patterns, used on the right of "is"
  TYPE_PAT(true),
  VAR_PAT(true),

  // value constructors
  TUPLE(true),
  LIST(true),

  /** "int.tryParse(s, out i)"; binds {@code i} if {@code s} parses. */
  TRY_PARSE(true),

  /** Extracts the nth component of a tuple, "#1 e". */
  FIELD("#", 8),
  NOT("not ", 8),
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  CARET(" ^ ", 6),
  LE(" <= ", 4),
  LT(" < ", 4),
  GE(" >= ", 4),
  GT(" > ", 4),
  EQ(" = ", 4),
  NE(" <> ", 4),
  /** Pattern test, "e is int i". */
  IS(" is ", 4),
  ANDALSO(" andalso ", 2),
  ORELSE(" orelse ", 1),
  IF("if ", 0),

  // clauses
  FROM("from "),
  LET("let "),
  WHERE("where "),
  TAKE_WHILE("takeWhile "),
  SKIP_WHILE("skipWhile "),
  SELECT("select "),
  /** A clause that holds a list of already-lowered combinators. */
  COMBINATORS("combinators ");

  /** Operator name, padded with spaces if infix. */
  public final String padded;

  /** Left precedence. */
  public final int left;

  /** Right precedence. */
  public final int right;

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(boolean atom) {
    this("", 1000, 1000);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  /** Returns whether this is the kind of a clause in a chain. */
  public boolean isClause() {
    switch (this) {
    case FROM:
    case LET:
    case WHERE:
    case TAKE_WHILE:
    case SKIP_WHILE:
    case SELECT:
    case COMBINATORS:
      return true;
    default:
      return false;
    }
  }

  /**
   * Returns whether a clause of this kind decides, by its boolean result,
   * whether an element continues to the next clause.
   *
   * <p>Only for such clauses may pattern variables that are definitely
   * assigned when the clause is true be definitely assigned downstream. "where"
   * drops elements for which it is false; "takeWhile" stops at the first such
   * element. "skipWhile" does not qualify: once it has stopped skipping, it
   * passes elements for which it is false.
   */
  public boolean gatesContinuation() {
    return this == WHERE || this == TAKE_WHILE;
  }

  /** Returns whether this is a binary operator that returns a boolean. */
  public boolean isComparison() {
    switch (this) {
    case LE:
    case LT:
    case GE:
    case GT:
    case EQ:
    case NE:
      return true;
    default:
      return false;
    }
  }
}

// End Op.java
