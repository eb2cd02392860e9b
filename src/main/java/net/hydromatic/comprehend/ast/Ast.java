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
import java.util.List;
import java.util.Objects;
import net.hydromatic.comprehend.type.PrimitiveType;
import net.hydromatic.comprehend.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expressions and patterns that occur in clauses.
 *
 * <p>Every node has a type. Types are assigned when the node is created (see
 * {@link AstBuilder}); the tree is assumed to have been type-checked by the
 * client.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short.
 */
public class Ast {
  private Ast() {}

  /** Base class for a pattern. */
  public abstract static class Pat extends AstNode {
    public final Type type;

    Pat(Op op, Type type) {
      super(Pos.ZERO, op);
      this.type = requireNonNull(type);
    }
  }

  /**
   * Named pattern.
   *
   * <p>For example, "x" in "from x in list".
   */
  public static class IdPat extends Pat {
    public final String name;

    IdPat(Type type, String name) {
      super(Op.ID_PAT, type);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IdPat
              && ((IdPat) o).name.equals(name)
              && ((IdPat) o).type.equals(type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Wildcard pattern, "_". */
  public static class WildcardPat extends Pat {
    WildcardPat(Type type) {
      super(Op.WILDCARD_PAT, type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Tuple pattern, the pattern analog of the {@link Tuple} expression.
   *
   * <p>For example, "(dx, dy)" in "let (dx, dy) = (a - x0, b - y0)".
   */
  public static class TuplePat extends Pat {
    public final List<Pat> args;

    TuplePat(Type type, ImmutableList<Pat> args) {
      super(Op.TUPLE_PAT, type);
      this.args = requireNonNull(args);
    }

    /** Returns the number of components. */
    public int arity() {
      return args.size();
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll("(", args, ")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Type-test pattern, the right-hand side of "o is int i".
   *
   * <p>Refutable: matches only non-null values of {@link #type}. If {@link
   * #name} is not null, a successful match binds it.
   */
  public static class TypePat extends Pat {
    public final @Nullable String name;

    TypePat(Type type, @Nullable String name) {
      super(Op.TYPE_PAT, type);
      this.name = name;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(type.moniker());
      return name == null ? w : w.append(" ").id(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Variable pattern, the right-hand side of "e is var x".
   *
   * <p>Always matches, even a null value, and binds {@link #name}.
   */
  public static class VarPat extends Pat {
    public final String name;

    VarPat(Type type, String name) {
      super(Op.VAR_PAT, type);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("var ").id(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Base class of expressions. */
  public abstract static class Exp extends AstNode {
    public final Type type;

    Exp(Op op, Type type) {
      super(Pos.ZERO, op);
      this.type = requireNonNull(type);
    }
  }

  /** Reference to a variable. */
  public static class Id extends Exp {
    public final String name;

    Id(Type type, String name) {
      super(Op.ID, type);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Id
              && ((Id) o).name.equals(name)
              && ((Id) o).type.equals(type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Literal. */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Op op, Type type, Comparable value) {
      super(op, type);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && op == ((Literal) o).op
              && value.equals(((Literal) o).value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return op == Op.UNIT_LITERAL ? w.append("()") : w.appendLiteral(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Tuple expression, "(a, b)". */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Type type, ImmutableList<Exp> args) {
      super(Op.TUPLE, type);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Tuple && args.equals(((Tuple) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll("(", args, ")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** List expression, "[a, b]". */
  public static class ListExp extends Exp {
    public final List<Exp> args;

    ListExp(Type type, ImmutableList<Exp> args) {
      super(Op.LIST, type);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ListExp && args.equals(((ListExp) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll("[", args, "]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Extracts a component of a tuple.
   *
   * <p>{@link #index} is zero-based, but is printed one-based, as in "#1 t".
   */
  public static class Field extends Exp {
    public final Exp exp;
    public final int index;

    Field(Type type, Exp exp, int index) {
      super(Op.FIELD, type);
      this.exp = requireNonNull(exp);
      this.index = index;
    }

    @Override
    public int hashCode() {
      return Objects.hash(exp, index);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Field
              && exp.equals(((Field) o).exp)
              && index == ((Field) o).index;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("#" + (index + 1) + " ").append(exp, op.right, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a built-in operator, such as "a + b" or "not c". */
  public static class Call extends Exp {
    public final List<Exp> args;

    Call(Op op, Type type, ImmutableList<Exp> args) {
      super(op, type);
      this.args = requireNonNull(args);
      checkArgument(
          op == Op.NOT ? args.size() == 1 : args.size() == 2,
          "wrong number of arguments for %s",
          op);
    }

    public Exp arg(int i) {
      return args.get(i);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Call
              && op == ((Call) o).op
              && args.equals(((Call) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (op == Op.NOT) {
        return w.prefix(left, op, args.get(0), right);
      }
      return w.infix(left, args.get(0), op, args.get(1), right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Conditional expression, "if c then a else b". */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Type type, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.IF, type);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof If
              && condition.equals(((If) o).condition)
              && ifTrue.equals(((If) o).ifTrue)
              && ifFalse.equals(((If) o).ifFalse);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("if ")
          .append(condition, 0, 0)
          .append(" then ")
          .append(ifTrue, 0, 0)
          .append(" else ")
          .append(ifFalse, 0, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Pattern test, "e is int i" or "e is var x".
   *
   * <p>Evaluates to true if {@link #exp} matches {@link #pat}; binds the
   * pattern's variable, if any, when it does.
   */
  public static class Is extends Exp {
    public final Exp exp;
    public final Pat pat;

    Is(Exp exp, Pat pat) {
      super(Op.IS, PrimitiveType.BOOL);
      this.exp = requireNonNull(exp);
      this.pat = requireNonNull(pat);
      checkArgument(
          pat.op == Op.TYPE_PAT || pat.op == Op.VAR_PAT,
          "not a refutable pattern: %s",
          pat);
    }

    /** Returns the name of the variable bound by this test, or null. */
    public @Nullable String boundName() {
      return pat instanceof VarPat
          ? ((VarPat) pat).name
          : ((TypePat) pat).name;
    }

    /**
     * Returns whether the bound variable may be null. Only an irrefutable "var"
     * pattern over a nullable expression can bind null.
     */
    public boolean boundNullable() {
      return pat instanceof VarPat && exp.type.isNullable();
    }

    @Override
    public int hashCode() {
      return Objects.hash(exp, pat.toString());
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Is
              && exp.equals(((Is) o).exp)
              && pat.type.equals(((Is) o).pat.type)
              && pat.toString().equals(((Is) o).pat.toString());
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, exp, op, pat, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Call to a try-parse function, "int.tryParse(s, out i)".
   *
   * <p>Evaluates to true, and binds {@link #name}, if the string {@link #exp}
   * can be parsed as a value of {@link #targetType}.
   */
  public static class TryParse extends Exp {
    public final PrimitiveType targetType;
    public final Exp exp;
    public final String name;

    TryParse(PrimitiveType targetType, Exp exp, String name) {
      super(Op.TRY_PARSE, PrimitiveType.BOOL);
      this.targetType = requireNonNull(targetType);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
      checkArgument(
          targetType == PrimitiveType.INT
              || targetType == PrimitiveType.REAL
              || targetType == PrimitiveType.BOOL,
          "cannot parse %s",
          targetType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(targetType, exp, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TryParse
              && targetType == ((TryParse) o).targetType
              && exp.equals(((TryParse) o).exp)
              && name.equals(((TryParse) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(targetType.moniker)
          .append(".tryParse(")
          .append(exp, 0, 0)
          .append(", out ")
          .id(name)
          .append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Ast.java
