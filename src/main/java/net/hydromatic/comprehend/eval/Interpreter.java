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
package net.hydromatic.comprehend.eval;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates expressions.
 *
 * <p>Tuples and lists evaluate to unmodifiable {@link List} instances, whose
 * elements may be null. A successful pattern test assigns its variable in the
 * environment's frame, so that expressions evaluated later, such as the right
 * operand of "andalso", can read it.
 */
public class Interpreter {
  private Interpreter() {}

  /** Evaluates an expression. */
  public static @Nullable Object eval(Ast.Exp exp, MutableEvalEnv env) {
    switch (exp.op) {
    case ID:
      return env.get(((Ast.Id) exp).name);

    case BOOL_LITERAL:
    case INT_LITERAL:
    case REAL_LITERAL:
    case STRING_LITERAL:
    case UNIT_LITERAL:
      return ((Ast.Literal) exp).value;

    case TUPLE:
      return evalAll(((Ast.Tuple) exp).args, env);

    case LIST:
      return evalAll(((Ast.ListExp) exp).args, env);

    case FIELD:
      final Ast.Field field = (Ast.Field) exp;
      return ((List<?>) requireNonNull(eval(field.exp, env))).get(field.index);

    case IF:
      final Ast.If if_ = (Ast.If) exp;
      return evalBool(if_.condition, env)
          ? eval(if_.ifTrue, env)
          : eval(if_.ifFalse, env);

    case IS:
      return evalIs((Ast.Is) exp, env);

    case TRY_PARSE:
      return evalTryParse((Ast.TryParse) exp, env);

    case NOT:
      return !evalBool(((Ast.Call) exp).arg(0), env);

    case ANDALSO:
      final Ast.Call andAlso = (Ast.Call) exp;
      return evalBool(andAlso.arg(0), env) && evalBool(andAlso.arg(1), env);

    case ORELSE:
      final Ast.Call orElse = (Ast.Call) exp;
      return evalBool(orElse.arg(0), env) || evalBool(orElse.arg(1), env);

    default:
      return evalCall((Ast.Call) exp, env);
    }
  }

  /** Evaluates a boolean expression. */
  public static boolean evalBool(Ast.Exp exp, MutableEvalEnv env) {
    final Object o = eval(exp, env);
    checkArgument(o instanceof Boolean, "not a boolean: %s", o);
    return (Boolean) o;
  }

  private static List<@Nullable Object> evalAll(
      List<Ast.Exp> exps, MutableEvalEnv env) {
    final @Nullable Object[] values = new Object[exps.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = eval(exps.get(i), env);
    }
    return Collections.unmodifiableList(Arrays.asList(values));
  }

  private static boolean evalIs(Ast.Is is, MutableEvalEnv env) {
    final Object value = eval(is.exp, env);
    if (is.pat instanceof Ast.VarPat) {
      env.assign(((Ast.VarPat) is.pat).name, value);
      return true;
    }
    final Ast.TypePat typePat = (Ast.TypePat) is.pat;
    if (value == null || !typePat.type.accepts(value)) {
      return false;
    }
    if (typePat.name != null) {
      env.assign(typePat.name, value);
    }
    return true;
  }

  private static boolean evalTryParse(
      Ast.TryParse tryParse, MutableEvalEnv env) {
    final Object s = eval(tryParse.exp, env);
    if (!(s instanceof String)) {
      return false;
    }
    final Object value = parse(tryParse.targetType, (String) s);
    if (value == null) {
      return false;
    }
    env.assign(tryParse.name, value);
    return true;
  }

  /** Parses a string as a value of a given type; returns null if invalid. */
  static @Nullable Object parse(PrimitiveType type, String s) {
    switch (type) {
    case INT:
      return Ints.tryParse(s);
    case REAL:
      return Doubles.tryParse(s);
    case BOOL:
      return s.equals("true") ? Boolean.TRUE
          : s.equals("false") ? Boolean.FALSE
          : null;
    default:
      throw new AssertionError("cannot parse " + type);
    }
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private static Object evalCall(Ast.Call call, MutableEvalEnv env) {
    final Object a0 = eval(call.arg(0), env);
    final Object a1 = eval(call.arg(1), env);
    switch (call.op) {
    case EQ:
      return Objects.equals(a0, a1);
    case NE:
      return !Objects.equals(a0, a1);
    case LT:
      return ((Comparable) requireNonNull(a0)).compareTo(a1) < 0;
    case LE:
      return ((Comparable) requireNonNull(a0)).compareTo(a1) <= 0;
    case GT:
      return ((Comparable) requireNonNull(a0)).compareTo(a1) > 0;
    case GE:
      return ((Comparable) requireNonNull(a0)).compareTo(a1) >= 0;
    case CARET:
      return (String) requireNonNull(a0) + requireNonNull(a1);
    default:
      break;
    }
    final Number n0 = (Number) requireNonNull(a0);
    final Number n1 = (Number) requireNonNull(a1);
    if (call.type == PrimitiveType.REAL) {
      final double d0 = n0.doubleValue();
      final double d1 = n1.doubleValue();
      switch (call.op) {
      case PLUS:
        return d0 + d1;
      case MINUS:
        return d0 - d1;
      case TIMES:
        return d0 * d1;
      case DIVIDE:
        return d0 / d1;
      default:
        throw new AssertionError("unknown operator " + call.op);
      }
    }
    final int i0 = n0.intValue();
    final int i1 = n1.intValue();
    switch (call.op) {
    case PLUS:
      return i0 + i1;
    case MINUS:
      return i0 - i1;
    case TIMES:
      return i0 * i1;
    case DIVIDE:
      checkArgument(i1 != 0, "division by zero");
      return i0 / i1;
    default:
      throw new AssertionError("unknown operator " + call.op);
    }
  }
}

// End Interpreter.java
