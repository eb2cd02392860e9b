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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.compile.Carrier;
import net.hydromatic.comprehend.compile.Combinator;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.linq4j.function.Function1;
import org.apache.calcite.linq4j.function.Function2;
import org.apache.calcite.linq4j.function.Predicate1;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Executes a list of combinators.
 *
 * <p>The first stage receives a single unit value. Each combinator becomes a
 * call to the corresponding {@link Enumerable} method: map to {@code select},
 * filter to {@code where}, flat-map to {@code selectMany}, and so forth.
 * Evaluation is lazy until {@link #run} materializes the result.
 */
public class Pipeline {
  private final List<Combinator> combinators;

  public Pipeline(List<Combinator> combinators) {
    this.combinators = requireNonNull(combinators);
  }

  /**
   * Runs the pipeline and returns the values it produces.
   *
   * @param outer Values of the variables that the chain does not bind
   */
  public List<@Nullable Object> run(Map<String, ?> outer) {
    final EvalEnv env = EvalEnvs.copyOf(outer);
    Enumerable<Object> enumerable = Linq4j.singletonEnumerable(Unit.INSTANCE);
    for (Combinator combinator : combinators) {
      enumerable = apply(enumerable, combinator, env);
    }
    return enumerable.toList();
  }

  /** Runs a pipeline that has no outer variables. */
  public static List<@Nullable Object> run(List<Combinator> combinators) {
    return new Pipeline(combinators).run(ImmutableMap.of());
  }

  private static Enumerable<Object> apply(
      Enumerable<Object> enumerable, Combinator c, EvalEnv outer) {
    switch (c.role) {
    case BIND:
      if (c.kind == Combinator.Kind.FLAT_MAP) {
        return flatMap(enumerable, c, outer);
      }
      final Ast.Exp source = requireNonNull(c.source);
      final Function1<Object, Object> bind = v -> bind(c, v, source, outer);
      return enumerable.select(bind);

    case GUARD:
      final Function1<Object, Object> guard =
          v -> guard(c, v, outer);
      return enumerable.select(guard);

    case PROJECT:
      final Function1<Object, Object> project =
          v -> Interpreter.eval(
              c.fieldExps.get(0),
              Carriers.unpack(c.input, v, outer).bindMutable());
      return enumerable.select(project);

    case UNWRAP:
      final Function1<Object, Object> unwrap =
          v -> ((Tagged) requireNonNull(v)).payload;
      return enumerable.select(unwrap);

    case TEST:
      final Ast.Exp condition = requireNonNull(c.condition);
      final Predicate1<Object> predicate =
          v -> Interpreter.evalBool(
              condition, Carriers.unpack(c.input, v, outer).bindMutable());
      return test(enumerable, c.kind, predicate);

    case REJECT_FAILURE:
      final Predicate1<Object> succeeded;
      if (c.input.representation == Carrier.Representation.TAGGED) {
        succeeded = v -> ((Tagged) requireNonNull(v)).ok;
      } else {
        succeeded = v -> v != null;
      }
      return test(enumerable, c.kind, succeeded);

    default:
      throw new AssertionError("unknown role " + c.role);
    }
  }

  private static Enumerable<Object> test(
      Enumerable<Object> enumerable,
      Combinator.Kind kind,
      Predicate1<Object> predicate) {
    switch (kind) {
    case FILTER:
      return enumerable.where(predicate);
    case TAKE_WHILE:
      return enumerable.takeWhile(predicate);
    case SKIP_WHILE:
      return enumerable.skipWhile(predicate);
    default:
      throw new AssertionError("not a test: " + kind);
    }
  }

  private static Enumerable<Object> flatMap(
      Enumerable<Object> enumerable, Combinator c, EvalEnv outer) {
    final Ast.Exp source = requireNonNull(c.source);
    final Function1<Object, Enumerable<Object>>
        collectionSelector =
            v -> {
              final Object collection =
                  Interpreter.eval(
                      source, Carriers.unpack(c.input, v, outer).bindMutable());
              @SuppressWarnings("unchecked")
              final List<@Nullable Object> list =
                  (List<@Nullable Object>) requireNonNull(collection);
              return Linq4j.asEnumerable(list);
            };
    final Function2<Object, Object, Object>
        resultSelector = (v, element) -> fields(c, v, element, outer);
    return enumerable.selectMany(collectionSelector, resultSelector);
  }

  /** Evaluates the source of a "let" and builds the new carrier. */
  private static @Nullable Object bind(
      Combinator c, @Nullable Object v, Ast.Exp source, EvalEnv outer) {
    final Object value =
        Interpreter.eval(
            source, Carriers.unpack(c.input, v, outer).bindMutable());
    return fields(c, v, value, outer);
  }

  /**
   * Binds a value to the combinator's binder, evaluates the field
   * expressions, and packs the results.
   */
  private static @Nullable Object fields(
      Combinator c, @Nullable Object v, @Nullable Object value,
      EvalEnv outer) {
    final MutableEvalEnv env =
        Carriers.unpack(c.input, v, outer)
            .bind(requireNonNull(c.binder), value)
            .bindMutable();
    final List<@Nullable Object> values = new ArrayList<>();
    for (Ast.Exp exp : c.fieldExps) {
      values.add(Interpreter.eval(exp, env));
    }
    return Carriers.pack(c.output, values);
  }

  /**
   * Evaluates a condition; on success builds the new carrier from the
   * variables the condition assigned, on failure returns null or a failed
   * tag.
   */
  private static @Nullable Object guard(
      Combinator c, @Nullable Object v, EvalEnv outer) {
    final MutableEvalEnv env =
        Carriers.unpack(c.input, v, outer).bindMutable();
    final boolean tagged =
        c.output.representation == Carrier.Representation.TAGGED;
    if (!Interpreter.evalBool(requireNonNull(c.condition), env)) {
      return tagged ? Tagged.FAILURE : null;
    }
    final List<@Nullable Object> values = new ArrayList<>();
    for (Ast.Exp exp : c.fieldExps) {
      values.add(Interpreter.eval(exp, env));
    }
    final Object payload = Carriers.pack(c.output, values);
    return tagged ? Tagged.success(payload) : payload;
  }
}

// End Pipeline.java
