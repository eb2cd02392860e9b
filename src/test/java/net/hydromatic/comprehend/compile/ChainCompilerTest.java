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

import static net.hydromatic.comprehend.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.comprehend.Fixture;
import net.hydromatic.comprehend.ast.ClauseChain;
import net.hydromatic.comprehend.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Test {@link ChainCompiler}, {@link Prop} and {@link Tracers}. */
public class ChainCompilerTest {
  private static ClauseChain parseAndSelect(Fixture f) {
    return f.builder()
        .from("s", f.strings("1", "x", "2"))
        .where(ast.tryParse(PrimitiveType.INT, f.s, "i"))
        .select(f.i)
        .build();
  }

  private static ClauseChain ambiguous(Fixture f) {
    return f.builder()
        .from("o", f.objs)
        .where(
            ast.orElse(
                ast.isType(f.o, PrimitiveType.INT, "i"),
                ast.isType(f.o, PrimitiveType.STRING, "i")))
        .build();
  }

  @Test
  void testPolicy() {
    final Fixture f = new Fixture();
    assertThat(new ChainCompiler().policy(),
        is(RestrictionPolicy.DISALLOW_PATTERN_VARIABLES_IN_CLAUSES));
    final ChainCompiler unique =
        f.compiler(RestrictionPolicy.REQUIRE_GLOBAL_NAME_UNIQUENESS);
    assertThat(unique.policy(),
        is(RestrictionPolicy.REQUIRE_GLOBAL_NAME_UNIQUENESS));

    final ClauseChain chain = parseAndSelect(f);
    assertThat(unique.compile(chain).size(), is(4));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> new ChainCompiler().compile(chain));
    assertThat(e.kind(),
        is(CompileException.Kind.PATTERN_VARIABLE_SCOPE_VIOLATION));
  }

  /** An error in one chain does not affect the others. */
  @Test
  void testCompileAll() {
    final Fixture f = new Fixture();
    final List<CompileException> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCompileException(Tracers.empty(), exceptions::add);
    final ChainCompiler compiler =
        f.compiler(RestrictionPolicy.REQUIRE_GLOBAL_NAME_UNIQUENESS, tracer);

    final List<CompiledChain> results =
        compiler.compileAll(
            ImmutableList.of(parseAndSelect(f), ambiguous(f),
                parseAndSelect(f)));
    assertThat(results.size(), is(3));
    assertThat(results.get(0).succeeded(), is(true));
    assertThat(results.get(0).exception(), nullValue());
    assertThat(results.get(1).succeeded(), is(false));
    assertThat(results.get(2).succeeded(), is(true));
    assertThat(results.get(2).combinators(), is(results.get(0).combinators()));

    assertThat(exceptions.size(), is(1));
    assertThat(exceptions.get(0), is(results.get(1).exception()));
    assertThat(exceptions.get(0).kind(),
        is(CompileException.Kind.AMBIGUOUS_PATTERN_VARIABLE));
    assertThrows(IllegalStateException.class,
        () -> results.get(1).combinators());
  }

  /** Compiling an already-lowered chain returns the same combinators. */
  @Test
  void testIdempotent() {
    final Fixture f = new Fixture();
    final ChainCompiler compiler =
        f.compiler(RestrictionPolicy.REQUIRE_GLOBAL_NAME_UNIQUENESS);
    final List<Combinator> combinators = compiler.compile(parseAndSelect(f));
    final ClauseChain lowered = ClauseChain.lowered(combinators);
    assertThat(lowered.isLowered(), is(true));
    assertThat(compiler.compile(lowered), is(combinators));
    assertThat(compiler.compile(ClauseChain.lowered(ImmutableList.of())),
        is(ImmutableList.of()));
  }

  @Test
  void testTracer() {
    final Fixture f = new Fixture();
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnFlow(tracer,
        facts -> events.add("flow " + facts.bindings()));
    tracer = Tracers.withOnCarriers(tracer, plan -> events.add("carriers "
        + plan));
    tracer = Tracers.withOnCombinators(tracer,
        combinators -> events.add("combinators " + combinators.size()));
    f.compiler(RestrictionPolicy.REQUIRE_GLOBAL_NAME_UNIQUENESS, tracer)
        .compile(parseAndSelect(f));
    assertThat(events,
        hasToString("[flow [s, i], carriers [0: {s}, 1: {i}?, 2: int], "
            + "combinators 4]"));

    // Without a handler, the exception is reported as not handled.
    assertThat(Tracers.empty().handleCompileException(
            assertThrows(CompileException.class,
                () -> new ChainCompiler().compile(ambiguous(f)))),
        is(false));
  }

  @Test
  void testValidateCarriers() {
    final Fixture f = new Fixture();
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.VALIDATE_CARRIERS.booleanValue(map), is(true));
    map.put(Prop.VALIDATE_CARRIERS, false);
    assertThat(Prop.VALIDATE_CARRIERS.booleanValue(map), is(false));
    map.put(Prop.RESTRICTION_POLICY,
        RestrictionPolicy.REQUIRE_GLOBAL_NAME_UNIQUENESS);
    final ChainCompiler compiler = new ChainCompiler(map, Tracers.empty());
    assertThat(compiler.compile(parseAndSelect(f)).size(), is(4));
  }

  @Test
  void testProp() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(
        Prop.RESTRICTION_POLICY.enumValue(map, RestrictionPolicy.class),
        is(RestrictionPolicy.DISALLOW_PATTERN_VARIABLES_IN_CLAUSES));
    map.put(Prop.RESTRICTION_POLICY,
        RestrictionPolicy.REQUIRE_GLOBAL_NAME_UNIQUENESS);
    assertThat(
        Prop.RESTRICTION_POLICY.enumValue(map, RestrictionPolicy.class),
        is(RestrictionPolicy.REQUIRE_GLOBAL_NAME_UNIQUENESS));
    assertThat(Prop.RESTRICTION_POLICY.camelName, is("restrictionPolicy"));

    final IllegalArgumentException e0 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.VALIDATE_CARRIERS.enumValue(map,
                RestrictionPolicy.class));
    assertThat(e0.getMessage(),
        is("invalid type RestrictionPolicy for property validateCarriers"));

    map.put(Prop.VALIDATE_CARRIERS, "yes");
    final IllegalArgumentException e1 =
        assertThrows(IllegalArgumentException.class,
            () -> new ChainCompiler(map, Tracers.empty()).compile(
                parseAndSelect(new Fixture())));
    assertThat(e1.getMessage(),
        is("value for property validateCarriers must have type Boolean"));
  }
}

// End ChainCompilerTest.java
