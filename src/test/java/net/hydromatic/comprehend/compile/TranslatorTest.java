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

import static net.hydromatic.comprehend.Matchers.isCompileException;
import static net.hydromatic.comprehend.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.comprehend.Fixture;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.ClauseChain;
import net.hydromatic.comprehend.eval.Pipeline;
import net.hydromatic.comprehend.type.PrimitiveType;
import net.hydromatic.comprehend.util.Static;
import org.junit.jupiter.api.Test;

/** Test {@link Translator}. */
public class TranslatorTest {
  private static ImmutableList<Combinator> translate(ClauseChain chain) {
    final FlowFacts facts = FlowAnalyzer.analyze(chain);
    return Translator.translate(
        facts, CarrierSynthesizer.synthesize(facts), true);
  }

  private static List<Combinator.Kind> kinds(List<Combinator> combinators) {
    return Static.transform(combinators, c -> c.kind);
  }

  private static List<Combinator.Role> roles(List<Combinator> combinators) {
    return Static.transform(combinators, c -> c.role);
  }

  /** Returns "from s in ["1", "x", "2"] where int.tryParse(s, out i)
   * select i". */
  private static ClauseChain parseAndSelect(Fixture f) {
    return f.builder()
        .from("s", f.strings("1", "x", "2"))
        .where(ast.tryParse(PrimitiveType.INT, f.s, "i"))
        .select(f.i)
        .build();
  }

  @Test
  void testParse() {
    final Fixture f = new Fixture();
    final List<Combinator> combinators = translate(parseAndSelect(f));
    assertThat(combinators.size(), is(4));
    assertThat(combinators.get(0),
        hasToString("flatMap {} -> {s}: s in [\"1\", \"x\", \"2\"] "
            + "yield {s}"));
    assertThat(combinators.get(1),
        hasToString("map {s} -> {i}?: if int.tryParse(s, out i) "
            + "yield {i}"));
    assertThat(combinators.get(2),
        hasToString("filter {i}? -> {i}?: succeeded"));
    assertThat(combinators.get(3), hasToString("map {i}? -> int: yield i"));
    assertThat(kinds(combinators),
        hasToString("[FLAT_MAP, MAP, FILTER, MAP]"));
    assertThat(Pipeline.run(combinators), hasToString("[1, 2]"));
  }

  @Test
  void testFilter() {
    // from x in [1, 2, 3] where x > 1 select x * 10
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1, 2, 3))
            .where(ast.greaterThan(f.x, f.intLiteral(1)))
            .select(ast.times(f.x, f.intLiteral(10)))
            .build();
    final List<Combinator> combinators = translate(chain);
    assertThat(combinators.get(1), hasToString("filter {x} -> {x}: x > 1"));
    assertThat(roles(combinators), hasToString("[BIND, TEST, PROJECT]"));
    assertThat(Pipeline.run(combinators), hasToString("[20, 30]"));
  }

  /** Removing a live field from a carrier makes the chain invalid. */
  @Test
  void testCarrierIsMinimal() {
    final Fixture f = new Fixture();
    final FlowFacts facts = FlowAnalyzer.analyze(parseAndSelect(f));
    final CarrierPlan plan = CarrierSynthesizer.synthesize(facts);
    final CarrierPlan plan2 = plan.withoutField(1, "i");
    assertThat(plan2.output(1), hasToString("{}?"));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> Translator.translate(facts, plan2, true));
    assertThat(e,
        isCompileException(CompileException.Kind.UNASSIGNED_VARIABLE_USE, 2,
            "variable 'i' is not definitely assigned in clause 2"));

    final CarrierPlan plan3 = plan.withoutField(0, "s");
    final CompileException e3 =
        assertThrows(CompileException.class,
            () -> Translator.translate(facts, plan3, true));
    assertThat(e3.clauseIndex(), is(1));
    assertThat(e3.variable(), is("s"));
  }

  /** A stage that does not allocate passes on fields that are dead. */
  @Test
  void testPassThrough() {
    // from x in [1, 2, 3] from y in [10] where x > 1 select y
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1, 2, 3))
            .from("y", f.ints(10))
            .where(ast.greaterThan(f.x, f.intLiteral(1)))
            .select(f.y)
            .build();
    final FlowFacts facts = FlowAnalyzer.analyze(chain);
    final CarrierPlan plan = CarrierSynthesizer.synthesize(facts);
    assertThat(plan.output(2), hasToString("{y}"));

    final List<Combinator> combinators =
        Translator.translate(facts, plan, true);
    assertThat(combinators.get(2),
        hasToString("filter {x, y} -> {x, y}: x > 1"));
    assertThat(combinators.get(3), hasToString("map {x, y} -> int: yield y"));
    assertThat(combinators.get(2).allocates(), is(false));
    assertThat(Pipeline.run(combinators), hasToString("[10, 10]"));
  }

  /** If a successful payload may be null, failures are tagged. */
  @Test
  void testTagged() {
    // from o in objs where not (o is int) andalso o is var v select v
    final Fixture f = new Fixture();
    final Ast.Is isVar = ast.isVar(f.o, "v");
    final ClauseChain chain =
        f.builder()
            .from("o", f.objs)
            .where(
                ast.andAlso(
                    ast.not(ast.isType(f.o, PrimitiveType.INT)), isVar))
            .select(ast.id("v", isVar.pat.type))
            .build();
    final List<Combinator> combinators = translate(chain);
    assertThat(roles(combinators),
        hasToString("[BIND, GUARD, REJECT_FAILURE, UNWRAP, PROJECT]"));
    assertThat(combinators.get(2),
        hasToString("filter {v}! -> {v}!: succeeded"));
    assertThat(combinators.get(3), hasToString("map {v}! -> {v}: unwrap"));
    assertThat(combinators.get(4), hasToString("map {v} -> obj: yield v"));

    final List<Object> result =
        new Pipeline(combinators)
            .run(ImmutableMap.of("objs", Arrays.asList(1, null, "a")));
    assertThat(result, hasToString("[null, a]"));
  }

  @Test
  void testTakeWhile() {
    // from x in [1, 2, 3, 1] takeWhile x < 3
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1, 2, 3, 1))
            .takeWhile(ast.lessThan(f.x, f.intLiteral(3)))
            .build();
    final List<Combinator> combinators = translate(chain);
    assertThat(kinds(combinators), hasToString("[FLAT_MAP, TAKE_WHILE, MAP]"));
    assertThat(Pipeline.run(combinators), hasToString("[1, 2]"));
  }

  @Test
  void testTakeWhileParsed() {
    // from s in ["1", "2", "x", "3"] takeWhile int.tryParse(s, out i)
    // select i
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("s", f.strings("1", "2", "x", "3"))
            .takeWhile(ast.tryParse(PrimitiveType.INT, f.s, "i"))
            .select(f.i)
            .build();
    final List<Combinator> combinators = translate(chain);
    assertThat(combinators.get(2),
        hasToString("takeWhile {i}? -> {i}?: succeeded"));
    assertThat(Pipeline.run(combinators), hasToString("[1, 2]"));
  }

  @Test
  void testSkipWhile() {
    // from x in [1, 2, 3, 1] skipWhile x < 2
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1, 2, 3, 1))
            .skipWhile(ast.lessThan(f.x, f.intLiteral(2)))
            .build();
    final List<Combinator> combinators = translate(chain);
    assertThat(combinators.get(1),
        hasToString("skipWhile {x} -> {x}: x < 2"));
    assertThat(Pipeline.run(combinators), hasToString("[2, 3, 1]"));
  }

  @Test
  void testLet() {
    // from x in [1, 2] let y = x + 1 select x * y
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1, 2))
            .let("y", ast.plus(f.x, f.intLiteral(1)))
            .select(ast.times(f.x, f.y))
            .build();
    final List<Combinator> combinators = translate(chain);
    assertThat(combinators.get(1),
        hasToString("map {x} -> {x, y}: y = x + 1 yield {x, y}"));
    assertThat(Pipeline.run(combinators), hasToString("[2, 6]"));
  }
}

// End TranslatorTest.java
