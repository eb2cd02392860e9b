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
import java.util.List;
import net.hydromatic.comprehend.Fixture;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.Clause;
import net.hydromatic.comprehend.ast.ClauseChain;
import net.hydromatic.comprehend.eval.Pipeline;
import net.hydromatic.comprehend.type.PrimitiveType;
import net.hydromatic.comprehend.type.TupleType;
import org.junit.jupiter.api.Test;

/** Test {@link DeconstructionExpander}. */
public class DeconstructionExpanderTest {
  private static ImmutableList<Combinator> lower(ClauseChain chain) {
    final FlowFacts facts = FlowAnalyzer.analyze(chain);
    return Translator.translate(
        facts, CarrierSynthesizer.synthesize(facts), true);
  }

  private static Ast.TuplePat pair(Fixture f, Ast.Pat p0, Ast.Pat p1) {
    return ast.tuplePat(f.typeSystem, p0, p1);
  }

  private static Ast.IdPat intPat(String name) {
    return ast.idPat(name, PrimitiveType.INT);
  }

  private static Ast.Id intId(String name) {
    return ast.id(name, PrimitiveType.INT);
  }

  /** A tuple "let" becomes a single map, whatever the number of
   * variables. */
  @Test
  void testLetIsOneStage() {
    // from a in [1, 2]
    // from b in [10]
    // let (dx, dy) = (a - x0, b - y0)
    // select dx * dy
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("a", f.ints(1, 2))
            .from("b", f.ints(10))
            .let(
                pair(f, intPat("dx"), intPat("dy")),
                ast.tuple(
                    f.typeSystem,
                    ast.minus(intId("a"), intId("x0")),
                    ast.minus(intId("b"), intId("y0"))))
            .select(ast.times(intId("dx"), intId("dy")))
            .build();
    final List<Combinator> combinators = lower(chain);
    assertThat(combinators.size(), is(4));
    final Combinator let = combinators.get(2);
    assertThat(let.clauseIndex, is(2));
    assertThat(let,
        hasToString("map {a, b} -> {dx, dy}: $0 = (a - x0, b - y0) "
            + "yield {dx = #1 $0, dy = #2 $0}"));
    assertThat(let.allocates(), is(true));

    final List<Object> result =
        new Pipeline(combinators).run(ImmutableMap.of("x0", 1, "y0", 0));
    assertThat(result, hasToString("[0, 10]"));
  }

  @Test
  void testNested() {
    // from x in [1] let (a, (b, c)) = (x, (x + 1, x + 2)) select a + b + c
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1))
            .let(
                pair(f, intPat("a"), pair(f, intPat("b"), intPat("c"))),
                ast.tuple(
                    f.typeSystem,
                    f.x,
                    ast.tuple(
                        f.typeSystem,
                        ast.plus(f.x, f.intLiteral(1)),
                        ast.plus(f.x, f.intLiteral(2)))))
            .select(
                ast.plus(ast.plus(intId("a"), intId("b")), intId("c")))
            .build();

    final Clause let = chain.get(1);
    final List<Extraction> extractions =
        DeconstructionExpander.expand(
            let, let.exp.type, "$0", binding -> true);
    assertThat(extractions,
        hasToString("[a = #1 $0, b = #1 (#2 $0), c = #2 (#2 $0)]"));
    assertThat(extractions.get(2).path, hasToString("[1, 1]"));
    assertThat(extractions.get(2).binding.clauseIndex, is(1));

    assertThat(Pipeline.run(lower(chain)), hasToString("[6]"));
  }

  @Test
  void testDeadVariablesAreNotExtracted() {
    // from x in [1] let (a, _, b) = (x, x, x + 1) select b
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1))
            .let(
                ast.tuplePat(
                    f.typeSystem,
                    intPat("a"),
                    ast.wildcardPat(PrimitiveType.INT),
                    intPat("b")),
                ast.tuple(
                    f.typeSystem, f.x, f.x, ast.plus(f.x, f.intLiteral(1))))
            .select(intId("b"))
            .build();
    final FlowFacts facts = FlowAnalyzer.analyze(chain);
    final CarrierPlan plan = CarrierSynthesizer.synthesize(facts);
    assertThat(plan.spec(1).extractions, hasToString("[b = #3 $0]"));
    assertThat(Pipeline.run(Translator.translate(facts, plan, true)),
        hasToString("[2]"));
  }

  @Test
  void testArityMismatch() {
    // from x in [1] let (a, b) = x
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1))
            .let(pair(f, intPat("a"), intPat("b")), f.x)
            .build();
    CompileException e =
        assertThrows(CompileException.class, () -> lower(chain));
    assertThat(e,
        isCompileException(CompileException.Kind.ARITY_MISMATCH, 1,
            "pattern (a, b) has arity 2 but value has type int"));

    // from (a, b) in [(1, 2, 3)]
    final TupleType tripleType =
        f.typeSystem.tupleType(f.intType, f.intType, f.intType);
    final Ast.ListExp triples =
        ast.list(
            f.typeSystem,
            tripleType,
            ast.tuple(
                f.typeSystem,
                f.intLiteral(1),
                f.intLiteral(2),
                f.intLiteral(3)));
    final ClauseChain chain2 =
        f.builder()
            .from(pair(f, intPat("a"), intPat("b")), triples)
            .build();
    e = assertThrows(CompileException.class, () -> lower(chain2));
    assertThat(e,
        isCompileException(CompileException.Kind.ARITY_MISMATCH, 0,
            "pattern (a, b) has arity 2 but value has arity 3"));
  }

  @Test
  void testArityMismatchOfDeadPattern() {
    // from x in [1] let (a, b) = (x, x, x) select x
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1))
            .let(
                pair(f, intPat("a"), intPat("b")),
                ast.tuple(f.typeSystem, f.x, f.x, f.x))
            .select(f.x)
            .build();
    final CompileException e =
        assertThrows(CompileException.class, () -> lower(chain));
    assertThat(e.kind(), is(CompileException.Kind.ARITY_MISMATCH));
  }
}

// End DeconstructionExpanderTest.java
