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
package net.hydromatic.comprehend;

import static net.hydromatic.comprehend.Matchers.isCompileException;
import static net.hydromatic.comprehend.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.ChainBuilder;
import net.hydromatic.comprehend.ast.Clause;
import net.hydromatic.comprehend.ast.ClauseChain;
import net.hydromatic.comprehend.ast.Op;
import net.hydromatic.comprehend.ast.Pos;
import net.hydromatic.comprehend.ast.VariableBinding;
import net.hydromatic.comprehend.compile.ChainCompiler;
import net.hydromatic.comprehend.compile.CompileException;
import net.hydromatic.comprehend.compile.FlowAnalyzer;
import net.hydromatic.comprehend.compile.RestrictionPolicy;
import net.hydromatic.comprehend.eval.Pipeline;
import net.hydromatic.comprehend.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Test {@link ChainBuilder}. */
public class ChainBuilderTest {
  @Test
  void testImplicitSelect() {
    // from s in ["1", "x", "2"] where s <> "x"
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("s", f.strings("1", "x", "2"))
            .where(ast.call(Op.NE, f.s, f.stringLiteral("x")))
            .build();
    assertThat(chain,
        hasToString("from s in [\"1\", \"x\", \"2\"] where s <> \"x\""));
    assertThat(chain.size(), is(3));
    assertThat(chain.last().op, is(Op.SELECT));
    assertThat(chain.last().implicit, is(true));
    assertThat(chain.last().exp, hasToString("s"));
    assertThat(chain.last().exp.type, is(PrimitiveType.STRING));
  }

  @Test
  void testImplicitSelectTuple() {
    // from x in [1, 2] from y in [3] select (x, y)
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder().from("x", f.ints(1, 2)).from("y", f.ints(3)).build();
    assertThat(chain.last().exp, hasToString("(x, y)"));
    assertThat(chain.last().exp.type.moniker(), is("int * int"));
    assertThat(chain.introduces(), hasToString("[x, y]"));
  }

  @Test
  void testExplicitSelect() {
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1, 2))
            .select(ast.times(f.x, f.intLiteral(10)))
            .build();
    assertThat(chain, hasToString("from x in [1, 2] select x * 10"));
    assertThat(chain.size(), is(2));
    assertThat(chain.last().implicit, is(false));
  }

  @Test
  void testIntroduces() {
    // from o in objs
    // where o is int i orelse (o is string s andalso int.tryParse(s, out i))
    final Fixture f = new Fixture();
    final Ast.Exp condition =
        ast.orElse(
            ast.isType(f.o, PrimitiveType.INT, "i"),
            ast.andAlso(
                ast.isType(f.o, PrimitiveType.STRING, "s"),
                ast.tryParse(PrimitiveType.INT, f.s, "i")));
    final ClauseChain chain =
        f.builder().from("o", f.objs).where(condition).build();
    assertThat(condition,
        hasToString("o is int i orelse o is string s "
            + "andalso int.tryParse(s, out i)"));

    final Clause from = chain.get(0);
    assertThat(from.introduces, hasToString("[o]"));
    assertThat(from.rangeVariables().get(0).type, is(PrimitiveType.OBJ));

    // The two occurrences of "i" have the same type, so appear once.
    final Clause where = chain.get(1);
    assertThat(where.introduces, hasToString("[i, s]"));
    assertThat(where.rangeVariables().isEmpty(), is(true));
    final VariableBinding i = where.introduces.get(0);
    assertThat(i.isPattern(), is(true));
    assertThat(i.nullable, is(false));
    assertThat(i.mutabilityIn(1),
        is(VariableBinding.Mutability.MUTABLE_WITHIN_INTRODUCING_CLAUSE));
    assertThat(i.mutabilityIn(2),
        is(VariableBinding.Mutability.IMMUTABLE_THEREAFTER));
  }

  @Test
  void testVarPatternIsNullable() {
    // from o in objs where o is var v
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder().from("o", f.objs).where(ast.isVar(f.o, "v")).build();
    final VariableBinding v = chain.get(1).introduces.get(0);
    assertThat(v, hasToString("v"));
    assertThat(v.nullable, is(true));
  }

  @Test
  void testLetTuplePattern() {
    final Fixture f = new Fixture();
    final Ast.TuplePat pat =
        ast.tuplePat(
            f.typeSystem,
            ast.idPat("dx", PrimitiveType.INT),
            ast.idPat("dy", PrimitiveType.INT));
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1))
            .let(
                pat,
                ast.tuple(
                    f.typeSystem,
                    ast.minus(f.x, f.intLiteral(1)),
                    ast.minus(f.x, f.intLiteral(2))))
            .build();
    assertThat(chain.get(1), hasToString("let (dx, dy) = (x - 1, x - 2)"));
    assertThat(chain.get(1).rangeVariables(), hasToString("[dx, dy]"));
    assertThat(chain.last().exp, hasToString("(x, dx, dy)"));
  }

  @Test
  void testPos() {
    final Fixture f = new Fixture();
    final Pos pos = new Pos("query.txt", 3, 1, 3, 12);
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1))
            .at(pos)
            .where(ast.greaterThan(f.x, f.intLiteral(0)))
            .build();
    assertThat(chain.get(0).pos, is(Pos.ZERO));
    assertThat(chain.get(1).pos, is(pos));
    assertThat(pos, hasToString("query.txt:3.1-3.12"));

    final CompileException e =
        assertThrows(CompileException.class,
            () -> f.builder().at(pos).where(ast.boolLiteral(true)).build());
    assertThat(e.pos(), is(pos));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("query.txt:3.1-3.12 Error: MALFORMED_CHAIN: clause 0: "
            + "chain must start with 'from', not 'where'"));
  }

  @Test
  void testClear() {
    final Fixture f = new Fixture();
    final ChainBuilder builder = f.builder().where(ast.boolLiteral(true));
    builder.clear();
    final ClauseChain chain = builder.from("x", f.ints(1)).build();
    assertThat(chain, hasToString("from x in [1]"));
  }

  @Test
  void testMalformed() {
    final Fixture f = new Fixture();
    CompileException e =
        assertThrows(CompileException.class, () -> f.builder().build());
    assertThat(e,
        isCompileException(
            CompileException.Kind.MALFORMED_CHAIN, -1, "chain is empty"));

    e = assertThrows(CompileException.class,
        () -> f.builder().where(ast.boolLiteral(true)).build());
    assertThat(e,
        isCompileException(CompileException.Kind.MALFORMED_CHAIN, 0,
            "chain must start with 'from', not 'where'"));

    e = assertThrows(CompileException.class,
        () -> f.builder()
            .from("x", f.ints(1, 2))
            .select(f.x)
            .where(ast.boolLiteral(true))
            .build());
    assertThat(e,
        isCompileException(CompileException.Kind.MALFORMED_CHAIN, 1,
            "'select' must be the last clause"));

    e = assertThrows(CompileException.class,
        () -> f.builder().from("x", f.intLiteral(1)).build());
    assertThat(e,
        isCompileException(CompileException.Kind.MALFORMED_CHAIN, 0,
            "source of 'from' must be a list, but has type int"));
  }

  @Test
  void testDuplicateVariable() {
    // from (a, a) in [(1, 2)]
    final Fixture f = new Fixture();
    final Ast.TuplePat pat =
        ast.tuplePat(
            f.typeSystem,
            ast.idPat("a", PrimitiveType.INT),
            ast.idPat("a", PrimitiveType.INT));
    CompileException e =
        assertThrows(CompileException.class,
            () -> f.builder().from(pat, f.intPairs(1, 2)).build());
    assertThat(e,
        isCompileException(CompileException.Kind.DUPLICATE_VARIABLE, 0,
            "variable 'a' occurs twice in pattern"));
    assertThat(e.variable(), is("a"));

    // from x in [1, 2] let (a, a) = (x, x)
    e = assertThrows(CompileException.class,
        () -> f.builder()
            .from("x", f.ints(1, 2))
            .let(pat, ast.tuple(f.typeSystem, f.x, f.x))
            .build());
    assertThat(e,
        isCompileException(CompileException.Kind.DUPLICATE_VARIABLE, 1,
            "variable 'a' occurs twice in pattern"));
  }

  /** A range variable may reuse the name of a variable that is no longer
   * read; later clauses see the new variable. */
  @Test
  void testReintroduceRangeName() {
    // from x in [1, 2] let y = x + 1 let x = y * 2 select x
    final Fixture f = new Fixture();
    final ClauseChain chain =
        f.builder()
            .from("x", f.ints(1, 2))
            .let("y", ast.plus(f.x, f.intLiteral(1)))
            .let("x", ast.times(f.y, f.intLiteral(2)))
            .select(f.x)
            .build();
    assertThat(chain.introduces(), hasToString("[x, y, x]"));
    assertThat(FlowAnalyzer.analyze(chain).references(3),
        hasToString("[x (clause 2)]"));

    final ChainCompiler compiler =
        f.compiler(RestrictionPolicy.DISALLOW_PATTERN_VARIABLES_IN_CLAUSES);
    assertThat(Pipeline.run(compiler.compile(chain)), hasToString("[4, 6]"));

    // from x in [1, 2] from y in [10] let x = x + y
    // The implicit select returns the most recent "x".
    final ClauseChain chain2 =
        f.builder()
            .from("x", f.ints(1, 2))
            .from("y", f.ints(10))
            .let("x", ast.plus(f.x, f.y))
            .build();
    assertThat(chain2.last().exp, hasToString("(y, x)"));
    assertThat(Pipeline.run(compiler.compile(chain2)),
        hasToString("[[10, 11], [10, 12]]"));
  }
}

// End ChainBuilderTest.java
