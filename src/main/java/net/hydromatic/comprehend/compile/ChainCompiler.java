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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.comprehend.ast.ClauseChain;

/**
 * Lowers clause chains to combinators.
 *
 * <p>Runs, in order, the {@link FlowAnalyzer}, the {@link ScopeGuard}, the
 * {@link CarrierSynthesizer} and the {@link Translator}. The {@link Tracer}
 * sees the result of each stage.
 *
 * <p>A compiler holds only immutable configuration, so one instance may
 * compile several chains, concurrently if need be.
 */
public class ChainCompiler {
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;

  public ChainCompiler(Map<Prop, Object> props, Tracer tracer) {
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a compiler with default properties and no tracing. */
  public ChainCompiler() {
    this(ImmutableMap.of(), Tracers.empty());
  }

  /** Returns the restriction policy in force. */
  public RestrictionPolicy policy() {
    return Prop.RESTRICTION_POLICY.enumValue(props, RestrictionPolicy.class);
  }

  /**
   * Lowers a chain.
   *
   * @throws CompileException if the chain is invalid or breaks the
   *     restriction policy
   */
  public ImmutableList<Combinator> compile(ClauseChain chain) {
    final FlowFacts facts = FlowAnalyzer.analyze(chain);
    tracer.onFlow(facts);

    new ScopeGuard(policy()).check(facts);

    final CarrierPlan plan = CarrierSynthesizer.synthesize(facts);
    tracer.onCarriers(plan);

    final ImmutableList<Combinator> combinators =
        Translator.translate(
            facts, plan, Prop.VALIDATE_CARRIERS.booleanValue(props));
    tracer.onCombinators(combinators);
    return combinators;
  }

  /**
   * Lowers several independent chains.
   *
   * <p>An error in one chain does not prevent the others from compiling;
   * it is reported to the tracer and returned in that chain's result.
   */
  public ImmutableList<CompiledChain> compileAll(List<ClauseChain> chains) {
    final ImmutableList.Builder<CompiledChain> results =
        ImmutableList.builder();
    for (ClauseChain chain : chains) {
      try {
        results.add(new CompiledChain(chain, compile(chain), null));
      } catch (CompileException e) {
        tracer.handleCompileException(e);
        results.add(new CompiledChain(chain, null, e));
      }
    }
    return results.build();
  }
}

// End ChainCompiler.java
