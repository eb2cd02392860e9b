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

import java.util.List;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on flow facts, then calls
   * the underlying tracer.
   */
  public static Tracer withOnFlow(Tracer tracer, Consumer<FlowFacts> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFlow(FlowFacts facts) {
        consumer.accept(facts);
        super.onFlow(facts);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a carrier plan, then
   * calls the underlying tracer.
   */
  public static Tracer withOnCarriers(
      Tracer tracer, Consumer<CarrierPlan> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCarriers(CarrierPlan plan) {
        consumer.accept(plan);
        super.onCarriers(plan);
      }
    };
  }

  public static Tracer withOnCombinators(
      Tracer tracer, Consumer<List<Combinator>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCombinators(List<Combinator> combinators) {
        consumer.accept(combinators);
        super.onCombinators(combinators);
      }
    };
  }

  public static Tracer withOnCompileException(
      Tracer tracer, Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onFlow(FlowFacts facts) {}

    @Override
    public void onCarriers(CarrierPlan plan) {}

    @Override
    public void onCombinators(List<Combinator> combinators) {}

    @Override
    public boolean handleCompileException(CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onFlow(FlowFacts facts) {
      tracer.onFlow(facts);
    }

    @Override
    public void onCarriers(CarrierPlan plan) {
      tracer.onCarriers(plan);
    }

    @Override
    public void onCombinators(List<Combinator> combinators) {
      tracer.onCombinators(combinators);
    }

    @Override
    public boolean handleCompileException(CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
