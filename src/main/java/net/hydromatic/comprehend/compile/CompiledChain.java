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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.comprehend.ast.ClauseChain;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of compiling one chain with {@link ChainCompiler#compileAll}: either
 * its combinators or the error that stopped it.
 */
public class CompiledChain {
  public final ClauseChain chain;
  private final @Nullable ImmutableList<Combinator> combinators;
  private final @Nullable CompileException exception;

  CompiledChain(
      ClauseChain chain,
      @Nullable ImmutableList<Combinator> combinators,
      @Nullable CompileException exception) {
    this.chain = requireNonNull(chain);
    this.combinators = combinators;
    this.exception = exception;
    checkArgument((combinators == null) != (exception == null));
  }

  /** Returns whether the chain was lowered without error. */
  public boolean succeeded() {
    return combinators != null;
  }

  /**
   * Returns the combinators.
   *
   * @throws IllegalStateException if compilation failed
   */
  public ImmutableList<Combinator> combinators() {
    checkState(combinators != null, "chain failed: %s", exception);
    return requireNonNull(combinators);
  }

  /** Returns the error, or null if compilation succeeded. */
  public @Nullable CompileException exception() {
    return exception;
  }

  @Override
  public String toString() {
    return chain + " => "
        + (combinators != null ? combinators.toString() : "" + exception);
  }
}

// End CompiledChain.java
