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
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.VariableBinding;

/**
 * How to get the value of one variable of a deconstruction pattern.
 *
 * <p>For example, in "let (a, (b, c)) = e", where the value of {@code e} is
 * bound to {@code $0}, the extraction for {@code c} has path [1, 1] and
 * expression "#2 (#2 $0)".
 */
public class Extraction {
  public final VariableBinding binding;

  /** Zero-based component index at each level of nesting. */
  public final ImmutableList<Integer> path;

  public final Ast.Exp exp;

  Extraction(
      VariableBinding binding, ImmutableList<Integer> path, Ast.Exp exp) {
    this.binding = requireNonNull(binding);
    this.path = requireNonNull(path);
    this.exp = requireNonNull(exp);
  }

  @Override
  public String toString() {
    return binding.name + " = " + exp;
  }
}

// End Extraction.java
