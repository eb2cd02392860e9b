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

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>Maps variable names to values. A value may be null, for instance a
 * variable bound by "e is var x" where {@code e} is null, so use {@link
 * #contains} rather than a null check to see whether a name is bound.
 */
public interface EvalEnv {
  /** Returns whether {@code name} is bound. */
  boolean contains(String name);

  /**
   * Returns the value bound to {@code name}.
   *
   * @throws IllegalArgumentException if {@code name} is not bound
   */
  @Nullable Object get(String name);

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding (name, value).
   */
  default EvalEnv bind(String name, @Nullable Object value) {
    return new EvalEnvs.SubEvalEnv(this, name, value);
  }

  /**
   * Creates an environment that has the same content as this one, plus
   * slots that expressions may assign while they are evaluated.
   */
  default MutableEvalEnv bindMutable() {
    return new EvalEnvs.MutableFrameEvalEnv(this);
  }

  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name are
   * visited, but after the more obscuring bindings.
   */
  void visit(BiConsumer<String, @Nullable Object> consumer);

  /** Returns a map of the values and bindings. */
  default Map<String, @Nullable Object> valueMap() {
    final Map<String, @Nullable Object> valueMap = new HashMap<>();
    visit(valueMap::putIfAbsent);
    return valueMap;
  }
}

// End EvalEnv.java
