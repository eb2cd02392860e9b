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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link EvalEnv}. */
public class EvalEnvs {
  private EvalEnvs() {}

  /** Creates an evaluation environment with the given (name, value) map. */
  public static EvalEnv copyOf(Map<String, ?> valueMap) {
    return new MapEvalEnv(valueMap);
  }

  /** Evaluation environment that reads from a map. */
  static class MapEvalEnv implements EvalEnv {
    final Map<String, @Nullable Object> valueMap;

    MapEvalEnv(Map<String, ?> valueMap) {
      // HashMap rather than ImmutableMap, because values may be null
      this.valueMap = new HashMap<>(valueMap);
    }

    @Override
    public boolean contains(String name) {
      return valueMap.containsKey(name);
    }

    @Override
    public @Nullable Object get(String name) {
      checkArgument(valueMap.containsKey(name), "variable %s is not bound",
          name);
      return valueMap.get(name);
    }

    @Override
    public void visit(BiConsumer<String, @Nullable Object> consumer) {
      valueMap.forEach(consumer);
    }
  }

  /**
   * Evaluation environment that inherits from a parent environment and adds
   * one binding.
   */
  static class SubEvalEnv implements EvalEnv {
    final EvalEnv parentEnv;
    final String name;
    final @Nullable Object value;

    SubEvalEnv(EvalEnv parentEnv, String name, @Nullable Object value) {
      this.parentEnv = requireNonNull(parentEnv);
      this.name = requireNonNull(name);
      this.value = value;
    }

    @Override
    public boolean contains(String name) {
      return name.equals(this.name) || parentEnv.contains(name);
    }

    @Override
    public @Nullable Object get(String name) {
      for (SubEvalEnv e = this; ; ) {
        if (name.equals(e.name)) {
          return e.value;
        }
        if (e.parentEnv instanceof SubEvalEnv) {
          e = (SubEvalEnv) e.parentEnv;
        } else {
          return e.parentEnv.get(name);
        }
      }
    }

    @Override
    public void visit(BiConsumer<String, @Nullable Object> consumer) {
      consumer.accept(name, value);
      parentEnv.visit(consumer);
    }
  }

  /**
   * Evaluation environment that inherits from a parent environment and adds
   * a frame of assignable variables.
   */
  static class MutableFrameEvalEnv implements MutableEvalEnv {
    final EvalEnv parentEnv;
    final Map<String, @Nullable Object> frame = new LinkedHashMap<>();

    MutableFrameEvalEnv(EvalEnv parentEnv) {
      this.parentEnv = requireNonNull(parentEnv);
    }

    @Override
    public void assign(String name, @Nullable Object value) {
      frame.put(name, value);
    }

    @Override
    public boolean contains(String name) {
      return frame.containsKey(name) || parentEnv.contains(name);
    }

    @Override
    public @Nullable Object get(String name) {
      if (frame.containsKey(name)) {
        return frame.get(name);
      }
      return parentEnv.get(name);
    }

    @Override
    public void visit(BiConsumer<String, @Nullable Object> consumer) {
      frame.forEach(consumer);
      parentEnv.visit(consumer);
    }
  }
}

// End EvalEnvs.java
