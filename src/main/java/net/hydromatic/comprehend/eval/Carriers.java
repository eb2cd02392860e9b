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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.hydromatic.comprehend.ast.VariableBinding;
import net.hydromatic.comprehend.compile.Carrier;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Packs variables into carrier values, and unpacks them. */
public class Carriers {
  private Carriers() {}

  /**
   * Packs field values into a successful carrier value, according to the
   * carrier's layout. The representation is not applied.
   */
  public static @Nullable Object pack(
      Carrier carrier, List<@Nullable Object> values) {
    checkArgument(values.size() == carrier.fields.size(),
        "carrier %s has %s fields, got %s", carrier, carrier.fields.size(),
        values);
    switch (carrier.layout()) {
    case UNIT:
      return Unit.INSTANCE;
    case ATOM:
      return values.get(0);
    case ROW:
      return Collections.unmodifiableList(Arrays.asList(values.toArray()));
    default:
      throw new IllegalArgumentException("cannot pack " + carrier);
    }
  }

  /**
   * Creates an environment that binds each field of a carrier value, on top
   * of a parent environment.
   *
   * <p>The value must be a successful payload; a tagged value must be
   * unwrapped first.
   */
  public static EvalEnv unpack(
      Carrier carrier, @Nullable Object value, EvalEnv parentEnv) {
    checkArgument(carrier.representation != Carrier.Representation.TAGGED,
        "cannot unpack tagged carrier %s", carrier);
    switch (carrier.layout()) {
    case UNIT:
      return parentEnv;
    case ATOM:
      return parentEnv.bind(carrier.fields.get(0).name, value);
    case ROW:
      checkArgument(value instanceof List, "not a row: %s", value);
      final List<?> row = (List<?>) value;
      EvalEnv env = parentEnv;
      for (int i = 0; i < carrier.fields.size(); i++) {
        final VariableBinding field = carrier.fields.get(i);
        env = env.bind(field.name, row.get(i));
      }
      return env;
    default:
      throw new IllegalArgumentException("cannot unpack " + carrier);
    }
  }
}

// End Carriers.java
