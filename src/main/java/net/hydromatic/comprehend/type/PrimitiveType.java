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
package net.hydromatic.comprehend.type;

import java.util.Locale;
import net.hydromatic.comprehend.eval.Unit;

/** Primitive type. */
public enum PrimitiveType implements Type {
  BOOL(Boolean.class, false),
  INT(Integer.class, false),
  REAL(Double.class, false),
  STRING(String.class, true),
  UNIT(Unit.class, false),
  /** Top type; every non-null value is an instance. */
  OBJ(Object.class, true);

  /** The name in the language, e.g. {@code bool}. */
  public final String moniker = name().toLowerCase(Locale.ROOT);

  private final Class<?> valueClass;
  private final boolean nullable;

  PrimitiveType(Class<?> valueClass, boolean nullable) {
    this.valueClass = valueClass;
    this.nullable = nullable;
  }

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public String moniker() {
    return moniker;
  }

  @Override
  public boolean isNullable() {
    return nullable;
  }

  @Override
  public boolean accepts(Object value) {
    return valueClass.isInstance(value);
  }
}

// End PrimitiveType.java
