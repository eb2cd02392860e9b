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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/** The type of a tuple value. */
public class TupleType implements Type {
  public final List<Type> argTypes;

  TupleType(List<? extends Type> argTypes) {
    this.argTypes = ImmutableList.copyOf(argTypes);
  }

  /** Returns the number of components. */
  public int arity() {
    return argTypes.size();
  }

  public Type argType(int i) {
    return argTypes.get(i);
  }

  @Override
  public String moniker() {
    return argTypes.stream()
        .map(t ->
            t instanceof TupleType ? "(" + t.moniker() + ")" : t.moniker())
        .collect(Collectors.joining(" * "));
  }

  @Override
  public boolean isNullable() {
    return false;
  }

  @Override
  public boolean accepts(Object value) {
    if (!(value instanceof List)) {
      return false;
    }
    final List<?> list = (List<?>) value;
    if (list.size() != argTypes.size()) {
      return false;
    }
    for (int i = 0; i < list.size(); i++) {
      final Object o = list.get(i);
      final Type argType = argTypes.get(i);
      if (o == null ? !argType.isNullable() : !argType.accepts(o)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return argTypes.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleType && argTypes.equals(((TupleType) o).argTypes);
  }

  @Override
  public String toString() {
    return moniker();
  }
}

// End TupleType.java
