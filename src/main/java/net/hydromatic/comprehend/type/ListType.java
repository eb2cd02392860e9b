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

import static java.util.Objects.requireNonNull;

import java.util.List;

/** The type of a list value. */
public class ListType implements Type {
  public final Type elementType;

  ListType(Type elementType) {
    this.elementType = requireNonNull(elementType);
  }

  @Override
  public String moniker() {
    return elementType instanceof TupleType
        ? "(" + elementType.moniker() + ") list"
        : elementType.moniker() + " list";
  }

  @Override
  public boolean isNullable() {
    return false;
  }

  @Override
  public boolean accepts(Object value) {
    return value instanceof List;
  }

  @Override
  public int hashCode() {
    return elementType.hashCode() * 37 + 1;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ListType
            && elementType.equals(((ListType) o).elementType);
  }

  @Override
  public String toString() {
    return moniker();
  }
}

// End ListType.java
