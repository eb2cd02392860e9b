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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A collection of types.
 *
 * <p>Composite types are interned, so that two requests for the same tuple or
 * list type return the same object.
 */
public class TypeSystem {
  private final Map<List<Type>, TupleType> tupleTypes = new HashMap<>();
  private final Map<Type, ListType> listTypes = new HashMap<>();

  /** Creates a tuple type. */
  public TupleType tupleType(Type... argTypes) {
    return tupleType(ImmutableList.copyOf(argTypes));
  }

  /** Creates a tuple type. */
  public TupleType tupleType(List<? extends Type> argTypes) {
    final ImmutableList<Type> key = ImmutableList.copyOf(argTypes);
    return tupleTypes.computeIfAbsent(key, TupleType::new);
  }

  /** Creates a list type. */
  public ListType listType(Type elementType) {
    return listTypes.computeIfAbsent(elementType, ListType::new);
  }
}

// End TypeSystem.java
