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
package net.hydromatic.comprehend.util;

import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Returns the value of a system property, converted into an enum constant.
   *
   * <p>Matching is case-insensitive. For {@code null} and values that are not
   * the name of a constant, returns {@code defaultVal}.
   */
  public static <E extends Enum<E>> E getEnumProperty(
      String prop, Class<E> enumClass, E defaultVal) {
    final String value = System.getProperty(prop);
    if (value == null) {
      return defaultVal;
    }
    final Optional<E> optional =
        Enums.getIfPresent(enumClass, value.toUpperCase(Locale.ROOT));
    return optional.or(defaultVal);
  }

  /**
   * Returns the last element of a list.
   *
   * @throws java.lang.IndexOutOfBoundsException if the list is empty
   */
  public static <E> E last(List<E> list) {
    return list.get(list.size() - 1);
  }

  /** Returns a list with one element appended. */
  public static <E> List<E> append(List<E> list, E e) {
    return ImmutableList.<E>builder().addAll(list).add(e).build();
  }

  /**
   * Applies a mapping function to each element.
   *
   * <p>Like {@link com.google.common.collect.Lists#transform}, but eager; the
   * result is an immutable list.
   */
  public static <E, T> ImmutableList<T> transform(
      Iterable<? extends E> elements, Function<E, T> mapper) {
    final ImmutableList.Builder<T> b = ImmutableList.builder();
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }
}

// End Static.java
