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

import com.google.common.base.CaseFormat;
import java.util.Map;
import net.hydromatic.comprehend.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls compilation.
 *
 * <p>A {@link ChainCompiler} reads its properties from a map; a property that
 * is absent from the map has its default value.
 */
public enum Prop {
  /**
   * Enum property "restrictionPolicy" controls which uses of pattern variables
   * across clauses are rejected; see {@link RestrictionPolicy}.
   *
   * <p>The default is {@link
   * RestrictionPolicy#DISALLOW_PATTERN_VARIABLES_IN_CLAUSES}, unless the
   * system property "comprehend.restrictionPolicy" names another policy.
   */
  RESTRICTION_POLICY("restrictionPolicy", RestrictionPolicy.class,
      Static.getEnumProperty("comprehend.restrictionPolicy",
          RestrictionPolicy.class,
          RestrictionPolicy.DISALLOW_PATTERN_VARIABLES_IN_CLAUSES)),

  /**
   * Boolean property "validateCarriers" controls whether the translator checks
   * that each stage's input holds every field its clause needs. Default is
   * true.
   */
  VALIDATE_CARRIERS("validateCarriers", Boolean.class, true);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    return value(map, Boolean.class);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    return value(map, type);
  }

  private <T> T value(Map<Prop, Object> map, Class<T> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        requestedType.getSimpleName(),
        camelName);
    final @Nullable Object o = map.get(this);
    checkArgument(
        o == null || type.isInstance(o),
        "value for property %s must have type %s",
        camelName,
        type.getSimpleName());
    return requestedType.cast(o == null ? defaultValue : o);
  }
}

// End Prop.java
