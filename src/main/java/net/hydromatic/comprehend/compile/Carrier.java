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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.comprehend.ast.VariableBinding;
import net.hydromatic.comprehend.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Shape of the value that flows between two combinator stages.
 *
 * <p>The fields are the variables that are live at that point, in the order
 * they were introduced. How the fields are packed depends on how many there
 * are (see {@link Layout}); whether, and how, a failed pattern test is
 * signaled depends on the {@link Representation}.
 *
 * <p>The output of a "select" is not a carrier of variables but the selected
 * value itself; its layout is {@link Layout#VALUE}.
 *
 * <p>Immutable.
 */
public class Carrier {
  /** Carrier with no fields, the input to the first stage. */
  public static final Carrier EMPTY =
      new Carrier(ImmutableList.of(), Representation.PLAIN, null);

  public final ImmutableList<VariableBinding> fields;
  public final Representation representation;

  /** Type of the value, if the layout is {@link Layout#VALUE}, else null. */
  public final @Nullable Type valueType;

  private Carrier(
      ImmutableList<VariableBinding> fields,
      Representation representation,
      @Nullable Type valueType) {
    this.fields = requireNonNull(fields);
    this.representation = requireNonNull(representation);
    this.valueType = valueType;
    checkArgument(
        valueType == null || fields.isEmpty(), "value carrier has fields");
  }

  /** Creates a carrier of variables. */
  public static Carrier of(
      List<VariableBinding> fields, Representation representation) {
    return new Carrier(ImmutableList.copyOf(fields), representation, null);
  }

  /** Creates a plain carrier of variables. */
  public static Carrier of(List<VariableBinding> fields) {
    return of(fields, Representation.PLAIN);
  }

  /** Creates a carrier that holds a selected value. */
  public static Carrier value(Type type) {
    return new Carrier(
        ImmutableList.of(), Representation.PLAIN, requireNonNull(type));
  }

  public Layout layout() {
    if (valueType != null) {
      return Layout.VALUE;
    }
    switch (fields.size()) {
    case 0:
      return Layout.UNIT;
    case 1:
      return Layout.ATOM;
    default:
      return Layout.ROW;
    }
  }

  /** Returns a carrier with the same fields, and plain representation. */
  public Carrier plain() {
    return representation == Representation.PLAIN
        ? this
        : new Carrier(fields, Representation.PLAIN, valueType);
  }

  /** Returns a carrier with the same fields, minus one. */
  public Carrier without(VariableBinding binding) {
    final ImmutableList.Builder<VariableBinding> b = ImmutableList.builder();
    fields.forEach(
        field -> {
          if (!field.equals(binding)) {
            b.add(field);
          }
        });
    return new Carrier(b.build(), representation, valueType);
  }

  public boolean contains(VariableBinding binding) {
    return fields.contains(binding);
  }

  /** Returns the position of a field, or -1. */
  public int indexOf(VariableBinding binding) {
    return fields.indexOf(binding);
  }

  /** Returns whether a successful payload of this carrier may be null. */
  public boolean isPayloadNullable() {
    switch (layout()) {
    case ATOM:
      return fields.get(0).nullable;
    case VALUE:
      return requireNonNull(valueType).isNullable();
    default:
      return false;
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(fields, representation, valueType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Carrier
            && fields.equals(((Carrier) o).fields)
            && representation == ((Carrier) o).representation
            && Objects.equals(valueType, ((Carrier) o).valueType);
  }

  /**
   * Returns a description such as "{s, i}". A "?" suffix means that failure
   * is signaled by null; "!" means that the value is tagged.
   */
  @Override
  public String toString() {
    if (valueType != null) {
      return valueType.moniker();
    }
    final StringBuilder b = new StringBuilder("{");
    for (int i = 0; i < fields.size(); i++) {
      b.append(i > 0 ? ", " : "").append(fields.get(i).name);
    }
    b.append("}");
    switch (representation) {
    case ELIDED:
      return b.append("?").toString();
    case TAGGED:
      return b.append("!").toString();
    default:
      return b.toString();
    }
  }

  /** How a carrier signals that the stage that produced it failed. */
  public enum Representation {
    /** Every value is a success. */
    PLAIN,
    /** Null means failure; any other value is a successful payload. */
    ELIDED,
    /** Each value is a {@code Tagged} holding a success flag and payload. */
    TAGGED
  }

  /** How the fields of a carrier are packed. */
  public enum Layout {
    /** No fields; the value is the unit value. */
    UNIT,
    /** One field; the value is the field's value. */
    ATOM,
    /** Two or more fields; the value is a list of the fields' values. */
    ROW,
    /** Output of "select"; the value is the selected value. */
    VALUE
  }
}

// End Carrier.java
