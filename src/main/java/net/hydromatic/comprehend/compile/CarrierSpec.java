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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Carrier produced by one clause, and how the clause binds its variables.
 *
 * <p>For a "from" or "let" clause, {@link #binder} is the name to which each
 * value of the clause's expression is bound: the pattern's name if the
 * pattern is a simple name, otherwise a generated name, in which case {@link
 * #extractions} says how to get each live variable from the binder.
 */
public class CarrierSpec {
  public final int clauseIndex;
  public final Carrier carrier;
  public final @Nullable String binder;
  public final ImmutableList<Extraction> extractions;

  CarrierSpec(
      int clauseIndex,
      Carrier carrier,
      @Nullable String binder,
      ImmutableList<Extraction> extractions) {
    this.clauseIndex = clauseIndex;
    this.carrier = requireNonNull(carrier);
    this.binder = binder;
    this.extractions = requireNonNull(extractions);
  }

  /** Returns a copy with a different carrier. */
  CarrierSpec withCarrier(Carrier carrier) {
    return new CarrierSpec(clauseIndex, carrier, binder, extractions);
  }

  @Override
  public String toString() {
    return clauseIndex + ": " + carrier
        + (extractions.isEmpty() ? "" : " " + extractions);
  }
}

// End CarrierSpec.java
