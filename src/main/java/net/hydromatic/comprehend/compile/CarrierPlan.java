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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.comprehend.ast.VariableBinding;

/**
 * The carriers between the clauses of a chain, as computed by {@link
 * CarrierSynthesizer}.
 *
 * <p>These are the logical carriers: each holds exactly the variables that
 * some later clause reads. Stages that do not allocate may pass on a physical
 * carrier with more fields; see {@link Translator}.
 */
public class CarrierPlan {
  public final ImmutableList<CarrierSpec> specs;

  CarrierPlan(ImmutableList<CarrierSpec> specs) {
    this.specs = requireNonNull(specs);
  }

  /** Returns the carrier that flows into a clause. */
  public Carrier input(int clauseIndex) {
    return clauseIndex == 0
        ? Carrier.EMPTY
        : specs.get(clauseIndex - 1).carrier;
  }

  /** Returns the carrier that flows out of a clause. */
  public Carrier output(int clauseIndex) {
    return specs.get(clauseIndex).carrier;
  }

  public CarrierSpec spec(int clauseIndex) {
    return specs.get(clauseIndex);
  }

  /**
   * Returns a copy of this plan in which the carrier out of a given clause
   * lacks the field with a given name. If there is no such field, returns
   * this plan.
   */
  public CarrierPlan withoutField(int clauseIndex, String name) {
    final CarrierSpec spec = specs.get(clauseIndex);
    for (VariableBinding field : spec.carrier.fields) {
      if (field.name.equals(name)) {
        final List<CarrierSpec> list = new ArrayList<>(specs);
        list.set(clauseIndex, spec.withCarrier(spec.carrier.without(field)));
        return new CarrierPlan(ImmutableList.copyOf(list));
      }
    }
    return this;
  }

  @Override
  public String toString() {
    return specs.toString();
  }
}

// End CarrierPlan.java
