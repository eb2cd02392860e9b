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

/**
 * Definite-assignment state of a variable at a clause.
 *
 * @see FlowFacts#fact
 */
public enum FlowFact {
  /** The variable may not have been assigned; using it is an error. */
  UNASSIGNED,

  /**
   * The variable is assigned if the clause's expression evaluates to true.
   * Holds only in the clause that introduces a pattern variable.
   */
  DEFINITELY_ASSIGNED_IF_TRUE,

  /** The variable is assigned whenever the clause is evaluated. */
  DEFINITELY_ASSIGNED
}

// End FlowFact.java
