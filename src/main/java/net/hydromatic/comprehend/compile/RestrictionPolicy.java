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
 * Limits on how pattern variables may be used across clauses.
 *
 * <p>Each policy rejects chains whose meaning would change if pattern
 * variables were later allowed to flow between clauses. The policy is fixed
 * for a compilation; see {@link Prop#RESTRICTION_POLICY}.
 */
public enum RestrictionPolicy {
  /**
   * A pattern variable may be used only in the clause that introduces it.
   * Different clauses may introduce pattern variables with the same name.
   */
  DISALLOW_PATTERN_VARIABLES_IN_CLAUSES,

  /**
   * A pattern variable may be used in later clauses, but no two pattern
   * variables in a chain may have the same name.
   */
  REQUIRE_GLOBAL_NAME_UNIQUENESS
}

// End RestrictionPolicy.java
