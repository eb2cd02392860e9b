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
package net.hydromatic.comprehend;

import net.hydromatic.comprehend.compile.CompileException;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a {@link CompileException} by kind, clause and message. */
  public static Matcher<CompileException> isCompileException(
      CompileException.Kind kind, int clauseIndex, String message) {
    return new CustomTypeSafeMatcher<CompileException>(
        "compile exception " + kind + " at clause " + clauseIndex + ": "
            + message) {
      @Override
      protected boolean matchesSafely(CompileException e) {
        return e.kind() == kind
            && e.clauseIndex() == clauseIndex
            && message.equals(e.getMessage());
      }
    };
  }
}

// End Matchers.java
