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
package net.hydromatic.comprehend.ast;

import static java.util.Objects.requireNonNull;

/**
 * Span of a clause in the text it was built from.
 *
 * <p>Lines and columns start at 1; {@link #ZERO} means the clause has no
 * known position. Reported by {@link
 * net.hydromatic.comprehend.compile.CompileException#pos()}.
 */
public class Pos {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  public Pos(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this.file = requireNonNull(file);
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Whether the span covers a single character. */
  private boolean isPoint() {
    return startLine == endLine && endColumn == startColumn + 1;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Appends "file:line.column" or "file:line.column-line.column". */
  public StringBuilder describeTo(StringBuilder buf) {
    if (!file.isEmpty()) {
      buf.append(file).append(':');
    }
    buf.append(startLine).append('.').append(startColumn);
    if (!isPoint()) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }
}

// End Pos.java
