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

import java.util.List;

/** Builds the string representation of an {@link AstNode}. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier. */
  public AstWriter id(String name) {
    b.append(name);
    return this;
  }

  /** Appends a node, wrapped in parentheses if its precedence is too low. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a list of nodes, separated by commas, between brackets. */
  public AstWriter appendAll(
      String start, List<? extends AstNode> nodes, String end) {
    b.append(start);
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      append(nodes.get(i), 0, 0);
    }
    b.append(end);
    return this;
  }

  /** Appends a literal value. */
  @SuppressWarnings("rawtypes")
  public AstWriter appendLiteral(Comparable value) {
    if (value instanceof String) {
      b.append('"')
          .append(((String) value).replace("\\", "\\\\").replace("\"", "\\\""))
          .append('"');
    } else {
      b.append(value);
    }
    return this;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    return append(a0, left, op.left)
        .append(op.padded)
        .append(a1, op.right, right);
  }

  /** Appends a call to a prefix operator. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    return append(op.padded).append(a, op.right, right);
  }
}

// End AstWriter.java
