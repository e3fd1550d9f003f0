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
package net.hydromatic.mathterm.ast;

import static java.util.Objects.requireNonNull;

/** Abstract syntax tree node.
 *
 * <p>Nodes are immutable. Equality is structural and ignores
 * {@link #pos}. */
public abstract class AstNode {
  public final Pos pos;
  public final Op op;

  AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string.
   *
   * <p>The purpose of this string is debugging. It is a fully parenthesized
   * prefix form that shows the structure of the tree, for example
   * "(+ 1 (* 2 3))". To generate text in a particular notation, use a
   * {@link net.hydromatic.mathterm.notation.NotationBuilder}.
   */
  @Override public final String toString() {
    // Marked final because you should override describeTo, not toString
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes the debugging form of this node to a builder. */
  abstract StringBuilder describeTo(StringBuilder buf);

  @Override public abstract boolean equals(Object o);

  @Override public abstract int hashCode();
}

// End AstNode.java
