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

import java.util.Objects;

/** Position of a parse-tree node.
 *
 * <p>Lines and columns are 1-based; offsets are 0-based indexes into the
 * text that was parsed, {@link #endOffset} exclusive.
 *
 * <p>Nodes that did not come from text, for example those reconstructed
 * from markup, have position {@link #ZERO}. Positions never take part in
 * the equality of AST nodes. */
public class Pos {
  public static final Pos ZERO = new Pos(0, 0, 0, 0, 0, 0);

  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;
  public final int startOffset;
  public final int endOffset;

  /** Creates a Pos. */
  public Pos(int startLine, int startColumn, int endLine, int endColumn,
      int startOffset, int endOffset) {
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  /** Creates a Pos from two offsets into a piece of text. */
  public static Pos of(String text, int startOffset, int endOffset) {
    final int[] start = lineCol(text, startOffset);
    final int[] end = lineCol(text, endOffset);
    return new Pos(start[0], start[1], end[0], end[1], startOffset,
        endOffset);
  }

  @Override public int hashCode() {
    return Objects.hash(startOffset, endOffset);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && this.startLine == ((Pos) o).startLine
        && this.startColumn == ((Pos) o).startColumn
        && this.endLine == ((Pos) o).endLine
        && this.endColumn == ((Pos) o).endColumn
        && this.startOffset == ((Pos) o).startOffset
        && this.endOffset == ((Pos) o).endOffset;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-')
          .append(endLine)
          .append('.')
          .append(endColumn);
    }
    return buf;
  }

  /** Returns the position spanning a list of nodes. */
  public static Pos sum(Iterable<? extends AstNode> nodes) {
    Pos pos = ZERO;
    for (AstNode node : nodes) {
      pos = pos.plus(node.pos);
    }
    return pos;
  }

  /** Returns a position spanning this and another position.
   * {@link #ZERO} is the identity. */
  public Pos plus(Pos pos) {
    if (pos.equals(ZERO)) {
      return this;
    }
    if (this.equals(ZERO)) {
      return pos;
    }
    final Pos start = pos.startOffset < startOffset ? pos : this;
    final Pos end = pos.endOffset > endOffset ? pos : this;
    return new Pos(start.startLine, start.startColumn, end.endLine,
        end.endColumn, start.startOffset, end.endOffset);
  }

  /** Returns the offset of a 1-based line and column in a piece of text.
   * Each character, including a tab, occupies one column. */
  public static int offset(String text, int line, int column) {
    int lineStart = 0;
    for (int i = 1; i < line; i++) {
      final int newline = text.indexOf('\n', lineStart);
      if (newline < 0) {
        throw new IllegalArgumentException("line " + line
            + " is beyond end of text");
      }
      lineStart = newline + 1;
    }
    return lineStart + column - 1;
  }

  /** Returns the 1-based line and column of an offset. */
  private static int[] lineCol(String s, int offset) {
    int line = 1;
    int lineStart = 0;
    int i;
    final int n = Math.min(s.length(), offset);
    for (i = 0; i < n; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    if (i == offset) {
      return new int[] {line, offset - lineStart + 1};
    } else {
      throw new IllegalArgumentException("offset " + offset
          + " is beyond end of text");
    }
  }
}

// End Pos.java
